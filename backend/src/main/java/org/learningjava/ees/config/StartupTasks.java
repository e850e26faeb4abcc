package org.learningjava.ees.config;

import org.learningjava.ees.application.port.ConnectionStorePort;
import org.learningjava.ees.application.port.EmbeddingStorePort;
import org.learningjava.ees.application.usecase.EmbeddingProviderFacade;
import org.learningjava.ees.domain.model.connection.Connection;
import org.learningjava.ees.domain.model.provider.ProviderSwitchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Creates the tables and points the provider at the stored active connection, if any. */
@Component
public class StartupTasks implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupTasks.class);

    private final EmbeddingStorePort embeddingStore;
    private final ConnectionStorePort connectionStore;
    private final EmbeddingProviderFacade provider;
    private final EesProperties props;

    public StartupTasks(EmbeddingStorePort embeddingStore,
                        ConnectionStorePort connectionStore,
                        EmbeddingProviderFacade provider,
                        EesProperties props) {
        this.embeddingStore = embeddingStore;
        this.connectionStore = connectionStore;
        this.provider = provider;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("=== StartupTasks BEGIN ===");
        if (props.isEnsureSchemaOnStartup()) {
            embeddingStore.ensureSchema();
            connectionStore.ensureSchema();
        } else {
            log.info("Schema creation disabled (ees.ensure-schema-on-startup=false)");
        }

        Optional<Connection> active = connectionStore.findActive();
        if (active.isEmpty()) {
            log.info("No active connection stored, staying on {}", provider.getCurrentProvider());
        } else {
            Connection c = active.get();
            ProviderSwitchResult r = provider.switchProvider(c.toProviderConfig());
            if (r.success()) {
                log.info("Using active connection '{}' ({})", c.name(), r.activeProvider());
            } else {
                log.warn("Active connection '{}' is unreachable, staying on {}: {}",
                        c.name(), r.activeProvider(), r.message());
            }
        }
        log.info("=== StartupTasks END ===");
    }
}
