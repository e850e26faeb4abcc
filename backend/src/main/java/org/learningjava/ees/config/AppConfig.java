package org.learningjava.ees.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.learningjava.ees.application.port.ConnectionStorePort;
import org.learningjava.ees.application.port.EmbeddingStorePort;
import org.learningjava.ees.application.port.ProviderAdapterFactory;
import org.learningjava.ees.application.usecase.EmbeddingProviderFacade;
import org.learningjava.ees.domain.service.ProviderRegistry;
import org.learningjava.ees.domain.service.SimilarityRanker;
import org.learningjava.ees.infrastructure.adapter.out.ollama.OllamaAdapterFactory;
import org.learningjava.ees.infrastructure.adapter.out.openai.OpenAiCompatibleAdapterFactory;
import org.learningjava.ees.infrastructure.adapter.out.postgres.PostgresConnectionStoreAdapter;
import org.learningjava.ees.infrastructure.adapter.out.postgres.PostgresEmbeddingStoreAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Duration;

@Configuration
public class AppConfig {

    //objects with external dependencies
    @Bean
    OkHttpClient okHttpClient(EesProperties props) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(props.getHttp().getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(props.getHttp().getReadTimeoutMs()))
                .writeTimeout(Duration.ofMillis(props.getHttp().getReadTimeoutMs()))
                .build();
    }

    @Bean
    ProviderAdapterFactory ollamaAdapterFactory(OkHttpClient http, ObjectMapper om) {
        return new OllamaAdapterFactory(http, om);
    }

    @Bean
    ProviderAdapterFactory openAiCompatibleAdapterFactory(EesProperties props) {
        return new OpenAiCompatibleAdapterFactory(props.getHttp().getConnectTimeoutMs(), props.getHttp().getReadTimeoutMs());
    }

    @Bean
    EmbeddingProviderFacade embeddingProviderFacade(ProviderRegistry registry, EesProperties props) {
        return new EmbeddingProviderFacade(registry, props.getProvider().toConfig());
    }

    @Bean
    SimilarityRanker similarityRanker() {
        return new SimilarityRanker();
    }

    @Bean
    EmbeddingStorePort embeddingStore(DataSource dataSource, SimilarityRanker ranker) {
        return new PostgresEmbeddingStoreAdapter(dataSource, ranker);
    }

    @Bean
    ConnectionStorePort connectionStore(DataSource dataSource, ObjectMapper om) {
        return new PostgresConnectionStoreAdapter(dataSource, om);
    }
}
