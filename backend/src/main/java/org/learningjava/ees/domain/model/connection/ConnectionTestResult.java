package org.learningjava.ees.domain.model.connection;

import java.util.List;

public record ConnectionTestResult(boolean success, String message, List<String> models) {

    public static ConnectionTestResult ok(List<String> models) {
        return new ConnectionTestResult(true, "Connection successful", List.copyOf(models));
    }

    public static ConnectionTestResult failed(String message) {
        return new ConnectionTestResult(false, message, null);
    }
}
