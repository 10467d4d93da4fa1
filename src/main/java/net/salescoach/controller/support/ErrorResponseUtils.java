package net.salescoach.controller.support;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, String> errorBody(String message, String detail) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }

    public static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return error(status, message, null);
    }

    public static ResponseEntity<Map<String, String>> error(HttpStatus status, String message, String detail) {
        return ResponseEntity.status(status).body(errorBody(message, detail));
    }

    public static ResponseEntity<Map<String, String>> notFound(String message) {
        return error(HttpStatus.NOT_FOUND, message);
    }

    /**
     * Normalizes {@code app.environment.mode}; blank means production.
     */
    public static String normalizeEnvironmentMode(String rawMode) {
        if (rawMode == null || rawMode.isBlank()) {
            return "production";
        }
        return rawMode.trim().toLowerCase(Locale.ROOT);
    }
}
