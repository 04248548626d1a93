package fr.lapetina.resilienthttp.domain.model;

import fr.lapetina.resilienthttp.domain.body.EntityBody;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Response attached to a completed transfer request.
 * Immutable once built; header names are case-insensitive.
 */
public record TransferResponse(
        int statusCode,
        Map<String, List<String>> headers,
        EntityBody body
) {
    public TransferResponse {
        if (statusCode < 100 || statusCode > 999) {
            throw new IllegalArgumentException("Invalid HTTP status code: " + statusCode);
        }
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        }
        headers = java.util.Collections.unmodifiableMap(copy);
        if (body == null) {
            body = EntityBody.factory(new byte[0]);
        }
    }

    /**
     * Creates a response with no headers and an empty body.
     */
    public static TransferResponse of(int statusCode) {
        return new TransferResponse(statusCode, null, null);
    }

    /**
     * Creates a response with no headers and the given body content.
     */
    public static TransferResponse of(int statusCode, String body) {
        return new TransferResponse(statusCode, null, EntityBody.factory(body));
    }

    /**
     * Returns the first value of a header.
     */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
