package org.Aayush.roadnet.acquisition;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when the map-data provider cannot produce a graph.
 *
 * <p>The acquisition layer treats every instance as non-fatal and falls back to grid
 * synthesis.</p>
 */
@Getter
@Accessors(fluent = true)
public final class MapDataProviderException extends RuntimeException {
    public static final String REASON_UNAVAILABLE = "MAP_PROVIDER_UNAVAILABLE";
    public static final String REASON_TIMEOUT = "MAP_PROVIDER_TIMEOUT";
    public static final String REASON_BAD_RESPONSE = "MAP_PROVIDER_BAD_RESPONSE";

    private final String reasonCode;

    public MapDataProviderException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public MapDataProviderException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
