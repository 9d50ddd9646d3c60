package org.Aayush.roadnet.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Road-network engine contract exception with deterministic reason codes.
 */
@Getter
public final class RoadNetworkException extends RuntimeException {
    public static final String REASON_INVALID_INPUT = "RN_INVALID_INPUT";
    public static final String REASON_EMPTY_NETWORK = "RN_EMPTY_NETWORK";
    public static final String REASON_NO_PATH_FOUND = "RN_NO_PATH_FOUND";
    public static final String REASON_UNKNOWN_NODE = "RN_UNKNOWN_NODE";
    public static final String REASON_INVALID_GRAPH = "RN_INVALID_GRAPH";
    public static final String REASON_COMPUTE_FAILED = "RN_COMPUTE_FAILED";

    private final String reasonCode;

    /**
     * Creates a reason-coded engine failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public RoadNetworkException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded engine failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public RoadNetworkException(String reasonCode, String message, Throwable cause) {
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
