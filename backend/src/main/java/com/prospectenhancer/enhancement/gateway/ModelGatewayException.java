package com.prospectenhancer.enhancement.gateway;

import lombok.Getter;

/**
 * Thrown when the model backend cannot produce an answer. Callers treat it as "enhancement skipped".
 */
@Getter
public class ModelGatewayException extends RuntimeException {

    public static final String TIMEOUT = "TIMEOUT";
    public static final String TRANSPORT = "TRANSPORT";
    public static final String BAD_RESPONSE = "BAD_RESPONSE";
    public static final String RATE_LIMITED = "RATE_LIMITED";

    private final String errorCode;

    public ModelGatewayException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ModelGatewayException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
