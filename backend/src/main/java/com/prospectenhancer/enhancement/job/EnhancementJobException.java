package com.prospectenhancer.enhancement.job;

import lombok.Getter;

/**
 * Rejected run command: a run is already active or the enhancement kind is unknown.
 */
@Getter
public class EnhancementJobException extends RuntimeException {

    public static final String ALREADY_RUNNING = "ALREADY_RUNNING";
    public static final String UNKNOWN_KIND = "UNKNOWN_KIND";

    private final String errorCode;

    public EnhancementJobException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
