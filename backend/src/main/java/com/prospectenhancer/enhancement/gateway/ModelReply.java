package com.prospectenhancer.enhancement.gateway;

/**
 * Outcome of one model call: the raw text when the backend answered, otherwise the failure message.
 */
public record ModelReply(String raw, long elapsedMs, String error) {

    public static ModelReply received(String raw, long elapsedMs) {
        return new ModelReply(raw, elapsedMs, null);
    }

    public static ModelReply failed(String error, long elapsedMs) {
        return new ModelReply(null, elapsedMs, error);
    }

    public boolean isReceived() {
        return error == null;
    }
}
