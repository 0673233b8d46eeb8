package com.prospectenhancer.enhancement.gateway;

/**
 * Synchronous text completion against the language-model backend.
 */
public interface ModelGateway {

    /**
     * @return the model's raw text answer, never null
     * @throws ModelGatewayException on timeout, transport failure or an unreadable envelope
     */
    String generate(String prompt);

    String modelName();
}
