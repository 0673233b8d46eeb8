package com.prospectenhancer.enhancement.gateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Times a model call and turns gateway failures into a failed {@link ModelReply}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelInvoker {

    private final ModelGateway modelGateway;

    public ModelReply invoke(String prompt) {
        long start = System.nanoTime();
        try {
            String raw = modelGateway.generate(prompt);
            return ModelReply.received(raw, elapsedMs(start));
        } catch (ModelGatewayException e) {
            log.warn("Model call failed ({}): {}", e.getErrorCode(), e.getMessage());
            return ModelReply.failed(e.getMessage(), elapsedMs(start));
        }
    }

    public String modelName() {
        return modelGateway.modelName();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
