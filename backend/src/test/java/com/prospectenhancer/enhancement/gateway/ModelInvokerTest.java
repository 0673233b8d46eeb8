package com.prospectenhancer.enhancement.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModelInvokerTest {

    @Mock
    private ModelGateway modelGateway;

    @InjectMocks
    private ModelInvoker invoker;

    @Test
    @DisplayName("received reply carries the raw text")
    void received() {
        when(modelGateway.generate("p")).thenReturn("answer");

        ModelReply reply = invoker.invoke("p");

        assertThat(reply.isReceived()).isTrue();
        assertThat(reply.raw()).isEqualTo("answer");
        assertThat(reply.elapsedMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    @DisplayName("gateway failure becomes a failed reply instead of an exception")
    void failed() {
        when(modelGateway.generate("p"))
                .thenThrow(new ModelGatewayException(ModelGatewayException.TIMEOUT, "Model call exceeded PT4M"));

        ModelReply reply = invoker.invoke("p");

        assertThat(reply.isReceived()).isFalse();
        assertThat(reply.raw()).isNull();
        assertThat(reply.error()).isEqualTo("Model call exceeded PT4M");
    }
}
