package com.prospectenhancer.enhancement.parser;

import com.prospectenhancer.common.NaicsCatalog;
import com.prospectenhancer.domain.Prospect;
import com.prospectenhancer.enhancement.audit.LlmAuditLog;
import com.prospectenhancer.enhancement.audit.ModelInteractionType;
import com.prospectenhancer.enhancement.gateway.ModelInvoker;
import com.prospectenhancer.enhancement.gateway.ModelReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NaicsClassifierTest {

    @Mock
    private ModelInvoker modelInvoker;
    @Mock
    private LlmAuditLog auditLog;

    private NaicsClassifier classifier;
    private Prospect prospect;

    @BeforeEach
    void setUp() {
        classifier = new NaicsClassifier(modelInvoker, auditLog, new NaicsCatalog());
        prospect = new Prospect();
        prospect.setId("p1");
        prospect.setTitle("Custom software development");
        prospect.setAgency("DHS");
    }

    @Test
    @DisplayName("top three by confidence are kept and the primary is the highest valid code")
    @SuppressWarnings("unchecked")
    void sortsAndLimits() {
        when(modelInvoker.invoke(anyString())).thenReturn(ModelReply.received("""
                [
                  {"code": "541512", "description": "whatever", "confidence": 0.7},
                  {"code": "541511", "description": "model text", "confidence": 0.95},
                  {"code": "541519", "confidence": 0.6},
                  {"code": "541330", "confidence": 0.5}
                ]
                """, 400));

        NaicsClassification result = classifier.classify(prospect);

        assertThat(result.code()).isEqualTo("541511");
        assertThat(result.description()).isEqualTo("Custom Computer Programming Services");
        assertThat(result.confidence()).isEqualTo(0.95);
        assertThat(result.candidates()).extracting(NaicsCandidate::code)
                .containsExactly("541511", "541512", "541519");

        ArgumentCaptor<Map<String, Object>> parsed = ArgumentCaptor.forClass(Map.class);
        verify(auditLog).success(eq("p1"), eq(ModelInteractionType.NAICS_CLASSIFICATION), anyString(), any(),
                parsed.capture());
        assertThat((List<?>) parsed.getValue().get("all_codes")).hasSize(3);
    }

    @Test
    @DisplayName("codes missing from the catalog are dropped after the top-three cut")
    void invalidCodesDropped() {
        when(modelInvoker.invoke(anyString())).thenReturn(ModelReply.received("""
                [{"code": "999999", "confidence": 0.99}, {"code": "54151", "confidence": 0.9},
                 {"code": "236220"}]
                """, 100));

        NaicsClassification result = classifier.classify(prospect);

        assertThat(result.code()).isEqualTo("236220");
        assertThat(result.confidence()).isEqualTo(0.8);
        assertThat(result.candidates()).hasSize(1);
    }

    @Test
    @DisplayName("object answer is a failure with no code")
    void notAnArray() {
        when(modelInvoker.invoke(anyString())).thenReturn(ModelReply.received("{\"code\": \"541511\"}", 100));

        assertThat(classifier.classify(prospect).hasCode()).isFalse();
        verify(auditLog).failure(eq("p1"), eq(ModelInteractionType.NAICS_CLASSIFICATION), anyString(), any(),
                anyMap(), anyString());
    }
}
