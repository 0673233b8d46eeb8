package com.prospectenhancer.enhancement.engine;

import com.prospectenhancer.domain.EnhancementKind;
import com.prospectenhancer.domain.NaicsSource;
import com.prospectenhancer.domain.Prospect;
import com.prospectenhancer.enhancement.gateway.ModelInvoker;
import com.prospectenhancer.enhancement.parser.MonetaryValue;
import com.prospectenhancer.enhancement.parser.MonetaryValueParser;
import com.prospectenhancer.enhancement.parser.NaicsClassification;
import com.prospectenhancer.enhancement.parser.NaicsClassifier;
import com.prospectenhancer.enhancement.parser.SideChannelMatch;
import com.prospectenhancer.enhancement.parser.SideChannelNaicsExtractor;
import com.prospectenhancer.enhancement.parser.TitleEnhancement;
import com.prospectenhancer.enhancement.parser.TitleEnhancer;
import com.prospectenhancer.enhancement.setaside.SetAsideResult;
import com.prospectenhancer.enhancement.setaside.SetAsideStandardizationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Enhances one prospect in memory for the requested kind(s). Persisting the prospect is the caller's job;
 * model interactions are audited as they happen.
 * <p>
 * Each sub-enhancement is skipped when its result already exists, unless {@code force} is set.
 * NAICS is taken from the side channel when present ({@code ORIGINAL}) before the model is asked
 * ({@code LLM_INFERRED}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnhancementEngine {

    static final String NAICS_FROM_EXTRA_KEY = "naics_extracted_from_extra";
    static final String LLM_CLASSIFICATION_KEY = "llm_classification";
    static final String TITLE_ENHANCEMENT_KEY = "llm_title_enhancement";
    static final String SET_ASIDE_KEY = "set_aside_standardization";

    private final MonetaryValueParser monetaryValueParser;
    private final SideChannelNaicsExtractor sideChannelNaicsExtractor;
    private final NaicsClassifier naicsClassifier;
    private final TitleEnhancer titleEnhancer;
    private final SetAsideStandardizationService setAsideStandardizationService;
    private final ModelInvoker modelInvoker;

    public EnhancementOutcome enhanceOne(Prospect prospect, EnhancementKind kind) {
        return enhanceOne(prospect, kind, false);
    }

    public EnhancementOutcome enhanceOne(Prospect prospect, EnhancementKind kind, boolean force) {
        boolean values = kind.includes(EnhancementKind.VALUES) && enhanceValue(prospect, force);
        boolean naics = kind.includes(EnhancementKind.NAICS) && enhanceNaics(prospect, force);
        boolean titles = kind.includes(EnhancementKind.TITLES) && enhanceTitle(prospect, force);
        boolean setAsides = kind.includes(EnhancementKind.SET_ASIDES) && enhanceSetAside(prospect, force);
        EnhancementOutcome outcome = new EnhancementOutcome(values, naics, titles, setAsides);
        if (outcome.anySucceeded()) {
            prospect.setOllamaProcessedAt(Instant.now());
            prospect.setOllamaModelVersion(modelInvoker.modelName());
        }
        log.debug("Prospect {} enhanced for {}: {}", prospect.getId(), kind.value(), outcome);
        return outcome;
    }

    private boolean enhanceValue(Prospect p, boolean force) {
        if (!force && p.hasParsedValue()) {
            return false;
        }
        Optional<String> source = valueSource(p);
        if (source.isEmpty()) {
            return false;
        }
        MonetaryValue value = monetaryValueParser.parse(source.get(), p.getId());
        if (!value.isParsed()) {
            return false;
        }
        p.setEstimatedValueSingle(value.single());
        p.setEstimatedValueMin(value.min());
        p.setEstimatedValueMax(value.max());
        if (isBlank(p.getEstimatedValueText())) {
            p.setEstimatedValueText(source.get());
        }
        return true;
    }

    private static Optional<String> valueSource(Prospect p) {
        if (!isBlank(p.getEstimatedValueText())) {
            return Optional.of(p.getEstimatedValueText());
        }
        if (p.getEstimatedValue() != null) {
            return Optional.of(p.getEstimatedValue().toPlainString());
        }
        return Optional.empty();
    }

    private boolean enhanceNaics(Prospect p, boolean force) {
        if (isBlank(p.getDescription())) {
            return false;
        }
        if (!force && p.getNaics() != null && p.getNaicsSource() == NaicsSource.LLM_INFERRED) {
            return false;
        }
        SideChannelMatch match = sideChannelNaicsExtractor.extract(p.getExtra());
        if (match.foundInSideChannel()) {
            p.setNaics(match.code());
            p.setNaicsDescription(match.description());
            p.setNaicsSource(NaicsSource.ORIGINAL);
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("extracted_at", Instant.now().toString());
            meta.put("original_code", match.code());
            meta.put("original_description", match.description());
            meta.put("rule", match.rule());
            p.getExtra().put(NAICS_FROM_EXTRA_KEY, meta);
            return true;
        }
        NaicsClassification classification = naicsClassifier.classify(p);
        if (!classification.hasCode()) {
            return false;
        }
        p.setNaics(classification.code());
        p.setNaicsDescription(classification.description());
        p.setNaicsSource(NaicsSource.LLM_INFERRED);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("naics_confidence", classification.confidence());
        meta.put("all_codes", classification.candidates().stream()
                .map(c -> Map.<String, Object>of("code", c.code(), "confidence", c.confidence()))
                .toList());
        meta.put("model_used", modelInvoker.modelName());
        meta.put("classified_at", Instant.now().toString());
        p.getExtra().put(LLM_CLASSIFICATION_KEY, meta);
        return true;
    }

    private boolean enhanceTitle(Prospect p, boolean force) {
        if (isBlank(p.getTitle()) || (!force && p.getAiEnhancedTitle() != null)) {
            return false;
        }
        TitleEnhancement enhancement = titleEnhancer.enhance(p.getTitle(), p.getDescription(), p.getAgency(), p.getId());
        if (!enhancement.isEnhanced()) {
            return false;
        }
        p.setAiEnhancedTitle(enhancement.enhancedTitle());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("confidence", enhancement.confidence());
        meta.put("reasoning", enhancement.reasoning());
        meta.put("original_title", p.getTitle());
        meta.put("enhanced_at", Instant.now().toString());
        meta.put("model_used", modelInvoker.modelName());
        p.getExtra().put(TITLE_ENHANCEMENT_KEY, meta);
        return true;
    }

    private boolean enhanceSetAside(Prospect p, boolean force) {
        if (!force && p.getSetAsideStandardized() != null) {
            return false;
        }
        Optional<SetAsideResult> standardized = setAsideStandardizationService.standardize(p);
        if (standardized.isEmpty()) {
            return false;
        }
        SetAsideResult result = standardized.get();
        p.setSetAsideStandardized(result.category().code());
        p.setSetAsideStandardizedLabel(result.category().label());
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("original_set_aside", p.getSetAside());
        meta.put("comprehensive_data_used", result.input());
        meta.put("method", result.method().name().toLowerCase());
        meta.put("confidence", result.confidence());
        meta.put("standardized_at", Instant.now().toString());
        p.getExtra().put(SET_ASIDE_KEY, meta);
        return true;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
