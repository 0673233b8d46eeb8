package com.prospectenhancer.enhancement.setaside;

import com.prospectenhancer.domain.Prospect;
import com.prospectenhancer.enhancement.config.EnhancementProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Standardizes a prospect's set-aside: deterministic rules first, the model only below the consult threshold.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SetAsideStandardizationService {

    static final double MODEL_CONFIDENCE = 0.85;

    private final SetAsideStandardizer standardizer;
    private final SetAsideModelClassifier modelClassifier;
    private final EnhancementProperties properties;

    /**
     * @return empty when the prospect carries no set-aside information at all
     */
    public Optional<SetAsideResult> standardize(Prospect prospect) {
        String input = SetAsideInputs.comprehensive(prospect.getSetAside(), prospect.getExtra());
        if (input.isEmpty()) {
            return Optional.empty();
        }
        SetAsideResult deterministic = standardizer.standardize(input);
        if (deterministic.confidence() >= properties.getSetAsideModelConsultThreshold()) {
            return Optional.of(deterministic);
        }
        log.debug("Set-aside '{}' below consult threshold ({}), asking model", input, deterministic.confidence());
        Optional<SetAsideResult> fromModel = modelClassifier.classify(input, prospect.getId())
                .map(c -> new SetAsideResult(c, MODEL_CONFIDENCE, SetAsideResult.Method.MODEL, input));
        return Optional.of(fromModel.orElse(deterministic));
    }
}
