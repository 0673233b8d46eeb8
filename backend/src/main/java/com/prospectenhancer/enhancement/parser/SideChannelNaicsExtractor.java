package com.prospectenhancer.enhancement.parser;

import com.prospectenhancer.common.ExtraPayloads;
import com.prospectenhancer.common.NaicsCatalog;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds a NAICS code already present in a prospect's side-channel payload.
 * Rules run in order: direct code key, formatted code key, generic keys, value scan.
 */
@Component
public class SideChannelNaicsExtractor {

    private final List<SideChannelRule> rules;

    public SideChannelNaicsExtractor(NaicsCodeParser parser, NaicsCatalog catalog) {
        this.rules = SideChannelRules.standard(parser, catalog);
    }

    /**
     * @param payload a map or JSON text; anything unreadable counts as "not found"
     */
    public SideChannelMatch extract(Object payload) {
        Map<String, Object> extra = ExtraPayloads.normalize(payload);
        if (extra.isEmpty()) {
            return SideChannelMatch.notFound();
        }
        for (SideChannelRule rule : rules) {
            Optional<SideChannelMatch> match = rule.extract(extra);
            if (match.isPresent()) {
                return match.get();
            }
        }
        return SideChannelMatch.notFound();
    }
}
