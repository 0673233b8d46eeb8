package com.prospectenhancer.domain;

import org.springframework.data.mongodb.core.query.Criteria;

import java.util.Map;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Which prospects a run of a given kind should pick up. The in-memory predicate and the Mongo criteria
 * express the same rule and must be changed together.
 */
public final class ProspectEligibility {

    public static final String SMALL_BUSINESS_PROGRAM_KEY = "original_small_business_program";

    private ProspectEligibility() {
    }

    public static boolean isEligible(Prospect p, EnhancementKind kind, boolean skipExisting) {
        return switch (kind) {
            case VALUES -> hasValueSource(p) && (!skipExisting || !p.hasParsedValue());
            case NAICS -> present(p.getDescription())
                    && (!skipExisting || p.getNaics() == null || p.getNaicsSource() != NaicsSource.LLM_INFERRED);
            case TITLES -> present(p.getTitle()) && (!skipExisting || p.getAiEnhancedTitle() == null);
            case SET_ASIDES -> hasSetAsideSource(p) && (!skipExisting || p.getSetAsideStandardized() == null);
            case ALL -> isEligible(p, EnhancementKind.VALUES, skipExisting)
                    || isEligible(p, EnhancementKind.NAICS, skipExisting)
                    || isEligible(p, EnhancementKind.TITLES, skipExisting)
                    || isEligible(p, EnhancementKind.SET_ASIDES, skipExisting);
        };
    }

    public static Criteria criteria(EnhancementKind kind, boolean skipExisting) {
        return switch (kind) {
            case VALUES -> skipExisting
                    ? new Criteria().andOperator(valueSourceCriteria(),
                    where("estimatedValueSingle").is(null),
                    where("estimatedValueMin").is(null),
                    where("estimatedValueMax").is(null))
                    : valueSourceCriteria();
            case NAICS -> skipExisting
                    ? new Criteria().andOperator(presentCriteria("description"),
                    new Criteria().orOperator(where("naics").is(null),
                            where("naicsSource").ne(NaicsSource.LLM_INFERRED)))
                    : presentCriteria("description");
            case TITLES -> skipExisting
                    ? new Criteria().andOperator(presentCriteria("title"), where("aiEnhancedTitle").is(null))
                    : presentCriteria("title");
            case SET_ASIDES -> skipExisting
                    ? new Criteria().andOperator(setAsideSourceCriteria(), where("setAsideStandardized").is(null))
                    : setAsideSourceCriteria();
            case ALL -> new Criteria().orOperator(
                    criteria(EnhancementKind.VALUES, skipExisting),
                    criteria(EnhancementKind.NAICS, skipExisting),
                    criteria(EnhancementKind.TITLES, skipExisting),
                    criteria(EnhancementKind.SET_ASIDES, skipExisting));
        };
    }

    private static boolean hasValueSource(Prospect p) {
        return present(p.getEstimatedValueText()) || p.getEstimatedValue() != null;
    }

    private static boolean hasSetAsideSource(Prospect p) {
        Map<String, Object> extra = p.getExtra();
        Object program = extra.get(SMALL_BUSINESS_PROGRAM_KEY);
        return present(p.getSetAside()) || (program != null && !"".equals(program));
    }

    private static boolean present(String s) {
        return s != null && !s.isEmpty();
    }

    private static Criteria valueSourceCriteria() {
        return new Criteria().orOperator(presentCriteria("estimatedValueText"), where("estimatedValue").ne(null));
    }

    private static Criteria setAsideSourceCriteria() {
        return new Criteria().orOperator(presentCriteria("setAside"),
                presentCriteria("extra." + SMALL_BUSINESS_PROGRAM_KEY));
    }

    private static Criteria presentCriteria(String field) {
        return where(field).nin(null, "");
    }
}
