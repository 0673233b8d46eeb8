package com.prospectenhancer.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Eligibility-driven and bulk-update queries on prospects.
 */
public interface ProspectRepositoryCustom {

    long countEligible(EnhancementKind kind, boolean skipExisting);

    /**
     * Most recently loaded eligible prospect whose id is not in {@code excludedIds}.
     */
    Optional<Prospect> findNextEligible(EnhancementKind kind, boolean skipExisting, Collection<String> excludedIds);

    /** Eligible prospects, most recently loaded first; {@code limit <= 0} means no limit. */
    List<Prospect> findEligible(EnhancementKind kind, boolean skipExisting, int limit);

    List<String> findEligibleIds(EnhancementKind kind, boolean skipExisting);

    /**
     * Resets IN_PROGRESS prospects to IDLE, clearing start timestamp and owner.
     *
     * @param startedBefore only prospects started before this instant (or with no start timestamp);
     *                      null resets every IN_PROGRESS prospect
     * @return number of prospects reset
     */
    long resetInProgress(Instant startedBefore);

    long countInProgressStartedBefore(Instant startedBefore);
}
