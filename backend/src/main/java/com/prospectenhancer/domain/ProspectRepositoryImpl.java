package com.prospectenhancer.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed custom queries for prospects.
 */
@Repository
@RequiredArgsConstructor
public class ProspectRepositoryImpl implements ProspectRepositoryCustom {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "loadedAt");

    private final MongoTemplate mongoTemplate;

    @Override
    public long countEligible(EnhancementKind kind, boolean skipExisting) {
        return mongoTemplate.count(new Query(ProspectEligibility.criteria(kind, skipExisting)), Prospect.class);
    }

    @Override
    public Optional<Prospect> findNextEligible(EnhancementKind kind, boolean skipExisting, Collection<String> excludedIds) {
        Criteria criteria = ProspectEligibility.criteria(kind, skipExisting);
        if (excludedIds != null && !excludedIds.isEmpty()) {
            criteria = new Criteria().andOperator(criteria, where("_id").nin(excludedIds));
        }
        Query query = new Query(criteria).with(NEWEST_FIRST).limit(1);
        return Optional.ofNullable(mongoTemplate.findOne(query, Prospect.class));
    }

    @Override
    public List<Prospect> findEligible(EnhancementKind kind, boolean skipExisting, int limit) {
        Query query = new Query(ProspectEligibility.criteria(kind, skipExisting)).with(NEWEST_FIRST);
        if (limit > 0) {
            query.limit(limit);
        }
        return mongoTemplate.find(query, Prospect.class);
    }

    @Override
    public List<String> findEligibleIds(EnhancementKind kind, boolean skipExisting) {
        Query query = new Query(ProspectEligibility.criteria(kind, skipExisting)).with(NEWEST_FIRST);
        query.fields().include("_id");
        return mongoTemplate.find(query, Prospect.class).stream().map(Prospect::getId).toList();
    }

    @Override
    public long resetInProgress(Instant startedBefore) {
        Update update = new Update()
                .set("enhancementStatus", EnhancementStatus.IDLE)
                .unset("enhancementStartedAt")
                .unset("enhancementUserId");
        return mongoTemplate.updateMulti(inProgressQuery(startedBefore), update, Prospect.class).getModifiedCount();
    }

    @Override
    public long countInProgressStartedBefore(Instant startedBefore) {
        return mongoTemplate.count(inProgressQuery(startedBefore), Prospect.class);
    }

    private static Query inProgressQuery(Instant startedBefore) {
        Criteria criteria = where("enhancementStatus").is(EnhancementStatus.IN_PROGRESS);
        if (startedBefore != null) {
            criteria = criteria.orOperator(
                    where("enhancementStartedAt").lt(startedBefore),
                    where("enhancementStartedAt").is(null));
        }
        return new Query(criteria);
    }
}
