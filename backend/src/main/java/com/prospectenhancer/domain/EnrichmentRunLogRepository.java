package com.prospectenhancer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface EnrichmentRunLogRepository extends MongoRepository<EnrichmentRunLog, String> {

    Optional<EnrichmentRunLog> findFirstByEnhancementTypeOrderByTimestampDesc(String enhancementType);
}
