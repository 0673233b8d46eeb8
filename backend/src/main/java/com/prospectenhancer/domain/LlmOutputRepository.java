package com.prospectenhancer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface LlmOutputRepository extends MongoRepository<LlmOutput, String> {

    List<LlmOutput> findByProspectIdOrderByTimestampDesc(String prospectId);

    List<LlmOutput> findByProspectIdAndEnhancementTypeOrderByTimestampDesc(String prospectId, String enhancementType);
}
