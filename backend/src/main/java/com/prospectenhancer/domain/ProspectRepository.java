package com.prospectenhancer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ProspectRepository extends MongoRepository<Prospect, String>, ProspectRepositoryCustom {

    long countByEnhancementStatus(EnhancementStatus status);

    List<Prospect> findByEnhancementStatus(EnhancementStatus status);
}
