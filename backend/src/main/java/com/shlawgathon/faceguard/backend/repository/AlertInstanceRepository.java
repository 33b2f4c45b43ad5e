package com.shlawgathon.faceguard.backend.repository;

import com.shlawgathon.faceguard.backend.model.AlertInstance;
import com.shlawgathon.faceguard.backend.model.AlertStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AlertInstanceRepository extends MongoRepository<AlertInstance, String> {

    Optional<AlertInstance> findFirstByRuleIdAndSubjectPersonIdOrderByTriggeredAtDesc(String ruleId,
            String subjectPersonId);

    List<AlertInstance> findByStatus(AlertStatus status);

    Page<AlertInstance> findByStatus(AlertStatus status, Pageable pageable);

    long countByStatus(AlertStatus status);
}
