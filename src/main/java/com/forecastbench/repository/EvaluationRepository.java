package com.forecastbench.repository;

import com.forecastbench.entity.EvaluationRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface EvaluationRepository extends JpaRepository<EvaluationRecord, UUID> {

    Page<EvaluationRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<EvaluationRecord> findByLabelOrderByCreatedAtDesc(String label, Pageable pageable);
}
