package com.arknoa.orchestrator.repository;

import com.arknoa.orchestrator.model.StageOutput;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StageOutputRepository extends JpaRepository<StageOutput, StageOutput.Key> {

    List<StageOutput> findByRequestId(UUID requestId);
}
