package com.agentrunner.repository;

import com.agentrunner.entity.AutomationRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

/**
 * Repository interface for managing {@link AutomationRun} entities.
 */
public interface AutomationRunRepository extends JpaRepository<AutomationRun, UUID> {
}
