package com.agentrunner.repository;

import com.agentrunner.entity.Automation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for managing {@link Automation} entities.
 */
@Repository
public interface AutomationRepository extends JpaRepository<Automation, String> {

    /**
     * Loads an automation together with its entry points in declaration order.
     *
     * @param id The automation id.
     * @return An {@link Optional} containing the automation, or empty if not found.
     */
    @Query("select distinct a from Automation a left join fetch a.entryPoints where a.id = :id")
    Optional<Automation> findWithEntryPointsById(@Param("id") String id);

    /**
     * Lists every automation with its entry points, ordered by name.
     *
     * @return All registered automations.
     */
    @Query("select distinct a from Automation a left join fetch a.entryPoints order by a.name")
    List<Automation> findAllWithEntryPoints();
}
