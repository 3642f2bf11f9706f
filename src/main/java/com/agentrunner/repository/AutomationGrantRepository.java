package com.agentrunner.repository;

import com.agentrunner.entity.AutomationGrant;
import com.agentrunner.entity.GrantScope;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link AutomationGrant} entities.
 */
@Repository
public interface AutomationGrantRepository extends JpaRepository<AutomationGrant, UUID> {

    /**
     * Lists the grants held by an identity with their automations loaded, ordered by automation name.
     *
     * @param identityId The identity id.
     * @return The grants of the identity.
     */
    @Query("select g from AutomationGrant g join fetch g.automation a where g.identity.id = :identityId order by a.name")
    List<AutomationGrant> findAllWithAutomationByIdentityId(@Param("identityId") UUID identityId);

    Optional<AutomationGrant> findByIdentityIdAndAutomationId(UUID identityId, String automationId);

    boolean existsByIdentityIdAndAutomationIdAndScope(UUID identityId, String automationId, GrantScope scope);
}
