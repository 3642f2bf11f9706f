package com.agentrunner.repository;

import com.agentrunner.entity.AgentIdentity;
import com.agentrunner.entity.IdentityKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link AgentIdentity} entities.
 * Humans and agents share the table and are told apart by {@link IdentityKind}.
 */
@Repository
public interface AgentIdentityRepository extends JpaRepository<AgentIdentity, UUID> {

    /**
     * Finds an identity by id, restricted to the given kind.
     *
     * @param id The identity id.
     * @param kind The expected kind.
     * @return An {@link Optional} containing the identity, or empty if absent or of another kind.
     */
    Optional<AgentIdentity> findByIdAndKind(UUID id, IdentityKind kind);

    /**
     * Lists every identity of the given kind except one, ordered by first name.
     *
     * @param kind The kind to list.
     * @param excludedId The identity to leave out, usually the caller.
     * @return The matching identities.
     */
    List<AgentIdentity> findAllByKindAndIdNotOrderByFirstNameAsc(IdentityKind kind, UUID excludedId);

    boolean existsByEmail(String email);
}
