package com.agentrunner.orchestration.service;

import com.agentrunner.entity.AgentIdentity;
import com.agentrunner.entity.IdentityKind;
import com.agentrunner.orchestration.model.AgentCapabilities;
import com.agentrunner.repository.AgentIdentityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AgentDirectoryService {

    private static final String AGENT_EMAIL_TEMPLATE = "agent-%s@internal.agentrunner.local";

    private final AgentIdentityRepository agentIdentityRepository;
    private final AutomationCatalogService automationCatalogService;

    @Transactional(readOnly = true)
    public Optional<AgentIdentity> findAgentById(UUID agentId) {
        return agentIdentityRepository.findByIdAndKind(agentId, IdentityKind.AGENT);
    }

    /**
     * Lists every agent except {@code excludeId}, ordered by first name.
     */
    @Transactional(readOnly = true)
    public List<AgentIdentity> listPeerAgents(UUID excludeId) {
        return agentIdentityRepository.findAllByKindAndIdNotOrderByFirstNameAsc(IdentityKind.AGENT, excludeId);
    }

    @Transactional
    public AgentIdentity createAgent(String firstName, @Nullable String lastName, @Nullable String avatar) {
        AgentIdentity agent = AgentIdentity.builder()
                .firstName(firstName.trim())
                .lastName(StringUtils.hasText(lastName) ? lastName.trim() : "")
                .avatar(avatar)
                .email(uniqueEmail())
                .kind(IdentityKind.AGENT)
                .build();
        AgentIdentity saved = agentIdentityRepository.save(agent);
        log.info("Created agent {} ({})", saved.getId(), saved.displayName());
        return saved;
    }

    @Transactional
    public AgentIdentity updateAgent(UUID agentId, @Nullable String firstName, @Nullable String avatar) {
        AgentIdentity agent = findAgentById(agentId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Agent not found: " + agentId));
        if (StringUtils.hasText(firstName)) {
            agent.setFirstName(firstName.trim());
        }
        if (avatar != null) {
            agent.setAvatar(avatar.isBlank() ? null : avatar);
        }
        return agentIdentityRepository.save(agent);
    }

    @Transactional(readOnly = true)
    public AgentCapabilities getCapabilities(UUID agentId) {
        AgentIdentity agent = findAgentById(agentId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Agent not found: " + agentId));
        return new AgentCapabilities(agent.getId(), agent.displayName(),
                automationCatalogService.listAutomationsVisibleTo(agent.getId()));
    }

    private String uniqueEmail() {
        String email;
        do {
            email = AGENT_EMAIL_TEMPLATE.formatted(UUID.randomUUID().toString().substring(0, 8));
        } while (agentIdentityRepository.existsByEmail(email));
        return email;
    }
}
