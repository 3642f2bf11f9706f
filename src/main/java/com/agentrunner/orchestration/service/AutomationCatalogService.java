package com.agentrunner.orchestration.service;

import com.agentrunner.entity.AgentIdentity;
import com.agentrunner.entity.Automation;
import com.agentrunner.entity.AutomationEntryPoint;
import com.agentrunner.entity.AutomationGrant;
import com.agentrunner.entity.GrantScope;
import com.agentrunner.entity.IdentityKind;
import com.agentrunner.orchestration.model.AutomationSummary;
import com.agentrunner.orchestration.model.EntryPointDefinition;
import com.agentrunner.repository.AgentIdentityRepository;
import com.agentrunner.repository.AutomationGrantRepository;
import com.agentrunner.repository.AutomationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Automations and the grants that make them visible to agents. A READ grant lists an
 * automation in the agent's prompt; only an EXECUTE grant lets the agent run it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutomationCatalogService {

    private final AutomationRepository automationRepository;
    private final AutomationGrantRepository automationGrantRepository;
    private final AgentIdentityRepository agentIdentityRepository;

    @Transactional(readOnly = true)
    public List<AutomationSummary> listAutomationsVisibleTo(UUID identityId) {
        return automationGrantRepository.findAllWithAutomationByIdentityId(identityId).stream()
                .map(AutomationGrant::getAutomation)
                .map(automation -> new AutomationSummary(automation.getId(), automation.getName(), automation.isActive()))
                .toList();
    }

    /**
     * Loads an automation with its entry points if the identity may execute it.
     */
    @Transactional(readOnly = true)
    public Optional<Automation> findExecutable(UUID identityId, String automationId) {
        if (!automationGrantRepository.existsByIdentityIdAndAutomationIdAndScope(identityId, automationId, GrantScope.EXECUTE)) {
            return Optional.empty();
        }
        return automationRepository.findWithEntryPointsById(automationId);
    }

    @Transactional(readOnly = true)
    public List<Automation> listAutomations() {
        return automationRepository.findAllWithEntryPoints();
    }

    @Transactional
    public Automation register(String id,
                               String name,
                               boolean active,
                               @Nullable String endpointUrl,
                               List<EntryPointDefinition> entryPoints) {
        if (automationRepository.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Automation already exists: " + id);
        }
        Automation automation = Automation.builder()
                .id(id)
                .name(name)
                .active(active)
                .endpointUrl(endpointUrl)
                .build();
        for (EntryPointDefinition definition : entryPoints) {
            automation.addEntryPoint(AutomationEntryPoint.builder()
                    .name(definition.name())
                    .type(definition.type())
                    .disabled(definition.disabled())
                    .build());
        }
        Automation saved = automationRepository.save(automation);
        log.info("Registered automation {} with {} entry point(s)", saved.getId(), saved.getEntryPoints().size());
        return saved;
    }

    /**
     * Gives an agent access to an automation, replacing any scope it already held.
     */
    @Transactional
    public AutomationGrant grant(String automationId, UUID agentId, GrantScope scope) {
        Automation automation = automationRepository.findById(automationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Automation not found: " + automationId));
        AgentIdentity agent = agentIdentityRepository.findByIdAndKind(agentId, IdentityKind.AGENT)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Agent not found: " + agentId));
        AutomationGrant grant = automationGrantRepository.findByIdentityIdAndAutomationId(agentId, automationId)
                .orElseGet(() -> AutomationGrant.builder()
                        .identity(agent)
                        .automation(automation)
                        .build());
        grant.setScope(scope);
        AutomationGrant saved = automationGrantRepository.save(grant);
        log.info("Granted {} on automation {} to agent {}", scope, automationId, agentId);
        return saved;
    }
}
