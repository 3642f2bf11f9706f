package com.agentrunner.orchestration.service;

import com.agentrunner.entity.AgentIdentity;
import com.agentrunner.entity.Automation;
import com.agentrunner.entity.AutomationGrant;
import com.agentrunner.entity.GrantScope;
import com.agentrunner.entity.IdentityKind;
import com.agentrunner.orchestration.model.AutomationSummary;
import com.agentrunner.orchestration.model.EntryPointDefinition;
import com.agentrunner.repository.AgentIdentityRepository;
import com.agentrunner.repository.AutomationGrantRepository;
import com.agentrunner.repository.AutomationRepository;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutomationCatalogServiceTest {

    private final AutomationRepository automationRepository = mock(AutomationRepository.class);
    private final AutomationGrantRepository grantRepository = mock(AutomationGrantRepository.class);
    private final AgentIdentityRepository identityRepository = mock(AgentIdentityRepository.class);
    private final AutomationCatalogService service =
            new AutomationCatalogService(automationRepository, grantRepository, identityRepository);

    @Test
    void testListAutomationsVisibleTo() {
        UUID agentId = UUID.randomUUID();
        Automation automation = Automation.builder().id("wf-1").name("Report").active(false).build();
        when(grantRepository.findAllWithAutomationByIdentityId(agentId)).thenReturn(List.of(
                AutomationGrant.builder().automation(automation).scope(GrantScope.READ).build()));

        assertEquals(List.of(new AutomationSummary("wf-1", "Report", false)), service.listAutomationsVisibleTo(agentId));
    }

    @Test
    void testFindExecutableRequiresExecuteGrant() {
        UUID agentId = UUID.randomUUID();
        when(grantRepository.existsByIdentityIdAndAutomationIdAndScope(agentId, "wf-1", GrantScope.EXECUTE))
                .thenReturn(false);

        assertTrue(service.findExecutable(agentId, "wf-1").isEmpty());
        verify(automationRepository, never()).findWithEntryPointsById("wf-1");
    }

    @Test
    void testFindExecutable() {
        UUID agentId = UUID.randomUUID();
        Automation automation = Automation.builder().id("wf-1").name("Report").build();
        when(grantRepository.existsByIdentityIdAndAutomationIdAndScope(agentId, "wf-1", GrantScope.EXECUTE))
                .thenReturn(true);
        when(automationRepository.findWithEntryPointsById("wf-1")).thenReturn(Optional.of(automation));

        assertEquals(Optional.of(automation), service.findExecutable(agentId, "wf-1"));
    }

    @Test
    void testRegisterKeepsEntryPointOrder() {
        when(automationRepository.existsById("wf-1")).thenReturn(false);
        when(automationRepository.save(any(Automation.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Automation automation = service.register("wf-1", "Report", true, "https://hooks.example.test/wf-1", List.of(
                new EntryPointDefinition("Chat", "conversational", false),
                new EntryPointDefinition("Manual", "manual", true)));

        assertEquals(2, automation.getEntryPoints().size());
        assertEquals("Chat", automation.getEntryPoints().get(0).getName());
        assertEquals(0, automation.getEntryPoints().get(0).getPosition());
        assertEquals(1, automation.getEntryPoints().get(1).getPosition());
        assertTrue(automation.getEntryPoints().get(1).isDisabled());
        assertSame(automation, automation.getEntryPoints().get(0).getAutomation());
    }

    @Test
    void testRegisterDuplicate() {
        when(automationRepository.existsById("wf-1")).thenReturn(true);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.register("wf-1", "Report", true, null, List.of()));
        assertEquals(HttpStatus.CONFLICT, ex.getStatusCode());
    }

    @Test
    void testGrantReplacesExistingScope() {
        UUID agentId = UUID.randomUUID();
        Automation automation = Automation.builder().id("wf-1").name("Report").build();
        AgentIdentity agent = AgentIdentity.builder().id(agentId).firstName("Ada").kind(IdentityKind.AGENT).build();
        AutomationGrant existing = AutomationGrant.builder().identity(agent).automation(automation)
                .scope(GrantScope.READ).build();
        when(automationRepository.findById("wf-1")).thenReturn(Optional.of(automation));
        when(identityRepository.findByIdAndKind(agentId, IdentityKind.AGENT)).thenReturn(Optional.of(agent));
        when(grantRepository.findByIdentityIdAndAutomationId(agentId, "wf-1")).thenReturn(Optional.of(existing));
        when(grantRepository.save(existing)).thenReturn(existing);

        AutomationGrant grant = service.grant("wf-1", agentId, GrantScope.EXECUTE);

        assertSame(existing, grant);
        assertEquals(GrantScope.EXECUTE, grant.getScope());
    }

    @Test
    void testGrantUnknownAgent() {
        UUID agentId = UUID.randomUUID();
        when(automationRepository.findById("wf-1"))
                .thenReturn(Optional.of(Automation.builder().id("wf-1").name("Report").build()));
        when(identityRepository.findByIdAndKind(agentId, IdentityKind.AGENT)).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.grant("wf-1", agentId, GrantScope.READ));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }
}
