package com.agentrunner.api;

import com.agentrunner.orchestration.service.AutomationCatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/automations")
public class AutomationController {

    private final AutomationCatalogService automationCatalogService;

    public AutomationController(AutomationCatalogService automationCatalogService) {
        this.automationCatalogService = automationCatalogService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AutomationResponse register(@Valid @RequestBody RegisterAutomationRequest request) {
        var automation = automationCatalogService.register(request.id(), request.name(), request.active(),
                request.endpointUrl(), request.entryPointDefinitions());
        return AutomationResponse.from(automation);
    }

    @GetMapping
    public List<AutomationResponse> list() {
        return automationCatalogService.listAutomations().stream()
                .map(AutomationResponse::from)
                .toList();
    }

    @PostMapping("/{automationId}/grants")
    public GrantResponse grant(@PathVariable String automationId, @Valid @RequestBody GrantRequest request) {
        automationCatalogService.grant(automationId, request.agentId(), request.scope());
        return new GrantResponse(automationId, request.agentId(), request.scope());
    }
}
