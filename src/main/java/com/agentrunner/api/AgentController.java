package com.agentrunner.api;

import com.agentrunner.orchestration.TaskOrchestrator;
import com.agentrunner.orchestration.model.AgentCapabilities;
import com.agentrunner.orchestration.service.AgentDirectoryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final AgentDirectoryService agentDirectoryService;
    private final TaskOrchestrator taskOrchestrator;

    public AgentController(AgentDirectoryService agentDirectoryService, TaskOrchestrator taskOrchestrator) {
        this.agentDirectoryService = agentDirectoryService;
        this.taskOrchestrator = taskOrchestrator;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AgentResponse create(@Valid @RequestBody CreateAgentRequest request) {
        var agent = agentDirectoryService.createAgent(request.firstName(), request.lastName(), request.avatar());
        return AgentResponse.from(agent);
    }

    @PatchMapping("/{agentId}")
    public AgentResponse update(@PathVariable UUID agentId, @Valid @RequestBody UpdateAgentRequest request) {
        var agent = agentDirectoryService.updateAgent(agentId, request.firstName(), request.avatar());
        return AgentResponse.from(agent);
    }

    @GetMapping("/{agentId}/capabilities")
    public AgentCapabilities capabilities(@PathVariable UUID agentId) {
        return agentDirectoryService.getCapabilities(agentId);
    }

    @PostMapping("/{agentId}/tasks")
    public TaskResponse executeTask(@PathVariable UUID agentId, @Valid @RequestBody TaskRequest request) {
        var result = taskOrchestrator.executeTask(agentId, request.prompt(), 0);
        return TaskResponse.from(result);
    }
}
