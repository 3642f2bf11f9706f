package com.agentrunner.orchestration.service;

import com.agentrunner.entity.AgentIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Resolves the name a model used for a peer agent. Exact first-name matches win over exact
 * display-name matches, which win over case-insensitive matches of either.
 */
@Service
@RequiredArgsConstructor
public class PeerResolutionService {

    private final AgentDirectoryService agentDirectoryService;

    public Optional<AgentIdentity> findPeer(UUID callerId, String name) {
        if (!StringUtils.hasText(name)) {
            return Optional.empty();
        }
        return findPeer(agentDirectoryService.listPeerAgents(callerId), name);
    }

    Optional<AgentIdentity> findPeer(List<AgentIdentity> peers, String name) {
        String wanted = name.trim();
        List<Predicate<AgentIdentity>> matchers = List.of(
                peer -> wanted.equals(peer.getFirstName()),
                peer -> wanted.equals(peer.displayName()),
                peer -> wanted.equalsIgnoreCase(peer.getFirstName()) || wanted.equalsIgnoreCase(peer.displayName()));
        for (Predicate<AgentIdentity> matcher : matchers) {
            Optional<AgentIdentity> match = peers.stream().filter(matcher).findFirst();
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }
}
