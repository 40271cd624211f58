package com.verityngn.orchestrator.service;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tokens of the jobs running on this process, so a cancel request or a
 * heartbeat that observes the persisted flag can wake the worker.
 */
@Component
public class CancellationRegistry {

    private final Map<UUID, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken register(UUID jobId) {
        return tokens.computeIfAbsent(jobId, CancellationToken::new);
    }

    public void unregister(UUID jobId) {
        tokens.remove(jobId);
    }

    /** @return true when the job runs on this process and was signalled */
    public boolean signal(UUID jobId) {
        CancellationToken token = tokens.get(jobId);
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    public Optional<CancellationToken> find(UUID jobId) {
        return Optional.ofNullable(tokens.get(jobId));
    }

    public Set<UUID> runningJobIds() {
        return Set.copyOf(tokens.keySet());
    }
}
