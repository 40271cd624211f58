package com.verityngn.orchestrator.provider;

import java.time.Instant;

/**
 * Last known health of a registered provider, as shown by GET /providers.
 */
public record ProviderStatus(
        String     name,
        Capability capability,
        boolean    available,
        String     reason,
        Instant    checkedAt) {}
