package com.verityngn.orchestrator.admission;

import java.util.Map;

/**
 * Concurrency limits, resolved once at startup.
 *
 * @param globalCap          RUNNING jobs allowed across all tenants
 * @param defaultTenantCap   RUNNING jobs allowed per tenant unless overridden
 * @param tenantCaps         per-tenant overrides
 * @param maxQueuedPerTenant QUEUED jobs a capped tenant may hold; 0 means unbounded
 */
public record AdmissionPolicy(int globalCap, int defaultTenantCap,
                              Map<String, Integer> tenantCaps, int maxQueuedPerTenant) {

    public AdmissionPolicy {
        if (globalCap < 1) {
            throw new IllegalArgumentException("global-cap must be >= 1");
        }
        if (defaultTenantCap < 1) {
            throw new IllegalArgumentException("default-tenant-cap must be >= 1");
        }
        tenantCaps = tenantCaps == null ? Map.of() : Map.copyOf(tenantCaps);
        tenantCaps.forEach((tenant, cap) -> {
            if (cap == null || cap < 1) {
                throw new IllegalArgumentException("cap for tenant '" + tenant + "' must be >= 1");
            }
        });
        if (maxQueuedPerTenant < 0) {
            throw new IllegalArgumentException("max-queued-per-tenant must be >= 0");
        }
    }

    public int capFor(String tenantId) {
        return tenantCaps.getOrDefault(tenantId, defaultTenantCap);
    }

    public boolean queueBounded() {
        return maxQueuedPerTenant > 0;
    }
}
