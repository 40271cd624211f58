package com.verityngn.orchestrator.provider;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-process provider registry.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by name and capability ({@link #resolve}). A name that is not
 *       registered, or registered with the wrong capability, resolves to
 *       empty: the stage treats it like an unavailable provider.</li>
 *   <li>Health: each provider is probed on first use and again once its
 *       cached probe is older than the health TTL. A call failing with
 *       UNAVAILABLE marks the provider down until the next probe.</li>
 *   <li>Metrics-instrumented invocation ({@link #call}): every call is timed
 *       and counted by outcome, and unexpected exceptions are wrapped as
 *       TRANSIENT provider errors.</li>
 * </ol>
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private record Probe(ProviderAvailability availability, Instant checkedAt) {}

    private final Map<String, Provider> providers = new LinkedHashMap<>();
    private final Map<String, Probe>    probes    = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;
    private final Clock         clock;
    private final Duration      healthTtl;

    public ProviderRegistry(List<? extends Provider> allProviders,
                            MeterRegistry meterRegistry,
                            Clock clock,
                            Duration healthTtl) {
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.healthTtl     = healthTtl;
        for (Provider p : allProviders) {
            if (providers.putIfAbsent(p.name(), p) != null) {
                throw new IllegalArgumentException("Duplicate provider name '" + p.name() + "'");
            }
            log.info("Registered provider '{}' [{}]", p.name(), p.capability());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * Find a usable provider for a fallback-chain entry.
     *
     * @return empty when the name is unknown, has a different capability, or probes unavailable
     */
    public <T extends Provider> Optional<T> resolve(String name, Class<T> type) {
        Provider provider = providers.get(name);
        if (provider == null) {
            log.debug("Provider '{}' is not installed", name);
            return Optional.empty();
        }
        if (!type.isInstance(provider)) {
            log.warn("Provider '{}' is a {} provider, not usable as {}",
                    name, provider.capability(), type.getSimpleName());
            return Optional.empty();
        }
        ProviderAvailability availability = availability(provider);
        if (!availability.available()) {
            log.info("Provider '{}' unavailable: {}", name, availability.reason());
            return Optional.empty();
        }
        return Optional.of(type.cast(provider));
    }

    /** Mark a provider down until its next scheduled probe. */
    public void markUnavailable(String name, String reason) {
        probes.put(name, new Probe(ProviderAvailability.down(reason), clock.instant()));
    }

    /** Probe every provider now; called once at startup. */
    public void probeAll() {
        providers.values().forEach(p -> {
            ProviderAvailability a = refresh(p);
            if (a.available()) {
                log.info("Provider '{}' is available", p.name());
            } else {
                log.warn("Provider '{}' is unavailable: {}", p.name(), a.reason());
            }
        });
    }

    /** Current status of all providers, sorted by name. */
    public List<ProviderStatus> statuses() {
        return providers.values().stream()
                .sorted(Comparator.comparing(Provider::name))
                .map(p -> {
                    availability(p);
                    Probe probe = probes.get(p.name());
                    return new ProviderStatus(p.name(), p.capability(),
                            probe.availability().available(), probe.availability().reason(),
                            probe.checkedAt());
                })
                .toList();
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented invocation
    // ------------------------------------------------------------------

    /**
     * Invoke a provider with full observability.
     *
     * <pre>
     *   verity.provider.calls{provider, outcome="success|transient|rate_limited|timeout|unavailable"}
     *   verity.provider.duration{provider, capability}
     * </pre>
     *
     * @throws ProviderException for every failure; unexpected exceptions become TRANSIENT
     */
    public <T> T call(Provider provider, Supplier<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return call.get();
        } catch (ProviderException e) {
            outcome = e.getKind().name().toLowerCase(Locale.ROOT);
            if (e.getKind() == ProviderException.Kind.UNAVAILABLE) {
                markUnavailable(provider.name(), e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            outcome = "transient";
            throw new ProviderException(ProviderException.Kind.TRANSIENT,
                    "Unexpected error in provider '" + provider.name() + "': " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("verity.provider.duration",
                    "provider", provider.name(),
                    "capability", provider.capability().name().toLowerCase(Locale.ROOT)));
            meterRegistry.counter("verity.provider.calls",
                    "provider", provider.name(), "outcome", outcome).increment();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ProviderAvailability availability(Provider provider) {
        Probe cached = probes.get(provider.name());
        if (cached != null && cached.checkedAt().plus(healthTtl).isAfter(clock.instant())) {
            return cached.availability();
        }
        return refresh(provider);
    }

    private ProviderAvailability refresh(Provider provider) {
        ProviderAvailability a;
        try {
            a = provider.probe();
            if (a == null) {
                a = ProviderAvailability.down("probe returned no status");
            }
        } catch (RuntimeException e) {
            log.warn("Probe of provider '{}' threw: {}", provider.name(), e.getMessage(), e);
            a = ProviderAvailability.down("probe failed: " + e.getMessage());
        }
        probes.put(provider.name(), new Probe(a, clock.instant()));
        return a;
    }
}
