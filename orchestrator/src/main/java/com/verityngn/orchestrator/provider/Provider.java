package com.verityngn.orchestrator.provider;

/**
 * A pluggable external capability usable by pipeline stages. Stage fallback
 * chains refer to providers by {@link #name()}.
 *
 * Routine absence of a capability, such as a backend that is not configured
 * or not reachable, is reported by {@link #probe()} and never by throwing.
 * Implementations pick local or remote execution at construction time; the
 * executor only sees this interface.
 */
public interface Provider {

    /** Unique name referenced from stage fallback chains. */
    String name();

    Capability capability();

    /** Cheap health check; must not throw for a missing or misconfigured backend. */
    ProviderAvailability probe();
}
