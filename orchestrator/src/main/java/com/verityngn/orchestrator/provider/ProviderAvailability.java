package com.verityngn.orchestrator.provider;

/**
 * Result of {@link Provider#probe()}.
 *
 * @param available whether the provider can take calls right now
 * @param reason    why not, when unavailable
 */
public record ProviderAvailability(boolean available, String reason) {

    public static ProviderAvailability up() {
        return new ProviderAvailability(true, null);
    }

    public static ProviderAvailability down(String reason) {
        return new ProviderAvailability(false, reason);
    }
}
