package com.verityngn.orchestrator.api;

import com.verityngn.orchestrator.provider.ProviderRegistry;
import com.verityngn.orchestrator.provider.ProviderStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** GET /providers — registered providers and their last known availability. */
@RestController
@RequestMapping("/providers")
public class ProviderController {

    private final ProviderRegistry registry;

    public ProviderController(ProviderRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<ProviderStatus> list() {
        return registry.statuses();
    }
}
