package com.verityngn.orchestrator.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, immutable list of stages. Built once from configuration; a job
 * may run a copy with per-stage overrides applied, but stage order and
 * names never change at runtime.
 */
public final class PipelineDefinition {

    private final List<Stage> stages;

    public PipelineDefinition(List<Stage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("pipeline must define at least one stage");
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < stages.size(); i++) {
            Stage s = stages.get(i);
            if (!names.add(s.name())) {
                throw new IllegalArgumentException("duplicate stage name '" + s.name() + "'");
            }
            if (s.ordinal() != i) {
                throw new IllegalArgumentException("stage '" + s.name() + "' has ordinal "
                        + s.ordinal() + " but sits at position " + i);
            }
            if (s.inputStage() != null && !names.contains(s.inputStage())) {
                throw new IllegalArgumentException("stage '" + s.name()
                        + "' reads from '" + s.inputStage() + "' which does not run before it");
            }
        }
        this.stages = List.copyOf(stages);
    }

    public int size()               { return stages.size(); }
    public Stage stage(int index)   { return stages.get(index); }
    public List<Stage> stages()     { return stages; }

    public boolean contains(String stageName) {
        return stages.stream().anyMatch(s -> s.name().equals(stageName));
    }

    /** Names of stages whose result must be present before a report can be assembled. */
    public List<String> requiredStageNames() {
        return stages.stream().filter(s -> !s.optional()).map(Stage::name).toList();
    }

    /**
     * Copy of this pipeline with per-job overrides applied. Overrides naming
     * unknown stages are ignored.
     *
     * @throws IllegalArgumentException when an override produces an invalid stage
     */
    public PipelineDefinition withOverrides(Map<String, StageOverride> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        List<Stage> copy = new ArrayList<>(stages.size());
        for (Stage s : stages) {
            copy.add(s.withOverride(overrides.get(s.name())));
        }
        return new PipelineDefinition(copy);
    }
}
