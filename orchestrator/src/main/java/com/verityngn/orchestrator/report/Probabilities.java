package com.verityngn.orchestrator.report;

/** Provider-estimated likelihoods for one claim, fractions in [0, 1]. */
public record Probabilities(double trueProbability, double falseProbability, double uncertainProbability) {}
