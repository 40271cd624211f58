package com.verityngn.orchestrator.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Persistence step around the pure assembler: canonical JSON out to the
 * artifact store, and back in for the API.
 *
 * Canonical means sorted property names and sorted map keys with no
 * indentation, so equal reports always produce equal bytes.
 */
public class ReportPublisher {

    private final ArtifactStore artifacts;
    private final ObjectMapper  canonical = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public ReportPublisher(ArtifactStore artifacts) {
        this.artifacts = artifacts;
    }

    public byte[] toBytes(Report report) {
        try {
            return canonical.writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise report for job " + report.jobId(), e);
        }
    }

    /** @return artifact reference to record on the job */
    public String publish(Report report) {
        String key = "reports/" + report.jobId() + (report.partial() ? "-partial" : "") + ".json";
        return artifacts.put(toBytes(report), key);
    }

    public JsonNode read(String reference) {
        try {
            return canonical.readTree(artifacts.get(reference));
        } catch (IOException e) {
            throw new UncheckedIOException("Corrupt report artifact " + reference, e);
        }
    }
}
