package com.verityngn.orchestrator.report;

public class ArtifactNotFoundException extends RuntimeException {

    public ArtifactNotFoundException(String uri) {
        super("No artifact at " + uri);
    }
}
