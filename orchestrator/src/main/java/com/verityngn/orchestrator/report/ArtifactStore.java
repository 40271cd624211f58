package com.verityngn.orchestrator.report;

/**
 * Blob store for finished reports.
 */
public interface ArtifactStore {

    /** Store {@code bytes} under {@code key}, replacing any previous content. */
    String put(byte[] bytes, String key);

    /** @throws ArtifactNotFoundException when nothing is stored at {@code uri} */
    byte[] get(String uri);
}
