package com.partialspec.dto.request;

/**
 * Artifact locations for one run, as given on the command line. Any {@code null}
 * component falls back to the configured default.
 *
 * @param artifactDir Directory holding the diff and the before/after documents.
 * @param baseline    The legacy-operations document.
 * @param diff        The structural diff artifact.
 * @param before      Base name or file name of the previous version's document.
 * @param after       Base name or file name of the new version's document.
 * @param outputDir   Where the partial spec is written.
 */
public record GenerateRequest(String artifactDir, String baseline, String diff,
                              String before, String after, String outputDir) {

    public static GenerateRequest defaults() {
        return new GenerateRequest(null, null, null, null, null, null);
    }
}
