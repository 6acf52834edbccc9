package com.partialspec.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised settings for a partial spec run, bound from {@code partial-spec.*}.
 * <p>
 * Artifact names follow the layout of the CI job that produces them: the two interface
 * documents are given as base names and resolved to {@code .yaml} or {@code .json}
 * depending on which file exists.
 */
@Data
@ConfigurationProperties(prefix = "partial-spec")
public class PartialSpecProperties {

    /** Directory holding the diff and the before/after documents. */
    private String artifactDir = ".";

    /** Legacy-operations document, relative to the artifact directory unless absolute. */
    private String baselineFile = "swagger_baseline.json";

    /** Output of the structural diff tool. */
    private String diffFile = "diff.json";

    /** Base name (or file name) of the document for the previous version. */
    private String beforeDocument = "swagger_main";

    /** Base name (or file name) of the document for the new version. */
    private String afterDocument = "swagger_head";

    /** Where to write the partial spec; defaults to the artifact directory. */
    private String outputDir;

    private String jsonOutputFile = "partial_spec.json";

    private String yamlOutputFile = "partial_spec.yaml";

    private String outputTitle = "Changed-Only API Spec";

    private String outputVersion = "1.0.0";

    /** Add a placeholder default response to included operations that declare no success response. */
    private boolean synthesizeDefaultResponse = true;

    /** Parse the emitted document with swagger-parser and report its messages as warnings. */
    private boolean structureCheck = true;
}
