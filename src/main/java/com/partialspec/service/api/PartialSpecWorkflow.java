package com.partialspec.service.api;

import com.partialspec.dto.request.GenerateRequest;
import com.partialspec.dto.response.DetectionReport;
import com.partialspec.dto.response.GenerateReport;
import com.partialspec.model.Baseline;

/**
 * Runs the engine against artifacts on disk: resolves and loads the inputs, generates,
 * checks and writes the partial spec.
 */
public interface PartialSpecWorkflow {

    /**
     * Produces and writes the partial spec. Nothing is written if any input fails to load.
     *
     * @param request Artifact locations; {@code null} entries use the configured defaults.
     * @return The decision log, warnings, summary and output locations.
     */
    GenerateReport generate(GenerateRequest request);

    /**
     * Runs change detection only.
     */
    DetectionReport detect(GenerateRequest request);

    /**
     * Loads the baseline the given request points at.
     */
    Baseline loadBaseline(GenerateRequest request);
}
