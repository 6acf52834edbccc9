package com.partialspec.dto.response;

import com.partialspec.model.OutputFiles;
import com.partialspec.model.PartialSpecResult;
import com.partialspec.model.PartialSpecSummary;
import java.util.List;

/**
 * What the {@code generate} command reports back after writing a partial spec.
 *
 * @param result   The generator output, including the decision log.
 * @param summary  Counts of the kept paths, operations and components.
 * @param warnings Every non-fatal condition of the run, loader and structure check included.
 * @param files    Where the JSON and YAML forms were written.
 */
public record GenerateReport(PartialSpecResult result, PartialSpecSummary summary,
                             List<String> warnings, OutputFiles files) {

    public GenerateReport {
        warnings = List.copyOf(warnings);
    }
}
