package com.partialspec.dto.response;

import com.partialspec.model.AffectedOperations;
import com.partialspec.model.Baseline;

/**
 * Result of running change detection alone, for inspection.
 */
public record DetectionReport(AffectedOperations affected, Baseline baseline) {
}
