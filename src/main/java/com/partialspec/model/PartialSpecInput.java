package com.partialspec.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The four already-materialised inputs of one run. None of them is modified.
 *
 * @param baseline The legacy operations.
 * @param diff     The structural diff artifact; may be {@code null} or a missing node when absent.
 * @param before   The document of the previous version; may be {@code null} when absent.
 * @param after    The document of the new version. Required.
 */
public record PartialSpecInput(Baseline baseline, JsonNode diff, JsonNode before, JsonNode after) {
}
