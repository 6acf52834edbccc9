package com.partialspec.service.api;

import com.partialspec.model.PartialSpecInput;
import com.partialspec.model.PartialSpecResult;

/**
 * The core engine: a pure function from the four inputs to the minimal partial spec.
 * Identical inputs always produce an equal document.
 */
public interface PartialSpecGenerator {

    PartialSpecResult generate(PartialSpecInput input);
}
