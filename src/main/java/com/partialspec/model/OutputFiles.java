package com.partialspec.model;

import java.nio.file.Path;

/**
 * Where the two representations of a partial spec were written.
 */
public record OutputFiles(Path json, Path yaml) {
}
