package com.partialspec.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.partialspec.model.Baseline;
import com.partialspec.model.OperationKey;
import com.partialspec.service.api.BaselineLoader;
import com.partialspec.service.api.DocumentLoader;
import com.partialspec.util.DocumentTrees;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class BaselineLoaderImpl implements BaselineLoader {

    private final DocumentLoader documentLoader;

    public BaselineLoaderImpl(DocumentLoader documentLoader) {
        this.documentLoader = documentLoader;
    }

    @Override
    public Baseline load(JsonNode baselineDocument) {
        Set<OperationKey> legacy = new TreeSet<>(DocumentTrees.operations(baselineDocument).keySet());
        log.info("Loaded {} legacy operations from baseline.", legacy.size());
        return Baseline.of(legacy);
    }

    /**
     * {@inheritDoc}
     * <p>
     * A missing baseline is not an error, but it is loud: with no legacy operations every
     * changed operation ends up strictly checked.
     */
    @Override
    public Baseline load(Path baselineFile) {
        log.info("Loading legacy baseline from: {}", baselineFile);
        Optional<ObjectNode> document = documentLoader.loadInterfaceDocument(baselineFile);
        if (document.isEmpty()) {
            log.warn("No baseline found at {}. Every changed operation will be strictly checked.", baselineFile);
            return Baseline.missing();
        }
        return load(document.get());
    }
}
