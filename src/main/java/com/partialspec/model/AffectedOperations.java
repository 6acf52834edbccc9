package com.partialspec.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Operations judged changed or added by either detection phase, together with the
 * sources that flagged each of them. Instances are immutable; use {@link #builder()}.
 */
public final class AffectedOperations {

    private final SortedMap<OperationKey, Set<DetectionSource>> sources;

    private AffectedOperations(SortedMap<OperationKey, Set<DetectionSource>> sources) {
        this.sources = Collections.unmodifiableSortedMap(sources);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AffectedOperations empty() {
        return new AffectedOperations(new TreeMap<>());
    }

    public SortedSet<OperationKey> keys() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(sources.keySet()));
    }

    public boolean contains(OperationKey key) {
        return sources.containsKey(key);
    }

    public Set<DetectionSource> sourcesOf(OperationKey key) {
        Set<DetectionSource> found = sources.get(key);
        return found == null ? Collections.emptySet() : Collections.unmodifiableSet(found);
    }

    /**
     * @return A short, comma separated list of detection sources, e.g. "structural diff, modified operation".
     */
    public String describeSources(OperationKey key) {
        return sourcesOf(key).stream()
                .map(DetectionSource::description)
                .collect(Collectors.joining(", "));
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    public static final class Builder {

        private final SortedMap<OperationKey, Set<DetectionSource>> sources = new TreeMap<>();

        private Builder() {
        }

        public Builder add(OperationKey key, DetectionSource source) {
            sources.computeIfAbsent(key, k -> EnumSet.noneOf(DetectionSource.class)).add(source);
            return this;
        }

        public AffectedOperations build() {
            SortedMap<OperationKey, Set<DetectionSource>> copy = new TreeMap<>();
            for (Map.Entry<OperationKey, Set<DetectionSource>> entry : sources.entrySet()) {
                copy.put(entry.getKey(), EnumSet.copyOf(entry.getValue()));
            }
            return new AffectedOperations(copy);
        }
    }
}
