package com.vidnyan.lintnorm.domain.violation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Violations grouped by normalized repository-relative path.
 * <p>
 * Keys keep the order in which paths were first seen, and each list keeps the
 * order in which its violations appeared in the tool output. A path may be
 * present with an empty list when the format reports a file without issues.
 * Instances are created fresh for every parse and are not shared.
 */
public final class ViolationsByPath {

    private final Map<String, List<Violation>> byPath = new LinkedHashMap<>();

    public static ViolationsByPath empty() {
        return new ViolationsByPath();
    }

    /**
     * Append a violation, creating the path entry on first use.
     */
    public void add(String path, Violation violation) {
        Objects.requireNonNull(violation, "violation");
        listFor(path).add(violation);
    }

    /**
     * Make sure the path has an entry, even if nothing is ever added to it.
     */
    public void touch(String path) {
        listFor(path);
    }

    /**
     * Set the violations of a path, discarding any earlier ones.
     * The path keeps its original position if it was already present.
     */
    public void replace(String path, List<Violation> violations) {
        Objects.requireNonNull(path, "path");
        byPath.put(path, new ArrayList<>(violations));
    }

    public List<Violation> get(String path) {
        List<Violation> violations = byPath.get(path);
        return violations == null ? List.of() : Collections.unmodifiableList(violations);
    }

    public boolean contains(String path) {
        return byPath.containsKey(path);
    }

    public Set<String> paths() {
        return Collections.unmodifiableSet(byPath.keySet());
    }

    public int size() {
        return byPath.size();
    }

    public boolean isEmpty() {
        return byPath.isEmpty();
    }

    /**
     * Total number of violations across all paths.
     */
    public int violationCount() {
        return byPath.values().stream().mapToInt(List::size).sum();
    }

    @JsonValue
    public Map<String, List<Violation>> asMap() {
        Map<String, List<Violation>> view = new LinkedHashMap<>();
        byPath.forEach((path, violations) -> view.put(path, Collections.unmodifiableList(violations)));
        return Collections.unmodifiableMap(view);
    }

    private List<Violation> listFor(String path) {
        Objects.requireNonNull(path, "path");
        return byPath.computeIfAbsent(path, k -> new ArrayList<>());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ViolationsByPath other)) return false;
        return byPath.equals(other.byPath);
    }

    @Override
    public int hashCode() {
        return byPath.hashCode();
    }

    @Override
    public String toString() {
        return byPath.toString();
    }
}
