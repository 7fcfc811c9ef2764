package com.e2eq.obo.exceptions;

import java.util.List;

/**
 * Thrown when the resolved {@code is_a} edges do not form a DAG.
 * <p>
 * The cycle is reported in path order, starting and ending with the same id, e.g.
 * {@code [A, B, A]} for {@code A is_a B} and {@code B is_a A}.
 * </p>
 */
public class CycleDetectedException extends OboException {
    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super("Cycle detected in is_a hierarchy: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
