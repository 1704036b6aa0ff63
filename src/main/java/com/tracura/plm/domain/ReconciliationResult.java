package com.tracura.plm.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a reconciliation pass over one or more projects.
 */
public record ReconciliationResult(
    int projectsChecked,
    List<StatusTransition> transitions,
    List<String> expiredDelegations,
    List<String> conflicts,
    List<String> errors
) {
    public ReconciliationResult {
        transitions = List.copyOf(Objects.requireNonNullElse(transitions, Collections.emptyList()));
        expiredDelegations = List.copyOf(Objects.requireNonNullElse(expiredDelegations, Collections.emptyList()));
        conflicts = List.copyOf(Objects.requireNonNullElse(conflicts, Collections.emptyList()));
        errors = List.copyOf(Objects.requireNonNullElse(errors, Collections.emptyList()));
    }

    public static ReconciliationResult empty() {
        return new ReconciliationResult(0, List.of(), List.of(), List.of(), List.of());
    }

    public static ReconciliationResult failed(String error) {
        return new ReconciliationResult(1, List.of(), List.of(), List.of(), List.of(error));
    }

    public ReconciliationResult merge(ReconciliationResult other) {
        return new ReconciliationResult(
            projectsChecked + other.projectsChecked,
            concat(transitions, other.transitions),
            concat(expiredDelegations, other.expiredDelegations),
            concat(conflicts, other.conflicts),
            concat(errors, other.errors)
        );
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * True when the pass wrote nothing.
     */
    public boolean isNoOp() {
        return transitions.isEmpty() && expiredDelegations.isEmpty();
    }

    private static <T> List<T> concat(List<T> a, List<T> b) {
        var all = new ArrayList<T>(a);
        all.addAll(b);
        return all;
    }
}
