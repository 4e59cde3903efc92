// file: core/src/main/java/io/schemasync/core/align/AlignmentReport.java
package io.schemasync.core.align;

import io.schemasync.core.live.MutationJournal.Kind;
import io.schemasync.core.live.MutationJournal.Outcome;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * What one alignment run did, in execution order.
 */
public final class AlignmentReport {

    private final List<Outcome> outcomes;

    public AlignmentReport(List<Outcome> outcomes) {
        this.outcomes = List.copyOf(outcomes);
    }

    public List<Outcome> outcomes() {
        return outcomes;
    }

    public List<Outcome> outcomes(Kind kind) {
        return outcomes.stream().filter(o -> o.kind() == kind).toList();
    }

    /** Number of changes actually applied to the server. Zero means the server already matched. */
    public int mutationCount() {
        return (int) outcomes.stream().filter(o -> o.kind().mutation()).count();
    }

    public boolean converged() {
        return outcomes.stream().allMatch(o -> o.kind().mutation());
    }

    /** One line per outcome kind that occurred, e.g. {@code "CREATED=3, DELETED=1"}. */
    public String summary() {
        if (outcomes.isEmpty()) return "no changes";
        Map<Kind, Integer> counts = new EnumMap<>(Kind.class);
        for (Outcome o : outcomes) {
            counts.merge(o.kind(), 1, Integer::sum);
        }
        StringBuilder sb = new StringBuilder();
        counts.forEach((k, n) -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(k).append('=').append(n);
        });
        return sb.toString();
    }

    @Override
    public String toString() {
        return "AlignmentReport{" + summary() + "}";
    }
}
