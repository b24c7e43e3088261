package com.ocit.compiler.model;

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * Normalized transition timeline: one {@link StateVector} per tick.
 *
 * Immutable; corrections are applied through {@link #toBuilder()}.
 */
@EqualsAndHashCode
public final class StateTimeline {

    private final List<StateVector> ticks;

    private StateTimeline(List<StateVector> ticks) {
        this.ticks = ticks;
    }

    public static StateTimeline of(@NonNull List<StateVector> ticks) {
        return new StateTimeline(List.copyOf(ticks));
    }

    public static StateTimeline of(String... ticks) {
        List<StateVector> vectors = new ArrayList<>();
        for (String tick : ticks) {
            vectors.add(StateVector.of(tick));
        }
        return new StateTimeline(List.copyOf(vectors));
    }

    public int length() {
        return ticks.size();
    }

    public StateVector tick(int tick) {
        return ticks.get(tick);
    }

    public char letter(int tick, int index) {
        return ticks.get(tick).letterAt(index);
    }

    public List<StateVector> ticks() {
        return ticks;
    }

    /**
     * Letters of one link index over all ticks, e.g. "rruG".
     */
    public String column(int index) {
        StringBuilder sb = new StringBuilder(ticks.size());
        for (StateVector tick : ticks) {
            sb.append(tick.letterAt(index));
        }
        return sb.toString();
    }

    public Builder toBuilder() {
        return new Builder(ticks);
    }

    @Override
    public String toString() {
        return ticks.toString();
    }

    public static final class Builder {

        private final char[][] rows;

        private Builder(List<StateVector> ticks) {
            rows = new char[ticks.size()][];
            for (int t = 0; t < rows.length; t++) {
                rows[t] = ticks.get(t).toCharArray();
            }
        }

        public int length() {
            return rows.length;
        }

        public char letter(int tick, int index) {
            return rows[tick][index];
        }

        public Builder set(int tick, int index, char letter) {
            rows[tick][index] = letter;
            return this;
        }

        public StateTimeline build() {
            List<StateVector> vectors = new ArrayList<>(rows.length);
            for (char[] row : rows) {
                vectors.add(StateVector.of(row));
            }
            return new StateTimeline(List.copyOf(vectors));
        }
    }
}
