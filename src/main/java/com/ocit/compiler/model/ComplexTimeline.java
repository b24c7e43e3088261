package com.ocit.compiler.model;

import java.util.Arrays;

/**
 * Per-tick complex states of one transition, stored as a flat arena of cells
 * addressed by (tick, index, slot).
 *
 * Instances are immutable. Edits go through {@link #toCells()} and come back
 * as a new timeline via {@link Cells#build()}.
 */
public final class ComplexTimeline {

    private final int ticks;
    private final int[] slotCounts;
    private final int[] offsets;
    private final int width;
    private final char[] cells;

    private ComplexTimeline(int ticks, int[] slotCounts, char[] cells) {
        this.ticks = ticks;
        this.slotCounts = slotCounts;
        this.offsets = new int[slotCounts.length];
        int cursor = 0;
        for (int i = 0; i < slotCounts.length; i++) {
            offsets[i] = cursor;
            cursor += slotCounts[i];
        }
        this.width = cursor;
        this.cells = cells;
    }

    /**
     * Timeline of {@code ticks} ticks, each a copy of {@code initial}.
     */
    public static ComplexTimeline replicate(ComplexStateVector initial, int ticks) {
        int[] slotCounts = initial.slotCounts();
        int width = Arrays.stream(slotCounts).sum();
        char[] row = new char[width];
        int cursor = 0;
        for (int i = 0; i < initial.size(); i++) {
            for (int s = 0; s < slotCounts[i]; s++) {
                row[cursor++] = initial.slot(i, s);
            }
        }
        char[] cells = new char[ticks * width];
        for (int t = 0; t < ticks; t++) {
            System.arraycopy(row, 0, cells, t * width, width);
        }
        return new ComplexTimeline(ticks, slotCounts, cells);
    }

    public int ticks() {
        return ticks;
    }

    public char letter(int tick, int index, int slot) {
        return cells[cell(tick, index, slot)];
    }

    public ComplexStateVector tick(int tick) {
        String[] states = new String[slotCounts.length];
        for (int i = 0; i < slotCounts.length; i++) {
            int start = tick * width + offsets[i];
            states[i] = new String(cells, start, slotCounts[i]);
        }
        return ComplexStateVector.of(states);
    }

    public Cells toCells() {
        return new Cells(cells.clone());
    }

    private int cell(int tick, int index, int slot) {
        if (tick < 0 || tick >= ticks || slot < 0 || slot >= slotCounts[index]) {
            throw new IndexOutOfBoundsException("No cell (" + tick + ", " + index + ", " + slot + ")");
        }
        return tick * width + offsets[index] + slot;
    }

    /**
     * Mutable working copy of a timeline's cells.
     */
    public final class Cells {

        private final char[] data;

        private Cells(char[] data) {
            this.data = data;
        }

        public Cells set(int tick, int index, int slot, char letter) {
            data[cell(tick, index, slot)] = letter;
            return this;
        }

        /**
         * Overwrites the slot from {@code fromTick} up to the last tick.
         */
        public Cells fillFrom(int fromTick, int index, int slot, char letter) {
            for (int t = Math.max(0, fromTick); t < ticks; t++) {
                set(t, index, slot, letter);
            }
            return this;
        }

        public ComplexTimeline build() {
            return new ComplexTimeline(ticks, slotCounts, data.clone());
        }
    }
}
