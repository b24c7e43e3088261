package com.ocit.compiler.model;

import java.util.Arrays;
import java.util.List;

import lombok.EqualsAndHashCode;

/**
 * For every link index, the ordered letters contributed by the signal groups
 * sharing that index (one slot per group, ordered by group priority).
 *
 * Immutable; {@link #withSlot} returns a copy.
 */
@EqualsAndHashCode
public final class ComplexStateVector {

    private final String[] complexStates;

    private ComplexStateVector(String[] complexStates) {
        this.complexStates = complexStates;
    }

    public static ComplexStateVector of(List<String> complexStates) {
        return new ComplexStateVector(complexStates.toArray(new String[0]));
    }

    public static ComplexStateVector of(String... complexStates) {
        return new ComplexStateVector(complexStates.clone());
    }

    /**
     * Vector whose index {@code i} holds {@code slotCounts[i]} copies of {@code letter}.
     */
    public static ComplexStateVector filled(int[] slotCounts, char letter) {
        String[] states = new String[slotCounts.length];
        for (int i = 0; i < slotCounts.length; i++) {
            states[i] = String.valueOf(letter).repeat(slotCounts[i]);
        }
        return new ComplexStateVector(states);
    }

    public int size() {
        return complexStates.length;
    }

    /**
     * Concatenated letters of all groups at {@code index}, e.g. "rO".
     */
    public String complexState(int index) {
        return complexStates[index];
    }

    public char slot(int index, int slot) {
        return complexStates[index].charAt(slot);
    }

    public ComplexStateVector withSlot(int index, int slot, char letter) {
        String[] copy = complexStates.clone();
        char[] chars = copy[index].toCharArray();
        chars[slot] = letter;
        copy[index] = new String(chars);
        return new ComplexStateVector(copy);
    }

    public int[] slotCounts() {
        int[] counts = new int[complexStates.length];
        for (int i = 0; i < complexStates.length; i++) {
            counts[i] = complexStates[i].length();
        }
        return counts;
    }

    public List<String> asList() {
        return List.of(complexStates);
    }

    @Override
    public String toString() {
        return Arrays.toString(complexStates);
    }
}
