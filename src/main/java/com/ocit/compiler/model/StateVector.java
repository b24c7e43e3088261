package com.ocit.compiler.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * SUMO state string: one simulator letter per link index, in ascending index order.
 *
 * Two vectors are equal when their letter sequences are equal.
 */
@EqualsAndHashCode
public final class StateVector {

    private final String letters;

    private StateVector(String letters) {
        this.letters = letters;
    }

    public static StateVector of(@NonNull String letters) {
        return new StateVector(letters);
    }

    public static StateVector of(char[] letters) {
        return new StateVector(new String(letters));
    }

    public int length() {
        return letters.length();
    }

    public char letterAt(int index) {
        return letters.charAt(index);
    }

    public char[] toCharArray() {
        return letters.toCharArray();
    }

    public String letters() {
        return letters;
    }

    @Override
    public String toString() {
        return letters;
    }
}
