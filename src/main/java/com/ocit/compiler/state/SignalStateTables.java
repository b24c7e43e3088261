package com.ocit.compiler.state;

import java.util.Map;

/**
 * Static translation tables from OCIT signal pictures to SUMO state letters.
 *
 * SUMO letters: G major green, g minor green, y yellow, r red, u red-yellow,
 * O off (dark), o off blinking.
 */
public final class SignalStateTables {

    public static final char MAJOR_GREEN = 'G';
    public static final char MINOR_GREEN = 'g';
    public static final char YELLOW = 'y';
    public static final char RED = 'r';
    public static final char RED_YELLOW = 'u';
    public static final char DARK = 'O';
    public static final char OFF_BLINKING = 'o';

    /**
     * Single OCIT picture token (named color or hex code) to SUMO letter.
     */
    public static final Map<String, Character> SIGNAL_COLORS = Map.ofEntries(
            Map.entry("gruen", MAJOR_GREEN),
            Map.entry("gelb", YELLOW),
            Map.entry("rot", RED),
            Map.entry("rotgelb", RED_YELLOW),
            Map.entry("dunkel", DARK),
            Map.entry("gelbblk", OFF_BLINKING),
            Map.entry("00", OFF_BLINKING),
            Map.entry("08", OFF_BLINKING),
            Map.entry("03", RED),
            Map.entry("30", MAJOR_GREEN),
            Map.entry("0F", RED_YELLOW),
            Map.entry("0C", YELLOW));

    /**
     * Observed letter combinations of groups sharing one link index (in slot
     * order) to the single letter SUMO should show.
     */
    public static final Map<String, Character> COMPLEX_STATES = Map.ofEntries(
            Map.entry("rO", 'r'),
            Map.entry("Or", 'r'),
            Map.entry("ro", 'r'),
            Map.entry("rG", 'r'),
            Map.entry("Go", 'g'),
            Map.entry("go", 'g'),
            Map.entry("gO", 'g'),
            Map.entry("OG", 'G'),
            Map.entry("Gr", 'G'),
            Map.entry("GO", 'G'),
            Map.entry("yG", 'y'),
            Map.entry("yo", 'y'),
            Map.entry("yO", 'y'),
            Map.entry("yr", 'r'),
            Map.entry("uG", 'u'),
            Map.entry("uo", 'u'),
            Map.entry("uO", 'u'),
            Map.entry("ur", 'r'),

            Map.entry("rro", 'r'),
            Map.entry("rrO", 'r'),
            Map.entry("rOo", 'r'),
            Map.entry("rGo", 'r'),
            Map.entry("rGO", 'r'),
            Map.entry("rOO", 'r'),
            Map.entry("roO", 'r'),
            Map.entry("rOG", 'r'),
            Map.entry("OOr", 'r'),
            Map.entry("OGo", 'g'),
            Map.entry("OGO", 'G'),
            Map.entry("OrO", 'r'),
            Map.entry("gOo", 'g'),
            Map.entry("gGO", 'G'),
            Map.entry("Goo", 'G'),
            Map.entry("GoO", 'g'),
            Map.entry("GOo", 'g'),
            Map.entry("GOO", 'g'),
            Map.entry("goO", 'g'),
            Map.entry("GoG", 'G'),
            Map.entry("GOG", 'G'),
            Map.entry("GGO", 'G'),
            Map.entry("GGo", 'g'),
            Map.entry("GrO", 'G'),
            Map.entry("rGG", 'g'),
            Map.entry("uGO", 'G'),
            Map.entry("uoO", 'u'),
            Map.entry("uGG", 'u'),
            Map.entry("yOG", 'y'),
            Map.entry("yGo", 'y'),
            Map.entry("yGO", 'y'),
            Map.entry("yGG", 'y'),
            Map.entry("Ogo", 'g'),
            Map.entry("OgO", 'g'),
            Map.entry("Oro", 'r'),
            Map.entry("Orr", 'r'),
            Map.entry("OGr", 'G'),
            Map.entry("Grr", 'G'),
            Map.entry("rgO", 'r'),
            Map.entry("rgo", 'r'),
            Map.entry("Gro", 'G'),
            Map.entry("OrG", 'r'),
            Map.entry("uOG", 'u'));

    private SignalStateTables() {
        // Constant tables
    }

    public static boolean isGreen(char letter) {
        return letter == MAJOR_GREEN || letter == MINOR_GREEN;
    }
}
