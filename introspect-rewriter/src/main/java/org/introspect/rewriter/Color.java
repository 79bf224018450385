package org.introspect.rewriter;

/**
 * ANSI display style of one palette slot.
 */
public final class Color {
    public static final String RESET = "\033[0m";

    private final int slot;
    private final String escape;

    Color(int slot, String escape) {
        this.slot = slot;
        this.escape = escape;
    }

    public int getSlot() {
        return slot;
    }

    /**
     * Wraps text in the given style; a null color leaves the text plain.
     */
    public static String paint(Color color, String text) {
        if (color == null) {
            return text;
        }
        return color.escape + text + RESET;
    }

    @Override
    public String toString() {
        return "Color{" + slot + "}";
    }
}
