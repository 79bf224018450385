package org.introspect.rewriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered set of display styles handed out to entities, plus the style of the failure marker.
 */
public final class Palette {
    private static final String[] ANSI_STYLES = {
            "\033[32m",
            "\033[33m",
            "\033[34m",
            "\033[35m",
            "\033[36m",
            "\033[1;32m",
            "\033[1;33m",
            "\033[1;35m"
    };
    private static final String HIGHLIGHT = "\033[1;31m";

    private final List<Color> colors;
    private final String highlight;

    private Palette(List<Color> colors, String highlight) {
        this.colors = Collections.unmodifiableList(colors);
        this.highlight = highlight;
    }

    public static Palette ansi() {
        List<Color> colors = new ArrayList<>(ANSI_STYLES.length);
        for (int i = 0; i < ANSI_STYLES.length; i++) {
            colors.add(new Color(i, ANSI_STYLES[i]));
        }
        return new Palette(colors, HIGHLIGHT);
    }

    public static Palette monochrome() {
        return new Palette(new ArrayList<>(), null);
    }

    public static Palette forDefaults(RewriteDefaults defaults) {
        return defaults.colorsEnabled() ? ansi() : monochrome();
    }

    public int size() {
        return colors.size();
    }

    public Color get(int slot) {
        return colors.get(slot);
    }

    public String highlight(String text) {
        return highlight == null ? text : highlight + text + Color.RESET;
    }
}
