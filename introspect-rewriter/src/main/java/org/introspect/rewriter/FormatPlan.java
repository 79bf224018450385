package org.introspect.rewriter;

/**
 * How one leaf value is printed: a printf conversion (possibly quoted) and the cast text of an implicit
 * conversion, if the value went through one.
 */
public final class FormatPlan {
    private final String specifier;
    private final String castPrefix;

    public FormatPlan(String specifier, String castPrefix) {
        this.specifier = specifier;
        this.castPrefix = castPrefix;
    }

    public String getSpecifier() {
        return specifier;
    }

    public String getCastPrefix() {
        return castPrefix;
    }

    /**
     * Format text for the value, with the cast prefix in front and the conversion in the given color. The
     * cast text is escaped for use inside a format string.
     */
    public String render(Color color) {
        String cast = castPrefix == null ? "" : escape(castPrefix);
        return cast + Color.paint(color, specifier);
    }

    public static String escape(String text) {
        return text.replace("%", "%%");
    }

    @Override
    public String toString() {
        return castPrefix == null ? specifier : castPrefix + specifier;
    }
}
