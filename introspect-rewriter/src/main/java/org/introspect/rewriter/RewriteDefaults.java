package org.introspect.rewriter;

import java.util.Locale;

public final class RewriteDefaults {
    public static final boolean DEFAULT_COLORS = true;
    public static final int DEFAULT_BUFFER_SIZE = 1024;
    public static final int DEFAULT_SUBEXPRESSION_BUFFER_SIZE = 1024;
    public static final boolean DEFAULT_SHOW_STATIC_CASTS = false;
    public static final String DEFAULT_ASSERT_FAIL_NAME = "__assert_fail";
    public static final String DEFAULT_PRINTF_NAME = "printf";
    public static final String DEFAULT_SNPRINTF_NAME = "snprintf";
    public static final String DEFAULT_ABORT_NAME = "abort";
    public static final int MIN_BUFFER_SIZE = 2;

    private static final String PROPERTY_PREFIX = "introspect.rewrite.";
    private static final String ENV_PREFIX = "AI_REWRITE_";

    private Boolean colors;
    private Integer bufferSize;
    private Integer subexpressionBufferSize;
    private Boolean showStaticCasts;
    private String assertFailName;
    private String printfName;
    private String snprintfName;
    private String abortName;

    public static RewriteDefaults fromSystemEnv() {
        RewriteDefaults defaults = new RewriteDefaults();
        defaults.colors = readBoolean("colors");
        defaults.bufferSize = readBufferSize("bufferSize");
        defaults.subexpressionBufferSize = readBufferSize("subexpressionBufferSize");
        defaults.showStaticCasts = readBoolean("showStaticCasts");
        defaults.assertFailName = readSetting("assertFailName");
        defaults.printfName = readSetting("printfName");
        defaults.snprintfName = readSetting("snprintfName");
        defaults.abortName = readSetting("abortName");
        return defaults;
    }

    public RewriteDefaults merge(RewriteDefaults overrides) {
        if (overrides == null) {
            return this;
        }
        RewriteDefaults merged = new RewriteDefaults();
        merged.colors = overrides.colors != null ? overrides.colors : colors;
        merged.bufferSize = overrides.bufferSize != null ? overrides.bufferSize : bufferSize;
        merged.subexpressionBufferSize = overrides.subexpressionBufferSize != null
                ? overrides.subexpressionBufferSize : subexpressionBufferSize;
        merged.showStaticCasts = overrides.showStaticCasts != null ? overrides.showStaticCasts : showStaticCasts;
        merged.assertFailName = overrides.assertFailName != null ? overrides.assertFailName : assertFailName;
        merged.printfName = overrides.printfName != null ? overrides.printfName : printfName;
        merged.snprintfName = overrides.snprintfName != null ? overrides.snprintfName : snprintfName;
        merged.abortName = overrides.abortName != null ? overrides.abortName : abortName;
        return merged;
    }

    public boolean colorsEnabled() {
        return colors != null ? colors : DEFAULT_COLORS;
    }

    public int bufferSizeOrDefault() {
        return isUsableBufferSize(bufferSize) ? bufferSize : DEFAULT_BUFFER_SIZE;
    }

    public int subexpressionBufferSizeOrDefault() {
        return isUsableBufferSize(subexpressionBufferSize) ? subexpressionBufferSize
                : DEFAULT_SUBEXPRESSION_BUFFER_SIZE;
    }

    public boolean showStaticCastsEnabled() {
        return showStaticCasts != null ? showStaticCasts : DEFAULT_SHOW_STATIC_CASTS;
    }

    public String assertFailNameOrDefault() {
        return assertFailName != null ? assertFailName : DEFAULT_ASSERT_FAIL_NAME;
    }

    public String printfNameOrDefault() {
        return printfName != null ? printfName : DEFAULT_PRINTF_NAME;
    }

    public String snprintfNameOrDefault() {
        return snprintfName != null ? snprintfName : DEFAULT_SNPRINTF_NAME;
    }

    public String abortNameOrDefault() {
        return abortName != null ? abortName : DEFAULT_ABORT_NAME;
    }

    public Boolean getColors() {
        return colors;
    }

    public void setColors(Boolean colors) {
        this.colors = colors;
    }

    public Integer getBufferSize() {
        return bufferSize;
    }

    public void setBufferSize(Integer bufferSize) {
        this.bufferSize = bufferSize;
    }

    public Integer getSubexpressionBufferSize() {
        return subexpressionBufferSize;
    }

    public void setSubexpressionBufferSize(Integer subexpressionBufferSize) {
        this.subexpressionBufferSize = subexpressionBufferSize;
    }

    public Boolean getShowStaticCasts() {
        return showStaticCasts;
    }

    public void setShowStaticCasts(Boolean showStaticCasts) {
        this.showStaticCasts = showStaticCasts;
    }

    public String getAssertFailName() {
        return assertFailName;
    }

    public void setAssertFailName(String assertFailName) {
        this.assertFailName = assertFailName;
    }

    public String getPrintfName() {
        return printfName;
    }

    public void setPrintfName(String printfName) {
        this.printfName = printfName;
    }

    public String getSnprintfName() {
        return snprintfName;
    }

    public void setSnprintfName(String snprintfName) {
        this.snprintfName = snprintfName;
    }

    public String getAbortName() {
        return abortName;
    }

    public void setAbortName(String abortName) {
        this.abortName = abortName;
    }

    /**
     * A report buffer has to hold at least one character and the terminating NUL.
     */
    private static boolean isUsableBufferSize(Integer size) {
        return size != null && size >= MIN_BUFFER_SIZE;
    }

    private static Boolean readBoolean(String setting) {
        String value = readSetting(setting);
        if (value == null) {
            return null;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "on":
            case "1":
                return Boolean.TRUE;
            case "false":
            case "no":
            case "off":
            case "0":
                return Boolean.FALSE;
            default:
                return null;
        }
    }

    private static Integer readBufferSize(String setting) {
        String value = readSetting(setting);
        if (value == null) {
            return null;
        }
        try {
            int size = Integer.parseInt(value);
            return size >= MIN_BUFFER_SIZE ? size : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * Reads {@code introspect.rewrite.<setting>}, falling back to {@code AI_REWRITE_<SETTING>} with the camel
     * case name split at each capital.
     */
    private static String readSetting(String setting) {
        String value = System.getProperty(PROPERTY_PREFIX + setting);
        if (value == null || value.trim().isEmpty()) {
            String envKey = ENV_PREFIX + setting.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase(Locale.ROOT);
            value = System.getenv(envKey);
        }
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
