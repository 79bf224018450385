package org.introspect.rewriter;

import org.junit.After;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class RewriteDefaultsTest {

    @After
    public void clearProperties() {
        System.clearProperty("introspect.rewrite.colors");
        System.clearProperty("introspect.rewrite.bufferSize");
        System.clearProperty("introspect.rewrite.subexpressionBufferSize");
        System.clearProperty("introspect.rewrite.showStaticCasts");
        System.clearProperty("introspect.rewrite.abortName");
    }

    @Test
    public void unsetValuesUseDefaults() {
        RewriteDefaults defaults = new RewriteDefaults();

        assertThat(defaults.colorsEnabled()).isTrue();
        assertThat(defaults.bufferSizeOrDefault()).isEqualTo(1024);
        assertThat(defaults.subexpressionBufferSizeOrDefault()).isEqualTo(1024);
        assertThat(defaults.showStaticCastsEnabled()).isFalse();
        assertThat(defaults.assertFailNameOrDefault()).isEqualTo("__assert_fail");
        assertThat(defaults.printfNameOrDefault()).isEqualTo("printf");
        assertThat(defaults.snprintfNameOrDefault()).isEqualTo("snprintf");
        assertThat(defaults.abortNameOrDefault()).isEqualTo("abort");
    }

    @Test
    public void readsSystemProperties() {
        System.setProperty("introspect.rewrite.colors", "no");
        System.setProperty("introspect.rewrite.bufferSize", " 256 ");
        System.setProperty("introspect.rewrite.abortName", "panic");

        RewriteDefaults defaults = RewriteDefaults.fromSystemEnv();

        assertThat(defaults.getColors()).isFalse();
        assertThat(defaults.getBufferSize()).isEqualTo(256);
        assertThat(defaults.abortNameOrDefault()).isEqualTo("panic");
    }

    @Test
    public void ignoresMalformedNumbers() {
        System.setProperty("introspect.rewrite.bufferSize", "big");

        assertThat(RewriteDefaults.fromSystemEnv().getBufferSize()).isNull();
    }

    @Test
    public void buffersTooSmallForOneCharacterAreIgnored() {
        System.setProperty("introspect.rewrite.bufferSize", "1");
        System.setProperty("introspect.rewrite.subexpressionBufferSize", "-8");
        System.setProperty("introspect.rewrite.showStaticCasts", "on");

        RewriteDefaults fromProperties = RewriteDefaults.fromSystemEnv();

        assertThat(fromProperties.getBufferSize()).isNull();
        assertThat(fromProperties.getSubexpressionBufferSize()).isNull();
        assertThat(fromProperties.showStaticCastsEnabled()).isTrue();

        RewriteDefaults configured = new RewriteDefaults();
        configured.setBufferSize(0);
        configured.setSubexpressionBufferSize(2);

        assertThat(configured.bufferSizeOrDefault()).isEqualTo(RewriteDefaults.DEFAULT_BUFFER_SIZE);
        assertThat(configured.subexpressionBufferSizeOrDefault()).isEqualTo(2);
    }

    @Test
    public void overridesWinWhenSet() {
        RewriteDefaults base = new RewriteDefaults();
        base.setColors(false);
        base.setBufferSize(64);
        RewriteDefaults overrides = new RewriteDefaults();
        overrides.setBufferSize(128);

        RewriteDefaults merged = base.merge(overrides);

        assertThat(merged.getColors()).isFalse();
        assertThat(merged.getBufferSize()).isEqualTo(128);
        assertThat(base.merge(null)).isSameAs(base);
    }
}
