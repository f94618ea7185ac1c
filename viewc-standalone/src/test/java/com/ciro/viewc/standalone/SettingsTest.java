package com.ciro.viewc.standalone;

import com.ciro.viewc.CompilerOptions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SettingsTest {

    @Test
    void classpathDefaultsMatchCompilerDefaults() {
        Settings s = Settings.load(Map.of());
        assertEquals(CompilerOptions.defaults(), s.compilerOptions());
        assertEquals(ProgramWriter.Format.TEXT, s.output());
        assertNull(s.get(Settings.RUN));
    }

    @Test
    void overridesWinOverProperties() {
        Settings s = Settings.load(Map.of(
                Settings.BULK_CLEAR, "false",
                Settings.EMIT_FLUSH, "false",
                Settings.SCOPE_ATTRIBUTE, "data-c",
                Settings.OUTPUT, "JSON"));

        CompilerOptions o = s.compilerOptions();
        assertEquals("data-c", o.scopeAttribute());
        assertFalse(o.bulkClear());
        assertFalse(o.emitFlush());
        assertTrue(o.detectOnlyChild());
        assertEquals(ProgramWriter.Format.JSON, s.output());
    }

    @Test
    void noneDisablesScopeAttribute() {
        assertNull(Settings.load(Map.of(Settings.SCOPE_ATTRIBUTE, "none")).compilerOptions().scopeAttribute());
        assertNull(Settings.load(Map.of(Settings.SCOPE_ATTRIBUTE, " ")).compilerOptions().scopeAttribute());
    }
}
