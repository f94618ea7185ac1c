package com.ciro.viewc.standalone;

import com.ciro.viewc.CompilerOptions;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;

/**
 * Configuración del CLI: {@code viewc.properties} del classpath y encima
 * los {@code -Dclave=valor} de la línea de comandos.
 */
public final class Settings {

    public static final String RESOURCE = "viewc.properties";

    static final String SCOPE_ATTRIBUTE = "viewc.scope-attribute";
    static final String BULK_CLEAR = "viewc.bulk-clear";
    static final String DETECT_ONLY_CHILD = "viewc.detect-only-child";
    static final String EMIT_FLUSH = "viewc.emit-flush";
    static final String OUTPUT = "viewc.output";
    static final String RUN = "viewc.run";

    private final Properties props;

    private Settings(Properties props) {
        this.props = props;
    }

    public static Settings load(Map<String, String> overrides) {
        Properties p = new Properties();
        try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("no se pudo leer " + RESOURCE, e);
        }
        overrides.forEach(p::setProperty);
        return new Settings(p);
    }

    public CompilerOptions compilerOptions() {
        CompilerOptions d = CompilerOptions.defaults();
        String scope = props.getProperty(SCOPE_ATTRIBUTE, d.scopeAttribute());
        return new CompilerOptions(
                scope.isBlank() || scope.equals("none") ? null : scope,
                flag(BULK_CLEAR, d.bulkClear()),
                flag(DETECT_ONLY_CHILD, d.detectOnlyChild()),
                flag(EMIT_FLUSH, d.emitFlush()));
    }

    public ProgramWriter.Format output() {
        String v = props.getProperty(OUTPUT, "text").trim();
        return v.equalsIgnoreCase("json") ? ProgramWriter.Format.JSON : ProgramWriter.Format.TEXT;
    }

    public String get(String key) {
        return props.getProperty(key);
    }

    private boolean flag(String key, boolean fallback) {
        String v = props.getProperty(key);
        return v == null ? fallback : Boolean.parseBoolean(v.trim());
    }
}
