package com.ciro.viewc.standalone;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Lee un bundle JSON. */
public class BundleReader {

    private final ObjectMapper mapper;

    public BundleReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Bundle read(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in, file.getFileName().toString());
        } catch (IOException e) {
            throw new UncheckedIOException("no se pudo leer " + file, e);
        }
    }

    public Bundle read(InputStream in, String fallbackName) {
        try {
            Bundle b = mapper.readValue(in, Bundle.class);
            if (b.name() == null || b.name().isBlank()) return new Bundle(stripExtension(fallbackName), b.components());
            return b;
        } catch (IOException e) {
            throw new UncheckedIOException("bundle inválido: " + fallbackName, e);
        }
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
