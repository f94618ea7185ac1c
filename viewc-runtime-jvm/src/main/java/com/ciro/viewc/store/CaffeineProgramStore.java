package com.ciro.viewc.store;

import com.ciro.viewc.CompiledProgram;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

public class CaffeineProgramStore implements LoweredProgramStore {

    private static final Logger log = LoggerFactory.getLogger(CaffeineProgramStore.class);

    private final Cache<String, CompiledProgram> cache;

    public CaffeineProgramStore() {
        this(1_000, 30);
    }

    public CaffeineProgramStore(long maximumSize, long expireAfterAccessMinutes) {
        this.cache = Caffeine.newBuilder()
                .expireAfterAccess(expireAfterAccessMinutes, TimeUnit.MINUTES)
                .maximumSize(maximumSize)
                .removalListener((String key, CompiledProgram val, RemovalCause cause) -> {
                    // Solo interesa lo que sale por tamaño o expiración
                    if (cause.wasEvicted()) log.debug("Programa {} desalojado ({})", key, cause);
                })
                .build();
    }

    @Override
    public CompiledProgram get(String bundleId) {
        return cache.getIfPresent(bundleId);
    }

    @Override
    public void put(String bundleId, CompiledProgram program) {
        cache.put(bundleId, program);
    }

    @Override
    public void remove(String bundleId) {
        cache.invalidate(bundleId);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
