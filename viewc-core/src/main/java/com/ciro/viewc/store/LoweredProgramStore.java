package com.ciro.viewc.store;

import com.ciro.viewc.CompiledProgram;

public interface LoweredProgramStore {
    CompiledProgram get(String bundleId);
    void put(String bundleId, CompiledProgram program);
    void remove(String bundleId);
    long size();
}
