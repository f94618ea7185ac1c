package com.ciro.viewc.standalone;

import com.ciro.viewc.CompiledProgram;
import com.ciro.viewc.LoweredComponent;
import com.ciro.viewc.target.Procedure;
import com.ciro.viewc.target.ProgramPrinter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Salida del CLI: listado de texto o JSON con el listado por procedimiento. */
public class ProgramWriter {

    public enum Format { TEXT, JSON }

    public record ProcedureOut(String kind, List<String> params, List<String> body) {}

    public record ComponentOut(String name, Map<String, Object> internalState, Map<String, ProcedureOut> procedures) {}

    private final ObjectMapper mapper;

    public ProgramWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String write(CompiledProgram program, Format format) {
        return format == Format.JSON ? json(program) : text(program);
    }

    String text(CompiledProgram program) {
        StringBuilder sb = new StringBuilder();
        for (LoweredComponent c : program.components()) {
            sb.append("// ===== ").append(c.name()).append(" =====\n");
            sb.append(ProgramPrinter.print(c.procedures().values())).append('\n');
        }
        return sb.toString();
    }

    String json(CompiledProgram program) {
        List<ComponentOut> out = new ArrayList<>();
        for (LoweredComponent c : program.components()) {
            Map<String, ProcedureOut> procs = new LinkedHashMap<>();
            for (Procedure p : c.procedures().values()) {
                String listing = ProgramPrinter.print(p);
                procs.put(p.name(), new ProcedureOut(p.kind().name(), p.params(), List.of(listing.split("\n"))));
            }
            out.add(new ComponentOut(c.name(), c.internalState(), procs));
        }
        try {
            return mapper.writeValueAsString(Map.of("components", out));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("no se pudo serializar el programa", e);
        }
    }
}
