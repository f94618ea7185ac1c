package com.ciro.viewc.standalone;

import com.ciro.viewc.ast.ComponentDef;
import com.ciro.viewc.ast.ElementNode;
import com.ciro.viewc.ast.Expr;
import com.ciro.viewc.ast.ExprNode;
import com.ciro.viewc.ast.TextNode;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class BundleReaderTest {

    private final BundleReader reader = new BundleReader(ObjectMapperFactory.create());

    @Test
    void readsComponentsWithTypedNodes() throws Exception {
        Bundle bundle;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("counter.json")) {
            bundle = reader.read(in, "counter.json");
        }

        assertEquals("demo", bundle.name());
        assertEquals(1, bundle.components().size());
        ComponentDef counter = bundle.components().get(0);
        assertEquals("Counter", counter.name());
        assertTrue(counter.hasView());
        assertTrue(counter.stateVar("count").orElseThrow().mutable());
        assertEquals(new Expr.Literal(0), counter.stateVar("count").orElseThrow().init());

        ElementNode p = (ElementNode) counter.view().get(0);
        assertEquals("p", p.tag());
        assertEquals(new TextNode("hola"), p.children().get(0));

        ElementNode span = (ElementNode) counter.view().get(1);
        assertEquals(new ExprNode(new Expr.Ident("count")), span.children().get(0));
    }

    @Test
    void missingCollectionsBecomeEmpty() throws Exception {
        Bundle bundle;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("broken.json")) {
            bundle = reader.read(in, "broken.json");
        }
        ComponentDef shell = bundle.components().get(0);
        assertTrue(shell.state().isEmpty());
        assertTrue(shell.methods().isEmpty());
        assertNull(shell.router());
    }

    @Test
    void blankNameFallsBackToFileName() {
        String json = "{\"components\":[]}";
        Bundle bundle = reader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "tienda.json");
        assertEquals("tienda", bundle.name());
        assertTrue(bundle.components().isEmpty());
    }

    @Test
    void malformedJsonIsReported() {
        InputStream in = new ByteArrayInputStream("{\"components\": [".getBytes(StandardCharsets.UTF_8));
        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> reader.read(in, "mal.json"));
        assertTrue(e.getMessage().contains("mal.json"));
    }
}
