package com.blastradius.engine;

import com.blastradius.engine.graph.NodeIdGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeIdGeneratorTest {

    @Test
    void entityIdCombinesFileOrdinalAndName() {
        assertEquals("src/orders.rs#2:orders::place",
                NodeIdGenerator.forEntity("src/orders.rs", 2, "orders::place"));
    }

    @Test
    void externalIdIsPrefixed() {
        assertEquals("external::println", NodeIdGenerator.forExternal("println"));
    }

    @Test
    void simpleNameHandlesEverySeparator() {
        assertEquals("bar", NodeIdGenerator.simpleName("com.example.Foo.bar"));
        assertEquals("f", NodeIdGenerator.simpleName("crate::module::f"));
        assertEquals("c", NodeIdGenerator.simpleName("a/b#c"));
        assertEquals("plain", NodeIdGenerator.simpleName("plain"));
    }

    @Test
    void fingerprintIgnoresWhitespaceOnlyEdits() {
        String a = NodeIdGenerator.fingerprint("fn parse(input: &str) -> u8", List.of("&str"), "u8");
        String b = NodeIdGenerator.fingerprint("fn  parse(input:   &str) -> u8 ", List.of(" &str"), "u8 ");
        assertEquals(a, b);
        assertEquals(16, a.length(), "8 bytes as hex");
    }

    @Test
    void fingerprintSeesReturnTypeChange() {
        String a = NodeIdGenerator.fingerprint(null, List.of("i32"), "u8");
        String b = NodeIdGenerator.fingerprint(null, List.of("i32"), "u16");
        assertNotEquals(a, b);
    }

    @Test
    void fingerprintSeesParameterChange() {
        String a = NodeIdGenerator.fingerprint(null, List.of("i32"), null);
        String b = NodeIdGenerator.fingerprint(null, List.of("i32", "bool"), null);
        assertNotEquals(a, b);
    }
}
