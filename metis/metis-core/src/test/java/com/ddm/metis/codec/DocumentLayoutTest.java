package com.ddm.metis.codec;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link DocumentLayout} 类的单元测试。
 *
 * @author metis
 */
class DocumentLayoutTest {

    private static JsonNode yaml(String text) throws Exception {
        return EntityCodecs.YAML.readTree(text);
    }

    @Test
    void testList() throws Exception {
        List<DocumentLayout.Entry> entries = DocumentLayout.list().entries(yaml("- id: a\n- id: b\n"), "doc");
        assertEquals(2, entries.size());
        assertNull(entries.get(0).defaultId());
    }

    @Test
    void testKeyed_KeysBecomeDefaultIds() throws Exception {
        List<DocumentLayout.Entry> entries = DocumentLayout.keyed().entries(yaml("a:\n  name: A\nb:\n  name: B\n"), "doc");
        assertEquals(List.of("a", "b"), entries.stream().map(DocumentLayout.Entry::defaultId).toList());
    }

    @Test
    void testWrapped() throws Exception {
        DocumentLayout layout = DocumentLayout.wrapped("kpis", DocumentLayout.list());
        assertEquals(1, layout.entries(yaml("kpis:\n  - id: a\n"), "doc").size());
        assertTrue(layout.entries(yaml("other: []\n"), "doc").isEmpty());
    }

    @Test
    void testContract_DocumentNameIsDefaultId() throws Exception {
        List<DocumentLayout.Entry> entries = DocumentLayout.contract().entries(yaml("metadata:\n  name: X\n"), "fi_data");
        assertEquals(1, entries.size());
        assertEquals("fi_data", entries.get(0).defaultId());
    }

    @Test
    void testMismatch() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> DocumentLayout.list().entries(yaml("a: 1\n"), "doc"));
        assertThrows(IllegalArgumentException.class, () -> DocumentLayout.keyed().entries(yaml("- 1\n"), "doc"));
    }

    @Test
    void testParse() {
        assertEquals(DocumentLayout.list(), DocumentLayout.parse("LIST", null));
        assertEquals(DocumentLayout.wrapped("terms", DocumentLayout.keyed()), DocumentLayout.parse("wrapped-keyed", "terms"));
        assertThrows(IllegalArgumentException.class, () -> DocumentLayout.parse("wrapped", null));
        assertThrows(IllegalArgumentException.class, () -> DocumentLayout.parse("tree", null));
        assertThrows(IllegalArgumentException.class,
                () -> DocumentLayout.wrapped("x", DocumentLayout.contract()));
    }
}
