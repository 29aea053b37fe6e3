package com.blastradius.io;

import com.blastradius.engine.model.SummaryModel.StructuralSummary;
import com.blastradius.engine.model.SummaryModel.SummaryEntity;
import com.blastradius.io.summary.SummaryReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SummaryReaderTest {

    private final SummaryReader reader = new SummaryReader();

    @Test
    void readsSingleSummaryObject(@TempDir Path tmp) throws IOException {
        String json = """
            {
              "file": "src/orders.rs",
              "language": "rust",
              "entities": [
                {
                  "kind": "function",
                  "qualified_name": "orders::place",
                  "visibility": "pub",
                  "parameters": ["Order"],
                  "return_type": "Receipt",
                  "container": "orders",
                  "location": { "file": "src/orders.rs", "line_start": 12, "line_end": 30 }
                }
              ],
              "relationships": [
                { "from": "orders::place", "to": "orders::validate", "kind": "calls", "weight": 0.9 }
              ]
            }
            """;
        Path file = tmp.resolve("orders.json");
        Files.writeString(file, json);

        List<StructuralSummary> summaries = reader.read(file);

        assertEquals(1, summaries.size());
        StructuralSummary s = summaries.get(0);
        assertEquals("src/orders.rs", s.file);
        assertEquals("rust", s.language);
        SummaryEntity place = s.getEntities().get(0);
        assertEquals("orders::place", place.qualifiedName);
        assertEquals(List.of("Order"), place.parameters);
        assertEquals("Receipt", place.returnType);
        assertEquals("orders", place.container);
        assertNull(place.exported);
        assertEquals(12, place.location.lineStart);
        assertEquals(0.9, s.relationships.get(0).weight);
    }

    @Test
    void readsArrayOfSummaries(@TempDir Path tmp) throws IOException {
        String json = """
            [
              { "file": "src/a.rs", "language": "rust", "entities": [] },
              { "file": "src/b.rs", "language": "rust", "entities": [] }
            ]
            """;
        Path file = tmp.resolve("all.json");
        Files.writeString(file, json);

        List<StructuralSummary> summaries = reader.read(file);

        assertEquals(List.of("src/a.rs", "src/b.rs"), summaries.stream().map(s -> s.file).toList());
        assertNull(summaries.get(0).relationships);
    }

    @Test
    void readAllConcatenatesInOrder(@TempDir Path tmp) throws IOException {
        Path a = tmp.resolve("a.json");
        Path b = tmp.resolve("b.json");
        Files.writeString(a, "{ \"file\": \"src/a.rs\" }");
        Files.writeString(b, "[{ \"file\": \"src/b.rs\" }, { \"file\": \"src/c.rs\" }]");

        List<StructuralSummary> summaries = reader.readAll(List.of(a, b));

        assertEquals(List.of("src/a.rs", "src/b.rs", "src/c.rs"), summaries.stream().map(s -> s.file).toList());
    }

    @Test
    void fileNotFoundThrowsSummaryReadException() {
        Path missing = Path.of("/tmp/does-not-exist-summary.json");
        assertThrows(SummaryReader.SummaryReadException.class, () -> reader.read(missing));
    }

    @Test
    void emptyFileThrowsSummaryReadException(@TempDir Path tmp) throws IOException {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "");
        assertThrows(SummaryReader.SummaryReadException.class, () -> reader.read(empty));
    }

    @Test
    void invalidJsonThrowsSummaryReadException(@TempDir Path tmp) throws IOException {
        Path bad = tmp.resolve("bad.json");
        Files.writeString(bad, "{ not valid json }}}");
        assertThrows(SummaryReader.SummaryReadException.class, () -> reader.read(bad));
    }

    @Test
    void scalarDocumentThrowsSummaryReadException(@TempDir Path tmp) throws IOException {
        Path scalar = tmp.resolve("scalar.json");
        Files.writeString(scalar, "42");
        assertThrows(SummaryReader.SummaryReadException.class, () -> reader.read(scalar));
    }
}
