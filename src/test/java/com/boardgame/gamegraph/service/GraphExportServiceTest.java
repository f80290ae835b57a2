package com.boardgame.gamegraph.service;

import com.boardgame.gamegraph.dto.EdgeDto;
import com.boardgame.gamegraph.model.Game;
import com.boardgame.gamegraph.model.GameGraph;
import com.boardgame.gamegraph.model.SimilarityEdge;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GraphExportServiceTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private GraphExportService exportService;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        exportService = new GraphExportService(objectMapper);
    }

    private GameGraph sampleGraph() {
        Game catan = Game.builder()
                .id("13")
                .name("CATAN")
                .mechanics(new LinkedHashSet<>(List.of("Dice Rolling", "Trading")))
                .categories(new LinkedHashSet<>(List.of("Economic")))
                .averageRating(7.09)
                .averageWeight(2.29)
                .minPlayers(3)
                .maxPlayers(4)
                .playingTime(120)
                .build();
        Game unknown = Game.builder().id("822").name("Carcassonne – Édition").build();
        return new GameGraph(List.of(catan, unknown), List.of(SimilarityEdge.between("822", "13", 0.42)));
    }

    @Test
    void testNodesMatchViewerSchema() throws Exception {
        GraphExportService.ExportResult result = exportService.export(sampleGraph(), tempDir);

        assertEquals(tempDir.resolve("nodes.json"), result.nodesFile());
        JsonNode nodes = objectMapper.readTree(result.nodesFile().toFile());
        assertEquals(2, nodes.size());

        JsonNode catan = nodes.get(0);
        List<String> fields = new ArrayList<>();
        Iterator<String> names = catan.fieldNames();
        names.forEachRemaining(fields::add);
        assertEquals(List.of("id", "label", "name", "averagerating", "averageweight", "minplayers",
                "maxplayers", "playingtime", "mechanics", "categories", "bggUrl"), fields);

        assertEquals("13", catan.get("id").asText());
        assertEquals("CATAN", catan.get("label").asText());
        assertEquals(7.09, catan.get("averagerating").asDouble());
        assertEquals(120, catan.get("playingtime").asInt());
        assertEquals("Dice Rolling", catan.get("mechanics").get(0).asText());
        assertEquals("https://boardgamegeek.com/boardgame/13", catan.get("bggUrl").asText());
    }

    @Test
    void testUnknownNumbersAreNull() throws Exception {
        exportService.export(sampleGraph(), tempDir);

        JsonNode unknown = objectMapper.readTree(tempDir.resolve("nodes.json").toFile()).get(1);
        for (String field : List.of("averagerating", "averageweight", "minplayers", "maxplayers", "playingtime")) {
            assertTrue(unknown.has(field), field + " must be present");
            assertTrue(unknown.get(field).isNull(), field + " must be null");
        }
        assertTrue(unknown.get("mechanics").isArray());
        assertEquals(0, unknown.get("mechanics").size());
    }

    @Test
    void testNonAsciiWrittenAsUtf8() throws Exception {
        exportService.export(sampleGraph(), tempDir);

        String raw = Files.readString(tempDir.resolve("nodes.json"), StandardCharsets.UTF_8);
        assertTrue(raw.contains("Carcassonne – Édition"));
    }

    @Test
    void testEdgesFile() throws Exception {
        exportService.export(sampleGraph(), tempDir);

        JsonNode edges = objectMapper.readTree(tempDir.resolve("edges.json").toFile());
        assertEquals(1, edges.size());
        assertEquals("13", edges.get(0).get("source").asText());
        assertEquals("822", edges.get(0).get("target").asText());
        assertEquals(0.42, edges.get(0).get("weight").asDouble());
    }

    @Test
    void testEmptyGraphWritesEmptyArrays() throws Exception {
        exportService.export(GameGraph.empty(), tempDir);

        assertEquals(0, objectMapper.readTree(tempDir.resolve("nodes.json").toFile()).size());
        assertTrue(objectMapper.readTree(tempDir.resolve("nodes.json").toFile()).isArray());
        assertTrue(objectMapper.readTree(tempDir.resolve("edges.json").toFile()).isArray());
        assertEquals(0, objectMapper.readTree(tempDir.resolve("edges.json").toFile()).size());
    }

    @Test
    void testCreatesMissingDirectoryAndLeavesNoTempFiles() throws Exception {
        Path out = tempDir.resolve("nested").resolve("data");

        exportService.export(sampleGraph(), out);

        try (Stream<Path> files = Files.list(out)) {
            assertEquals(List.of("edges.json", "nodes.json"),
                    files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList()));
        }
    }

    @Test
    void testReplacesPreviousExport() throws Exception {
        exportService.export(sampleGraph(), tempDir);
        exportService.export(GameGraph.empty(), tempDir);

        assertEquals(0, objectMapper.readTree(tempDir.resolve("nodes.json").toFile()).size());
        assertEquals(0, objectMapper.readTree(tempDir.resolve("edges.json").toFile()).size());
    }

    @Test
    void testFailedWriteKeepsPreviousExport() throws Exception {
        exportService.export(sampleGraph(), tempDir);
        String nodesBefore = Files.readString(tempDir.resolve("nodes.json"));
        String edgesBefore = Files.readString(tempDir.resolve("edges.json"));

        SimpleModule failingEdges = new SimpleModule();
        failingEdges.addSerializer(EdgeDto.class, new JsonSerializer<>() {
            @Override
            public void serialize(EdgeDto value, JsonGenerator gen, SerializerProvider serializers)
                    throws IOException {
                throw new IOException("disk full");
            }
        });
        GraphExportService broken = new GraphExportService(new ObjectMapper().registerModule(failingEdges));

        GameGraph replacement = new GameGraph(List.of(Game.builder().id("1").name("Other").build()),
                List.of(SimilarityEdge.between("1", "2", 0.9)));
        assertThrows(IOException.class, () -> broken.export(replacement, tempDir));

        assertEquals(nodesBefore, Files.readString(tempDir.resolve("nodes.json")));
        assertEquals(edgesBefore, Files.readString(tempDir.resolve("edges.json")));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(2, files.count());
        }
    }

    @Test
    void testOutputPathThatIsAFileFails() throws IOException {
        Path notADirectory = Files.writeString(tempDir.resolve("data"), "occupied");

        assertThrows(IOException.class, () -> exportService.export(sampleGraph(), notADirectory));
    }

    @Test
    void testFailedEdgesMoveRestoresPreviousNodes() throws Exception {
        exportService.export(sampleGraph(), tempDir);
        String nodesBefore = Files.readString(tempDir.resolve("nodes.json"));

        // a non-empty directory where edges.json should go makes the second rename fail
        Files.delete(tempDir.resolve("edges.json"));
        Files.createDirectories(tempDir.resolve("edges.json"));
        Files.writeString(tempDir.resolve("edges.json").resolve("keep"), "x");

        GameGraph replacement = new GameGraph(List.of(Game.builder().id("1").name("Other").build()), List.of());
        assertThrows(IOException.class, () -> exportService.export(replacement, tempDir));

        assertEquals(nodesBefore, Files.readString(tempDir.resolve("nodes.json")));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of("edges.json", "nodes.json"),
                    files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList()));
        }
    }

    @Test
    void testFailedEdgesMoveOnFirstExportLeavesNoNodes() throws Exception {
        Files.createDirectories(tempDir.resolve("edges.json"));
        Files.writeString(tempDir.resolve("edges.json").resolve("keep"), "x");

        assertThrows(IOException.class, () -> exportService.export(sampleGraph(), tempDir));

        assertFalse(Files.exists(tempDir.resolve("nodes.json")));
    }

    @Test
    void testExportedFilesAreWorldReadable() throws Exception {
        assumeTrue(Files.getFileStore(tempDir).supportsFileAttributeView(PosixFileAttributeView.class));

        exportService.export(sampleGraph(), tempDir);

        for (String name : List.of("nodes.json", "edges.json")) {
            Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(tempDir.resolve(name));
            assertTrue(permissions.contains(PosixFilePermission.OTHERS_READ), name + " not world-readable");
            assertTrue(permissions.contains(PosixFilePermission.GROUP_READ), name + " not group-readable");
            assertTrue(permissions.contains(PosixFilePermission.OWNER_WRITE));
        }
    }
}
