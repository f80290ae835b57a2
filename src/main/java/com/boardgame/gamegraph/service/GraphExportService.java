package com.boardgame.gamegraph.service;

import com.boardgame.gamegraph.dto.EdgeDto;
import com.boardgame.gamegraph.dto.GameNodeDto;
import com.boardgame.gamegraph.model.GameGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes nodes.json and edges.json for the graph viewer.
 *
 * <p>Both files are first written completely to temporary files next to their targets and
 * only then moved into place. If edges.json cannot be replaced, the previous nodes.json is
 * restored, so a failed run leaves the previous export intact.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphExportService {

    public static final String NODES_FILE = "nodes.json";
    public static final String EDGES_FILE = "edges.json";

    static final Set<PosixFilePermission> EXPORT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final ObjectMapper objectMapper;

    public record ExportResult(Path nodesFile, Path edgesFile) {
    }

    public ExportResult export(GameGraph graph, Path outputDirectory) throws IOException {
        List<GameNodeDto> nodes = graph.nodes().stream().map(GameNodeDto::from).collect(Collectors.toList());
        List<EdgeDto> edges = graph.edges().stream().map(EdgeDto::from).collect(Collectors.toList());

        Files.createDirectories(outputDirectory);
        Path nodesFile = outputDirectory.resolve(NODES_FILE);
        Path edgesFile = outputDirectory.resolve(EDGES_FILE);

        ObjectWriter writer = objectMapper.writerWithDefaultPrettyPrinter();
        Path nodesTemp = Files.createTempFile(outputDirectory, ".nodes-", ".json.tmp");
        Path edgesTemp = null;
        Path nodesBackup = null;
        try {
            edgesTemp = Files.createTempFile(outputDirectory, ".edges-", ".json.tmp");

            writer.writeValue(nodesTemp.toFile(), nodes);
            writer.writeValue(edgesTemp.toFile(), edges);
            makeReadable(nodesTemp);
            makeReadable(edgesTemp);

            if (Files.isRegularFile(nodesFile)) {
                nodesBackup = Files.createTempFile(outputDirectory, ".nodes-", ".json.bak");
                Files.copy(nodesFile, nodesBackup, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.COPY_ATTRIBUTES);
            }

            moveIntoPlace(nodesTemp, nodesFile);
            try {
                moveIntoPlace(edgesTemp, edgesFile);
            } catch (IOException e) {
                restoreNodes(nodesBackup, nodesFile, e);
                throw e;
            }
        } finally {
            deleteQuietly(nodesTemp);
            deleteQuietly(edgesTemp);
            deleteQuietly(nodesBackup);
        }

        log.info("Wrote {} ({} nodes)", nodesFile, nodes.size());
        log.info("Wrote {} ({} edges)", edgesFile, edges.size());
        return new ExportResult(nodesFile, edgesFile);
    }

    /**
     * Puts the previous nodes.json back after edges.json could not be replaced,
     * or removes the new one when there was no previous export.
     */
    private void restoreNodes(Path backup, Path nodesFile, IOException failure) {
        try {
            if (backup != null) {
                moveIntoPlace(backup, nodesFile);
            } else {
                Files.deleteIfExists(nodesFile);
            }
            log.warn("Replacing {} failed, restored previous {}", EDGES_FILE, nodesFile);
        } catch (IOException e) {
            log.error("Could not restore {} after failed export: {}", nodesFile, e.getMessage());
            failure.addSuppressed(e);
        }
    }

    // Temp files are created owner-only; exported files must be readable by whoever serves them.
    private void makeReadable(Path file) throws IOException {
        if (Files.getFileStore(file).supportsFileAttributeView(PosixFileAttributeView.class)) {
            Files.setPosixFilePermissions(file, EXPORT_PERMISSIONS);
        }
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
        }
    }
}
