package me.golemcore.careergraph.adapter.outbound.storage;

import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String GRAPH_DIR = "graph";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        CareerGraphProperties properties = new CareerGraphProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateStorageDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve(GRAPH_DIR)));
    }

    @Test
    void shouldWriteAtomicallyAndReadBack() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(GRAPH_DIR, "graph.json", "{\"v\":1}").get();
        storageAdapter.putTextAtomic(GRAPH_DIR, "graph.json", "{\"v\":2}").get();

        assertEquals("{\"v\":2}", storageAdapter.getText(GRAPH_DIR, "graph.json").get());
        assertFalse(Files.exists(tempDir.resolve(GRAPH_DIR).resolve("graph.json.tmp")));
    }

    @Test
    void shouldAppendLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(GRAPH_DIR, "update-log.jsonl", "{\"a\":1}\n").get();
        storageAdapter.appendText(GRAPH_DIR, "update-log.jsonl", "{\"b\":2}\n").get();

        assertEquals("{\"a\":1}\n{\"b\":2}\n", storageAdapter.getText(GRAPH_DIR, "update-log.jsonl").get());
    }

    @Test
    void shouldReturnNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(GRAPH_DIR, "missing.json").get());
    }

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(GRAPH_DIR, "../../etc/passwd").get());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }
}
