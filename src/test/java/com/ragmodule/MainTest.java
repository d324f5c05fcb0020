package com.ragmodule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ragmodule.config.RagSettings;
import com.ragmodule.embedding.EmbeddingClient;
import com.ragmodule.embedding.ScriptedEmbeddingClient;
import com.ragmodule.store.InMemoryVectorStoreClient;
import com.ragmodule.store.VectorStoreClient;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    private final InMemoryVectorStoreClient store = new InMemoryVectorStoreClient();
    private final RagBackends backends = new RagBackends() {
        @Override
        public EmbeddingClient embeddingClient(RagSettings settings) {
            return new ScriptedEmbeddingClient(settings.embeddings().dimension());
        }

        @Override
        public VectorStoreClient vectorStoreClient(RagSettings settings) {
            return store;
        }
    };

    private Path configPath;
    private Path dataDir;
    private ByteArrayOutputStream output;

    @BeforeEach
    void writeConfigAndData() throws IOException {
        configPath = tempDir.resolve("rag.yml");
        Files.writeString(configPath, """
                provider: qdrant
                qdrant:
                  url: http://localhost:6333
                  collectionName: cli-docs
                  vectorSize: 64
                  distanceMetric: Cosine
                embeddings:
                  providerType: hashing
                """);
        dataDir = Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(dataDir.resolve("ubc.md"), "# UBC\nUBC is a public research university in Vancouver.\n");
        Files.writeString(dataDir.resolve("rivers.md"), "# Rivers\nThe Fraser River flows into the Pacific Ocean.\n");
        Files.writeString(dataDir.resolve("notes.txt"), "not markdown, never ingested");
    }

    private int run(String input, String... args) {
        output = new ByteArrayOutputStream();
        Main main = new Main(
                backends,
                Map.of(),
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
        return new CommandLine(main).execute(args);
    }

    private String output() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldIngestMarkdownFilesAndRetrieve() {
        int ingest = run("", "--config", configPath.toString(), "--mode", "ingest", "--data-dir", dataDir.toString());
        assertEquals(0, ingest);
        assertTrue(output().contains("Ingested 2 of 2 files."));
        assertEquals(2, store.pointCount("cli-docs"));

        int retrieve = run("", "--config", configPath.toString(), "--mode", "retrieve", "--query", "UBC university", "--limit", "1");
        assertEquals(0, retrieve);
        assertTrue(output().contains("#1 score="));
        assertTrue(output().contains("source=ubc.md"));
        assertFalse(output().contains("#2 "));
    }

    @Test
    void shouldListAndClearStoredChunks() {
        run("", "--config", configPath.toString(), "--mode", "ingest", "--data-dir", dataDir.toString());

        assertEquals(0, run("", "--config", configPath.toString(), "--mode", "list", "--source", "rivers.md"));
        assertTrue(output().contains("1 chunks stored for source rivers.md"));
        assertTrue(output().contains("Fraser River"));

        assertEquals(0, run("", "--config", configPath.toString(), "--mode", "clear"));
        assertFalse(store.hasCollection("cli-docs"));
    }

    @Test
    void shouldAnswerQueriesInteractivelyUntilExit() {
        run("", "--config", configPath.toString(), "--mode", "ingest", "--data-dir", dataDir.toString());

        int exitCode = run("Fraser River\n\nexit\nnever asked\n", "--config", configPath.toString(), "--mode", "interactive");

        assertEquals(0, exitCode);
        assertTrue(output().contains("source=rivers.md"));
        assertEquals(3, output().split("query> ", -1).length - 1);
    }

    @Test
    void shouldRequireQueryInRetrieveMode() {
        assertEquals(2, run("", "--config", configPath.toString(), "--mode", "retrieve"));
        assertEquals(2, run("", "--config", configPath.toString(), "--mode", "list"));
    }

    @Test
    void shouldExitWithOneOnInvalidConfiguration() throws IOException {
        Path broken = tempDir.resolve("broken.yml");
        Files.writeString(broken, """
                provider: qdrant
                qdrant:
                  url: http://localhost:6333
                """);

        assertEquals(1, run("", "--config", broken.toString(), "--mode", "clear"));
        assertEquals(1, run("", "--config", tempDir.resolve("absent.yml").toString(), "--mode", "clear"));
    }

    @Test
    void shouldExitWithOneWhenStoreIsUnreachable() {
        store.failingListing();

        assertEquals(1, run("", "--config", configPath.toString(), "--mode", "clear"));
    }
}
