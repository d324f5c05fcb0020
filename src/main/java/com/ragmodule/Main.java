package com.ragmodule;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ragmodule.config.RagConfig;
import com.ragmodule.config.RagConfigLoader;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "rag-module",
        mixinStandardHelpOptions = true,
        version = "rag-module 0.1.0",
        description = "Ingest markdown documents into Qdrant and retrieve context for queries.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final int PREVIEW_LENGTH = 150;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "rag.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "interactive")
    Mode mode;

    @Option(names = "--data-dir", description = "Directory of .md files for ingest mode", defaultValue = "data")
    Path dataDir;

    @Option(names = "--query", description = "Query text used in retrieve mode")
    String query;

    @Option(names = "--limit", description = "Maximum number of chunks to return")
    Integer limit;

    @Option(names = "--score-threshold", description = "Minimum similarity score for returned chunks")
    Double scoreThreshold;

    @Option(names = "--source", description = "Source metadata value used in list mode")
    String source;

    private final RagBackends backends;
    private final Map<String, String> environment;
    private final InputStream in;
    private final PrintStream out;

    enum Mode {
        ingest,
        retrieve,
        interactive,
        clear,
        list
    }

    public Main() {
        this(RagBackends.defaults(), System.getenv(), System.in, System.out);
    }

    Main(RagBackends backends, Map<String, String> environment, InputStream in, PrintStream out) {
        this.backends = backends;
        this.environment = environment;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (mode == Mode.retrieve && (query == null || query.isBlank())) {
            log.error("--query is required in retrieve mode");
            return 2;
        }
        if (mode == Mode.list && (source == null || source.isBlank())) {
            log.error("--source is required in list mode");
            return 2;
        }

        log.info("Starting rag-module in {} mode", mode);
        log.info("Using config file: {}", configPath);

        RagModule rag;
        try {
            RagConfig config = new RagConfigLoader().load(configPath, environment);
            rag = RagModule.create(config, backends, ForkJoinPool.commonPool()).join();
        } catch (IOException e) {
            log.error("Unable to read config file {}", configPath, e);
            return 1;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return 1;
        } catch (CompletionException e) {
            log.error("Failed to initialize RagModule: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return 1;
        }

        try (rag) {
            switch (mode) {
                case ingest -> ingest(rag);
                case retrieve -> printResults(rag.retrieveContext(query, options()));
                case interactive -> interactive(rag);
                case clear -> {
                    rag.deleteStorage();
                    out.println("Storage cleared.");
                }
                case list -> list(rag);
            }
        }
        return 0;
    }

    private void ingest(RagModule rag) throws IOException {
        if (!Files.isDirectory(dataDir)) {
            log.warn("Data directory {} does not exist. Nothing to ingest.", dataDir);
            return;
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(dataDir)) {
            files = stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".md"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        log.info("Found {} markdown files in {}", files.size(), dataDir);

        int ingested = 0;
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                List<String> ids = rag.addDocument(content, Map.of("source", name));
                log.info("Ingested {} as {} chunks", name, ids.size());
                ingested++;
            } catch (IOException | RagException e) {
                log.error("Failed to ingest {}", name, e);
            }
        }
        out.printf("Ingested %d of %d files.%n", ingested, files.size());
    }

    private void interactive(RagModule rag) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        out.println("rag-module ready. Type a query, or 'exit' to quit.");
        while (true) {
            out.print("query> ");
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            String input = line.trim();
            if ("exit".equalsIgnoreCase(input) || "quit".equalsIgnoreCase(input)) {
                break;
            }
            if (input.isEmpty()) {
                continue;
            }
            try {
                printResults(rag.retrieveContext(input, options()));
            } catch (RagException e) {
                log.error("Retrieval failed for query \"{}\"", input, e);
            }
        }
    }

    private void list(RagModule rag) {
        List<StoredChunk> chunks = rag.getDocumentsByMetadata(Map.of("source", source));
        out.printf("%d chunks stored for source %s%n", chunks.size(), source);
        for (StoredChunk chunk : chunks) {
            out.printf("%s chunkIndex=%s %s%n",
                    chunk.id(),
                    chunk.payload().get("chunkIndex"),
                    preview(chunk.content()));
        }
    }

    private RetrievalOptions options() {
        return new RetrievalOptions(limit, scoreThreshold, null);
    }

    private void printResults(List<RetrievedChunk> results) {
        if (results.isEmpty()) {
            out.println("No matching context found.");
            return;
        }
        for (int i = 0; i < results.size(); i++) {
            RetrievedChunk result = results.get(i);
            Object resultSource = result.metadata() == null ? null : result.metadata().get("source");
            out.printf(Locale.ROOT, "#%d score=%.4f source=%s%n    %s%n",
                    i + 1,
                    result.score(),
                    resultSource == null ? "unknown" : resultSource,
                    preview(result.content()));
        }
    }

    static String preview(String content) {
        if (content == null) {
            return "";
        }
        String flattened = content.replaceAll("\\s+", " ").trim();
        return flattened.length() <= PREVIEW_LENGTH ? flattened : flattened.substring(0, PREVIEW_LENGTH) + "...";
    }
}
