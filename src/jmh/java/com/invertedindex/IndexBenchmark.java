package com.invertedindex;

import com.invertedindex.config.EngineConfig;
import com.invertedindex.index.IndexBuilder;
import com.invertedindex.query.QueryEngine;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 索引构建与查询性能基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {

    @State(Scope.Benchmark)
    public static class CorpusState {
        @Param({"true", "false"})
        boolean singleThreaded;

        @Param({"50000", "1000000"})
        long flushThreshold;

        Path tempDir;
        Path sourceDir;
        EngineConfig config;

        @Setup(Level.Trial)
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("invidx-benchmark");
            sourceDir = Files.createDirectories(tempDir.resolve("source"));

            // 1000个文档，每个约120个词
            for (int i = 0; i < 1000; i++) {
                Files.writeString(sourceDir.resolve("doc" + i + ".txt"), generateDocument(i));
            }

            config = EngineConfig.defaults();
            config.setSingleThreaded(singleThreaded);
            config.setSegmentFlushThreshold(flushThreshold);
            config.setIndexOutputPath(tempDir.resolve("index.dat"));
        }

        @TearDown(Level.Trial)
        public void tearDown() throws IOException {
            deleteDirectory(tempDir);
        }
    }

    @State(Scope.Benchmark)
    public static class QueryState {
        Path tempDir;
        QueryEngine queryEngine;

        @Setup(Level.Trial)
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("invidx-benchmark");
            Path sourceDir = Files.createDirectories(tempDir.resolve("source"));
            for (int i = 0; i < 5000; i++) {
                Files.writeString(sourceDir.resolve("doc" + i + ".txt"), generateDocument(i));
            }

            EngineConfig config = EngineConfig.defaults();
            config.setIndexOutputPath(tempDir.resolve("index.dat"));
            new IndexBuilder(config).build(List.of(sourceDir));
            queryEngine = QueryEngine.open(config.getIndexOutputPath());
        }

        @TearDown(Level.Trial)
        public void tearDown() throws IOException {
            deleteDirectory(tempDir);
        }
    }

    @Benchmark
    public int buildIndex(CorpusState state) throws IOException {
        return new IndexBuilder(state.config).build(List.of(state.sourceDir)).termCount();
    }

    @Benchmark
    public int searchCommonTerm(QueryState state) throws IOException {
        return state.queryEngine.search("java").totalMatches();
    }

    @Benchmark
    public int searchRareTerm(QueryState state) throws IOException {
        return state.queryEngine.search("token4242").totalMatches();
    }

    private static String generateDocument(int index) {
        return "Document " + index + " token" + index + " content. "
            + "It contains various words like Java, Python, programming, "
            + "search, index, document, file, content, data. "
            + "The quick brown fox jumps over the lazy dog. "
            + "repeated text to increase size. ".repeat(15);
    }

    private static void deleteDirectory(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
