package com.filefinder;

import com.filefinder.config.Constants;
import com.filefinder.index.ExclusionRules;
import com.filefinder.index.FileIndexer;
import com.filefinder.query.RankingEngine;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 索引与检索性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class RankingBenchmark {

    private static final String[] TOPICS = {"budget", "roadmap", "meeting_notes", "invoice", "report"};
    private static final String[] EXTENSIONS = {"md", "txt", "xlsx", "pdf", "docx"};

    @State(Scope.Thread)
    public static class IndexState {
        Path tempDir;
        Path sourceDir;
        int round;

        @Setup(Level.Trial)
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("ffind-benchmark");
            sourceDir = tempDir.resolve("source");
            createTree(sourceDir, 1000);
        }

        @TearDown(Level.Trial)
        public void tearDown() throws IOException {
            deleteDirectory(tempDir);
        }
    }

    /**
     * 每次调用使用新的目录库，测量首次全量构建。
     */
    @Benchmark
    public int fullIndexThroughput(IndexState state) throws IOException {
        Path catalogPath = state.tempDir.resolve("catalog-" + state.round++ + ".db");
        return new FileIndexer(catalogPath, defaultRules(), Clock.systemUTC())
            .ensureIndex(List.of(state.sourceDir)).get(0).added();
    }

    @State(Scope.Benchmark)
    public static class QueryLatencyState {
        Path tempDir;
        Path catalogPath;
        RankingEngine rankingEngine;
        FileIndexer indexer;
        Path sourceDir;

        @Setup(Level.Trial)
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("ffind-benchmark");
            sourceDir = tempDir.resolve("source");
            catalogPath = tempDir.resolve("catalog.db");
            createTree(sourceDir, 10000);

            indexer = new FileIndexer(catalogPath, defaultRules(), Clock.systemUTC());
            indexer.ensureIndex(List.of(sourceDir));
            rankingEngine = new RankingEngine(catalogPath, Clock.systemUTC());
        }

        @TearDown(Level.Trial)
        public void tearDown() throws IOException {
            deleteDirectory(tempDir);
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long queryLatencySingleToken(QueryLatencyState state) {
        return state.rankingEngine.rank("budget", Constants.DEFAULT_SEARCH_LIMIT).elapsedMs();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public long queryLatencyMultiToken(QueryLatencyState state) {
        return state.rankingEngine.rank("meeting notes 42", Constants.DEFAULT_SEARCH_LIMIT).elapsedMs();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int incrementalNoChange(QueryLatencyState state) throws IOException {
        return state.indexer.ensureIndex(List.of(state.sourceDir)).get(0).unchanged();
    }

    private static ExclusionRules defaultRules() {
        return new ExclusionRules(Constants.EXCLUDED_DIRECTORIES, Constants.BLOCKED_EXTENSIONS,
            Constants.DEFAULT_ALLOWED_EXTENSIONS);
    }

    // 每 100 个文件一个子目录
    private static void createTree(Path sourceDir, int fileCount) throws IOException {
        for (int i = 0; i < fileCount; i++) {
            Path folder = sourceDir.resolve("project_" + (i / 100));
            Files.createDirectories(folder);
            String name = TOPICS[i % TOPICS.length] + "_" + i + "." + EXTENSIONS[i % EXTENSIONS.length];
            Files.writeString(folder.resolve(name), "file " + i);
        }
    }

    private static void deleteDirectory(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException exception) {
                    throw new UncheckedIOException(exception);
                }
            });
        }
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(RankingBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
