package com.invertedindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.invertedindex.config.Constants;
import com.invertedindex.config.EngineConfig;
import com.invertedindex.highlight.AnsiHighlighter;
import com.invertedindex.highlight.HighlightSpan;
import com.invertedindex.index.BuildReport;
import com.invertedindex.index.IndexBuilder;
import com.invertedindex.index.IndexMeta;
import com.invertedindex.query.QueryEngine;
import com.invertedindex.query.SearchHit;
import com.invertedindex.query.SearchResult;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "invidx",
    description = "🔍 并发倒排索引构建与检索工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.CreateSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 并发倒排索引构建与检索工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    private static Path indexPathOrDefault(Path indexPath) {
        return indexPath == null ? Path.of(Constants.DEFAULT_INDEX_FILE) : indexPath;
    }

    @Command(name = "create", description = "📂 为文件或目录构建索引")
    static class CreateSubcommand implements Callable<Integer> {

        @Parameters(description = "要索引的文件或目录（目录只展开一层）", arity = "1..*")
        private List<Path> sourcePaths;

        @Option(names = {"-s", "--single-threaded"}, description = "在当前线程中顺序构建")
        private boolean singleThreaded;

        @Option(names = {"-w", "--workers"}, description = "并发模式的工作线程数，默认为 CPU 核数")
        private Integer workers;

        @Option(names = {"-o", "--output"}, description = "索引输出文件，默认 " + Constants.DEFAULT_INDEX_FILE)
        private Path output;

        @Option(names = {"--flush-threshold"}, description = "批次累积多少个位置后写出一个段")
        private Long flushThreshold;

        @Option(names = {"--merge-factor"}, description = "单轮归并最多同时打开的段数")
        private Integer mergeFactor;

        @Option(names = {"-c", "--config"}, description = "properties 配置文件，命令行选项优先")
        private Path configFile;

        @Override
        public Integer call() {
            try {
                EngineConfig config = resolveConfig();
                System.out.println("🚀 开始构建索引...");
                System.out.println("📂 源路径: " + sourcePaths);
                System.out.println("📁 输出文件: " + config.getIndexOutputPath());
                System.out.println("🔧 模式: " + (config.isSingleThreaded()
                    ? "单线程"
                    : "并发（" + config.effectiveWorkerCount() + " 个工作线程）"));

                BuildReport report = new IndexBuilder(config).build(sourcePaths);

                System.out.println("✅ 索引完成！");
                System.out.println("📊 统计:");
                System.out.println("   文档数: " + report.documentCount());
                System.out.println("   词条数: " + report.termCount());
                System.out.println("   词数: " + report.wordCount());
                System.out.println("   段数: " + report.segmentCount() + "，归并轮数: " + report.mergePasses());
                System.out.println("   用时: " + report.elapsedMillis() + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                return 1;
            }
        }

        EngineConfig resolveConfig() throws IOException {
            EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
            if (singleThreaded) {
                config.setSingleThreaded(true);
            }
            if (workers != null) {
                config.setWorkerCount(workers);
            }
            if (output != null) {
                config.setIndexOutputPath(output);
            }
            if (flushThreshold != null) {
                config.setSegmentFlushThreshold(flushThreshold);
            }
            if (mergeFactor != null) {
                config.setMergeFactor(mergeFactor);
            }
            return config;
        }
    }

    @Command(name = "search", description = "🔎 查询单个词项并高亮显示命中文档")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "查询词项（大小写不敏感）", arity = "1")
        private String term;

        @Option(names = {"-i", "--index"}, description = "索引文件，默认 " + Constants.DEFAULT_INDEX_FILE)
        private Path indexPath;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @Option(names = {"--no-color"}, description = "文本输出不使用 ANSI 颜色")
        private boolean noColor;

        @Override
        public Integer call() {
            try {
                QueryEngine queryEngine = QueryEngine.open(indexPathOrDefault(indexPath));
                SearchResult result = queryEngine.search(term);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                    return 0;
                }
                System.out.println("🔍 查询: \"" + term + "\"");
                System.out.println();
                printTextResult(result);
                System.out.println();
                System.out.println("📊 共 " + result.totalMatches() + " 个文档匹配，用时 " + result.elapsedMs() + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(SearchResult result) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }

            for (SearchHit hit : result.hits()) {
                System.out.println("─────────────────────────────────");
                System.out.printf("📄 %s (docId=%d, %d 处匹配)%n", hit.sourcePath(), hit.docId(), hit.highlights().size());
                String text = noColor ? hit.text() : AnsiHighlighter.render(hit.text(), hit.highlights());
                System.out.println(text.stripTrailing());
            }
        }

        private void printJsonResult(SearchResult result) throws IOException {
            List<JsonHit> hits = new ArrayList<>(result.hits().size());
            for (SearchHit hit : result.hits()) {
                hits.add(new JsonHit(hit.docId(), hit.sourcePath().toString(), hit.highlights()));
            }
            JsonResult jsonResult = new JsonResult(result.query(), result.term(), result.totalMatches(), result.elapsedMs(), hits);
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(jsonResult));
        }

        record JsonHit(int docId, String path, List<HighlightSpan> highlights) {
        }

        record JsonResult(String query, String term, int totalMatches, long elapsedMs, List<JsonHit> hits) {
        }
    }

    @Command(name = "status", description = "📊 查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @Option(names = {"-i", "--index"}, description = "索引文件，默认 " + Constants.DEFAULT_INDEX_FILE)
        private Path indexPath;

        @Override
        public Integer call() {
            Path resolvedIndex = indexPathOrDefault(indexPath);
            try {
                IndexMeta meta = IndexMeta.readFrom(IndexMeta.metaPathFor(resolvedIndex));

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 索引文件: " + resolvedIndex);
                System.out.println("📄 文档总数: " + meta.documentCount());
                System.out.println("🔤 词条总数: " + meta.termCount());
                System.out.println("📝 词数: " + meta.wordCount());
                System.out.println("📦 段数量: " + meta.segmentCount() + "，归并轮数: " + meta.mergePasses());
                System.out.println("🔧 构建模式: " + (meta.singleThreaded() ? "单线程" : "并发（" + meta.workerCount() + " 个工作线程）"));
                System.out.println("💾 索引大小: " + formatBytes(Files.size(resolvedIndex)));
                System.out.println("🕒 构建时间: " + meta.createTime() + "，用时 " + meta.elapsedMillis() + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }
}
