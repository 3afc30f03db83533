package com.filefinder.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.filefinder.action.DesktopEntryOpener;
import com.filefinder.action.FileActionHandler;
import com.filefinder.action.FileActionResult;
import com.filefinder.catalog.EntryKind;
import com.filefinder.catalog.FileCatalog;
import com.filefinder.catalog.FileEntry;
import com.filefinder.config.Constants;
import com.filefinder.config.FinderConfig;
import com.filefinder.dialog.CommandDispatcher;
import com.filefinder.dialog.DispatchReply;
import com.filefinder.index.FileIndexer;
import com.filefinder.index.IndexReport;
import com.filefinder.query.RankingEngine;
import com.filefinder.query.SearchHit;
import com.filefinder.query.SearchResult;
import com.filefinder.session.SelectionSession;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "ffind",
    description = "🔍 本地文件/文件夹名称模糊检索",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.IndexSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.OpenSubcommand.class,
        MainCommand.ListSubcommand.class,
        MainCommand.StatusSubcommand.class,
        MainCommand.ShellSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--catalog"}, description = "目录库文件路径（默认 ./" + Constants.DEFAULT_CATALOG_FILE + "）")
    private Path catalogPath;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 本地文件/文件夹名称模糊检索");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    FinderConfig resolveConfig() {
        FinderConfig config = configFile == null ? FinderConfig.defaults() : FinderConfig.load(configFile);
        if (catalogPath != null) {
            config.setCatalogPath(catalogPath);
        }
        return config;
    }

    private List<Path> resolveRoots(List<Path> explicitRoots, FinderConfig config) {
        if (explicitRoots != null && !explicitRoots.isEmpty()) {
            return explicitRoots;
        }
        return config.getRoots();
    }

    private int sanitizeSearchLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_SEARCH_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_SEARCH_LIMIT);
            return Constants.MAX_SEARCH_LIMIT;
        }
        return rawLimit;
    }

    private String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return trimmed;
    }

    private static void printReports(List<IndexReport> reports) {
        for (IndexReport report : reports) {
            System.out.printf("📂 %s [%s] 新增 %d, 更新 %d, 删除 %d, 未变 %d, 用时 %dms%n",
                report.root(), report.mode(), report.added(), report.updated(), report.deleted(),
                report.unchanged(), report.elapsedMs());
        }
    }

    private static void printOptions(List<FileEntry> entries) {
        int rank = 1;
        for (FileEntry entry : entries) {
            System.out.printf("%d. %s  (%s)%n", rank++, entry.name(), entry.path());
        }
    }

    @Command(name = "index", description = "📂 首次全量构建或增量更新目录库")
    static class IndexSubcommand implements Callable<Integer> {

        @Parameters(description = "要索引的根目录（缺省使用配置文件中的 roots）", arity = "0..*")
        private List<Path> roots;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FinderConfig config = main.resolveConfig();
                List<Path> effectiveRoots = main.resolveRoots(roots, config);
                if (effectiveRoots.isEmpty()) {
                    System.err.println("❌ 未指定根目录");
                    return 1;
                }
                System.out.println("🚀 开始索引...");
                System.out.println("📁 目录库: " + config.getCatalogPath());
                long start = System.currentTimeMillis();
                List<IndexReport> reports = new FileIndexer(config).ensureIndex(effectiveRoots);
                printReports(reports);
                System.out.println("✅ 索引完成！用时 " + (System.currentTimeMillis() - start) + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 索引失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "search", description = "🔎 按名称/路径模糊检索")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "检索文本", arity = "1")
        private String query;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制", defaultValue = "5")
        private int limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FinderConfig config = main.resolveConfig();
                String safeQuery = main.sanitizeQuery(query);
                int safeLimit = main.sanitizeSearchLimit(limit);
                SearchResult result = new RankingEngine(config).rank(safeQuery, safeLimit);

                System.out.println("🔍 查询: \"" + safeQuery + "\"");
                System.out.println();

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    printTextResult(result);
                }

                System.out.println();
                System.out.println("📊 候选 " + result.candidateCount() + " 条，命中 " + result.hits().size()
                    + " 条，用时 " + result.elapsedMs() + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextResult(SearchResult result) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }

            int rank = 1;
            for (SearchHit hit : result.hits()) {
                System.out.printf("%d. [%s] %s (score: %.1f)%n", rank++, hit.entry().kind().columnValue(),
                    hit.entry().path(), hit.score());
            }
        }

        private void printJsonResult(SearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "open", description = "🟢 打开最匹配的文件或文件夹")
    static class OpenSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "条目类型 (file|folder)")
        private String kind;

        @Parameters(index = "1..*", description = "目标名称", arity = "1..*")
        private List<String> target;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FinderConfig config = main.resolveConfig();
                FileActionHandler handler = new FileActionHandler(new RankingEngine(config), new DesktopEntryOpener());
                String targetText = main.sanitizeQuery(String.join(" ", target));
                FileActionResult result = handler.handleFileAction("open", EntryKind.parse(kind), targetText);
                switch (result.outcome()) {
                    case NOT_FOUND -> {
                        System.out.println("❌ 未找到匹配的条目");
                        return 1;
                    }
                    case OPENED -> System.out.println("🟢 已打开 " + result.entries().get(0).path());
                    case OPEN_FAILED -> {
                        System.out.println("❌ 无法打开 " + result.entries().get(0).path());
                        return 1;
                    }
                    case AMBIGUOUS -> {
                        System.out.println("找到多个匹配:");
                        printOptions(result.entries());
                    }
                    default -> {
                    }
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 打开失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "list", description = "📂 列出最匹配文件夹的直接子项")
    static class ListSubcommand implements Callable<Integer> {

        @Parameters(description = "文件夹名称", arity = "1..*")
        private List<String> target;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FinderConfig config = main.resolveConfig();
                FileActionHandler handler = new FileActionHandler(new RankingEngine(config), new DesktopEntryOpener());
                String targetText = main.sanitizeQuery(String.join(" ", target));
                FileActionResult result = handler.handleFileAction("list", EntryKind.FOLDER, targetText);
                if (result.outcome() != FileActionResult.Outcome.LISTED) {
                    System.out.println("❌ 未找到匹配的文件夹");
                    return 1;
                }
                System.out.println("📂 " + result.entries().get(0).path() + " 的内容:");
                result.children().stream()
                    .limit(Constants.LIST_PREVIEW_LIMIT)
                    .forEach(child -> System.out.println(" - " + child));
                if (result.children().size() > Constants.LIST_PREVIEW_LIMIT) {
                    System.out.println("（仅显示前 " + Constants.LIST_PREVIEW_LIMIT + " 项，共 " + result.children().size() + " 项）");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 列出失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "📊 查看目录库统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            FinderConfig config = main.resolveConfig();
            try (FileCatalog catalog = new FileCatalog(config.getCatalogPath())) {
                System.out.println("📊 目录库状态");
                System.out.println("═══════════");
                System.out.println("📁 目录库: " + config.getCatalogPath());
                System.out.println("📄 文件数: " + catalog.countByKind(EntryKind.FILE));
                System.out.println("📂 文件夹数: " + catalog.countByKind(EntryKind.FOLDER));
                System.out.println("🕒 最近索引: " + catalog.getMeta(Constants.LAST_INDEX_TIME_KEY).orElse("从未索引"));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "shell", description = "💬 逐行读取话语并执行文件控制与消歧选择")
    static class ShellSubcommand implements Callable<Integer> {

        @Parameters(description = "启动时同步的根目录（缺省使用配置文件中的 roots）", arity = "0..*")
        private List<Path> roots;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                FinderConfig config = main.resolveConfig();
                List<Path> effectiveRoots = main.resolveRoots(roots, config);
                if (!effectiveRoots.isEmpty()) {
                    printReports(new FileIndexer(config).ensureIndex(effectiveRoots));
                }

                DesktopEntryOpener opener = new DesktopEntryOpener();
                CommandDispatcher dispatcher = new CommandDispatcher(
                    new FileActionHandler(new RankingEngine(config), opener),
                    new SelectionSession(opener));

                System.out.println("💬 输入话语，例如 \"open file q4 budget\"，输入 exit 退出");
                BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                String line;
                while ((line = reader.readLine()) != null) {
                    String utterance = line.trim();
                    if ("exit".equalsIgnoreCase(utterance) || "quit".equalsIgnoreCase(utterance)) {
                        break;
                    }
                    if (utterance.isEmpty()) {
                        continue;
                    }
                    DispatchReply reply = dispatcher.handle(utterance);
                    System.out.println(reply.handled() ? reply.message() : "🤷 未识别的文件命令: " + utterance);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 会话异常: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }
}
