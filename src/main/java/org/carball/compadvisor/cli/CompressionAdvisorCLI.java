package org.carball.compadvisor.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.compadvisor.analysis.AnalysisAbortedException;
import org.carball.compadvisor.analysis.CompressionAdvisor;
import org.carball.compadvisor.config.AdvisorSettings;
import org.carball.compadvisor.config.ConfigurationLoader;
import org.carball.compadvisor.config.StrategyLoader;
import org.carball.compadvisor.engine.DatabaseEngine;
import org.carball.compadvisor.engine.JdbcDatabaseEngine;
import org.carball.compadvisor.model.AnalysisRun;
import org.carball.compadvisor.model.BatchSummary;
import org.carball.compadvisor.model.ExecutionRecord;
import org.carball.compadvisor.model.ExecutionStatus;
import org.carball.compadvisor.model.Recommendation;
import org.carball.compadvisor.model.Rule;
import org.carball.compadvisor.model.Strategy;
import org.carball.compadvisor.output.AdvisorReport;
import org.carball.compadvisor.repository.StateStore;
import org.carball.compadvisor.rules.RuleCache;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

@Slf4j
public class CompressionAdvisorCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║              Storage Compression Advisor v%s               ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_ABORTED = 2;
    static final int EXIT_FAILED = 3;

    private static final List<String> COMMANDS = List.of(
            "analyze", "recommendations", "ddl", "execute", "batch", "revert", "status", "history", "purge", "strategies");

    private final Function<String, DatabaseEngine> engineFactory;
    private final ConfigurationLoader configurationLoader;
    private final PrintStream out;
    private final PrintStream err;

    public CompressionAdvisorCLI() {
        this(JdbcDatabaseEngine::new, new ConfigurationLoader(), System.out, System.err);
    }

    CompressionAdvisorCLI(Function<String, DatabaseEngine> engineFactory, ConfigurationLoader configurationLoader,
                          PrintStream out, PrintStream err) {
        this.engineFactory = engineFactory;
        this.configurationLoader = configurationLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CompressionAdvisorCLI().run(args));
    }

    public int run(String[] args) {
        out.printf(BANNER + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? EXIT_USAGE : EXIT_OK;
        }

        String command = args[0].toLowerCase(Locale.ROOT);
        if (!COMMANDS.contains(command)) {
            err.println("\n❌ Unknown command: " + args[0]);
            err.println("\nRun with --help for usage information.");
            return EXIT_USAGE;
        }

        try {
            String settingsFile = option(args, "--settings");
            AdvisorSettings settings = configurationLoader.loadConfiguration(
                    settingsFile == null ? null : Path.of(settingsFile), args);
            RuleCache ruleCache = RuleCache.fromFile(new StrategyLoader(), settings.getStrategiesFile());

            if (command.equals("strategies")) {
                printStrategies(ruleCache.strategies());
                return EXIT_OK;
            }

            if (settings.getConnectionString() == null || settings.getConnectionString().isBlank()) {
                throw new IllegalArgumentException("A database connection is required (--jdbc-url or COMPADVISOR_JDBC_URL)");
            }

            StateStore stateStore = new StateStore(Path.of(settings.getStateFile()));
            try (CompressionAdvisor advisor = new CompressionAdvisor(
                    engineFactory.apply(settings.getConnectionString()), settings, ruleCache)) {
                advisor.loadState(stateStore);
                int exitCode = dispatch(command, args, advisor);
                advisor.saveState(stateStore);
                return exitCode;
            }

        } catch (AnalysisAbortedException e) {
            err.println("\n❌ Analysis aborted: " + e.getMessage());
            log.debug("Analysis abort details", e);
            return EXIT_ABORTED;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_USAGE;
        } catch (Exception e) {
            err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return EXIT_USAGE;
        }
    }

    private int dispatch(String command, String[] args, CompressionAdvisor advisor)
            throws AnalysisAbortedException, IOException {
        switch (command) {
            case "analyze":
                return analyze(args, advisor);
            case "recommendations":
                return recommendations(args, advisor);
            case "ddl":
                return ddl(args, advisor);
            case "execute":
                return execute(args, advisor);
            case "batch":
                return batch(args, advisor);
            case "revert":
                return revert(args, advisor);
            case "status":
                out.println("Execution " + requiredLong(args, "--execution") + ": "
                        + advisor.getExecutionStatus(requiredLong(args, "--execution")));
                return EXIT_OK;
            case "history":
                return history(args, advisor);
            case "purge":
                int days = intOption(args, "--days", advisor.getSettings().getHistoryRetentionDays());
                out.println("🧹 Purged " + advisor.purgeRecommendations(days) + " recommendations older than " + days + " days");
                return EXIT_OK;
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private int analyze(String[] args, CompressionAdvisor advisor) throws AnalysisAbortedException {
        Strategy strategy = advisor.resolveStrategy(optionOrDefault(args, "--strategy", "balanced"));
        String owner = option(args, "--owner");
        int parallelism = advisor.getSettings().getAnalysisParallelism();

        out.println("\n🔍 Starting analysis...");
        out.println("   Scope: " + (owner == null ? "all schemas" : owner));
        out.println("   Strategy: " + strategy.getName());
        out.println("   Workers: " + parallelism);
        out.println();

        out.print("📊 Analyzing objects... ");
        long runId = advisor.startAnalysis(owner, strategy.getId(), parallelism);
        out.println("✓");

        AnalysisRun run = advisor.getRun(runId);
        out.println("\n✅ Analysis run " + runId + " complete!");
        out.println("   Objects analyzed: " + run.getObjectsAnalyzed());
        out.println("   Recommendations: " + run.getRecommendationsCreated());
        if (run.getObjectsFailed() > 0) {
            out.println("   ⚠️ Failed to analyze: " + run.getObjectsFailed());
        }
        out.println("   Projected savings: " + mb(advisor.totalProjectedSavings(strategy.getId())));
        return EXIT_OK;
    }

    private int recommendations(String[] args, CompressionAdvisor advisor) throws IOException {
        String strategyName = option(args, "--strategy");
        Integer strategyId = strategyName == null ? null : advisor.resolveStrategy(strategyName).getId();
        double minSavings = doubleOption(args, "--min-savings", advisor.getSettings().getMinSavingsPct());

        List<Recommendation> recommendations = advisor.getRecommendations(strategyId, minSavings);
        AdvisorReport report = new AdvisorReport(recommendations, List.of());
        String format = optionOrDefault(args, "--format", "text");
        String output = option(args, "--output");

        if (format.equals("json") || format.equals("markdown")) {
            String content = format.equals("json") ? report.toJson() : report.toMarkdown();
            if (output != null) {
                Files.writeString(Path.of(output), content);
                out.println("📝 Report written to " + output);
            } else {
                out.println(content);
            }
            return EXIT_OK;
        }

        if (recommendations.isEmpty()) {
            out.println("\n💡 No actionable recommendations with at least " + minSavings + "% savings.");
            return EXIT_OK;
        }
        out.println("\n📋 Recommendations:");
        for (Recommendation rec : recommendations) {
            out.printf(Locale.ROOT, "   [%d] %-40s %-11s -> %-20s %10s saved (%.1f%%) %s%n",
                    rec.getId(), rec.getRef(), rec.getCurrentEncoding() == null ? "unknown" : rec.getCurrentEncoding(),
                    rec.getRecommendedEncoding(),
                    mb(rec.getProjectedSavingsBytes()), rec.getSavingsPct(), rec.getPriority());
        }
        out.println("\n   Total projected savings: " + mb(advisor.totalProjectedSavings(strategyId)));
        return EXIT_OK;
    }

    private int ddl(String[] args, CompressionAdvisor advisor) {
        String id = option(args, "--id");
        List<String> statements = advisor.generateDdl(id == null ? null : Long.parseLong(id), hasFlag(args, "--online"));
        statements.forEach(out::println);
        return EXIT_OK;
    }

    private int execute(String[] args, CompressionAdvisor advisor) {
        long id = requiredLong(args, "--id");
        boolean apply = hasFlag(args, "--apply");
        out.println("\n⚙️ " + (apply ? "Applying" : "Dry run of") + " recommendation " + id + "...");

        ExecutionRecord record = advisor.execute(id, !apply, hasFlag(args, "--online"));
        printExecution(record);
        return record.getStatus() == ExecutionStatus.SUCCEEDED ? EXIT_OK : EXIT_FAILED;
    }

    private int batch(String[] args, CompressionAdvisor advisor) {
        Strategy strategy = advisor.resolveStrategy(optionOrDefault(args, "--strategy", "balanced"));
        int maxObjects = intOption(args, "--max-objects", 10);
        long maxBytes = (long) (doubleOption(args, "--max-size-gb", 0) * 1024 * 1024 * 1024);
        boolean apply = hasFlag(args, "--apply");

        out.println("\n⚙️ Batch " + (apply ? "execution" : "dry run") + " for strategy " + strategy.getName()
                + " (max " + maxObjects + " objects)...");
        BatchSummary summary = advisor.batchExecute(strategy.getId(), maxObjects, maxBytes, hasFlag(args, "--online"), !apply);

        summary.executions().forEach(this::printExecution);
        out.println("\n📊 Batch summary:");
        out.println("   Processed: " + summary.processed());
        out.println("   Succeeded: " + summary.succeeded());
        out.println("   Failed: " + summary.failed());
        out.println("   Savings: " + mb(summary.totalSavingsBytes()));
        return summary.failed() == 0 ? EXIT_OK : EXIT_FAILED;
    }

    private int revert(String[] args, CompressionAdvisor advisor) {
        long executionId = requiredLong(args, "--execution");
        ExecutionRecord record = advisor.revert(executionId, !hasFlag(args, "--apply"));
        printExecution(record);
        return record.getStatus() == ExecutionStatus.SUCCEEDED ? EXIT_OK : EXIT_FAILED;
    }

    private int history(String[] args, CompressionAdvisor advisor) throws IOException {
        String status = option(args, "--status");
        List<ExecutionRecord> history = advisor.getHistory(intOption(args, "--days", 30), option(args, "--owner"),
                status == null ? null : ExecutionStatus.valueOf(status.toUpperCase(Locale.ROOT)));

        if ("markdown".equals(option(args, "--format"))) {
            out.println(new AdvisorReport(List.of(), history).toMarkdown());
            return EXIT_OK;
        }
        if (history.isEmpty()) {
            out.println("\n💡 No executions in the selected period.");
        }
        history.forEach(this::printExecution);
        return EXIT_OK;
    }

    private void printExecution(ExecutionRecord record) {
        String icon = record.getStatus() == ExecutionStatus.SUCCEEDED ? "✓" : "✗";
        out.printf("   %s [%d] %s %s %s%s%n", icon, record.getExecutionId(), record.getOperation(), record.getRef(),
                record.getStatus(), record.isDryRun() ? " (dry run)" : "");
        if (record.getStatement() != null) {
            out.println("       " + record.getStatement());
        }
        if (record.getErrorDetail() != null) {
            out.println("       Error: " + record.getErrorDetail());
        }
    }

    private void printStrategies(List<Strategy> strategies) {
        out.println("\n📚 Available strategies:");
        for (Strategy strategy : strategies) {
            out.println("\n   " + strategy.getId() + ". " + strategy.getName() + " - " + strategy.getDescription());
            for (Rule rule : strategy.getRules()) {
                out.printf("      %-6s #%d -> %-20s %s%n", rule.getObjectType(), rule.getPriority(), rule.getEncoding(),
                        rule.getDescription() == null ? "" : rule.getDescription());
            }
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private void printUsage() {
        out.println("\nUsage: java -jar compression-advisor.jar <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  analyze           Analyze objects and store recommendations");
        out.println("                    --owner <schema>  --strategy <name|id>");
        out.println("  recommendations   List actionable recommendations");
        out.println("                    --strategy <name|id>  --min-savings <pct>  --format text|json|markdown  --output <file>");
        out.println("  ddl               Print DDL for one (--id) or all actionable recommendations  [--online]");
        out.println("  execute           Execute one recommendation (dry run unless --apply)");
        out.println("                    --id <recommendation>  [--apply] [--online]");
        out.println("  batch             Execute the highest-priority recommendations of a strategy");
        out.println("                    --strategy <name|id>  --max-objects <n>  --max-size-gb <gb>  [--apply] [--online]");
        out.println("  revert            Restore the encoding replaced by an execution  --execution <id> [--apply]");
        out.println("  status            Show the status of an execution  --execution <id>");
        out.println("  history           Show executions  --days <n>  --owner <schema>  --status <status>");
        out.println("  purge             Remove old recommendations  --days <n>");
        out.println("  strategies        List strategies and their rules");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
        out.println("Examples:");
        out.println("  java -jar compression-advisor.jar analyze --jdbc-url jdbc:oracle:thin:@//db:1521/APP --owner SALES");
        out.println("  java -jar compression-advisor.jar batch --strategy balanced --max-objects 5 --apply --online");
    }

    private static String option(String[] args, String name) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].equals(name)) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static String optionOrDefault(String[] args, String name, String defaultValue) {
        String value = option(args, name);
        return value == null ? defaultValue : value;
    }

    private static int intOption(String[] args, String name, int defaultValue) {
        String value = option(args, name);
        return value == null ? defaultValue : Integer.parseInt(value);
    }

    private static double doubleOption(String[] args, String name, double defaultValue) {
        String value = option(args, name);
        return value == null ? defaultValue : Double.parseDouble(value);
    }

    private static long requiredLong(String[] args, String name) {
        String value = option(args, name);
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        return Long.parseLong(value);
    }

    private static boolean hasFlag(String[] args, String name) {
        return Arrays.asList(args).contains(name);
    }

    private static String mb(long bytes) {
        return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
    }
}
