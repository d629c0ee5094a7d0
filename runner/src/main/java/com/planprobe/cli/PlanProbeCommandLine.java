package com.planprobe.cli;

import com.planprobe.config.ExecutionOption;
import com.planprobe.config.ExecutionOptions;
import com.planprobe.exception.PlanProbeException;
import com.planprobe.pipeline.ProbePipeline;
import com.planprobe.pipeline.ProbeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line interface that probes one SQL statement against a Parquet dataset.
 *
 * <p>Usage examples:
 * <pre>
 * # Look up one run and check that the id filter reaches the scan
 * java -jar planprobe-runner.jar --data ./data/runs.parquet
 *
 * # Same query with filter pushdown disabled
 * java -jar planprobe-runner.jar --data ./data/runs.parquet \
 *   --option pushdown_filters=false
 * </pre>
 */
public class PlanProbeCommandLine {

    private static final Logger logger = LoggerFactory.getLogger(PlanProbeCommandLine.class);

    static final int EXIT_OK = 0;
    static final int EXIT_STAGE_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String DEFAULT_SQL =
        "SELECT json_payload FROM runs WHERE id = '2ef7079b-541a-4229-bd00-e6c00402e8f1'";

    private static final String USAGE =
        "PlanProbe\n\n" +
        "Usage: java -jar planprobe-runner.jar --data PATH [OPTIONS]\n\n" +
        "Options:\n" +
        "  --data PATH              Parquet file or glob to register (required)\n" +
        "  --table NAME             Relation name (default: runs)\n" +
        "  --sql TEXT               SQL statement to probe\n" +
        "  --sql-file PATH          Read the SQL statement from a file\n" +
        "  --option KEY=VALUE       Execution option, repeatable:\n" +
        "                             pruning, pushdown_filters, reorder_filters,\n" +
        "                             enable_page_index, threads, memory_limit,\n" +
        "                             batch_size, timeout_ms\n" +
        "  --column NAME            Result column to preview (default: first text column)\n" +
        "  --max-rows N             Preview row count (default: 5)\n" +
        "  --max-value-length N     Preview value length (default: 100)\n" +
        "  --skip-analyze           Do not run EXPLAIN ANALYZE\n" +
        "  --help                   Show this help message\n\n" +
        "Exit codes: 0 success, 1 stage failure, 2 usage error\n";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the command line against the given streams.
     *
     * @return the process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineArgs parsed;
        try {
            parsed = parseArguments(args);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage() + "\n");
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (parsed.help) {
            out.println(USAGE);
            return EXIT_OK;
        }

        String sql;
        try {
            sql = resolveSql(parsed);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage() + "\n");
            err.println(USAGE);
            return EXIT_USAGE;
        }

        ConsoleReport report = new ConsoleReport(out);
        try {
            Map<String, Object> options = new LinkedHashMap<>();
            ExecutionOptions fromProperties = ExecutionOptions.fromSystemProperties();
            for (ExecutionOption option : ExecutionOption.values()) {
                if (fromProperties.isExplicit(option)) {
                    options.put(option.key(), fromProperties.get(option));
                }
            }
            options.putAll(parsed.options);

            ProbeRequest request = ProbeRequest.builder()
                .dataPath(parsed.dataPath)
                .tableName(parsed.table)
                .sql(sql)
                .options(options)
                .previewColumn(parsed.column)
                .maxRows(parsed.maxRows)
                .maxValueLength(parsed.maxValueLength)
                .explainAnalyze(!parsed.skipAnalyze)
                .build();

            report.printBanner(parsed.dataPath, sql);
            new ProbePipeline().run(request, report);
            return EXIT_OK;
        } catch (PlanProbeException e) {
            logger.debug("Probe failed in stage {}", e.getStage(), e);
            err.println(e.toReportLine());
            return EXIT_STAGE_FAILURE;
        }
    }

    private static String resolveSql(CommandLineArgs parsed) throws UsageException {
        if (parsed.sql != null && parsed.sqlFile != null) {
            throw new UsageException("--sql and --sql-file are mutually exclusive");
        }
        if (parsed.sqlFile != null) {
            try {
                return Files.readString(Path.of(parsed.sqlFile), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                throw new UsageException("Cannot read SQL file " + parsed.sqlFile + ": " + e.getMessage());
            }
        }
        return parsed.sql != null ? parsed.sql : DEFAULT_SQL;
    }

    /**
     * Parses command-line arguments.
     */
    static CommandLineArgs parseArguments(String[] args) throws UsageException {
        CommandLineArgs result = new CommandLineArgs();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--data":
                    result.dataPath = requireValue(args, ++i, "--data");
                    break;
                case "--table":
                    result.table = requireValue(args, ++i, "--table");
                    break;
                case "--sql":
                    result.sql = requireValue(args, ++i, "--sql");
                    break;
                case "--sql-file":
                    result.sqlFile = requireValue(args, ++i, "--sql-file");
                    break;
                case "--option":
                    String pair = requireValue(args, ++i, "--option");
                    int eq = pair.indexOf('=');
                    if (eq <= 0) {
                        throw new UsageException("Expected KEY=VALUE for --option but got: " + pair);
                    }
                    result.options.put(pair.substring(0, eq).trim(),
                        ExecutionOptions.parseValue(pair.substring(eq + 1).trim()));
                    break;
                case "--column":
                    result.column = requireValue(args, ++i, "--column");
                    break;
                case "--max-rows":
                    result.maxRows = requireNonNegativeInt(args, ++i, "--max-rows");
                    break;
                case "--max-value-length":
                    result.maxValueLength = requireNonNegativeInt(args, ++i, "--max-value-length");
                    break;
                case "--skip-analyze":
                    result.skipAnalyze = true;
                    break;
                case "--help":
                case "-h":
                    result.help = true;
                    break;
                default:
                    throw new UsageException("Unknown argument: " + args[i]);
            }
        }

        if (!result.help && result.dataPath == null) {
            throw new UsageException("--data is required");
        }
        return result;
    }

    private static String requireValue(String[] args, int index, String flag) throws UsageException {
        if (index >= args.length) {
            throw new UsageException(flag + " requires a value");
        }
        return args[index];
    }

    private static int requireNonNegativeInt(String[] args, int index, String flag) throws UsageException {
        String text = requireValue(args, index, flag);
        try {
            int value = Integer.parseInt(text);
            if (value < 0) {
                throw new UsageException(flag + " must not be negative: " + text);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects an integer but got: " + text);
        }
    }

    /**
     * Container for parsed command-line arguments.
     */
    static class CommandLineArgs {
        String dataPath = null;
        String table = ProbeRequest.DEFAULT_TABLE;
        String sql = null;
        String sqlFile = null;
        final Map<String, Object> options = new LinkedHashMap<>();
        String column = null;
        int maxRows = ProbeRequest.DEFAULT_MAX_ROWS;
        int maxValueLength = ProbeRequest.DEFAULT_MAX_VALUE_LENGTH;
        boolean skipAnalyze = false;
        boolean help = false;
    }

    static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }
}
