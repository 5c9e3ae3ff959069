package org.dxworks.sqlportability;

import org.dxworks.sqlportability.analyzer.dialect.DialectOracle;
import org.dxworks.sqlportability.analyzer.macro.MacroGenerator;
import org.dxworks.sqlportability.analyzer.rewrite.ModelRewriter;
import org.dxworks.sqlportability.analyzer.scan.ProjectScanner;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final List<String> COMMANDS = List.of("scan", "generate", "generate-library", "rewrite", "migrate");

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        if (args.length < 1 || !COMMANDS.contains(args[0])) {
            printUsage();
            return EXIT_USAGE;
        }

        String command = args[0];
        Path configPath = Paths.get(PortabilityConfig.CONFIG_FILE_NAME);
        boolean dryRun = false;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 >= args.length) {
                    System.err.println("Error: " + arg + " requires a path");
                    printUsage();
                    return EXIT_USAGE;
                }
                configPath = Paths.get(args[++i]);
            } else if ("--dry-run".equals(arg) && "rewrite".equals(command)) {
                dryRun = true;
            } else {
                System.err.println("Error: Unexpected argument: " + arg);
                printUsage();
                return EXIT_USAGE;
            }
        }

        PortabilityConfig config;
        try {
            config = PortabilityConfig.load(configPath);
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        try {
            switch (command) {
                case "scan" -> scan(config);
                case "generate" -> generate(config);
                case "generate-library" -> generateLibrary(config);
                case "rewrite" -> rewrite(config, dryRun);
                case "migrate" -> migrate(config);
                default -> {
                    printUsage();
                    return EXIT_USAGE;
                }
            }
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        return EXIT_OK;
    }

    private static void scan(PortabilityConfig config) {
        System.out.println("Scanning dbt project...");
        SortedMap<String, Integer> functions = ProjectScanner.scanProject(config);

        System.out.println();
        System.out.println("Non-Portable Functions Detected");
        System.out.println("=".repeat(40));
        System.out.println(String.format("%-30s %9s", "Function", "Count"));
        System.out.println("-".repeat(40));
        for (Map.Entry<String, Integer> entry : functions.entrySet()) {
            System.out.println(String.format("%-30s %9d", entry.getKey(), entry.getValue()));
        }
        System.out.println("=".repeat(40));
        System.out.println("Total unique functions: " + functions.size());
    }

    private static void generate(PortabilityConfig config) throws IOException {
        System.out.println("Generating macros...");
        SortedMap<String, Integer> functions = ProjectScanner.scanProject(config);
        Path output = MacroGenerator.generate(config, new ArrayList<>(functions.keySet()));
        System.out.println("Generated macros at: " + output);
    }

    private static void generateLibrary(PortabilityConfig config) throws IOException {
        System.out.println("Generating complete function library...");
        List<String> functions = new ArrayList<>(DialectOracle.catalogDifferences(config.getAdapters()));
        Path output = MacroGenerator.generate(config, functions);
        System.out.println("Generated " + functions.size() + " macros at: " + output);
    }

    private static void rewrite(PortabilityConfig config, boolean dryRun) {
        System.out.println((dryRun ? "Preview" : "Rewriting") + " models...");
        List<Path> changes = ModelRewriter.rewriteModels(config, dryRun);
        for (Path changed : changes) {
            System.out.println("  " + changed);
        }
        if (dryRun) {
            System.out.println("Would modify " + changes.size() + " file(s)");
        } else {
            System.out.println("Modified " + changes.size() + " file(s)");
        }
    }

    private static void migrate(PortabilityConfig config) throws IOException {
        System.out.println("Starting migration...");
        System.out.println();

        System.out.println("[1/3] Scanning project...");
        SortedMap<String, Integer> functions = ProjectScanner.scanProject(config);
        System.out.println("      Found " + functions.size() + " non-portable function(s)");

        System.out.println("[2/3] Generating macros...");
        Path output = MacroGenerator.generate(config, new ArrayList<>(functions.keySet()));
        System.out.println("      Generated macros at: " + output);

        System.out.println("[3/3] Rewriting models...");
        List<Path> changes = ModelRewriter.rewriteModels(config, false);
        System.out.println("      Modified " + changes.size() + " file(s)");

        System.out.println();
        System.out.println("Migration complete!");
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar sql-portability.jar <command> [--config|-c <path>] [--dry-run]");
        System.err.println("Commands:");
        System.err.println("  scan              Scan models and list non-portable functions");
        System.err.println("  generate          Generate portable_* macros for the functions found by scan");
        System.err.println("  generate-library  Generate macros for every function whose catalogs differ");
        System.err.println("  rewrite           Rewrite models to call portable_* macros (--dry-run to preview)");
        System.err.println("  migrate           scan, generate and rewrite in one go");
        System.err.println("  <path> defaults to " + PortabilityConfig.CONFIG_FILE_NAME);
    }
}
