package com.raditha.cpptokens.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.cpptokens.analyzer.TranslationUnitAnalyzer;
import com.raditha.cpptokens.analyzer.UnitReport;
import com.raditha.cpptokens.config.Language;
import com.raditha.cpptokens.config.Platform;
import com.raditha.cpptokens.config.Settings;
import com.raditha.cpptokens.config.SettingsLoader;
import com.raditha.cpptokens.config.Standards;
import com.raditha.cpptokens.lexer.SimpleLexer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line driver for the token list pipeline.
 * <p>
 * Usage:
 * java -jar cpptokens.jar [options] &lt;file&gt;...
 * <p>
 * Configuration priority: CLI arguments &gt; YAML config file &gt; defaults
 */
@Command(name = "cpptokens", mixinStandardHelpOptions = true, version = "cpptokens v1.0.0",
        description = "Tokenize, normalize and build the AST of preprocessed C/C++ files")
public class CppTokensCLI implements Callable<Integer> {

    private static final String VERSION = "1.0.0";

    static final int EXIT_UNIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_IO = 3;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "<file>", description = "Preprocessed source files")
    private List<Path> files = new ArrayList<>();

    @Option(names = "--config", description = "YAML configuration file", paramLabel = "<path>")
    private File configFile;

    @Option(names = "--platform", description = "Platform model: native, unix32, unix64, win32A, win32W, win64",
            paramLabel = "<name>")
    private String platform;

    @Option(names = "--std", description = "Language standard, e.g. c99 or c++17 (repeatable)", paramLabel = "<std>")
    private List<String> standards = new ArrayList<>();

    @Option(names = "--language", description = "Force the language: c or c++", paramLabel = "<lang>")
    private String language;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--ast", description = "List the expression trees of each file")
    private boolean showAst = false;

    @Option(names = "--print-ast", description = "Log the broken expression tree when validation fails")
    private boolean printAst = false;

    /**
     * DTO for the JSON report.
     */
    public record RunReport(String version, Instant analyzedAt, int filesAnalyzed, int failed,
                            List<UnitReport> units) {
    }

    @Override
    public Integer call() throws IOException {
        Settings settings = buildSettings();
        TranslationUnitAnalyzer analyzer = new TranslationUnitAnalyzer(settings, parseLanguage(language),
                new SimpleLexer(), printAst);

        List<UnitReport> reports = new ArrayList<>();
        for (Path file : files) {
            reports.add(analyzer.analyze(file));
        }
        int failed = (int) reports.stream().filter(r -> !r.isOk()).count();

        PrintWriter out = spec.commandLine().getOut();
        if (jsonOutput) {
            printJsonReport(out, new RunReport(VERSION, Instant.now(), reports.size(), failed, reports));
        } else {
            printTextReport(out, reports, failed);
        }
        out.flush();
        return failed == 0 ? 0 : EXIT_UNIT_FAILED;
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /**
     * Command line with the exit code mapping of this driver.
     */
    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new CppTokensCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIG;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_UNIT_FAILED;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return EXIT_CONFIG;
        });
        return cmd;
    }

    /**
     * Settings from the config file (or the classpath default) with the CLI overrides applied.
     *
     * @throws IllegalArgumentException if an option value is invalid
     */
    Settings buildSettings() throws IOException {
        Settings settings;
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new IllegalArgumentException("Config file not found: " + configFile);
            }
            settings = SettingsLoader.load(configFile);
        } else {
            settings = SettingsLoader.loadDefault();
        }
        if (platform != null) {
            settings = settings.withPlatform(Platform.fromName(platform));
        }
        Standards std = settings.standards();
        for (String s : standards) {
            if (s.toLowerCase().contains("++")) {
                std = new Standards(std.c(), Standards.CppStandard.fromString(s));
            } else {
                std = new Standards(Standards.CStandard.fromString(s), std.cpp());
            }
        }
        return settings.withStandards(std);
    }

    static Language parseLanguage(String value) {
        if (value == null) {
            return Language.NONE;
        }
        return switch (value.toLowerCase()) {
            case "c" -> Language.C;
            case "c++", "cpp" -> Language.CPP;
            default -> throw new IllegalArgumentException("Language must be 'c' or 'c++', got: " + value);
        };
    }

    private void printTextReport(PrintWriter out, List<UnitReport> reports, int failed) {
        out.println("=".repeat(80));
        out.println("TOKEN LIST REPORT");
        out.println("=".repeat(80));
        for (UnitReport report : reports) {
            out.println(report.getSummary());
            if (showAst && report.isOk()) {
                for (String expression : report.expressions()) {
                    out.println("    " + expression);
                }
            }
        }
        out.println("-".repeat(80));
        out.printf("Files analyzed: %d, failed: %d%n", reports.size(), failed);
    }

    private static void printJsonReport(PrintWriter out, RunReport report) throws IOException {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
    }
}
