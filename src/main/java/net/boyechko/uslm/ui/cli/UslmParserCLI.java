/*
 * USLM-Tree - Legal Code Hierarchy Parser
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.uslm.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import net.boyechko.uslm.core.ParserConfig;
import net.boyechko.uslm.core.ParsingService;
import net.boyechko.uslm.core.StructureException;
import net.boyechko.uslm.core.VerbosityLevel;
import net.boyechko.uslm.graph.GraphIngestor;
import net.boyechko.uslm.graph.InMemoryGraphSink;
import net.boyechko.uslm.graph.IngestStats;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.ParsedDocument;
import net.boyechko.uslm.ui.JsonExporter;
import net.boyechko.uslm.ui.ParsingReporter;
import net.boyechko.uslm.ui.TreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class UslmParserCLI {
    private static final int HIERARCHY_DEPTH = 8;

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputPath,
            Path configPath,
            Integer maxSections,
            boolean maxSectionsSet,
            boolean showHierarchy,
            String showSection,
            boolean graphStats,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputPath;
        Path configPath;
        Integer maxSections;
        boolean maxSectionsSet;
        boolean showHierarchy;
        String showSection;
        boolean graphStats;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (configPath != null && !Files.exists(configPath)) {
                throw new CLIException("Config file not found: " + configPath);
            }
            if (outputPath != null && Files.isDirectory(outputPath)) {
                String baseName =
                        inputPath.getFileName().toString().replaceFirst("[.][^.]+$", "");
                outputPath = outputPath.resolve(baseName + ".json");
            }
            return new CLIConfig(
                    inputPath,
                    outputPath,
                    configPath,
                    maxSections,
                    maxSectionsSet,
                    showHierarchy,
                    showSection,
                    graphStats,
                    verbosity);
        }
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Runs the parser with the given arguments and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return 0;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config.verbosity());
            logger().info(
                            "Starting parse of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            return processFile(config, out, err);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-n", "--max-sections" -> {
                    String value = requireValue(args, i++, "Section count not specified after -n");
                    b.maxSections = parseMaxSections(value);
                    b.maxSectionsSet = true;
                }
                case "-o", "--output" ->
                        b.outputPath =
                                Paths.get(
                                        requireValue(
                                                args, i++, "Output file not specified after -o"));
                case "-c", "--config" ->
                        b.configPath =
                                Paths.get(
                                        requireValue(
                                                args, i++, "Config file not specified after -c"));
                case "-s", "--show-section" ->
                        b.showSection =
                                requireValue(args, i++, "Section number not specified after -s");
                case "-t", "--show-hierarchy" -> b.showHierarchy = true;
                case "-g", "--graph-stats" -> b.graphStats = true;
                case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new CLIException("Unknown option: " + args[i]);
                    } else if (b.inputPath == null) {
                        b.inputPath = Paths.get(args[i]);
                    } else {
                        throw new CLIException("Multiple input files specified");
                    }
                }
            }
        }

        return b.build();
    }

    private static String requireValue(String[] args, int optionIndex, String missingMessage)
            throws CLIException {
        if (optionIndex + 1 < args.length) {
            return args[optionIndex + 1];
        }
        throw new CLIException(missingMessage);
    }

    /** Zero means no cutoff. */
    private static Integer parseMaxSections(String value) throws CLIException {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new CLIException("Invalid section count: " + value);
        }
        if (parsed < 0) {
            throw new CLIException("Section count must not be negative: " + value);
        }
        return parsed == 0 ? null : parsed;
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        ctx.getLogger("net.boyechko.uslm").setLevel(level);
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(UslmParserCLI.class);
        }
        return logger;
    }

    private static int processFile(CLIConfig config, PrintStream out, PrintStream err) {
        ParsingReporter reporter = new ParsingReporter(out, config.verbosity());
        try {
            ParserConfig parserConfig =
                    config.configPath() != null
                            ? ParserConfig.fromFile(config.configPath())
                            : ParserConfig.loadDefault();

            ParsingService.ParsingServiceBuilder builder =
                    new ParsingService.ParsingServiceBuilder()
                            .withConfig(parserConfig)
                            .withListener(reporter);
            if (config.maxSectionsSet()) {
                builder.withMaxSections(config.maxSections());
            }
            ParsingService service = builder.build();

            ParsedDocument parsed = service.parseFile(config.inputPath());

            if (config.showHierarchy()) {
                out.println();
                out.println("Hierarchy (first " + HIERARCHY_DEPTH + " levels):");
                out.print(TreeFormatter.hierarchy(parsed.root(), HIERARCHY_DEPTH));
            }

            if (config.showSection() != null) {
                out.println();
                Optional<LegalNode> section = parsed.getSection(config.showSection());
                if (section.isPresent()) {
                    out.print(TreeFormatter.sectionDetails(section.get()));
                } else {
                    reporter.onError("Section " + config.showSection() + " not found");
                }
            }

            if (config.graphStats()) {
                printGraphStats(parsed, service.config().getBatchSize(), out);
            }

            if (config.outputPath() != null) {
                new JsonExporter().export(parsed, config.outputPath());
                reporter.onSuccess("Exported to " + config.outputPath());
            }
            reporter.finish();
            return 0;
        } catch (StructureException e) {
            reporter.finish();
            err.println("✗ Parsing failed: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            reporter.finish();
            err.println("✗ Invalid configuration: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            reporter.finish();
            err.println("✗ Failed to write output: " + e.getMessage());
            logger().debug("Export failure", e);
            return 1;
        }
    }

    private static void printGraphStats(ParsedDocument parsed, int batchSize, PrintStream out) {
        InMemoryGraphSink sink = new InMemoryGraphSink(parsed.codeLabel());
        IngestStats stats = new GraphIngestor(sink, batchSize).ingest(parsed);
        out.println();
        out.println("Graph statistics:");
        out.println("  Nodes: " + stats.totalNodes());
        out.println("  PARENT_OF relationships: " + stats.parentRelationships());
        out.println("  REFERENCES relationships: " + stats.referenceRelationships());
        out.println("  References to sections not in graph: " + stats.referencesNotFound());
        for (Map.Entry<String, Integer> e : stats.relationshipCounts().entrySet()) {
            out.println("  " + e.getKey() + ": " + e.getValue());
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: java UslmParserCLI [-q|-v|-vv] [-n N] [-t] [-s N] [-g] [-c config.yaml]"
                + " [-o output.json] <input.xml>\n"
                + "  -h, --help              Show this help message\n"
                + "  -n, --max-sections N    Stop after N sections (0 for no limit)\n"
                + "  -o, --output <file>     Export the parsed tree as JSON\n"
                + "  -t, --show-hierarchy    Print the node hierarchy\n"
                + "  -s, --show-section N    Print details for section N\n"
                + "  -g, --graph-stats       Load the tree into an in-memory graph, print counts\n"
                + "  -c, --config <file>     Read parser settings from a YAML file\n"
                + "  -q, --quiet             Only show errors and final status\n"
                + "  -v, --verbose           Show detailed parsing information\n"
                + "  -vv, --debug            Show all debug information\n"
                + "Examples:\n"
                + "  java UslmParserCLI -n 50 -t usc26.xml\n"
                + "  java UslmParserCLI -n 0 -o usc26.json usc26.xml\n"
                + "  java UslmParserCLI -s 162 -g usc26.xml";
    }
}
