package com.forumprep.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forumprep.config.FlattenConfig;
import com.forumprep.model.Phase;
import com.forumprep.util.dom.FlattenedHtmlResult;
import com.forumprep.util.dom.HtmlFlattener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Command line entry point: reads an HTML file, runs the selected phases and
 * writes the processed HTML.
 */
public class ForumPrepCli {
    private static final Logger logger = LoggerFactory.getLogger(ForumPrepCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "usage: forumprep -i <file> [-o <file>] [-A] [-a] [-l] [-n] [-v] [-c <properties>] [--report <file>]",
            "  -i, --in-file <file>          Input file path",
            "  -o, --out-html-file <file>    Output file path for HTML",
            "  -A, --auto-output             Write <input>.out.html",
            "  -a, --all-filters             Apply all filters (phases)",
            "  -l, --link-css                Apply filter: link external CSS",
            "  -n, --inline-css              Apply filter: inline CSS",
            "  -v, --remove-invisible        Apply filter: remove invisible",
            "  -c, --config <properties>     Override configuration",
            "      --report <file>           Write a JSON metrics report");

    private final ObjectMapper objectMapper;

    public ForumPrepCli() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        System.exit(new ForumPrepCli().run(args, System.err));
    }

    /**
     * Options parsed from the command line
     */
    static final class Options {
        Path inFile;
        Path outHtmlFile;
        Path configFile;
        Path reportFile;
        boolean autoOutput;
        final Set<Phase> phases = EnumSet.noneOf(Phase.class);
    }

    static Options parse(String[] args) {
        Options options = new Options();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-i", "--in-file" -> options.inFile = Path.of(requireValue(args, ++i, arg));
                case "-o", "--out-html-file" -> options.outHtmlFile = Path.of(requireValue(args, ++i, arg));
                case "-c", "--config" -> options.configFile = Path.of(requireValue(args, ++i, arg));
                case "--report" -> options.reportFile = Path.of(requireValue(args, ++i, arg));
                case "-A", "--auto-output" -> options.autoOutput = true;
                case "-a", "--all-filters" -> options.phases.addAll(EnumSet.allOf(Phase.class));
                case "-l", "--link-css" -> options.phases.add(Phase.LINK_CSS);
                case "-n", "--inline-css" -> options.phases.add(Phase.INLINE_CSS);
                case "-v", "--remove-invisible" -> options.phases.add(Phase.REMOVE_INVISIBLE);
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        if (options.inFile == null) {
            throw new IllegalArgumentException("Missing required option: -i/--in-file");
        }
        if (options.autoOutput && options.outHtmlFile == null) {
            options.outHtmlFile = autoOutputPath(options.inFile);
        }
        return options;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("-")) {
            throw new IllegalArgumentException("Option " + option + " requires a value");
        }
        return args[index];
    }

    static Path autoOutputPath(Path inFile) {
        String name = inFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return inFile.resolveSibling(stem + ".out.html");
    }

    int run(String[] args, PrintStream err) {
        Options options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        if (!Files.isRegularFile(options.inFile)) {
            err.println("Error: Input HTML file not found at " + options.inFile);
            return EXIT_IO_ERROR;
        }

        try {
            FlattenConfig config = options.configFile != null
                    ? FlattenConfig.fromFile(options.configFile)
                    : FlattenConfig.fromProperties();
            HtmlFlattener flattener = new HtmlFlattener(config);

            logger.info("Processing HTML from: {}", options.inFile);
            String raw = Files.readString(options.inFile, StandardCharsets.UTF_8);
            Path baseDir = options.inFile.toAbsolutePath().getParent();
            FlattenedHtmlResult result = flattener.flatten(raw, options.phases, baseDir);

            if (options.outHtmlFile != null) {
                Files.writeString(options.outHtmlFile, result.getHtml(), StandardCharsets.UTF_8);
                logger.info("Processed HTML saved to: {}", options.outHtmlFile);
            }

            if (options.reportFile != null) {
                List<String> phaseNames = new ArrayList<>();
                for (Phase phase : options.phases) {
                    phaseNames.add(phase.getReportName());
                }
                FlattenReport report = new FlattenReport(
                        options.inFile.toString(),
                        options.outHtmlFile == null ? null : options.outHtmlFile.toString(),
                        phaseNames,
                        Instant.now(),
                        result.getMetrics());
                objectMapper.writeValue(options.reportFile.toFile(), report);
                logger.info("Report saved to: {}", options.reportFile);
            }
            return EXIT_OK;
        } catch (IOException e) {
            logger.error("Processing failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_IO_ERROR;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
    }
}
