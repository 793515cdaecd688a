package com.metabolite.classification.cli;

import com.metabolite.classification.bulk.CsvNameImporter;
import com.metabolite.classification.bulk.CsvResultExporter;
import com.metabolite.classification.bulk.ExportResult;
import com.metabolite.classification.bulk.JsonResultExporter;
import com.metabolite.classification.bulk.ResultExporter;
import com.metabolite.classification.core.model.ResultTable;
import com.metabolite.classification.pipeline.PipelineConfig;
import com.metabolite.classification.pipeline.PipelineOrchestrator;
import com.metabolite.classification.pipeline.ProgressListener;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

/**
 * Command-line entry point: reads names from the first column of a CSV file, runs the
 * pipeline and writes the result table as CSV or JSON.
 */
public class MetaboliteClassifierCli {
    private static final Logger log = LoggerFactory.getLogger(MetaboliteClassifierCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;

    private static final String APP_NAME = "metabolite-classifier";

    public static final String OPTION_INPUT = "input";
    public static final String OPTION_OUTPUT = "output";
    public static final String OPTION_FORMAT = "format";
    public static final String OPTION_SUMMARY = "summary";
    public static final String OPTION_HMDB_DELAY = "hmdb-delay-ms";
    public static final String OPTION_KEGG_DELAY = "kegg-delay-ms";
    public static final String OPTION_KEGG_PARTIAL = "kegg-partial";
    public static final String OPTION_HELP = "help";

    private final PipelineOrchestrator.Builder pipelineBuilder;

    public MetaboliteClassifierCli() {
        this(PipelineOrchestrator.builder());
    }

    MetaboliteClassifierCli(PipelineOrchestrator.Builder pipelineBuilder) {
        this.pipelineBuilder = pipelineBuilder;
    }

    public static void main(String[] args) {
        System.exit(new MetaboliteClassifierCli().run(args));
    }

    static Options buildOptions() {
        Options opts = new Options();
        opts.addOption(Option.builder("i").longOpt(OPTION_INPUT).hasArg().argName("FILE")
                .desc("CSV file whose first column holds metabolite names (first row is a header)").build());
        opts.addOption(Option.builder("o").longOpt(OPTION_OUTPUT).hasArg().argName("FILE")
                .desc("Where to write the result table").build());
        opts.addOption(Option.builder("f").longOpt(OPTION_FORMAT).hasArg().argName("csv|json")
                .desc("Output format, csv by default").build());
        opts.addOption(Option.builder().longOpt(OPTION_SUMMARY)
                .desc("Only write final_type, super_class, pathways and ids").build());
        opts.addOption(Option.builder().longOpt(OPTION_HMDB_DELAY).hasArg().argName("MS")
                .desc("Pause between HMDB requests, 1000 by default").build());
        opts.addOption(Option.builder().longOpt(OPTION_KEGG_DELAY).hasArg().argName("MS")
                .desc("Pause between KEGG requests, 500 by default").build());
        opts.addOption(Option.builder().longOpt(OPTION_KEGG_PARTIAL)
                .desc("Keep KEGG data from whichever request succeeded when the other fails").build());
        opts.addOption(Option.builder("h").longOpt(OPTION_HELP).desc("Print this help message and exit").build());
        return opts;
    }

    /**
     * Runs the command and returns the process exit code.
     */
    public int run(String[] args) {
        Options opts = buildOptions();
        HelpFormatter helpFormatter = new HelpFormatter();
        CommandLineParser cmdLineParser = new DefaultParser();
        CommandLine cmdLine;
        try {
            cmdLine = cmdLineParser.parse(opts, args);
        } catch (ParseException e) {
            System.err.println("Caught exception when parsing command line: " + e.getMessage());
            helpFormatter.printHelp(APP_NAME, opts);
            return EXIT_USAGE;
        }

        if (cmdLine.hasOption(OPTION_HELP)) {
            helpFormatter.printHelp(APP_NAME, opts);
            return EXIT_OK;
        }
        if (!cmdLine.hasOption(OPTION_INPUT) || !cmdLine.hasOption(OPTION_OUTPUT)) {
            System.err.println("Both --" + OPTION_INPUT + " and --" + OPTION_OUTPUT + " are required");
            helpFormatter.printHelp(APP_NAME, opts);
            return EXIT_USAGE;
        }

        PipelineConfig config;
        ResultExporter exporter;
        try {
            config = buildConfig(cmdLine);
            exporter = buildExporter(cmdLine);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            helpFormatter.printHelp(APP_NAME, opts);
            return EXIT_USAGE;
        }

        Path input = Paths.get(cmdLine.getOptionValue(OPTION_INPUT));
        Path output = Paths.get(cmdLine.getOptionValue(OPTION_OUTPUT));
        if (!Files.isRegularFile(input)) {
            log.error("cli.input_missing path={}", input);
            return EXIT_IO;
        }

        List<String> names;
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            names = new CsvNameImporter().readNames(reader);
        } catch (IOException e) {
            log.error("cli.read_failed path={} error={}", input, e.getMessage());
            return EXIT_IO;
        }
        log.info("cli.loaded names={} input={}", names.size(), input);

        PipelineOrchestrator pipeline = pipelineBuilder.config(config).build();
        ResultTable table = pipeline.run(names, loggingListener());

        try (OutputStream out = Files.newOutputStream(output)) {
            ExportResult result = exporter.export(table, out);
            log.info("cli.written rows={} output={}", result.rows(), output);
        } catch (IOException e) {
            log.error("cli.write_failed path={} error={}", output, e.getMessage());
            return EXIT_IO;
        }
        return EXIT_OK;
    }

    static PipelineConfig buildConfig(CommandLine cmdLine) {
        PipelineConfig.Builder builder = PipelineConfig.builder();
        if (cmdLine.hasOption(OPTION_HMDB_DELAY)) {
            builder.hmdbDelay(parseMillis(cmdLine.getOptionValue(OPTION_HMDB_DELAY), OPTION_HMDB_DELAY));
        }
        if (cmdLine.hasOption(OPTION_KEGG_DELAY)) {
            builder.keggDelay(parseMillis(cmdLine.getOptionValue(OPTION_KEGG_DELAY), OPTION_KEGG_DELAY));
        }
        builder.keggPartialResults(cmdLine.hasOption(OPTION_KEGG_PARTIAL));
        return builder.build();
    }

    static ResultExporter buildExporter(CommandLine cmdLine) {
        boolean summary = cmdLine.hasOption(OPTION_SUMMARY);
        String format = cmdLine.getOptionValue(OPTION_FORMAT, "csv");
        switch (format) {
            case "csv":
                return new CsvResultExporter(summary);
            case "json":
                return new JsonResultExporter(summary);
            default:
                throw new IllegalArgumentException("Unsupported output format: " + format);
        }
    }

    private static Duration parseMillis(String value, String option) {
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " expects a number of milliseconds, got: " + value);
        }
    }

    private static ProgressListener loggingListener() {
        return (fraction, message) -> log.info("progress {}% {}", Math.round(fraction * 100), message);
    }
}
