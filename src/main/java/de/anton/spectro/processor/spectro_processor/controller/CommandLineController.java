package de.anton.spectro.processor.spectro_processor.controller;

import de.anton.spectro.processor.spectro_processor.model.ConfigField;
import de.anton.spectro.processor.spectro_processor.model.ParameterBundle;
import de.anton.spectro.processor.spectro_processor.model.ParameterSpec;
import de.anton.spectro.processor.spectro_processor.model.Parameters;
import de.anton.spectro.processor.spectro_processor.model.ProcessingException;
import de.anton.spectro.processor.spectro_processor.model.ValueType;
import de.anton.spectro.processor.spectro_processor.service.ExperimentFileService;
import de.anton.spectro.processor.spectro_processor.service.ExperimentPreview;
import de.anton.spectro.processor.spectro_processor.service.ProcessingConfiguration;
import de.anton.spectro.processor.spectro_processor.service.ProcessingResult;
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
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command line front end: parses options into a parameter bundle, runs the file service and
 * writes the results. Returns an exit code instead of exiting so it can be driven from tests.
 */
public class CommandLineController {

    private static final Logger logger = LoggerFactory.getLogger(CommandLineController.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_PROCESSING = 2;

    static final String OPTION_INPUT = "input";
    static final String OPTION_IDENTIFY = "identify";
    static final String OPTION_PARAMS = "params";
    static final String OPTION_OUTPUT = "output";
    static final String OPTION_EXCEL = "excel";
    static final String OPTION_PLOT = "plot";
    static final String OPTION_COLUMN_WIDTH = "column-width";
    static final String OPTION_NO_SETUP_HEADER = "no-setup-header";
    static final String OPTION_HELP = "help";

    private static final String SYNTAX = "spectro-processor [options] <instrument file>";
    private static final String HELP_MESSAGE = "Processes CD and ATF instrument files (titration, pH, temperature "
            + "and wavelength experiments) into an R-readable table.";

    public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {
        {
            add(Option.builder("i").longOpt(OPTION_INPUT).hasArg().argName("FILE")
                    .desc("instrument file to process (may also be given as the first argument)"));
            add(Option.builder().longOpt(OPTION_IDENTIFY)
                    .desc("print instrument, experiment, configuration and expected parameters, then exit"));
            add(Option.builder("p").longOpt(OPTION_PARAMS).hasArg().argName("FILE")
                    .desc("properties file with parameters; command line values take precedence"));
            add(Option.builder("o").longOpt(OPTION_OUTPUT).hasArg().argName("FILE")
                    .desc("output file (default: standard output)"));
            add(Option.builder().longOpt(OPTION_EXCEL).hasArg().argName("FILE")
                    .desc("also export the table to an .xlsx workbook"));
            add(Option.builder().longOpt(OPTION_PLOT).hasArg().argName("FILE")
                    .desc("also save a PNG chart of the corrected channels"));
            add(Option.builder().longOpt(OPTION_COLUMN_WIDTH).hasArg().argName("N")
                    .desc("characters per output column (default 12)"));
            add(Option.builder().longOpt(OPTION_NO_SETUP_HEADER)
                    .desc("omit the user/date/comments block from the header"));
            add(Option.builder("h").longOpt(OPTION_HELP).desc("print this help and exit"));

            for (ParameterSpec spec : Parameters.catalog()) {
                Option.Builder builder = Option.builder().longOpt(toOptionName(spec.key()))
                        .desc(spec.description() + " (" + spec.type() + ")");
                if (spec.type() != ValueType.BOOLEAN) {
                    builder.hasArg().argName(spec.type().toString().toUpperCase(Locale.ROOT));
                }
                add(builder);
            }
        }
    };

    public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();

    static {
        HELP_FORMATTER.setWidth(100);
    }

    /** camelCase parameter key to kebab-case option name, e.g. {@code numResidues -> num-residues}. */
    static String toOptionName(String key) {
        return key.replaceAll("([a-z0-9])([A-Z])", "$1-$2").toLowerCase(Locale.ROOT);
    }

    static Options buildOptions() {
        Options options = new Options();
        for (Option.Builder builder : OPTION_BUILDERS) {
            options.addOption(builder.build());
        }
        return options;
    }

    /**
     * Runs the command line.
     *
     * @return {@link #EXIT_OK}, {@link #EXIT_USAGE} for argument errors or {@link #EXIT_PROCESSING}
     *         if the file could not be processed or written.
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        Options options = buildOptions();
        CommandLine cl;
        try {
            cl = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            logger.error("Argument parsing failed: {}", e.getMessage());
            err.println("Argument parsing failed: " + e.getMessage());
            printHelp(options, err);
            return EXIT_USAGE;
        }

        if (cl.hasOption(OPTION_HELP)) {
            printHelp(options, out);
            return EXIT_OK;
        }

        Path input = inputFile(cl);
        if (input == null) {
            err.println("No input file given.");
            printHelp(options, err);
            return EXIT_USAGE;
        }

        ProcessingConfiguration configuration;
        ParameterBundle parameters;
        try {
            configuration = configuration(cl);
            parameters = parameters(cl);
        } catch (IllegalArgumentException | IOException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            err.println("Invalid arguments: " + e.getMessage());
            return EXIT_USAGE;
        }

        ExperimentFileService service = new ExperimentFileService(configuration);
        try {
            if (cl.hasOption(OPTION_IDENTIFY)) {
                printPreview(service.preview(input), out);
                return EXIT_OK;
            }

            ProcessingResult result = service.process(input, parameters);
            if (cl.hasOption(OPTION_OUTPUT)) {
                service.writeOutput(result, Path.of(cl.getOptionValue(OPTION_OUTPUT)));
            } else {
                out.print(result.output());
                out.flush();
            }
            if (cl.hasOption(OPTION_EXCEL)) {
                service.exportExcel(result, Path.of(cl.getOptionValue(OPTION_EXCEL)));
            }
            if (cl.hasOption(OPTION_PLOT)) {
                service.writeChart(result, Path.of(cl.getOptionValue(OPTION_PLOT)));
            }
            return EXIT_OK;
        } catch (ProcessingException | ArithmeticException e) {
            logger.error("Processing of {} failed", input, e);
            err.println("Error: " + e.getMessage());
            return EXIT_PROCESSING;
        } catch (IOException e) {
            logger.error("Writing results for {} failed", input, e);
            err.println("Error writing results: " + e.getMessage());
            return EXIT_PROCESSING;
        }
    }

    private Path inputFile(CommandLine cl) {
        if (cl.hasOption(OPTION_INPUT)) {
            return Path.of(cl.getOptionValue(OPTION_INPUT));
        }
        List<String> positional = cl.getArgList();
        return positional.isEmpty() ? null : Path.of(positional.get(0));
    }

    private ProcessingConfiguration configuration(CommandLine cl) {
        ProcessingConfiguration configuration = ProcessingConfiguration.defaults();
        if (cl.hasOption(OPTION_COLUMN_WIDTH)) {
            configuration = configuration.withColumnWidth(Integer.parseInt(cl.getOptionValue(OPTION_COLUMN_WIDTH).trim()));
        }
        if (cl.hasOption(OPTION_NO_SETUP_HEADER)) {
            configuration = new ProcessingConfiguration(configuration.columnWidth(), configuration.decimals(), false);
        }
        return configuration;
    }

    /** Properties file first, then the command line options on top. */
    ParameterBundle parameters(CommandLine cl) throws IOException {
        ParameterBundle bundle = cl.hasOption(OPTION_PARAMS)
                ? ParameterBundle.fromProperties(Path.of(cl.getOptionValue(OPTION_PARAMS)))
                : new ParameterBundle();
        for (ParameterSpec spec : Parameters.catalog()) {
            String option = toOptionName(spec.key());
            if (!cl.hasOption(option)) {
                continue;
            }
            bundle.put(spec.key(), spec.type() == ValueType.BOOLEAN ? Boolean.TRUE : cl.getOptionValue(option));
        }
        logger.debug("Parameters from command line: {}", bundle);
        return bundle;
    }

    private void printHelp(Options options, PrintStream stream) {
        PrintWriter writer = new PrintWriter(stream);
        HELP_FORMATTER.printHelp(writer, HELP_FORMATTER.getWidth(), SYNTAX, HELP_MESSAGE, options,
                HELP_FORMATTER.getLeftPadding(), HELP_FORMATTER.getDescPadding(), null, false);
        writer.flush();
    }

    private void printPreview(ExperimentPreview preview, PrintStream out) {
        out.println("Instrument: " + preview.descriptor().instrument());
        out.println("Experiment: " + preview.descriptor().experimentType());
        out.println("Channels: " + String.join(", ", preview.channelNames()));
        out.println("Configuration:");
        for (ConfigField field : preview.configFields()) {
            out.println("  " + field.getTitle() + ": " + field.formatValue());
        }
        out.println("Required parameters:");
        for (ParameterSpec spec : preview.requiredParameters()) {
            out.println("  --" + toOptionName(spec.key()) + " (" + spec.type() + "): " + spec.description());
        }
        out.println("Optional parameters:");
        for (ParameterSpec spec : preview.optionalParameters()) {
            out.println("  --" + toOptionName(spec.key()) + " (" + spec.type() + "): " + spec.description());
        }
        out.flush();
    }
}
