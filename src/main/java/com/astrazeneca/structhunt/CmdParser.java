package com.astrazeneca.structhunt;

import com.astrazeneca.structhunt.data.PredictorOutputFormat;
import com.astrazeneca.structhunt.exception.ConfigurationException;
import com.astrazeneca.structhunt.printers.PrinterType;
import org.apache.commons.cli.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;

import static com.astrazeneca.structhunt.data.Patterns.COLUMN_RANGE;
import static com.astrazeneca.structhunt.data.Patterns.WHITESPACES;

/**
 * Class to parse the parameters from the command line
 */
public class CmdParser {
    /**
     * Parses the array of command line parameters and fills configuration parameters.
     * @param args arguments from command line to be parsed
     * @return configuration with parameters from command line
     * @throws ParseException if parse can't be finished
     */
    public Configuration parseParams(String[] args) throws ParseException {
        Options options = buildOptions();

        CommandLineParser parser = new BasicParser();

        Configuration config = null;

        try {
            CommandLine cmd = parser.parse(options, args);
            if ((cmd.getOptions().length == 0 && cmd.getArgs().length == 0) || cmd.hasOption("H")) {
                help(options);
            }
            config = parseCmd(cmd);
        } catch (MissingOptionException e) {
            List<?> missingOptions = e.getMissingOptions();
            System.err.print("Missing required option(s): ");
            for (Iterator<?> iterator = missingOptions.iterator(); iterator.hasNext(); ) {
                Object object = iterator.next();
                System.err.print(object);
                if (iterator.hasNext()) {
                    System.err.print(", ");
                }
            }
            System.err.println();
            help(options);
        }

        return config;
    }

    /**
     * For each parameter in CMD set the Configuration variable
     * @param cmd parsed CommandLine from apache CLI
     * @return configuration with parameters from command line
     * @throws ParseException if a numeric option can't be read
     */
    Configuration parseCmd(CommandLine cmd) throws ParseException {
        Configuration config = new Configuration();

        config.input = cmd.getOptionValue("i");
        String[] args = cmd.getArgs();
        if (config.input == null && args.length > 0) {
            config.input = args[0];
        }
        config.outputDir = cmd.getOptionValue("o");
        config.workDir = cmd.getOptionValue("w");
        config.annotation = cmd.getOptionValue("g");
        config.printHeader = cmd.hasOption('h');
        config.y = cmd.hasOption("y");
        config.writeBed = cmd.hasOption("bed");

        if (cmd.hasOption("b")) {
            String base = cmd.getOptionValue("b");
            if (base.length() != 1) {
                throw new ConfigurationException("-b", "repeat base must be one nucleotide, got \"" + base + "\"");
            }
            config.repeatBase = Character.toUpperCase(base.charAt(0));
        }
        config.minRunLength = getIntValue(cmd, "r", Configuration.DEFAULT_MIN_RUN_LENGTH);
        config.maxRunLength = getIntValue(cmd, "R", Configuration.DEFAULT_MAX_RUN_LENGTH);
        config.maxLoopLength = getIntValue(cmd, "l", Configuration.DEFAULT_MAX_LOOP_LENGTH);
        config.minScore = getDoubleValue(cmd, "m", Configuration.DEFAULT_MIN_SCORE);

        config.predictorCommand = cmd.getOptionValue("p");
        if (cmd.hasOption("a")) {
            config.predictorArguments = splitArguments(cmd.getOptionValue("a"));
        }
        config.intermediateExtension = cmd.getOptionValue("zext", config.intermediateExtension);
        config.finalExtension = cmd.getOptionValue("pext", config.finalExtension);
        config.minMetric = getDoubleValue(cmd, "z", Configuration.DEFAULT_MIN_METRIC);
        config.maxMetric = getDoubleValue(cmd, "Z", Configuration.DEFAULT_MAX_METRIC);
        config.predictorFormat = readPredictorFormat(cmd);

        config.window = getIntValue(cmd, "W", Configuration.DEFAULT_WINDOW);
        config.upstream = getIntValue(cmd, "u", config.upstream);
        config.downstream = getIntValue(cmd, "d", config.downstream);

        config.threads = Math.max(readThreadsCount(cmd), 1);
        config.predictorThreads = getIntValue(cmd, "pth", config.predictorThreads);
        config.minPartitionLength = getLongValue(cmd, "M", config.minPartitionLength);
        config.pollIntervalMillis = getLongValue(cmd, "I", config.pollIntervalMillis);
        config.graceMillis = getLongValue(cmd, "grace", config.graceMillis);
        config.timeoutMillis = getLongValue(cmd, "timeout", 0);
        config.maxWarnings = getIntValue(cmd, "warn", config.maxWarnings);
        config.lineWidth = getIntValue(cmd, "L", config.lineWidth);

        if (cmd.hasOption("DP")) {
            String defaultPrinter = cmd.getOptionValue("DP", PrinterType.OUT.name());
            switch (defaultPrinter) {
                case "ERR": config.printerType = PrinterType.ERR; break;
                case "OUT":
                default: config.printerType = PrinterType.OUT;
            }
        }
        return config;
    }

    /**
     * Builds the predictor output layout. Column options are 1-based, a sequence column of 0 means none.
     * @param cmd parsed CommandLine from apache CLI
     * @return layout, the default one for every option that isn't set
     * @throws ParseException if a column option can't be read
     */
    private PredictorOutputFormat readPredictorFormat(CommandLine cmd) throws ParseException {
        PredictorOutputFormat defaults = PredictorOutputFormat.DEFAULT;
        int position = getColumnValue(cmd, "pc", defaults.positionColumn);
        int metric = getColumnValue(cmd, "mc", defaults.metricColumn);
        int sequence = getColumnValue(cmd, "sc", defaults.sequenceColumn);
        int[] aux = defaults.auxColumns;
        if (cmd.hasOption("ac")) {
            String value = cmd.getOptionValue("ac").trim();
            if (value.isEmpty()) {
                aux = new int[0];
            } else {
                String[] columns = value.split(",");
                aux = new int[columns.length];
                for (int i = 0; i < columns.length; i++) {
                    aux[i] = toColumn(columns[i].trim(), "-ac");
                }
            }
        }
        int minColumns = defaults.minColumns;
        int maxColumns = defaults.maxColumns;
        if (cmd.hasOption("cols")) {
            Matcher range = COLUMN_RANGE.matcher(cmd.getOptionValue("cols").trim());
            if (!range.matches()) {
                throw new ConfigurationException("-cols", "expected N or N-M, got \"" + cmd.getOptionValue("cols") + "\"");
            }
            minColumns = Integer.parseInt(range.group(1));
            maxColumns = range.group(2) == null ? minColumns : Integer.parseInt(range.group(2));
        }
        boolean oneBased = defaults.oneBasedPositions;
        if (cmd.hasOption("zb")) {
            oneBased = 1 == getIntValue(cmd, "zb", 1);
        }
        int windowLength = getIntValue(cmd, "pw", defaults.windowLength);
        return new PredictorOutputFormat(position, metric, aux, sequence, minColumns, maxColumns, oneBased,
                windowLength);
    }

    private static int toColumn(String value, String option) {
        try {
            int column = Integer.parseInt(value);
            if (column < 1) {
                throw new ConfigurationException(option, "columns start from 1, got " + value);
            }
            return column - 1;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(option, "\"" + value + "\" is not a column number");
        }
    }

    static List<String> splitArguments(String value) {
        List<String> arguments = new ArrayList<>();
        for (String argument : WHITESPACES.split(value.replace(',', ' ').trim())) {
            if (!argument.isEmpty()) {
                arguments.add(argument);
            }
        }
        return arguments;
    }

    /**
     * Help information about options contains long and short option names and their descriptions
     * @return options from apache CLI
     */
    @SuppressWarnings("static-access")
    private Options buildOptions() {
        Options options = new Options();
        options.addOption("H", "?", false, "Print this help page");
        options.addOption("h", "header", false, "Print a header row describing columns");
        options.addOption("y", "verbose", false, "Verbose mode.  Will output timing and predictor progress to STDERR");
        options.addOption("bed", false, "Write BED files of the candidates into the output directory");

        options.addOption(OptionBuilder.withArgName("fasta")
                .hasArg(true)
                .withDescription("The multi-sequence FASTA file to scan")
                .withType(String.class)
                .isRequired(false)
                .create('i'));

        options.addOption(OptionBuilder.withArgName("dir")
                .hasArg(true)
                .withDescription("The directory for result tables.  If not set, tables are printed to STDOUT")
                .withType(String.class)
                .isRequired(false)
                .create('o'));

        options.addOption(OptionBuilder.withArgName("dir")
                .hasArg(true)
                .withDescription("The directory for partition files and predictor output.  Default: <output dir>/partitions, "
                        + "or a temporary directory")
                .withType(String.class)
                .isRequired(false)
                .create('w'));

        options.addOption(OptionBuilder.withArgName("gtf")
                .hasArg(true)
                .withDescription("The GTF annotation.  Transcripts are used for gene and promoter overlaps")
                .withType(String.class)
                .isRequired(false)
                .create('g'));

        options.addOption(OptionBuilder.withArgName("base")
                .hasArg(true)
                .withDescription("The repeated nucleotide of quadruplex runs.  Default: G")
                .withType(String.class)
                .isRequired(false)
                .create('b'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The smallest run length class scanned.  Default: 3")
                .withType(Number.class)
                .isRequired(false)
                .create('r'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The first run length class not scanned.  Default: 7")
                .withType(Number.class)
                .isRequired(false)
                .create('R'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The maximal loop length between runs.  Default: 7")
                .withType(Number.class)
                .isRequired(false)
                .create('l'));

        options.addOption(OptionBuilder.withArgName("double")
                .hasArg(true)
                .withDescription("The minimal quadruplex score.  Default: 50")
                .withType(Number.class)
                .isRequired(false)
                .create('m'));

        options.addOption(OptionBuilder.withArgName("command")
                .hasArg(true)
                .withDescription("The structure predictor program.  If not set, only quadruplexes are searched")
                .withType(String.class)
                .isRequired(false)
                .create('p'));

        options.addOption(OptionBuilder.withArgName("args")
                .hasArg(true)
                .withDescription("The predictor arguments before the sequence file, space or comma separated.  Default: \"12 8 12\"")
                .withType(String.class)
                .isRequired(false)
                .create('a'));

        options.addOption(OptionBuilder.withArgName("ext")
                .hasArg(true)
                .withDescription("The extension of the predictor intermediate scores.  Default: .Z-SCORE")
                .withType(String.class)
                .isRequired(false)
                .create("zext"));

        options.addOption(OptionBuilder.withArgName("ext")
                .hasArg(true)
                .withDescription("The extension of the predictor final output.  Default: .probability")
                .withType(String.class)
                .isRequired(false)
                .create("pext"));

        options.addOption(OptionBuilder.withArgName("double")
                .hasArg(true)
                .withDescription("The minimal quality metric of predicted structures, inclusive.  Default: 300")
                .withType(Number.class)
                .isRequired(false)
                .create('z'));

        options.addOption(OptionBuilder.withArgName("double")
                .hasArg(true)
                .withDescription("The maximal quality metric of predicted structures, inclusive.  Default: 400")
                .withType(Number.class)
                .isRequired(false)
                .create('Z'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The column of the position in predictor output.  Default: 1")
                .withType(Number.class)
                .isRequired(false)
                .create("pc"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The column of the quality metric in predictor output.  Default: 4")
                .withType(Number.class)
                .isRequired(false)
                .create("mc"));

        options.addOption(OptionBuilder.withArgName("INT,INT")
                .hasArg(true)
                .withDescription("The columns of other scores in predictor output.  Default: 2,3")
                .withType(String.class)
                .isRequired(false)
                .create("ac"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The column of the window sequence in predictor output, 0 if there is none.  Default: 5")
                .withType(Number.class)
                .isRequired(false)
                .create("sc"));

        options.addOption(OptionBuilder.withArgName("INT-INT")
                .hasArg(true)
                .withDescription("The accepted number of columns in predictor output.  Default: 4-5")
                .withType(String.class)
                .isRequired(false)
                .create("cols"));

        options.addOption(OptionBuilder.withArgName("0/1")
                .hasArg(true)
                .withDescription("Indicate whether predictor positions are 1-based.  Default: 1")
                .withType(Number.class)
                .isRequired(false)
                .create("zb"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The span of a predicted structure without sequence text.  Default: 12")
                .withType(Number.class)
                .isRequired(false)
                .create("pw"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The maximal distance between a quadruplex and a predicted structure.  Default: 1000")
                .withType(Number.class)
                .isRequired(false)
                .create('W'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The promoter length upstream of the transcription start.  Default: 1000")
                .withType(Number.class)
                .isRequired(false)
                .create('u'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The promoter length downstream of the transcription start.  Default: 1000")
                .withType(Number.class)
                .isRequired(false)
                .create('d'));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasOptionalArg()
                .withDescription("Threads count.  Without a value, the number of available processors is used")
                .withType(Number.class)
                .isRequired(false)
                .create("th"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("Maximum number of simultaneous predictor runs, capped by the available processors."
                        + "  Default: the number of available processors")
                .withType(Number.class)
                .isRequired(false)
                .create("pth"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The predictor runs only on sequences longer than INT bases.  Default: 1048576")
                .withType(Number.class)
                .isRequired(false)
                .create('M'));

        options.addOption(OptionBuilder.withArgName("msec")
                .hasArg(true)
                .withDescription("The interval of predictor progress polls.  Default: 2000")
                .withType(Number.class)
                .isRequired(false)
                .create('I'));

        options.addOption(OptionBuilder.withArgName("msec")
                .hasArg(true)
                .withDescription("The time a cancelled predictor gets before it is killed.  Default: 5000")
                .withType(Number.class)
                .isRequired(false)
                .create("grace"));

        options.addOption(OptionBuilder.withArgName("msec")
                .hasArg(true)
                .withDescription("The time limit of one predictor run, 0 for none.  Default: 0")
                .withType(Number.class)
                .isRequired(false)
                .create("timeout"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The number of malformed lines reported per file.  Default: 10")
                .withType(Number.class)
                .isRequired(false)
                .create("warn"));

        options.addOption(OptionBuilder.withArgName("INT")
                .hasArg(true)
                .withDescription("The line width of partition FASTA files, 0 for one line.  Default: 60")
                .withType(Number.class)
                .isRequired(false)
                .create('L'));

        options.addOption(OptionBuilder.withArgName("OUT/ERR")
                .hasArg(true)
                .withDescription("The printer for tables when no output directory is set.  Default: OUT")
                .withType(String.class)
                .isRequired(false)
                .create("DP"));

        return options;
    }

    private int getIntValue(CommandLine cmd, String option, int defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(option);
        return value == null ? defaultValue : ((Number) value).intValue();
    }

    private long getLongValue(CommandLine cmd, String option, long defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(option);
        return value == null ? defaultValue : ((Number) value).longValue();
    }

    private int getColumnValue(CommandLine cmd, String opt, int defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(opt);
        return value == null ? defaultValue : ((Number) value).intValue() - 1;
    }

    private double getDoubleValue(CommandLine cmd, String opt, double defaultValue) throws ParseException {
        Object value = cmd.getParsedOptionValue(opt);
        return value == null ? defaultValue : ((Number) value).doubleValue();
    }

    /**
     * Calculates possible count of threads to use. If -th set without value, it will be set to number of
     * available processors.
     * @param cmd parsed CommandLine from apache CLI
     * @return number of threads
     * @throws ParseException if option -th can't be read
     */
    private int readThreadsCount(CommandLine cmd) throws ParseException {
        int threads = 0;
        if (cmd.hasOption("th")) {
            Object value = cmd.getParsedOptionValue("th");
            if (value == null) {
                threads = Runtime.getRuntime().availableProcessors();
            } else {
                threads = ((Number) value).intValue();
            }
        }
        return threads;
    }

    private void help(Options options) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.setOptionComparator(null);
        formatter.printHelp(142, "structhunt -i input.fa [-o dir] [-g genes.gtf] [-p predictor] [-th [threads]] "
                        + "[-r min_run] [-R max_run] [-l max_loop] [-m min_score] [-z min_metric] [-Z max_metric] [-W window]",
                "StructHunt searches G-quadruplex forming repeats in every sequence of a FASTA file and, when a structure\n"
                        + "predictor is given, runs it over every long enough sequence in parallel, keeps the predicted Z-DNA\n"
                        + "windows within the quality band and pairs them with nearby quadruplexes.  With a GTF annotation both\n"
                        + "motif classes are also intersected with gene bodies and promoters.\nOptions:",
                options, "EXIT STATUS\n"
                        + ".       0 when every predictor run succeeded, 2 when some of them failed, 1 on failure");

        System.exit(0);
    }
}
