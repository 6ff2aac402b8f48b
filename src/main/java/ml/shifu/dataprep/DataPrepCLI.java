/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.dataprep;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import ml.shifu.dataprep.container.obj.DatasetSchema;
import ml.shifu.dataprep.container.obj.ProcessingConfig;
import ml.shifu.dataprep.core.processor.CleanseProcessor;
import ml.shifu.dataprep.exception.DataPrepException;
import ml.shifu.dataprep.util.Constants;
import ml.shifu.dataprep.util.LoggerUtils;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DataPrepCLI is the MAIN class: it reads the options from command line, loads config and schema and runs the cleanse
 * step over the input files.
 */
public class DataPrepCLI {

    private static final String INPUT = "input";
    private static final String OUTPUT = "output";
    private static final String CONFIG = "config";
    private static final String SCHEMA = "schema";
    private static final String STRATEGY = "strategy";
    private static final String DELIMITER = "delimiter";
    private static final String HELP = "help";

    private static final String BASE_LOGGER = "ml.shifu.dataprep";

    private static final Logger log = LoggerFactory.getLogger(DataPrepCLI.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Run the command line without exiting the jvm.
     *
     * @return 0 if all datasets are cleaned, 1 if any dataset failed, -1 on invalid options, config or input
     */
    public static int run(String[] args) {
        Options opts = buildOptions();
        if(args.length > 0 && isHelpOption(args[0])) {
            printUsage(opts);
            return 0;
        }

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        try {
            cmd = parser.parse(opts, args);
        } catch (ParseException e) {
            log.error("Invalid command options. Please check help message. {}", e.getMessage());
            printUsage(opts);
            return -1;
        }

        try {
            ProcessingConfig config = cmd.hasOption(CONFIG) ? ProcessingConfig.load(new File(
                    cmd.getOptionValue(CONFIG))) : ProcessingConfig.fromEnvironment();
            if(cmd.hasOption(STRATEGY)) {
                config = config.withMissingValueStrategy(cmd.getOptionValue(STRATEGY));
            }
            LoggerUtils.setupLogger(BASE_LOGGER, config.getLogLevel(), config.getLogFile());
            log.debug("Running with {}", config);

            DatasetSchema schema = cmd.hasOption(SCHEMA) ? DatasetSchema.load(new File(cmd.getOptionValue(SCHEMA)))
                    : null;

            List<File> inputs = new ArrayList<File>();
            for(String input: cmd.getOptionValues(INPUT)) {
                inputs.add(new File(input));
            }
            File outputDir = cmd.hasOption(OUTPUT) ? new File(cmd.getOptionValue(OUTPUT)) : null;

            CleanseProcessor processor = new CleanseProcessor(config, schema, inputs, outputDir);
            processor.setDelimiter(cmd.getOptionValue(DELIMITER, Constants.DEFAULT_DELIMITER));
            int status = processor.run();
            if(status == 0) {
                log.info("Data cleansing is successful.");
            } else {
                log.warn("Error in data cleansing, please check your input data and config.");
            }
            return status;
        } catch (DataPrepException e) {
            log.error("Error: {}", e.getMessage(), e);
            return -1;
        } catch (Exception e) {
            log.error("Unexpected error: {}", StringUtils.defaultString(e.getMessage(), e.toString()), e);
            return -1;
        }
    }

    private static Options buildOptions() {
        Options opts = new Options();
        opts.addOption(Option.builder("i").longOpt(INPUT).hasArgs().required()
                .desc("Input csv file, could be repeated").build());
        opts.addOption(Option.builder("o").longOpt(OUTPUT).hasArg().desc("Output directory of cleaned files").build());
        opts.addOption(Option.builder("c").longOpt(CONFIG).hasArg().desc("Processing config json file").build());
        opts.addOption(Option.builder("s").longOpt(SCHEMA).hasArg().desc("Dataset schema json file").build());
        opts.addOption(Option.builder().longOpt(STRATEGY).hasArg()
                .desc("Missing value strategy: mean, median or drop").build());
        opts.addOption(Option.builder("d").longOpt(DELIMITER).hasArg().desc("Field delimiter, ',' by default")
                .build());
        opts.addOption(Option.builder("h").longOpt(HELP).desc("Print this message").build());
        return opts;
    }

    private static boolean isHelpOption(String str) {
        return "-h".equalsIgnoreCase(str) || "--help".equalsIgnoreCase(str);
    }

    private static void printUsage(Options opts) {
        new HelpFormatter().printHelp("dataprep -i <csv> [-i <csv> ...] [options]", opts);
    }

}
