package com.lohika.morning.risk.spark.driver.cli;

import com.lohika.morning.risk.spark.driver.SparkContextConfiguration;
import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

public class RiskPipelineCli {

    private static final Logger log = LoggerFactory.getLogger(RiskPipelineCli.class);

    static final String DEFAULT_CONFIG = "config.json";

    private static final Options options = new Options();

    static {
        options.addOption("c", "config", true, "Pipeline configuration file (default " + DEFAULT_CONFIG + ")");
        options.addOption("h", "help", false, "Print this help");
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    public static int execute(String[] args) {
        log.debug("Going to execute: {}", String.join(" ", args));
        final CommandLineParser cliParser = new DefaultParser();
        try {
            final CommandLine parse = cliParser.parse(options, args);
            if (parse.hasOption("help")) {
                printHelp();
                return 0;
            }
            if (parse.getArgs().length != 1) {
                System.out.println("Expected exactly one command");
                printHelp();
                return -1;
            }

            final PipelineCommand command = commandOf(parse.getArgs()[0]);
            if (command == null) {
                System.out.println("Unknown command: " + parse.getArgs()[0]);
                printHelp();
                return -1;
            }
            final PipelineConfig config = PipelineConfig.load(Paths.get(parse.getOptionValue("config", DEFAULT_CONFIG)));
            try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(SparkContextConfiguration.class)) {
                return command.execute(context, config);
            }
        } catch (ParseException e) {
            System.out.println(e.getMessage());
            printHelp();
            return -1;
        } catch (Exception e) {
            log.error("Error while executing: {}", String.join(" ", args), e);
            return -1;
        }
    }

    static PipelineCommand commandOf(String name) {
        return Arrays.stream(PipelineCommand.values())
                .filter(command -> command.name().equals(name))
                .findFirst()
                .orElse(null);
    }

    private static void printHelp() {
        String commands = Arrays.stream(PipelineCommand.values())
                .map(command -> "  " + command.name() + ": " + command.getDescription())
                .collect(Collectors.joining(System.lineSeparator()));
        new HelpFormatter().printHelp("risk-pipeline [-c config.json] <command>", "", options,
                System.lineSeparator() + "Commands:" + System.lineSeparator() + commands);
    }
}
