package com.lohika.morning.risk.api.client;

import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import java.nio.file.Paths;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

public class ApiCallsRunner {

    private static final Logger log = LoggerFactory.getLogger(ApiCallsRunner.class);

    private static final int TIMEOUT_MILLIS = 600_000;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String[] args) {
        Options options = new Options();
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("file")
                .desc("pipeline configuration, config.json by default").build());
        options.addOption("h", "help", false, "print this message");
        try {
            CommandLine line = new DefaultParser().parse(options, args);
            if (line.hasOption("h")) {
                new HelpFormatter().printHelp("apicalls", options);
                return 0;
            }
            PipelineConfig config = PipelineConfig.load(Paths.get(line.getOptionValue("c", "config.json")));
            SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(TIMEOUT_MILLIS);
            requestFactory.setReadTimeout(TIMEOUT_MILLIS);
            new ApiCallsClient(new RestTemplate(requestFactory), config.url()).run(config);
            return 0;
        } catch (ParseException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            new HelpFormatter().printHelp("apicalls", options);
            return -1;
        } catch (Exception e) {
            log.error("API calls failed", e);
            return -1;
        }
    }
}
