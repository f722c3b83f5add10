package com.lohika.morning.risk.api;

import com.lohika.morning.risk.spark.driver.config.PipelineConfig;
import java.nio.file.Paths;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ApiConfiguration {

    @Bean
    public PipelineConfig pipelineConfig(@Value("${risk.config.path:config.json}") String configPath) {
        return PipelineConfig.load(Paths.get(configPath));
    }
}
