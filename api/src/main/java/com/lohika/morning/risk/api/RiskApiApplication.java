package com.lohika.morning.risk.api;

import com.lohika.morning.risk.spark.driver.SparkContextConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import(SparkContextConfiguration.class)
public class RiskApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskApiApplication.class, args);
    }
}
