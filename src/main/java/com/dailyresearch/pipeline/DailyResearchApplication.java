package com.dailyresearch.pipeline;

import com.dailyresearch.pipeline.config.ResearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ResearchProperties.class)
public class DailyResearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DailyResearchApplication.class, args);
    }
}
