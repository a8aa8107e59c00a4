package com.querypilot;

import com.querypilot.config.QueryPilotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(QueryPilotProperties.class)
public class QueryPilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryPilotApplication.class, args);
    }
}
