package com.civicintel.dumping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class DumpingStarSchemaApplication {

    public static void main(String[] args) {
        SpringApplication.run(DumpingStarSchemaApplication.class, args);
    }
}
