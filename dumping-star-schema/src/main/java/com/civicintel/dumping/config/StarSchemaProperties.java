package com.civicintel.dumping.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "star-schema")
@Data
public class StarSchemaProperties {

    /** Raw illegal dumping CSV. Overridden by --input on the command line. */
    private String input;

    private Output output = new Output();
    private Cli cli = new Cli();

    @Data
    public static class Output {
        private String exportDir = "exports";
        private boolean includeHeader = true;
        private boolean writeManifest = true;
    }

    @Data
    public static class Cli {
        private boolean run = true;
    }
}
