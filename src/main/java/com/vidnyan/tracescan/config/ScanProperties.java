package com.vidnyan.tracescan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the scanner.
 * Can be configured via application.yml or command-line properties.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tracescan")
public class ScanProperties {

    private Scan scan = new Scan();
    private Rules rules = new Rules();
    private Report report = new Report();

    @Data
    public static class Scan {

        /**
         * Directory to scan from the command line. Empty = no CLI scan.
         */
        private String path = "";

        /**
         * File extensions to scan, lower case with dot.
         */
        private List<String> extensions = new ArrayList<>(List.of(".java", ".kt"));

        /**
         * Path fragments that exclude a file, matched against "/" + the root-relative path.
         */
        private List<String> excludes = new ArrayList<>();

        /**
         * Lines of context on each side of a finding.
         */
        private int contextRadius = 10;

        /**
         * Worker threads. 1 = sequential.
         */
        private int parallelism = 1;
    }

    @Data
    public static class Rules {

        /**
         * Rules to run, in order. Empty = all registered rules, sorted by name.
         */
        private List<String> enabled = new ArrayList<>();

        /**
         * Rules removed from the active set.
         */
        private List<String> disabled = new ArrayList<>();
    }

    @Data
    public static class Report {

        /**
         * Report format: text or json.
         */
        private String format = "text";

        /**
         * Output file. Empty = write the report to the log.
         */
        private String output = "";
    }
}
