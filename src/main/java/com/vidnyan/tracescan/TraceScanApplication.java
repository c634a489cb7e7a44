package com.vidnyan.tracescan;

import com.vidnyan.tracescan.adapter.in.cli.ScanCliRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * TraceScan - heuristic crash-pattern scanner for Android sources.
 *
 * Runs one scan and exits when a path is given; otherwise serves the REST API.
 */
@SpringBootApplication
public class TraceScanApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(TraceScanApplication.class, args);
        if (context.getBean(ScanCliRunner.class).hasScanned()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
