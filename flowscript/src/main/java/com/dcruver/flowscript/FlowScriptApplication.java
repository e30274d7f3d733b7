package com.dcruver.flowscript;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the FlowScript toolchain.
 *
 * Compiles FlowScript documents into a content-addressed graph, lints the graph
 * against the decision-hygiene rules, and answers structural queries over it.
 * Runs as a Spring Shell application: interactive without arguments, one command otherwise.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class FlowScriptApplication {

    public static void main(String[] args) {
        log.info("Starting FlowScript...");
        SpringApplication.run(FlowScriptApplication.class, args);
    }
}
