package com.dcruver.flowscript.config;

import com.dcruver.flowscript.app.LintFailedException;
import com.dcruver.flowscript.exception.FlowScriptException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.shell.command.CommandExceptionResolver;
import org.springframework.shell.command.CommandHandlingResult;

import java.time.Clock;

/**
 * Shared beans: the clock behind parse timestamps and blocker ages,
 * and the mapping from failures to process exit codes.
 */
@Configuration
@Slf4j
public class FlowScriptConfiguration {

    public static final int EXIT_FAILURE = 1;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fatal document errors and failed lint runs exit with status 1 and a located message
     */
    @Bean
    public CommandExceptionResolver flowScriptExceptionResolver() {
        return ex -> {
            if (ex instanceof LintFailedException) {
                return CommandHandlingResult.of(ex.getMessage(), EXIT_FAILURE);
            }
            if (ex instanceof FlowScriptException) {
                FlowScriptException failure = (FlowScriptException) ex;
                log.debug("Command failed with {}", failure.getCode(), failure);
                return CommandHandlingResult.of("Error: " + failure.getMessage() + "\n", EXIT_FAILURE);
            }
            return null;
        };
    }
}
