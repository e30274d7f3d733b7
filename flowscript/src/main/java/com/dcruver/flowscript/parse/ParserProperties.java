package com.dcruver.flowscript.parse;

import com.dcruver.flowscript.ir.Author;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Parser settings. Defaults match the notation's standard dialect.
 */
@Component
@ConfigurationProperties(prefix = "flowscript.parser")
@Data
public class ParserProperties {
    private int indentUnit = IndentationScanner.DEFAULT_INDENT_UNIT;

    /** Bare {@code ><} fails the parse instead of being left to the linter */
    private boolean requireTensionAxis = false;

    private String producer = "flowscript-java 1.0.0";

    private AuthorSettings author = new AuthorSettings();

    @Data
    public static class AuthorSettings {
        private String agent;
        private Author.Role role;

        public Author toAuthor() {
            if (agent == null || agent.isBlank()) {
                return null;
            }
            return Author.builder().agent(agent).role(role == null ? Author.Role.HUMAN : role).build();
        }
    }
}
