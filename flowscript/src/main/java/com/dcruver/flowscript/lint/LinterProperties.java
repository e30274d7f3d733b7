package com.dcruver.flowscript.lint;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thresholds for the advisory structure rules.
 */
@Component
@ConfigurationProperties(prefix = "flowscript.linter")
@Data
public class LinterProperties {
    private int maxNestingDepth = 5;

    /** Counted in nodes along the chain */
    private int maxCausalChainLength = 10;
}
