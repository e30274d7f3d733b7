package com.dcruver.flowscript.query.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One alternative of a question, compared with the others.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlternativeOption {
    NodeRef node;
    boolean chosen;

    String rationale;
    String decidedOn;

    /** Direct causal consequences */
    List<String> consequences;

    List<TensionRef> tensions;

    /** Thoughts recorded against a rejected alternative */
    List<String> rejectionReasons;
}
