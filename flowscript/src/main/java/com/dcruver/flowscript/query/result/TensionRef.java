package com.dcruver.flowscript.query.result;

import lombok.Value;

@Value
public class TensionRef {
    /** Axis label, or {@code unlabeled} */
    String axis;
    NodeRef source;
    NodeRef target;
}
