package com.dcruver.flowscript.lint;

/**
 * ERROR findings block a clean status; WARNING findings are advisory.
 */
public enum Severity {
    ERROR,
    WARNING
}
