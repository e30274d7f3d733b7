package com.dcruver.flowscript.parse;

import lombok.Value;

import java.util.List;

/**
 * Preprocessed text plus, for every transformed line, the original 1-based line it came from.
 */
@Value
public class ScanResult {
    String text;
    List<Integer> lineMap;

    public ScanResult(String text, List<Integer> lineMap) {
        this.text = text;
        this.lineMap = List.copyOf(lineMap);
    }

    /**
     * Original line for a 1-based transformed line
     */
    public int originalLine(int transformedLine) {
        if (lineMap.isEmpty()) {
            return Math.max(1, transformedLine);
        }
        int index = Math.min(Math.max(transformedLine, 1), lineMap.size()) - 1;
        return lineMap.get(index);
    }

    public int transformedLineCount() {
        return lineMap.size();
    }
}
