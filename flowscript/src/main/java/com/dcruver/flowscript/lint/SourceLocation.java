package com.dcruver.flowscript.lint;

import com.dcruver.flowscript.ir.Provenance;
import lombok.Value;

@Value
public class SourceLocation {
    String file;

    /** Original source line, 0 when unknown */
    int line;

    public static SourceLocation of(Provenance provenance) {
        if (provenance == null) {
            return new SourceLocation(null, 0);
        }
        return new SourceLocation(provenance.getSourceFile(), provenance.getLineNumber());
    }

    @Override
    public String toString() {
        String name = file == null ? "<input>" : file;
        return line > 0 ? name + ":" + line : name;
    }
}
