package com.example.retrosheet.normalize;

import com.example.retrosheet.entity.SourceFile;
import lombok.Value;

/**
 * One logical record with its provenance. Used for diagnostics only.
 */
@Value
public class RawRecord {
    SourceFile source;
    long lineNumber;
    String text;

    public String location() {
        return source.getPath() + ":" + lineNumber;
    }
}
