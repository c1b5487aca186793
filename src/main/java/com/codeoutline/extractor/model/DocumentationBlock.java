package com.codeoutline.extractor.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Run of comments attached to the single declaration it precedes.
 */
@Value
@Builder
public class DocumentationBlock {
    /** Comment text exactly as written, comments joined by a newline. */
    String text;
    int commentCount;
    SourceSpan span;
    int startLine;
    int endLine;
    /** True when the run opens with a doc marker ({@code /**}, {@code /*!}, {@code ///}, {@code //!}). */
    boolean docMarker;

    /**
     * Returns the text with comment delimiters and leading asterisks removed,
     * blank leading/trailing lines dropped.
     */
    public String getContent() {
        List<String> lines = new ArrayList<>();
        for (String raw : text.split("\n", -1)) {
            String line = raw.strip();
            if (line.startsWith("/**") || line.startsWith("/*!")) {
                line = line.substring(3);
            } else if (line.startsWith("/*")) {
                line = line.substring(2);
            } else if (line.startsWith("///") || line.startsWith("//!")) {
                line = line.substring(3);
            } else if (line.startsWith("//")) {
                line = line.substring(2);
            }
            if (line.endsWith("*/")) {
                line = line.substring(0, line.length() - 2);
            }
            line = line.strip();
            if (line.startsWith("*")) {
                line = line.substring(1).strip();
            }
            lines.add(line);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines);
    }
}
