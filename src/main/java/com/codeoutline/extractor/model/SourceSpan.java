package com.codeoutline.extractor.model;

import lombok.Value;

/**
 * Half-open character range {@code [startOffset, endOffset)} in the parsed text.
 */
@Value
public class SourceSpan {
    int startOffset;
    int endOffset;

    public static SourceSpan of(int startOffset, int endOffset) {
        return new SourceSpan(startOffset, Math.max(startOffset, endOffset));
    }

    public boolean contains(SourceSpan other) {
        return other.startOffset >= startOffset && other.endOffset <= endOffset;
    }

    public int length() {
        return endOffset - startOffset;
    }
}
