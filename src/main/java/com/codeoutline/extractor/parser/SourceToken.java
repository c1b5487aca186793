package com.codeoutline.extractor.parser;

import lombok.Value;

/**
 * Represents a token from the source tokenizer. Offsets are character
 * positions in the parsed text; lines and columns are 1-based.
 */
@Value
public class SourceToken {
    TokenType type;
    String text;
    int startOffset;
    int endOffset;
    int line;
    int column;
    int endLine;
    int endColumn;
    /** Set on string/char literals and block comments that run into end of input. */
    boolean unterminated;

    public enum TokenType {
        IDENTIFIER,
        KEYWORD,
        STRING_LITERAL,
        CHAR_LITERAL,
        NUMBER,
        PUNCTUATION,
        LINE_COMMENT,
        BLOCK_COMMENT,
        PREPROCESSOR,
        EOF
    }

    public boolean isComment() {
        return type == TokenType.LINE_COMMENT || type == TokenType.BLOCK_COMMENT;
    }

    public boolean isEof() {
        return type == TokenType.EOF;
    }

    public boolean isIdentifier() {
        return type == TokenType.IDENTIFIER;
    }

    /**
     * True for a keyword or punctuation token with exactly this text.
     */
    public boolean is(String symbol) {
        return (type == TokenType.PUNCTUATION || type == TokenType.KEYWORD) && text.equals(symbol);
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }
}
