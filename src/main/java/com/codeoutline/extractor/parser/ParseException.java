package com.codeoutline.extractor.parser;

/**
 * Raised when a declaration header cannot be recognized. Never escapes a
 * parse: the parser records the message and resumes at the next boundary token.
 */
public class ParseException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final int line;

    public ParseException(String message, int line) {
        super(message + " at line " + line);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
