package com.codeoutline.extractor.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.codeoutline.extractor.model.ParseDiagnostics;

import lombok.Value;

/**
 * Forward cursor over the code tokens of a token stream with a small bounded
 * lookahead window. Comment tokens are not returned; each code token instead
 * carries the comments that came directly before it.
 */
class TokenCursor {
    static final int MAX_LOOKAHEAD = 8;

    private final Iterator<SourceToken> tokens;
    private final ParseDiagnostics diagnostics;
    private final List<Entry> window = new ArrayList<>();
    private List<SourceToken> pendingComments = new ArrayList<>();
    private SourceToken previous;
    private Entry eof;
    private int tokenCount;

    @Value
    static class Entry {
        SourceToken token;
        List<SourceToken> leadingComments;
    }

    TokenCursor(Iterator<SourceToken> tokens, ParseDiagnostics diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    SourceToken peek() {
        return peek(0);
    }

    SourceToken peek(int ahead) {
        return entry(ahead).getToken();
    }

    /**
     * Comments directly preceding the next code token.
     */
    List<SourceToken> leadingComments() {
        return entry(0).getLeadingComments();
    }

    /**
     * Last consumed code token, or null at the start of input.
     */
    SourceToken previous() {
        return previous;
    }

    SourceToken advance() {
        Entry next = entry(0);
        if (!next.getToken().isEof()) {
            window.remove(0);
            previous = next.getToken();
        }
        return next.getToken();
    }

    boolean isAtEnd() {
        return peek().isEof();
    }

    boolean check(String symbol) {
        return peek().is(symbol);
    }

    int getTokenCount() {
        return tokenCount;
    }

    private Entry entry(int ahead) {
        if (ahead >= MAX_LOOKAHEAD) {
            throw new IllegalArgumentException("Lookahead " + ahead + " exceeds window of " + MAX_LOOKAHEAD);
        }
        while (window.size() <= ahead && eof == null) {
            fill();
        }
        return ahead < window.size() ? window.get(ahead) : eof;
    }

    private void fill() {
        while (tokens.hasNext()) {
            SourceToken token = tokens.next();
            tokenCount++;
            if (token.isUnterminated()) {
                diagnostics.getWarnings().add("Unterminated " + describe(token) + " at line " + token.getLine());
            }
            if (token.isComment()) {
                pendingComments.add(token);
                continue;
            }
            Entry entry = new Entry(token, List.copyOf(pendingComments));
            pendingComments = new ArrayList<>();
            if (token.isEof()) {
                eof = entry;
            } else {
                window.add(entry);
            }
            return;
        }
    }

    private static String describe(SourceToken token) {
        return switch (token.getType()) {
            case STRING_LITERAL -> "string literal";
            case CHAR_LITERAL -> "character literal";
            case BLOCK_COMMENT -> "block comment";
            default -> token.getType().name().toLowerCase();
        };
    }
}
