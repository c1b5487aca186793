package com.codeoutline.extractor.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeoutline.extractor.parser.SourceToken.TokenType;

/**
 * Tokenizer for curly-brace source files.
 *
 * Iteration is lazy: each call to {@link #iterator()} starts a fresh scan from
 * the beginning of the text and yields tokens on demand, ending with exactly
 * one {@link TokenType#EOF} token. The tokenizer never fails; malformed input
 * degrades to best-effort tokens flagged {@code unterminated}.
 */
public class SourceTokenizer implements Iterable<SourceToken> {
    private static final Logger log = LoggerFactory.getLogger(SourceTokenizer.class);

    static final Set<String> KEYWORDS = Set.of(
        "namespace", "class", "struct", "union", "enum", "template", "typename",
        "public", "private", "protected", "virtual", "static", "inline", "explicit",
        "constexpr", "consteval", "constinit", "const", "volatile", "mutable", "extern",
        "friend", "operator", "typedef", "using", "return", "if", "else", "while", "for",
        "do", "switch", "case", "default", "break", "continue", "goto", "new", "delete",
        "this", "throw", "try", "catch", "sizeof", "alignof", "decltype", "noexcept",
        "static_assert", "thread_local", "register", "nullptr", "true", "false",
        "void", "bool", "char", "short", "int", "long", "float", "double", "signed",
        "unsigned", "auto", "wchar_t", "char8_t", "char16_t", "char32_t"
    );

    // longest first, so the first match is the maximal one; '<' and '>' stay single characters
    private static final Set<String> RAW_STRING_PREFIXES = Set.of("R", "LR", "uR", "UR", "u8R");

    // longest delimiter a raw string may declare between '"' and '('
    private static final int MAX_RAW_DELIMITER = 16;

    private static final String[] PUNCTUATORS = {
        "...", "->*",
        "::", "->", "++", "--", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
        "==", "!=", "&&", "||", ".*", "##"
    };

    private final String source;

    public SourceTokenizer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * Tokenize the entire source text, comments included.
     */
    public List<SourceToken> tokenize() {
        List<SourceToken> tokens = new ArrayList<>();
        for (SourceToken token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    @Override
    public Iterator<SourceToken> iterator() {
        return new Scanner();
    }

    /**
     * One forward pass over the text.
     */
    private final class Scanner implements Iterator<SourceToken> {
        private int pos = 0;
        private int line = 1;
        private int column = 1;
        private boolean atLineStart = true;
        private boolean finished = false;

        @Override
        public boolean hasNext() {
            return !finished;
        }

        @Override
        public SourceToken next() {
            if (finished) {
                throw new NoSuchElementException("Token stream already ended");
            }
            skipWhitespace();
            if (pos >= source.length()) {
                finished = true;
                return new SourceToken(TokenType.EOF, "", pos, pos, line, column, line, column, false);
            }
            SourceToken token = nextToken();
            atLineStart = false;
            if (token.isUnterminated()) {
                log.debug("Unterminated {} starting at line {}", token.getType(), token.getLine());
            }
            return token;
        }

        private void skipWhitespace() {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '\n') {
                    advanceChar();
                    atLineStart = true;
                } else if (Character.isWhitespace(c)) {
                    advanceChar();
                } else {
                    break;
                }
            }
        }

        private SourceToken nextToken() {
            char c = source.charAt(pos);
            int start = pos;
            int startLine = line;
            int startCol = column;

            if (c == '/' && peekChar(1) == '/') {
                return readLineComment(start, startLine, startCol);
            }
            if (c == '/' && peekChar(1) == '*') {
                return readBlockComment(start, startLine, startCol);
            }
            if (c == '#' && atLineStart) {
                return readPreprocessor(start, startLine, startCol);
            }
            if (c == '"' || c == '\'') {
                return readQuoted(c, start, startLine, startCol);
            }
            if (Character.isDigit(c) || (c == '.' && Character.isDigit(peekChar(1)))) {
                return readNumber(start, startLine, startCol);
            }
            if (isIdentifierStart(c)) {
                return readIdentifierOrKeyword(start, startLine, startCol);
            }
            return readPunctuation(start, startLine, startCol);
        }

        private SourceToken readLineComment(int start, int startLine, int startCol) {
            while (pos < source.length() && source.charAt(pos) != '\n') {
                advanceChar();
            }
            return make(TokenType.LINE_COMMENT, start, startLine, startCol, false);
        }

        private SourceToken readBlockComment(int start, int startLine, int startCol) {
            advanceChar();
            advanceChar();
            while (pos < source.length()) {
                if (source.charAt(pos) == '*' && peekChar(1) == '/') {
                    advanceChar();
                    advanceChar();
                    return make(TokenType.BLOCK_COMMENT, start, startLine, startCol, false);
                }
                advanceChar();
            }
            return make(TokenType.BLOCK_COMMENT, start, startLine, startCol, true);
        }

        private SourceToken readPreprocessor(int start, int startLine, int startCol) {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '\\' && (peekChar(1) == '\n' || (peekChar(1) == '\r' && peekChar(2) == '\n'))) {
                    // line continuation
                    advanceChar();
                    if (source.charAt(pos) == '\r') {
                        advanceChar();
                    }
                    advanceChar();
                    continue;
                }
                if (c == '\n') {
                    break;
                }
                advanceChar();
            }
            int end = pos;
            while (end > start && Character.isWhitespace(source.charAt(end - 1))) {
                end--;
            }
            return new SourceToken(TokenType.PREPROCESSOR, source.substring(start, end), start, end,
                    startLine, startCol, line, column, false);
        }

        private SourceToken readQuoted(char quote, int start, int startLine, int startCol) {
            TokenType type = quote == '"' ? TokenType.STRING_LITERAL : TokenType.CHAR_LITERAL;
            advanceChar(); // opening quote

            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '\\') {
                    advanceChar();
                    if (pos < source.length()) {
                        advanceChar();
                    }
                } else if (c == quote) {
                    advanceChar();
                    return make(type, start, startLine, startCol, false);
                } else {
                    advanceChar();
                }
            }
            return make(type, start, startLine, startCol, true);
        }

        private SourceToken readNumber(int start, int startLine, int startCol) {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                    char prev = c;
                    advanceChar();
                    if ((prev == 'e' || prev == 'E' || prev == 'p' || prev == 'P')
                            && (peekChar(0) == '+' || peekChar(0) == '-')) {
                        advanceChar();
                    }
                } else if (c == '\'' && Character.isLetterOrDigit(peekChar(1))) {
                    // digit separator
                    advanceChar();
                } else {
                    break;
                }
            }
            return make(TokenType.NUMBER, start, startLine, startCol, false);
        }

        private SourceToken readIdentifierOrKeyword(int start, int startLine, int startCol) {
            while (pos < source.length() && isIdentifierPart(source.charAt(pos))) {
                advanceChar();
            }
            String value = source.substring(start, pos);
            if (RAW_STRING_PREFIXES.contains(value) && peekChar(0) == '"') {
                String delimiter = rawDelimiter();
                if (delimiter != null) {
                    return readRawString(delimiter, start, startLine, startCol);
                }
            }
            TokenType type = KEYWORDS.contains(value) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
            return make(type, start, startLine, startCol, false);
        }

        /**
         * Delimiter of a raw string whose opening quote is at the current
         * position, or null when no valid {@code d-char-sequence(} follows.
         */
        private String rawDelimiter() {
            for (int i = 1; i <= MAX_RAW_DELIMITER + 1; i++) {
                char c = peekChar(i);
                if (c == '(') {
                    return source.substring(pos + 1, pos + i);
                }
                if (c == '\0' || c == ')' || c == '\\' || c == '"' || Character.isWhitespace(c)) {
                    return null;
                }
            }
            return null;
        }

        /**
         * Reads {@code R"delim( ... )delim"}. Quotes and backslashes inside are
         * plain characters.
         */
        private SourceToken readRawString(String delimiter, int start, int startLine, int startCol) {
            String closing = ")" + delimiter + "\"";
            int contentStart = pos + delimiter.length() + 2;
            int close = source.indexOf(closing, contentStart);
            int end = close >= 0 ? close + closing.length() : source.length();
            while (pos < end) {
                advanceChar();
            }
            return make(TokenType.STRING_LITERAL, start, startLine, startCol, close < 0);
        }

        private SourceToken readPunctuation(int start, int startLine, int startCol) {
            for (String punctuator : PUNCTUATORS) {
                if (source.startsWith(punctuator, pos)) {
                    for (int i = 0; i < punctuator.length(); i++) {
                        advanceChar();
                    }
                    return make(TokenType.PUNCTUATION, start, startLine, startCol, false);
                }
            }
            advanceChar();
            return make(TokenType.PUNCTUATION, start, startLine, startCol, false);
        }

        private SourceToken make(TokenType type, int start, int startLine, int startCol, boolean unterminated) {
            return new SourceToken(type, source.substring(start, pos), start, pos,
                    startLine, startCol, line, column, unterminated);
        }

        private void advanceChar() {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }

        private char peekChar(int ahead) {
            int index = pos + ahead;
            return index < source.length() ? source.charAt(index) : '\0';
        }
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
