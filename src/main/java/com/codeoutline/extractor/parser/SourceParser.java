package com.codeoutline.extractor.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeoutline.extractor.config.ParserOptions;
import com.codeoutline.extractor.model.DocumentationBlock;
import com.codeoutline.extractor.model.ImportDirective;
import com.codeoutline.extractor.model.ParseDiagnostics;
import com.codeoutline.extractor.model.ParseResult;
import com.codeoutline.extractor.model.Scope;
import com.codeoutline.extractor.model.ScopeKind;
import com.codeoutline.extractor.model.SourceSpan;
import com.codeoutline.extractor.model.Symbol;
import com.codeoutline.extractor.model.Visibility;
import com.codeoutline.extractor.parser.SourceToken.TokenType;

import lombok.Value;

/**
 * Parser for curly-brace source files.
 * Walks the token stream once and builds the symbol tree.
 *
 * Parsing only:
 * - Recognizes declarations and the scopes they open
 * - Attaches documentation comments
 * - Reports diagnostics
 *
 * Function bodies are skipped without being decomposed. Malformed input never
 * aborts a parse: unrecognizable regions are skipped up to the next
 * {@code ;}, {@code {} or {@code }}.
 *
 * An instance parses one text once and is not thread-safe.
 */
public class SourceParser {
    private static final Logger log = LoggerFactory.getLogger(SourceParser.class);

    private static final Set<String> DECISION_KEYWORDS = Set.of("if", "else", "while", "for", "case", "catch");
    private static final Set<String> DECISION_OPERATORS = Set.of("?", "&&", "||");
    private static final Set<String> ACCESS_KEYWORDS = Set.of("public", "protected", "private");

    private final String source;
    private final String fileName;
    private final ParserOptions options;
    private final ParseDiagnostics diagnostics = new ParseDiagnostics();
    private final List<ImportDirective> imports = new ArrayList<>();
    private final TokenCursor cursor;
    private final ScopeTracker scopes;
    private final DeclarationRecognizer recognizer;
    private final CommentClassifier commentClassifier;
    private boolean parsed;

    /**
     * Where a declaration header begins, with the comments in front of it.
     */
    @Value
    private static class HeaderStart {
        SourceToken token;
        List<SourceToken> leadingComments;
        SourceToken previous;
    }

    @Value
    private static class Header {
        List<SourceToken> tokens;
        SourceToken terminator;
    }

    public SourceParser(String source, String fileName, ParserOptions options, List<ScopeListener> listeners) {
        this.source = source != null ? source : "";
        this.fileName = fileName;
        this.options = options != null ? options : ParserOptions.defaults();

        Scope root = Scope.root(fileName);
        List<ScopeListener> all = new ArrayList<>();
        all.add(new SymbolTreeBuilder());
        all.addAll(listeners);

        this.scopes = new ScopeTracker(root, all);
        this.cursor = new TokenCursor(new SourceTokenizer(this.source).iterator(), diagnostics);
        this.recognizer = new DeclarationRecognizer(this.source);
        this.commentClassifier = new CommentClassifier(this.options.getDocumentationPolicy());
    }

    public SourceParser(String source, String fileName) {
        this(source, fileName, ParserOptions.defaults(), List.of());
    }

    public ParseResult parse() {
        if (parsed) {
            throw new IllegalStateException("SourceParser instances parse once; create a new one");
        }
        parsed = true;

        while (!cursor.isAtEnd()) {
            try {
                parseStatement();
            } catch (ParseException e) {
                log.debug("Recognition miss near line {}: {}", e.getLine(), e.getMessage());
                diagnostics.getWarnings().add(e.getMessage());
                skipToBoundary();
            }
        }

        SourceToken eof = cursor.peek();
        int unclosed = scopes.closeAll(source.length(), eof.getLine());
        if (unclosed > 0) {
            diagnostics.getWarnings().add(unclosed + " unclosed scope(s) auto-closed at end of input");
        }
        if (scopes.getIgnoredCloses() > 0) {
            diagnostics.getInfos().add(scopes.getIgnoredCloses() + " unmatched '}' ignored");
        }
        scopes.sealRoot(source.length(), eof.getLine());

        Scope root = scopes.getRoot();
        log.debug("Parsed {}: {} top-level symbols, {} tokens", fileName, root.getSymbols().size(),
                cursor.getTokenCount());

        return ParseResult.builder()
                .fileName(fileName)
                .root(root)
                .diagnostics(diagnostics)
                .tokenCount(cursor.getTokenCount())
                .imports(List.copyOf(imports))
                .build();
    }

    private void parseStatement() {
        SourceToken token = cursor.peek();

        if (token.is("}")) {
            Scope closing = scopes.current();
            cursor.advance();
            if (!scopes.pop(token)) {
                diagnostics.getWarnings().add("Unmatched '}' ignored at line " + token.getLine());
                return;
            }
            if (closing.getKind() == ScopeKind.TYPE && closing.getOwner() != null) {
                parseTrailingDeclarators(closing.getOwner());
            }
            return;
        }

        if (token.getType() == TokenType.PREPROCESSOR) {
            cursor.advance();
            recognizer.recognizeInclude(token).ifPresent(imports::add);
            return;
        }

        if (token.is(";")) {
            cursor.advance();
            return;
        }

        if (token.getType() == TokenType.KEYWORD && ACCESS_KEYWORDS.contains(token.getText())
                && cursor.peek(1).is(":")) {
            parseAccessLabel();
            return;
        }

        HeaderStart start = markStart();
        String templateParameters = null;
        while (cursor.peek().isKeyword("template")) {
            SourceToken keyword = cursor.advance();
            if (!cursor.check("<")) {
                // explicit instantiation such as "template class Box<int>;"
                log.debug("Skipping explicit instantiation at line {}", keyword.getLine());
                skipToBoundary();
                return;
            }
            templateParameters = readTemplateParameters();
        }

        parseDeclaration(start, templateParameters);
    }

    private void parseAccessLabel() {
        SourceToken label = cursor.advance();
        cursor.advance(); // ':'

        Scope scope = scopes.current();
        if (scope.getKind() == ScopeKind.TYPE) {
            scope.setCurrentVisibility(Visibility.fromKeyword(label.getText()));
            log.debug("Access label {} at line {}", label.getText(), label.getLine());
        } else {
            diagnostics.getWarnings().add("Access label '" + label.getText() + "' outside a type at line "
                    + label.getLine());
        }
    }

    private String readTemplateParameters() {
        SourceToken open = cursor.advance();
        scopes.openTemplateParameters(open);

        while (true) {
            SourceToken token = cursor.peek();
            if (token.isEof() || (scopes.getAngleParenDepth() == 0
                    && (token.is("{") || token.is("}") || token.is(";")))) {
                scopes.abandonTemplateParameters(token);
                throw new ParseException("Unterminated template parameter list", open.getLine());
            }
            cursor.advance();
            if (scopes.trackAngle(token)) {
                return source.substring(open.getEndOffset(), token.getStartOffset())
                        .replaceAll("\\s+", " ")
                        .strip();
            }
        }
    }

    private void parseDeclaration(HeaderStart start, String templateParameters) {
        Header header = readHeader();
        SourceToken terminator = header.getTerminator();
        Scope scope = scopes.current();

        if (terminator.is(";") && !header.getTokens().isEmpty() && header.getTokens().get(0).isKeyword("using")
                && (scope.getKind() == ScopeKind.FILE || scope.getKind() == ScopeKind.NAMESPACE)) {
            recognizer.recognizeUsing(header.getTokens()).ifPresent(imports::add);
        }

        List<Declaration> declarations = recognizer.recognize(header.getTokens(), terminator, scope,
                templateParameters);
        if (declarations.isEmpty()) {
            skipUnrecognized(header, start);
            return;
        }

        Declaration first = declarations.get(0);
        if (first.isAnonymousScope()) {
            SourceToken brace = cursor.advance();
            scopes.push(ScopeKind.NAMESPACE, "", null, brace);
            return;
        }

        DocumentationBlock documentation = commentClassifier
                .classify(start.getLeadingComments(), start.getPrevious(), start.getToken())
                .orElse(null);

        Symbol symbol = null;
        for (Declaration declaration : declarations) {
            symbol = buildSymbol(declaration, documentation, start.getToken(), terminator, scope);
            // a comment documents one declaration only
            documentation = null;
            scopes.emit(symbol);
            log.debug("Parsed {} '{}' at line {}", symbol.getKind(), symbol.getName(), symbol.getStartLine());
        }

        SourceToken end = cursor.advance();
        if (end.is(";")) {
            return;
        }

        switch (symbol.getKind()) {
            case NAMESPACE -> scopes.push(ScopeKind.NAMESPACE, symbol.getName(), symbol, end);
            case ENUM -> {
                scopes.push(ScopeKind.TYPE, symbol.getName(), symbol, end);
                if (parseEnumBody()) {
                    parseTrailingDeclarators(symbol);
                }
            }
            case CLASS, STRUCT, TEMPLATE_CLASS -> scopes.push(ScopeKind.TYPE, symbol.getName(), symbol, end);
            default -> skipBody(symbol, end);
        }
    }

    private Symbol buildSymbol(Declaration declaration, DocumentationBlock documentation, SourceToken start,
                               SourceToken terminator, Scope scope) {
        Visibility visibility = scope.getKind() == ScopeKind.TYPE
                ? scope.getCurrentVisibility()
                : Visibility.UNSPECIFIED;

        return Symbol.builder()
                .kind(declaration.getKind())
                .name(declaration.getName())
                .visibility(visibility)
                .signature(declaration.getSignature())
                .documentation(documentation)
                .returnType(declaration.getReturnType())
                .parameters(declaration.getParameters())
                .modifiers(declaration.getModifiers())
                .templateParameters(declaration.getTemplateParameters())
                .baseClasses(declaration.getBaseClasses())
                .classKey(declaration.getClassKey())
                .value(declaration.getValue())
                .declarationOnly(declaration.isDeclarationOnly())
                .span(SourceSpan.of(start.getStartOffset(), terminator.getEndOffset()))
                .startLine(start.getLine())
                .endLine(terminator.getEndLine())
                .build();
    }

    /**
     * Gathers header tokens up to the {@code ;}, {@code {} or {@code }} that ends
     * it at depth zero. The terminator is left unconsumed. Braces of member
     * initializers in a constructor initializer list stay inside the header.
     */
    private Header readHeader() {
        List<SourceToken> tokens = new ArrayList<>();
        int depth = 0;
        boolean initializerList = false;

        while (true) {
            SourceToken token = cursor.peek();
            if (token.isEof()) {
                return new Header(tokens, token);
            }
            if (depth == 0 && (token.is(";") || token.is("}"))) {
                return new Header(tokens, token);
            }
            if (depth == 0 && token.is("{")) {
                if (initializerList && isBraceInitializer(tokens)) {
                    readBalancedBraces(tokens);
                    continue;
                }
                return new Header(tokens, token);
            }
            if (token.getType() == TokenType.PREPROCESSOR) {
                cursor.advance();
                continue;
            }

            if (token.is("(") || token.is("[") || token.is("{")) {
                depth++;
            } else if (token.is(")") || token.is("]") || token.is("}")) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is(":") && endsParameterList(tokens)) {
                initializerList = true;
            }
            tokens.add(cursor.advance());

            if (tokens.size() > options.getMaxHeaderTokens()) {
                throw new ParseException("Declaration header exceeds " + options.getMaxHeaderTokens() + " tokens",
                        tokens.get(0).getLine());
            }
        }
    }

    private static boolean endsParameterList(List<SourceToken> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        SourceToken last = tokens.get(tokens.size() - 1);
        return last.is(")") || last.isKeyword("noexcept");
    }

    private static boolean isBraceInitializer(List<SourceToken> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        SourceToken last = tokens.get(tokens.size() - 1);
        return last.isIdentifier() || last.is(">");
    }

    private void readBalancedBraces(List<SourceToken> tokens) {
        int depth = 0;
        while (!cursor.isAtEnd()) {
            SourceToken token = cursor.advance();
            tokens.add(token);
            if (token.is("{")) {
                depth++;
            } else if (token.is("}") && --depth == 0) {
                return;
            }
        }
    }

    /**
     * Handles a header that matched no declaration rule. A following block is
     * skipped as an anonymous scope; inside a type, a block followed by
     * {@code ;} was a brace initializer and the member is kept as a field.
     */
    private void skipUnrecognized(Header header, HeaderStart start) {
        SourceToken terminator = header.getTerminator();
        if (terminator.is(";")) {
            cursor.advance();
            if (!header.getTokens().isEmpty()) {
                log.debug("Skipped non-declaration at line {}", start.getToken().getLine());
            }
            return;
        }
        if (!terminator.is("{")) {
            // '}' and end of input are handled by the statement loop
            return;
        }

        Scope scope = scopes.current();
        SourceToken brace = cursor.advance();
        SourceToken close = skipBody(null, brace);

        if (scope.getKind() == ScopeKind.TYPE && close != null && cursor.check(";") && !header.getTokens().isEmpty()) {
            SourceToken semicolon = cursor.advance();
            String signature = source.substring(start.getToken().getStartOffset(), close.getEndOffset())
                    .replaceAll("\\s+", " ");
            DocumentationBlock documentation = commentClassifier
                    .classify(start.getLeadingComments(), start.getPrevious(), start.getToken())
                    .orElse(null);
            for (Declaration field : recognizer.recognizeFields(header.getTokens(), signature)) {
                Symbol symbol = buildSymbol(field, documentation, start.getToken(), semicolon, scope);
                documentation = null;
                scopes.emit(symbol);
            }
        }
    }

    /**
     * Skips a brace-delimited body as an opaque scope, counting decision
     * points for {@code owner} on the way.
     *
     * @return the closing brace, or null when input ended first
     */
    private SourceToken skipBody(Symbol owner, SourceToken brace) {
        scopes.push(ScopeKind.FUNCTION, owner != null ? owner.getName() : "", owner, brace);
        int depth = 1;
        int complexity = options.isComputeComplexity() ? 1 : 0;

        while (true) {
            SourceToken token = cursor.peek();
            if (token.isEof()) {
                if (owner != null) {
                    owner.completeBody(source.length(), token.getLine(), complexity);
                }
                return null;
            }
            cursor.advance();
            if (token.is("{")) {
                depth++;
            } else if (token.is("}")) {
                depth--;
                if (depth == 0) {
                    scopes.pop(token);
                    if (owner != null) {
                        owner.completeBody(token.getEndOffset(), token.getEndLine(), complexity);
                    }
                    return token;
                }
            } else if (options.isComputeComplexity() && isDecisionPoint(token)) {
                complexity++;
            }
        }
    }

    private static boolean isDecisionPoint(SourceToken token) {
        return (token.getType() == TokenType.KEYWORD && DECISION_KEYWORDS.contains(token.getText()))
                || (token.getType() == TokenType.PUNCTUATION && DECISION_OPERATORS.contains(token.getText()));
    }

    /**
     * Reads comma-separated enumerators up to the closing brace of the enum.
     *
     * @return true when the closing brace was reached
     */
    private boolean parseEnumBody() {
        while (true) {
            SourceToken token = cursor.peek();
            if (token.isEof()) {
                return false;
            }
            if (token.is("}")) {
                cursor.advance();
                scopes.pop(token);
                return true;
            }
            if (token.is(",") || token.is(";") || token.getType() == TokenType.PREPROCESSOR) {
                cursor.advance();
                continue;
            }

            HeaderStart start = markStart();
            List<SourceToken> tokens = new ArrayList<>();
            int depth = 0;
            // template argument brackets in a value such as "foo<1, 2>::value"
            int angle = 0;
            boolean inValue = false;
            while (!cursor.isAtEnd()) {
                SourceToken next = cursor.peek();
                if (depth == 0 && (next.is("}") || next.is(";") || (next.is(",") && angle == 0))) {
                    break;
                }
                if (next.is("(") || next.is("[") || next.is("{")) {
                    depth++;
                } else if (next.is(")") || next.is("]") || next.is("}")) {
                    depth = Math.max(0, depth - 1);
                } else if (depth == 0 && next.is("=")) {
                    inValue = true;
                } else if (inValue && depth == 0 && next.is("<") && tokens.get(tokens.size() - 1).isIdentifier()) {
                    angle++;
                } else if (depth == 0 && next.is(">") && angle > 0) {
                    angle--;
                }
                tokens.add(cursor.advance());
            }

            // an unmatched '<' was a comparison after all
            List<List<SourceToken>> entries = angle == 0 ? List.of(tokens) : splitAtCommas(tokens);
            DocumentationBlock documentation = commentClassifier
                    .classify(start.getLeadingComments(), start.getPrevious(), start.getToken())
                    .orElse(null);
            for (List<SourceToken> entry : entries) {
                if (entry.isEmpty()) {
                    continue;
                }
                try {
                    Declaration enumerator = recognizer.recognizeEnumerator(entry);
                    SourceToken last = entry.get(entry.size() - 1);
                    Symbol symbol = buildSymbol(enumerator, documentation, entry.get(0), last, scopes.current());
                    scopes.emit(symbol);
                } catch (ParseException e) {
                    log.debug("Skipping enumerator: {}", e.getMessage());
                    diagnostics.getWarnings().add(e.getMessage());
                }
                documentation = null;
            }
        }
    }

    private static List<List<SourceToken>> splitAtCommas(List<SourceToken> tokens) {
        List<List<SourceToken>> parts = new ArrayList<>();
        List<SourceToken> current = new ArrayList<>();
        int depth = 0;
        for (SourceToken token : tokens) {
            if (token.is("(") || token.is("[") || token.is("{")) {
                depth++;
            } else if (token.is(")") || token.is("]") || token.is("}")) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is(",")) {
                parts.add(current);
                current = new ArrayList<>();
                continue;
            }
            current.add(token);
        }
        parts.add(current);
        return parts;
    }

    /**
     * Reads the declarators between a closed type body and its {@code ;}. Inside
     * a type they become fields; after {@code typedef} the first one names an
     * unnamed type. Elsewhere they are left to the statement loop.
     */
    private void parseTrailingDeclarators(Symbol type) {
        if (cursor.check(";")) {
            return;
        }
        boolean typedef = type.getSignature().startsWith("typedef");
        Scope scope = scopes.current();
        if (!typedef && scope.getKind() != ScopeKind.TYPE) {
            return;
        }

        List<SourceToken> tokens = new ArrayList<>();
        int depth = 0;
        while (!cursor.isAtEnd()) {
            SourceToken next = cursor.peek();
            if (depth == 0 && (next.is(";") || next.is("}"))) {
                break;
            }
            if (next.is("(") || next.is("[") || next.is("{")) {
                depth++;
            } else if (next.is(")") || next.is("]") || next.is("}")) {
                depth = Math.max(0, depth - 1);
            }
            tokens.add(cursor.advance());
            if (tokens.size() > options.getMaxHeaderTokens()) {
                throw new ParseException("Declarator list exceeds " + options.getMaxHeaderTokens() + " tokens",
                        tokens.get(0).getLine());
            }
        }
        if (tokens.isEmpty() || !cursor.check(";")) {
            return;
        }
        SourceToken semicolon = cursor.advance();

        String typeName = type.getName().isEmpty() ? type.getClassKey() : type.getName();
        String signature = typeName + " " + source
                .substring(tokens.get(0).getStartOffset(), tokens.get(tokens.size() - 1).getEndOffset())
                .replaceAll("\\s+", " ");
        List<Declaration> declarators = recognizer.recognizeDeclarators(tokens, signature);

        if (typedef) {
            if (type.getName().isEmpty() && !declarators.isEmpty()) {
                type.assignName(declarators.get(0).getName());
                log.debug("Named typedef'd {} '{}' at line {}", type.getKind(), type.getName(), type.getStartLine());
            }
            return;
        }
        for (Declaration field : declarators) {
            Symbol symbol = buildSymbol(field, null, tokens.get(0), semicolon, scope);
            scopes.emit(symbol);
        }
    }

    /**
     * Skips to the next boundary: consumes through a {@code ;}, stops before
     * {@code {} or {@code }} so the statement loop can keep scopes balanced.
     */
    private void skipToBoundary() {
        while (!cursor.isAtEnd()) {
            SourceToken token = cursor.peek();
            if (token.is(";")) {
                cursor.advance();
                return;
            }
            if (token.is("{") || token.is("}")) {
                return;
            }
            cursor.advance();
        }
    }

    private HeaderStart markStart() {
        return new HeaderStart(cursor.peek(), cursor.leadingComments(), cursor.previous());
    }

    public ParseDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
