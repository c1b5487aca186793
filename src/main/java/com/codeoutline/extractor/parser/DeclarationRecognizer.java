package com.codeoutline.extractor.parser;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeoutline.extractor.model.ImportDirective;
import com.codeoutline.extractor.model.ParameterInfo;
import com.codeoutline.extractor.model.Scope;
import com.codeoutline.extractor.model.ScopeKind;
import com.codeoutline.extractor.model.SymbolKind;
import com.codeoutline.extractor.parser.SourceToken.TokenType;

/**
 * Classifies declaration headers. A header is the run of code tokens in front
 * of a {@code ;} or {@code {} at nesting depth zero; rules are tried in a fixed
 * order and the first match wins:
 * <ol>
 * <li>namespace (or an anonymous namespace / {@code extern "C"} block)</li>
 * <li>class, struct or union definition or forward declaration</li>
 * <li>enum definition or opaque declaration</li>
 * <li>function, method, constructor or destructor</li>
 * <li>field, inside a type only</li>
 * </ol>
 * A template parameter list already consumed by the caller turns classes into
 * template classes and functions into template functions.
 *
 * An empty result means "not a declaration"; a {@link ParseException} means the
 * header looked like a declaration but was malformed.
 */
public class DeclarationRecognizer {
    private static final Logger log = LoggerFactory.getLogger(DeclarationRecognizer.class);

    private static final Set<String> SPECIFIERS = Set.of(
        "static", "inline", "virtual", "explicit", "constexpr", "consteval", "constinit",
        "extern", "friend", "mutable", "thread_local", "register"
    );

    private static final Set<String> NON_DECLARATIONS = Set.of("using", "friend", "static_assert");

    // identifiers that take a parenthesized argument and never name a function
    private static final Set<String> ATTRIBUTE_MACROS = Set.of(
        "__attribute__", "__declspec", "alignas", "__asm__", "asm"
    );

    private static final Pattern INCLUDE = Pattern.compile("#\\s*include\\s*([<\"])([^>\"]+)[>\"]");

    private final String source;

    public DeclarationRecognizer(String source) {
        this.source = source;
    }

    /**
     * @param header             code tokens of the header, terminator excluded
     * @param terminator         the {@code ;}, {@code {}, {@code }} or end-of-input token that ended it
     * @param scope              scope the header appears in
     * @param templateParameters raw template parameter text, or null when not templated
     */
    public List<Declaration> recognize(List<SourceToken> header, SourceToken terminator, Scope scope,
                                       String templateParameters) {
        if (header.isEmpty() || !(terminator.is("{") || terminator.is(";"))) {
            return List.of();
        }
        boolean opensBody = terminator.is("{");
        SourceToken first = header.get(0);

        if (first.isKeyword("namespace")
                || (first.isKeyword("inline") && header.size() > 1 && header.get(1).isKeyword("namespace"))) {
            return recognizeNamespace(header, first.isKeyword("inline") ? 1 : 0, opensBody);
        }
        if (first.isKeyword("extern") && header.size() == 2
                && header.get(1).getType() == TokenType.STRING_LITERAL && opensBody) {
            return List.of(Declaration.builder().name("").anonymousScope(true).build());
        }
        if (first.getType() == TokenType.KEYWORD && NON_DECLARATIONS.contains(first.getText())) {
            return List.of();
        }

        int typeStart = first.isKeyword("typedef") ? 1 : 0;
        if (typeStart == 1 && !opensBody) {
            return List.of();
        }
        if (typeStart < header.size()) {
            SourceToken key = header.get(typeStart);
            Declaration type = null;
            if (key.isKeyword("class") || key.isKeyword("struct") || key.isKeyword("union")) {
                type = recognizeType(header, typeStart, opensBody, templateParameters);
            } else if (key.isKeyword("enum")) {
                type = recognizeEnum(header, typeStart, opensBody);
            }
            if (type != null) {
                return List.of(type);
            }
        }
        if (typeStart == 1) {
            return List.of();
        }

        Declaration callable = recognizeCallable(header, opensBody, scope, templateParameters);
        if (callable != null) {
            return List.of(callable);
        }

        if (!opensBody && scope.getKind() == ScopeKind.TYPE) {
            return recognizeFields(header, text(header, 0, header.size()));
        }
        return List.of();
    }

    private List<Declaration> recognizeNamespace(List<SourceToken> header, int at, boolean opensBody) {
        if (!opensBody) {
            // alias such as "namespace fs = std::filesystem;"
            return List.of();
        }
        int i = at + 1;
        if (i == header.size()) {
            return List.of(Declaration.builder().name("").anonymousScope(true).build());
        }
        StringBuilder name = new StringBuilder();
        boolean expectName = true;
        for (; i < header.size(); i++) {
            SourceToken token = header.get(i);
            if (expectName && token.isKeyword("inline")) {
                continue;
            }
            if (expectName && token.isIdentifier()) {
                name.append(token.getText());
                expectName = false;
            } else if (!expectName && token.is("::")) {
                name.append("::");
                expectName = true;
            } else {
                throw new ParseException("Malformed namespace declaration '" + text(header, 0, header.size()) + "'",
                        header.get(at).getLine());
            }
        }
        if (expectName) {
            throw new ParseException("Namespace name ends with '::'", header.get(at).getLine());
        }
        return List.of(Declaration.builder()
                .kind(SymbolKind.NAMESPACE)
                .name(name.toString())
                .signature(text(header, 0, header.size()))
                .build());
    }

    private Declaration recognizeType(List<SourceToken> header, int at, boolean opensBody,
                                      String templateParameters) {
        String classKey = header.get(at).getText();
        int size = header.size();
        int i = skipAttributes(header, at + 1);

        int nameStart = -1;
        int nameEnd = -1;
        int nameRuns = 0;
        Set<String> modifiers = new LinkedHashSet<>();
        while (i < size && header.get(i).isIdentifier()) {
            if (nameStart >= 0 && header.get(i).getText().equals("final")) {
                break;
            }
            // an export macro in front of the real name is overwritten by the name
            nameStart = i;
            nameRuns++;
            i++;
            while (i + 1 < size && header.get(i).is("::") && header.get(i + 1).isIdentifier()) {
                i += 2;
            }
            nameEnd = i;
            i = skipAttributes(header, i);
        }
        if (i < size && nameStart >= 0 && header.get(i).is("<")) {
            i = skipAngles(header, i);
        }
        if (i < size && header.get(i).getText().equals("final")) {
            modifiers.add("final");
            i++;
        }

        List<String> bases = new ArrayList<>();
        if (i < size) {
            if (!header.get(i).is(":") || !opensBody) {
                return null;
            }
            for (List<SourceToken> base : splitTopLevel(header, i + 1, size)) {
                if (!base.isEmpty()) {
                    bases.add(join(base));
                }
            }
        }

        if (!opensBody && (nameStart < 0 || nameRuns > 1)) {
            return null;
        }

        SymbolKind kind;
        if (templateParameters != null) {
            kind = SymbolKind.TEMPLATE_CLASS;
        } else if (classKey.equals("class")) {
            kind = SymbolKind.CLASS;
        } else {
            kind = SymbolKind.STRUCT;
        }

        return Declaration.builder()
                .kind(kind)
                .name(nameStart >= 0 ? join(header.subList(nameStart, nameEnd)) : "")
                .classKey(classKey)
                .signature(text(header, 0, size))
                .baseClasses(bases)
                .modifiers(modifiers)
                .templateParameters(templateParameters)
                .declarationOnly(!opensBody)
                .build();
    }

    private Declaration recognizeEnum(List<SourceToken> header, int at, boolean opensBody) {
        int size = header.size();
        int i = at + 1;
        Set<String> modifiers = new LinkedHashSet<>();
        if (i < size && (header.get(i).isKeyword("class") || header.get(i).isKeyword("struct"))) {
            modifiers.add("scoped");
            i++;
        }
        i = skipAttributes(header, i);

        String name = "";
        if (i < size && header.get(i).isIdentifier()) {
            int start = i++;
            while (i + 1 < size && header.get(i).is("::") && header.get(i + 1).isIdentifier()) {
                i += 2;
            }
            name = join(header.subList(start, i));
        }
        if (i < size) {
            if (!header.get(i).is(":")) {
                if (opensBody) {
                    throw new ParseException("Malformed enum header '" + text(header, 0, size) + "'",
                            header.get(at).getLine());
                }
                // the enum is only the type of a variable or function
                return null;
            }
            if (i + 1 == size) {
                throw new ParseException("Missing underlying type for enum '" + name + "'", header.get(i).getLine());
            }
        }
        if (!opensBody && name.isEmpty()) {
            return null;
        }

        return Declaration.builder()
                .kind(SymbolKind.ENUM)
                .name(name)
                .classKey("enum")
                .signature(text(header, 0, size))
                .modifiers(modifiers)
                .declarationOnly(!opensBody)
                .build();
    }

    private Declaration recognizeCallable(List<SourceToken> header, boolean opensBody, Scope scope,
                                          String templateParameters) {
        int size = header.size();
        int open = -1;
        int nameStart = -1;
        String name = null;
        int depth = 0;

        for (int i = 0; i < size && open < 0; i++) {
            SourceToken token = header.get(i);
            if (depth == 0 && token.isKeyword("operator")) {
                int j = i + 1;
                if (j + 1 < size && header.get(j).is("(") && header.get(j + 1).is(")")) {
                    j += 2;
                } else {
                    while (j < size && !header.get(j).is("(")) {
                        j++;
                    }
                }
                if (j >= size || !header.get(j).is("(")) {
                    return null;
                }
                nameStart = qualifierStart(header, i);
                name = joinQualifier(header, nameStart, i) + operatorName(header, i, j);
                open = j;
            } else if (token.is("(")) {
                int nameEnd = depth == 0 ? calleeEnd(header, i) : -1;
                if (nameEnd > 0 && header.get(nameEnd - 1).isIdentifier()
                        && !ATTRIBUTE_MACROS.contains(header.get(nameEnd - 1).getText())) {
                    open = i;
                    nameStart = nameEnd - 1;
                    if (nameStart > 0 && header.get(nameStart - 1).is("~")) {
                        nameStart--;
                    }
                    nameStart = qualifierStart(header, nameStart);
                    name = join(header.subList(nameStart, nameEnd));
                } else {
                    depth++;
                }
            } else if (token.is("[") || token.is("{")) {
                depth++;
            } else if (token.is(")") || token.is("]") || token.is("}")) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is("=")) {
                // "int x = f(1);" is an initialized variable
                return null;
            }
        }
        if (open < 0) {
            return null;
        }

        int close = matchForward(header, open, "(", ")");
        if (close < 0) {
            throw new ParseException("Unbalanced parameter list for '" + name + "'", header.get(open).getLine());
        }

        Set<String> modifiers = new LinkedHashSet<>();
        List<SourceToken> returnTokens = new ArrayList<>();
        for (int i = 0; i < nameStart; i++) {
            SourceToken token = header.get(i);
            if (token.getType() == TokenType.KEYWORD && SPECIFIERS.contains(token.getText())) {
                modifiers.add(token.getText());
            } else if (token.is("[") && i + 1 < nameStart && header.get(i + 1).is("[")) {
                i = Math.max(i, matchForward(header, i, "[", "]"));
            } else if (token.isIdentifier() && ATTRIBUTE_MACROS.contains(token.getText())
                    && i + 1 < nameStart && header.get(i + 1).is("(")) {
                i = Math.max(i, matchForward(header, i + 1, "(", ")"));
            } else if (token.getType() != TokenType.STRING_LITERAL) {
                returnTokens.add(token);
            }
        }
        String returnType = returnTokens.isEmpty() ? null : join(returnTokens);
        returnType = readTrailing(header, close + 1, modifiers, returnType);

        String simpleName = name;
        String qualifier = null;
        int sep = name.lastIndexOf("::");
        if (sep >= 0 && !name.startsWith("operator")) {
            simpleName = name.substring(sep + 2);
            qualifier = stripTemplateArgs(name.substring(0, sep));
            int outer = qualifier.lastIndexOf("::");
            if (outer >= 0) {
                qualifier = qualifier.substring(outer + 2);
            }
        }
        String typeName = scope.getTypeName();

        SymbolKind kind;
        if (simpleName.startsWith("~")
                && (simpleName.substring(1).equals(typeName) || simpleName.substring(1).equals(qualifier))) {
            kind = SymbolKind.DESTRUCTOR;
        } else if (returnType == null && (simpleName.equals(typeName) || simpleName.equals(qualifier))) {
            kind = SymbolKind.CONSTRUCTOR;
        } else if (returnType == null && !simpleName.startsWith("operator")) {
            // no return type: a macro invocation or a statement, not a declaration
            log.debug("Header '{}' has no return type, not a function", text(header, 0, size));
            return null;
        } else if (templateParameters != null) {
            kind = SymbolKind.TEMPLATE_FUNCTION;
        } else if (scope.getKind() == ScopeKind.TYPE || qualifier != null) {
            kind = SymbolKind.METHOD;
        } else {
            kind = SymbolKind.FUNCTION;
        }

        return Declaration.builder()
                .kind(kind)
                .name(name)
                .signature(text(header, open, close + 1))
                .returnType(returnType)
                .parameters(parseParameters(header, open, close))
                .modifiers(modifiers)
                .templateParameters(templateParameters)
                .declarationOnly(!opensBody)
                .build();
    }

    /**
     * Reads qualifiers after the parameter list. Returns the effective return
     * type, which a trailing {@code -> type} replaces.
     */
    private String readTrailing(List<SourceToken> header, int from, Set<String> modifiers, String returnType) {
        int size = header.size();
        for (int i = from; i < size; i++) {
            SourceToken token = header.get(i);
            String text = token.getText();
            if (token.isKeyword("const")) {
                modifiers.add("const");
            } else if (token.isKeyword("noexcept") || token.isKeyword("throw")) {
                modifiers.add("noexcept");
                if (i + 1 < size && header.get(i + 1).is("(")) {
                    i = Math.max(i, matchForward(header, i + 1, "(", ")"));
                }
            } else if (token.isIdentifier() && (text.equals("override") || text.equals("final"))) {
                modifiers.add(text);
            } else if (token.is("=") && i + 1 < size) {
                String value = header.get(i + 1).getText();
                switch (value) {
                    case "0" -> modifiers.add("pure");
                    case "default" -> modifiers.add("defaulted");
                    case "delete" -> modifiers.add("deleted");
                    default -> log.debug("Unexpected '= {}' after parameter list", value);
                }
                i++;
            } else if (token.is("->")) {
                int end = i + 1;
                while (end < size && !isTrailingKeyword(header.get(end))) {
                    end++;
                }
                if (end > i + 1) {
                    returnType = join(header.subList(i + 1, end));
                }
                i = end - 1;
            } else if (token.is(":")) {
                // constructor initializer list
                break;
            }
        }
        return returnType;
    }

    private static boolean isTrailingKeyword(SourceToken token) {
        String text = token.getText();
        return token.is("=") || token.is(":")
                || (token.isIdentifier() && (text.equals("override") || text.equals("final")));
    }

    /**
     * Splits a raw parameter list into parameters. No type is resolved; the name
     * is taken to be the last identifier when something precedes it.
     */
    List<ParameterInfo> parseParameters(List<SourceToken> header, int open, int close) {
        List<ParameterInfo> parameters = new ArrayList<>();
        for (List<SourceToken> part : splitTopLevel(header, open + 1, close)) {
            if (part.isEmpty() || (part.size() == 1 && part.get(0).isKeyword("void"))) {
                continue;
            }
            int eq = indexOfTopLevel(part, "=");
            List<SourceToken> decl = eq >= 0 ? part.subList(0, eq) : part;
            String defaultValue = eq >= 0 ? text(part, eq + 1, part.size()) : null;
            boolean variadic = decl.stream().anyMatch(t -> t.is("..."));

            int nameIdx = decl.size() - 1;
            while (nameIdx > 0 && decl.get(nameIdx).is("]")) {
                nameIdx = matchBackward(decl, nameIdx, "[", "]") - 1;
            }
            String name = null;
            List<SourceToken> typeTokens = new ArrayList<>(decl);
            if (nameIdx > 0 && decl.get(nameIdx).isIdentifier() && !decl.get(nameIdx - 1).is("::")) {
                name = decl.get(nameIdx).getText();
                typeTokens.remove(nameIdx);
            } else {
                name = pointerDeclaratorName(decl);
            }
            parameters.add(ParameterInfo.builder()
                    .name(name)
                    .type(join(typeTokens))
                    .defaultValue(defaultValue)
                    .variadic(variadic)
                    .build());
        }
        return parameters;
    }

    /**
     * One field per declarator of a member declaration such as {@code int a, *b;}.
     */
    public List<Declaration> recognizeFields(List<SourceToken> header, String signature) {
        SourceToken first = header.get(0);
        if (first.isKeyword("typedef") || first.isKeyword("template")
                || (first.getType() == TokenType.KEYWORD && NON_DECLARATIONS.contains(first.getText()))) {
            return List.of();
        }
        Set<String> modifiers = new LinkedHashSet<>();
        for (SourceToken token : header) {
            if (token.getType() == TokenType.KEYWORD && SPECIFIERS.contains(token.getText())) {
                modifiers.add(token.getText());
            } else if (!token.isKeyword("const")) {
                break;
            }
        }
        return fields(header, signature, modifiers, true);
    }

    /**
     * Declarators written after a type body, as {@code b, *p} in
     * {@code struct B { ... } b, *p;}. The type has already been consumed, so a
     * lone identifier names a member here.
     */
    public List<Declaration> recognizeDeclarators(List<SourceToken> tokens, String signature) {
        return fields(tokens, signature, Set.of(), false);
    }

    private List<Declaration> fields(List<SourceToken> header, String signature, Set<String> modifiers,
                                     boolean typeLeads) {
        List<Declaration> fields = new ArrayList<>();
        List<List<SourceToken>> declarators = splitTopLevel(header, 0, header.size());
        for (int d = 0; d < declarators.size(); d++) {
            List<SourceToken> declarator = declarators.get(d);
            if (typeLeads && d == 0 && declarator.size() < 2) {
                // a lone identifier is a macro, not a member
                continue;
            }
            String name = declaratorName(declarator);
            if (name == null) {
                log.debug("No field name in '{}'", signature);
                continue;
            }
            fields.add(Declaration.builder()
                    .kind(SymbolKind.FIELD)
                    .name(name)
                    .signature(signature)
                    .modifiers(modifiers)
                    .build());
        }
        return fields;
    }

    /**
     * Reads a namespace-level {@code using} header. Type aliases
     * ({@code using T = ...;}) import nothing and give an empty result.
     */
    public Optional<ImportDirective> recognizeUsing(List<SourceToken> header) {
        int size = header.size();
        int i = 1;
        ImportDirective.Kind kind = ImportDirective.Kind.USING_DECLARATION;
        if (i < size && header.get(i).isKeyword("namespace")) {
            kind = ImportDirective.Kind.USING_NAMESPACE;
            i++;
        } else if (i < size && header.get(i).isKeyword("typename")) {
            i++;
        }
        if (i >= size || indexOfTopLevel(header, "=") >= 0) {
            return Optional.empty();
        }
        return Optional.of(ImportDirective.builder()
                .kind(kind)
                .target(join(header.subList(i, size)))
                .line(header.get(0).getLine())
                .build());
    }

    /**
     * Reads an {@code #include <path>} or {@code #include "path"} directive;
     * any other directive gives an empty result.
     */
    public Optional<ImportDirective> recognizeInclude(SourceToken directive) {
        Matcher matcher = INCLUDE.matcher(directive.getText());
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        return Optional.of(ImportDirective.builder()
                .kind(ImportDirective.Kind.INCLUDE)
                .target(matcher.group(2))
                .system(matcher.group(1).equals("<"))
                .line(directive.getLine())
                .build());
    }

    /**
     * @throws ParseException when the entry does not start with a name or has an empty initializer
     */
    public Declaration recognizeEnumerator(List<SourceToken> tokens) {
        SourceToken first = tokens.get(0);
        if (!first.isIdentifier()) {
            throw new ParseException("Expected enumerator name but found '" + first.getText() + "'", first.getLine());
        }
        int eq = indexOfTopLevel(tokens, "=");
        String value = null;
        if (eq >= 0) {
            value = text(tokens, eq + 1, tokens.size());
            if (value.isEmpty()) {
                throw new ParseException("Missing value for enumerator '" + first.getText() + "'", first.getLine());
            }
        }
        return Declaration.builder()
                .kind(SymbolKind.ENUMERATOR)
                .name(first.getText())
                .signature(text(tokens, 0, tokens.size()))
                .value(value)
                .build();
    }

    private String declaratorName(List<SourceToken> declarator) {
        String name = null;
        int angle = 0;
        for (int i = 0; i < declarator.size(); i++) {
            SourceToken token = declarator.get(i);
            if (token.is("<")) {
                angle++;
            } else if (token.is(">")) {
                angle = Math.max(0, angle - 1);
            } else if (angle == 0 && (token.is("=") || token.is("[") || token.is("{")
                    || token.is(":") || token.is("("))) {
                break;
            } else if (angle == 0 && token.isIdentifier()) {
                name = i > 0 && declarator.get(i - 1).is("::") ? null : token.getText();
            }
        }
        return name != null ? name : pointerDeclaratorName(declarator);
    }

    /**
     * Name inside a function-pointer declarator such as {@code void (*callback)(int)}.
     */
    private static String pointerDeclaratorName(List<SourceToken> tokens) {
        for (int i = 0; i + 3 < tokens.size(); i++) {
            if (tokens.get(i).is("(") && (tokens.get(i + 1).is("*") || tokens.get(i + 1).is("&"))
                    && tokens.get(i + 2).isIdentifier() && tokens.get(i + 3).is(")")) {
                return tokens.get(i + 2).getText();
            }
        }
        return null;
    }

    private static String operatorName(List<SourceToken> header, int operatorIndex, int open) {
        StringBuilder name = new StringBuilder("operator");
        for (int i = operatorIndex + 1; i < open; i++) {
            SourceToken token = header.get(i);
            if (token.isIdentifier() || token.getType() == TokenType.KEYWORD) {
                name.append(' ');
            }
            name.append(token.getText());
        }
        return name.toString();
    }

    /**
     * End of the name in front of the {@code (} at {@code open}: the paren itself,
     * or the {@code <} of explicit template arguments as in {@code f<int>(int)}.
     */
    private static int calleeEnd(List<SourceToken> header, int open) {
        if (open == 0) {
            return -1;
        }
        if (header.get(open - 1).is(">")) {
            return matchBackward(header, open - 1, "<", ">");
        }
        return open;
    }

    /**
     * Walks back over {@code Outer::} and {@code Outer<T>::} qualifiers in front of a name.
     */
    private static int qualifierStart(List<SourceToken> header, int nameIndex) {
        int start = nameIndex;
        while (start >= 2 && header.get(start - 1).is("::")) {
            int candidate = start - 2;
            if (header.get(candidate).is(">")) {
                int lt = matchBackward(header, candidate, "<", ">");
                if (lt < 1) {
                    break;
                }
                candidate = lt - 1;
            }
            if (!header.get(candidate).isIdentifier()) {
                break;
            }
            start = candidate;
        }
        return start;
    }

    private static String joinQualifier(List<SourceToken> header, int from, int to) {
        return from < to ? join(header.subList(from, to)) : "";
    }

    private static String stripTemplateArgs(String name) {
        int lt = name.indexOf('<');
        return lt >= 0 ? name.substring(0, lt) : name;
    }

    private static int skipAttributes(List<SourceToken> header, int i) {
        while (i < header.size()) {
            SourceToken token = header.get(i);
            if (token.is("[") && i + 1 < header.size() && header.get(i + 1).is("[")) {
                int end = matchForward(header, i, "[", "]");
                if (end < 0) {
                    return header.size();
                }
                i = end + 1;
            } else if (token.isIdentifier() && ATTRIBUTE_MACROS.contains(token.getText())
                    && i + 1 < header.size() && header.get(i + 1).is("(")) {
                int end = matchForward(header, i + 1, "(", ")");
                if (end < 0) {
                    return header.size();
                }
                i = end + 1;
            } else {
                break;
            }
        }
        return i;
    }

    private static int skipAngles(List<SourceToken> header, int open) {
        int end = matchForward(header, open, "<", ">");
        return end < 0 ? header.size() : end + 1;
    }

    private static int matchForward(List<SourceToken> tokens, int open, String opener, String closer) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            if (tokens.get(i).is(opener)) {
                depth++;
            } else if (tokens.get(i).is(closer)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int matchBackward(List<SourceToken> tokens, int close, String opener, String closer) {
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            if (tokens.get(i).is(closer)) {
                depth++;
            } else if (tokens.get(i).is(opener)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int indexOfTopLevel(List<SourceToken> tokens, String symbol) {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            SourceToken token = tokens.get(i);
            if (token.is("(") || token.is("[") || token.is("{")) {
                depth++;
            } else if (token.is(")") || token.is("]") || token.is("}")) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is(symbol)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Splits {@code tokens[from, to)} at commas outside any bracket pair. Angle
     * brackets count here: parameter and base lists are declarative.
     */
    static List<List<SourceToken>> splitTopLevel(List<SourceToken> tokens, int from, int to) {
        List<List<SourceToken>> parts = new ArrayList<>();
        List<SourceToken> current = new ArrayList<>();
        int depth = 0;
        int angle = 0;
        for (int i = from; i < to; i++) {
            SourceToken token = tokens.get(i);
            if (token.is("(") || token.is("[") || token.is("{")) {
                depth++;
            } else if (token.is(")") || token.is("]") || token.is("}")) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is("<")) {
                angle++;
            } else if (depth == 0 && token.is(">")) {
                angle = Math.max(0, angle - 1);
            } else if (depth == 0 && angle == 0 && token.is(",")) {
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
     * Source text of {@code tokens[from, to)} with whitespace runs collapsed.
     */
    String text(List<SourceToken> tokens, int from, int to) {
        if (from >= to) {
            return "";
        }
        return source.substring(tokens.get(from).getStartOffset(), tokens.get(to - 1).getEndOffset())
                .replaceAll("\\s+", " ")
                .strip();
    }

    /**
     * Rebuilds text from tokens, putting a space only between two words.
     */
    static String join(List<SourceToken> tokens) {
        StringBuilder sb = new StringBuilder();
        SourceToken prev = null;
        for (SourceToken token : tokens) {
            if (prev != null && (isWord(prev) && isWord(token) || prev.is(","))) {
                sb.append(' ');
            }
            sb.append(token.getText());
            prev = token;
        }
        return sb.toString();
    }

    private static boolean isWord(SourceToken token) {
        return token.getType() == TokenType.IDENTIFIER || token.getType() == TokenType.KEYWORD
                || token.getType() == TokenType.NUMBER;
    }
}
