package com.codeoutline.extractor.cli.output;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeoutline.extractor.model.ImportDirective;
import com.codeoutline.extractor.model.ParseDiagnostics;
import com.codeoutline.extractor.model.ParseResult;
import com.codeoutline.extractor.model.Symbol;
import com.codeoutline.extractor.model.SymbolVisitor;
import com.codeoutline.extractor.model.Visibility;

import lombok.Getter;

/**
 * Responsible only for printing CLI output for the "outline" command.
 * No validation, no parsing.
 */
public class OutlinePrinter {

    private static final Logger log = LoggerFactory.getLogger(OutlinePrinter.class);
    private static final String INDENT = "  ";

    private final boolean showDocs;

    public OutlinePrinter(boolean showDocs) {
        this.showDocs = showDocs;
    }

    public void printOutline(Path file, ParseResult result) {
        log.info("=================================================");
        log.info("{}", file);
        log.info("=================================================");
        for (ImportDirective directive : result.getImports()) {
            log.info("{}", describe(directive));
        }
        for (String line : render(result)) {
            log.info("{}", line);
        }

        SymbolCounter counter = new SymbolCounter();
        result.accept(counter);
        log.info("-------------------------------------------------");
        log.info("Namespaces: {}  Types: {}  Callables: {}  Fields: {}  Enumerators: {}",
                counter.getNamespaces(), counter.getTypes(), counter.getCallables(), counter.getFields(),
                counter.getEnumerators());
        log.info("Tokens: {}", result.getTokenCount());

        printDiagnostics(result.getDiagnostics());
    }

    public void printFailure(Path file, String message) {
        log.error("Could not read {}: {}", file, message);
    }

    public void printSummary(int files, int warnings, boolean strict) {
        log.info("");
        log.info("Files outlined: {}", files);
        log.info("Warnings: {}", warnings);
        if (strict && warnings > 0) {
            log.error("Strict mode: failing because of {} warning(s)", warnings);
        }
    }

    public static String describe(ImportDirective directive) {
        String text = switch (directive.getKind()) {
            case INCLUDE -> directive.isSystem()
                    ? "#include <" + directive.getTarget() + ">"
                    : "#include \"" + directive.getTarget() + "\"";
            case USING_NAMESPACE -> "using namespace " + directive.getTarget();
            case USING_DECLARATION -> "using " + directive.getTarget();
        };
        return text + "  [" + directive.getLine() + "]";
    }

    /**
     * Outline lines for every symbol, children indented under their parent.
     */
    public List<String> render(ParseResult result) {
        List<String> lines = new ArrayList<>();
        for (Symbol symbol : result.getRoot().getSymbols()) {
            render(symbol, 0, lines);
        }
        return lines;
    }

    private void render(Symbol symbol, int depth, List<String> lines) {
        String indent = INDENT.repeat(depth);
        lines.add(indent + describe(symbol));
        if (showDocs && symbol.hasDocumentation()) {
            for (String doc : symbol.getDocumentation().getContent().split("\n")) {
                lines.add(indent + INDENT + "| " + doc);
            }
        }
        for (Symbol child : symbol.getChildren()) {
            render(child, depth + 1, lines);
        }
    }

    static String describe(Symbol symbol) {
        StringBuilder line = new StringBuilder();
        if (symbol.getVisibility() != Visibility.UNSPECIFIED) {
            line.append(symbol.getVisibility().name().toLowerCase()).append(' ');
        }
        line.append(symbol.getKind().name().toLowerCase().replace('_', '-')).append(' ');

        switch (symbol.getKind()) {
            case FUNCTION, METHOD, TEMPLATE_FUNCTION, CONSTRUCTOR, DESTRUCTOR -> {
                if (symbol.getReturnType() != null) {
                    line.append(symbol.getReturnType()).append(' ');
                }
                line.append(symbol.getName()).append(symbol.getSignature());
                if (!symbol.getModifiers().isEmpty()) {
                    line.append(' ').append(symbol.getModifiers());
                }
                if (symbol.isDeclarationOnly()) {
                    line.append(" (declaration)");
                } else if (symbol.getComplexity() > 0) {
                    line.append(" complexity=").append(symbol.getComplexity());
                }
            }
            case ENUMERATOR -> {
                line.append(symbol.getName());
                if (symbol.getValue() != null) {
                    line.append(" = ").append(symbol.getValue());
                }
            }
            case FIELD -> line.append(symbol.getName());
            default -> {
                line.append(symbol.getName().isEmpty() ? "<anonymous>" : symbol.getName());
                if (!symbol.getBaseClasses().isEmpty()) {
                    line.append(" : ").append(String.join(", ", symbol.getBaseClasses()));
                }
                if (symbol.isDeclarationOnly()) {
                    line.append(" (declaration)");
                }
            }
        }
        line.append("  [").append(symbol.getStartLine()).append('-').append(symbol.getEndLine()).append(']');
        return line.toString();
    }

    private void printDiagnostics(ParseDiagnostics diagnostics) {
        for (String error : diagnostics.getErrors()) {
            log.error("ERROR: {}", error);
        }
        for (String warning : diagnostics.getWarnings()) {
            log.warn("WARNING: {}", warning);
        }
        for (String info : diagnostics.getInfos()) {
            log.info("INFO: {}", info);
        }
    }

    @Getter
    static class SymbolCounter implements SymbolVisitor {
        private int namespaces;
        private int types;
        private int callables;
        private int fields;
        private int enumerators;

        @Override
        public void visitNamespace(Symbol symbol) {
            namespaces++;
        }

        @Override
        public void visitType(Symbol symbol) {
            types++;
        }

        @Override
        public void visitCallable(Symbol symbol) {
            callables++;
        }

        @Override
        public void visitField(Symbol symbol) {
            fields++;
        }

        @Override
        public void visitEnumerator(Symbol symbol) {
            enumerators++;
        }
    }
}
