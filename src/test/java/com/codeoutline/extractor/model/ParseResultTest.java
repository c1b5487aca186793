package com.codeoutline.extractor.model;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.codeoutline.extractor.parser.SourceParser;

class ParseResultTest {

    private static final String SOURCE = """
            namespace geo {
            struct Point { int x; int y; };
            double distance(const Point& a, const Point& b);
            namespace detail {
            double distance(double dx, double dy);
            }
            }
            """;

    @Test
    void testAllSymbolsInPreOrder() {
        ParseResult result = new SourceParser(SOURCE, "geo.h").parse();

        assertThat(result.getAllSymbols()).extracting(Symbol::getQualifiedName).containsExactly(
                "geo", "geo::Point", "geo::Point::x", "geo::Point::y", "geo::distance", "geo::detail",
                "geo::detail::distance");
    }

    @Test
    void testLookups() {
        ParseResult result = new SourceParser(SOURCE, "geo.h").parse();

        assertThat(result.findSymbols("distance")).hasSize(2);
        assertThat(result.findByQualifiedName("geo::detail::distance"))
                .hasValueSatisfying(s -> assertThat(s.getParameters()).hasSize(2));
        assertThat(result.findByQualifiedName("geo::missing")).isEmpty();
        assertThat(result.getSymbolsOfKind(SymbolKind.FIELD)).extracting(Symbol::getName).containsExactly("x", "y");
        assertThat(result.getSymbolsOfKind(SymbolKind.NAMESPACE)).hasSize(2);
    }

    @Test
    void testVisitorSeesEverySymbol() {
        ParseResult result = new SourceParser(SOURCE, "geo.h").parse();
        List<String> namespaces = new ArrayList<>();
        List<String> fields = new ArrayList<>();

        result.accept(new SymbolVisitor() {
            @Override
            public void visitNamespace(Symbol symbol) {
                namespaces.add(symbol.getName());
            }

            @Override
            public void visitField(Symbol symbol) {
                fields.add(symbol.getName());
            }
        });

        assertThat(namespaces).containsExactly("geo", "detail");
        assertThat(fields).containsExactly("x", "y");
    }

    @Test
    void testRootScope() {
        ParseResult result = new SourceParser(SOURCE, "geo.h").parse();
        Scope root = result.getRoot();

        assertThat(root.isRoot()).isTrue();
        assertThat(root.getFileName()).isEqualTo("geo.h");
        assertThat(root.getSpan()).isEqualTo(SourceSpan.of(0, SOURCE.length()));
        assertThat(root.getSymbols()).singleElement().extracting(Symbol::getName).isEqualTo("geo");
        assertThat(result.getTokenCount()).isPositive();
    }
}
