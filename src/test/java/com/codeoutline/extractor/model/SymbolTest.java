package com.codeoutline.extractor.model;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class SymbolTest {

    @Test
    void testQualifiedNameFollowsParents() {
        Symbol ns = container(SymbolKind.NAMESPACE, "net");
        Symbol type = container(SymbolKind.CLASS, "Socket");
        Symbol method = leaf(SymbolKind.METHOD, "connect");

        ns.addChild(type);
        type.addChild(method);

        assertThat(method.getQualifiedPath()).containsExactly("net", "Socket");
        assertThat(method.getQualifiedName()).isEqualTo("net::Socket::connect");
        assertThat(method.getParent()).isSameAs(type);
        assertThat(ns.getQualifiedName()).isEqualTo("net");
    }

    @Test
    void testUnnamedParentsAreLeftOutOfQualifiedName() {
        Symbol outer = container(SymbolKind.CLASS, "Outer");
        Symbol anonymous = container(SymbolKind.STRUCT, "");
        Symbol field = leaf(SymbolKind.FIELD, "x");

        outer.addChild(anonymous);
        anonymous.addChild(field);

        assertThat(field.getQualifiedName()).isEqualTo("Outer::x");
    }

    @Test
    void testAssignNameOnlyForUnnamedSymbols() {
        Symbol anonymous = container(SymbolKind.STRUCT, "");
        Symbol field = leaf(SymbolKind.FIELD, "x");
        anonymous.addChild(field);
        anonymous.seal(30, 1);

        anonymous.assignName("Point");

        assertThat(field.getQualifiedName()).isEqualTo("Point::x");
        assertThatThrownBy(() -> anonymous.assignName("Other"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Point");
    }

    @Test
    void testSealedSymbolRejectsChildren() {
        Symbol type = container(SymbolKind.STRUCT, "Point");
        type.addChild(leaf(SymbolKind.FIELD, "x"));
        type.seal(40, 3);

        assertThat(type.isSealed()).isTrue();
        assertThat(type.getSpan()).isEqualTo(SourceSpan.of(0, 40));
        assertThat(type.getEndLine()).isEqualTo(3);
        assertThatThrownBy(() -> type.addChild(leaf(SymbolKind.FIELD, "y")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Point");
        assertThatThrownBy(() -> type.getChildren().add(leaf(SymbolKind.FIELD, "z")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testLeavesAndForwardDeclarationsStartSealed() {
        Symbol forward = Symbol.builder().kind(SymbolKind.CLASS).name("Database").declarationOnly(true).build();

        assertThat(leaf(SymbolKind.FUNCTION, "main").isSealed()).isTrue();
        assertThat(forward.isSealed()).isTrue();
        assertThat(container(SymbolKind.CLASS, "Open").isSealed()).isFalse();
    }

    @Test
    void testBuilderDefaults() {
        Symbol symbol = Symbol.builder().kind(SymbolKind.FIELD).build();

        assertThat(symbol.getName()).isEmpty();
        assertThat(symbol.getSignature()).isEmpty();
        assertThat(symbol.getVisibility()).isEqualTo(Visibility.UNSPECIFIED);
        assertThat(symbol.getParameters()).isEmpty();
        assertThat(symbol.getModifiers()).isEmpty();
        assertThat(symbol.hasDocumentation()).isFalse();
    }

    @Test
    void testCompleteBodyOnlyForCallables() {
        Symbol fn = leaf(SymbolKind.FUNCTION, "run");
        fn.completeBody(120, 9, 3);

        assertThat(fn.getSpan().getEndOffset()).isEqualTo(120);
        assertThat(fn.getComplexity()).isEqualTo(3);
        assertThatThrownBy(() -> leaf(SymbolKind.FIELD, "x").completeBody(1, 1, 1))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testVisitorDispatchByKind() {
        List<String> visited = new ArrayList<>();
        SymbolVisitor visitor = new SymbolVisitor() {
            @Override
            public void visitType(Symbol symbol) {
                visited.add("type:" + symbol.getName());
            }

            @Override
            public void visitCallable(Symbol symbol) {
                visited.add("callable:" + symbol.getName());
            }
        };

        container(SymbolKind.TEMPLATE_CLASS, "Box").accept(visitor);
        leaf(SymbolKind.DESTRUCTOR, "~Box").accept(visitor);
        leaf(SymbolKind.ENUMERATOR, "RED").accept(visitor);

        assertThat(visited).containsExactly("type:Box", "callable:~Box");
    }

    @Test
    void testKindCategories() {
        assertThat(SymbolKind.NAMESPACE.isContainer()).isTrue();
        assertThat(SymbolKind.ENUM.isType()).isTrue();
        assertThat(SymbolKind.TEMPLATE_FUNCTION.isCallable()).isTrue();
        assertThat(SymbolKind.FIELD.isContainer()).isFalse();
        assertThat(Visibility.defaultFor("struct")).isEqualTo(Visibility.PUBLIC);
        assertThat(Visibility.defaultFor("class")).isEqualTo(Visibility.PRIVATE);
        assertThatThrownBy(() -> Visibility.fromKeyword("internal")).isInstanceOf(IllegalArgumentException.class);
    }

    private static Symbol container(SymbolKind kind, String name) {
        return Symbol.builder().kind(kind).name(name).span(SourceSpan.of(0, 10)).startLine(1).build();
    }

    private static Symbol leaf(SymbolKind kind, String name) {
        return Symbol.builder().kind(kind).name(name).span(SourceSpan.of(2, 8)).startLine(1).build();
    }
}
