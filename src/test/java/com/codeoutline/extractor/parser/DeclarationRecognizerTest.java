package com.codeoutline.extractor.parser;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.codeoutline.extractor.model.ImportDirective;
import com.codeoutline.extractor.model.ParameterInfo;
import com.codeoutline.extractor.model.Scope;
import com.codeoutline.extractor.model.ScopeKind;
import com.codeoutline.extractor.model.Symbol;
import com.codeoutline.extractor.model.SymbolKind;

/**
 * Unit tests for DeclarationRecognizer, one header at a time.
 */
class DeclarationRecognizerTest {

    private final Scope file = Scope.root("test.cpp");

    @Test
    void testNamespace() {
        Declaration ns = single("namespace net::http {", file);

        assertThat(ns.getKind()).isEqualTo(SymbolKind.NAMESPACE);
        assertThat(ns.getName()).isEqualTo("net::http");
    }

    @Test
    void testAnonymousNamespaceAndLinkageBlock() {
        assertThat(single("namespace {", file).isAnonymousScope()).isTrue();
        assertThat(single("extern \"C\" {", file).isAnonymousScope()).isTrue();
    }

    @Test
    void testNamespaceAliasIsSkipped() {
        assertThat(recognize("namespace fs = std::filesystem;", file)).isEmpty();
    }

    @Test
    void testMalformedNamespaceThrows() {
        assertThatThrownBy(() -> recognize("namespace a b {", file))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Malformed namespace declaration")
                .hasMessageEndingWith("at line 1");
    }

    @Test
    void testClassWithBasesAndFinal() {
        Declaration type = single("class Circle final : public Shape, private Logger<int, 2> {", file);

        assertThat(type.getKind()).isEqualTo(SymbolKind.CLASS);
        assertThat(type.getName()).isEqualTo("Circle");
        assertThat(type.getModifiers()).containsExactly("final");
        assertThat(type.getBaseClasses()).containsExactly("public Shape", "private Logger<int, 2>");
        assertThat(type.isDeclarationOnly()).isFalse();
    }

    @Test
    void testExportMacroBeforeClassName() {
        Declaration type = single("class API_EXPORT Widget {", file);

        assertThat(type.getName()).isEqualTo("Widget");
    }

    @Test
    void testForwardDeclarationAndUnion() {
        Declaration forward = single("class Database;", file);
        Declaration union = single("union Value {", file);

        assertThat(forward.isDeclarationOnly()).isTrue();
        assertThat(union.getKind()).isEqualTo(SymbolKind.STRUCT);
        assertThat(union.getClassKey()).isEqualTo("union");
    }

    @Test
    void testTemplateClass() {
        Declaration type = single("struct Box {", file, "typename T");

        assertThat(type.getKind()).isEqualTo(SymbolKind.TEMPLATE_CLASS);
        assertThat(type.getTemplateParameters()).isEqualTo("typename T");
    }

    @Test
    void testScopedEnumWithUnderlyingType() {
        Declaration type = single("enum class Color : uint8_t {", file);

        assertThat(type.getKind()).isEqualTo(SymbolKind.ENUM);
        assertThat(type.getModifiers()).containsExactly("scoped");
        assertThat(type.getSignature()).isEqualTo("enum class Color : uint8_t");
    }

    @Test
    void testMalformedEnumThrows() {
        assertThatThrownBy(() -> recognize("enum Color Red {", file))
                .isInstanceOfSatisfying(ParseException.class, e -> assertThat(e.getLine()).isEqualTo(1));
        assertThatThrownBy(() -> recognize("enum Color : {", file))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Missing underlying type");
    }

    @Test
    void testFunctionWithParameters() {
        Declaration fn = single("static inline const char* format(const char* fmt, int width = 8, ...) {", file);

        assertThat(fn.getKind()).isEqualTo(SymbolKind.FUNCTION);
        assertThat(fn.getName()).isEqualTo("format");
        assertThat(fn.getReturnType()).isEqualTo("const char*");
        assertThat(fn.getModifiers()).containsExactly("static", "inline");
        assertThat(fn.getSignature()).isEqualTo("(const char* fmt, int width = 8, ...)");

        List<ParameterInfo> params = fn.getParameters();
        assertThat(params).extracting(ParameterInfo::getName).containsExactly("fmt", "width", null);
        assertThat(params.get(0).getType()).isEqualTo("const char*");
        assertThat(params.get(1).getDefaultValue()).isEqualTo("8");
        assertThat(params.get(1).isOptional()).isTrue();
        assertThat(params.get(2).isVariadic()).isTrue();
    }

    @Test
    void testVoidParameterListIsEmpty() {
        assertThat(single("int main(void) {", file).getParameters()).isEmpty();
    }

    @Test
    void testFunctionPointerParameter() {
        Declaration fn = single("void on(int code, void (*callback)(int));", file);

        assertThat(fn.getParameters()).extracting(ParameterInfo::getName).containsExactly("code", "callback");
        assertThat(fn.isDeclarationOnly()).isTrue();
    }

    @Test
    void testTrailingReturnType() {
        Declaration fn = single("auto area() const noexcept -> double {", file);

        assertThat(fn.getReturnType()).isEqualTo("double");
        assertThat(fn.getModifiers()).containsExactly("const", "noexcept");
    }

    @Test
    void testMembersInTypeScope() {
        Scope widget = typeScope("Widget", "class");

        assertThat(single("Widget(int size) : size_(size) {", widget).getKind()).isEqualTo(SymbolKind.CONSTRUCTOR);
        assertThat(single("explicit Widget(const Widget& other);", widget).getKind())
                .isEqualTo(SymbolKind.CONSTRUCTOR);
        assertThat(single("virtual ~Widget() = default;", widget).getModifiers())
                .containsExactly("virtual", "defaulted");
        assertThat(single("~Widget() {", widget).getKind()).isEqualTo(SymbolKind.DESTRUCTOR);

        Declaration draw = single("virtual void draw() const override = 0;", widget);
        assertThat(draw.getKind()).isEqualTo(SymbolKind.METHOD);
        assertThat(draw.getModifiers()).containsExactly("virtual", "const", "override", "pure");
    }

    @Test
    void testOutOfClassDefinitions() {
        Declaration method = single("bool AuthService::login(const string& email) {", file);
        Declaration ctor = single("AuthService::AuthService(Database* db) : dbClient(db) {", file);
        Declaration dtor = single("AuthService::~AuthService() {", file);
        Declaration templated = single("T Box<T>::get() const {", file);

        assertThat(method.getKind()).isEqualTo(SymbolKind.METHOD);
        assertThat(method.getName()).isEqualTo("AuthService::login");
        assertThat(ctor.getKind()).isEqualTo(SymbolKind.CONSTRUCTOR);
        assertThat(dtor.getKind()).isEqualTo(SymbolKind.DESTRUCTOR);
        assertThat(dtor.getName()).isEqualTo("AuthService::~AuthService");
        assertThat(templated.getName()).isEqualTo("Box<T>::get");
        assertThat(templated.getKind()).isEqualTo(SymbolKind.METHOD);
    }

    @Test
    void testOperators() {
        Scope point = typeScope("Point", "struct");

        assertThat(single("bool operator==(const Point& other) const;", point).getName()).isEqualTo("operator==");
        assertThat(single("int operator()(int x) {", point).getName()).isEqualTo("operator()");
        assertThat(single("explicit operator bool() const {", point).getName()).isEqualTo("operator bool");
    }

    @Test
    void testStatementsAreNotDeclarations() {
        assertThat(recognize("int x = compute(1);", file)).isEmpty();
        assertThat(recognize("DECLARE_MODULE(core);", file)).isEmpty();
        assertThat(recognize("using namespace std;", file)).isEmpty();
        assertThat(recognize("typedef unsigned long size_type;", file)).isEmpty();
    }

    @Test
    void testFieldsOnePerDeclarator() {
        Scope widget = typeScope("Widget", "struct");

        List<Declaration> fields = recognize("static const int a = 1, *b, c[4];", widget);

        assertThat(fields).extracting(Declaration::getName).containsExactly("a", "b", "c");
        assertThat(fields).allSatisfy(f -> {
            assertThat(f.getKind()).isEqualTo(SymbolKind.FIELD);
            assertThat(f.getModifiers()).containsExactly("static");
            assertThat(f.getSignature()).isEqualTo("static const int a = 1, *b, c[4]");
        });
    }

    @Test
    void testTemplatedFieldTypes() {
        Scope widget = typeScope("Widget", "class");

        assertThat(single("std::map<std::string, int> counts;", widget).getName()).isEqualTo("counts");
        assertThat(single("unsigned flags : 3;", widget).getName()).isEqualTo("flags");
        assertThat(single("void (*handler)(int);", widget).getName()).isEqualTo("handler");
    }

    @Test
    void testNonFieldMembersAreSkipped() {
        Scope widget = typeScope("Widget", "class");

        assertThat(recognize("friend class Registry;", widget)).isEmpty();
        assertThat(recognize("using Base::Base;", widget)).isEmpty();
        assertThat(recognize("typedef int Id;", widget)).isEmpty();
        assertThat(recognize("static_assert(sizeof(int) == 4, \"int size\");", widget)).isEmpty();
        assertThat(recognize("Q_OBJECT;", widget)).isEmpty();
    }

    @Test
    void testEnumerators() {
        DeclarationRecognizer recognizer = new DeclarationRecognizer("Green = Red << 1");
        List<SourceToken> tokens = codeTokens("Green = Red << 1");

        Declaration enumerator = recognizer.recognizeEnumerator(tokens);

        assertThat(enumerator.getName()).isEqualTo("Green");
        assertThat(enumerator.getValue()).isEqualTo("Red << 1");
        assertThat(enumerator.getSignature()).isEqualTo("Green = Red << 1");
    }

    @Test
    void testBadEnumeratorsThrow() {
        DeclarationRecognizer missingValue = new DeclarationRecognizer("A =");
        DeclarationRecognizer noName = new DeclarationRecognizer("= 3");

        assertThatThrownBy(() -> missingValue.recognizeEnumerator(codeTokens("A =")))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Missing value for enumerator 'A'");
        assertThatThrownBy(() -> noName.recognizeEnumerator(codeTokens("= 3")))
                .isInstanceOf(ParseException.class);
    }

    @Test
    void testExplicitSpecializationKeepsName() {
        Declaration fn = single("void f<int>(int x) {", file, "");
        Declaration member = single("void Registry<int>::add<long>(long v) {", file, "");

        assertThat(fn.getKind()).isEqualTo(SymbolKind.TEMPLATE_FUNCTION);
        assertThat(fn.getName()).isEqualTo("f");
        assertThat(fn.getReturnType()).isEqualTo("void");
        assertThat(fn.getParameters()).extracting(ParameterInfo::getName).containsExactly("x");
        assertThat(member.getName()).isEqualTo("Registry<int>::add");
        assertThat(member.getTemplateParameters()).isEmpty();
    }

    @Test
    void testDeclaratorsAfterTypeBody() {
        DeclarationRecognizer recognizer = new DeclarationRecognizer("b, *pb, arr[4]");

        List<Declaration> fields = recognizer.recognizeDeclarators(codeTokens("b, *pb, arr[4]"), "B b, *pb, arr[4]");

        assertThat(fields).extracting(Declaration::getName).containsExactly("b", "pb", "arr");
        assertThat(fields).extracting(Declaration::getKind).containsOnly(SymbolKind.FIELD);
    }

    @Test
    void testUsingHeaders() {
        DeclarationRecognizer recognizer = new DeclarationRecognizer("");

        assertThat(recognizer.recognizeUsing(codeTokens("using namespace std::chrono"))).hasValueSatisfying(i -> {
            assertThat(i.getKind()).isEqualTo(ImportDirective.Kind.USING_NAMESPACE);
            assertThat(i.getTarget()).isEqualTo("std::chrono");
        });
        assertThat(recognizer.recognizeUsing(codeTokens("using typename Base::value_type"))).hasValueSatisfying(i -> {
            assertThat(i.getKind()).isEqualTo(ImportDirective.Kind.USING_DECLARATION);
            assertThat(i.getTarget()).isEqualTo("Base::value_type");
        });
        assertThat(recognizer.recognizeUsing(codeTokens("using Handle = std::uint32_t"))).isEmpty();
    }

    @Test
    void testIncludeDirectives() {
        DeclarationRecognizer recognizer = new DeclarationRecognizer("");

        assertThat(recognizer.recognizeInclude(directive("#include <sys/types.h>"))).hasValueSatisfying(i -> {
            assertThat(i.getTarget()).isEqualTo("sys/types.h");
            assertThat(i.isSystem()).isTrue();
        });
        assertThat(recognizer.recognizeInclude(directive("#  include \"util/log.h\" // logging")))
                .hasValueSatisfying(i -> {
                    assertThat(i.getTarget()).isEqualTo("util/log.h");
                    assertThat(i.isSystem()).isFalse();
                });
        assertThat(recognizer.recognizeInclude(directive("#define INCLUDE_ALL 1"))).isEmpty();
        assertThat(recognizer.recognizeInclude(directive("#include MACRO_HEADER"))).isEmpty();
    }

    private static SourceToken directive(String text) {
        return new SourceTokenizer(text).tokenize().get(0);
    }

    private static Scope typeScope(String name, String classKey) {
        Symbol owner = Symbol.builder()
                .kind(classKey.equals("class") ? SymbolKind.CLASS : SymbolKind.STRUCT)
                .name(name)
                .classKey(classKey)
                .build();
        return Scope.root("test.cpp").open(ScopeKind.TYPE, name, owner, 0);
    }

    private static Declaration single(String header, Scope scope) {
        return single(header, scope, null);
    }

    private static Declaration single(String header, Scope scope, String templateParameters) {
        List<Declaration> declarations = recognize(header, scope, templateParameters);
        assertThat(declarations).hasSize(1);
        return declarations.get(0);
    }

    private static List<Declaration> recognize(String header, Scope scope) {
        return recognize(header, scope, null);
    }

    /**
     * Splits the trailing '{' or ';' off as the terminator.
     */
    private static List<Declaration> recognize(String source, Scope scope, String templateParameters) {
        List<SourceToken> tokens = codeTokens(source);
        SourceToken terminator = tokens.get(tokens.size() - 1);
        return new DeclarationRecognizer(source)
                .recognize(tokens.subList(0, tokens.size() - 1), terminator, scope, templateParameters);
    }

    private static List<SourceToken> codeTokens(String source) {
        return new SourceTokenizer(source).tokenize().stream()
                .filter(t -> !t.isComment() && !t.isEof())
                .toList();
    }
}
