package com.codeoutline.extractor.parser;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.codeoutline.extractor.config.DocumentationPolicy;
import com.codeoutline.extractor.model.DocumentationBlock;

class CommentClassifierTest {

    private final CommentClassifier anyComment = new CommentClassifier(DocumentationPolicy.ANY_COMMENT);
    private final CommentClassifier markersOnly = new CommentClassifier(DocumentationPolicy.DOC_MARKERS_ONLY);

    @Test
    void testOnlyLastRunIsCandidate() {
        List<SourceToken> tokens = tokens("int a;\n// one\n\n// two\n// three\nint b;");

        Optional<DocumentationBlock> doc = anyComment.classify(comments(tokens), tokens.get(2), tokens.get(6));

        assertThat(doc).isPresent();
        assertThat(doc.get().getText()).isEqualTo("// two\n// three");
        assertThat(doc.get().getCommentCount()).isEqualTo(2);
        assertThat(doc.get().getStartLine()).isEqualTo(4);
        assertThat(doc.get().getEndLine()).isEqualTo(5);
        assertThat(doc.get().isDocMarker()).isFalse();
    }

    @Test
    void testTrailingCommentIsNotDocumentation() {
        List<SourceToken> tokens = tokens("int a; // about a\nint b;");

        Optional<DocumentationBlock> doc = anyComment.classify(comments(tokens), tokens.get(2), tokens.get(4));

        assertThat(doc).isEmpty();
    }

    @Test
    void testTrailingCommentFollowedByRealDoc() {
        List<SourceToken> tokens = tokens("int a; // about a\n// about b\nint b;");

        Optional<DocumentationBlock> doc = anyComment.classify(comments(tokens), tokens.get(2), tokens.get(5));

        assertThat(doc).map(DocumentationBlock::getText).contains("// about b");
    }

    @Test
    void testBlankLineBetweenRunAndDeclarationIsAllowed() {
        List<SourceToken> tokens = tokens("/** Widget */\n\nclass Widget;");

        Optional<DocumentationBlock> doc = anyComment.classify(comments(tokens), null, tokens.get(1));

        assertThat(doc).map(DocumentationBlock::getText).contains("/** Widget */");
    }

    @Test
    void testMarkersOnlyPolicy() {
        List<SourceToken> plain = tokens("// plain\nint f();");
        List<SourceToken> marked = tokens("/// marked\n/// more\nint g();");

        assertThat(markersOnly.classify(comments(plain), null, plain.get(1))).isEmpty();
        assertThat(markersOnly.classify(comments(marked), null, marked.get(2)))
                .map(DocumentationBlock::isDocMarker)
                .contains(true);
    }

    @Test
    void testNoComments() {
        List<SourceToken> tokens = tokens("int f();");

        assertThat(anyComment.classify(List.of(), null, tokens.get(0))).isEmpty();
    }

    @Test
    void testDocMarkers() {
        assertThat(CommentClassifier.hasDocMarker(tokens("/** doc */").get(0))).isTrue();
        assertThat(CommentClassifier.hasDocMarker(tokens("/*! doc */").get(0))).isTrue();
        assertThat(CommentClassifier.hasDocMarker(tokens("/// doc").get(0))).isTrue();
        assertThat(CommentClassifier.hasDocMarker(tokens("//! doc").get(0))).isTrue();
        assertThat(CommentClassifier.hasDocMarker(tokens("/**/").get(0))).isFalse();
        assertThat(CommentClassifier.hasDocMarker(tokens("/* plain */").get(0))).isFalse();
        assertThat(CommentClassifier.hasDocMarker(tokens("// plain").get(0))).isFalse();
    }

    private static List<SourceToken> tokens(String source) {
        return new SourceTokenizer(source).tokenize();
    }

    private static List<SourceToken> comments(List<SourceToken> tokens) {
        return tokens.stream().filter(SourceToken::isComment).toList();
    }
}
