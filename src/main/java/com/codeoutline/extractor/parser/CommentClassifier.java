package com.codeoutline.extractor.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.codeoutline.extractor.config.DocumentationPolicy;
import com.codeoutline.extractor.model.DocumentationBlock;
import com.codeoutline.extractor.model.SourceSpan;

/**
 * Decides whether the comments in front of a declaration document it.
 *
 * Only the last run of comments counts: comments on consecutive lines form a
 * run, a blank line starts a new one. A comment sharing a line with the code
 * before it is a trailing remark and never documentation.
 */
public class CommentClassifier {

    private final DocumentationPolicy policy;

    public CommentClassifier(DocumentationPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param comments    comment tokens between the previous code token and the declaration
     * @param previous    last code token before the comments, or null at start of input
     * @param declaration first token of the declaration header
     */
    public Optional<DocumentationBlock> classify(List<SourceToken> comments, SourceToken previous,
                                                 SourceToken declaration) {
        List<SourceToken> candidates = new ArrayList<>();
        for (SourceToken comment : comments) {
            if (candidates.isEmpty() && previous != null && comment.getLine() == previous.getEndLine()) {
                continue;
            }
            candidates.add(comment);
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        int runStart = candidates.size() - 1;
        while (runStart > 0 && candidates.get(runStart).getLine() <= candidates.get(runStart - 1).getEndLine() + 1) {
            runStart--;
        }
        List<SourceToken> run = candidates.subList(runStart, candidates.size());

        boolean docMarker = hasDocMarker(run.get(0));
        if (policy == DocumentationPolicy.DOC_MARKERS_ONLY && !docMarker) {
            return Optional.empty();
        }

        SourceToken first = run.get(0);
        SourceToken last = run.get(run.size() - 1);
        if (last.getEndOffset() > declaration.getStartOffset()) {
            return Optional.empty();
        }
        StringBuilder text = new StringBuilder();
        for (SourceToken comment : run) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(comment.getText().stripTrailing());
        }

        return Optional.of(DocumentationBlock.builder()
                .text(text.toString())
                .commentCount(run.size())
                .span(SourceSpan.of(first.getStartOffset(), last.getEndOffset()))
                .startLine(first.getLine())
                .endLine(last.getEndLine())
                .docMarker(docMarker)
                .build());
    }

    static boolean hasDocMarker(SourceToken comment) {
        String text = comment.getText();
        if (text.startsWith("/**")) {
            // "/**/" is an empty ordinary comment
            return !text.startsWith("/**/");
        }
        return text.startsWith("/*!") || text.startsWith("///") || text.startsWith("//!");
    }
}
