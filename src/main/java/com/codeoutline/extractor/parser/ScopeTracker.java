package com.codeoutline.extractor.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeoutline.extractor.model.Scope;
import com.codeoutline.extractor.model.ScopeKind;
import com.codeoutline.extractor.model.Symbol;

/**
 * Stack of open scopes, updated on brace events and on the angle brackets of
 * a template parameter list.
 *
 * Angle brackets only count as delimiters while a template parameter list is
 * open, i.e. after {@code template <}. Everywhere else they are ordinary
 * punctuation, so comparisons and shifts never open a scope.
 */
public class ScopeTracker {
    private static final Logger log = LoggerFactory.getLogger(ScopeTracker.class);

    private final Deque<Scope> stack = new ArrayDeque<>();
    private final Scope root;
    private final List<ScopeListener> listeners;

    private int pushCount;
    private int popCount;
    private int ignoredCloses;

    private int angleDepth;
    private int angleParenDepth;

    public ScopeTracker(Scope root, List<ScopeListener> listeners) {
        this.root = root;
        this.listeners = List.copyOf(listeners);
        stack.push(root);
    }

    public Scope current() {
        return stack.peek();
    }

    public Scope getRoot() {
        return root;
    }

    /**
     * Number of open scopes above the root.
     */
    public int depth() {
        return stack.size() - 1;
    }

    public Scope push(ScopeKind kind, String name, Symbol owner, SourceToken open) {
        Scope scope = current().open(kind, name, owner, open.getStartOffset());
        stack.push(scope);
        pushCount++;
        log.debug("Opened {} scope '{}' at line {}", kind, scope.getName(), open.getLine());
        for (ScopeListener listener : listeners) {
            listener.onScopePush(scope);
        }
        return scope;
    }

    /**
     * Closes the innermost scope. A close with only the root open is ignored.
     *
     * @return false when the close had nothing to match
     */
    public boolean pop(SourceToken close) {
        if (stack.size() <= 1) {
            ignoredCloses++;
            log.debug("Ignoring unmatched '{}' at line {}", close.getText(), close.getLine());
            return false;
        }
        popInternal(close.getEndOffset(), close.getEndLine());
        return true;
    }

    /**
     * Reports a declaration recognized in the current scope.
     */
    public void emit(Symbol symbol) {
        Scope scope = current();
        for (ScopeListener listener : listeners) {
            listener.onSymbol(symbol, scope);
        }
    }

    /**
     * Opens a template parameter list at the {@code <} following {@code template}.
     */
    public void openTemplateParameters(SourceToken open) {
        push(ScopeKind.TEMPLATE_PARAMETER_LIST, "", null, open);
        angleDepth = 1;
        angleParenDepth = 0;
    }

    /**
     * Feeds one token consumed inside an open template parameter list.
     * Nested {@code <}/{@code >} pairs are matched; brackets inside parentheses
     * are left alone.
     *
     * @return true when this token closed the list
     */
    public boolean trackAngle(SourceToken token) {
        if (!isInTemplateParameters()) {
            return false;
        }
        if (token.is("(")) {
            angleParenDepth++;
        } else if (token.is(")")) {
            angleParenDepth = Math.max(0, angleParenDepth - 1);
        } else if (angleParenDepth == 0 && token.is("<")) {
            angleDepth++;
        } else if (angleParenDepth == 0 && token.is(">")) {
            angleDepth--;
            if (angleDepth == 0) {
                popInternal(token.getEndOffset(), token.getEndLine());
                return true;
            }
        }
        return false;
    }

    public boolean isInTemplateParameters() {
        return current().getKind() == ScopeKind.TEMPLATE_PARAMETER_LIST;
    }

    public int getAngleParenDepth() {
        return angleParenDepth;
    }

    /**
     * Drops a template parameter list that never found its closing bracket.
     */
    public void abandonTemplateParameters(SourceToken at) {
        if (isInTemplateParameters()) {
            popInternal(at.getStartOffset(), at.getLine());
        }
        angleDepth = 0;
        angleParenDepth = 0;
    }

    /**
     * Closes every scope still open at end of input.
     *
     * @return how many scopes were closed
     */
    public int closeAll(int endOffset, int endLine) {
        int closed = 0;
        while (stack.size() > 1) {
            Scope scope = stack.peek();
            log.debug("Auto-closing {} scope '{}' at end of input", scope.getKind(), scope.getName());
            popInternal(endOffset, endLine);
            closed++;
        }
        return closed;
    }

    public void sealRoot(int endOffset, int endLine) {
        root.seal(endOffset, endLine);
    }

    public int getPushCount() {
        return pushCount;
    }

    public int getPopCount() {
        return popCount;
    }

    public int getIgnoredCloses() {
        return ignoredCloses;
    }

    private void popInternal(int endOffset, int endLine) {
        Scope scope = stack.pop();
        popCount++;
        scope.seal(endOffset, endLine);
        for (ScopeListener listener : listeners) {
            listener.onScopePop(scope);
        }
    }
}
