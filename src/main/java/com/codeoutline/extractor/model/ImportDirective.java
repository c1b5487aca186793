package com.codeoutline.extractor.model;

import lombok.Builder;
import lombok.Value;

/**
 * A dependency named by the file: an {@code #include} directive or a
 * namespace-level {@code using} declaration.
 */
@Value
@Builder
public class ImportDirective {

    public enum Kind {
        INCLUDE,
        /** {@code using namespace std;} */
        USING_NAMESPACE,
        /** {@code using std::string;} */
        USING_DECLARATION
    }

    Kind kind;
    /** Header path for includes, the qualified name for using declarations. */
    String target;
    /** True for {@code #include <...>}. */
    boolean system;
    int line;
}
