package com.codeoutline.extractor.config;

/**
 * Which comment runs may become documentation.
 */
public enum DocumentationPolicy {
    /** Any comment run directly preceding a declaration. */
    ANY_COMMENT,
    /** Only runs opening with {@code /**}, {@code /*!}, {@code ///} or {@code //!}. */
    DOC_MARKERS_ONLY
}
