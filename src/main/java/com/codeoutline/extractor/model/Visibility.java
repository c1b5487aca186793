package com.codeoutline.extractor.model;

/**
 * Member access level. Symbols outside a type scope are {@link #UNSPECIFIED}.
 */
public enum Visibility {
    PUBLIC,
    PROTECTED,
    PRIVATE,
    UNSPECIFIED;

    /**
     * Maps an access keyword to its visibility.
     *
     * @throws IllegalArgumentException for anything other than public/protected/private
     */
    public static Visibility fromKeyword(String keyword) {
        return switch (keyword) {
            case "public" -> PUBLIC;
            case "protected" -> PROTECTED;
            case "private" -> PRIVATE;
            default -> throw new IllegalArgumentException("Not an access keyword: " + keyword);
        };
    }

    /**
     * Members of a {@code class} start private, everything else public.
     */
    public static Visibility defaultFor(String classKey) {
        return "class".equals(classKey) ? PRIVATE : PUBLIC;
    }
}
