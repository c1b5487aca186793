package com.codeoutline.extractor.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.codeoutline.extractor.config.ParserOptions;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the command. Keeps OutlineCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedOutlineOptions {
    ParserOptions parserOptions;
    List<Path> files;
}
