package com.codeoutline.extractor;

import com.codeoutline.extractor.cli.OutlineCommand;
import picocli.CommandLine;

/**
 * Main entry point for the code outline extractor.
 * Prints the declarations of curly-brace source files as an indented outline.
 */
public class ExtractorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new OutlineCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
