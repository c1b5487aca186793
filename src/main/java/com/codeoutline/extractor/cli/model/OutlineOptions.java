package com.codeoutline.extractor.cli.model;

import java.nio.file.Path;
import java.util.List;

import com.codeoutline.extractor.config.ParserOptions;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "outline" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class OutlineOptions {

	@Parameters(arity = "1..*", paramLabel = "FILE", description = "Source files to outline")
	private List<Path> files;

	@Option(names = { "--doc-markers-only" }, description = "Only treat /**, /*!, /// and //! comments as documentation")
	private boolean docMarkersOnly;

	@Option(names = { "--docs", "-d" }, description = "Print the documentation attached to each symbol")
	private boolean showDocs;

	@Option(names = { "--max-header-tokens" }, defaultValue = "" + ParserOptions.DEFAULT_MAX_HEADER_TOKENS,
			description = "Longest declaration header to recognize, in tokens (default: ${DEFAULT-VALUE})")
	private int maxHeaderTokens;

	@Option(names = { "--no-complexity" }, description = "Skip counting decision points in function bodies")
	private boolean noComplexity;

	@Option(names = { "--strict" }, description = "Exit with status 1 when any parse warning is reported")
	private boolean strict;
}
