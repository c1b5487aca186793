package com.codeoutline.extractor.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.codeoutline.extractor.cli.exception.OptionsValidationException;
import com.codeoutline.extractor.cli.model.OutlineOptions;
import com.codeoutline.extractor.cli.model.ValidatedOutlineOptions;
import com.codeoutline.extractor.config.DocumentationPolicy;
import com.codeoutline.extractor.config.ParserOptions;

public class OutlineOptionsValidator {

	public ValidatedOutlineOptions validate(OutlineOptions o) {
		List<String> errors = new ArrayList<>();

		List<Path> files = o.getFiles() == null ? List.of() : o.getFiles();
		if (files.isEmpty()) {
			errors.add("At least one source file is required.");
		}

		List<Path> normalized = new ArrayList<>();
		for (Path file : files) {
			Path p = file.toAbsolutePath().normalize();
			if (!Files.exists(p)) {
				errors.add("Source file does not exist: " + file);
			} else if (Files.isDirectory(p)) {
				errors.add("Source path is a directory, not a file: " + file);
			} else if (!Files.isReadable(p)) {
				errors.add("Source file is not readable: " + file);
			}
			normalized.add(p);
		}

		if (o.getMaxHeaderTokens() <= 0) {
			errors.add("Max header tokens must be > 0. Got: " + o.getMaxHeaderTokens());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ParserOptions parserOptions = ParserOptions.builder()
				.documentationPolicy(o.isDocMarkersOnly() ? DocumentationPolicy.DOC_MARKERS_ONLY
						: DocumentationPolicy.ANY_COMMENT)
				.maxHeaderTokens(o.getMaxHeaderTokens())
				.computeComplexity(!o.isNoComplexity())
				.build();

		return new ValidatedOutlineOptions(parserOptions, List.copyOf(normalized));
	}
}
