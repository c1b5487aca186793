package com.codeoutline.extractor.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeoutline.extractor.cli.exception.OptionsValidationException;
import com.codeoutline.extractor.cli.model.OutlineOptions;
import com.codeoutline.extractor.cli.model.ValidatedOutlineOptions;
import com.codeoutline.extractor.cli.output.OutlinePrinter;
import com.codeoutline.extractor.cli.validation.OutlineOptionsValidator;
import com.codeoutline.extractor.model.ParseResult;
import com.codeoutline.extractor.service.SourceParserService;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command printing the declaration outline of one or more source files.
 */
@Command(
        name = "outline",
        mixinStandardHelpOptions = true,
        version = "code-outline-extractor 1.0.0",
        description = "Prints the namespaces, types, functions and fields declared in C-family source files."
)
public class OutlineCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(OutlineCommand.class);

    @Mixin
    private OutlineOptions options = new OutlineOptions();

    private final OutlineOptionsValidator validator = new OutlineOptionsValidator();

    @Override
    public Integer call() {
        ValidatedOutlineOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error(error));
            return 1;
        }

        SourceParserService service = new SourceParserService(validated.getParserOptions());
        OutlinePrinter printer = new OutlinePrinter(options.isShowDocs());

        int outlined = 0;
        int warnings = 0;
        boolean failed = false;
        for (Path file : validated.getFiles()) {
            try {
                ParseResult result = service.parse(file);
                printer.printOutline(file, result);
                outlined++;
                warnings += result.getDiagnostics().getWarnings().size();
            } catch (IOException e) {
                printer.printFailure(file, e.getMessage());
                failed = true;
            }
        }

        printer.printSummary(outlined, warnings, options.isStrict());
        if (failed || (options.isStrict() && warnings > 0)) {
            return 1;
        }
        return 0;
    }
}
