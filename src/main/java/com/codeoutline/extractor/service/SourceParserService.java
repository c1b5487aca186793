package com.codeoutline.extractor.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeoutline.extractor.config.ParserOptions;
import com.codeoutline.extractor.model.ParseResult;
import com.codeoutline.extractor.parser.ScopeListener;
import com.codeoutline.extractor.parser.SourceParser;

/**
 * Entry point for parsing source text. Each call runs an independent parse,
 * so one service may be shared across threads as long as the registered
 * listeners tolerate it.
 */
public class SourceParserService {
    private static final Logger log = LoggerFactory.getLogger(SourceParserService.class);

    private final ParserOptions options;
    private final List<ScopeListener> listeners = new ArrayList<>();

    public SourceParserService() {
        this(ParserOptions.defaults());
    }

    public SourceParserService(ParserOptions options) {
        this.options = options != null ? options : ParserOptions.defaults();
    }

    public SourceParserService addListener(ScopeListener listener) {
        listeners.add(listener);
        return this;
    }

    public ParseResult parse(String source, String fileName) {
        log.debug("Parsing {} ({} chars)", fileName, source != null ? source.length() : 0);
        return new SourceParser(source, fileName, options, listeners).parse();
    }

    /**
     * Decodes {@code utf8} as UTF-8, replacing malformed sequences, and parses it.
     */
    public ParseResult parse(byte[] utf8, String fileName) {
        String source = utf8 != null ? new String(utf8, StandardCharsets.UTF_8) : "";
        return parse(source, fileName);
    }

    public ParseResult parse(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        byte[] content = Files.readAllBytes(path);

        log.debug("Parsing source file: {}", path);
        return parse(content, fileName);
    }

    public ParserOptions getOptions() {
        return options;
    }
}
