package com.vidnyan.slate.application.port.out;

import com.vidnyan.slate.domain.model.Span;

/**
 * The parser could not build a tree from the source text.
 * Recoverable per file: the file is reported as parse-failed and no rules run for it.
 */
public class SourceSyntaxException extends Exception {

    private final transient Span span;

    public SourceSyntaxException(Span span, String message) {
        super(message);
        this.span = span;
    }

    public SourceSyntaxException(Span span, String message, Throwable cause) {
        super(message, cause);
        this.span = span;
    }

    /**
     * Offending region of the source text.
     */
    public Span span() {
        return span;
    }
}
