package com.vidnyan.slate.application.port.out;

import com.vidnyan.slate.domain.model.SyntaxTree;

/**
 * Port for turning source text into the structural model.
 * Implemented by language adapters (e.g. a JavaParser adapter).
 *
 * Contract: either return a well-formed tree (children inside their parent, siblings ordered by
 * start offset and disjoint) or throw {@link SourceSyntaxException}. Implementations must be safe
 * to call concurrently.
 */
public interface SourceParser {

    /**
     * Check if this parser handles the given file name.
     */
    boolean supports(String fileName);

    /**
     * Parse one source text.
     *
     * @throws SourceSyntaxException when the text is malformed
     */
    SyntaxTree parse(String text) throws SourceSyntaxException;

    /**
     * Get the parser name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
