package com.vidnyan.slate.adapter.out.parser;

import com.vidnyan.slate.domain.model.NodeKind;

/**
 * Node kinds produced by {@link PlainTextParser}.
 */
public enum TextNodeKind implements NodeKind {
    DOCUMENT,
    LINE,
    WORD,
    WHITESPACE,
    PUNCTUATION,
    LINE_BREAK
}
