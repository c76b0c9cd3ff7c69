package com.vidnyan.slate.adapter.out.parser;

import com.vidnyan.slate.domain.model.NodeKind;

/**
 * Node kinds produced by {@link JavaSourceParser}.
 * Coarse on purpose: JavaParser node types without a dedicated kind fall into
 * {@link #STATEMENT}, {@link #EXPRESSION} or {@link #OTHER}.
 */
public enum JavaNodeKind implements NodeKind {
    COMPILATION_UNIT,
    PACKAGE_DECLARATION,
    IMPORT_DECLARATION,
    CLASS_OR_INTERFACE_DECLARATION,
    ENUM_DECLARATION,
    RECORD_DECLARATION,
    ANNOTATION_DECLARATION,
    FIELD_DECLARATION,
    VARIABLE_DECLARATOR,
    METHOD_DECLARATION,
    CONSTRUCTOR_DECLARATION,
    PARAMETER,
    BLOCK_STMT,
    STATEMENT,
    ANNOTATION,
    EXPRESSION,
    NAME,
    TYPE,
    MODIFIER,
    COMMENT,
    OTHER
}
