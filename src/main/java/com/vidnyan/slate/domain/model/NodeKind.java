package com.vidnyan.slate.domain.model;

/**
 * Kind tag of a structural node.
 * Each language adapter supplies a closed enumeration implementing this interface.
 * Implementations must have value semantics for equals/hashCode (enums do).
 */
public interface NodeKind {

    /**
     * Kind name as reported in messages.
     */
    String name();
}
