package com.e2eq.cnl.schema;

/**
 * What happens when a user type is deleted while edges or nodes still use it.
 */
public enum TypeDeletionPolicy {
    /** Refuse the delete with a dangling-reference error. */
    REJECT,
    /** Delete the edges of that type everywhere (or clear the node type) and then the type. */
    CASCADE
}
