package com.e2eq.cnl.exceptions;

/**
 * Thrown when a schema type, morph or transition would be created under a name that is
 * already taken in the given tier or scope.
 */
public class DuplicateException extends CnlGraphException {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final String tier;

    public DuplicateException(String name, String tier) {
        super(String.format("'%s' already exists in %s", name, tier));
        this.name = name;
        this.tier = tier;
    }

    public String getName() {
        return name;
    }

    public String getTier() {
        return tier;
    }
}
