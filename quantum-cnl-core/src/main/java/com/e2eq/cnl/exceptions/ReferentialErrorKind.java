package com.e2eq.cnl.exceptions;

public enum ReferentialErrorKind {
    NOT_FOUND,
    PROTECTED_MORPH,
    DANGLING_REFERENCE
}
