package com.e2eq.cnl.validation;

public enum ValidationErrorKind {
    UNKNOWN_TYPE,
    DOMAIN_RANGE_MISMATCH,
    BAD_DATA_TYPE,
    DISALLOWED_VALUE
}
