package com.e2eq.cnl.graph;

public enum EdgeKind {
    RELATION,
    ATTRIBUTE
}
