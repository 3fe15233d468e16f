package com.hsformatter.plugins.haskell.cst;

public enum OpaqueKind {
    CLASS,
    INSTANCE,
    TYPE_SYNONYM,
    FIXITY,
    CPP,
    SPLICE,
    GADT,
    OTHER
}
