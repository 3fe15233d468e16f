package com.hsformatter.plugins.haskell.cst;

public enum NodeKind {
    MODULE,
    MODULE_HEADER,
    EXPORT_LIST,
    EXPORT_ITEM,
    IMPORT_GROUP,
    IMPORT_DECL,
    IMPORT_LIST,
    IMPORT_ITEM,
    PRAGMA,
    TYPE_SIGNATURE,
    DATA_DECL,
    CONSTRUCTOR,
    RECORD_FIELD,
    DERIVING_CLAUSE,
    FUNCTION_CLAUSE,
    EQUATION,
    GUARDED_RHS,
    EXPR,
    LAYOUT_BLOCK,
    CASE_ALT,
    LET_BINDING,
    OPAQUE_DECL
}
