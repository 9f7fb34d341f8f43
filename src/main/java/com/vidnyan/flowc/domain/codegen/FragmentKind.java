package com.vidnyan.flowc.domain.codegen;

/**
 * Role of a code fragment in the generated module.
 */
public enum FragmentKind {
    IMPORT,
    DECLARATION,
    INITIALIZATION,
    EXECUTION
}
