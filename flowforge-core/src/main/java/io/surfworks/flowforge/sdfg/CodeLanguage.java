package io.surfworks.flowforge.sdfg;

/**
 * Languages code blocks can be tagged with.
 */
public enum CodeLanguage {
    Python,
    CPP,
    MLIR
}
