package io.treexform.core.tree;

/**
 * A location in a document: zero-based line, zero-based character column (counted in Unicode
 * code points) and the UTF-8 byte offset from the start of the text.
 */
public record Position(int line, int column, int byteOffset) {}
