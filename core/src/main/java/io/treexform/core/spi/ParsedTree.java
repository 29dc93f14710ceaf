package io.treexform.core.spi;

/** A backend parse result. Only the owning {@link Language} interprets anything beyond the root. */
public interface ParsedTree {

    /** The root node of the parse. */
    RawNode root();
}
