package org.calista.flowsight.train.format;

/** Line layout of a rendered call chain. */
public enum ChainStyle {
    /** {@code   1. step} */
    NUMBERED,
    /** {@code   → step} */
    ARROW,
    /** {@code   • step} */
    BULLET,
    /** Branch glyphs, one indentation level per step; the last step closes the branch. */
    TREE
}
