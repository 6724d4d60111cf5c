package org.regexptree.tree;

/**
 * One step of a path through a tree: the accessor to call on a node and the index to pass it.
 *
 * @param accessor Which part of the node the step reads.
 * @param index The index within that part; always 0 for the single-valued accessors.
 */
public record NavStep(
        Accessor accessor,
        int index
) {

    /**
     * The parts of a node an element can be retrieved from.
     */
    public enum Accessor {
        /** The ordinary children of a node. */
        CHILD,
        /** The opening delimiter of a structure. */
        START,
        /** The type marker of a structure. */
        TYPE,
        /** The closing delimiter of a structure. */
        FINISH
    }

    public static NavStep child(int index) {
        return new NavStep(Accessor.CHILD, index);
    }

    @Override
    public String toString() {
        return accessor.name().toLowerCase() + "(" + index + ")";
    }
}
