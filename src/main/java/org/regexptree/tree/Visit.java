package org.regexptree.tree;

/**
 * The verdict of an {@link ElementVisitor} on a single candidate.
 */
public enum Visit {
    /** Add the candidate to the results and search inside it. */
    INCLUDE,
    /** Leave the candidate out of the results but search inside it. */
    EXCLUDE,
    /** Leave the candidate out of the results and do not search inside it. */
    PRUNE
}
