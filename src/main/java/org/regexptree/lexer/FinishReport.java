package org.regexptree.lexer;

/**
 * What {@link TreeFinisher#finish} found out about a tree.
 *
 * @param failures The number of parse failures reported by the finalize pass.
 * @param captureCount The number of capturing groups that received a number.
 */
public record FinishReport(
        int failures,
        int captureCount
) {

    public boolean isClean() {
        return failures == 0;
    }
}
