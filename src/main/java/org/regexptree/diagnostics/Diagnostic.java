package org.regexptree.diagnostics;

/**
 * A parse failure found while finishing a tree.
 *
 * @param message What is wrong.
 * @param offset The character offset in the regular expression the message refers to.
 */
public record Diagnostic(String message, int offset) {

    @Override
    public String toString() {
        return String.format("offset %d: %s", offset, message);
    }
}
