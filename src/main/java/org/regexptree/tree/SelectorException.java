package org.regexptree.tree;

/**
 * Thrown when a {@link Selector} cannot be turned into a visitor.
 */
public class SelectorException extends RuntimeException {

    public SelectorException(String message) {
        super(message);
    }
}
