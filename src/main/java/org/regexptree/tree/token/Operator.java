package org.regexptree.tree.token;

/**
 * An operator such as the alternation bar {@code |} or the anchors {@code ^} and {@code $}.
 */
public class Operator extends Token {

    public Operator(String content) {
        super(content);
    }
}
