package org.regexptree.tree.token;

/**
 * A character that matches itself, possibly written as an escape such as {@code \t}.
 */
public class Literal extends Token {

    public Literal(String content) {
        super(content);
    }
}
