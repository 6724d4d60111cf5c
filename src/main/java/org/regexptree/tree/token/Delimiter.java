package org.regexptree.tree.token;

/**
 * The opening or closing bracket of a structure.
 */
public class Delimiter extends Token {

    public Delimiter(String content) {
        super(content);
    }
}
