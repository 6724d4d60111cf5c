package org.regexptree.tree.token;

/**
 * Layout under the {@code /x} modifier. Not significant.
 */
public class Whitespace extends Token {

    public Whitespace(String content) {
        super(content);
    }

    @Override
    public boolean significant() {
        return false;
    }
}
