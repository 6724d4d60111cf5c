package org.regexptree.tree.token;

/**
 * A comment, either {@code (?#...)} or a {@code #} comment under {@code /x}. Not significant.
 */
public class Comment extends Token {

    public Comment(String content) {
        super(content);
    }

    @Override
    public boolean significant() {
        return false;
    }
}
