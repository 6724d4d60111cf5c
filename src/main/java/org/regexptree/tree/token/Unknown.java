package org.regexptree.tree.token;

/**
 * Text the lexer could not make sense of. Each one counts as a parse failure.
 */
public class Unknown extends Token {

    private final String error;

    public Unknown(String content, String error) {
        super(content);
        this.error = error;
    }

    /**
     * @return Why the text could not be lexed.
     */
    public String error() {
        return error;
    }

    @Override
    public int finalizeParse() {
        return 1;
    }
}
