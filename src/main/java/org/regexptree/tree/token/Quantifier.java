package org.regexptree.tree.token;

/**
 * A quantifier: {@code *}, {@code +}, {@code ?} or a bounded repeat like {@code {2,5}}.
 */
public class Quantifier extends Token {

    public Quantifier(String content) {
        super(content);
    }
}
