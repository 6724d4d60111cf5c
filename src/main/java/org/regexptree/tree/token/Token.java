package org.regexptree.tree.token;

import org.regexptree.tree.Element;

import java.util.List;
import java.util.Objects;

/**
 * A leaf of the parse tree: a run of source text that the lexer recognized as one unit.
 */
public abstract class Token extends Element {

    private final String content;

    protected Token(String content) {
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public String content() {
        return content;
    }

    @Override
    public List<Element> elements() {
        return List.of();
    }

    @Override
    public List<Element> tokens() {
        return List.of(this);
    }
}
