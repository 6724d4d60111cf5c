package org.regexptree.tree.node;

import org.regexptree.tree.Element;
import org.regexptree.tree.Node;

import java.util.Arrays;
import java.util.List;

/**
 * A plain run of elements: the body of a regular expression or one branch of an alternation.
 */
public class Sequence extends Node {

    public Sequence(List<? extends Element> children) {
        super(children);
    }

    public Sequence(Element... children) {
        this(children == null ? null : Arrays.asList(children));
    }
}
