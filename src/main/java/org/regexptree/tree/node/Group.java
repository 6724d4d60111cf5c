package org.regexptree.tree.node;

import org.regexptree.tree.Element;
import org.regexptree.tree.token.Delimiter;
import org.regexptree.tree.token.GroupType;

import java.util.List;

/**
 * A group that does not capture, such as {@code (?:...)}, {@code (?=...)} or {@code (?>...)}.
 */
public class Group extends Structure {

    public Group(Delimiter start, GroupType type, List<? extends Element> children, Delimiter finish) {
        super(start, type, children, finish);
    }
}
