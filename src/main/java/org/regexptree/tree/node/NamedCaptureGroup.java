package org.regexptree.tree.node;

import org.regexptree.tree.Element;
import org.regexptree.tree.token.Delimiter;
import org.regexptree.tree.token.GroupType;

import java.util.List;

/**
 * A capturing group with a name, {@code (?<name>...)}. Named captures are numbered
 * along with the unnamed ones.
 */
public class NamedCaptureGroup extends CaptureGroup {

    public NamedCaptureGroup(Delimiter start, GroupType type, List<? extends Element> children, Delimiter finish) {
        super(start, requireNamed(type), children, finish);
    }

    private static GroupType requireNamed(GroupType type) {
        if (type == null || !type.isNamedCapture()) {
            throw new IllegalArgumentException("A named capture needs a named type marker, got "
                    + (type == null ? "none" : "'" + type.content() + "'"));
        }
        return type;
    }

    public String name() {
        return type().flatMap(GroupType::name).orElseThrow();
    }
}
