package org.regexptree.tree.node;

import org.regexptree.tree.Element;
import org.regexptree.tree.token.Delimiter;
import org.regexptree.tree.token.GroupType;

import java.util.List;
import java.util.OptionalInt;

/**
 * A capturing group. Its number is assigned by the lexer in order of the opening parentheses.
 */
public class CaptureGroup extends Structure {

    private int number = -1;

    public CaptureGroup(Delimiter start, List<? extends Element> children, Delimiter finish) {
        super(start, null, children, finish);
    }

    protected CaptureGroup(Delimiter start, GroupType type, List<? extends Element> children, Delimiter finish) {
        super(start, type, children, finish);
    }

    /**
     * @return The capture number, or empty until the lexer has numbered the tree.
     */
    public OptionalInt number() {
        return number < 0 ? OptionalInt.empty() : OptionalInt.of(number);
    }

    /**
     * Takes the given number and numbers the captures nested inside this one after it.
     */
    @Override
    public int recordCaptureNumber(int number) {
        this.number = number;
        return super.recordCaptureNumber(number + 1);
    }
}
