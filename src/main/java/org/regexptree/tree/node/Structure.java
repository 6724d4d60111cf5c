package org.regexptree.tree.node;

import org.regexptree.tree.Element;
import org.regexptree.tree.NavStep;
import org.regexptree.tree.Node;
import org.regexptree.tree.token.Delimiter;
import org.regexptree.tree.token.GroupType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A bracketed construct. Besides its children a structure owns an opening delimiter,
 * an optional type marker and a closing delimiter; these are part of {@link #elements()}
 * but not of {@link #children()}.
 * <p>
 * A structure whose closing delimiter is missing was left unterminated by the source and
 * counts as one parse failure when finalized.
 */
public abstract class Structure extends Node {

    private final Delimiter start;
    private final GroupType type;
    private final Delimiter finish;
    private final List<Element> elements;

    /**
     * @param start The opening delimiter.
     * @param type The type marker, or {@code null} if the structure has none.
     * @param children The contents between the delimiters.
     * @param finish The closing delimiter, or {@code null} if the source ended first.
     * @throws IllegalArgumentException if {@code start} is {@code null} or an element cannot be adopted.
     */
    protected Structure(Delimiter start, GroupType type, List<? extends Element> children, Delimiter finish) {
        super(children, delimiting(start, type, finish));
        this.start = start;
        this.type = type;
        this.finish = finish;

        List<Element> all = new ArrayList<>();
        all.add(start);
        if (type != null) {
            all.add(type);
        }
        all.addAll(children());
        if (finish != null) {
            all.add(finish);
        }
        this.elements = Collections.unmodifiableList(all);
    }

    private static List<Element> delimiting(Delimiter start, GroupType type, Delimiter finish) {
        if (start == null) {
            throw new IllegalArgumentException("A structure needs an opening delimiter");
        }
        List<Element> owned = new ArrayList<>(3);
        owned.add(start);
        if (type != null) {
            owned.add(type);
        }
        if (finish != null) {
            owned.add(finish);
        }
        return owned;
    }

    public Delimiter start() {
        return start;
    }

    public Optional<GroupType> type() {
        return Optional.ofNullable(type);
    }

    public Optional<Delimiter> finish() {
        return Optional.ofNullable(finish);
    }

    @Override
    public List<Element> elements() {
        return elements;
    }

    @Override
    public Optional<Element> firstElement() {
        return Optional.of(start);
    }

    @Override
    public Optional<Element> lastElement() {
        return Optional.of(elements.get(elements.size() - 1));
    }

    @Override
    public int finalizeParse() {
        return super.finalizeParse() + (finish == null ? 1 : 0);
    }

    @Override
    protected Optional<NavStep> locate(Element element) {
        if (element == start) {
            return Optional.of(new NavStep(NavStep.Accessor.START, 0));
        }
        if (element == type) {
            return Optional.of(new NavStep(NavStep.Accessor.TYPE, 0));
        }
        if (element == finish) {
            return Optional.of(new NavStep(NavStep.Accessor.FINISH, 0));
        }
        return super.locate(element);
    }

    @Override
    protected Optional<Element> stepInto(NavStep step) {
        return switch (step.accessor()) {
            case START -> Optional.of(start);
            case TYPE -> Optional.ofNullable(type);
            case FINISH -> Optional.ofNullable(finish);
            case CHILD -> super.stepInto(step);
        };
    }
}
