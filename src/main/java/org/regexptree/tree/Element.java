package org.regexptree.tree;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The base class of everything that can be placed in a regular expression parse tree,
 * leaf tokens and container nodes alike.
 * <p>
 * An element knows its parent through a weak reference that is set by the owning
 * {@link Node} when the node is constructed. Elements compare by identity.
 */
public abstract class Element {

    private WeakReference<Node> parent;

    /**
     * Returns the text of this element as it appeared in the source.
     *
     * @return The content, never {@code null}.
     */
    public abstract String content();

    /**
     * Returns every element held by this one, in document order.
     *
     * @return The elements, or an empty list for a leaf.
     */
    public abstract List<Element> elements();

    /**
     * Returns the leaf tokens below this element in document order.
     *
     * @return The tokens; a token returns a list holding only itself.
     */
    public abstract List<Element> tokens();

    /**
     * Returns whether this element carries meaning, as opposed to layout or comments.
     *
     * @return {@code true} unless the variant is insignificant.
     */
    public boolean significant() {
        return true;
    }

    /**
     * Returns the earliest host interpreter version in which this element is valid.
     *
     * @return The version, {@link HostVersion#minimum()} unless the variant needs a newer one.
     */
    public HostVersion versionIntroduced() {
        return HostVersion.minimum();
    }

    /**
     * Returns the host interpreter version in which this element stopped being valid.
     *
     * @return The version, or empty if the element was never removed as far as is known.
     */
    public Optional<HostVersion> versionRemoved() {
        return Optional.empty();
    }

    /**
     * Called once by the lexer after the whole tree has been built.
     *
     * @return The number of parse failures discovered in this element.
     */
    public int finalizeParse() {
        return 0;
    }

    /**
     * Called by the lexer to number capturing constructs in document order.
     *
     * @param number The number the next capturing construct receives.
     * @return The number the construct after this element receives.
     */
    public int recordCaptureNumber(int number) {
        return number;
    }

    public Optional<Node> parent() {
        return parent == null ? Optional.empty() : Optional.ofNullable(parent.get());
    }

    /**
     * Returns the root of the tree this element belongs to.
     *
     * @return The outermost ancestor, or this element if it has no parent.
     */
    public Element top() {
        Element current = this;
        Optional<Node> up = current.parent();
        while (up.isPresent()) {
            current = up.get();
            up = current.parent();
        }
        return current;
    }

    public boolean isDescendantOf(Node node) {
        return node != null && node.contains(this);
    }

    public boolean isAncestorOf(Element element) {
        return false;
    }

    /**
     * Returns the step that retrieves this element from its parent.
     *
     * @return The step, or empty if the element is detached.
     */
    public Optional<NavStep> indexInParent() {
        return parent().flatMap(p -> p.locate(this));
    }

    /**
     * Returns the path from {@link #top()} down to this element.
     * Following it with {@link Node#navigate(List)} on the top yields this element again.
     *
     * @return The steps, empty for a root.
     */
    public List<NavStep> navigation() {
        List<NavStep> steps = new ArrayList<>();
        Element current = this;
        Optional<Node> up = current.parent();
        while (up.isPresent()) {
            Node owner = up.get();
            Optional<NavStep> step = owner.locate(current);
            if (step.isEmpty()) {
                break;
            }
            steps.add(step.get());
            current = owner;
            up = owner.parent();
        }
        Collections.reverse(steps);
        return steps;
    }

    public Optional<Element> nextSibling() {
        return sibling(1, false);
    }

    public Optional<Element> previousSibling() {
        return sibling(-1, false);
    }

    public Optional<Element> nextSignificantSibling() {
        return sibling(1, true);
    }

    public Optional<Element> previousSignificantSibling() {
        return sibling(-1, true);
    }

    private Optional<Element> sibling(int direction, boolean significantOnly) {
        Optional<Node> owner = parent();
        if (owner.isEmpty()) {
            return Optional.empty();
        }
        List<Element> siblings = owner.get().children();
        int self = indexByIdentity(siblings, this);
        if (self < 0) {
            // Delimiters and type markers of a structure are not among its children.
            return Optional.empty();
        }
        for (int i = self + direction; i >= 0 && i < siblings.size(); i += direction) {
            Element candidate = siblings.get(i);
            if (!significantOnly || candidate.significant()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    static int indexByIdentity(List<Element> list, Element element) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == element) {
                return i;
            }
        }
        return -1;
    }

    final boolean hasParent() {
        return parent().isPresent();
    }

    final void attachTo(Node owner) {
        this.parent = new WeakReference<>(owner);
    }

    @Override
    public String toString() {
        return content();
    }
}
