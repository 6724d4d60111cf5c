package org.regexptree.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A parse tree element that contains other elements.
 * <p>
 * A node owns its children exclusively and keeps them in document order. The children
 * are fixed at construction; the lexer passes ({@link #finalizeParse()} and
 * {@link #recordCaptureNumber(int)}) decorate the elements but never change the shape of the tree.
 * <p>
 * Searching is done with {@link #find(Selector)} and {@link #findFirst(Selector)}. Both
 * scan {@link #elements()} in order and descend into nested nodes unless the visitor
 * answers {@link Visit#PRUNE}. They differ in how a failing visitor deeper in the tree is
 * treated: {@code find} drops the results of the failing subtree and carries on, while
 * {@code findFirst} fails as a whole.
 */
public abstract class Node extends Element {

    private static final Logger LOG = LoggerFactory.getLogger(Node.class);

    private final List<Element> children;

    /**
     * Creates a node that owns the given children.
     *
     * @param children The children in document order.
     * @throws IllegalArgumentException if the list or one of its entries is {@code null},
     *                                  or if a child already belongs to another node.
     */
    protected Node(List<? extends Element> children) {
        this(children, List.of());
    }

    /**
     * Creates a node that owns the given children and, outside its children list, the
     * given extra elements. Both are checked together before anything is attached.
     *
     * @param children The children in document order.
     * @param owned Further elements owned by the node, such as delimiters.
     * @throws IllegalArgumentException if a list or one of its entries is {@code null},
     *                                  or if an element already belongs to another node.
     */
    protected Node(List<? extends Element> children, List<? extends Element> owned) {
        checkAdoptable(children, owned);
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        for (Element child : this.children) {
            child.attachTo(this);
        }
        for (Element element : owned) {
            element.attachTo(this);
        }
    }

    private static void checkAdoptable(List<? extends Element> children, List<? extends Element> owned) {
        if (children == null) {
            throw new IllegalArgumentException("Children must not be null");
        }
        Set<Element> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < children.size(); i++) {
            checkAdoptable(children.get(i), "Child at index " + i, seen);
        }
        for (Element element : owned) {
            checkAdoptable(element, "Owned element", seen);
        }
    }

    private static void checkAdoptable(Element element, String where, Set<Element> seen) {
        if (element == null) {
            throw new IllegalArgumentException(where + " is null");
        }
        if (element.hasParent()) {
            throw new IllegalArgumentException(where + " ('" + element.content() + "') already belongs to another node");
        }
        if (!seen.add(element)) {
            throw new IllegalArgumentException(where + " ('" + element.content() + "') appears more than once");
        }
    }

    // region Structural navigation

    public Optional<Element> child() {
        return child(0);
    }

    /**
     * Returns the child at a raw position, ignoring significance.
     *
     * @param index The position.
     * @return The child, or empty if the index is out of range.
     */
    public Optional<Element> child(int index) {
        if (index < 0 || index >= children.size()) {
            return Optional.empty();
        }
        return Optional.of(children.get(index));
    }

    /**
     * Returns the children of this node.
     *
     * @return An unmodifiable list in document order.
     */
    public List<Element> children() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    @Override
    public List<Element> elements() {
        return children;
    }

    public Optional<Element> firstElement() {
        return child(0);
    }

    public Optional<Element> lastElement() {
        return child(children.size() - 1);
    }

    /**
     * Tells whether the candidate lies somewhere below this node. A node does not contain itself.
     *
     * @param candidate The object to test.
     * @return {@code true} if the candidate is an element with this node among its ancestors.
     */
    public boolean contains(Object candidate) {
        if (!(candidate instanceof Element element)) {
            return false;
        }
        Optional<Node> up = element.parent();
        while (up.isPresent()) {
            Node ancestor = up.get();
            if (ancestor == this) {
                return true;
            }
            up = ancestor.parent();
        }
        return false;
    }

    @Override
    public boolean isAncestorOf(Element element) {
        return contains(element);
    }

    @Override
    public String content() {
        StringBuilder sb = new StringBuilder();
        for (Element element : elements()) {
            sb.append(element.content());
        }
        return sb.toString();
    }

    @Override
    public List<Element> tokens() {
        List<Element> tokens = new ArrayList<>();
        for (Element element : elements()) {
            tokens.addAll(element.tokens());
        }
        return tokens;
    }

    // endregion

    // region Significant children

    /**
     * Returns the significant children of this node.
     *
     * @return A new list holding the children whose {@link Element#significant()} is {@code true}.
     */
    public List<Element> schildren() {
        List<Element> result = new ArrayList<>();
        for (Element child : children) {
            if (child.significant()) {
                result.add(child);
            }
        }
        return result;
    }

    public int significantChildCount() {
        int count = 0;
        for (Element child : children) {
            if (child.significant()) {
                count++;
            }
        }
        return count;
    }

    public Optional<Element> schild() {
        return schild(0);
    }

    /**
     * Returns the significant child at the given index. Negative indices count from the
     * end, so {@code schild(-1)} is the last significant child.
     *
     * @param index The index among the significant children.
     * @return The child, or empty if the index is past either end.
     */
    public Optional<Element> schild(int index) {
        if (index >= 0) {
            int remaining = index;
            for (Element child : children) {
                if (!child.significant()) {
                    continue;
                }
                if (remaining-- == 0) {
                    return Optional.of(child);
                }
            }
        } else {
            int remaining = index;
            for (int loc = children.size() - 1; loc >= 0; loc--) {
                Element child = children.get(loc);
                if (!child.significant()) {
                    continue;
                }
                if (remaining++ == -1) {
                    return Optional.of(child);
                }
            }
        }
        return Optional.empty();
    }

    // endregion

    // region Search

    public SearchResult<List<Element>> find(String typeName) {
        return find(Selector.ofTypeName(typeName));
    }

    public SearchResult<List<Element>> find(Class<? extends Element> type) {
        return find(Selector.ofType(type));
    }

    public SearchResult<List<Element>> find(ElementVisitor visitor) {
        return find(Selector.of(visitor));
    }

    /**
     * Collects every element below this node that the selector accepts, in document order.
     * <p>
     * If the visitor throws while judging one of this node's own elements, the whole
     * search fails. If it throws inside a nested node, the results of that nested node are
     * dropped and the scan goes on with the next element.
     *
     * @param selector What to look for.
     * @return The elements found, {@link SearchResult.Status#NOT_FOUND} if there were none,
     *         or {@link SearchResult.Status#FAILED} if the selector or the visitor failed.
     */
    public SearchResult<List<Element>> find(Selector selector) {
        ElementVisitor visitor;
        try {
            visitor = resolve(selector);
        } catch (SelectorException e) {
            return SearchResult.failed(e);
        }
        return findWith(visitor);
    }

    private SearchResult<List<Element>> findWith(ElementVisitor visitor) {
        List<Element> found = new ArrayList<>();
        for (Element element : elements()) {
            Visit verdict;
            try {
                verdict = judge(visitor, element);
            } catch (Exception e) {
                return SearchResult.failed(e);
            }
            if (verdict == Visit.INCLUDE) {
                found.add(element);
            }
            if (element instanceof Node nested && verdict != Visit.PRUNE) {
                SearchResult<List<Element>> inner = nested.findWith(visitor);
                if (inner.isFound()) {
                    found.addAll(inner.get());
                } else if (inner.isFailed() && LOG.isDebugEnabled()) {
                    LOG.debug("Dropping results below '{}' after visitor failure", nested.content());
                }
            }
        }
        return found.isEmpty() ? SearchResult.notFound() : SearchResult.found(found);
    }

    public SearchResult<Element> findFirst(String typeName) {
        return findFirst(Selector.ofTypeName(typeName));
    }

    public SearchResult<Element> findFirst(Class<? extends Element> type) {
        return findFirst(Selector.ofType(type));
    }

    public SearchResult<Element> findFirst(ElementVisitor visitor) {
        return findFirst(Selector.of(visitor));
    }

    /**
     * Returns the first element below this node, in document order, that the selector accepts.
     * A visitor failure anywhere in the searched part of the tree fails the whole search.
     *
     * @param selector What to look for.
     * @return The element found, {@link SearchResult.Status#NOT_FOUND} if there was none,
     *         or {@link SearchResult.Status#FAILED} if the selector or the visitor failed.
     */
    public SearchResult<Element> findFirst(Selector selector) {
        ElementVisitor visitor;
        try {
            visitor = resolve(selector);
        } catch (SelectorException e) {
            return SearchResult.failed(e);
        }
        return findFirstWith(visitor);
    }

    private SearchResult<Element> findFirstWith(ElementVisitor visitor) {
        for (Element element : elements()) {
            Visit verdict;
            try {
                verdict = judge(visitor, element);
            } catch (Exception e) {
                return SearchResult.failed(e);
            }
            if (verdict == Visit.INCLUDE) {
                return SearchResult.found(element);
            }
            if (element instanceof Node nested && verdict != Visit.PRUNE) {
                SearchResult<Element> inner = nested.findFirstWith(visitor);
                if (!inner.isNotFound()) {
                    return inner;
                }
            }
        }
        return SearchResult.notFound();
    }

    private static ElementVisitor resolve(Selector selector) {
        if (selector == null) {
            throw new SelectorException("No selector given");
        }
        return selector.resolve();
    }

    private Visit judge(ElementVisitor visitor, Element element) throws Exception {
        Visit verdict;
        try {
            verdict = visitor.visit(this, element);
        } catch (Exception e) {
            LOG.warn("Visitor failed on '{}' in '{}': {}", element.content(), content(), e.toString());
            throw e;
        }
        return verdict == null ? Visit.PRUNE : verdict;
    }

    // endregion

    // region Version aggregation

    /**
     * Returns the newest {@link Element#versionIntroduced()} among the elements of this node,
     * and never less than {@link HostVersion#minimum()}.
     *
     * @return The earliest host version in which this node is valid.
     */
    @Override
    public HostVersion versionIntroduced() {
        HostVersion result = HostVersion.minimum();
        for (Element element : elements()) {
            result = HostVersion.max(result, element.versionIntroduced());
        }
        return result;
    }

    /**
     * Returns the oldest {@link Element#versionRemoved()} defined among the elements of this node.
     *
     * @return The version in which this node stops being valid, or empty if no element was removed.
     */
    @Override
    public Optional<HostVersion> versionRemoved() {
        HostVersion result = null;
        for (Element element : elements()) {
            Optional<HostVersion> removed = element.versionRemoved();
            if (removed.isPresent() && (result == null || removed.get().isBefore(result))) {
                result = removed.get();
            }
        }
        return Optional.ofNullable(result);
    }

    // endregion

    // region Lexer passes

    @Override
    public int finalizeParse() {
        int failures = 0;
        for (Element element : elements()) {
            failures += element.finalizeParse();
        }
        return failures;
    }

    @Override
    public int recordCaptureNumber(int number) {
        int next = number;
        for (Element child : children) {
            next = child.recordCaptureNumber(next);
        }
        return next;
    }

    /**
     * Returns the step that retrieves a direct child from this node.
     *
     * @param child The child.
     * @return The step, or empty if the child's parent is not this node.
     */
    public Optional<NavStep> navigationTo(Element child) {
        if (child == null || child.parent().orElse(null) != this) {
            return Optional.empty();
        }
        return child.indexInParent();
    }

    /**
     * Follows a path produced by {@link Element#navigation()}.
     *
     * @param steps The path, starting at this node.
     * @return The element at the end of the path, or empty if the path leads nowhere.
     */
    public Optional<Element> navigate(List<NavStep> steps) {
        Element current = this;
        for (NavStep step : steps) {
            if (!(current instanceof Node node)) {
                return Optional.empty();
            }
            Optional<Element> next = node.stepInto(step);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * Locates an element owned by this node.
     *
     * @param element An element whose parent is this node.
     * @return The step that retrieves it, or empty if this node does not hold it.
     */
    protected Optional<NavStep> locate(Element element) {
        int index = indexByIdentity(children, element);
        return index < 0 ? Optional.empty() : Optional.of(NavStep.child(index));
    }

    /**
     * Retrieves the element a step points at.
     *
     * @param step The step.
     * @return The element, or empty if this node has nothing there.
     */
    protected Optional<Element> stepInto(NavStep step) {
        return step.accessor() == NavStep.Accessor.CHILD ? child(step.index()) : Optional.empty();
    }

    // endregion
}
