package org.regexptree.tree;

/**
 * What a search looks for. A selector is resolved into an {@link ElementVisitor} once per
 * search; resolution failures surface as a failed {@link SearchResult}, not as an exception.
 */
@FunctionalInterface
public interface Selector {

    /**
     * Produces the visitor for this selector.
     *
     * @return The visitor.
     * @throws SelectorException if the selector is unusable.
     */
    ElementVisitor resolve();

    /**
     * Wraps a visitor.
     *
     * @param visitor The visitor; {@code null} yields a selector that fails to resolve.
     * @return The selector.
     */
    static Selector of(ElementVisitor visitor) {
        return () -> {
            if (visitor == null) {
                throw new SelectorException("No visitor given");
            }
            return visitor;
        };
    }

    /**
     * Selects every element that is an instance of the given type, subclasses included.
     *
     * @param type The element type.
     * @return The selector.
     */
    static Selector ofType(Class<? extends Element> type) {
        return () -> {
            if (type == null) {
                throw new SelectorException("No element type given");
            }
            return (container, candidate) -> type.isInstance(candidate) ? Visit.INCLUDE : Visit.EXCLUDE;
        };
    }

    /**
     * Selects by element type name, e.g. {@code Token::Literal} or {@code Regexp::Token::Literal}.
     * The name is looked up in {@link ElementTypes#standard()} when the search starts.
     * A name no element type answers to matches nothing.
     *
     * @param typeName The type name, with or without the namespace prefix.
     * @return The selector.
     */
    static Selector ofTypeName(String typeName) {
        return () -> {
            if (typeName == null) {
                throw new SelectorException("No element type name given");
            }
            return ElementTypes.standard().lookup(typeName)
                    .map(type -> ofType(type).resolve())
                    .orElse((container, candidate) -> Visit.EXCLUDE);
        };
    }
}
