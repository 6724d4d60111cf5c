package org.regexptree.tree;

import org.regexptree.config.TreeSettings;
import org.regexptree.tree.node.CaptureGroup;
import org.regexptree.tree.node.Group;
import org.regexptree.tree.node.NamedCaptureGroup;
import org.regexptree.tree.node.Sequence;
import org.regexptree.tree.node.Structure;
import org.regexptree.tree.token.Comment;
import org.regexptree.tree.token.Delimiter;
import org.regexptree.tree.token.GroupType;
import org.regexptree.tree.token.Literal;
import org.regexptree.tree.token.Operator;
import org.regexptree.tree.token.Quantifier;
import org.regexptree.tree.token.Token;
import org.regexptree.tree.token.Unknown;
import org.regexptree.tree.token.Whitespace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The namespace of element type names that selectors may use, e.g. {@code Regexp::Token::Literal}.
 * <p>
 * Names are looked up with or without the namespace prefix; a name that does not start
 * with the prefix is qualified with it first.
 */
public final class ElementTypes {

    private static final Map<String, Class<? extends Element>> STANDARD_TYPES = standardTypes();

    private final String prefix;
    private final Map<String, Class<? extends Element>> types;

    /**
     * @param prefix The namespace prefix, e.g. {@code Regexp::}.
     * @param types The known types by unqualified name.
     */
    public ElementTypes(String prefix, Map<String, Class<? extends Element>> types) {
        this.prefix = prefix;
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    /**
     * Returns the namespace of the built-in element types under the configured prefix.
     *
     * @return The standard namespace.
     */
    public static ElementTypes standard() {
        return Holder.INSTANCE;
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Qualifies a type name with the namespace prefix unless it already carries it.
     *
     * @param name The name.
     * @return The qualified name.
     */
    public String qualify(String name) {
        return name.startsWith(prefix) ? name : prefix + name;
    }

    /**
     * Looks up a type by name.
     *
     * @param name The name, with or without the prefix.
     * @return The type, or empty if the namespace has no such name.
     */
    public Optional<Class<? extends Element>> lookup(String name) {
        String unqualified = qualify(name).substring(prefix.length());
        return Optional.ofNullable(types.get(unqualified));
    }

    /**
     * Returns the qualified name of the most specific type the element belongs to.
     *
     * @param element The element.
     * @return The name, or empty if none of the types in the namespace match.
     */
    public Optional<String> nameOf(Element element) {
        Class<?> type = element.getClass();
        while (type != null && Element.class.isAssignableFrom(type)) {
            for (Map.Entry<String, Class<? extends Element>> entry : types.entrySet()) {
                if (entry.getValue() == type) {
                    return Optional.of(prefix + entry.getKey());
                }
            }
            type = type.getSuperclass();
        }
        return Optional.empty();
    }

    private static Map<String, Class<? extends Element>> standardTypes() {
        Map<String, Class<? extends Element>> types = new LinkedHashMap<>();
        types.put("Element", Element.class);
        types.put("Node", Node.class);
        types.put("Sequence", Sequence.class);
        types.put("Structure", Structure.class);
        types.put("Structure::Group", Group.class);
        types.put("Structure::Capture", CaptureGroup.class);
        types.put("Structure::NamedCapture", NamedCaptureGroup.class);
        types.put("Token", Token.class);
        types.put("Token::Literal", Literal.class);
        types.put("Token::Operator", Operator.class);
        types.put("Token::Quantifier", Quantifier.class);
        types.put("Token::Whitespace", Whitespace.class);
        types.put("Token::Comment", Comment.class);
        types.put("Token::Delimiter", Delimiter.class);
        types.put("Token::GroupType", GroupType.class);
        types.put("Token::Unknown", Unknown.class);
        return types;
    }

    private static final class Holder {
        private static final ElementTypes INSTANCE =
                new ElementTypes(TreeSettings.defaults().namespacePrefix(), STANDARD_TYPES);
    }
}
