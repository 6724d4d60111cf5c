package org.regexptree.tree.token;

import org.regexptree.tree.HostVersion;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The marker after an opening parenthesis that says what kind of group follows,
 * e.g. {@code ?:}, {@code ?<name>} or {@code ?|}.
 */
public class GroupType extends Token {

    private static final Pattern NAMED = Pattern.compile("\\?(?:P?<([A-Za-z_]\\w*)>|'([A-Za-z_]\\w*)')");
    private static final HostVersion NAMED_CAPTURES = HostVersion.parse("5.010");
    private static final HostVersion BRANCH_RESET = HostVersion.parse("5.010");
    private static final HostVersion CARET_MODIFIERS = HostVersion.parse("5.014");

    private final String name;

    public GroupType(String content) {
        super(content);
        Matcher m = NAMED.matcher(content);
        this.name = m.matches() ? (m.group(1) != null ? m.group(1) : m.group(2)) : null;
    }

    /**
     * @return The capture name for {@code ?<name>}, {@code ?'name'} and {@code ?P<name>}; empty otherwise.
     */
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public boolean isNamedCapture() {
        return name != null;
    }

    @Override
    public HostVersion versionIntroduced() {
        String content = content();
        if (name != null) {
            return NAMED_CAPTURES;
        }
        if (content.equals("?|")) {
            return BRANCH_RESET;
        }
        if (content.startsWith("?^")) {
            return CARET_MODIFIERS;
        }
        return super.versionIntroduced();
    }
}
