package org.regexptree.tree;

import org.regexptree.config.TreeSettings;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A host interpreter version such as {@code 5.006} or {@code 5.010}.
 * <p>
 * Versions are totally ordered by their decimal value. The dotted form {@code 5.10.0}
 * is accepted as well and maps to {@code 5.010000}.
 */
public final class HostVersion implements Comparable<HostVersion> {

    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern DOTTED = Pattern.compile("v?(\\d+)\\.(\\d{1,3})\\.(\\d{1,3})");
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    private final BigDecimal value;

    private HostVersion(BigDecimal value) {
        this.value = value.stripTrailingZeros();
    }

    /**
     * Parses a version in decimal ({@code 5.010}) or dotted ({@code 5.10.0}, {@code v5.10.0}) form.
     *
     * @param text The version text.
     * @return The parsed version.
     * @throws IllegalArgumentException if the text is not a version.
     */
    public static HostVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version text must not be null");
        }
        String trimmed = text.trim();
        Matcher dotted = DOTTED.matcher(trimmed);
        if (dotted.matches()) {
            BigDecimal major = new BigDecimal(dotted.group(1));
            BigDecimal minor = new BigDecimal(dotted.group(2)).divide(THOUSAND);
            BigDecimal patch = new BigDecimal(dotted.group(3)).divide(MILLION);
            return new HostVersion(major.add(minor).add(patch));
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            return new HostVersion(new BigDecimal(trimmed));
        }
        throw new IllegalArgumentException("Not a host version: '" + text + "'");
    }

    /**
     * Returns the oldest version any construct can require. The value comes from
     * {@link TreeSettings#defaults()} and is fixed for the life of the process.
     *
     * @return The floor version.
     */
    public static HostVersion minimum() {
        return TreeSettings.defaults().minimumHostVersion();
    }

    public static HostVersion max(HostVersion a, HostVersion b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static HostVersion min(HostVersion a, HostVersion b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public boolean isBefore(HostVersion other) {
        return compareTo(other) < 0;
    }

    public BigDecimal toBigDecimal() {
        return value;
    }

    @Override
    public int compareTo(HostVersion other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HostVersion other && value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        // At least three decimals, the way host versions are usually written.
        BigDecimal shown = value.scale() < 3 ? value.setScale(3, RoundingMode.UNNECESSARY) : value;
        return shown.toPlainString();
    }
}
