package org.regexptree.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.regexptree.tree.HostVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Immutable settings shared by every tree in the process.
 *
 * @param minimumHostVersion The floor returned by version aggregation for an empty node.
 * @param namespacePrefix The prefix that qualifies short element type names in selectors.
 * @param captureNumberingStart The first number handed out to a capturing construct.
 */
public record TreeSettings(
        HostVersion minimumHostVersion,
        String namespacePrefix,
        int captureNumberingStart
) {

    private static final Logger LOG = LoggerFactory.getLogger(TreeSettings.class);
    private static final String ROOT = "regexptree";

    /**
     * Reads the settings from the {@code regexptree} section of a configuration.
     *
     * @param config The resolved configuration.
     * @return The settings.
     * @throws ConfigException if a key is missing or holds an unusable value.
     */
    public static TreeSettings fromConfig(Config config) {
        Config section = config.getConfig(ROOT);

        String rawVersion = section.getString("minimum-host-version");
        HostVersion minimum;
        try {
            minimum = HostVersion.parse(rawVersion);
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(section.origin(), ROOT + ".minimum-host-version", e.getMessage(), e);
        }

        String prefix = section.getString("selector.namespace-prefix");
        if (prefix.isBlank()) {
            throw new ConfigException.BadValue(section.origin(), ROOT + ".selector.namespace-prefix", "must not be blank");
        }

        int start = section.getInt("capture-numbering.start");
        if (start < 0) {
            throw new ConfigException.BadValue(section.origin(), ROOT + ".capture-numbering.start", "must not be negative, was " + start);
        }

        return new TreeSettings(minimum, prefix, start);
    }

    /**
     * Returns the process-wide settings, loaded on first use and never changed afterwards.
     * An unusable configuration is logged and replaced by the built-in defaults.
     *
     * @return The default settings.
     */
    public static TreeSettings defaults() {
        return Holder.INSTANCE;
    }

    /**
     * Reads the settings from a configuration source, falling back to the built-in
     * defaults of {@code reference.conf} if the source cannot be read or holds a bad value.
     *
     * @param source Supplies the resolved configuration.
     * @return The settings read from the source, or the built-in defaults.
     */
    static TreeSettings loadOrBuiltIn(Supplier<Config> source) {
        try {
            return fromConfig(source.get());
        } catch (ConfigException e) {
            LOG.error("Invalid tree settings, using built-in defaults: {}", e.getMessage());
            return fromConfig(ConfigFactory.parseResources(TreeSettings.class, "/reference.conf").resolve());
        }
    }

    private static final class Holder {
        private static final TreeSettings INSTANCE = loadOrBuiltIn(ConfigLoader::load);
    }
}
