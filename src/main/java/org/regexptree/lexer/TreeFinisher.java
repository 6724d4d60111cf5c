package org.regexptree.lexer;

import org.regexptree.config.TreeSettings;
import org.regexptree.diagnostics.DiagnosticsEngine;
import org.regexptree.tree.Element;
import org.regexptree.tree.Node;
import org.regexptree.tree.SearchResult;
import org.regexptree.tree.node.Structure;
import org.regexptree.tree.token.Unknown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the passes the lexer applies once a tree has been fully built: the finalize pass,
 * which counts parse failures, and capture numbering. Every parse failure is reported to
 * the {@link DiagnosticsEngine} with its character offset.
 */
public class TreeFinisher {

    private static final Logger LOG = LoggerFactory.getLogger(TreeFinisher.class);

    private final TreeSettings settings;
    private final DiagnosticsEngine diagnostics;

    public TreeFinisher(DiagnosticsEngine diagnostics) {
        this(TreeSettings.defaults(), diagnostics);
    }

    public TreeFinisher(TreeSettings settings, DiagnosticsEngine diagnostics) {
        this.settings = settings;
        this.diagnostics = diagnostics;
    }

    /**
     * Finishes a tree. Must be called exactly once per tree, on its root.
     *
     * @param root The root of the tree.
     * @return The number of parse failures and of numbered captures.
     */
    public FinishReport finish(Node root) {
        int failures = root.finalizeParse();
        if (failures > 0) {
            LOG.warn("Found {} parse failure(s) in '{}'", failures, root.content());
            reportFailures(root);
        }

        int start = settings.captureNumberingStart();
        int next = root.recordCaptureNumber(start);
        FinishReport report = new FinishReport(failures, next - start);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Finished '{}': {} failure(s), {} capture(s)", root.content(), report.failures(), report.captureCount());
        }
        return report;
    }

    private void reportFailures(Node root) {
        Map<Element, Integer> offsets = tokenOffsets(root);

        SearchResult<List<Element>> unknowns = root.find(Unknown.class);
        for (Element element : unknowns.orElse(List.of())) {
            Unknown unknown = (Unknown) element;
            diagnostics.reportError("Unrecognized '" + unknown.content() + "': " + unknown.error(),
                    offsets.getOrDefault(unknown, 0));
        }

        List<Element> structures = new ArrayList<>();
        if (root instanceof Structure) {
            structures.add(root);
        }
        structures.addAll(root.find(Structure.class).orElse(List.of()));
        for (Element element : structures) {
            Structure structure = (Structure) element;
            if (structure.finish().isEmpty()) {
                diagnostics.reportError("Unterminated '" + structure.start().content() + "'",
                        offsets.getOrDefault(structure.start(), 0));
            }
        }
    }

    private static Map<Element, Integer> tokenOffsets(Node root) {
        Map<Element, Integer> offsets = new IdentityHashMap<>();
        int offset = 0;
        for (Element token : root.tokens()) {
            offsets.put(token, offset);
            offset += token.content().length();
        }
        return offsets;
    }
}
