package org.regexptree.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the parse failures reported while a tree is finished, so that the passes do not
 * have to decide how problems are presented.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a parse failure.
     *
     * @param message What is wrong.
     * @param offset  The character offset of the problem.
     */
    public void reportError(String message, int offset) {
        diagnostics.add(new Diagnostic(message, offset));
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return The diagnostics in the order they were reported.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return One diagnostic per line.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
