package org.regexptree.tree;

/**
 * Decides, element by element, what a search returns and where it descends.
 */
@FunctionalInterface
public interface ElementVisitor {

    /**
     * Judges one candidate.
     *
     * @param container The node whose elements are being scanned.
     * @param candidate The element under consideration.
     * @return The verdict; {@link Visit#PRUNE} stops the search from entering the candidate.
     * @throws Exception if the visitor cannot judge the candidate. The search that called it fails.
     */
    Visit visit(Node container, Element candidate) throws Exception;
}
