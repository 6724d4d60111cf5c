package org.regexptree.tree;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.regexptree.junit.logging.ExpectLog;
import org.regexptree.junit.logging.LogLevel;
import org.regexptree.junit.logging.LogWatchExtension;
import org.regexptree.tree.node.CaptureGroup;
import org.regexptree.tree.node.Group;
import org.regexptree.tree.node.Sequence;
import org.regexptree.tree.token.Delimiter;
import org.regexptree.tree.token.GroupType;
import org.regexptree.tree.token.Literal;
import org.regexptree.tree.token.Quantifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link Node#find(Selector)} and {@link Node#findFirst(Selector)}.
 * <p>
 * The tree under test is {@code ab(d)c}: three literals at the top and a fourth inside a capture.
 */
@Tag("unit")
@ExtendWith({LogWatchExtension.class, MockitoExtension.class})
class NodeSearchTest {

    private Literal a;
    private Literal b;
    private Literal c;
    private Literal d;
    private CaptureGroup group;
    private Sequence root;

    @BeforeEach
    void setUp() {
        a = new Literal("a");
        b = new Literal("b");
        c = new Literal("c");
        d = new Literal("d");
        group = new CaptureGroup(new Delimiter("("), List.of(d), new Delimiter(")"));
        root = new Sequence(a, b, group, c);
    }

    @Test
    void testFind_ByShortTypeName_FindsNestedElementsInDocumentOrder() {
        SearchResult<List<Element>> result = root.find("Token::Literal");

        assertThat(result.status()).isEqualTo(SearchResult.Status.FOUND);
        assertThat(result.get()).containsExactly(a, b, d, c);
    }

    @Test
    void testFind_ByQualifiedTypeName() {
        assertThat(root.find("Regexp::Token::Literal").get()).containsExactly(a, b, d, c);
    }

    @Test
    void testFind_ByTypeName_MatchesSubclasses() {
        SearchResult<List<Element>> tokens = root.find("Token");

        assertThat(tokens.get()).hasSize(6).contains(group.start(), group.finish().orElseThrow());
        assertThat(root.find("Structure").get()).containsExactly(group);
    }

    @Test
    void testFind_ByClass() {
        assertThat(root.find(CaptureGroup.class).get()).containsExactly(group);
        assertThat(root.find(Node.class).get()).containsExactly(group);
    }

    @Test
    void testFind_NothingMatches_IsNotFoundRatherThanFailed() {
        SearchResult<List<Element>> result = root.find(Quantifier.class);

        assertThat(result.isNotFound()).isTrue();
        assertThat(result.isFailed()).isFalse();
        assertThat(result.value()).isEmpty();
        assertThat(result.orElse(List.of())).isEmpty();
    }

    @Test
    void testFind_UnknownTypeName_FindsNothing() {
        SearchResult<List<Element>> result = root.find("Token::NoSuchThing");

        assertThat(result.isNotFound()).isTrue();
        assertThat(result.failure()).isEmpty();
        assertThat(root.findFirst("Token::NoSuchThing").isNotFound()).isTrue();
        assertThat(root.find("NoSuchThing").isNotFound()).isTrue();
        assertThat(root.findFirst("Regexp::NoSuchThing").isNotFound()).isTrue();
    }

    @Test
    void testFind_NullSelectors_Fail() {
        assertThat(root.find((String) null).failure()).containsInstanceOf(SelectorException.class);
        assertThat(root.find((Selector) null).isFailed()).isTrue();
        assertThat(root.find((ElementVisitor) null).isFailed()).isTrue();
        assertThat(root.find((String) null).isFailed()).isTrue();
        assertThat(root.findFirst((Class<? extends Element>) null).isFailed()).isTrue();
    }

    @Test
    void testFind_PruneStopsDescentButNotTheSiblingScan() {
        ElementVisitor literalsOutsideGroups = (container, candidate) -> {
            if (candidate instanceof CaptureGroup) {
                return Visit.PRUNE;
            }
            return candidate instanceof Literal ? Visit.INCLUDE : Visit.EXCLUDE;
        };

        assertThat(root.find(literalsOutsideGroups).get()).containsExactly(a, b, c);
    }

    @Test
    void testFind_ExcludeStillDescends() {
        ElementVisitor literalsOnly = (container, candidate) ->
                candidate instanceof Literal ? Visit.INCLUDE : Visit.EXCLUDE;

        assertThat(root.find(literalsOnly).get()).containsExactly(a, b, d, c);
    }

    @Test
    void testFind_IncludedNodeIsSearchedToo() {
        ElementVisitor everything = (container, candidate) -> Visit.INCLUDE;

        assertThat(root.find(everything).get())
                .containsExactly(a, b, group, group.start(), d, group.finish().orElseThrow(), c);
    }

    @Test
    void testFind_NullVerdictPrunes() {
        List<Element> visited = new ArrayList<>();
        ElementVisitor literalsButNothingInsideGroups = (container, candidate) -> {
            visited.add(candidate);
            if (candidate instanceof CaptureGroup) {
                return null;
            }
            return candidate instanceof Literal ? Visit.INCLUDE : Visit.EXCLUDE;
        };

        assertThat(root.find(literalsButNothingInsideGroups).get()).containsExactly(a, b, c);
        assertThat(visited).containsExactly(a, b, group, c);
    }

    @Test
    void testFindFirst_NullVerdictPrunes() {
        ElementVisitor onlyD = (container, candidate) -> candidate == d ? Visit.INCLUDE : null;

        assertThat(root.findFirst(onlyD).isNotFound()).isTrue();
        assertThat(group.findFirst(onlyD).get()).isSameAs(d);
    }

    @Test
    void testFind_VisitorSeesTheDirectContainer() {
        List<Node> containersOfD = new ArrayList<>();
        root.find((container, candidate) -> {
            if (candidate == d) {
                containersOfD.add(container);
            }
            return Visit.EXCLUDE;
        });

        assertThat(containersOfD).containsExactly(group);
    }

    @Test
    void testFind_PrunedNodeIsNeverEntered() throws Exception {
        ElementVisitor visitor = mock(ElementVisitor.class);
        when(visitor.visit(any(), any())).thenReturn(Visit.EXCLUDE);
        when(visitor.visit(any(), same(group))).thenReturn(Visit.PRUNE);

        root.find(visitor);

        verify(visitor).visit(root, group);
        verify(visitor, never()).visit(same(group), any());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = "org\\.regexptree\\.tree\\.Node", messagePattern = "Visitor failed on 'b'.*")
    void testFind_FaultAtThisLevel_FailsTheWholeSearch() {
        ElementVisitor faultsOnB = (container, candidate) -> {
            if (candidate == b) {
                throw new IllegalStateException("boom");
            }
            return Visit.INCLUDE;
        };

        SearchResult<List<Element>> result = root.find(faultsOnB);

        assertThat(result.isFailed()).isTrue();
        assertThat(result.value()).isEmpty();
        assertThat(result.failure().orElseThrow()).hasMessage("boom");
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Visitor failed on 'd'.*")
    void testFind_FaultInsideNestedNode_DropsOnlyThatSubtree() {
        ElementVisitor faultsOnD = (container, candidate) -> {
            if (candidate == d) {
                throw new IllegalStateException("boom");
            }
            return candidate instanceof Literal ? Visit.INCLUDE : Visit.EXCLUDE;
        };

        SearchResult<List<Element>> result = root.find(faultsOnD);

        assertThat(result.isFound()).isTrue();
        assertThat(result.get()).containsExactly(a, b, c);
    }

    @Test
    void testFindFirst_ReturnsFirstMatchInDocumentOrder() {
        assertThat(root.findFirst("Token::Literal").get()).isSameAs(a);
        assertThat(root.findFirst(CaptureGroup.class).get()).isSameAs(group);
        assertThat(root.findFirst((container, candidate) -> candidate == d ? Visit.INCLUDE : Visit.EXCLUDE).get())
                .isSameAs(d);
    }

    @Test
    void testFindFirst_NothingMatches_IsNotFound() {
        SearchResult<Element> result = root.findFirst(Quantifier.class);

        assertThat(result.isNotFound()).isTrue();
        assertThat(result.failure()).isEmpty();
    }

    @Test
    void testFindFirst_PruneHidesNestedMatch() {
        ElementVisitor dOutsideGroups = (container, candidate) -> {
            if (candidate == group) {
                return Visit.PRUNE;
            }
            return candidate == d ? Visit.INCLUDE : Visit.EXCLUDE;
        };

        assertThat(root.findFirst(dOutsideGroups).isNotFound()).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Visitor failed on 'd'.*")
    void testFindFirst_FaultInsideNestedNode_FailsTheWholeSearch() {
        ElementVisitor faultsOnD = (container, candidate) -> {
            if (candidate == d) {
                throw new IllegalStateException("boom");
            }
            return candidate == c ? Visit.INCLUDE : Visit.EXCLUDE;
        };

        assertThat(root.findFirst(faultsOnD).isFailed()).isTrue();
        // find() on the same tree and visitor drops the failing subtree instead.
        assertThat(root.find(faultsOnD).get()).containsExactly(c);
    }

    @Test
    void testFindFirst_MatchBeforeFaultingSubtreeWins() {
        ElementVisitor faultsOnD = (container, candidate) -> {
            if (candidate == d) {
                throw new IllegalStateException("boom");
            }
            return candidate == b ? Visit.INCLUDE : Visit.EXCLUDE;
        };

        assertThat(root.findFirst(faultsOnD).get()).isSameAs(b);
    }

    @Test
    void testFind_SearchesTypeMarkersOfStructures() {
        GroupType type = new GroupType("?:");
        Group nonCapturing = new Group(new Delimiter("("), type, List.of(new Literal("x")), new Delimiter(")"));
        Sequence tree = new Sequence(nonCapturing);

        assertThat(tree.find("Token::GroupType").get()).containsExactly(type);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Visitor failed on 'x' in 'x'.*")
    void testFind_DebugOff_BuildsNestedTextOnlyForTheWarning() {
        Logger logger = (Logger) LoggerFactory.getLogger(Node.class);
        Level previous = logger.getLevel();
        logger.setLevel(Level.INFO);
        try {
            Literal x = new Literal("x");
            TextCountingSequence nested = new TextCountingSequence(x);
            Sequence top = new Sequence(new Literal("w"), nested);

            SearchResult<List<Element>> result = top.find((container, candidate) -> {
                if (candidate == x) {
                    throw new IllegalStateException("boom");
                }
                return Visit.INCLUDE;
            });

            assertThat(result.get()).hasSize(2);
            assertThat(nested.contentCalls).isEqualTo(1);
        } finally {
            logger.setLevel(previous);
        }
    }

    private static final class TextCountingSequence extends Sequence {
        private int contentCalls;

        TextCountingSequence(Element... children) {
            super(children);
        }

        @Override
        public String content() {
            contentCalls++;
            return super.content();
        }
    }
}
