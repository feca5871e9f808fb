package com.challenges.treenav.search;

import com.challenges.treenav.tree.ChildrenProducer;
import com.challenges.treenav.tree.NilParameterException;
import com.challenges.treenav.tree.Tree;
import com.challenges.treenav.tree.TreeSearchException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class TreeSearchTest {

    private static final Map<String, List<String>> EDGES = Map.of(
            "root", List.of("a", "b", "c"),
            "a", List.of("a1", "a2"),
            "a1", List.of("a11"),
            "b", List.of("ba", "bb"),
            "ba", List.of("baa"));

    private static final ChildrenProducer<String> PRODUCER = name -> {
        if (name == null) {
            throw new NilParameterException("element");
        }
        return EDGES.getOrDefault(name, List.of());
    };

    private final TreeSearch<String> search = new TreeSearch<>(PRODUCER);

    private static boolean isAncestor(String ancestor, String descendant) {
        for (String child : EDGES.getOrDefault(ancestor, List.of())) {
            if (child.equals(descendant) || isAncestor(child, descendant)) {
                return true;
            }
        }
        return false;
    }

    private static SearchCriteria<String> contains(String text) {
        return SearchCriteria.matching(s -> s.contains(text));
    }

    // ============================================================
    // Collect and prune
    // ============================================================

    @Test
    public void testCollectAndPruneKeepsShallowestMatches() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        ImmutableList<String> result = search.collectAndPrune(tree, contains("a"));

        assertEquals(List.of("a", "ba"), result.castToList());
    }

    @Test
    public void testCollectAndPruneNeverReturnsAncestorAndDescendant() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        for (String text : List.of("a", "b", "1", "aa")) {
            ImmutableList<String> result = search.collectAndPrune(tree, contains(text));
            for (String x : result) {
                for (String y : result) {
                    assertFalse(isAncestor(x, y), x + " is an ancestor of " + y + " for '" + text + "'");
                }
            }
        }
    }

    @Test
    public void testCollectAndPruneWildcardReturnsDirectChildren() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        assertEquals(List.of("a", "b", "c"), search.collectAndPrune(tree, SearchCriteria.wildcard()).castToList());
    }

    @Test
    public void testCollectAndPruneMatchingNothing() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        assertTrue(search.collectAndPrune(tree, SearchCriteria.none()).isEmpty());
        assertTrue(search.collectAndPrune(tree, contains("zzz")).isEmpty());
    }

    @Test
    public void testCollectAndPruneDoesNotReportTheRoot() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        assertTrue(search.collectAndPrune(tree, SearchCriteria.matching("root"::equals)).isEmpty());
    }

    @Test
    public void testCollectAndPruneResultsInBreadthFirstOrder() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        // Both sit at depth 3; a1 was enqueued before ba
        ImmutableList<String> result = search.collectAndPrune(tree, SearchCriteria.matching(s -> s.length() == 3));

        assertEquals(List.of("a11", "baa"), result.castToList());
    }

    @Test
    public void testCollectAndPruneRejectsNodeWithoutElement() throws TreeSearchException {
        TreeSearch<String> lenient = new TreeSearch<>(name -> "root".equals(name) ? Arrays.asList("x", null) : List.of());
        Tree<String> tree = lenient.buildTree("root");

        NilParameterException e = assertThrows(NilParameterException.class,
                () -> lenient.collectAndPrune(tree, SearchCriteria.none()));
        assertEquals("node", e.parameter());
    }

    @Test
    public void testNullCriteriaIsAContractViolation() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        assertThrows(NullPointerException.class, () -> search.collectAndPrune(tree, null));
        assertThrows(NullPointerException.class, () -> search.firstMatch(tree, null));
        assertThrows(NullPointerException.class, () -> search.directChildrenMatching(tree, null));
    }

    // ============================================================
    // First match
    // ============================================================

    @Test
    public void testFirstMatchStopsAtFirstHit() throws TreeSearchException {
        Map<String, List<String>> edges = Map.of("root", List.of("x", "y"), "x", List.of("x1"));
        TreeSearch<String> small = new TreeSearch<>(name -> edges.getOrDefault(name, List.of()));
        Tree<String> tree = small.buildTree("root");

        MutableList<String> tested = Lists.mutable.empty();
        Optional<String> match = small.firstMatch(tree, SearchCriteria.matching(s -> {
            tested.add(s);
            return s.equals("x1");
        }));

        assertEquals(Optional.of("x1"), match);
        assertEquals(List.of("x", "x1"), tested);
    }

    @Test
    public void testFirstMatchFollowsDepthFirstOrder() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        assertEquals(Optional.of("a1"), search.firstMatch(tree, SearchCriteria.matching(s -> s.endsWith("1"))));
        // a11 comes before b in pre-order, even though b is shallower
        assertEquals(Optional.of("a11"),
                search.firstMatch(tree, SearchCriteria.matching(s -> s.equals("b") || s.length() == 3)));
    }

    @Test
    public void testFirstMatchWithoutHit() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        assertEquals(Optional.empty(), search.firstMatch(tree, contains("zzz")));
    }

    @Test
    public void testFirstMatchWildcardReturnsFirstChild() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        assertEquals(Optional.of("a"), search.firstMatch(tree, SearchCriteria.wildcard()));
    }

    // ============================================================
    // Direct children
    // ============================================================

    @Test
    public void testDirectChildrenMatching() throws TreeSearchException {
        Tree<String> tree = search.buildTree("root");

        assertEquals(List.of("a", "b", "c"), search.directChildrenMatching(tree, SearchCriteria.wildcard()).castToList());
        assertEquals(List.of("b"), search.directChildrenMatching(tree, contains("b")).castToList());
        // ba matches but is not a direct child
        assertTrue(search.directChildrenMatching(tree, SearchCriteria.matching("ba"::equals)).isEmpty());
    }

    @Test
    public void testDirectChildrenOfLeafRoot() throws TreeSearchException {
        Tree<String> tree = search.buildTree("c");

        assertTrue(search.directChildrenMatching(tree, SearchCriteria.wildcard()).isEmpty());
    }

    @Test
    public void testDirectChildrenSkipsNodeWithoutElement() throws TreeSearchException {
        TreeSearch<String> lenient = new TreeSearch<>(name -> "root".equals(name) ? Arrays.asList("x", null) : List.of());
        Tree<String> tree = lenient.buildTree("root");

        assertEquals(List.of("x"), lenient.directChildrenMatching(tree, SearchCriteria.wildcard()).castToList());
    }
}
