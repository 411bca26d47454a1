package dumb.theorem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;

import static org.junit.jupiter.api.Assertions.*;

class SearchTest {

    private static final Rules MIU = Rules.miu();

    /** Shortest derivation depth of every string reachable within {@code maxLevel}, found without deduplicating across paths. */
    private static Map<String, Integer> exhaustiveDepths(String axiom, Rules rules, int maxLevel) {
        var depths = new HashMap<String, Integer>();
        Set<String> exactly = Set.of(axiom);
        for (var d = 0; d <= maxLevel; d++) {
            for (var s : exactly) depths.putIfAbsent(s, d);
            var next = new HashSet<String>();
            for (var s : exactly) next.addAll(rules.successors(s));
            exactly = next;
        }
        return depths;
    }

    @Test
    void miuToLevelTwo() {
        var tree = Search.miu(2);
        assertEquals(List.of("MI"), tree.level(0));
        assertEquals(List.of("MIU", "MII"), tree.level(1));
        assertEquals(List.of("MIUIU", "MIIU", "MIIII"), tree.level(2));
        assertEquals(Set.of("MIUIU", "MIIU", "MIIII"), Set.copyOf(tree.level(2)));
        assertEquals(6, tree.size());
        assertEquals(2, tree.depth());
    }

    @Test
    void miuToLevelThree() {
        var tree = Search.miu(3);
        assertEquals(List.of("MIUIUIUIU", "MIIUIIU", "MIIIIU", "MIIIIIIII", "MUI"), tree.level(3));
        assertEquals(11, tree.size());

        var mui = tree.find("MUI").orElseThrow();
        assertEquals("MIIII", mui.parent().orElseThrow().value());
        assertEquals("rule_2", mui.rule());
        assertEquals(List.of("MI", "MII", "MIIII", "MUI"), mui.path());
    }

    @Test
    void childrenInRuleOrder() {
        var tree = Search.miu(3);
        var miiii = tree.find("MIIII").orElseThrow();
        assertEquals(List.of("MIIIIU", "MIIIIIIII", "MUI"), miiii.children().stream().map(TheoremNode::value).toList());
        assertEquals(List.of("rule_0", "rule_1", "rule_2"), miiii.children().stream().map(TheoremNode::rule).toList());
    }

    @Test
    void levelZeroIsJustTheAxiom() {
        var tree = Search.miu(0);
        assertEquals(1, tree.size());
        assertTrue(tree.root().isLeaf());
        assertTrue(tree.root().isRoot());
        assertNull(tree.root().rule());
        assertFalse(tree.stats().fixedPoint());
        assertEquals(Map.of(0, List.of("MI")), tree.byLevel());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5, 50})
    void noRulesGiveSingleNode(int maxLevel) {
        var tree = Search.search("MI", List.of(), maxLevel);
        assertEquals(1, tree.size());
        assertEquals("MI", tree.root().value());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3, 100})
    void deadEndAxiomIsAFixedPoint(int maxLevel) {
        var tree = Search.search("U", MIU, maxLevel);
        assertEquals(1, tree.size());
        assertTrue(tree.stats().fixedPoint());
        assertEquals(0, tree.stats().candidates());
    }

    @Test
    void stopsAtFixedPointBeforeMaxLevel() {
        var shrink = List.of(Rule.of("drop_a", s -> s.contains("a"), s -> s.substring(1)));
        var tree = Search.search("aaa", shrink, 10);
        assertEquals(List.of("aaa", "aa", "a", ""), tree.nodes().stream().map(TheoremNode::value).toList());
        assertEquals(3, tree.depth());
        assertTrue(tree.stats().fixedPoint());
    }

    @Test
    void emptyAxiomIsValid() {
        var tree = Search.search("", List.of(Rule.of("grow", s -> s.length() < 2, s -> s + "x")), 5);
        assertEquals(List.of("", "x", "xx"), tree.nodes().stream().map(TheoremNode::value).toList());
    }

    @Test
    void negativeLevelRejected() {
        var e = assertThrows(IllegalArgumentException.class, () -> Search.search("MI", MIU, -1));
        assertTrue(e.getMessage().contains("-1"));
    }

    @Test
    void nullArgumentsRejected() {
        assertThrows(NullPointerException.class, () -> Search.search(null, MIU, 1));
        assertThrows(NullPointerException.class, () -> Search.search("MI", (Rules) null, 1));
    }

    @Test
    void duplicateAcrossBranchesGetsOneNode() {
        var rules = List.of(
                Rule.of("a_to_c", s -> s.contains("a"), s -> s.replaceFirst("a", "c")),
                Rule.of("b_to_d", s -> s.contains("b"), s -> s.replaceFirst("b", "d")));
        var tree = Search.search("ab", rules, 3);

        assertEquals(List.of("cb", "ad"), tree.level(1));
        assertEquals(List.of("cd"), tree.level(2));
        var cd = tree.find("cd").orElseThrow();
        assertEquals("cb", cd.parent().orElseThrow().value());
        assertEquals("b_to_d", cd.rule());
        assertTrue(tree.find("ad").orElseThrow().isLeaf());
        assertEquals(1, tree.stats().duplicates());
    }

    @Test
    void duplicateFromSameNodeKeepsFirstRule() {
        var rules = List.of(
                Rule.of("first", s -> true, s -> s + "y"),
                Rule.of("second", s -> true, s -> s + "y"));
        var tree = Search.search("x", rules, 1);
        assertEquals(1, tree.root().children().size());
        assertEquals("first", tree.root().children().get(0).rule());
    }

    @Test
    void derivationsBackToKnownTheoremsAddNothing() {
        var tree = Search.search("MUU", MIU, 3);
        assertEquals(List.of("MUUUU", "M"), tree.level(1));
        // MUUUU -> MUU is already the root
        assertFalse(tree.find("MUUUU").orElseThrow().children().stream().anyMatch(n -> n.value().equals("MUU")));
    }

    @Test
    void deterministic() {
        var a = Search.miu(5);
        var b = Search.miu(5);
        assertEquals(a.byLevel(), b.byLevel());
        for (var n : a.nodes()) {
            var m = b.find(n.value()).orElseThrow();
            assertEquals(n.level(), m.level());
            assertEquals(n.parent().map(TheoremNode::value), m.parent().map(TheoremNode::value));
            assertEquals(n.rule(), m.rule());
        }
    }

    @Test
    void valuesAreUnique() {
        var nodes = Search.miu(6).nodes();
        var values = new LinkedHashSet<String>();
        for (var n : nodes) assertTrue(values.add(n.value()), n.value());
    }

    @Test
    void childLevelIsParentLevelPlusOne() {
        for (var n : Search.miu(6).nodes()) {
            for (var c : n.children()) assertEquals(n.level() + 1, c.level());
            if (n.isRoot()) assertEquals(0, n.level());
        }
    }

    @Test
    void levelsAreShortestDerivations() {
        var maxLevel = 5;
        var tree = Search.miu(maxLevel);
        var depths = exhaustiveDepths(Rules.AXIOM, MIU, maxLevel);

        assertEquals(depths.keySet(), Set.copyOf(tree.nodes().stream().map(TheoremNode::value).toList()));
        for (var n : tree.nodes())
            assertEquals(depths.get(n.value()), n.level(), n.value());
    }

    @Test
    void pathsAreRealDerivations() {
        var tree = Search.miu(5);
        for (var n : tree.nodes()) {
            var path = tree.pathTo(n);
            assertEquals(Rules.AXIOM, path.get(0));
            assertEquals(n.value(), path.get(path.size() - 1));
            assertEquals(n.level() + 1, path.size());
            for (var i = 1; i < path.size(); i++)
                assertTrue(MIU.successors(path.get(i - 1)).contains(path.get(i)), path.get(i - 1) + " -> " + path.get(i));
        }
    }

    @Test
    void statsCountCandidates() {
        var stats = Search.miu(3).stats();
        assertEquals(10, stats.candidates());
        assertEquals(0, stats.duplicates());
        assertFalse(stats.fixedPoint());
    }

    @Test
    void concurrentSearchesAreIndependent() throws Exception {
        var expected = Search.miu(6).byLevel();
        var threads = new Thread[4];
        var results = new ConcurrentLinkedQueue<Map<Integer, List<String>>>();
        for (var i = 0; i < threads.length; i++) {
            threads[i] = new Thread(() -> results.add(Search.miu(6).byLevel()));
            threads[i].start();
        }
        for (var t : threads) t.join();
        assertEquals(threads.length, results.size());
        results.forEach(r -> assertEquals(expected, r));
    }
}
