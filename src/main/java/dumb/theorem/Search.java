package dumb.theorem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Breadth-first theorem enumeration.
 *
 * <p>Each level is expanded completely before the next one starts, so a node's level is the
 * length of its shortest derivation. A string is recorded once for the whole search: the first
 * producer in frontier order, then rule order, becomes its parent and every later derivation of
 * it is dropped without creating a node or an edge.
 *
 * <p>All state lives in one {@code search} call; concurrent searches share nothing.
 */
public final class Search {
    private static final Logger logger = LoggerFactory.getLogger(Search.class);

    private final Rules rules;
    private final Map<String, TheoremNode> seen = new LinkedHashMap<>();
    private long candidates, duplicates;

    private Search(Rules rules) {
        this.rules = rules;
    }

    public static TheoremTree search(String axiom, List<Rule> rules, int maxLevel) {
        return search(axiom, new Rules(requireNonNull(rules)), maxLevel);
    }

    /**
     * Enumerates every theorem derivable from {@code axiom} in at most {@code maxLevel} rule
     * applications.
     *
     * @throws IllegalArgumentException if {@code maxLevel} is negative
     */
    public static TheoremTree search(String axiom, Rules rules, int maxLevel) {
        requireNonNull(axiom);
        requireNonNull(rules);
        if (maxLevel < 0)
            throw new IllegalArgumentException("maxLevel must be non-negative: " + maxLevel);
        return new Search(rules).run(axiom, maxLevel);
    }

    /** The MIU system from its usual axiom. */
    public static TheoremTree miu(int maxLevel) {
        return search(Rules.AXIOM, Rules.miu(), maxLevel);
    }

    private TheoremTree run(String axiom, int maxLevel) {
        var root = TheoremNode.root(axiom);
        seen.put(axiom, root);

        List<TheoremNode> frontier = List.of(root);
        var level = 0;
        while (level < maxLevel && !frontier.isEmpty()) {
            frontier = expand(frontier);
            level++;
            logger.debug("Level {}: {} new theorems ({} total)", level, frontier.size(), seen.size());
        }

        var fixedPoint = frontier.isEmpty();
        var tree = new TheoremTree(root, seen, maxLevel, new TheoremTree.Stats(candidates, duplicates, fixedPoint));
        logger.info("Search from '{}' to level {}: {} unique theorems, {} candidates, {} duplicates{}",
                axiom, maxLevel, seen.size(), candidates, duplicates, fixedPoint ? " (fixed point at level " + (level - 1) + ")" : "");
        return tree;
    }

    private List<TheoremNode> expand(List<TheoremNode> frontier) {
        var next = new ArrayList<TheoremNode>();
        for (var node : frontier) {
            for (var rule : rules.list()) {
                var derived = rule.apply(node.value());
                if (derived.isEmpty()) continue;
                candidates++;
                var value = derived.get();
                if (seen.containsKey(value)) {
                    duplicates++;
                    continue;
                }
                var child = node.addChild(value, rule.name());
                seen.put(value, child);
                next.add(child);
            }
        }
        return next;
    }
}
