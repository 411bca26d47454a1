package dumb.theorem;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.theorem.util.Json;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Result of a {@link Search}: the derivation tree rooted at the axiom, plus the views display
 * code needs. Immutable once returned.
 */
public final class TheoremTree {
    private final TheoremNode root;
    private final Map<String, TheoremNode> index;
    private final int maxLevel;
    private final Stats stats;

    TheoremTree(TheoremNode root, Map<String, TheoremNode> index, int maxLevel, Stats stats) {
        this.root = requireNonNull(root);
        this.index = Collections.unmodifiableMap(index);
        this.maxLevel = maxLevel;
        this.stats = requireNonNull(stats);
    }

    public TheoremNode root() {
        return root;
    }

    public String axiom() {
        return root.value();
    }

    public int maxLevel() {
        return maxLevel;
    }

    public Stats stats() {
        return stats;
    }

    public int size() {
        return index.size();
    }

    /** Deepest level actually reached. */
    public int depth() {
        var d = 0;
        for (var n : index.values()) d = Math.max(d, n.level());
        return d;
    }

    public boolean contains(String value) {
        return index.containsKey(value);
    }

    public Optional<TheoremNode> find(String value) {
        return Optional.ofNullable(index.get(value));
    }

    /** Level to values, both in breadth-first discovery order. */
    public Map<Integer, List<String>> byLevel() {
        var levels = new LinkedHashMap<Integer, List<String>>();
        for (var n : index.values())
            levels.computeIfAbsent(n.level(), k -> new ArrayList<>()).add(n.value());
        levels.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(levels);
    }

    public List<String> level(int level) {
        return byLevel().getOrDefault(level, List.of());
    }

    public List<String> pathTo(TheoremNode node) {
        return node.path();
    }

    /** Derivation path to {@code value}, or empty if the search never reached it. */
    public Optional<List<String>> pathTo(String value) {
        return find(value).map(TheoremNode::path);
    }

    /** All nodes in depth-first pre-order. */
    public List<TheoremNode> nodes() {
        var all = new ArrayList<TheoremNode>(index.size());
        traverse(Order.DEPTH_FIRST).forEach(v -> all.add(v.node()));
        return all;
    }

    public List<TheoremNode> leaves() {
        return nodes().stream().filter(TheoremNode::isLeaf).toList();
    }

    /** A lazy view; each call to {@code iterator()} starts a fresh walk from the root. */
    public Iterable<Visit> traverse(Order order) {
        requireNonNull(order);
        return () -> new Walk(root, order);
    }

    public JsonNode toJson() {
        ObjectNode n = Json.node();
        n.put("axiom", axiom());
        n.put("maxLevel", maxLevel);
        n.put("size", size());
        n.set("stats", Json.node(stats));
        n.set("root", Json.node(root));
        return n;
    }

    @Override
    public String toString() {
        return "TheoremTree[axiom=" + axiom() + ", size=" + size() + ", depth=" + depth() + ']';
    }

    public enum Order {BREADTH_FIRST, DEPTH_FIRST}

    public record Visit(TheoremNode node, int level) {
        public Visit {
            requireNonNull(node);
        }
    }

    /**
     * @param candidates  successors produced by applicable rules, duplicates included
     * @param duplicates  candidates dropped because their value was already in the tree
     * @param fixedPoint  true if the search stopped because a level produced nothing new
     */
    public record Stats(long candidates, long duplicates, boolean fixedPoint) {
    }

    private static final class Walk implements Iterator<Visit> {
        private final ArrayDeque<TheoremNode> pending = new ArrayDeque<>();
        private final Order order;

        Walk(TheoremNode root, Order order) {
            this.order = order;
            pending.add(root);
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public Visit next() {
            if (pending.isEmpty()) throw new NoSuchElementException();
            var n = pending.poll();
            var kids = n.children();
            switch (order) {
                case BREADTH_FIRST -> pending.addAll(kids);
                case DEPTH_FIRST -> {
                    for (var i = kids.size() - 1; i >= 0; i--)
                        pending.push(kids.get(i));
                }
            }
            return new Visit(n, n.level());
        }
    }
}
