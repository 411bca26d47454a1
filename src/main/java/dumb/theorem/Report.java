package dumb.theorem;

import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/** Text rendering of a finished {@link TheoremTree}. */
public final class Report {
    private final TheoremTree tree;
    private final int samplePaths;
    private final int samplePathMinLevel;

    public Report(TheoremTree tree, int samplePaths, int samplePathMinLevel) {
        this.tree = requireNonNull(tree);
        this.samplePaths = samplePaths;
        this.samplePathMinLevel = samplePathMinLevel;
    }

    public Report(TheoremTree tree, Configuration config) {
        this(tree, config.samplePaths(), config.samplePathMinLevel());
    }

    static String quote(List<String> values) {
        return values.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", ", "[", "]"));
    }

    public String summary() {
        return "Total unique theorems generated: " + tree.size();
    }

    public String structure() {
        var sb = new StringBuilder();
        for (var v : tree.traverse(TheoremTree.Order.DEPTH_FIRST))
            sb.append("  ".repeat(v.level())).append("├─ ").append(v.node().value())
                    .append(" (level ").append(v.level()).append(")\n");
        return sb.toString();
    }

    public String levels() {
        var sb = new StringBuilder();
        tree.byLevel().forEach((level, values) ->
                sb.append("Level ").append(level).append(": ").append(quote(values)).append('\n'));
        return sb.toString();
    }

    /** The first few nodes, in depth-first pre-order, at or below the sample level. */
    public List<TheoremNode> samples() {
        return tree.nodes().stream()
                .filter(n -> n.level() >= samplePathMinLevel)
                .limit(samplePaths)
                .toList();
    }

    public String paths() {
        var sb = new StringBuilder();
        for (var n : samples())
            sb.append("Path to '").append(n.value()).append("': ")
                    .append(String.join(" -> ", n.path())).append('\n');
        return sb.toString();
    }

    public String render() {
        return "=== Optimized Theorem Generation ===\n" + summary() + "\n\n" +
                "=== Tree Structure ===\n" + structure() + '\n' +
                "=== Theorems by Level ===\n" + levels() + '\n' +
                "=== Sample Derivation Paths ===\n" + paths();
    }

    public void print(PrintStream out) {
        out.print(render());
        out.flush();
    }
}
