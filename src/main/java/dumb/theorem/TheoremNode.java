package dumb.theorem;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One unique theorem in a derivation tree. The parent link is a back-reference only; a node owns
 * its children. Nodes are never mutated after creation except by {@link #addChild}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"value", "level", "rule", "children"})
public final class TheoremNode {
    private final String value;
    private final int level;
    private final @Nullable TheoremNode parent;
    private final @Nullable String rule;
    private final List<TheoremNode> children = new ArrayList<>();

    private TheoremNode(String value, int level, @Nullable TheoremNode parent, @Nullable String rule) {
        this.value = requireNonNull(value);
        this.level = level;
        this.parent = parent;
        this.rule = rule;
    }

    static TheoremNode root(String axiom) {
        return new TheoremNode(axiom, 0, null, null);
    }

    /** Creates a node one level below this one, produced by {@code rule}, and appends it. */
    TheoremNode addChild(String value, String rule) {
        var child = new TheoremNode(value, level + 1, this, requireNonNull(rule));
        children.add(child);
        return child;
    }

    @JsonProperty("value")
    public String value() {
        return value;
    }

    @JsonProperty("level")
    public int level() {
        return level;
    }

    public Optional<TheoremNode> parent() {
        return Optional.ofNullable(parent);
    }

    /** Name of the rule that derived this node from its parent; absent for the axiom. */
    @JsonProperty("rule")
    public @Nullable String rule() {
        return rule;
    }

    @JsonProperty("children")
    public List<TheoremNode> children() {
        return Collections.unmodifiableList(children);
    }

    @JsonIgnore
    public boolean isRoot() {
        return parent == null;
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Values from the axiom down to this node, inclusive. */
    public List<String> path() {
        var path = new ArrayList<String>(level + 1);
        for (var n = this; n != null; n = n.parent)
            path.add(n.value);
        Collections.reverse(path);
        return path;
    }

    @Override
    public String toString() {
        return "Theorem('" + value + "', level=" + level + ')';
    }
}
