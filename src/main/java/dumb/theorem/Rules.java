package dumb.theorem;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An ordered rule set. Rule order defines the order of successors, and therefore the order of
 * children in a theorem tree.
 */
public final class Rules {
    public static final String AXIOM = "MI";
    public static final String M = "M", I = "I", U = "U";

    private final List<Rule> rules;

    public Rules(List<Rule> rules) {
        this.rules = List.copyOf(requireNonNull(rules));
    }

    public static Rules of(Rule... rules) {
        return new Rules(List.of(rules));
    }

    /** The four rules of the MIU system. */
    public static Rules miu() {
        return miu(M, I, U);
    }

    /** The MIU rules over arbitrary designated symbols. */
    public static Rules miu(String m, String i, String u) {
        requireSymbol(m, "M");
        requireSymbol(i, "I");
        requireSymbol(u, "U");
        var iii = i.repeat(3);
        var uu = u.repeat(2);
        return of(
                Rule.of("rule_0", s -> s.endsWith(i), s -> s + u),
                Rule.of("rule_1", s -> s.startsWith(m), s -> s + s.substring(m.length())),
                Rule.of("rule_2", s -> s.contains(iii), s -> Rule.replaceFirst(s, iii, u)),
                Rule.of("rule_3", s -> s.contains(uu), s -> Rule.replaceFirst(s, uu, ""))
        );
    }

    private static void requireSymbol(String symbol, String role) {
        if (requireNonNull(symbol, role).isEmpty())
            throw new IllegalArgumentException("Designated " + role + "-symbol must not be empty");
    }

    /** Successors of {@code theorem}, one per applicable rule, in rule order. Duplicates are kept. */
    public List<String> successors(String theorem) {
        requireNonNull(theorem);
        var out = new ArrayList<String>(rules.size());
        for (var r : rules)
            r.apply(theorem).ifPresent(out::add);
        return out;
    }

    /** Rules applicable to {@code theorem}, in rule order. */
    public List<Rule> applicable(String theorem) {
        return rules.stream().filter(r -> r.isApplicable(theorem)).toList();
    }

    public List<Rule> list() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "Rules" + rules;
    }
}
