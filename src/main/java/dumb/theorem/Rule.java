package dumb.theorem;

import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * A single-shot rewrite rule: when {@code applies} holds for a string, {@code rewrite} yields
 * exactly one successor.
 */
public record Rule(String name, Predicate<String> applies, UnaryOperator<String> rewrite) {
    public Rule {
        requireNonNull(name);
        requireNonNull(applies);
        requireNonNull(rewrite);
    }

    public static Rule of(String name, Predicate<String> applies, UnaryOperator<String> rewrite) {
        return new Rule(name, applies, rewrite);
    }

    public boolean isApplicable(String theorem) {
        return applies.test(theorem);
    }

    public Optional<String> apply(String theorem) {
        return isApplicable(theorem) ? Optional.of(requireNonNull(rewrite.apply(theorem), name)) : Optional.empty();
    }

    /** Replaces the first occurrence of {@code target}; {@code s} must contain it. */
    static String replaceFirst(String s, String target, String replacement) {
        var at = s.indexOf(target);
        return s.substring(0, at) + replacement + s.substring(at + target.length());
    }

    @Override
    public String toString() {
        return "Rule[" + name + ']';
    }
}
