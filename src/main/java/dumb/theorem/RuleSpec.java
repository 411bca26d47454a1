package dumb.theorem;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * Declarative form of a {@link Rule}, as written in a configuration file:
 * <pre>{"name": "rule_2", "when": "CONTAINS", "match": "III", "action": "REPLACE_FIRST", "replacement": "U"}</pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleSpec(String name, When when, String match, Action action, @Nullable String replacement) {

    public RuleSpec {
        requireNonNull(name);
        requireNonNull(when);
        requireNonNull(match);
        requireNonNull(action);
    }

    @JsonCreator
    public static RuleSpec create(@JsonProperty("name") @Nullable String name,
                                  @JsonProperty("when") @Nullable When when,
                                  @JsonProperty("match") @Nullable String match,
                                  @JsonProperty("action") Action action,
                                  @JsonProperty("replacement") @Nullable String replacement) {
        if (action == null)
            throw new IllegalArgumentException("Rule spec " + name + " has no action");
        return new RuleSpec(
                name != null ? name : action.name().toLowerCase(),
                when != null ? when : When.ALWAYS,
                match != null ? match : "",
                action,
                replacement);
    }

    public static List<Rule> compile(List<RuleSpec> specs) {
        return specs.stream().map(RuleSpec::rule).toList();
    }

    public Rule rule() {
        return Rule.of(name, when.predicate(match), transform());
    }

    private UnaryOperator<String> transform() {
        return switch (action) {
            case APPEND -> {
                var r = required();
                yield s -> s + r;
            }
            case DUPLICATE_SUFFIX -> {
                if (when != When.STARTS_WITH)
                    throw new IllegalArgumentException("Rule " + name + ": DUPLICATE_SUFFIX needs when STARTS_WITH, got " + when);
                yield s -> s + s.substring(match.length());
            }
            case REPLACE_FIRST -> {
                var r = required();
                yield s -> s.contains(match) ? Rule.replaceFirst(s, match, r) : s;
            }
            case REMOVE_FIRST -> {
                if (match.isEmpty())
                    throw new IllegalArgumentException("Rule " + name + ": REMOVE_FIRST needs a non-empty match");
                yield s -> s.contains(match) ? Rule.replaceFirst(s, match, "") : s;
            }
        };
    }

    private String required() {
        if (replacement == null)
            throw new IllegalArgumentException("Rule " + name + ": " + action + " needs a replacement");
        return replacement;
    }

    public enum When {
        ALWAYS, STARTS_WITH, ENDS_WITH, CONTAINS;

        Predicate<String> predicate(String match) {
            return switch (this) {
                case ALWAYS -> s -> true;
                case STARTS_WITH -> s -> s.startsWith(match);
                case ENDS_WITH -> s -> s.endsWith(match);
                case CONTAINS -> s -> s.contains(match);
            };
        }
    }

    public enum Action {APPEND, DUPLICATE_SUFFIX, REPLACE_FIRST, REMOVE_FIRST}
}
