package dumb.theorem;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.theorem.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * What to search and how much of it to show. An empty rule list in JSON is kept as is; an
 * absent one means the MIU rules. Rule specs are compiled on construction, so a malformed one
 * fails here rather than at search time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Configuration(
        @JsonProperty("axiom") String axiom,
        @JsonProperty("maxLevel") int maxLevel,
        @JsonProperty("rules") @Nullable List<RuleSpec> rules,
        @JsonProperty("samplePaths") int samplePaths,
        @JsonProperty("samplePathMinLevel") int samplePathMinLevel
) {
    static final int DEFAULT_MAX_LEVEL = 4;
    static final int DEFAULT_SAMPLE_PATHS = 3;
    static final int DEFAULT_SAMPLE_PATH_MIN_LEVEL = 2;

    public Configuration {
        requireNonNull(axiom);
        if (maxLevel < 0)
            throw new IllegalArgumentException("maxLevel must be non-negative: " + maxLevel);
        if (samplePaths < 0)
            throw new IllegalArgumentException("samplePaths must be non-negative: " + samplePaths);
        rules = rules != null ? List.copyOf(rules) : null;
        if (rules != null)
            RuleSpec.compile(rules);
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("axiom") @Nullable String axiom,
            @JsonProperty("maxLevel") @Nullable Integer maxLevel,
            @JsonProperty("rules") @Nullable List<RuleSpec> rules,
            @JsonProperty("samplePaths") @Nullable Integer samplePaths,
            @JsonProperty("samplePathMinLevel") @Nullable Integer samplePathMinLevel
    ) {
        this(
                axiom != null ? axiom : Rules.AXIOM,
                maxLevel != null ? maxLevel : DEFAULT_MAX_LEVEL,
                rules,
                samplePaths != null ? samplePaths : DEFAULT_SAMPLE_PATHS,
                samplePathMinLevel != null ? samplePathMinLevel : DEFAULT_SAMPLE_PATH_MIN_LEVEL
        );
    }

    public Configuration() {
        this(Rules.AXIOM, DEFAULT_MAX_LEVEL, null, DEFAULT_SAMPLE_PATHS, DEFAULT_SAMPLE_PATH_MIN_LEVEL);
    }

    public static Configuration parse(String json) throws JsonProcessingException {
        return Json.obj(json, Configuration.class);
    }

    public static Configuration load(Path file) throws IOException {
        return parse(Files.readString(file));
    }

    public Rules ruleSet() {
        return rules == null ? Rules.miu() : new Rules(RuleSpec.compile(rules));
    }

    public TheoremTree search() {
        return Search.search(axiom, ruleSet(), maxLevel);
    }

    public Configuration withAxiom(String axiom) {
        return new Configuration(axiom, maxLevel, rules, samplePaths, samplePathMinLevel);
    }

    public Configuration withMaxLevel(int maxLevel) {
        return new Configuration(axiom, maxLevel, rules, samplePaths, samplePathMinLevel);
    }

    public Configuration withSamplePaths(int samplePaths) {
        return new Configuration(axiom, maxLevel, rules, samplePaths, samplePathMinLevel);
    }

    public String toJsonString() {
        return Json.str(this);
    }
}
