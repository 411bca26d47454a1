package dumb.theorem;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE = """
            Usage: java %s [options]
              -a, --axiom <string>     starting string (default: MI)
              -l, --max-level <n>      search depth bound (default: 4)
              -c, --config <file>      JSON configuration: axiom, maxLevel, rules, samplePaths, samplePathMinLevel
              -s, --samples <n>        number of sample derivation paths (default: 3)
                  --json               print the tree as JSON instead of the text report
              -h, --help               show this message
            """.formatted(Main.class.getName());

    public static void main(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            System.err.print(USAGE);
            System.exit(1);
            return;
        }
        System.exit(run(options, System.out));
    }

    static int run(Options options, PrintStream out) {
        if (options.help()) {
            out.print(USAGE);
            return 0;
        }
        Configuration config;
        try {
            config = options.configuration();
        } catch (IOException e) {
            logger.error("Failed to load configuration {}: {}", options.config(), e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        var tree = config.search();
        if (options.json())
            out.println(tree.toJson().toPrettyString());
        else
            new Report(tree, config).print(out);
        return 0;
    }

    /** Command-line values; each one present overrides the configuration file. */
    record Options(@Nullable Path config, @Nullable String axiom, @Nullable Integer maxLevel,
                   @Nullable Integer samples, boolean json, boolean help) {

        static Options parse(String... args) {
            Path config = null;
            String axiom = null;
            Integer maxLevel = null, samples = null;
            var json = false;
            var help = false;
            for (var i = 0; i < args.length; i++) {
                var arg = args[i];
                try {
                    switch (arg) {
                        case "-a", "--axiom" -> axiom = args[++i];
                        case "-l", "--max-level" -> maxLevel = nonNegative(arg, args[++i]);
                        case "-c", "--config" -> config = Path.of(args[++i]);
                        case "-s", "--samples" -> samples = nonNegative(arg, args[++i]);
                        case "--json" -> json = true;
                        case "-h", "--help" -> help = true;
                        default -> throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                } catch (ArrayIndexOutOfBoundsException e) {
                    throw new IllegalArgumentException("Missing value for " + arg);
                }
            }
            return new Options(config, axiom, maxLevel, samples, json, help);
        }

        private static int nonNegative(String option, String value) {
            int n;
            try {
                n = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(option + " expects an integer, got '" + value + "'");
            }
            if (n < 0)
                throw new IllegalArgumentException(option + " must be non-negative, got " + n);
            return n;
        }

        Configuration configuration() throws IOException {
            var c = config != null ? Configuration.load(config) : new Configuration();
            if (axiom != null) c = c.withAxiom(axiom);
            if (maxLevel != null) c = c.withMaxLevel(maxLevel);
            if (samples != null) c = c.withSamplePaths(samples);
            return c;
        }
    }
}
