package org.babble.generator;

import org.babble.tools.PropertyLoader;

public class GeneratorOptions {

    public static final int DEFAULT_WORDS = 100;
    public static final int DEFAULT_PREFIX = 2;

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: GeneratorRunner [-words N] [-prefix N] < input.txt",
            "  -words N    maximum number of words to print (default from markov.words, else " + DEFAULT_WORDS + ")",
            "  -prefix N   prefix length in words (default from markov.prefix, else " + DEFAULT_PREFIX + ")",
            "  -help       print this message");

    private int words;
    private int prefix;
    private boolean help;

    private GeneratorOptions(int words, int prefix) {
        this.words = words;
        this.prefix = prefix;
    }

    public static GeneratorOptions defaults() {
        return new GeneratorOptions(
                PropertyLoader.getIntProperty("markov.words", DEFAULT_WORDS),
                PropertyLoader.getIntProperty("markov.prefix", DEFAULT_PREFIX));
    }

    /**
     * Accepts {@code -name value}, {@code -name=value} and the same with two dashes.
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a
     *                                  value that is not a positive integer
     */
    public static GeneratorOptions parse(String[] args) {
        GeneratorOptions options = defaults();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-") || arg.equals("-") || arg.equals("--")) {
                throw new IllegalArgumentException("unexpected argument: " + arg);
            }
            String name = arg.startsWith("--") ? arg.substring(2) : arg.substring(1);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }

            switch (name) {
                case "h":
                case "help":
                    options.help = true;
                    break;
                case "words":
                case "prefix":
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("flag needs an argument: -" + name);
                        }
                        value = args[++i];
                    }
                    int n = parsePositive(name, value);
                    if (name.equals("words")) {
                        options.words = n;
                    } else {
                        options.prefix = n;
                    }
                    break;
                default:
                    throw new IllegalArgumentException("flag provided but not defined: -" + name);
            }
        }

        if (options.words < 1) {
            throw new IllegalArgumentException("markov.words must be positive: " + options.words);
        }
        if (options.prefix < 1) {
            throw new IllegalArgumentException("markov.prefix must be positive: " + options.prefix);
        }
        return options;
    }

    private static int parsePositive(String name, String value) {
        int n;
        try {
            n = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value \"" + value + "\" for flag -" + name, e);
        }
        if (n < 1) {
            throw new IllegalArgumentException("-" + name + " must be positive: " + n);
        }
        return n;
    }

    public int getWords() {
        return words;
    }

    public int getPrefix() {
        return prefix;
    }

    public boolean isHelp() {
        return help;
    }
}
