package org.babble.generator;

import org.babble.generator.markov.Chain;
import org.babble.generator.markov.ChainBuilder;
import org.babble.generator.markov.ChainGenerator;
import org.babble.tools.Logger;

import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Reads a text from standard input, builds a word chain from it and prints
 * random text generated from that chain.
 */
public class GeneratorRunner {

    private static final Logger log = Logger.getLogger(GeneratorRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final PrintStream err;

    public GeneratorRunner(PrintStream err) {
        this.err = err;
    }

    public int run(String[] args, InputStream in, OutputStream out) {
        GeneratorOptions options;
        try {
            options = GeneratorOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(GeneratorOptions.USAGE);
            return EXIT_USAGE;
        }
        if (options.isHelp()) {
            err.println(GeneratorOptions.USAGE);
            return EXIT_OK;
        }

        log.info("[markov] Building chain, prefix=" + options.getPrefix());
        Chain chain;
        try {
            Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
            chain = ChainBuilder.build(reader, options.getPrefix());
        } catch (IOException e) {
            log.error("[markov] Failed to read input", e);
            return EXIT_FAILURE;
        }
        log.info("[markov] Chain built: " + chain.describe());

        try {
            Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            new ChainGenerator(chain).generate(writer, options.getWords());
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            log.error("[markov] Failed to write output", e);
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    public static void main(String[] args) {
        // System.out hides write errors, go straight to fd 1
        OutputStream out = new FileOutputStream(FileDescriptor.out);
        int status = new GeneratorRunner(System.err).run(args, System.in, out);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }
}
