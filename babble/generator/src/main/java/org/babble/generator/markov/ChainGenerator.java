package org.babble.generator.markov;

import org.babble.tools.Logger;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Random;

/**
 * Walks a built {@link Chain}, picking each next word uniformly among the
 * recorded follow-ons of the current prefix. Words that followed a prefix more
 * often occupy more slots and so come up more often.
 *
 * <p>The chain is only read. Every call to {@code generate} starts from a fresh
 * empty prefix, so calls do not affect one another.
 */
public class ChainGenerator {
    private static final Logger log = Logger.getLogger(ChainGenerator.class);
    private static final Random DEFAULT_RANDOM = new Random(System.nanoTime());

    private final Chain chain;
    private Random myRandom;

    public ChainGenerator(Chain chain) {
        this(chain, DEFAULT_RANDOM);
    }

    public ChainGenerator(Chain chain, Random random) {
        this.chain = Objects.requireNonNull(chain, "chain");
        this.myRandom = Objects.requireNonNull(random, "random");
    }

    public void setRandom(long seed) {
        myRandom = new Random(seed);
    }

    /**
     * Writes at most {@code maxWords} words, each followed by a space, and
     * flushes the writer.
     *
     * @return the number of words written
     * @throws IOException if the writer fails; generation stops at that point
     */
    public int generate(Writer out, int maxWords) throws IOException {
        Objects.requireNonNull(out, "out");
        int written = 0;

        Iterator<String> it = walk(maxWords);
        while (it.hasNext()) {
            out.write(it.next());
            out.write(' ');
            written++;
        }
        out.flush();

        log.info("[markov] Generated " + written + " of at most " + maxWords + " words");
        return written;
    }

    public List<String> generate(int maxWords) {
        List<String> words = new ArrayList<>();
        walk(maxWords).forEachRemaining(words::add);

        log.info("[markov] Generated " + words.size() + " of at most " + maxWords + " words");
        return words;
    }

    /**
     * Lazily picks up to {@code maxWords} words, starting from an empty prefix.
     * The walk ends early at a prefix the chain never saw.
     */
    public Iterator<String> walk(int maxWords) {
        return new Walk(maxWords);
    }

    private class Walk implements Iterator<String> {
        private final Prefix prefix = chain.newPrefix();
        private int remaining;
        private String next;

        Walk(int maxWords) {
            remaining = maxWords;
            advance();
        }

        // null when the limit is hit or the prefix was never seen
        private void advance() {
            next = null;
            if (remaining <= 0) {
                return;
            }
            remaining--;
            List<String> follows = chain.getFollows(prefix);
            if (!follows.isEmpty()) {
                next = follows.get(myRandom.nextInt(follows.size()));
            }
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public String next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            String word = next;
            prefix.shift(word);
            advance();
            return word;
        }
    }
}
