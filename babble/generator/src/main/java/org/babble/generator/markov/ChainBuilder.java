package org.babble.generator.markov;

import org.babble.tools.Logger;

import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * Fills a {@link Chain} from a word stream. The first words of the stream are
 * keyed by a prefix that still holds the initial empty strings.
 */
public class ChainBuilder {
    private static final Logger log = Logger.getLogger(ChainBuilder.class);

    private final Chain chain;

    public ChainBuilder(Chain chain) {
        this.chain = Objects.requireNonNull(chain, "chain");
    }

    public static Chain build(Reader reader, int prefixLength) throws IOException {
        Chain chain = new Chain(prefixLength);
        new ChainBuilder(chain).build(reader);
        return chain;
    }

    public Chain build(Reader reader) throws IOException {
        return build(new WordReader(reader));
    }

    public Chain build(WordReader words) throws IOException {
        Prefix prefix = chain.newPrefix();
        int count = 0;

        String word;
        while ((word = words.next()) != null) {
            chain.add(prefix.key(), word);
            prefix.shift(word);
            count++;
        }

        log.info("[markov] Read " + count + " words, chain has " + chain.size() + " keys");
        return chain;
    }

    public Chain getChain() {
        return chain;
    }
}
