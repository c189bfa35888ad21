package org.babble.generator.markov;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.Objects;

/**
 * Splits a character stream into whitespace-delimited words, one at a time.
 * See {@link #isSeparator(int)} for what counts as whitespace.
 */
public class WordReader implements Closeable {
    private final BufferedReader reader;

    public WordReader(Reader reader) {
        Objects.requireNonNull(reader, "reader");
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    }

    /**
     * @return the next word, or {@code null} once the stream is exhausted
     */
    public String next() throws IOException {
        int c = reader.read();
        while (c != -1 && isSeparator(c)) {
            c = reader.read();
        }
        if (c == -1) {
            return null;
        }

        StringBuilder word = new StringBuilder();
        while (c != -1 && !isSeparator(c)) {
            word.append((char) c);
            c = reader.read();
        }
        return word.toString();
    }

    /**
     * Word separators: ASCII tab through carriage return, space, NEL and the
     * Unicode space separators, no-break spaces included. The information
     * separators U+001C..U+001F are part of a word.
     */
    static boolean isSeparator(int c) {
        if (c <= 0xFF) {
            return (c >= 0x09 && c <= 0x0D) || c == 0x20 || c == 0x85 || c == 0xA0;
        }
        return c == 0x1680
                || (c >= 0x2000 && c <= 0x200A)
                || c == 0x2028 || c == 0x2029
                || c == 0x202F || c == 0x205F
                || c == 0x3000;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
