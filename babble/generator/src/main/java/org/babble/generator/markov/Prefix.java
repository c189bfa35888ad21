package org.babble.generator.markov;

import java.util.Arrays;

/**
 * Sliding window over the last {@code length()} words. Starts out filled with
 * empty strings and is shifted in place as words are read or emitted.
 */
public class Prefix {
    private final String[] myWords;

    public Prefix(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("prefix length must be positive: " + size);
        }
        myWords = new String[size];
        Arrays.fill(myWords, "");
    }

    public String wordAt(int index) {
        if (index < 0 || index >= myWords.length) {
            throw new IndexOutOfBoundsException("bad index in wordAt " + index);
        }
        return myWords[index];
    }

    public int length() {
        return myWords.length;
    }

    /**
     * Drops the oldest word and appends {@code word} at the end.
     */
    public void shift(String word) {
        System.arraycopy(myWords, 1, myWords, 0, myWords.length - 1);
        myWords[myWords.length - 1] = word;
    }

    /**
     * Words joined by a single space, used as the chain key.
     */
    public String key() {
        return String.join(" ", myWords);
    }

    @Override
    public String toString() {
        return key();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Prefix)) {
            return false;
        }
        return Arrays.equals(myWords, ((Prefix) o).myWords);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(myWords);
    }
}
