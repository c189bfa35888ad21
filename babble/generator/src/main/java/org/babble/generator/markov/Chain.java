package org.babble.generator.markov;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prefix key to the words seen right after that prefix. A word that followed
 * the same prefix several times is stored several times.
 *
 * @see ChainBuilder
 * @see ChainGenerator
 */
public class Chain {
    private final int prefixLength;
    private final Map<String, List<String>> chain;
    private int tokenCount;

    public Chain(int prefixLength) {
        if (prefixLength < 1) {
            throw new IllegalArgumentException("prefix length must be positive: " + prefixLength);
        }
        this.prefixLength = prefixLength;
        this.chain = new HashMap<>();
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public Prefix newPrefix() {
        return new Prefix(prefixLength);
    }

    void add(String key, String word) {
        chain.computeIfAbsent(key, k -> new ArrayList<>()).add(word);
        tokenCount++;
    }

    public List<String> getFollows(String key) {
        List<String> follows = chain.get(key);
        if (follows == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(follows);
    }

    public List<String> getFollows(Prefix prefix) {
        return getFollows(prefix.key());
    }

    public boolean containsKey(String key) {
        return chain.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(chain.keySet());
    }

    public int size() {
        return chain.size();
    }

    public int tokenCount() {
        return tokenCount;
    }

    public boolean isEmpty() {
        return chain.isEmpty();
    }

    public String describe() {
        int maxSize = 0;
        String maxKey = null;
        for (Map.Entry<String, List<String>> entry : chain.entrySet()) {
            int curSize = entry.getValue().size();
            if (curSize > maxSize) {
                maxSize = curSize;
                maxKey = entry.getKey();
            }
        }
        StringBuilder sb = new StringBuilder();
        sb.append("order=").append(prefixLength)
                .append(" keys=").append(chain.size())
                .append(" tokens=").append(tokenCount)
                .append(" maxFollows=").append(maxSize);
        if (maxKey != null) {
            sb.append(" (\"").append(maxKey).append("\")");
        }
        return sb.toString();
    }
}
