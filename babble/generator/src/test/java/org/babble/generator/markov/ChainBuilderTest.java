package org.babble.generator.markov;

import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.Assert.*;

public class ChainBuilderTest {

    @Test
    public void testOrderOneKeys() throws IOException {
        Chain chain = ChainBuilder.build(new StringReader("a a a b"), 1);

        assertEquals(2, chain.size());
        assertEquals(List.of("a"), chain.getFollows(""));
        assertEquals(List.of("a", "a", "b"), chain.getFollows("a"));
        assertFalse(chain.containsKey("b"));
        assertTrue(chain.getFollows("b").isEmpty());
        assertEquals(4, chain.tokenCount());
    }

    @Test
    public void testOrderTwoKeysIncludeEmptyPlaceholders() throws IOException {
        Chain chain = ChainBuilder.build(new StringReader("the cat sat the cat ran"), 2);

        assertEquals(List.of("the"), chain.getFollows(" "));
        assertEquals(List.of("cat"), chain.getFollows(" the"));
        assertEquals(List.of("sat", "ran"), chain.getFollows("the cat"));
        assertEquals(List.of("the"), chain.getFollows("cat sat"));
        assertEquals(List.of("cat"), chain.getFollows("sat the"));
        assertFalse(chain.containsKey("cat ran"));
        assertEquals(5, chain.size());
    }

    @Test
    public void testNoEmptyFollowLists() throws IOException {
        String text = "it was the best of times it was the worst of times\n"
                + "it was the age of wisdom it was the age of foolishness";
        for (int order = 1; order <= 4; order++) {
            Chain chain = ChainBuilder.build(new StringReader(text), order);
            int total = 0;
            for (String key : chain.keys()) {
                assertFalse("empty list for \"" + key + "\"", chain.getFollows(key).isEmpty());
                total += chain.getFollows(key).size();
            }
            assertEquals(24, total);
            assertEquals(24, chain.tokenCount());
        }
    }

    @Test
    public void testSameInputSameChain() throws IOException {
        String text = "one fish two fish red fish blue fish one fish";
        Chain first = ChainBuilder.build(new StringReader(text), 1);
        Chain second = ChainBuilder.build(new StringReader(text), 1);

        assertEquals(first.keys(), second.keys());
        for (String key : first.keys()) {
            assertEquals(first.getFollows(key), second.getFollows(key));
        }
        // insertion order, first seen first
        assertEquals(List.of("two", "red", "blue"), first.getFollows("fish"));
    }

    @Test
    public void testEmptyInputLeavesChainEmpty() throws IOException {
        Chain chain = ChainBuilder.build(new StringReader(" \n "), 2);
        assertTrue(chain.isEmpty());
        assertEquals(0, chain.tokenCount());
    }

    @Test
    public void testFollowsAreReadOnly() throws IOException {
        Chain chain = ChainBuilder.build(new StringReader("a b"), 1);
        try {
            chain.getFollows("a").add("c");
            fail("expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            assertEquals(List.of("b"), chain.getFollows("a"));
        }
    }

    @Test
    public void testReadErrorAbortsBuild() {
        Chain chain = new Chain(1);
        ChainBuilder builder = new ChainBuilder(chain);
        try {
            builder.build(new WordReaderTest.FailingReader("a b c ", new IOException("read failed")));
            fail("expected IOException");
        } catch (IOException e) {
            assertEquals("read failed", e.getMessage());
        }
        assertEquals(3, chain.tokenCount());
        assertSame(chain, builder.getChain());
    }

    @Test
    public void testDescribe() throws IOException {
        Chain chain = ChainBuilder.build(new StringReader("a a a b"), 1);
        assertEquals("order=1 keys=2 tokens=4 maxFollows=3 (\"a\")", chain.describe());
        assertEquals("order=3 keys=0 tokens=0 maxFollows=0", new Chain(3).describe());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNonPositiveOrder() {
        new Chain(0);
    }
}
