/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.Before;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TweetSetTest
{
    private TweetSet ts;
    private Tweet[] data;

    private static final Tweet KEY = tweet(42);

    @Before
    public void initialize() {
        data = shuffle(200);
        ts = TweetSet.empty();
        for (Tweet t : data) {
            incl(t);
        }
    }

    private static Tweet tweet(int i) {
        return new Tweet("user" + i, "tweet " + i, i % 37);
    }

    private static Tweet[] shuffle(int len) {
        Random rnd = new Random();
        return IntStream.generate(() -> rnd.nextInt(len))
                        .distinct().limit(len)
                        .mapToObj(TweetSetTest::tweet)
                        .toArray(Tweet[]::new);
    }

    private TweetSet validate(TweetSet s) {
        TweetSetImpl.TSet t = (TweetSetImpl.TSet)s;
        if (!t.valid()) {
            StringBuilder msg = new StringBuilder();
            msg.append("Internal tree structure corrupted\n\n");
            msg.append("Tree Structure: \n");
            msg.append(t.showTree());
            msg.append("\nSample Data: \n");
            msg.append(Arrays.toString(data));
            fail(msg.toString());
        }
        return s;
    }

    private void incl(Tweet t) {
        validate(ts = ts.incl(t));
    }

    private void remove(Tweet t) {
        validate(ts = ts.remove(t));
    }

    private static Set<String> texts(Iterable<Tweet> tweets) {
        Set<String> res = new HashSet<>();
        tweets.forEach(t -> res.add(t.getText()));
        return res;
    }

    @Test
    public void test_empty() {
        TweetSet empty = TweetSet.empty();
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
        assertFalse(empty.contains(KEY));
        assertSame(empty, empty.remove(KEY));
        assertTrue(empty.filter(t -> true).isEmpty());
        assertTrue(empty.descendingByRetweet().isEmpty());
        assertFalse(empty.iterator().hasNext());
        empty.foreach(t -> fail("visited element of empty set"));
    }

    @Test(expected = NoSuchElementException.class)
    public void test_mostRetweeted_empty() {
        TweetSet.empty().mostRetweeted();
    }

    @Test
    public void test_contains() {
        for (Tweet t : data) {
            assertTrue(ts.contains(t));
        }
        assertTrue(ts.contains(new Tweet("somebody else", KEY.getText(), 1000)));
        assertFalse(ts.contains(new Tweet("user", "XXX", 0)));
        assertEquals(data.length, ts.size());
        assertFalse(ts.isEmpty());
    }

    @Test
    public void test_incl_contains() {
        Tweet t = new Tweet("user", "brand new", 1);
        assertFalse(ts.contains(t));
        incl(t);
        assertTrue(ts.contains(t));
        assertEquals(data.length + 1, ts.size());
    }

    @Test
    public void test_incl_idempotent() {
        Tweet t = new Tweet("user", "brand new", 1);
        TweetSet once = ts.incl(t);
        TweetSet twice = once.incl(t);
        assertSame(once, twice);
        assertEquals(once, twice);
    }

    @Test
    public void test_incl_keeps_first() {
        Tweet r1 = new Tweet("a", "same text", 1);
        Tweet r2 = new Tweet("b", "same text", 99);
        TweetSet s = TweetSet.empty().incl(r1).incl(r2);
        assertEquals(1, s.size());
        assertEquals(TweetSet.of(r1), s);
        assertEquals("a", s.mostRetweeted().getUser());
        assertEquals(1, s.mostRetweeted().getRetweets());

        assertSame(ts, ts.incl(new Tweet("other", KEY.getText(), 1000)));
    }

    @Test
    public void test_persistent() {
        TweetSet orig = ts;
        Tweet t = new Tweet("user", "brand new", 1);
        ts.incl(t);
        ts.remove(KEY);
        ts.filter(x -> false);
        ts.union(TweetSet.of(t));
        assertSame(orig, ts);
        assertTrue(ts.contains(KEY));
        assertFalse(ts.contains(t));
        assertEquals(data.length, ts.size());
    }

    @Test
    public void test_remove() {
        remove(KEY);
        assertEquals(data.length - 1, ts.size());
        assertFalse(ts.contains(KEY));
    }

    @Test
    public void test_remove_not_exists() {
        TweetSet orig = ts;
        remove(new Tweet("user", "XXX", 0));
        assertSame(orig, ts);
    }

    @Test
    public void validate_remove() {
        Tweet[] order = shuffle(data.length);
        for (int i = 0; i < order.length; i++) {
            remove(order[i]);
            assertFalse(ts.contains(order[i]));
            assertEquals(data.length - i - 1, ts.size());
        }
        assertTrue(ts.isEmpty());
    }

    @Test
    public void test_filter() {
        Predicate<Tweet> p = t -> t.getRetweets() % 2 == 0;
        TweetSet filtered = validate(ts.filter(p));
        for (Tweet t : data) {
            assertEquals(p.test(t), filtered.contains(t));
        }
        assertEquals(Arrays.stream(data).filter(p).count(), filtered.size());
        assertTrue(ts.filter(t -> false).isEmpty());
        assertEquals(ts, ts.filter(t -> true));
    }

    @Test
    public void test_filterAcc() {
        Tweet extra = new Tweet("user", "extra", 3);
        TweetSet res = validate(ts.filterAcc(t -> t.getRetweets() == 0, TweetSet.of(extra)));
        assertTrue(res.contains(extra));
        assertTrue(res.contains(tweet(0)));
        assertFalse(res.contains(tweet(1)));
    }

    @Test
    public void test_union() {
        TweetSet other = TweetSet.empty();
        for (int i = 150; i < 300; i++) {
            other = other.incl(tweet(i));
        }

        TweetSet u1 = validate(ts.union(other));
        TweetSet u2 = validate(other.union(ts));
        assertEquals(300, u1.size());
        assertEquals(texts(u1), texts(u2));
        assertEquals(u1, u2);
        for (int i = 0; i < 300; i++) {
            assertTrue(u1.contains(tweet(i)));
        }
    }

    @Test
    public void test_union_empty() {
        assertEquals(ts, ts.union(TweetSet.empty()));
        assertSame(ts, TweetSet.empty().union(ts));
        assertTrue(TweetSet.empty().union(TweetSet.empty()).isEmpty());
    }

    @Test
    public void test_union_retains_existing() {
        TweetSet s1 = TweetSet.of(new Tweet("a", "same text", 1));
        TweetSet s2 = TweetSet.of(new Tweet("b", "same text", 9));
        assertEquals("b", s1.union(s2).mostRetweeted().getUser());
        assertEquals("a", s2.union(s1).mostRetweeted().getUser());
    }

    @Test
    public void test_mostRetweeted() {
        Tweet max = ts.mostRetweeted();
        for (Tweet t : data) {
            assertTrue(t.getRetweets() <= max.getRetweets());
        }
        assertEquals(36, max.getRetweets());
    }

    @Test
    public void test_mostRetweeted_tie() {
        TweetSet s = TweetSet.of(new Tweet("x", "m", 5),
                                 new Tweet("y", "z", 5),
                                 new Tweet("z", "a", 5),
                                 new Tweet("w", "b", 1));
        assertEquals("a", s.mostRetweeted().getText());
    }

    @Test
    public void test_descendingByRetweet() {
        TweetSet s = TweetSet.of(new Tweet("a", "hello world", 5),
                                 new Tweet("b", "hello", 10),
                                 new Tweet("c", "world", 3));
        TweetList xs = s.descendingByRetweet();
        assertThat(xs.toList().stream().map(Tweet::getUser).collect(Collectors.toList()),
                   is(Arrays.asList("b", "a", "c")));
        assertThat(xs.toList().stream().map(Tweet::getRetweets).collect(Collectors.toList()),
                   is(Arrays.asList(10, 5, 3)));
        assertEquals(3, s.size());
    }

    @Test
    public void validate_descendingByRetweet() {
        TweetList xs = ts.descendingByRetweet();
        assertEquals(data.length, xs.size());
        assertEquals(texts(ts), texts(xs));

        Tweet prev = null;
        for (Tweet t : xs) {
            if (prev != null) {
                assertTrue(prev.getRetweets() >= t.getRetweets());
                if (prev.getRetweets() == t.getRetweets()) {
                    assertTrue(prev.getText().compareTo(t.getText()) < 0);
                }
            }
            prev = t;
        }
    }

    @Test
    public void test_extract_exhausts() {
        Set<String> seen = new HashSet<>();
        TweetSet s = ts;
        while (!s.isEmpty()) {
            Tweet max = s.mostRetweeted();
            assertTrue(seen.add(max.getText()));
            s = validate(s.remove(max));
        }
        assertEquals(texts(ts), seen);
    }

    @Test
    public void test_foreach_order() {
        List<String> visited = new ArrayList<>();
        ts.foreach(t -> visited.add(t.getText()));
        List<String> expected = Arrays.stream(data).map(Tweet::getText).sorted().collect(Collectors.toList());
        assertEquals(expected, visited);
        assertEquals(expected, ts.stream().map(Tweet::getText).collect(Collectors.toList()));
    }

    @Test
    public void test_equals() {
        TweetSet other = TweetSet.empty();
        for (int i = data.length; --i >= 0; ) {
            other = other.incl(data[i]);
        }
        assertEquals(ts, other);
        assertEquals(ts.hashCode(), other.hashCode());
        assertNotEquals(ts, other.remove(KEY));
        assertEquals(TweetSet.fromIterable(Arrays.asList(data)), ts);
    }

    @Test
    public void test_degenerate_tree() {
        TweetSet s = TweetSet.empty();
        for (int i = 0; i < 1000; i++) {
            s = s.incl(new Tweet("user", String.format("%04d", i), i));
        }
        validate(s);
        assertEquals(1000, s.size());
        assertEquals("0999", s.mostRetweeted().getText());
        assertEquals(1000, s.stream().count());

        TweetList xs = s.descendingByRetweet();
        assertEquals(999, xs.head().getRetweets());
        assertEquals(998, xs.tail().head().getRetweets());
        assertEquals(1000, xs.size());
    }

    @Test
    public void test_toString() {
        TweetSet s = TweetSet.of(new Tweet("u", "b", 1), new Tweet("u", "a", 2));
        assertThat(s.toString(), is("{a, b}"));
        assertThat(TweetSet.empty().toString(), is("{}"));
        assertThat(((TweetSetImpl.TSet)s).showTree(), containsString("a [2]"));
    }
}
