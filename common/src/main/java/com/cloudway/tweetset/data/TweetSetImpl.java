/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.data;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.StringJoiner;
import java.util.function.Consumer;
import java.util.function.Predicate;
import static java.util.Objects.requireNonNull;

/**
 * The underlying implementation of TweetSet.
 */
final class TweetSetImpl {
    private TweetSetImpl() {}

    private static final Empty EMPTY = new Empty();

    static TweetSet empty() {
        return EMPTY;
    }

    static abstract class TSet implements TweetSet {
        @Override
        public TweetList descendingByRetweet() {
            List<Tweet> sorted = new ArrayList<>(size());
            TweetSet rest = this;
            while (!rest.isEmpty()) {
                Tweet max = rest.mostRetweeted();
                sorted.add(max);
                rest = rest.remove(max);
            }

            TweetList res = TweetList.nil();
            for (int i = sorted.size(); --i >= 0; ) {
                res = TweetList.cons(sorted.get(i), res);
            }
            return res;
        }

        @Override
        public void foreach(Consumer<? super Tweet> action) {
            requireNonNull(action);
            for (Tweet t : this) {
                action.accept(t);
            }
        }

        @Override
        public Iterator<Tweet> iterator() {
            return new InOrderIterator(this);
        }

        abstract boolean valid();

        abstract String showTree(String bars);

        String showTree() {
            return showTree("");
        }

        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof TweetSet))
                return false;
            TweetSet s = (TweetSet)obj;
            if (size() != s.size())
                return false;
            for (Tweet t : s) {
                if (!contains(t))
                    return false;
            }
            return true;
        }

        public int hashCode() {
            int h = 0;
            for (Tweet t : this) {
                h += t.hashCode();
            }
            return h;
        }

        public String toString() {
            StringJoiner sj = new StringJoiner(", ", "{", "}");
            for (Tweet t : this) {
                sj.add(t.getText());
            }
            return sj.toString();
        }
    }

    static final class Empty extends TSet {
        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public int size() {
            return 0;
        }

        @Override
        public boolean contains(Tweet tweet) {
            return false;
        }

        @Override
        public Tweet mostRetweeted() {
            throw new NoSuchElementException("mostRetweeted of empty set");
        }

        @Override
        public TweetSet incl(Tweet tweet) {
            return new NonEmpty(requireNonNull(tweet), this, this);
        }

        @Override
        public TweetSet remove(Tweet tweet) {
            return this;
        }

        @Override
        public TweetSet filterAcc(Predicate<? super Tweet> p, TweetSet acc) {
            return acc;
        }

        @Override
        public TweetSet union(TweetSet that) {
            return requireNonNull(that);
        }

        @Override
        public TweetList descendingByRetweet() {
            return TweetList.nil();
        }

        @Override
        boolean valid() {
            return true;
        }

        @Override
        String showTree(String bars) {
            return bars + "@\n";
        }
    }

    static final class NonEmpty extends TSet {
        final Tweet elem;
        final TweetSet left;
        final TweetSet right;
        final int size;

        NonEmpty(Tweet elem, TweetSet left, TweetSet right) {
            this.elem = elem;
            this.left = left;
            this.right = right;
            this.size = left.size() + right.size() + 1;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public boolean contains(Tweet tweet) {
            int cmp = tweet.compareTo(elem);
            if (cmp < 0) {
                return left.contains(tweet);
            } else if (cmp > 0) {
                return right.contains(tweet);
            } else {
                return true;
            }
        }

        @Override
        public Tweet mostRetweeted() {
            Iterator<Tweet> it = iterator();
            Tweet max = it.next();
            while (it.hasNext()) {
                Tweet t = it.next();
                if (t.getRetweets() > max.getRetweets()) {
                    max = t;
                }
            }
            return max;
        }

        @Override
        public TweetSet incl(Tweet tweet) {
            int cmp = tweet.compareTo(elem);
            if (cmp < 0) {
                TweetSet l = left.incl(tweet);
                return l == left ? this : new NonEmpty(elem, l, right);
            } else if (cmp > 0) {
                TweetSet r = right.incl(tweet);
                return r == right ? this : new NonEmpty(elem, left, r);
            } else {
                return this;
            }
        }

        @Override
        public TweetSet remove(Tweet tweet) {
            int cmp = tweet.compareTo(elem);
            if (cmp < 0) {
                TweetSet l = left.remove(tweet);
                return l == left ? this : new NonEmpty(elem, l, right);
            } else if (cmp > 0) {
                TweetSet r = right.remove(tweet);
                return r == right ? this : new NonEmpty(elem, left, r);
            } else {
                return left.union(right);
            }
        }

        @Override
        public TweetSet filterAcc(Predicate<? super Tweet> p, TweetSet acc) {
            acc = left.filterAcc(p, acc);
            if (p.test(elem)) {
                acc = acc.incl(elem);
            }
            return right.filterAcc(p, acc);
        }

        @Override
        public TweetSet union(TweetSet that) {
            return right.union(left.union(that.incl(elem)));
        }

        // Assertions

        @Override
        boolean valid() {
            return bounded(this, null, null) && validsize(this);
        }

        private static boolean bounded(TweetSet t, Tweet lo, Tweet hi) {
            if (t.isEmpty()) {
                return true;
            } else {
                NonEmpty b = (NonEmpty)t;
                return (lo == null || lo.compareTo(b.elem) < 0)
                    && (hi == null || b.elem.compareTo(hi) < 0)
                    && bounded(b.left, lo, b.elem)
                    && bounded(b.right, b.elem, hi);
            }
        }

        private static boolean validsize(TweetSet t) {
            if (t.isEmpty()) {
                return true;
            } else {
                NonEmpty b = (NonEmpty)t;
                return b.size == b.left.size() + b.right.size() + 1
                    && validsize(b.left) && validsize(b.right);
            }
        }

        // Show

        @Override
        String showTree(String bars) {
            String line = bars + elem.getText() + " [" + elem.getRetweets() + "]\n";
            if (left.isEmpty() && right.isEmpty()) {
                return line;
            } else {
                return line + ((TSet)left).showTree(bars + "|  ")
                            + ((TSet)right).showTree(bars + "   ");
            }
        }
    }

    /**
     * Visits the branches of a tree in ascending order, keeping the path
     * on an explicit stack.
     */
    static final class InOrderIterator implements Iterator<Tweet> {
        private final Deque<NonEmpty> stack = new ArrayDeque<>();

        InOrderIterator(TweetSet t) {
            pushLeft(t);
        }

        private void pushLeft(TweetSet t) {
            while (!t.isEmpty()) {
                NonEmpty b = (NonEmpty)t;
                stack.push(b);
                t = b.left;
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Tweet next() {
            if (stack.isEmpty())
                throw new NoSuchElementException();
            NonEmpty b = stack.pop();
            pushLeft(b.right);
            return b.elem;
        }
    }
}
