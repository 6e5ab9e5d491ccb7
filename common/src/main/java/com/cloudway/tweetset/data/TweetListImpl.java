/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.data;

import java.util.NoSuchElementException;
import java.util.StringJoiner;
import static java.util.Objects.requireNonNull;

final class TweetListImpl {
    private TweetListImpl() {}

    private static final TweetList NIL = new TweetList() {
        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public Tweet head() {
            throw new NoSuchElementException("head of empty list");
        }

        @Override
        public TweetList tail() {
            throw new NoSuchElementException("tail of empty list");
        }

        @Override
        public String toString() {
            return "[]";
        }
    };

    private static final class Cons implements TweetList {
        private final Tweet head;
        private final TweetList tail;

        Cons(Tweet head, TweetList tail) {
            this.head = head;
            this.tail = tail;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public Tweet head() {
            return head;
        }

        @Override
        public TweetList tail() {
            return tail;
        }

        @Override
        public String toString() {
            StringJoiner sj = new StringJoiner(", ", "[", "]");
            foreach(t -> sj.add(t.getText() + " (" + t.getRetweets() + ")"));
            return sj.toString();
        }
    }

    static TweetList nil() {
        return NIL;
    }

    static TweetList cons(Tweet head, TweetList tail) {
        return new Cons(requireNonNull(head), requireNonNull(tail));
    }
}
