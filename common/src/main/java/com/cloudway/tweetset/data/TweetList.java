/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.data;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

import com.google.common.collect.ImmutableList;

/**
 * A persistent linked list of tweets.
 */
public interface TweetList extends Iterable<Tweet>
{
    /**
     * Returns {@code true} if this list contains no tweets.
     *
     * @return {@code true} if this list contains no tweets
     */
    boolean isEmpty();

    /**
     * Returns the first tweet in the list.
     *
     * @return the first tweet in the list
     * @throws NoSuchElementException if the list is empty
     */
    Tweet head();

    /**
     * Returns remaining tweets in the list.
     *
     * @return remaining tweets in the list
     * @throws NoSuchElementException if the list is empty
     */
    TweetList tail();

    // Constructors

    /**
     * Construct an empty list.
     *
     * @return the empty list
     */
    static TweetList nil() {
        return TweetListImpl.nil();
    }

    /**
     * Construct a list with head and tail.
     *
     * @param head the first tweet in the list
     * @param tail the remaining tweets in the list
     * @return the list that concatenate from head and tail
     */
    static TweetList cons(Tweet head, TweetList tail) {
        return TweetListImpl.cons(head, tail);
    }

    /**
     * Construct a list with given tweets.
     */
    static TweetList of(Tweet... tweets) {
        TweetList res = nil();
        for (int i = tweets.length; --i >= 0; ) {
            res = cons(tweets[i], res);
        }
        return res;
    }

    // Traversal

    /**
     * Performs the given action for each tweet of the list, from front
     * to back.
     *
     * @param action the action to be performed for each tweet
     */
    default void foreach(Consumer<? super Tweet> action) {
        for (TweetList xs = this; !xs.isEmpty(); xs = xs.tail()) {
            action.accept(xs.head());
        }
    }

    @Override
    default void forEach(Consumer<? super Tweet> action) {
        foreach(action);
    }

    @Override
    default Iterator<Tweet> iterator() {
        return new Iterator<Tweet>() {
            TweetList current = TweetList.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public Tweet next() {
                if (current.isEmpty())
                    throw new NoSuchElementException();
                Tweet res = current.head();
                current = current.tail();
                return res;
            }
        };
    }

    /**
     * Returns the number of tweets in this list.
     */
    default int size() {
        int n = 0;
        for (TweetList xs = this; !xs.isEmpty(); xs = xs.tail()) {
            n++;
        }
        return n;
    }

    /**
     * Copy tweets of this list into an immutable {@code java.util.List}.
     */
    default ImmutableList<Tweet> toList() {
        return ImmutableList.copyOf(this);
    }
}
