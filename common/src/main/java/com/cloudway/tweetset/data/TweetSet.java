/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.data;

import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A persistent set of tweets represented as a binary search tree. Every
 * branch in the tree has two children. For every branch {@code b}, all
 * tweets in the left subtree have a text smaller than the text of the
 * tweet at {@code b}, and all tweets in the right subtree a larger one.
 *
 * <p>The tree is not balanced. Modification operations never change an
 * existing set, they return a new set that shares the unchanged subtrees
 * with the original one.</p>
 */
public interface TweetSet extends Iterable<Tweet>
{
    /**
     * Returns the empty set.
     *
     * @return the empty set
     */
    static TweetSet empty() {
        return TweetSetImpl.empty();
    }

    /**
     * Construct a set with given tweets, inserted in the given order.
     */
    static TweetSet of(Tweet... tweets) {
        TweetSet res = empty();
        for (Tweet t : tweets) {
            res = res.incl(t);
        }
        return res;
    }

    /**
     * Construct a set with tweets from the given iterable, inserted in
     * iteration order.
     */
    static TweetSet fromIterable(Iterable<? extends Tweet> tweets) {
        TweetSet res = empty();
        for (Tweet t : tweets) {
            res = res.incl(t);
        }
        return res;
    }

    // Query Operations

    /**
     * Returns {@code true} if this set contains no tweets.
     *
     * @return {@code true} if this set contains no tweets
     */
    boolean isEmpty();

    /**
     * Returns the number of tweets in this set.
     *
     * @return the number of tweets in this set
     */
    int size();

    /**
     * Returns {@code true} if this set contains a tweet with the same text
     * as the given tweet.
     *
     * @param tweet tweet whose presence in this set is to be tested
     * @return {@code true} if this set contains the specified tweet
     */
    boolean contains(Tweet tweet);

    /**
     * Returns the tweet with the greatest number of retweets. If several
     * tweets share the greatest number, the one with the smallest text
     * is returned.
     *
     * @return the most retweeted tweet in this set
     * @throws java.util.NoSuchElementException if this set is empty
     */
    Tweet mostRetweeted();

    // Modification Operations

    /**
     * Returns a new set containing the tweets of this set and the given
     * tweet. If this set already contains a tweet with the same text then
     * this set is returned unchanged.
     *
     * @param tweet the tweet to be included
     * @return the set including the given tweet
     */
    TweetSet incl(Tweet tweet);

    /**
     * Returns a new set without the tweet that has the same text as the
     * given tweet. The children of the removed branch are merged by union.
     *
     * @param tweet the tweet to be removed
     * @return the set excluding the given tweet
     */
    TweetSet remove(Tweet tweet);

    /**
     * Returns a set consisting of the tweets of this set that match the
     * given predicate.
     *
     * @param p a predicate to apply to each tweet to determine if it
     * should be included
     * @return the filtered set
     */
    default TweetSet filter(Predicate<? super Tweet> p) {
        return filterAcc(p, empty());
    }

    /**
     * Includes the tweets of this set that match the given predicate into
     * the accumulator. The left subtree is visited first, then the tweet at
     * the branch, then the right subtree.
     *
     * @param p the predicate to match
     * @param acc the accumulated result
     * @return the accumulated result including matching tweets
     */
    TweetSet filterAcc(Predicate<? super Tweet> p, TweetSet acc);

    /**
     * Returns a set containing all tweets in this set and in the given set.
     * When both sets contain a tweet with the same text, the tweet from the
     * given set is retained.
     *
     * @param that the set to be union with this set
     * @return the union of two sets
     */
    TweetSet union(TweetSet that);

    /**
     * Returns a list of all tweets in this set, ordered by retweets in
     * descending order.
     *
     * @return the sorted list of tweets
     */
    TweetList descendingByRetweet();

    // Traversal

    /**
     * Performs the given action for each tweet in the set, in ascending
     * order of text.
     *
     * @param action the action to be performed for each tweet
     */
    void foreach(Consumer<? super Tweet> action);

    @Override
    default void forEach(Consumer<? super Tweet> action) {
        foreach(action);
    }

    /**
     * Returns a sequential {@code Stream} with this set as its source.
     *
     * @return a sequential {@code Stream} over the tweets in this set
     */
    default Stream<Tweet> stream() {
        return StreamSupport.stream(spliterator(), false);
    }
}
