/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.trending;

import java.io.IOException;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;

import com.cloudway.tweetset.data.Tweet;
import com.cloudway.tweetset.data.TweetList;
import com.cloudway.tweetset.data.TweetSet;
import com.cloudway.tweetset.util.RuntimeIOException;

/**
 * Classifies tweets from a number of sources by topics. All aggregates
 * are computed on first use and reused afterwards.
 */
public class TrendingTopics
{
    private static final Logger logger = Logger.getLogger(TrendingTopics.class.getName());
    static {
        if (System.getenv("TWEETSET_DEBUG") != null) {
            logger.setLevel(Level.FINE);
        }
    }

    private final ImmutableMap<String, Topic> topics;
    private final Supplier<ImmutableList<TweetSet>> sourceSets;
    private final Supplier<TweetSet> allTweets;
    private final Supplier<TweetList> trending;

    private final LoadingCache<String, TweetSet> topicTweets =
        CacheBuilder.newBuilder().build(new CacheLoader<String, TweetSet>() {
            @Override
            public TweetSet load(String name) {
                return collect(getTopic(name).mentions());
            }
        });

    public TrendingTopics(TweetReader reader, List<String> sources, List<Topic> topics) {
        requireNonNull(reader);
        ImmutableList<String> names = ImmutableList.copyOf(sources);

        ImmutableMap.Builder<String, Topic> builder = ImmutableMap.builder();
        topics.forEach(t -> builder.put(t.getName(), t));
        this.topics = builder.build();

        this.sourceSets = Suppliers.memoize(() -> load(reader, names));
        this.allTweets = Suppliers.memoize(() -> collect(t -> true));
        this.trending = Suppliers.memoize(this::computeTrending);
    }

    public static TrendingTopics fromConfig(Config config) {
        return new TrendingTopics(new TweetReader(config.getDataDir()),
                                  config.getSources(),
                                  config.getTopics());
    }

    private static ImmutableList<TweetSet> load(TweetReader reader, List<String> sources) {
        ImmutableList.Builder<TweetSet> sets = ImmutableList.builder();
        for (String name : sources) {
            try {
                sets.add(reader.readSource(name));
            } catch (IOException ex) {
                throw new RuntimeIOException(ex);
            }
        }
        return sets.build();
    }

    public ImmutableList<Topic> getTopics() {
        return topics.values().asList();
    }

    public Topic getTopic(String name) {
        Topic topic = topics.get(name);
        if (topic == null) {
            throw new IllegalArgumentException("unknown topic: " + name);
        }
        return topic;
    }

    /**
     * Returns the tweets from every source.
     *
     * @throws RuntimeIOException if a source cannot be read
     */
    public TweetSet allTweets() {
        return allTweets.get();
    }

    /**
     * Returns the tweets from every source that mention the named topic.
     *
     * @throws IllegalArgumentException if the topic is not known
     * @throws RuntimeIOException if a source cannot be read
     */
    public TweetSet tweetsFor(String topic) {
        try {
            return topicTweets.getUnchecked(topic);
        } catch (UncheckedExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException)
                throw (RuntimeException)ex.getCause();
            throw ex;
        }
    }

    /**
     * Returns the tweets mentioning any topic, sorted by retweets in
     * descending order.
     *
     * @throws RuntimeIOException if a source cannot be read
     */
    public TweetList trending() {
        return trending.get();
    }

    /**
     * Returns the most retweeted tweet over all sources.
     *
     * @throws java.util.NoSuchElementException if there is no tweet at all
     */
    public Tweet mostRetweeted() {
        return allTweets().mostRetweeted();
    }

    private TweetSet collect(Predicate<? super Tweet> p) {
        ImmutableList<TweetSet> sets = sourceSets.get();
        TweetSet res = TweetSet.empty();
        for (int i = sets.size(); --i >= 0; ) {
            res = sets.get(i).filter(p).union(res);
        }
        return res;
    }

    private TweetList computeTrending() {
        TweetSet res = TweetSet.empty();
        for (Topic topic : topics.values()) {
            TweetSet ts = tweetsFor(topic.getName());
            logger.fine("Topic " + topic.getName() + " mentioned by " + ts.size() + " tweets");
            res = res.union(ts);
        }
        return res.descendingByRetweet();
    }
}
