/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.trending;

import java.util.List;
import java.util.function.Predicate;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import com.cloudway.tweetset.data.Tweet;
import com.cloudway.tweetset.util.StringPredicates;

/**
 * A named list of keywords. A tweet mentions the topic if its text
 * contains any of the keywords.
 */
public final class Topic
{
    private final String name;
    private final ImmutableList<String> keywords;
    private final Predicate<String> matcher;

    public Topic(String name, List<String> keywords) {
        Preconditions.checkArgument(!StringPredicates.isBlank(name), "blank topic name");
        this.name = name;
        this.keywords = ImmutableList.copyOf(requireNonNull(keywords));
        this.matcher = StringPredicates.containsAny(this.keywords);
    }

    public String getName() {
        return name;
    }

    public ImmutableList<String> getKeywords() {
        return keywords;
    }

    public boolean isMentionedBy(Tweet tweet) {
        return matcher.test(tweet.getText());
    }

    public Predicate<Tweet> mentions() {
        return this::isMentionedBy;
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("name", name)
            .add("keywords", keywords)
            .toString();
    }
}
