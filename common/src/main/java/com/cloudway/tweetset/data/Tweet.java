/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.data;

import java.io.Serializable;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;

/**
 * A tweet. Tweets are identified and ordered by their text only, so two
 * tweets with the same text from different users are considered equal.
 */
public final class Tweet implements Comparable<Tweet>, Serializable
{
    private static final long serialVersionUID = 2634176290414758931L;

    private final String user;
    private final String text;
    private final int retweets;

    /**
     * Construct a tweet.
     *
     * @param user the author of the tweet
     * @param text the message text, used as the tweet identity
     * @param retweets the number of retweets, must not be negative
     * @throws IllegalArgumentException if {@code retweets} is negative
     */
    public Tweet(String user, String text, int retweets) {
        Preconditions.checkArgument(retweets >= 0, "negative retweets: %s", retweets);
        this.user = requireNonNull(user, "user");
        this.text = requireNonNull(text, "text");
        this.retweets = retweets;
    }

    public String getUser() {
        return user;
    }

    public String getText() {
        return text;
    }

    public int getRetweets() {
        return retweets;
    }

    /**
     * Compares two tweets by their text.
     */
    @Override
    public int compareTo(Tweet other) {
        return text.compareTo(other.text);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Tweet))
            return false;
        return text.equals(((Tweet)obj).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    public String toString() {
        return "User: " + user + "\n" +
               "Text: " + text + " [" + retweets + "]";
    }
}
