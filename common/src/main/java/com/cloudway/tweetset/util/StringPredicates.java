/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.util;

import java.util.function.Predicate;

import com.google.common.collect.ImmutableList;

public final class StringPredicates
{
    private StringPredicates() {}

    /**
     * Returns a predicate that tests whether a string contains any of the
     * given keywords. The predicate never matches if no keyword is given.
     */
    public static Predicate<String> containsAny(Iterable<? extends CharSequence> keywords) {
        ImmutableList<CharSequence> ks = ImmutableList.copyOf(keywords);
        return s -> {
            for (CharSequence k : ks) {
                if (s.contains(k)) {
                    return true;
                }
            }
            return false;
        };
    }

    public static boolean isBlank(CharSequence str) {
        int len;
        if (str == null || (len = str.length()) == 0) {
            return true;
        }
        for (int i = 0; i < len; i++) {
            if (!Character.isWhitespace(str.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
