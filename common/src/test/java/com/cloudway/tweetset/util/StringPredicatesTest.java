/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.function.Predicate;

import org.junit.Test;
import static org.junit.Assert.*;

public class StringPredicatesTest
{
    @Test
    public void containsAny() {
        Predicate<String> p = StringPredicates.containsAny(Arrays.asList("iphone", "iPad"));
        assertTrue(p.test("my new iPad"));
        assertTrue(p.test("iphone and android"));
        assertFalse(p.test("IPHONE"));
        assertFalse(p.test(""));
    }

    @Test
    public void containsAnyWithoutKeywords() {
        Predicate<String> p = StringPredicates.containsAny(Collections.emptyList());
        assertFalse(p.test("anything"));
    }

    @Test
    public void isBlank() {
        assertTrue(StringPredicates.isBlank(null));
        assertTrue(StringPredicates.isBlank(""));
        assertTrue(StringPredicates.isBlank(" \t\n"));
        assertFalse(StringPredicates.isBlank(" x "));
    }
}
