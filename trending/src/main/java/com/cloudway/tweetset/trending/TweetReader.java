/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.tweetset.trending;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import org.codehaus.jackson.JsonProcessingException;
import org.codehaus.jackson.annotate.JsonIgnoreProperties;
import org.codehaus.jackson.annotate.JsonProperty;
import org.codehaus.jackson.map.ObjectMapper;
import org.codehaus.jackson.type.TypeReference;

import com.cloudway.tweetset.data.Tweet;
import com.cloudway.tweetset.data.TweetSet;

/**
 * Reads tweets from JSON data. The data is an array of objects each
 * having the {@code user}, {@code text} and {@code retweets} fields.
 */
public class TweetReader
{
    private static final Logger logger = Logger.getLogger(TweetReader.class.getName());
    static {
        if (System.getenv("TWEETSET_DEBUG") != null) {
            logger.setLevel(Level.FINE);
        }
    }

    public static final String RESOURCE_DIR = "tweets/";
    public static final String EXTENSION = ".json";

    private static final TypeReference<List<TweetData>> TWEET_LIST_TYPE =
        new TypeReference<List<TweetData>>() {};

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TweetData {
        @JsonProperty String user;
        @JsonProperty String text;
        @JsonProperty Double retweets;
    }

    private final ObjectMapper mapper = new ObjectMapper();
    private final Optional<Path> dataDir;

    /**
     * Create a reader that loads named sources from the class path.
     */
    public TweetReader() {
        this(Optional.empty());
    }

    /**
     * Create a reader that loads named sources from the given directory
     * if present, otherwise from the class path.
     */
    public TweetReader(Optional<Path> dataDir) {
        this.dataDir = requireNonNull(dataDir);
    }

    /**
     * Read the named source, either {@code <name>.json} in the data
     * directory or {@code tweets/<name>.json} on the class path.
     *
     * @param name the source name
     * @return the set of tweets in the source
     * @throws IOException if the source cannot be read or is malformed
     */
    public TweetSet readSource(String name) throws IOException {
        requireNonNull(name);
        if (dataDir.isPresent()) {
            return read(dataDir.get().resolve(name + EXTENSION));
        } else {
            return readResource(RESOURCE_DIR + name + EXTENSION);
        }
    }

    public TweetSet readResource(String resource) throws IOException {
        InputStream in = TweetReader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new FileNotFoundException(resource + ": resource not found");
        }
        try {
            return read(in, resource);
        } finally {
            in.close();
        }
    }

    public TweetSet read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        }
    }

    /**
     * Read tweets from the given stream and include them into a set in
     * the order they appear. Tweets with a text already seen are dropped.
     *
     * @param in the input stream
     * @param source the source name used in error messages
     * @return the set of tweets
     * @throws IOException if the stream cannot be read or is malformed
     */
    public TweetSet read(InputStream in, String source) throws IOException {
        List<TweetData> data;
        try {
            data = mapper.readValue(in, TWEET_LIST_TYPE);
        } catch (JsonProcessingException ex) {
            throw new IOException(source + ": malformed tweet data", ex);
        }

        TweetSet res = TweetSet.empty();
        if (data != null) {
            for (TweetData d : data) {
                res = res.incl(toTweet(d, source));
            }
        }

        logger.fine("Read " + res.size() + " tweets from " + source);
        return res;
    }

    private static Tweet toTweet(TweetData d, String source) throws IOException {
        if (d == null || d.user == null || d.text == null) {
            throw new IOException(source + ": tweet without user or text");
        }
        int retweets = d.retweets == null ? 0 : d.retweets.intValue();
        if (retweets < 0) {
            throw new IOException(source + ": negative retweets for \"" + d.text + "\"");
        }
        return new Tweet(d.user, d.text, retweets);
    }
}
