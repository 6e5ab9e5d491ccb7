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
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import com.cloudway.tweetset.util.StringPredicates;

/**
 * The trending configuration. Values are read from a properties file and
 * can be overridden by system properties with the same name.
 */
public class Config
{
    public static final String CONF_FILE_KEY = "tweetset.conf";
    public static final String DEFAULT_CONF_RESOURCE = "tweetset.properties";

    public static final String SOURCES_KEY = "sources";
    public static final String DATA_DIR_KEY = "data.dir";
    public static final String TOPICS_KEY = "topics";
    public static final String TOPIC_KEY_PREFIX = "topic.";

    private static final Splitter LIST_SPLITTER =
        Splitter.on(',').trimResults().omitEmptyStrings();

    private final Properties conf;

    /**
     * Returns the default configuration. The configuration file is named
     * by the {@code tweetset.conf} system property, otherwise the
     * {@code tweetset.properties} resource on the class path is used.
     */
    public static Config getDefault() throws IOException {
        String file = System.getProperty(CONF_FILE_KEY);
        return file != null ? load(Paths.get(file)) : loadResource(DEFAULT_CONF_RESOURCE);
    }

    public static Config load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(requireNonNull(path))) {
            return load(in);
        }
    }

    public static Config loadResource(String name) throws IOException {
        InputStream in = Config.class.getClassLoader().getResourceAsStream(name);
        if (in == null) {
            throw new FileNotFoundException(name + ": configuration resource not found");
        }
        try {
            return load(in);
        } finally {
            in.close();
        }
    }

    public static Config load(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(in);
        return new Config(props);
    }

    public Config(Properties conf) {
        this.conf = requireNonNull(conf);
    }

    public Optional<String> get(String name) {
        String val = System.getProperty(name);
        if (StringPredicates.isBlank(val))
            val = conf.getProperty(name);
        return StringPredicates.isBlank(val) ? Optional.empty() : Optional.of(val.trim());
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    /**
     * @throws NumberFormatException if the value is not an integer
     */
    public int getInt(String name, int deflt) {
        return get(name).map(Integer::parseInt).orElse(deflt);
    }

    /**
     * Returns a comma separated list value, or an empty list if the value
     * is absent.
     */
    public ImmutableList<String> getList(String name) {
        return get(name).map(v -> ImmutableList.copyOf(LIST_SPLITTER.split(v)))
                        .orElse(ImmutableList.of());
    }

    public ImmutableList<String> getSources() {
        return getList(SOURCES_KEY);
    }

    public Optional<Path> getDataDir() {
        return get(DATA_DIR_KEY).map(Paths::get);
    }

    /**
     * Returns the topics configured by the {@code topics} key, each with
     * keywords from the corresponding {@code topic.<name>} key.
     */
    public ImmutableList<Topic> getTopics() {
        ImmutableList.Builder<Topic> topics = ImmutableList.builder();
        for (String name : getList(TOPICS_KEY)) {
            topics.add(new Topic(name, getList(TOPIC_KEY_PREFIX + name)));
        }
        return topics.build();
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add(SOURCES_KEY, getSources())
            .add(DATA_DIR_KEY, getDataDir().orElse(null))
            .add(TOPICS_KEY, getTopics())
            .toString();
    }
}
