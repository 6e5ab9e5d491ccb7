/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package tweetset;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Comparator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import com.google.common.base.Preconditions;

import com.cloudway.tweetset.data.TweetList;
import com.cloudway.tweetset.trending.Config;
import com.cloudway.tweetset.trending.TrendingTopics;

/**
 * Entry point for tweet trending commands.
 */
public class Control
{
    private static final Logger logger = Logger.getLogger(Control.class.getName());

    public static final String TOP_LIMIT_KEY = "top.limit";
    private static final int DEFAULT_TOP_LIMIT = 10;

    private final Config config;
    private final TrendingTopics topics;
    private final PrintStream out;
    private final PrintStream err;

    public Control(Config config, TrendingTopics topics, PrintStream out, PrintStream err) {
        this.config = config;
        this.topics = topics;
        this.out = out;
        this.err = err;
    }

    public static void main(String args[]) {
        Control control;
        try {
            Config config = Config.getDefault();
            control = new Control(config, TrendingTopics.fromConfig(config), System.out, System.err);
        } catch (Exception ex) {
            System.err.println("command failure: " + ex);
            System.exit(2);
            return;
        }

        int status = control.run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run the command given by the first argument.
     *
     * @return 0 on success, 1 if the command is invalid, 2 if the command failed
     */
    public int run(String[] args) {
        Method action = getActionMethod(getClass(), args);
        if (action == null) {
            err.println("invalid command. Use \"tweetset help\" for more information");
            return 1;
        }

        Throwable failure = null;
        try {
            Object[] arguments = new Object[1];
            arguments[0] = Arrays.copyOfRange(args, 1, args.length);
            action.invoke(this, arguments);
        } catch (InvocationTargetException ex) {
            failure = ex.getCause();
        } catch (Exception ex) {
            failure = ex;
        }

        if (failure != null) {
            logger.log(Level.FINE, "Command " + args[0] + " failed", failure);
            if (failure.getMessage() != null) {
                err.println("command failure: " + failure);
            } else {
                err.println("command failure");
                failure.printStackTrace(err);
            }
            return 2;
        }
        return 0;
    }

    private static Method getActionMethod(Class<? extends Control> cls, String[] args) {
        if (args.length == 0)
            return null;

        String command = args[0].replaceAll("-", "_");
        return Stream.of(cls.getMethods())
            .filter(m -> m.getName().equals(command))
            .filter(m -> m.isAnnotationPresent(Command.class))
            .filter(m -> Arrays.equals(m.getParameterTypes(), new Class<?>[] { String[].class }))
            .findFirst()
            .orElse(null);
    }

    @Command("Show this help message")
    public void help(String[] args) {
        err.println("Usage: tweetset COMMAND [ARGS...]");
        err.println();
        err.println("COMMANDS:");
        err.println();
        Stream.of(this.getClass().getMethods())
            .sorted(Comparator.comparing(Method::getName))
            .forEach(m -> {
                Command description = m.getAnnotation(Command.class);
                if (description != null) {
                    err.printf("  %-16s%s%n", m.getName().replace('_', '-'), description.value());
                }
            });
        err.println();
    }

    @Command("Print tweets mentioning any topic, most retweeted first")
    public void trending(String[] args) {
        print(topics.trending(), Integer.MAX_VALUE);
    }

    @Command("Print the first N trending tweets")
    public void top(String[] args) {
        int limit = args.length > 0
            ? Integer.parseInt(args[0])
            : config.getInt(TOP_LIMIT_KEY, DEFAULT_TOP_LIMIT);
        Preconditions.checkArgument(limit >= 0, "negative limit: %s", limit);
        print(topics.trending(), limit);
    }

    @Command("Print tweets mentioning the given topic, most retweeted first")
    public void topic(String[] args) {
        Preconditions.checkArgument(args.length == 1, "usage: tweetset topic NAME");
        print(topics.tweetsFor(args[0]).descendingByRetweet(), Integer.MAX_VALUE);
    }

    @Command("Print the most retweeted tweet of all sources")
    public void most_retweeted(String[] args) {
        out.println(topics.mostRetweeted());
    }

    private void print(TweetList tweets, int limit) {
        int n = 0;
        for (TweetList xs = tweets; !xs.isEmpty() && n < limit; xs = xs.tail(), n++) {
            out.println(xs.head());
        }
    }
}
