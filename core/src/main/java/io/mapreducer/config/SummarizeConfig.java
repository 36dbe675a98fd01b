package io.mapreducer.config;

import io.mapreducer.core.TokenEncoding;
import io.mapreducer.error.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Run parameters. Every value is required; {@link #validate()} rejects out-of-range values
 * before a run starts.
 *
 * <p>Layering for {@link #load(Path, Map)}, lowest precedence first: classpath
 * {@value #DEFAULTS_RESOURCE}, the optional user properties file, environment variables
 * ({@code MAPREDUCER_TOKENS_PER_MINUTE}), JVM system properties ({@code mapreducer.tokensPerMinute}),
 * then explicit overrides.
 */
public record SummarizeConfig(
        long tokensPerMinute,
        int requestsPerMinute,
        int queueConcurrency,
        long queueIntervalMs,
        long tokenBudgetWindowMs,
        long tokenBudgetTimeoutMs,
        long budgetPollIntervalMs,
        int mapOutputMaxTokens,
        int reduceOutputMaxTokens,
        int hierarchyGroupSize,
        double temperature,
        int chunkTokens,
        int chunkOverlapTokens,
        TokenEncoding encoding,
        int maxRetries,
        long runTimeoutMs
) {
    public static final String DEFAULTS_RESOURCE = "mapreducer-defaults.properties";
    public static final String ENV_PREFIX = "MAPREDUCER_";
    public static final String SYSPROP_PREFIX = "mapreducer.";

    public static final String TOKENS_PER_MINUTE = "tokensPerMinute";
    public static final String REQUESTS_PER_MINUTE = "requestsPerMinute";
    public static final String QUEUE_CONCURRENCY = "queueConcurrency";
    public static final String QUEUE_INTERVAL_MS = "queueIntervalMs";
    public static final String TOKEN_BUDGET_WINDOW_MS = "tokenBudgetWindowMs";
    public static final String TOKEN_BUDGET_TIMEOUT_MS = "tokenBudgetTimeoutMs";
    public static final String BUDGET_POLL_INTERVAL_MS = "budgetPollIntervalMs";
    public static final String MAP_OUTPUT_MAX_TOKENS = "mapOutputMaxTokens";
    public static final String REDUCE_OUTPUT_MAX_TOKENS = "reduceOutputMaxTokens";
    public static final String HIERARCHY_GROUP_SIZE = "hierarchyGroupSize";
    public static final String TEMPERATURE = "temperature";
    public static final String CHUNK_TOKENS = "chunkTokens";
    public static final String CHUNK_OVERLAP_TOKENS = "chunkOverlapTokens";
    public static final String ENCODING = "encoding";
    public static final String MAX_RETRIES = "maxRetries";
    public static final String RUN_TIMEOUT_MS = "runTimeoutMs";

    public static final List<String> KEYS = List.of(
            TOKENS_PER_MINUTE, REQUESTS_PER_MINUTE, QUEUE_CONCURRENCY, QUEUE_INTERVAL_MS,
            TOKEN_BUDGET_WINDOW_MS, TOKEN_BUDGET_TIMEOUT_MS, BUDGET_POLL_INTERVAL_MS,
            MAP_OUTPUT_MAX_TOKENS, REDUCE_OUTPUT_MAX_TOKENS, HIERARCHY_GROUP_SIZE, TEMPERATURE,
            CHUNK_TOKENS, CHUNK_OVERLAP_TOKENS, ENCODING, MAX_RETRIES, RUN_TIMEOUT_MS);

    public SummarizeConfig validate() throws ConfigurationException {
        positive(TOKENS_PER_MINUTE, tokensPerMinute);
        positive(REQUESTS_PER_MINUTE, requestsPerMinute);
        positive(QUEUE_CONCURRENCY, queueConcurrency);
        positive(QUEUE_INTERVAL_MS, queueIntervalMs);
        positive(TOKEN_BUDGET_WINDOW_MS, tokenBudgetWindowMs);
        positive(TOKEN_BUDGET_TIMEOUT_MS, tokenBudgetTimeoutMs);
        positive(BUDGET_POLL_INTERVAL_MS, budgetPollIntervalMs);
        positive(MAP_OUTPUT_MAX_TOKENS, mapOutputMaxTokens);
        positive(REDUCE_OUTPUT_MAX_TOKENS, reduceOutputMaxTokens);
        positive(HIERARCHY_GROUP_SIZE, hierarchyGroupSize);
        positive(CHUNK_TOKENS, chunkTokens);
        if (Double.isNaN(temperature) || temperature < 0 || temperature > 2) {
            throw new ConfigurationException(TEMPERATURE, "temperature must be between 0 and 2, was " + temperature);
        }
        if (chunkOverlapTokens < 0) {
            throw new ConfigurationException(CHUNK_OVERLAP_TOKENS, "chunkOverlapTokens must be greater than or equal to 0");
        }
        if (chunkOverlapTokens >= chunkTokens) {
            throw new ConfigurationException(CHUNK_OVERLAP_TOKENS,
                    "chunkOverlapTokens (" + chunkOverlapTokens + ") must be smaller than chunkTokens (" + chunkTokens + ")");
        }
        if (encoding == null) throw new ConfigurationException(ENCODING, "encoding is required but not provided");
        if (maxRetries < 0) throw new ConfigurationException(MAX_RETRIES, "maxRetries must be greater than or equal to 0");
        if (runTimeoutMs < 0) throw new ConfigurationException(RUN_TIMEOUT_MS, "runTimeoutMs must be greater than or equal to 0");
        return this;
    }

    /** Reads every key from {@code props}; a missing or unparsable key is a configuration error. */
    public static SummarizeConfig fromProperties(Properties props) throws ConfigurationException {
        return new SummarizeConfig(
                requireLong(props, TOKENS_PER_MINUTE),
                requireInt(props, REQUESTS_PER_MINUTE),
                requireInt(props, QUEUE_CONCURRENCY),
                requireLong(props, QUEUE_INTERVAL_MS),
                requireLong(props, TOKEN_BUDGET_WINDOW_MS),
                requireLong(props, TOKEN_BUDGET_TIMEOUT_MS),
                requireLong(props, BUDGET_POLL_INTERVAL_MS),
                requireInt(props, MAP_OUTPUT_MAX_TOKENS),
                requireInt(props, REDUCE_OUTPUT_MAX_TOKENS),
                requireInt(props, HIERARCHY_GROUP_SIZE),
                requireDouble(props, TEMPERATURE),
                requireInt(props, CHUNK_TOKENS),
                requireInt(props, CHUNK_OVERLAP_TOKENS),
                requireEncoding(props),
                requireInt(props, MAX_RETRIES),
                requireLong(props, RUN_TIMEOUT_MS)
        ).validate();
    }

    public static SummarizeConfig defaults() throws ConfigurationException {
        return fromProperties(loadDefaults());
    }

    public static SummarizeConfig load(Path userFile, Map<String, String> overrides) throws ConfigurationException {
        Properties merged = loadDefaults();
        if (userFile != null) {
            try (Reader r = Files.newBufferedReader(userFile, StandardCharsets.UTF_8)) {
                Properties user = new Properties();
                user.load(r);
                merged.putAll(user);
            } catch (IOException e) {
                throw new ConfigurationException(null, "Cannot read configuration file " + userFile + ": " + e.getMessage(), e);
            }
        }
        Map<String, String> env = System.getenv();
        for (String key : KEYS) {
            String fromEnv = env.get(envName(key));
            if (fromEnv != null && !fromEnv.isBlank()) merged.setProperty(key, fromEnv.trim());
            String fromSys = System.getProperty(SYSPROP_PREFIX + key);
            if (fromSys != null && !fromSys.isBlank()) merged.setProperty(key, fromSys.trim());
        }
        if (overrides != null) {
            overrides.forEach((k, v) -> { if (v != null) merged.setProperty(k, v); });
        }
        return fromProperties(merged);
    }

    /** Copy with the given keys replaced; the result is validated again. */
    public SummarizeConfig with(Map<String, String> overrides) throws ConfigurationException {
        Properties p = toProperties();
        overrides.forEach(p::setProperty);
        return fromProperties(p);
    }

    public Properties toProperties() {
        Properties p = new Properties();
        p.setProperty(TOKENS_PER_MINUTE, Long.toString(tokensPerMinute));
        p.setProperty(REQUESTS_PER_MINUTE, Integer.toString(requestsPerMinute));
        p.setProperty(QUEUE_CONCURRENCY, Integer.toString(queueConcurrency));
        p.setProperty(QUEUE_INTERVAL_MS, Long.toString(queueIntervalMs));
        p.setProperty(TOKEN_BUDGET_WINDOW_MS, Long.toString(tokenBudgetWindowMs));
        p.setProperty(TOKEN_BUDGET_TIMEOUT_MS, Long.toString(tokenBudgetTimeoutMs));
        p.setProperty(BUDGET_POLL_INTERVAL_MS, Long.toString(budgetPollIntervalMs));
        p.setProperty(MAP_OUTPUT_MAX_TOKENS, Integer.toString(mapOutputMaxTokens));
        p.setProperty(REDUCE_OUTPUT_MAX_TOKENS, Integer.toString(reduceOutputMaxTokens));
        p.setProperty(HIERARCHY_GROUP_SIZE, Integer.toString(hierarchyGroupSize));
        p.setProperty(TEMPERATURE, Double.toString(temperature));
        p.setProperty(CHUNK_TOKENS, Integer.toString(chunkTokens));
        p.setProperty(CHUNK_OVERLAP_TOKENS, Integer.toString(chunkOverlapTokens));
        p.setProperty(ENCODING, encoding == null ? "" : encoding.id());
        p.setProperty(MAX_RETRIES, Integer.toString(maxRetries));
        p.setProperty(RUN_TIMEOUT_MS, Long.toString(runTimeoutMs));
        return p;
    }

    static String envName(String key) {
        StringBuilder sb = new StringBuilder(ENV_PREFIX);
        for (char c : key.toCharArray()) {
            if (Character.isUpperCase(c)) sb.append('_');
            sb.append(Character.toUpperCase(c));
        }
        return sb.toString();
    }

    static Properties loadDefaults() throws ConfigurationException {
        Properties p = new Properties();
        try (InputStream in = SummarizeConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new ConfigurationException(null, "Missing classpath resource " + DEFAULTS_RESOURCE);
            p.load(in);
        } catch (IOException e) {
            throw new ConfigurationException(null, "Cannot read " + DEFAULTS_RESOURCE + ": " + e.getMessage(), e);
        }
        return p;
    }

    private static String require(Properties props, String key) throws ConfigurationException {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) throw new ConfigurationException(key, key + " is required but not provided");
        return v.trim();
    }

    private static long requireLong(Properties props, String key) throws ConfigurationException {
        String v = require(props, key);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, key + " must be an integer, was '" + v + "'", e);
        }
    }

    private static int requireInt(Properties props, String key) throws ConfigurationException {
        String v = require(props, key);
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, key + " must be an integer, was '" + v + "'", e);
        }
    }

    private static double requireDouble(Properties props, String key) throws ConfigurationException {
        String v = require(props, key);
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key, key + " must be a number, was '" + v + "'", e);
        }
    }

    private static TokenEncoding requireEncoding(Properties props) throws ConfigurationException {
        String v = require(props, ENCODING);
        try {
            return TokenEncoding.fromId(v.toLowerCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ENCODING, e.getMessage(), e);
        }
    }

    private static void positive(String key, long value) throws ConfigurationException {
        if (value <= 0) throw new ConfigurationException(key, key + " is required and must be greater than 0, was " + value);
    }
}
