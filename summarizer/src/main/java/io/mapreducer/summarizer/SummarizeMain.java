package io.mapreducer.summarizer;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.mapreducer.config.SummarizeConfig;
import io.mapreducer.core.Segment;
import io.mapreducer.core.SegmentSource;
import io.mapreducer.error.ConfigurationException;
import io.mapreducer.error.SummarizationException;
import io.mapreducer.metrics.Metrics;
import io.mapreducer.runtime.MapReduceOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * CLI that summarizes one or more input files with a map-reduce pass over a chat model.
 */
@CommandLine.Command(name = "mapreduce-summarize", mixinStandardHelpOptions = true,
        description = "Hierarchical map-reduce summarization under TPM/RPM limits")
public final class SummarizeMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(SummarizeMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-i", "--input"}, required = true, description = "Input file (repeat for several); JSON is re-serialized compactly")
    List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--out"}, description = "Write the summary here instead of stdout")
    Path out;

    @CommandLine.Option(names = "--json", description = "Emit {\"summary\": ...} instead of plain text")
    boolean json;

    @CommandLine.Option(names = "--endpoint", description = "Chat API base URL (Azure: the deployment URL)", defaultValue = "https://api.openai.com/v1")
    URI endpoint;

    @CommandLine.Option(names = "--model", description = "Model name", defaultValue = ModelSettings.DEFAULT_MODEL)
    String model;

    @CommandLine.Option(names = "--api-key", description = "API key (default: $OPENAI_API_KEY)", defaultValue = "${env:OPENAI_API_KEY}")
    String apiKey;

    @CommandLine.Option(names = "--azure", description = "Use Azure OpenAI authentication and URL layout")
    boolean azure;

    @CommandLine.Option(names = "--request-timeout", description = "Per-request HTTP timeout in seconds", defaultValue = "300")
    long requestTimeoutSeconds;

    @CommandLine.Option(names = "--map-prompt", description = "Map prompt template file containing {text}")
    Path mapPrompt;

    @CommandLine.Option(names = "--combine-prompt", description = "Combine prompt template file containing {text}")
    Path combinePrompt;

    @CommandLine.Option(names = {"-c", "--config"}, description = "Properties file with run settings")
    Path configFile;

    @CommandLine.Option(names = "--tpm", description = "Tokens per minute")
    Long tokensPerMinute;

    @CommandLine.Option(names = "--rpm", description = "Requests per minute")
    Integer requestsPerMinute;

    @CommandLine.Option(names = "--concurrency", description = "Concurrent model calls")
    Integer concurrency;

    @CommandLine.Option(names = "--group-size", description = "Hierarchy group size for the reduce phase")
    Integer groupSize;

    @CommandLine.Option(names = "--temperature", description = "Sampling temperature")
    Double temperature;

    @CommandLine.Option(names = "--encoding", description = "Token encoding: o200k or cl100k")
    String encoding;

    @CommandLine.Option(names = "--map-out", description = "Max output tokens per map call")
    Integer mapOutputMaxTokens;

    @CommandLine.Option(names = "--reduce-out", description = "Max output tokens per combine call")
    Integer reduceOutputMaxTokens;

    @CommandLine.Option(names = "--chunk-tokens", description = "Max tokens per segment")
    Integer chunkTokens;

    @CommandLine.Option(names = "--chunk-overlap", description = "Overlap tokens between segments")
    Integer chunkOverlapTokens;

    @CommandLine.Option(names = "--budget-timeout-ms", description = "Max wait for token budget per call")
    Long budgetTimeoutMs;

    @CommandLine.Option(names = "--run-timeout-ms", description = "Abandon the whole run after this long (0 = never)")
    Long runTimeoutMs;

    public static void main(String[] args) {
        int code = new CommandLine(new SummarizeMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter err = spec.commandLine().getErr();
        SummarizeConfig config;
        try {
            config = SummarizeConfig.load(configFile, overrides());
        } catch (ConfigurationException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_CONFIG;
        }

        String key = apiKey == null || apiKey.isBlank() ? null : apiKey;
        ModelSettings settings = new ModelSettings(endpoint, model, key, azure, Duration.ofSeconds(requestTimeoutSeconds));
        log.debug("Using {}", settings);
        Injector injector = Guice.createInjector(new SummarizerModule(config, settings, mapPrompt, combinePrompt));

        String text;
        try {
            text = injector.getInstance(InputAssembler.class).assemble(inputs);
        } catch (IOException e) {
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_CONFIG;
        }

        MapReduceOrchestrator orchestrator;
        List<Segment> segments;
        try {
            orchestrator = injector.getInstance(MapReduceOrchestrator.class);
            segments = injector.getInstance(SegmentSource.class).split(text);
        } catch (ProvisionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConfigurationException) {
                err.println("Invalid configuration: " + cause.getMessage());
                return EXIT_CONFIG;
            }
            throw e;
        }

        String summary;
        try {
            summary = orchestrator.summarize(segments);
        } catch (ConfigurationException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (SummarizationException e) {
            err.println("Summarization failed: " + e.getMessage());
            return EXIT_FAILED;
        } finally {
            logMetrics(orchestrator.registry());
        }

        String rendered = json
                ? injector.getInstance(ObjectMapper.class).writeValueAsString(Map.of("summary", summary))
                : summary;
        if (out != null) {
            Files.writeString(out, rendered + System.lineSeparator(), StandardCharsets.UTF_8);
            log.info("Summary written to {}", out);
        } else {
            PrintWriter stdout = spec.commandLine().getOut();
            stdout.println(rendered);
            stdout.flush();
        }
        return EXIT_OK;
    }

    Map<String, String> overrides() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(SummarizeConfig.TOKENS_PER_MINUTE, tokensPerMinute);
        raw.put(SummarizeConfig.REQUESTS_PER_MINUTE, requestsPerMinute);
        raw.put(SummarizeConfig.QUEUE_CONCURRENCY, concurrency);
        raw.put(SummarizeConfig.HIERARCHY_GROUP_SIZE, groupSize);
        raw.put(SummarizeConfig.TEMPERATURE, temperature);
        raw.put(SummarizeConfig.ENCODING, encoding);
        raw.put(SummarizeConfig.MAP_OUTPUT_MAX_TOKENS, mapOutputMaxTokens);
        raw.put(SummarizeConfig.REDUCE_OUTPUT_MAX_TOKENS, reduceOutputMaxTokens);
        raw.put(SummarizeConfig.CHUNK_TOKENS, chunkTokens);
        raw.put(SummarizeConfig.CHUNK_OVERLAP_TOKENS, chunkOverlapTokens);
        raw.put(SummarizeConfig.TOKEN_BUDGET_TIMEOUT_MS, budgetTimeoutMs);
        raw.put(SummarizeConfig.RUN_TIMEOUT_MS, runTimeoutMs);
        Map<String, String> result = new HashMap<>();
        raw.forEach((k, v) -> { if (v != null) result.put(k, v.toString()); });
        return result;
    }

    private static void logMetrics(MetricRegistry r) {
        Timer invoke = r.timer(Metrics.MODEL_INVOKE_TIME);
        log.info("metrics: calls={} p50(ms)={} retries={} tokens={} budgetWaits={} segments ok/skipped={}/{} combines={} queueStalls={}",
                invoke.getCount(),
                String.format("%.1f", TimeUnit.NANOSECONDS.toMicros((long) invoke.getSnapshot().getMedian()) / 1000.0),
                r.counter(Metrics.RETRY_ATTEMPTS).getCount(),
                r.counter(Metrics.BUDGET_TOKENS_USED).getCount(),
                r.counter(Metrics.BUDGET_WAITS).getCount(),
                r.counter(Metrics.MAP_SEGMENTS_SUCCEEDED).getCount(),
                r.counter(Metrics.MAP_SEGMENTS_SKIPPED).getCount(),
                r.counter(Metrics.REDUCE_COMBINES).getCount(),
                r.counter(Metrics.QUEUE_INTERVAL_STALLS).getCount());
    }
}
