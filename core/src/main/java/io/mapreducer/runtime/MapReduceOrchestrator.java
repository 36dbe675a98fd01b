package io.mapreducer.runtime;

import com.codahale.metrics.MetricRegistry;
import io.mapreducer.config.SummarizeConfig;
import io.mapreducer.core.LanguageModel;
import io.mapreducer.core.PromptTemplate;
import io.mapreducer.core.Segment;
import io.mapreducer.core.TokenCounter;
import io.mapreducer.error.ConfigurationException;
import io.mapreducer.error.SummarizationException;
import io.mapreducer.metrics.Metrics;
import io.mapreducer.retry.Sleeper;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for map-reduce summarization. Each call creates a {@link SummarizationRun} with its
 * own token tracker and admission queue, so concurrent runs never share budget state.
 */
public class MapReduceOrchestrator {
    /** Separator placed between items of a reduce group before the group is rendered into a prompt. */
    public static final String GROUP_SEPARATOR = "\n\n---\n\n";

    private final SummarizeConfig config;
    private final LanguageModel model;
    private final TokenCounter tokenCounter;
    private final PromptTemplate mapPrompt;
    private final PromptTemplate combinePrompt;
    private final Metrics metrics;
    private final Sleeper retrySleeper;

    public MapReduceOrchestrator(SummarizeConfig config,
                                 LanguageModel model,
                                 TokenCounter tokenCounter,
                                 PromptTemplate mapPrompt,
                                 PromptTemplate combinePrompt,
                                 MetricRegistry registry) {
        this(config, model, tokenCounter, mapPrompt, combinePrompt, registry, Sleeper.SYSTEM);
    }

    public MapReduceOrchestrator(SummarizeConfig config,
                                 LanguageModel model,
                                 TokenCounter tokenCounter,
                                 PromptTemplate mapPrompt,
                                 PromptTemplate combinePrompt,
                                 MetricRegistry registry,
                                 Sleeper retrySleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.model = Objects.requireNonNull(model, "model");
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
        this.mapPrompt = Objects.requireNonNull(mapPrompt, "mapPrompt");
        this.combinePrompt = Objects.requireNonNull(combinePrompt, "combinePrompt");
        this.metrics = new Metrics(registry);
        this.retrySleeper = retrySleeper == null ? Sleeper.SYSTEM : retrySleeper;
    }

    /** Validates the configuration before any per-run collaborator is built. */
    public SummarizationRun newRun(List<Segment> segments) throws ConfigurationException {
        config.validate();
        return new SummarizationRun(config, model, tokenCounter, mapPrompt, combinePrompt, metrics, retrySleeper, segments);
    }

    public String summarize(List<Segment> segments) throws SummarizationException {
        return newRun(segments).execute();
    }

    public SummarizeConfig config() { return config; }

    public MetricRegistry registry() { return metrics.registry(); }
}
