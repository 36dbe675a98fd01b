package io.mapreducer.summarizer;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Named;
import io.mapreducer.config.SummarizeConfig;
import io.mapreducer.core.LanguageModel;
import io.mapreducer.core.PromptTemplate;
import io.mapreducer.core.SegmentSource;
import io.mapreducer.core.TokenCounter;
import io.mapreducer.error.ConfigurationException;
import io.mapreducer.runtime.MapReduceOrchestrator;

import java.net.http.HttpClient;
import java.nio.file.Path;

public class SummarizerModule extends AbstractModule {
    private final SummarizeConfig config;
    private final ModelSettings settings;
    private final Path mapPromptFile;
    private final Path combinePromptFile;

    public SummarizerModule(SummarizeConfig config, ModelSettings settings, Path mapPromptFile, Path combinePromptFile) {
        this.config = config;
        this.settings = settings;
        this.mapPromptFile = mapPromptFile;
        this.combinePromptFile = combinePromptFile;
    }

    @Override
    protected void configure() {
        bind(SummarizeConfig.class).toInstance(config);
        bind(ModelSettings.class).toInstance(settings);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton TokenCounter tokenCounter() { return new JTokkitTokenCounter(); }

    @Provides SegmentSource segmentSource(TokenCounter counter) {
        return new RecursiveTextSplitter(counter, config.encoding(), config.chunkTokens(), config.chunkOverlapTokens());
    }

    @Provides @Singleton LanguageModel languageModel(ObjectMapper mapper) {
        return new OpenAiChatModel(HttpClient.newHttpClient(), mapper, settings.endpoint(), settings.model(),
                settings.apiKey(), settings.azure(), OpenAiChatModel.DEFAULT_AZURE_API_VERSION, settings.requestTimeout());
    }

    @Provides @Singleton @Named("map") PromptTemplate mapPrompt() throws ConfigurationException { return Prompts.map(mapPromptFile); }

    @Provides @Singleton @Named("combine") PromptTemplate combinePrompt() throws ConfigurationException { return Prompts.combine(combinePromptFile); }

    @Provides @Singleton InputAssembler inputAssembler(ObjectMapper mapper) { return new InputAssembler(mapper); }

    @Provides @Singleton MapReduceOrchestrator orchestrator(LanguageModel model, TokenCounter counter,
                                                           @Named("map") PromptTemplate mapPrompt,
                                                           @Named("combine") PromptTemplate combinePrompt,
                                                           MetricRegistry registry) {
        return new MapReduceOrchestrator(config, model, counter, mapPrompt, combinePrompt, registry);
    }
}
