package io.mapreducer.runtime;

import io.mapreducer.core.InvocationOptions;
import io.mapreducer.core.LanguageModel;
import io.mapreducer.core.ModelResponse;
import io.mapreducer.core.Usage;
import io.mapreducer.core.TokenCounter;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic model for orchestration tests. Map prompts ({@code MAP:<text>}) answer
 * {@code m[<text>]}; combine prompts ({@code COMBINE:<joined>}) answer {@code c(<items>)}.
 */
public class ScriptedModel implements LanguageModel {
    public static final String MAP_TEMPLATE = "MAP:{text}";
    public static final String COMBINE_TEMPLATE = "COMBINE:{text}";

    /** One token per character. */
    public static final TokenCounter CHAR_COUNTER = (text, encoding) -> text.length();

    public interface Hook {
        void before(String prompt) throws Exception;
    }

    public final List<String> prompts = new CopyOnWriteArrayList<>();
    public final List<InvocationOptions> options = new CopyOnWriteArrayList<>();
    public final AtomicInteger mapCalls = new AtomicInteger();
    public final AtomicInteger combineCalls = new AtomicInteger();
    private volatile Hook hook = prompt -> {};
    private volatile Usage usage = Usage.NONE;

    public ScriptedModel hook(Hook hook) { this.hook = hook; return this; }

    public ScriptedModel usage(Usage usage) { this.usage = usage; return this; }

    @Override
    public ModelResponse invoke(String prompt, InvocationOptions opts) throws Exception {
        prompts.add(prompt);
        options.add(opts);
        if (prompt.startsWith("MAP:")) mapCalls.incrementAndGet();
        else combineCalls.incrementAndGet();
        hook.before(prompt);
        if (prompt.startsWith("MAP:")) {
            return new ModelResponse("m[" + prompt.substring(4) + "]", usage);
        }
        String body = prompt.substring("COMBINE:".length());
        List<String> parts = Arrays.asList(body.split(MapReduceOrchestrator.GROUP_SEPARATOR, -1));
        return new ModelResponse("c(" + String.join(",", parts) + ")", usage);
    }
}
