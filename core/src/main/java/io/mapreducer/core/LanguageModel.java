package io.mapreducer.core;

/**
 * Remote language-model call. Failures carrying an HTTP-like status must be raised as
 * {@link ProviderException} so that rate limiting and server errors can be retried.
 */
@FunctionalInterface
public interface LanguageModel {
    ModelResponse invoke(String prompt, InvocationOptions options) throws Exception;
}
