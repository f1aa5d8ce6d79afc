package org.example.course.service.llm;

/**
 * Generator capability: one prompt in, one completion out. Provider selection happens in
 * configuration; callers see a single provider.
 */
public interface LlmProvider {

    /**
     * Run a single completion. Implementations do not retry.
     *
     * @throws LlmProviderException on transport or provider errors
     */
    LlmCompletion complete(String prompt, LlmOptions options);

    boolean isAvailable();

    String getProviderName();
}
