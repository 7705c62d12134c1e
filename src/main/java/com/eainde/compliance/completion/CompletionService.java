package com.eainde.compliance.completion;

/**
 * Stateless text-generation endpoint. Treated as a black box and safe to call again with the same prompt.
 */
public interface CompletionService {

    /**
     * @throws ServiceException on transport failure, timeout or an unusable response
     */
    String generate(String prompt, int maxTokens, double temperature);
}
