package com.prodomme.session;

/**
 * Approximate token counter used to keep history under the context budget.
 * It need not match the provider's tokenizer, but must grow with text length.
 */
@FunctionalInterface
public interface TokenEstimator {

    int countTokens(String text);
}
