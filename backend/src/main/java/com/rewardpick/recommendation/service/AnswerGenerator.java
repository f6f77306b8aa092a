package com.rewardpick.recommendation.service;

import java.util.List;

/**
 * Turns a ranked recommendation into a short natural-language answer.
 */
public interface AnswerGenerator {

    /**
     * @param prompt the user's question together with the ranking to explain
     * @param groundingFacts the only facts the answer may rely on
     * @throws GenerationUnavailableException when no answer can be produced
     */
    String generate(String prompt, List<String> groundingFacts);
}
