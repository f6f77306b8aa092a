package com.rewardpick.support;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic bag-of-words embedding for tests. Every token is hashed into a fixed bucket, so
 * texts sharing words are close and identical texts have similarity 1. No model files or
 * network access are involved.
 */
public class KeywordEmbeddingModel implements EmbeddingModel {

    private static final int DIMENSION = 128;

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
        List<Embedding> embeddings = new ArrayList<>();
        for (TextSegment segment : textSegments) {
            embeddings.add(Embedding.from(vector(segment.text())));
        }
        return Response.from(embeddings);
    }

    @Override
    public int dimension() {
        return DIMENSION;
    }

    private float[] vector(String text) {
        float[] vector = new float[DIMENSION];
        // bias keeps every vector non-zero
        vector[0] = 0.1f;
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.isEmpty()) {
                continue;
            }
            if (token.chars().allMatch(ch -> ch < 128)) {
                vector[bucket(token)] += 1f;
            } else {
                token.codePoints().forEach(codePoint -> vector[bucket(new String(Character.toChars(codePoint)))] += 1f);
            }
        }
        return vector;
    }

    private int bucket(String token) {
        return 1 + Math.floorMod(token.hashCode(), DIMENSION - 1);
    }
}
