package com.consensusplatform.common.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * In-process {@link EmbeddingProvider} based on hashed unigram and bigram term frequencies.
 *
 * <p>Each text is lower-cased and split into word tokens; common English stop words
 * are dropped. Every unigram and adjacent bigram
 * is hashed into one of {@code dimension} buckets and counted. The resulting vector is
 * L2-normalised, so cosine similarity reduces to a dot product.
 *
 * <p>Texts with no usable tokens map to the zero vector. Stateless and thread-safe.
 */
public final class TermFrequencyEmbeddingProvider implements EmbeddingProvider {

    public static final int DEFAULT_DIMENSION = 1024;

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "have",
        "in", "is", "it", "its", "of", "on", "or", "that", "the", "this", "to", "was",
        "were", "will", "with"
    );

    private final int dimension;

    public TermFrequencyEmbeddingProvider() {
        this(DEFAULT_DIMENSION);
    }

    public TermFrequencyEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive, got " + dimension);
        }
        this.dimension = dimension;
    }

    public int dimension() {
        return dimension;
    }

    @Override
    public List<double[]> embed(List<String> texts) {
        List<double[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    private double[] embedOne(String text) {
        double[] vector = new double[dimension];
        List<String> tokens = tokenize(text);
        for (int i = 0; i < tokens.size(); i++) {
            vector[bucket(tokens.get(i))] += 1.0;
            if (i + 1 < tokens.size()) {
                vector[bucket(tokens.get(i) + " " + tokens.get(i + 1))] += 1.0;
            }
        }
        double norm = 0.0;
        for (double v : vector) norm += v * v;
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vector.length; i++) vector[i] /= norm;
        }
        return vector;
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) return tokens;
        for (String raw : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (raw.isEmpty() || STOP_WORDS.contains(raw)) continue;
            tokens.add(raw);
        }
        return tokens;
    }

    private int bucket(String term) {
        return Math.floorMod(term.hashCode(), dimension);
    }
}
