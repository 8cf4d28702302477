package com.placeguide.recommend.embed;

import com.placeguide.recommend.cache.CacheKeys;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import org.springframework.stereotype.Component;

@Component
public class ToyEmbedder {
    private final EmbeddingProperties properties;

    public ToyEmbedder(EmbeddingProperties properties) {
        this.properties = properties;
    }

    public List<Double> embed(String text) {
        int dimension = Math.max(1, properties.getDimension());
        String normalized = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        Random random = new Random(Long.parseUnsignedLong(CacheKeys.sha256(normalized).substring(0, 15), 16));
        double[] values = new double[dimension];
        double sumSquares = 0.0;
        for (int i = 0; i < dimension; i++) {
            values[i] = random.nextGaussian();
            sumSquares += values[i] * values[i];
        }
        double norm = sumSquares == 0.0 ? 1.0 : Math.sqrt(sumSquares);
        List<Double> vector = new ArrayList<>(dimension);
        for (double value : values) {
            vector.add(value / norm);
        }
        return vector;
    }
}
