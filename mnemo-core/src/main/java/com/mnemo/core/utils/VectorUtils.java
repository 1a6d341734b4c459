package com.mnemo.core.utils;

import lombok.experimental.UtilityClass;

@UtilityClass
public class VectorUtils {
    /**
     * Cosine similarity of two vectors. Zero when either is missing, empty or the lengths differ.
     */
    public static double cosineSimilarity(float[] lhs, float[] rhs) {
        if (lhs == null || rhs == null || lhs.length == 0 || lhs.length != rhs.length) {
            return 0.0;
        }
        double dotProduct = 0.0;
        double normLhs = 0.0;
        double normRhs = 0.0;
        for (int i = 0; i < lhs.length; i++) {
            dotProduct += lhs[i] * rhs[i];
            normLhs += Math.pow(lhs[i], 2);
            normRhs += Math.pow(rhs[i], 2);
        }
        if (normLhs == 0.0 || normRhs == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normLhs) * Math.sqrt(normRhs));
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
