package com.facefinder.storage.similarity;

import com.facefinder.common.exception.DimensionMismatchException;
import org.springframework.stereotype.Component;

@Component
public class VectorSimilarity {

    /** Скалярное произведение; для нормированных векторов равно косинусному сходству */
    public double innerProduct(float[] vector1, float[] vector2) {
        if (vector1.length != vector2.length) {
            throw new DimensionMismatchException(vector1.length, vector2.length);
        }

        double dotProduct = 0.0;
        for (int i = 0; i < vector1.length; i++) {
            dotProduct += (double) vector1[i] * vector2[i];
        }
        return dotProduct;
    }

    /** Евклидова норма вектора */
    public double norm(float[] vector) {
        double sum = 0.0;
        for (float value : vector) {
            sum += (double) value * value;
        }
        return Math.sqrt(sum);
    }

    /**
     * Нормированная копия вектора
     * @throws IllegalArgumentException для нулевого вектора
     */
    public float[] normalize(float[] vector) {
        double norm = norm(vector);
        if (norm == 0.0 || Double.isNaN(norm) || Double.isInfinite(norm)) {
            throw new IllegalArgumentException("Vector cannot be normalized: norm=" + norm);
        }
        float[] result = new float[vector.length];
        for (int i = 0; i < vector.length; i++) {
            result[i] = (float) (vector[i] / norm);
        }
        return result;
    }

    /** Копия вектора; нормируется, только если норма отличается от 1 больше чем на tolerance */
    public float[] normalizeIfNeeded(float[] vector, double tolerance) {
        double norm = norm(vector);
        if (norm == 0.0 || Double.isNaN(norm) || Double.isInfinite(norm)) {
            throw new IllegalArgumentException("Vector cannot be normalized: norm=" + norm);
        }
        if (Math.abs(norm - 1.0) <= tolerance) {
            return vector.clone();
        }
        return normalize(vector);
    }
}
