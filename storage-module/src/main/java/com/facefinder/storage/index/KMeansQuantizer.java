package com.facefinder.storage.index;

import com.facefinder.storage.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Сферический k-means по единичным векторам.
 * Назначение по максимальному скалярному произведению, центроиды нормируются после каждого шага.
 * Инициализация k-means++ с фиксированным seed: один и тот же корпус даёт одни и те же кластеры.
 */
@Slf4j
public class KMeansQuantizer {

    private final VectorSimilarity similarity;
    private final int maxIterations;
    private final int sampleSize;
    private final long seed;

    public KMeansQuantizer(VectorSimilarity similarity, int maxIterations, int sampleSize, long seed) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("sampleSize must be positive");
        }
        this.similarity = similarity;
        this.maxIterations = maxIterations;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    /**
     * Обучить {@code clusterCount} центроидов; если векторов меньше, центроидов тоже меньше
     *
     * @param vectors единичные обучающие векторы одной размерности
     */
    public float[][] train(List<float[]> vectors, int clusterCount) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot train quantizer on an empty corpus");
        }
        if (clusterCount <= 0) {
            throw new IllegalArgumentException("clusterCount must be positive");
        }

        Random random = new Random(seed);
        List<float[]> sample = sample(vectors, random);
        int k = Math.min(clusterCount, sample.size());
        int dimension = sample.get(0).length;

        float[][] centroids = seed(sample, k, random);
        int[] assignment = new int[sample.size()];
        Arrays.fill(assignment, -1);

        int iteration = 0;
        boolean changed = true;
        while (changed && iteration < maxIterations) {
            changed = false;
            double[] bestSimilarity = new double[sample.size()];
            for (int i = 0; i < sample.size(); i++) {
                int nearest = nearest(centroids, sample.get(i));
                bestSimilarity[i] = similarity.innerProduct(centroids[nearest], sample.get(i));
                if (nearest != assignment[i]) {
                    assignment[i] = nearest;
                    changed = true;
                }
            }
            centroids = recompute(sample, assignment, k, dimension, bestSimilarity);
            iteration++;
        }

        log.debug("Trained {} centroids on {} vectors in {} iterations", k, sample.size(), iteration);
        return centroids;
    }

    /** Номер центроида с наибольшим скалярным произведением */
    public int nearest(float[][] centroids, float[] vector) {
        int best = 0;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double score = similarity.innerProduct(centroids[c], vector);
            if (score > bestScore) {
                bestScore = score;
                best = c;
            }
        }
        return best;
    }

    /** Номера {@code n} лучших центроидов, лучший первым */
    public int[] nearest(float[][] centroids, float[] vector, int n) {
        int count = Math.min(n, centroids.length);
        Integer[] order = new Integer[centroids.length];
        double[] scores = new double[centroids.length];
        for (int c = 0; c < centroids.length; c++) {
            order[c] = c;
            scores[c] = similarity.innerProduct(centroids[c], vector);
        }
        Arrays.sort(order, (a, b) -> {
            int cmp = Double.compare(scores[b], scores[a]);
            return cmp != 0 ? cmp : Integer.compare(a, b);
        });
        int[] result = new int[count];
        for (int i = 0; i < count; i++) {
            result[i] = order[i];
        }
        return result;
    }

    private List<float[]> sample(List<float[]> vectors, Random random) {
        if (vectors.size() <= sampleSize) {
            return vectors;
        }
        List<float[]> shuffled = new ArrayList<>(vectors);
        Collections.shuffle(shuffled, random);
        return shuffled.subList(0, sampleSize);
    }

    /** Инициализация k-means++, расстояние 1 - cos */
    private float[][] seed(List<float[]> sample, int k, Random random) {
        float[][] centroids = new float[k][];
        centroids[0] = sample.get(random.nextInt(sample.size())).clone();

        double[] distance = new double[sample.size()];
        Arrays.fill(distance, Double.MAX_VALUE);

        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (int i = 0; i < sample.size(); i++) {
                double d = Math.max(0.0, 1.0 - similarity.innerProduct(centroids[c - 1], sample.get(i)));
                distance[i] = Math.min(distance[i], d);
                total += distance[i];
            }

            int chosen;
            if (total <= 0.0) {
                // every remaining vector coincides with a centroid
                chosen = random.nextInt(sample.size());
            } else {
                double target = random.nextDouble() * total;
                chosen = sample.size() - 1;
                double cumulative = 0.0;
                for (int i = 0; i < sample.size(); i++) {
                    cumulative += distance[i];
                    if (cumulative >= target) {
                        chosen = i;
                        break;
                    }
                }
            }
            centroids[c] = sample.get(chosen).clone();
        }
        return centroids;
    }

    private float[][] recompute(List<float[]> sample, int[] assignment, int k, int dimension,
                                double[] bestSimilarity) {
        double[][] sums = new double[k][dimension];
        int[] counts = new int[k];
        for (int i = 0; i < sample.size(); i++) {
            float[] vector = sample.get(i);
            double[] sum = sums[assignment[i]];
            for (int d = 0; d < dimension; d++) {
                sum[d] += vector[d];
            }
            counts[assignment[i]]++;
        }

        boolean[] taken = new boolean[sample.size()];
        float[][] centroids = new float[k][];
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                // empty cluster: re-seed with the worst represented vector
                int worst = worstRepresented(bestSimilarity, taken);
                taken[worst] = true;
                centroids[c] = sample.get(worst).clone();
                continue;
            }
            float[] centroid = new float[dimension];
            for (int d = 0; d < dimension; d++) {
                centroid[d] = (float) sums[c][d];
            }
            centroids[c] = normalizeOrKeep(centroid, sample, assignment, c);
        }
        return centroids;
    }

    private float[] normalizeOrKeep(float[] centroid, List<float[]> sample, int[] assignment, int cluster) {
        if (similarity.norm(centroid) > 0.0) {
            return similarity.normalize(centroid);
        }
        // members cancel out exactly; fall back to the first member
        for (int i = 0; i < assignment.length; i++) {
            if (assignment[i] == cluster) {
                return sample.get(i).clone();
            }
        }
        return centroid;
    }

    private int worstRepresented(double[] bestSimilarity, boolean[] taken) {
        int worst = 0;
        double worstScore = Double.POSITIVE_INFINITY;
        for (int i = 0; i < bestSimilarity.length; i++) {
            if (!taken[i] && bestSimilarity[i] < worstScore) {
                worstScore = bestSimilarity[i];
                worst = i;
            }
        }
        return worst;
    }
}
