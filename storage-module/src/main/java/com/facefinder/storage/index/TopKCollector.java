package com.facefinder.storage.index;

import com.facefinder.common.model.FaceRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Хранит k лучших лиц со сходством не ниже порога.
 * В вершине кучи худший кандидат, вытеснение за O(log k).
 */
final class TopKCollector {

    private final int k;
    private final double threshold;
    private final PriorityQueue<ScoredFace> heap;

    TopKCollector(int k, double threshold) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        this.k = k;
        this.threshold = threshold;
        this.heap = new PriorityQueue<>(Math.min(k, 1024) + 1, ScoredFace.RANKING.reversed());
    }

    void offer(FaceRecord face, double similarity) {
        if (similarity < threshold) {
            return;
        }
        ScoredFace candidate = new ScoredFace(face, similarity);
        if (heap.size() < k) {
            heap.add(candidate);
        } else if (ScoredFace.RANKING.compare(candidate, heap.peek()) < 0) {
            heap.poll();
            heap.add(candidate);
        }
    }

    int size() {
        return heap.size();
    }

    List<ScoredFace> results() {
        List<ScoredFace> results = new ArrayList<>(heap);
        results.sort(ScoredFace.RANKING);
        return results;
    }
}
