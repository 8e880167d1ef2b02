package io.vulnscan.index;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Exact brute-force index.
 *
 * <p>Scans every vector on each query. Suitable for repository-sized indexes
 * (up to ~100k vectors); use {@link HnswVectorIndex} beyond that.</p>
 */
public class FlatVectorIndex extends AbstractVectorIndex {

    public FlatVectorIndex(IndexConfig config) {
        this(config, null);
    }

    public FlatVectorIndex(IndexConfig config, IndexFiles files) {
        super(config, files);
    }

    @Override
    protected void onAdded(int firstId, List<float[]> added) {
        // Vectors are scanned directly from the shared list
    }

    @Override
    protected List<SearchHit> nearest(float[] queryVector, int topK) {
        // Worst of the current top-K at the head
        PriorityQueue<SearchHit> best = new PriorityQueue<>(topK + 1, (a, b) -> b.compareTo(a));
        for (int id = 0; id < vectors.size(); id++) {
            best.add(hit(id, score(queryVector, vectors.get(id))));
            if (best.size() > topK) {
                best.poll();
            }
        }
        List<SearchHit> results = new ArrayList<>(best);
        results.sort(null);
        return results;
    }
}
