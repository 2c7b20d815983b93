package com.consensusplatform.engine.similarity;

import com.consensusplatform.common.model.Prediction;

import java.util.List;
import java.util.Map;

/**
 * Full outcome of one clustering pass.
 *
 * <ul>
 *   <li>{@code dominantCluster} – members of the winning cluster; a single prediction when
 *       {@code fallback} is set</li>
 *   <li>{@code outlierClusters} – every other group, including each isolated prediction as
 *       its own singleton group</li>
 *   <li>{@code labels} – one label per input prediction, {@link DensityClusterer#NOISE} for
 *       noise and isolated predictions</li>
 *   <li>{@code similarityMatrix} – cosine similarity over all input predictions</li>
 *   <li>{@code centroids} – label → mean scaled embedding, real clusters only</li>
 *   <li>{@code dominantLabel} – label of the dominant cluster, or
 *       {@link DensityClusterer#NOISE} when it is the noise group or a fallback</li>
 *   <li>{@code cohesion} – mean pairwise similarity inside the dominant cluster, clamped
 *       to [0, 1]; 1.0 for a singleton or fallback</li>
 * </ul>
 *
 * <p>Arrays are handed over as-is; treat them as read-only.
 */
public record ClusterResult(
    List<Prediction> dominantCluster,
    List<List<Prediction>> outlierClusters,
    int[] labels,
    double[][] similarityMatrix,
    Map<Integer, double[]> centroids,
    int dominantLabel,
    double cohesion,
    boolean fallback
) {
    public ClusterResult {
        dominantCluster = List.copyOf(dominantCluster);
        outlierClusters = List.copyOf(outlierClusters);
        centroids = Map.copyOf(centroids);
    }

    public int clusterCount() {
        return centroids.size();
    }

    public int outlierCount() {
        return outlierClusters.stream().mapToInt(List::size).sum();
    }
}
