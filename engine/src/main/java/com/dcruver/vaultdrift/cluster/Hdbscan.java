package com.dcruver.vaultdrift.cluster;

import com.dcruver.vaultdrift.domain.Deadline;
import com.dcruver.vaultdrift.nlp.VectorMath;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hierarchical density-based clustering over euclidean distance.
 *
 * Mutual reachability distances feed a minimum spanning tree (Prim, distances computed on the fly so
 * memory stays linear), which becomes a single-linkage hierarchy, then a condensed tree of clusters of
 * at least {@code minClusterSize} points. Clusters are picked by excess of mass; the root is never
 * picked, so a corpus without density structure comes back as noise.
 */
public class Hdbscan {

    public static final int NOISE = -1;

    /** Stand-in for 1/0 when points coincide */
    private static final double ZERO_DISTANCE_LAMBDA = 1e10;

    private final int minClusterSize;
    private final int minSamples;

    public Hdbscan(int minClusterSize, int minSamples) {
        if (minClusterSize < 2) {
            throw new IllegalArgumentException("minClusterSize must be at least 2: " + minClusterSize);
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1: " + minSamples);
        }
        this.minClusterSize = minClusterSize;
        this.minSamples = minSamples;
    }

    /**
     * Label each point with a cluster index (0..k-1, numbered by first member) or {@link #NOISE}.
     */
    public int[] fit(double[][] points, Deadline deadline) {
        int n = points.length;
        int[] labels = new int[n];
        Arrays.fill(labels, NOISE);
        if (n < minClusterSize || n < 2) {
            return labels;
        }

        double[] core = coreDistances(points, deadline);
        double[][] edges = minimumSpanningTree(points, core, deadline);
        int[][] children = new int[n - 1][2];
        double[] mergeDistance = new double[n - 1];
        int[] sizes = singleLinkage(edges, n, children, mergeDistance);

        List<double[]> condensed = condense(n, children, mergeDistance, sizes);
        Map<Integer, Boolean> selected = selectClusters(n, condensed);
        return label(n, condensed, selected);
    }

    // Distance to the minSamples-th nearest point, counting the point itself
    double[] coreDistances(double[][] points, Deadline deadline) {
        int n = points.length;
        int k = Math.min(minSamples, n) - 1;
        double[] core = new double[n];
        double[] row = new double[n];
        for (int i = 0; i < n; i++) {
            if ((i & 63) == 0) {
                deadline.check("clustering");
            }
            for (int j = 0; j < n; j++) {
                row[j] = i == j ? 0.0 : VectorMath.euclidean(points[i], points[j]);
            }
            double[] sorted = row.clone();
            Arrays.sort(sorted);
            core[i] = sorted[k];
        }
        return core;
    }

    /**
     * Prim over the complete mutual-reachability graph. Each edge is {from, to, weight}.
     */
    private double[][] minimumSpanningTree(double[][] points, double[] core, Deadline deadline) {
        int n = points.length;
        boolean[] inTree = new boolean[n];
        double[] best = new double[n];
        int[] from = new int[n];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        double[][] edges = new double[n - 1][];

        int current = 0;
        inTree[0] = true;
        for (int step = 0; step < n - 1; step++) {
            if ((step & 63) == 0) {
                deadline.check("clustering");
            }
            int next = -1;
            double nextWeight = Double.POSITIVE_INFINITY;
            for (int j = 0; j < n; j++) {
                if (inTree[j]) {
                    continue;
                }
                double reach = Math.max(VectorMath.euclidean(points[current], points[j]),
                    Math.max(core[current], core[j]));
                if (reach < best[j]) {
                    best[j] = reach;
                    from[j] = current;
                }
                if (best[j] < nextWeight) {
                    nextWeight = best[j];
                    next = j;
                }
            }
            inTree[next] = true;
            edges[step] = new double[] {from[next], next, nextWeight};
            current = next;
        }
        return edges;
    }

    /**
     * Union-find over edges sorted by weight. Node ids below n are points, merge i creates node n + i.
     * Returns the size of every node.
     */
    private static int[] singleLinkage(double[][] edges, int n, int[][] children, double[] mergeDistance) {
        double[][] sorted = edges.clone();
        Arrays.sort(sorted, (a, b) -> {
            int cmp = Double.compare(a[2], b[2]);
            if (cmp != 0) {
                return cmp;
            }
            cmp = Double.compare(Math.min(a[0], a[1]), Math.min(b[0], b[1]));
            return cmp != 0 ? cmp : Double.compare(Math.max(a[0], a[1]), Math.max(b[0], b[1]));
        });

        int[] parent = new int[2 * n - 1];
        int[] sizes = new int[2 * n - 1];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
            sizes[i] = i < n ? 1 : 0;
        }
        for (int i = 0; i < sorted.length; i++) {
            int a = find(parent, (int) sorted[i][0]);
            int b = find(parent, (int) sorted[i][1]);
            int node = n + i;
            children[i][0] = a;
            children[i][1] = b;
            mergeDistance[i] = sorted[i][2];
            parent[a] = node;
            parent[b] = node;
            sizes[node] = sizes[a] + sizes[b];
        }
        return sizes;
    }

    private static int find(int[] parent, int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    /**
     * Condensed tree rows: {parentCluster, child, lambda, childSize}. Cluster labels start at n (the root).
     */
    private List<double[]> condense(int n, int[][] children, double[] mergeDistance, int[] sizes) {
        int root = 2 * n - 2;
        int[] relabel = new int[2 * n - 1];
        boolean[] ignore = new boolean[2 * n - 1];
        relabel[root] = n;
        int nextLabel = n + 1;
        List<double[]> rows = new ArrayList<>();

        for (int node : breadthFirst(root, n, children)) {
            if (node < n || ignore[node]) {
                continue;
            }
            int left = children[node - n][0];
            int right = children[node - n][1];
            double distance = mergeDistance[node - n];
            double lambda = distance > 0.0 ? 1.0 / distance : ZERO_DISTANCE_LAMBDA;
            int leftSize = sizes[left];
            int rightSize = sizes[right];

            if (leftSize >= minClusterSize && rightSize >= minClusterSize) {
                relabel[left] = nextLabel++;
                rows.add(new double[] {relabel[node], relabel[left], lambda, leftSize});
                relabel[right] = nextLabel++;
                rows.add(new double[] {relabel[node], relabel[right], lambda, rightSize});
            } else if (leftSize < minClusterSize && rightSize < minClusterSize) {
                fallOut(left, relabel[node], lambda, n, children, ignore, rows);
                fallOut(right, relabel[node], lambda, n, children, ignore, rows);
            } else if (leftSize < minClusterSize) {
                relabel[right] = relabel[node];
                fallOut(left, relabel[node], lambda, n, children, ignore, rows);
            } else {
                relabel[left] = relabel[node];
                fallOut(right, relabel[node], lambda, n, children, ignore, rows);
            }
        }
        return rows;
    }

    private static void fallOut(int subtree, int cluster, double lambda, int n, int[][] children,
                                boolean[] ignore, List<double[]> rows) {
        for (int sub : breadthFirst(subtree, n, children)) {
            if (sub < n) {
                rows.add(new double[] {cluster, sub, lambda, 1});
            }
            ignore[sub] = true;
        }
    }

    private static List<Integer> breadthFirst(int start, int n, int[][] children) {
        List<Integer> order = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            int node = queue.poll();
            order.add(node);
            if (node >= n) {
                queue.add(children[node - n][0]);
                queue.add(children[node - n][1]);
            }
        }
        return order;
    }

    /**
     * Excess-of-mass selection over every cluster except the root.
     */
    private Map<Integer, Boolean> selectClusters(int n, List<double[]> condensed) {
        Map<Integer, Double> birth = new HashMap<>();
        Map<Integer, List<Integer>> childClusters = new HashMap<>();
        int maxLabel = n;
        birth.put(n, 0.0);
        for (double[] row : condensed) {
            int child = (int) row[1];
            if (row[3] > 1) {
                birth.put(child, row[2]);
                childClusters.computeIfAbsent((int) row[0], k -> new ArrayList<>()).add(child);
                maxLabel = Math.max(maxLabel, child);
            }
        }

        double[] stability = new double[maxLabel + 1];
        for (double[] row : condensed) {
            int parent = (int) row[0];
            stability[parent] += (row[2] - birth.get(parent)) * row[3];
        }

        Map<Integer, Boolean> selected = new HashMap<>();
        for (int cluster = maxLabel; cluster > n; cluster--) {
            selected.put(cluster, true);
        }
        for (int cluster = maxLabel; cluster > n; cluster--) {
            double subtree = 0.0;
            for (int child : childClusters.getOrDefault(cluster, List.of())) {
                subtree += stability[child];
            }
            if (subtree > stability[cluster]) {
                selected.put(cluster, false);
                stability[cluster] = subtree;
            } else {
                deselectDescendants(cluster, childClusters, selected);
            }
        }
        return selected;
    }

    private static void deselectDescendants(int cluster, Map<Integer, List<Integer>> childClusters,
                                            Map<Integer, Boolean> selected) {
        Deque<Integer> queue = new ArrayDeque<>(childClusters.getOrDefault(cluster, List.of()));
        while (!queue.isEmpty()) {
            int child = queue.poll();
            selected.put(child, false);
            queue.addAll(childClusters.getOrDefault(child, List.of()));
        }
    }

    private static int[] label(int n, List<double[]> condensed, Map<Integer, Boolean> selected) {
        Map<Integer, Integer> parentOf = new HashMap<>();
        int[] fellFrom = new int[n];
        for (double[] row : condensed) {
            int child = (int) row[1];
            if (child < n) {
                fellFrom[child] = (int) row[0];
            } else {
                parentOf.put(child, (int) row[0]);
            }
        }

        int[] raw = new int[n];
        for (int point = 0; point < n; point++) {
            raw[point] = NOISE;
            Integer cluster = fellFrom[point];
            while (cluster != null && cluster != n) {
                if (selected.getOrDefault(cluster, false)) {
                    raw[point] = cluster;
                    break;
                }
                cluster = parentOf.get(cluster);
            }
        }

        // renumber by first member so ids do not depend on tree traversal order
        Map<Integer, Integer> renumber = new HashMap<>();
        int[] labels = new int[n];
        for (int point = 0; point < n; point++) {
            if (raw[point] == NOISE) {
                labels[point] = NOISE;
            } else {
                labels[point] = renumber.computeIfAbsent(raw[point], k -> renumber.size());
            }
        }
        return labels;
    }
}
