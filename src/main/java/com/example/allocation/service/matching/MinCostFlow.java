package com.example.allocation.service.matching;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Minimum-cost flow by successive shortest paths (Bellman-Ford queue variant, so negative edge
 * costs are allowed as long as the initial graph has no negative cycle).
 *
 * <p>{@link #minimizeCost} augments only while the cheapest source-sink path has negative cost.
 * With profits entered as negated costs this yields a maximum-profit flow of whatever size is
 * best, not a maximum flow. Costs are integers and edges are scanned in insertion order, so
 * identical graphs always produce identical flows.
 */
public final class MinCostFlow {

    private static final long INF = Long.MAX_VALUE;

    private final int nodes;
    private final List<int[]> adjacency;
    private final List<Integer> to = new ArrayList<>();
    private final List<Integer> capacity = new ArrayList<>();
    private final List<Long> cost = new ArrayList<>();

    public MinCostFlow(int nodes) {
        this.nodes = nodes;
        this.adjacency = new ArrayList<>(nodes);
        for (int i = 0; i < nodes; i++) {
            adjacency.add(new int[0]);
        }
    }

    /**
     * Adds a directed edge and its residual twin.
     *
     * @return handle for {@link #flow(int)}
     */
    public int addEdge(int from, int target, int cap, long edgeCost) {
        if (cap < 0) {
            throw new IllegalArgumentException("Negative capacity " + cap + " on edge " + from + "->" + target);
        }
        int id = to.size();
        append(from, id, target, cap, edgeCost);
        append(target, id + 1, from, 0, -edgeCost);
        return id;
    }

    private void append(int node, int id, int target, int cap, long edgeCost) {
        int[] edges = adjacency.get(node);
        int[] grown = Arrays.copyOf(edges, edges.length + 1);
        grown[edges.length] = id;
        adjacency.set(node, grown);
        to.add(target);
        capacity.add(cap);
        cost.add(edgeCost);
    }

    /** Units currently pushed through the edge returned by {@link #addEdge}. */
    public int flow(int edge) {
        return capacity.get(edge + 1);
    }

    /**
     * Pushes flow along negative-cost shortest paths until none is left.
     *
     * @return total cost of the flow
     * @throws ArithmeticException if path costs overflow a {@code long}
     */
    public long minimizeCost(int source, int sink) {
        long total = 0;
        long[] dist = new long[nodes];
        int[] viaEdge = new int[nodes];
        boolean[] queued = new boolean[nodes];
        while (true) {
            Arrays.fill(dist, INF);
            Arrays.fill(viaEdge, -1);
            dist[source] = 0;
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(source);
            queued[source] = true;
            while (!queue.isEmpty()) {
                int u = queue.poll();
                queued[u] = false;
                for (int e : adjacency.get(u)) {
                    if (capacity.get(e) <= 0) {
                        continue;
                    }
                    int v = to.get(e);
                    long candidate = Math.addExact(dist[u], cost.get(e));
                    if (candidate < dist[v]) {
                        dist[v] = candidate;
                        viaEdge[v] = e;
                        if (!queued[v]) {
                            queue.add(v);
                            queued[v] = true;
                        }
                    }
                }
            }
            if (dist[sink] == INF || dist[sink] >= 0) {
                return total;
            }

            int push = Integer.MAX_VALUE;
            for (int v = sink; v != source; v = to.get(viaEdge[v] ^ 1)) {
                push = Math.min(push, capacity.get(viaEdge[v]));
            }
            for (int v = sink; v != source; v = to.get(viaEdge[v] ^ 1)) {
                int e = viaEdge[v];
                capacity.set(e, capacity.get(e) - push);
                capacity.set(e ^ 1, capacity.get(e ^ 1) + push);
            }
            total = Math.addExact(total, Math.multiplyExact(dist[sink], (long) push));
        }
    }
}
