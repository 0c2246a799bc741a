package com.example.allocation.service.matching;

import java.util.Arrays;

/**
 * Maximum-weight bipartite assignment (Kuhn-Munkres with potentials, O(n²m)).
 *
 * <p>Weights are integers so results are exact and reproducible. A weight {@code <= 0} means
 * "no edge": such pairs are never reported as assigned. Iteration order and strict comparisons
 * are fixed, so identical input always yields the identical assignment.
 */
public final class HungarianAssignment {

    public static final int UNASSIGNED = -1;

    private static final long INF = Long.MAX_VALUE / 4;

    @FunctionalInterface
    public interface WeightFunction {
        long weight(int row, int col);
    }

    private HungarianAssignment() {
    }

    /**
     * @return for each row, the assigned column or {@link #UNASSIGNED}
     */
    public static int[] maximize(int rows, int cols, WeightFunction weights) {
        int[] rowToCol = new int[rows];
        Arrays.fill(rowToCol, UNASSIGNED);
        if (rows == 0 || cols == 0) {
            return rowToCol;
        }
        if (rows <= cols) {
            int[] colToRow = solve(rows, cols, (i, j) -> -positive(weights.weight(i, j)));
            for (int col = 0; col < cols; col++) {
                int row = colToRow[col];
                if (row != UNASSIGNED && weights.weight(row, col) > 0) {
                    rowToCol[row] = col;
                }
            }
        } else {
            int[] rowAsCol = solve(cols, rows, (i, j) -> -positive(weights.weight(j, i)));
            for (int row = 0; row < rows; row++) {
                int col = rowAsCol[row];
                if (col != UNASSIGNED && weights.weight(row, col) > 0) {
                    rowToCol[row] = col;
                }
            }
        }
        return rowToCol;
    }

    private static long positive(long weight) {
        return weight > 0 ? weight : 0;
    }

    /**
     * Minimum-cost assignment of every one of n rows to a distinct column among m >= n.
     * Returns, for each column, the row assigned to it or {@link #UNASSIGNED}.
     */
    private static int[] solve(int n, int m, WeightFunction cost) {
        long[] u = new long[n + 1];
        long[] v = new long[m + 1];
        int[] p = new int[m + 1];
        int[] way = new int[m + 1];
        long[] minv = new long[m + 1];
        boolean[] used = new boolean[m + 1];

        for (int i = 1; i <= n; i++) {
            p[0] = i;
            int j0 = 0;
            Arrays.fill(minv, INF);
            Arrays.fill(used, false);
            do {
                used[j0] = true;
                int i0 = p[j0];
                long delta = INF;
                int j1 = 0;
                for (int j = 1; j <= m; j++) {
                    if (!used[j]) {
                        long cur = cost.weight(i0 - 1, j - 1) - u[i0] - v[j];
                        if (cur < minv[j]) {
                            minv[j] = cur;
                            way[j] = j0;
                        }
                        if (minv[j] < delta) {
                            delta = minv[j];
                            j1 = j;
                        }
                    }
                }
                for (int j = 0; j <= m; j++) {
                    if (used[j]) {
                        u[p[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minv[j] -= delta;
                    }
                }
                j0 = j1;
            } while (p[j0] != 0);
            do {
                int j1 = way[j0];
                p[j0] = p[j1];
                j0 = j1;
            } while (j0 != 0);
        }

        int[] colToRow = new int[m];
        for (int j = 1; j <= m; j++) {
            colToRow[j - 1] = p[j] == 0 ? UNASSIGNED : p[j] - 1;
        }
        return colToRow;
    }
}
