package com.example.allocation.service.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class HungarianAssignmentTest {

    private static HungarianAssignment.WeightFunction matrix(long[][] w) {
        return (r, c) -> w[r][c];
    }

    private static long totalWeight(int[] rowToCol, long[][] w) {
        long total = 0;
        for (int row = 0; row < rowToCol.length; row++) {
            if (rowToCol[row] != HungarianAssignment.UNASSIGNED) {
                total += w[row][rowToCol[row]];
            }
        }
        return total;
    }

    /** Exhaustive optimum over all partial injections row -> column, for cross-checking. */
    private static long bruteForce(long[][] w, int row, boolean[] usedCols) {
        if (row == w.length) {
            return 0;
        }
        long best = bruteForce(w, row + 1, usedCols);
        for (int c = 0; c < usedCols.length; c++) {
            if (!usedCols[c] && w[row][c] > 0) {
                usedCols[c] = true;
                best = Math.max(best, w[row][c] + bruteForce(w, row + 1, usedCols));
                usedCols[c] = false;
            }
        }
        return best;
    }

    @Nested
    @DisplayName("Known instances")
    class KnownInstances {

        @Test
        @DisplayName("should return all rows unassigned for an empty side")
        void emptyInput() {
            assertThat(HungarianAssignment.maximize(3, 0, (r, c) -> 1)).containsOnly(HungarianAssignment.UNASSIGNED);
            assertThat(HungarianAssignment.maximize(0, 4, (r, c) -> 1)).isEmpty();
        }

        @Test
        @DisplayName("should find the maximum-weight perfect matching of a square matrix")
        void square() {
            long[][] w = {
                    {7, 5, 1},
                    {6, 9, 2},
                    {3, 8, 4}
            };

            int[] result = HungarianAssignment.maximize(3, 3, matrix(w));

            // 7 + 9 + 4 = 20 beats every other permutation
            assertThat(result).containsExactly(0, 1, 2);
            assertThat(totalWeight(result, w)).isEqualTo(20);
        }

        @Test
        @DisplayName("should handle more rows than columns")
        void moreRowsThanColumns() {
            long[][] w = {
                    {1, 2},
                    {10, 3},
                    {4, 20}
            };

            int[] result = HungarianAssignment.maximize(3, 2, matrix(w));

            assertThat(result).containsExactly(HungarianAssignment.UNASSIGNED, 0, 1);
        }

        @Test
        @DisplayName("should never report a pair without an edge as assigned")
        void noEdgeNoAssignment() {
            long[][] w = {
                    {0, 0},
                    {5, 0}
            };

            int[] result = HungarianAssignment.maximize(2, 2, matrix(w));

            assertThat(result).containsExactly(HungarianAssignment.UNASSIGNED, 0);
        }
    }

    @Nested
    @DisplayName("Cross-check")
    class CrossCheck {

        @Test
        @DisplayName("should match the exhaustive optimum on random sparse matrices")
        void matchesBruteForce() {
            Random random = new Random(42);
            for (int trial = 0; trial < 200; trial++) {
                int rows = 1 + random.nextInt(5);
                int cols = 1 + random.nextInt(5);
                long[][] w = new long[rows][cols];
                for (long[] row : w) {
                    for (int c = 0; c < cols; c++) {
                        row[c] = random.nextInt(4) == 0 ? 0 : 1 + random.nextInt(1000);
                    }
                }

                int[] result = HungarianAssignment.maximize(rows, cols, matrix(w));

                long expected = bruteForce(w, 0, new boolean[cols]);
                assertThat(totalWeight(result, w))
                        .as("trial %d: %s", trial, Arrays.deepToString(w))
                        .isEqualTo(expected);
                assertThat(Arrays.stream(result).filter(c -> c != HungarianAssignment.UNASSIGNED))
                        .doesNotHaveDuplicates();
            }
        }
    }
}
