package com.raditha.correlator.matching;

import java.util.Arrays;

/**
 * Exact minimum-cost perfect matching on a square cost matrix
 * (Kuhn–Munkres / Hungarian algorithm).
 *
 * <p>Rows are added one at a time; each is connected through a shortest
 * augmenting path over reduced costs, with row and column potentials kept
 * feasible throughout. Runs in O(n³) time and O(n) extra space besides the
 * matrix.
 */
public class HungarianSolver {

    /**
     * Solve the assignment problem.
     *
     * @param matrix Square cost matrix
     * @return Column assigned to each row
     */
    public int[] solve(CostMatrix matrix) {
        int n = matrix.size();
        if (n == 0) {
            return new int[0];
        }

        // 1-based arrays; column 0 is a virtual column used to start each augmentation
        double[] rowPotential = new double[n + 1];
        double[] colPotential = new double[n + 1];
        int[] rowOfColumn = new int[n + 1];
        int[] previousColumn = new int[n + 1];

        for (int row = 1; row <= n; row++) {
            rowOfColumn[0] = row;
            double[] minSlack = new double[n + 1];
            boolean[] visited = new boolean[n + 1];
            Arrays.fill(minSlack, Double.POSITIVE_INFINITY);
            int currentCol = 0;

            do {
                visited[currentCol] = true;
                int currentRow = rowOfColumn[currentCol];
                double delta = Double.POSITIVE_INFINITY;
                int nextCol = 0;

                for (int col = 1; col <= n; col++) {
                    if (visited[col]) {
                        continue;
                    }
                    double reduced = matrix.get(currentRow - 1, col - 1)
                            - rowPotential[currentRow] - colPotential[col];
                    if (reduced < minSlack[col]) {
                        minSlack[col] = reduced;
                        previousColumn[col] = currentCol;
                    }
                    if (minSlack[col] < delta) {
                        delta = minSlack[col];
                        nextCol = col;
                    }
                }

                for (int col = 0; col <= n; col++) {
                    if (visited[col]) {
                        rowPotential[rowOfColumn[col]] += delta;
                        colPotential[col] -= delta;
                    } else {
                        minSlack[col] -= delta;
                    }
                }
                currentCol = nextCol;
            } while (rowOfColumn[currentCol] != 0);

            // Flip the augmenting path back to the virtual column
            do {
                int prev = previousColumn[currentCol];
                rowOfColumn[currentCol] = rowOfColumn[prev];
                currentCol = prev;
            } while (currentCol != 0);
        }

        int[] assignment = new int[n];
        for (int col = 1; col <= n; col++) {
            assignment[rowOfColumn[col] - 1] = col - 1;
        }
        return assignment;
    }

    /**
     * Solve the assignment problem for a raw {@code double[][]} matrix.
     *
     * @throws IllegalArgumentException if the matrix is not square
     */
    public int[] solve(double[][] costs) {
        return solve(CostMatrix.of(costs));
    }
}
