package com.raditha.correlator.matching;

import java.util.Arrays;

/**
 * Square matrix of assignment costs between rows (B side) and columns (A side).
 * Cells that no real pairing writes keep the padding cost of 1.0.
 */
public class CostMatrix {

    public static final double PADDING_COST = 1.0;

    private final double[][] costs;

    /**
     * Create an {@code size x size} matrix with every cell at
     * {@link #PADDING_COST}.
     */
    public CostMatrix(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        this.costs = new double[size][size];
        for (double[] row : costs) {
            Arrays.fill(row, PADDING_COST);
        }
    }

    /**
     * Copy an existing square matrix.
     *
     * @throws IllegalArgumentException if the matrix is ragged, not square or
     *                                  holds a negative or non-finite cost
     */
    public static CostMatrix of(double[][] values) {
        CostMatrix matrix = new CostMatrix(values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i].length != values.length) {
                throw new IllegalArgumentException(String.format(
                        "Cost matrix must be square: row %d has %d columns, expected %d",
                        i, values[i].length, values.length));
            }
            for (int j = 0; j < values.length; j++) {
                matrix.set(i, j, values[i][j]);
            }
        }
        return matrix;
    }

    public int size() {
        return costs.length;
    }

    public double get(int row, int column) {
        return costs[row][column];
    }

    public void set(int row, int column, double cost) {
        if (!Double.isFinite(cost) || cost < 0.0) {
            throw new IllegalArgumentException("cost must be finite and non-negative, got " + cost);
        }
        costs[row][column] = cost;
    }

    /**
     * Sum of the costs picked by an assignment of one column per row.
     */
    public double totalCost(int[] assignment) {
        double total = 0.0;
        for (int row = 0; row < assignment.length; row++) {
            total += costs[row][assignment[row]];
        }
        return total;
    }
}
