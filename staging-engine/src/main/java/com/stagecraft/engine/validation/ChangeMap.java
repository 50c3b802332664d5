package com.stagecraft.engine.validation;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Which coarse cells of the scene changed between two samples.
 *
 * The {@value ImageSample#GRID}-sample grid is split into
 * {@value #CELLS}x{@value #CELLS} cells; a cell counts as changed when the
 * mean absolute luminance difference across its samples exceeds
 * {@link #CHANGE_THRESHOLD}. Connected groups of changed cells
 * (4-connectivity) approximate individual added items.
 */
public final class ChangeMap {

    public static final int    CELLS            = 8;
    public static final double CHANGE_THRESHOLD = 12.0;

    private static final int CELL_SIZE = ImageSample.GRID / CELLS;

    private final boolean[][] changed = new boolean[CELLS][CELLS];   // [row][col]

    public ChangeMap(ImageSample before, ImageSample after) {
        for (int row = 0; row < CELLS; row++) {
            for (int col = 0; col < CELLS; col++) {
                double diff = 0;
                for (int y = row * CELL_SIZE; y < (row + 1) * CELL_SIZE; y++) {
                    for (int x = col * CELL_SIZE; x < (col + 1) * CELL_SIZE; x++) {
                        diff += Math.abs(after.luma(x, y) - before.luma(x, y));
                    }
                }
                changed[row][col] = diff / (CELL_SIZE * CELL_SIZE) > CHANGE_THRESHOLD;
            }
        }
    }

    public boolean isChanged(int row, int col) {
        return changed[row][col];
    }

    public int changedCellCount() {
        int n = 0;
        for (boolean[] row : changed) {
            for (boolean c : row) if (c) n++;
        }
        return n;
    }

    /** Number of 4-connected regions of changed cells. */
    public int regionCount() {
        boolean[][] seen = new boolean[CELLS][CELLS];
        int regions = 0;
        for (int row = 0; row < CELLS; row++) {
            for (int col = 0; col < CELLS; col++) {
                if (changed[row][col] && !seen[row][col]) {
                    regions++;
                    flood(row, col, seen);
                }
            }
        }
        return regions;
    }

    /** Fraction of cells in the bottom 'rows' rows that changed. */
    public double coverageOfBottomRows(int rows) {
        int n = 0;
        for (int row = CELLS - rows; row < CELLS; row++) {
            for (int col = 0; col < CELLS; col++) {
                if (changed[row][col]) n++;
            }
        }
        return (double) n / (rows * CELLS);
    }

    private void flood(int startRow, int startCol, boolean[][] seen) {
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[] {startRow, startCol});
        seen[startRow][startCol] = true;
        while (!stack.isEmpty()) {
            int[] cell = stack.pop();
            int[][] neighbours = {
                    {cell[0] - 1, cell[1]}, {cell[0] + 1, cell[1]},
                    {cell[0], cell[1] - 1}, {cell[0], cell[1] + 1}};
            for (int[] n : neighbours) {
                if (n[0] < 0 || n[0] >= CELLS || n[1] < 0 || n[1] >= CELLS) continue;
                if (changed[n[0]][n[1]] && !seen[n[0]][n[1]]) {
                    seen[n[0]][n[1]] = true;
                    stack.push(n);
                }
            }
        }
    }
}
