package com.odin.peer_mesh_service.component;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

/**
 * Grid used by the recording canvas: 1x1, 2x2 and 3x3 for up to one, four
 * and nine tiles, four columns beyond that.
 */
public final class GridLayout {

    private GridLayout() {
    }

    public static int columns(int tiles) {
        if (tiles <= 1) {
            return 1;
        }
        if (tiles <= 4) {
            return 2;
        }
        if (tiles <= 9) {
            return 3;
        }
        return 4;
    }

    public static int rows(int tiles) {
        if (tiles <= 1) {
            return 1;
        }
        if (tiles <= 9) {
            return columns(tiles);
        }
        return (tiles + 3) / 4;
    }

    /**
     * Cells in row-major order, one per tile.
     */
    public static List<Rectangle> cells(int tiles, int width, int height) {
        if (tiles <= 0) {
            return List.of();
        }
        int columns = columns(tiles);
        int rows = rows(tiles);
        int cellWidth = width / columns;
        int cellHeight = height / rows;
        List<Rectangle> cells = new ArrayList<>(tiles);
        for (int i = 0; i < tiles; i++) {
            cells.add(new Rectangle((i % columns) * cellWidth, (i / columns) * cellHeight, cellWidth, cellHeight));
        }
        return cells;
    }
}
