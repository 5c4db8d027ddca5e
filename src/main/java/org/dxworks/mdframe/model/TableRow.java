package org.dxworks.mdframe.model;

import java.util.List;

public record TableRow(int line, List<TableCell> cells) {

    public TableRow {
        cells = List.copyOf(cells);
    }
}
