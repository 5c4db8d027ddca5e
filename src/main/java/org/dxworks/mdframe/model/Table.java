package org.dxworks.mdframe.model;

import java.util.List;

/**
 * Pipe table: a header row, the delimiter row (recorded as {@code alignments}) and zero or more body rows.
 */
public record Table(int startLine, int endLine, List<TableAlignment> alignments, TableRow header,
                    List<TableRow> rows) implements Block {

    public Table {
        alignments = List.copyOf(alignments);
        rows = List.copyOf(rows);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
