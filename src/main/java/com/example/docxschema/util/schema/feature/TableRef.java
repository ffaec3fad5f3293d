package com.example.docxschema.util.schema.feature;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * 表格形状引用
 *
 * 记录单元格所属表格（路径式ID，如 "t001"）以及在表格中的位置和表格整体行列数
 */
public final class TableRef {

    @JsonProperty("table_id")
    private final String tableId;

    @JsonProperty("row")
    private final int row;

    @JsonProperty("col")
    private final int col;

    @JsonProperty("row_count")
    private final int rowCount;

    @JsonProperty("col_count")
    private final int colCount;

    @JsonCreator
    public TableRef(@JsonProperty("table_id") String tableId,
                    @JsonProperty("row") int row,
                    @JsonProperty("col") int col,
                    @JsonProperty("row_count") int rowCount,
                    @JsonProperty("col_count") int colCount) {
        this.tableId = tableId;
        this.row = row;
        this.col = col;
        this.rowCount = rowCount;
        this.colCount = colCount;
    }

    public String getTableId() { return tableId; }
    public int getRow() { return row; }
    public int getCol() { return col; }
    public int getRowCount() { return rowCount; }
    public int getColCount() { return colCount; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TableRef)) return false;
        TableRef that = (TableRef) o;
        return row == that.row && col == that.col
                && rowCount == that.rowCount && colCount == that.colCount
                && Objects.equals(tableId, that.tableId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableId, row, col, rowCount, colCount);
    }

    @Override
    public String toString() {
        return tableId + ".r" + row + ".c" + col + " (" + rowCount + "x" + colCount + ")";
    }
}
