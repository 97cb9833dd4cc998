package ai.rshell.parser;

/**
 * Zero-based source span of a node. Columns are whatever unit the engine reports (tree-sitter: UTF-8 bytes).
 */
public record SourceRange(int startRow, int startColumn, int endRow, int endColumn) {

    public SourceRange {
        if (startRow < 0 || startColumn < 0 || endRow < 0 || endColumn < 0) {
            throw new IllegalArgumentException("negative position in range %d:%d-%d:%d"
                    .formatted(startRow, startColumn, endRow, endColumn));
        }
        if (endRow < startRow || (endRow == startRow && endColumn < startColumn)) {
            throw new IllegalArgumentException("range end precedes start: %d:%d-%d:%d"
                    .formatted(startRow, startColumn, endRow, endColumn));
        }
    }

    public boolean contains(SourceRange other) {
        return compare(startRow, startColumn, other.startRow, other.startColumn) <= 0
                && compare(endRow, endColumn, other.endRow, other.endColumn) >= 0;
    }

    private static int compare(int rowA, int colA, int rowB, int colB) {
        return rowA != rowB ? Integer.compare(rowA, rowB) : Integer.compare(colA, colB);
    }

    @Override
    public String toString() {
        return "%d:%d-%d:%d".formatted(startRow, startColumn, endRow, endColumn);
    }
}
