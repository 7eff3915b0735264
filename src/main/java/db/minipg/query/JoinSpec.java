package db.minipg.query;

/**
 * Equality join condition {@code leftTable.leftColumn = rightTable.rightColumn}.
 * Columns are unqualified; the table qualifiers are null when the statement did not
 * write one. The right side always belongs to the joined table.
 */
public record JoinSpec(JoinKind kind, String leftTable, String leftColumn, String rightTable, String rightColumn) {

    public JoinSpec {
        if (kind == null) throw new IllegalArgumentException("join kind required");
        if (leftColumn == null || leftColumn.isBlank()) throw new IllegalArgumentException("left join column required");
        if (rightColumn == null || rightColumn.isBlank()) throw new IllegalArgumentException("right join column required");
    }

    public JoinSpec(JoinKind kind, String leftColumn, String rightColumn) {
        this(kind, null, leftColumn, null, rightColumn);
    }
}
