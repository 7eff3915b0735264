package db.minipg.exec;

import java.util.ArrayList;
import java.util.List;

/**
 * Nested loop equality join: {@code left[leftColumn] == right[rightColumn]}.
 * The right side is materialized on open; every left row is compared with every right
 * row (no index) and each match emits the left row merged with the right row's columns.
 * Left rows without a match are dropped, whatever join kind the statement declared.
 */
public class JoinOperator implements Operator {
    private final Operator left;
    private final Operator right;
    private final String leftColumn;
    private final String rightColumn;

    private List<Row> rightRows;
    private Row currentLeft;
    private int rightIndex;

    public JoinOperator(Operator left, Operator right, String leftColumn, String rightColumn) {
        this.left = left; this.right = right; this.leftColumn = leftColumn; this.rightColumn = rightColumn;
    }

    @Override
    public void open() {
        left.open();
        rightRows = new ArrayList<>();
        right.open();
        try {
            Row r;
            while ((r = right.next()) != null) rightRows.add(r);
        } finally {
            right.close();
        }
        currentLeft = left.next();
        rightIndex = 0;
    }

    @Override
    public Row next() {
        while (currentLeft != null) {
            Object lVal = currentLeft.get(leftColumn);
            while (rightIndex < rightRows.size()) {
                Row candidate = rightRows.get(rightIndex++);
                if (lVal != null && Values.equalsValue(lVal, candidate.get(rightColumn))) {
                    return currentLeft.merge(candidate);
                }
            }
            // every right row checked for this left row
            currentLeft = left.next();
            rightIndex = 0;
        }
        return null;
    }

    @Override
    public void close() {
        left.close();
        rightRows = null;
        currentLeft = null;
    }
}
