package com.jclean.examples;

import com.jclean.common.value.Value;
import com.jclean.console.TableRenderer;
import com.jclean.io.DelimitedTableReader;
import com.jclean.query.SortDirection;
import com.jclean.query.Sorter;
import com.jclean.rules.DenseRankRule;
import com.jclean.rules.RatioRule;
import com.jclean.rules.RequiredColumns;
import com.jclean.rules.RuleApplier;
import com.jclean.rules.SumRule;
import com.jclean.rules.ThresholdRule;
import com.jclean.table.Table;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Grades a table of student marks: a total, a percentage, a pass/fail result at
 * 40 marks per subject, and a dense rank by percentage.
 */
public class StudentMarksAnalyzer {
    public static final List<String> SUBJECTS = List.of("Math", "Science", "English");
    public static final double PASS_MARK = 40;

    private static final RequiredColumns REQUIRED = RequiredColumns.of("Name", "Math", "Science", "English");

    private final Sorter sorter = new Sorter();

    /**
     * Builds the graded table, sorted by percentage, highest first.
     *
     * @param marks Table with Name, Math, Science and English columns
     * @return The graded table with Total, Percentage, Result and Rank appended
     */
    public Table analyze(Table marks) {
        REQUIRED.check(marks);
        Table graded = RuleApplier.apply(marks,
            new SumRule("Total", SUBJECTS),
            new RatioRule("Percentage", "Total", SUBJECTS.size()),
            new ThresholdRule("Result", SUBJECTS, PASS_MARK),
            new DenseRankRule("Rank", "Percentage"));
        sorter.sort(graded, "Percentage", SortDirection.DESCENDING);
        return graded;
    }

    public static long countResult(Table graded, String result) {
        return graded.getColumnValues("Result").stream()
            .filter(value -> value.equals(Value.ofText(result)))
            .count();
    }

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            System.err.println("Usage: StudentMarksAnalyzer <marks.csv>");
            return;
        }
        Table graded = new StudentMarksAnalyzer().analyze(new DelimitedTableReader().read(Paths.get(args[0])));
        System.out.println(new TableRenderer().render(graded));
        System.out.println("Total students: " + graded.rowCount());
        System.out.println("Passed: " + countResult(graded, ThresholdRule.PASS));
        System.out.println("Failed: " + countResult(graded, ThresholdRule.FAIL));
        if (graded.rowCount() > 0) {
            System.out.println("Top performer: " + graded.getValue(0, "Name"));
        }
    }
}
