package com.jclean.console;

import com.jclean.cleaning.DedupReport;
import com.jclean.cleaning.ImputePolicy;
import com.jclean.cleaning.ImputeResult;
import com.jclean.cleaning.MissingValueReport;
import com.jclean.cleaning.RetypeReport;
import com.jclean.common.schema.Column;
import com.jclean.common.schema.ColumnType;
import com.jclean.query.AggregateFunction;
import com.jclean.query.PivotTable;
import com.jclean.query.SortDirection;
import com.jclean.query.Summary;
import com.jclean.session.CommandDispatcher;
import com.jclean.session.CommandResult;
import com.jclean.table.Table;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Menu-driven console front end. Collects arguments for each command, hands the
 * command to the dispatcher and prints the outcome. End of input exits.
 */
public class ConsoleApp {
    private static final String RULE = "=".repeat(50);
    private static final List<ColumnType> TYPE_CHOICES =
        List.of(ColumnType.INTEGER, ColumnType.FLOAT, ColumnType.TEXT, ColumnType.DATETIME);
    private static final List<AggregateFunction> AGGREGATE_CHOICES = List.of(
        AggregateFunction.SUM, AggregateFunction.MEAN, AggregateFunction.COUNT,
        AggregateFunction.MAX, AggregateFunction.MIN);

    private final CommandDispatcher dispatcher;
    private final BufferedReader in;
    private final PrintStream out;
    private final TableRenderer renderer;

    public ConsoleApp(CommandDispatcher dispatcher, BufferedReader in, PrintStream out) {
        this.dispatcher = dispatcher;
        this.in = in;
        this.out = out;
        this.renderer = new TableRenderer(50);
    }

    public void run() throws IOException {
        out.println("Welcome to the Data Cleaning Automation Tool!");
        while (!dispatcher.getSession().isFinished()) {
            displayMenu();
            String choice = prompt("\nEnter your choice (0-9): ");
            if (choice == null) {
                dispatcher.exit();
                break;
            }
            handle(choice.trim());
        }
        out.println("\nThank you for using the Data Cleaning Tool!");
    }

    private void displayMenu() {
        out.println();
        out.println(RULE);
        out.println("      DATA CLEANING AUTOMATION TOOL");
        out.println(RULE);
        out.println("1. Load CSV File");
        out.println("2. Handle Missing Values");
        out.println("3. Remove Duplicates");
        out.println("4. Change Data Type");
        out.println("5. Search Data");
        out.println("6. Sort Data");
        out.println("7. Create Pivot Table");
        out.println("8. View Data Summary");
        out.println("9. Save Cleaned Data");
        out.println("0. Exit");
        out.println(RULE);
    }

    void handle(String choice) throws IOException {
        switch (choice) {
            case "0":
                dispatcher.exit();
                break;
            case "1":
                load();
                break;
            case "2":
                handleMissing();
                break;
            case "3":
                report(dispatcher.dedup(), (DedupReport report) -> out.println(report));
                break;
            case "4":
                changeType();
                break;
            case "5":
                search();
                break;
            case "6":
                sort();
                break;
            case "7":
                pivot();
                break;
            case "8":
                report(dispatcher.summarize(), (Summary summary) -> out.print(renderer.render(summary)));
                break;
            case "9":
                report(dispatcher.persist(), (Path path) -> out.println("Data saved successfully as: " + path));
                break;
            default:
                out.println("\nInvalid choice! Please enter 0-9.");
        }
    }

    private void load() throws IOException {
        String path = prompt("Enter CSV file path: ");
        if (path == null) {
            return;
        }
        report(dispatcher.load(path), (Table table) -> {
            out.printf("File loaded successfully!%nData shape: %d rows, %d columns%n",
                table.rowCount(), table.columnCount());
            out.println("Columns: " + table.getColumnNames());
        });
    }

    private void handleMissing() throws IOException {
        CommandResult<MissingValueReport> missing = dispatcher.missingReport();
        if (!missing.isSuccess()) {
            printFailure(missing);
            return;
        }
        out.println("Missing values per column:");
        out.print(renderer.render(missing.getPayload()));
        if (!missing.getPayload().hasMissing()) {
            return;
        }
        out.println("\nOptions:");
        out.println("1. Drop rows with missing values");
        out.println("2. Fill with mean (numeric columns)");
        out.println("3. Fill with median (numeric columns)");
        out.println("4. Fill with custom value");
        String option = prompt("Choose option (1-4): ");
        ImputePolicy policy;
        switch (option == null ? "" : option.trim()) {
            case "1":
                policy = ImputePolicy.dropRows();
                break;
            case "2":
                policy = ImputePolicy.fillMean();
                break;
            case "3":
                policy = ImputePolicy.fillMedian();
                break;
            case "4":
                String value = prompt("Enter value to fill missing data: ");
                if (value == null) {
                    return;
                }
                policy = ImputePolicy.fillLiteral(value);
                break;
            default:
                out.println("Invalid option.");
                return;
        }
        report(dispatcher.impute(policy), (ImputeResult result) -> out.println(result));
    }

    private void changeType() throws IOException {
        String column = chooseColumn("\nEnter column number: ", true);
        if (column == null) {
            return;
        }
        out.println("\nData type options:");
        out.println("1. Integer (int)");
        out.println("2. Float (float)");
        out.println("3. String (str)");
        out.println("4. DateTime");
        Integer choice = readIndex("Choose data type (1-4): ", TYPE_CHOICES.size());
        if (choice == null) {
            return;
        }
        report(dispatcher.retype(column, TYPE_CHOICES.get(choice)), (RetypeReport result) -> out.println(result));
    }

    private void search() throws IOException {
        String column = chooseColumn("\nEnter column number to search: ", false);
        if (column == null) {
            return;
        }
        String query = prompt("Enter value to search in '" + column + "': ");
        if (query == null) {
            return;
        }
        report(dispatcher.search(column, query), (Table results) -> {
            out.println("\nFound " + results.rowCount() + " matching records:");
            out.print(results.rowCount() > 0 ? renderer.render(results) : "No matching records found.\n");
        });
    }

    private void sort() throws IOException {
        String column = chooseColumn("\nEnter column number to sort by: ", false);
        if (column == null) {
            return;
        }
        String order = prompt("Sort ascending? (y/n): ");
        SortDirection direction = order != null && order.trim().equalsIgnoreCase("y")
            ? SortDirection.ASCENDING
            : SortDirection.DESCENDING;
        report(dispatcher.sort(column, direction), (Table table) ->
            out.println("Data sorted by '" + column + "' (" + direction.name().toLowerCase(Locale.ROOT) + ")"));
    }

    private void pivot() throws IOException {
        String key = chooseColumn("\nEnter column number for rows (index): ", false);
        if (key == null) {
            return;
        }
        String value = chooseColumn("Enter column number for values: ", false);
        if (value == null) {
            return;
        }
        out.println("\nAggregation options:");
        out.println("1. Sum");
        out.println("2. Mean");
        out.println("3. Count");
        out.println("4. Max");
        out.println("5. Min");
        String choice = prompt("Choose aggregation (1-5): ");
        // unrecognised choices fall back to sum
        int index = choice == null ? -1 : parseChoice(choice);
        AggregateFunction chosen = index >= 0 && index < AGGREGATE_CHOICES.size()
            ? AGGREGATE_CHOICES.get(index)
            : AggregateFunction.SUM;
        report(dispatcher.pivot(key, value, chosen), (PivotTable pivot) -> {
            out.printf("%nPivot Table (%s of %s by %s):%n", chosen.label(), value, key);
            out.print(renderer.render(pivot.asTable()));
        });
    }

    /**
     * Lists the table's columns and reads a 1-based choice.
     *
     * @return The chosen column name, or null if there is no table or the choice is invalid
     */
    private String chooseColumn(String question, boolean withTypes) throws IOException {
        Table table = dispatcher.getSession().getTable().orElse(null);
        if (table == null) {
            out.println("\nNo table loaded. Please load a CSV file first (option 1)");
            return null;
        }
        out.println("Available columns:");
        List<Column> columns = table.getSchema().getColumns();
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            out.println((i + 1) + ". " + (withTypes ? column.toString() : column.getName()));
        }
        Integer index = readIndex(question, columns.size());
        return index == null ? null : columns.get(index).getName();
    }

    private Integer readIndex(String question, int size) throws IOException {
        String answer = prompt(question);
        if (answer == null) {
            return null;
        }
        int index = parseChoice(answer);
        if (index >= 0 && index < size) {
            return index;
        }
        out.println("Error: invalid choice '" + answer.trim() + "'");
        return null;
    }

    /**
     * @return The zero-based index of a 1-based menu answer, or -1 if it is not a number
     */
    private static int parseChoice(String answer) {
        String trimmed = answer.trim();
        return trimmed.matches("\\d{1,9}") ? Integer.parseInt(trimmed) - 1 : -1;
    }

    private String prompt(String question) throws IOException {
        out.print(question);
        out.flush();
        return in.readLine();
    }

    private <T> void report(CommandResult<T> result, PayloadPrinter<T> printer) {
        if (result.isSuccess()) {
            printer.print(result.getPayload());
        } else {
            printFailure(result);
        }
    }

    private void printFailure(CommandResult<?> result) {
        out.println("Error (" + result.getErrorKind() + "): " + result.getMessage());
    }

    @FunctionalInterface
    private interface PayloadPrinter<T> {
        void print(T payload);
    }
}
