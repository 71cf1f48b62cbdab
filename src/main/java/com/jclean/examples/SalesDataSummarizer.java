package com.jclean.examples;

import com.jclean.common.value.Numbers;
import com.jclean.console.TableRenderer;
import com.jclean.io.DelimitedTableReader;
import com.jclean.query.AggregateFunction;
import com.jclean.query.Aggregator;
import com.jclean.query.PivotTable;
import com.jclean.query.SortDirection;
import com.jclean.query.Sorter;
import com.jclean.rules.ProductRule;
import com.jclean.rules.RequiredColumns;
import com.jclean.rules.RuleApplier;
import com.jclean.table.Table;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Summarises sales records: revenue per line, totals, and revenue and quantity per item and per day.
 */
public class SalesDataSummarizer {
    private static final RequiredColumns REQUIRED = RequiredColumns.of("Date", "Item", "Quantity", "Price");

    private final Aggregator aggregator = new Aggregator();
    private final Sorter sorter = new Sorter();

    public static class SalesReport {
        private final Table sales;
        private final Table revenueByItem;
        private final Table quantityByItem;
        private final Table revenueByDate;

        SalesReport(Table sales, Table revenueByItem, Table quantityByItem, Table revenueByDate) {
            this.sales = sales;
            this.revenueByItem = revenueByItem;
            this.quantityByItem = quantityByItem;
            this.revenueByDate = revenueByDate;
        }

        /**
         * The input with a Revenue column appended.
         */
        public Table getSales() {
            return sales;
        }

        /**
         * Revenue per item, highest first.
         */
        public Table getRevenueByItem() {
            return revenueByItem;
        }

        public Table getQuantityByItem() {
            return quantityByItem;
        }

        public Table getRevenueByDate() {
            return revenueByDate;
        }

        public double getTotalRevenue() {
            return Numbers.sum(Numbers.nonNull(sales.getColumnValues("Revenue")));
        }

        public double getTotalQuantity() {
            return Numbers.sum(Numbers.nonNull(sales.getColumnValues("Quantity")));
        }

        public double getAveragePrice() {
            return Numbers.mean(Numbers.nonNull(sales.getColumnValues("Price")));
        }
    }

    public SalesReport summarize(Table salesTable) {
        REQUIRED.check(salesTable);
        Table sales = RuleApplier.apply(salesTable, new ProductRule("Revenue", List.of("Quantity", "Price")));
        return new SalesReport(sales,
            ranked(aggregator.pivot(sales, "Item", "Revenue", AggregateFunction.SUM)),
            ranked(aggregator.pivot(sales, "Item", "Quantity", AggregateFunction.SUM)),
            ranked(aggregator.pivot(sales, "Date", "Revenue", AggregateFunction.SUM)));
    }

    private Table ranked(PivotTable pivot) {
        Table table = pivot.asTable();
        sorter.sort(table, pivot.getAggregateColumn(), SortDirection.DESCENDING);
        return table;
    }

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            System.err.println("Usage: SalesDataSummarizer <sales.csv>");
            return;
        }
        SalesReport report = new SalesDataSummarizer().summarize(new DelimitedTableReader().read(Paths.get(args[0])));
        TableRenderer renderer = new TableRenderer();
        System.out.printf("Total revenue: %.2f%n", report.getTotalRevenue());
        System.out.printf("Items sold: %.0f%n", report.getTotalQuantity());
        System.out.printf("Average price: %.2f%n", report.getAveragePrice());
        System.out.println("\nDaily sales:\n" + renderer.render(report.getRevenueByDate()));
        System.out.println("Best selling items:\n" + renderer.render(report.getQuantityByItem()));
        System.out.println("Top revenue items:\n" + renderer.render(report.getRevenueByItem()));
    }
}
