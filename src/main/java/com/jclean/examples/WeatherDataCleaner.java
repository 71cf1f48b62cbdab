package com.jclean.examples;

import com.jclean.cleaning.ImputePolicy;
import com.jclean.cleaning.MissingValueHandler;
import com.jclean.cleaning.MissingValueReport;
import com.jclean.cleaning.TypeCoercer;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.value.Numbers;
import com.jclean.console.TableRenderer;
import com.jclean.io.DelimitedTableReader;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.OptionalDouble;
import java.util.stream.DoubleStream;

/**
 * Cleans daily weather readings. Each of Date, Temperature, Humidity and Rainfall
 * is handled only when the table has it: temperature gaps take the column mean,
 * humidity gaps the median, missing rainfall counts as none, and dates become
 * DATETIME.
 */
public class WeatherDataCleaner {
    private static final Logger logger = LoggerFactory.getLogger(WeatherDataCleaner.class);

    public static final String DATE = "Date";
    public static final String TEMPERATURE = "Temperature";
    public static final String HUMIDITY = "Humidity";
    public static final String RAINFALL = "Rainfall";

    private final MissingValueHandler missingValueHandler = new MissingValueHandler();
    private final TypeCoercer coercer = new TypeCoercer();

    public static class WeatherReport {
        private final Table cleaned;
        private final MissingValueReport missingBefore;

        WeatherReport(Table cleaned, MissingValueReport missingBefore) {
            this.cleaned = cleaned;
            this.missingBefore = missingBefore;
        }

        public Table getCleaned() {
            return cleaned;
        }

        /**
         * Missing cells per column as loaded, before any fill.
         */
        public MissingValueReport getMissingBefore() {
            return missingBefore;
        }

        public OptionalDouble getMaxTemperature() {
            return stream(TEMPERATURE).max();
        }

        public OptionalDouble getMinTemperature() {
            return stream(TEMPERATURE).min();
        }

        public OptionalDouble getAverageTemperature() {
            return stream(TEMPERATURE).average();
        }

        public OptionalDouble getTotalRainfall() {
            double[] values = values(RAINFALL);
            return values == null ? OptionalDouble.empty() : OptionalDouble.of(Numbers.sum(values));
        }

        public OptionalDouble getAverageRainfall() {
            return stream(RAINFALL).average();
        }

        public OptionalDouble getAverageHumidity() {
            return stream(HUMIDITY).average();
        }

        private DoubleStream stream(String column) {
            double[] values = values(column);
            return values == null ? DoubleStream.empty() : Arrays.stream(values);
        }

        // null when the column is absent or not numeric
        private double[] values(String column) {
            if (!cleaned.hasColumn(column) || !cleaned.getType(column).isNumeric()) {
                return null;
            }
            return Numbers.nonNull(cleaned.getColumnValues(column));
        }
    }

    /**
     * Cleans a copy of the readings; the input table is not modified.
     *
     * @throws com.jclean.common.CleaningException AGGREGATION when Temperature or
     *         Humidity is present but not numeric
     */
    public WeatherReport clean(Table weather) {
        Table cleaned = new Table(weather.getSchema(), weather.getRows(), weather.getSourceName().orElse(null));
        MissingValueReport before = missingValueHandler.report(cleaned);
        if (before.hasMissing()) {
            logger.info("Found {} missing values", before.getTotalMissing());
        }

        if (cleaned.hasColumn(TEMPERATURE)) {
            missingValueHandler.imputeColumn(cleaned, TEMPERATURE, ImputePolicy.fillMean());
        }
        if (cleaned.hasColumn(HUMIDITY)) {
            missingValueHandler.imputeColumn(cleaned, HUMIDITY, ImputePolicy.fillMedian());
        }
        if (cleaned.hasColumn(RAINFALL)) {
            missingValueHandler.imputeColumn(cleaned, RAINFALL, ImputePolicy.fillLiteral("0"));
        }
        if (cleaned.hasColumn(DATE) && cleaned.getType(DATE) != ColumnType.DATETIME) {
            coercer.retype(cleaned, DATE, ColumnType.DATETIME);
        }
        return new WeatherReport(cleaned, before);
    }

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            System.err.println("Usage: WeatherDataCleaner <weather.csv>");
            return;
        }
        WeatherReport report = new WeatherDataCleaner().clean(new DelimitedTableReader().read(Paths.get(args[0])));
        System.out.println(report.getMissingBefore());
        System.out.println(new TableRenderer().render(report.getCleaned()));
        report.getMaxTemperature().ifPresent(t -> System.out.printf("Max temperature: %.1f C%n", t));
        report.getMinTemperature().ifPresent(t -> System.out.printf("Min temperature: %.1f C%n", t));
        report.getAverageTemperature().ifPresent(t -> System.out.printf("Average temperature: %.1f C%n", t));
        report.getTotalRainfall().ifPresent(r -> System.out.printf("Total rainfall: %.1f mm%n", r));
        report.getAverageRainfall().ifPresent(r -> System.out.printf("Average rainfall: %.1f mm%n", r));
        report.getAverageHumidity().ifPresent(h -> System.out.printf("Average humidity: %.1f%%%n", h));
    }
}
