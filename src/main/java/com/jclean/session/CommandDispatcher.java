package com.jclean.session;

import com.jclean.cleaning.DedupReport;
import com.jclean.cleaning.Deduplicator;
import com.jclean.cleaning.ImputePolicy;
import com.jclean.cleaning.ImputeResult;
import com.jclean.cleaning.MissingValueHandler;
import com.jclean.cleaning.MissingValueReport;
import com.jclean.cleaning.RetypeReport;
import com.jclean.cleaning.TypeCoercer;
import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.io.DelimitedTableReader;
import com.jclean.io.Persister;
import com.jclean.io.TableLoader;
import com.jclean.query.AggregateFunction;
import com.jclean.query.Aggregator;
import com.jclean.query.PivotTable;
import com.jclean.query.Searcher;
import com.jclean.query.SortDirection;
import com.jclean.query.Sorter;
import com.jclean.query.Summary;
import com.jclean.query.SummaryReporter;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Routes commands to table operations, enforcing the session's state machine.
 * <p>
 * LOAD and EXIT are accepted in any state; every other command needs a loaded
 * table and fails with PRECONDITION otherwise. The dispatcher only looks at
 * whether a table is loaded, never at its contents. Failures come back as
 * {@link CommandResult#failure} values and leave the session's table as it was.
 */
public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final Session session;
    private final TableLoader loader;
    private final Persister persister;
    private final TypeCoercer coercer = new TypeCoercer();
    private final MissingValueHandler missingValueHandler = new MissingValueHandler();
    private final Deduplicator deduplicator = new Deduplicator();
    private final Searcher searcher = new Searcher();
    private final Sorter sorter = new Sorter();
    private final Aggregator aggregator = new Aggregator();
    private final SummaryReporter summaryReporter = new SummaryReporter();

    public CommandDispatcher(Session session) {
        this(session, new EngineConfig.Builder().build());
    }

    public CommandDispatcher(Session session, EngineConfig config) {
        this(session,
            new TableLoader(new DelimitedTableReader(config.getDelimiter())),
            new Persister(config.getOutputDirectory(), config.getCompressionCodec(),
                config.getDelimiter(), config.getClock()));
    }

    public CommandDispatcher(Session session, TableLoader loader, Persister persister) {
        this.session = session;
        this.loader = loader;
        this.persister = persister;
    }

    public Session getSession() {
        return session;
    }

    /**
     * Runs one command against the session.
     *
     * @param command The command to run
     * @return The command's payload, or the reason it failed
     */
    public CommandResult<?> dispatch(Command command) {
        switch (command.getType()) {
            case LOAD:
                return load(command.getSource());
            case IMPUTE:
                return impute(command.getPolicy());
            case DEDUP:
                return dedup();
            case RETYPE:
                return retype(command.getColumn(), command.getColumnType());
            case SEARCH:
                return search(command.getColumn(), command.getQuery());
            case SORT:
                return sort(command.getColumn(), command.getDirection());
            case PIVOT:
                return pivot(command.getColumn(), command.getValueColumn(), command.getFunction());
            case SUMMARIZE:
                return summarize();
            case PERSIST:
                return persist();
            case MISSING_REPORT:
                return missingReport();
            default:
                return exit();
        }
    }

    public CommandResult<Table> load(String source) {
        return run(CommandType.LOAD, () -> {
            Table table = loader.load(argument(source, "source"));
            session.replaceTable(table);
            return table;
        });
    }

    public CommandResult<ImputeResult> impute(ImputePolicy policy) {
        return run(CommandType.IMPUTE, () -> missingValueHandler.impute(session.requireTable(), argument(policy, "policy")));
    }

    public CommandResult<DedupReport> dedup() {
        return run(CommandType.DEDUP, () -> deduplicator.deduplicate(session.requireTable()));
    }

    public CommandResult<RetypeReport> retype(String column, ColumnType type) {
        return run(CommandType.RETYPE, () -> coercer.retype(session.requireTable(), argument(column, "column"), argument(type, "type")));
    }

    public CommandResult<Table> search(String column, String query) {
        return run(CommandType.SEARCH, () -> searcher.search(session.requireTable(), argument(column, "column"), argument(query, "query")));
    }

    public CommandResult<Table> sort(String column, SortDirection direction) {
        return run(CommandType.SORT, () -> {
            Table table = session.requireTable();
            sorter.sort(table, argument(column, "column"), argument(direction, "direction"));
            return table;
        });
    }

    public CommandResult<PivotTable> pivot(String keyColumn, String valueColumn, AggregateFunction function) {
        return run(CommandType.PIVOT,
            () -> aggregator.pivot(session.requireTable(), argument(keyColumn, "keyColumn"),
                argument(valueColumn, "valueColumn"), argument(function, "function")));
    }

    public CommandResult<Summary> summarize() {
        return run(CommandType.SUMMARIZE, () -> summaryReporter.summarize(session.requireTable()));
    }

    public CommandResult<Path> persist() {
        return run(CommandType.PERSIST, () -> persister.persist(session.requireTable()));
    }

    public CommandResult<MissingValueReport> missingReport() {
        return run(CommandType.MISSING_REPORT, () -> missingValueHandler.report(session.requireTable()));
    }

    public CommandResult<Void> exit() {
        return run(CommandType.EXIT, () -> {
            session.finish();
            return null;
        });
    }

    private static <T> T argument(T value, String name) {
        if (value == null) {
            throw new CleaningException(ErrorKind.INVALID_ARGUMENT, name + " cannot be null");
        }
        return value;
    }

    private <T> CommandResult<T> run(CommandType type, Supplier<T> operation) {
        if (!type.isAllowedIn(session.getState())) {
            logger.debug("Rejected {} in state {}", type, session.getState());
            return CommandResult.failure(ErrorKind.PRECONDITION, "No table loaded. Please load a file first.");
        }
        try {
            return CommandResult.success(operation.get());
        } catch (CleaningException e) {
            logger.info("{} failed: {}", type, e.getMessage());
            return CommandResult.failure(e.getKind(), e.getMessage());
        }
    }
}
