package com.lazyframe.api;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.Literal;
import com.lazyframe.expression.SortOrder;
import com.lazyframe.expression.UnresolvedColumn;
import com.lazyframe.expression.WindowFunction;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Distinct;
import com.lazyframe.logical.Explode;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.JoinOptions;
import com.lazyframe.logical.JoinType;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.PlanPrinter;
import com.lazyframe.logical.Project;
import com.lazyframe.logical.Scan;
import com.lazyframe.logical.Slice;
import com.lazyframe.logical.Sort;
import com.lazyframe.logical.Union;
import com.lazyframe.logical.Unpivot;
import com.lazyframe.logical.Upsample;
import com.lazyframe.logical.Window;
import com.lazyframe.logical.WithColumns;
import com.lazyframe.runtime.ArrowBatchIterator;
import com.lazyframe.runtime.CancellationToken;
import com.lazyframe.runtime.EngineConfig;
import com.lazyframe.runtime.QueryExecutor;
import com.lazyframe.source.ArrowDataSource;
import com.lazyframe.source.BatchStream;
import com.lazyframe.source.DataSource;
import com.lazyframe.source.InMemoryDataSource;
import com.lazyframe.temporal.Duration;
import com.lazyframe.temporal.Upsampler;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A lazily evaluated query over one or more data sources.
 *
 * <p>Every transformation returns a new frame wrapping a larger logical plan; nothing runs
 * until one of the {@code collect} methods is called. Expressions are resolved against the
 * input schema as soon as a transformation is applied, so unknown columns, type errors and
 * misplaced aggregates fail at the call that introduces them.
 *
 * <p>Frames are immutable and may be shared between threads. Each {@code collect} is an
 * independent execution of the same plan.
 *
 * <p>Example:
 * <pre>
 *   LazyFrame orders = LazyFrame.scan(ordersSource);
 *   ColumnarBatch result = orders
 *       .filter(col("status").eq("shipped"))
 *       .groupBy("region")
 *       .agg(col("amount").sum().alias("total"))
 *       .sort(col("total").desc())
 *       .head(10)
 *       .collect();
 * </pre>
 */
public final class LazyFrame {

    private static final Logger logger = LoggerFactory.getLogger(LazyFrame.class);

    private static final String WINDOW_PREFIX = "__window_";

    private final LogicalPlan plan;
    private final EngineConfig config;

    private LazyFrame(LogicalPlan plan, EngineConfig config) {
        this.plan = Objects.requireNonNull(plan, "plan must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    // ==================== Construction ====================

    /**
     * Starts a query that scans a data source.
     *
     * @param source the source
     * @return the frame
     */
    public static LazyFrame scan(DataSource source) {
        return new LazyFrame(new Scan(source), EngineConfig.defaults());
    }

    /**
     * Starts a query over an in-memory batch.
     *
     * @param name the source name shown in plans
     * @param batch the data
     * @return the frame
     */
    public static LazyFrame fromBatch(String name, ColumnarBatch batch) {
        return scan(InMemoryDataSource.of(name, batch));
    }

    /**
     * Starts a query over Arrow record batches. The roots must stay open while the frame is
     * collected.
     *
     * @param name the source name shown in plans
     * @param roots the record batches
     * @return the frame
     */
    public static LazyFrame fromArrow(String name, List<VectorSchemaRoot> roots) {
        return scan(new ArrowDataSource(name, roots));
    }

    /**
     * Wraps an existing logical plan.
     *
     * @param plan the plan
     * @return the frame
     */
    public static LazyFrame of(LogicalPlan plan) {
        return new LazyFrame(plan, EngineConfig.defaults());
    }

    /**
     * Returns a frame that executes with the given configuration.
     *
     * @param newConfig the configuration used by {@code collect} and {@code explain}
     * @return the frame
     */
    public LazyFrame withConfig(EngineConfig newConfig) {
        return new LazyFrame(plan, newConfig);
    }

    public LogicalPlan logicalPlan() {
        return plan;
    }

    public EngineConfig config() {
        return config;
    }

    public StructType schema() {
        return plan.schema();
    }

    public List<String> columns() {
        return plan.schema().names();
    }

    // ==================== Row-wise transformations ====================

    public LazyFrame filter(Expression condition) {
        logger.debug("Adding filter: {}", condition);
        return next(new Filter(plan, condition));
    }

    /**
     * Replaces the columns with the given expressions. Strings select columns by name.
     *
     * @param exprs column names or expressions, window functions included
     * @return the frame
     */
    public LazyFrame select(Object... exprs) {
        return select(toExpressions(exprs));
    }

    public LazyFrame select(List<? extends Expression> exprs) {
        logger.debug("Selecting {} columns", exprs.size());
        return next(withWindows(exprs, Project::new));
    }

    /**
     * Adds columns, or replaces columns of the same name in place.
     *
     * @param exprs the new columns, window functions included
     * @return the frame
     */
    public LazyFrame withColumns(Expression... exprs) {
        return withColumns(Arrays.asList(exprs));
    }

    public LazyFrame withColumns(List<? extends Expression> exprs) {
        logger.debug("Adding {} columns", exprs.size());
        List<String> inputNames = plan.schema().names();
        LogicalPlan result = withWindows(exprs, WithColumns::new);
        if (result.child() instanceof Window) {
            // Drop the intermediate window columns, keep input order then new columns
            List<String> names = new ArrayList<>();
            for (String name : result.schema().names()) {
                if (!name.startsWith(WINDOW_PREFIX) || inputNames.contains(name)) {
                    names.add(name);
                }
            }
            result = Project.columns(result, names);
        }
        return next(result);
    }

    public LazyFrame withColumn(Expression expr) {
        return withColumns(List.of(expr));
    }

    public LazyFrame drop(String... names) {
        Set<String> dropped = new HashSet<>(Arrays.asList(names));
        plan.schema().select(Arrays.asList(names));
        List<String> kept = new ArrayList<>();
        for (String name : plan.schema().names()) {
            if (!dropped.contains(name)) {
                kept.add(name);
            }
        }
        return next(Project.columns(plan, kept));
    }

    /**
     * Renames columns, keeping their positions.
     *
     * @param renames old name to new name
     * @return the frame
     */
    public LazyFrame rename(Map<String, String> renames) {
        plan.schema().select(new ArrayList<>(renames.keySet()));
        List<Expression> exprs = new ArrayList<>();
        for (String name : plan.schema().names()) {
            Expression column = new UnresolvedColumn(name);
            String target = renames.get(name);
            exprs.add(target == null ? column : new AliasExpression(column, target));
        }
        return next(new Project(plan, exprs));
    }

    // ==================== Aggregation ====================

    /**
     * Groups rows by keys. Strings are column names.
     *
     * @param keys column names or expressions
     * @return the grouping, completed with {@link GroupBy#agg}
     */
    public GroupBy groupBy(Object... keys) {
        return new GroupBy(this, toExpressions(keys));
    }

    /**
     * Aggregates the whole input into a single row.
     *
     * @param aggs the aggregation outputs
     * @return the frame
     */
    public LazyFrame agg(Expression... aggs) {
        return groupBy().agg(aggs);
    }

    LazyFrame aggregate(List<Expression> keys, List<Expression> aggs) {
        logger.debug("Aggregating {} outputs by {} keys", aggs.size(), keys.size());
        return next(new Aggregate(plan, keys, aggs));
    }

    // ==================== Joins ====================

    /**
     * Joins on columns of the same name on both sides.
     *
     * @param other the right input
     * @param on the key column
     * @param how the join kind
     * @return the frame
     */
    public LazyFrame join(LazyFrame other, String on, JoinType how) {
        return join(other, List.of(on), List.of(on), how, JoinOptions.DEFAULT);
    }

    public LazyFrame join(LazyFrame other, List<String> on, JoinType how) {
        return join(other, on, on, how, JoinOptions.DEFAULT);
    }

    public LazyFrame join(LazyFrame other, List<?> leftOn, List<?> rightOn, JoinType how) {
        return join(other, leftOn, rightOn, how, JoinOptions.DEFAULT);
    }

    /**
     * Joins two frames.
     *
     * @param other the right input
     * @param leftOn key column names or expressions over this frame
     * @param rightOn key column names or expressions over {@code other}
     * @param how the join kind
     * @param options suffix, build side and as-of options
     * @return the frame
     */
    public LazyFrame join(LazyFrame other, List<?> leftOn, List<?> rightOn, JoinType how, JoinOptions options) {
        Objects.requireNonNull(other, "other must not be null");
        logger.debug("Adding {} join", how);
        return next(new Join(plan, other.plan, how, toExpressions(leftOn.toArray()),
            toExpressions(rightOn.toArray()), options));
    }

    public LazyFrame crossJoin(LazyFrame other) {
        Objects.requireNonNull(other, "other must not be null");
        logger.debug("Adding cross join");
        return next(new Join(plan, other.plan, JoinType.CROSS, List.of(), List.of()));
    }

    /**
     * Joins each left row with the closest right row by an ordered key. Both inputs must
     * be sorted by their key.
     *
     * @param other the right input
     * @param leftOn the left key column
     * @param rightOn the right key column
     * @param strategy the search direction
     * @param tolerance the largest allowed distance: a number, a {@link Duration}, a
     *                  duration string such as {@code "2h"}, or null for no limit
     * @return the frame
     */
    public LazyFrame joinAsof(LazyFrame other, String leftOn, String rightOn,
                              JoinOptions.AsofStrategy strategy, Object tolerance) {
        return joinAsof(other, leftOn, rightOn, strategy, tolerance, List.of(), List.of());
    }

    /**
     * Joins each left row with the closest right row that has equal {@code by} values.
     *
     * @param other the right input
     * @param leftOn the left key column
     * @param rightOn the right key column
     * @param strategy the search direction
     * @param tolerance the largest allowed distance, or null
     * @param leftBy left columns matched exactly
     * @param rightBy right columns matched exactly
     * @return the frame
     */
    public LazyFrame joinAsof(LazyFrame other, String leftOn, String rightOn,
                              JoinOptions.AsofStrategy strategy, Object tolerance,
                              List<String> leftBy, List<String> rightBy) {
        Object limit = tolerance instanceof String text ? Duration.parse(text) : tolerance;
        JoinOptions options = JoinOptions.DEFAULT.withAsof(strategy, limit).withBy(leftBy, rightBy);
        return join(other, List.of(leftOn), List.of(rightOn), JoinType.ASOF, options);
    }

    // ==================== Ordering and slicing ====================

    /**
     * Sorts rows. Strings sort ascending; use {@link Expression#desc()} and
     * {@link SortOrder#withNullsLast()} for other orders. The sort is stable.
     *
     * @param by column names, expressions or sort orders
     * @return the frame
     */
    public LazyFrame sort(Object... by) {
        List<SortOrder> orders = new ArrayList<>(by.length);
        for (Object key : by) {
            Expression expr = Literal.liftColumn(key);
            orders.add(expr instanceof SortOrder order ? order : expr.asc());
        }
        logger.debug("Adding sort: {}", orders);
        return next(new Sort(plan, orders));
    }

    /**
     * Sorts by columns with one direction for all keys.
     *
     * @param by the columns
     * @param descending true for descending order
     * @param nullsLast true to place nulls after all values
     * @return the frame
     */
    public LazyFrame sort(List<String> by, boolean descending, boolean nullsLast) {
        List<SortOrder> orders = new ArrayList<>(by.size());
        for (String name : by) {
            orders.add(new SortOrder(new UnresolvedColumn(name), descending, nullsLast));
        }
        return next(new Sort(plan, orders));
    }

    /**
     * Keeps {@code length} rows starting at {@code offset}. A negative offset counts from
     * the end.
     *
     * @param offset the first row
     * @param length the number of rows
     * @return the frame
     */
    public LazyFrame slice(long offset, long length) {
        return next(new Slice(plan, offset, length));
    }

    public LazyFrame head(long n) {
        return slice(0, n);
    }

    public LazyFrame limit(long n) {
        return head(n);
    }

    public LazyFrame tail(long n) {
        return slice(-n, n);
    }

    // ==================== Reshaping ====================

    public LazyFrame unique() {
        return next(new Distinct(plan));
    }

    /**
     * Removes duplicate rows, keeping the first-seen order.
     *
     * @param subset the columns that identify duplicates, or null for all columns
     * @param keep which row of each set of duplicates survives
     * @return the frame
     */
    public LazyFrame unique(List<String> subset, Distinct.Keep keep) {
        return next(new Distinct(plan, subset, keep));
    }

    public LazyFrame explode(String... columns) {
        return next(new Explode(plan, Arrays.asList(columns)));
    }

    /**
     * Turns value columns into rows of (variable, value) pairs.
     *
     * @param index columns repeated on every output row
     * @param on value columns; empty means every non-index column
     * @param variableName name of the column holding the source column names
     * @param valueName name of the column holding the values
     * @return the frame
     */
    public LazyFrame unpivot(List<String> index, List<String> on, String variableName, String valueName) {
        return next(new Unpivot(plan, index, on, variableName, valueName));
    }

    public LazyFrame unpivot(List<String> index, List<String> on) {
        return unpivot(index, on, "variable", "value");
    }

    /**
     * Appends the rows of other frames with the same column names.
     *
     * @param others the frames appended after this one
     * @return the frame
     */
    public LazyFrame union(LazyFrame... others) {
        List<LogicalPlan> inputs = new ArrayList<>(others.length + 1);
        inputs.add(plan);
        for (LazyFrame other : others) {
            inputs.add(other.plan);
        }
        return next(new Union(inputs));
    }

    /**
     * Concatenates frames vertically.
     *
     * @param frames the frames, at least one
     * @return the frame, with the configuration of the first input
     */
    public static LazyFrame concat(List<LazyFrame> frames) {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("at least one frame is required");
        }
        return frames.get(0).union(frames.subList(1, frames.size()).toArray(new LazyFrame[0]));
    }

    /**
     * Fills the gaps of a sorted time column with a regular range of timestamps.
     *
     * @param timeColumn the date or timestamp column, sorted within each group
     * @param every the interval, such as {@code "1d"} or {@code "3d12h"}
     * @param offset shifts the start of the range, such as {@code "0ns"}
     * @param by group columns, forward-filled into generated rows
     * @return the frame
     */
    public LazyFrame upsample(String timeColumn, String every, String offset, String... by) {
        Upsampler upsampler = new Upsampler(timeColumn, Arrays.asList(by), Duration.parse(every),
            Duration.parse(offset));
        return next(new Upsample(plan, upsampler));
    }

    // ==================== Execution ====================

    /**
     * Optimizes, plans and runs the query.
     *
     * @return the result
     */
    public ColumnarBatch collect() {
        return new QueryExecutor(config).collect(plan);
    }

    public ColumnarBatch collect(CancellationToken token) {
        return new QueryExecutor(config).collect(plan, token);
    }

    /**
     * Runs the query and hands out the result incrementally. With streaming enabled, only
     * the batches in flight are held in memory. The caller must close the stream.
     *
     * @param token cancels the execution
     * @return the result batches
     */
    public BatchStream collectStreaming(CancellationToken token) {
        return new QueryExecutor(config).collectStreaming(plan, token);
    }

    public ArrowBatchIterator collectArrow(CancellationToken token) {
        return new QueryExecutor(config).collectArrow(plan, token);
    }

    public VectorSchemaRoot collectToArrow() {
        return new QueryExecutor(config).collectToArrow(plan);
    }

    /**
     * Renders the optimized logical plan.
     *
     * @return the plan text
     */
    public String explain() {
        return new QueryExecutor(config).explain(plan);
    }

    /**
     * Renders the unoptimized logical plan.
     *
     * @return the plan text
     */
    public String explainUnoptimized() {
        return PlanPrinter.render(plan);
    }

    /**
     * Renders the physical plan, including pipelines and materialization points.
     *
     * @return the plan text
     */
    public String explainPhysical() {
        return new QueryExecutor(config).explainPhysical(plan);
    }

    @Override
    public String toString() {
        return "LazyFrame" + plan.schema();
    }

    // ==================== Helpers ====================

    private LazyFrame next(LogicalPlan newPlan) {
        return new LazyFrame(newPlan, config);
    }

    private static List<Expression> toExpressions(Object[] values) {
        List<Expression> exprs = new ArrayList<>(values.length);
        for (Object value : values) {
            exprs.add(Literal.liftColumn(value));
        }
        return exprs;
    }

    /**
     * Moves window functions into a {@link Window} node below the projection and replaces
     * them with references to its output columns.
     */
    private LogicalPlan withWindows(List<? extends Expression> exprs,
                                    BiFunction<LogicalPlan, List<Expression>, LogicalPlan> build) {
        List<AliasExpression> windows = new ArrayList<>();
        List<Expression> rewritten = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            if (!ExpressionUtils.containsWindow(expr)) {
                rewritten.add(expr);
                continue;
            }
            String name = expr.outputName();
            Expression replaced = ExpressionUtils.transformDown(expr, e -> {
                if (e instanceof WindowFunction window) {
                    String column = WINDOW_PREFIX + windows.size();
                    windows.add(new AliasExpression(window, column));
                    return new UnresolvedColumn(column);
                }
                return e;
            });
            rewritten.add(replaced.outputName().equals(name) ? replaced : new AliasExpression(replaced, name));
        }
        LogicalPlan input = windows.isEmpty() ? plan : new Window(plan, windows);
        return build.apply(input, rewritten);
    }
}
