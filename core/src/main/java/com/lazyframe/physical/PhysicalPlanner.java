package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Cache;
import com.lazyframe.logical.Distinct;
import com.lazyframe.logical.Explode;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
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
import com.lazyframe.runtime.EngineConfig;
import com.lazyframe.streaming.HashAggregateOperator;
import com.lazyframe.streaming.HashJoinStreamOperator;
import com.lazyframe.streaming.OperatorFactory;
import com.lazyframe.streaming.Pipeline;
import com.lazyframe.streaming.SliceOperator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates an optimized logical plan into a tree of physical operators.
 *
 * <p>With streaming enabled, every maximal subtree the streaming executor supports becomes a
 * {@link PipelineExec}: a scan followed by filters, projections, with-columns steps,
 * mergeable aggregations, streaming hash joins (inner, left, semi, anti) and leading-row
 * slices. An in-memory operator that consumes a pipeline gets an explicit
 * {@link MaterializeExec} in between. Without streaming every node runs in memory.
 *
 * <p>Shared {@code Cache} subplans map to a single {@link CacheExec}. A planner instance
 * plans one query.
 */
public final class PhysicalPlanner {

    private static final Logger logger = LoggerFactory.getLogger(PhysicalPlanner.class);

    private final EngineConfig config;
    private final Map<Long, PhysicalOperator> caches = new HashMap<>();
    private int nextPipelineId;

    public PhysicalPlanner(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Plans a logical plan.
     *
     * @param plan the optimized logical plan
     * @return the physical plan
     */
    public PhysicalOperator plan(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        PhysicalOperator root = planNode(plan);
        logger.debug("Physical plan ({} pipelines):\n{}", nextPipelineId, explain(root));
        return root;
    }

    /**
     * Renders a physical plan as indented text.
     *
     * @param root the physical plan
     * @return the rendered tree
     */
    public static String explain(PhysicalOperator root) {
        return PlanPrinter.render(root, PhysicalOperator::children, PhysicalOperator::toString);
    }

    // ========================================================================
    // Strategy selection
    // ========================================================================

    private PhysicalOperator planNode(LogicalPlan node) {
        if (config.streaming() && isStreamable(node)) {
            return planPipeline(node);
        }
        return planInMemory(node);
    }

    /**
     * Plans a child of an in-memory operator, materializing it if it streams.
     */
    private PhysicalOperator input(LogicalPlan child) {
        PhysicalOperator op = planNode(child);
        return op.isStreaming() ? new MaterializeExec(op) : op;
    }

    static boolean isStreamable(LogicalPlan node) {
        if (node instanceof Scan) {
            return true;
        }
        if (node instanceof Filter || node instanceof Project || node instanceof WithColumns) {
            return isStreamable(node.child());
        }
        if (node instanceof Aggregate aggregate) {
            return aggregate.isMergeable() && isStreamable(aggregate.child());
        }
        if (node instanceof Join join) {
            JoinType type = join.joinType();
            boolean streamSide = type == JoinType.INNER || type == JoinType.LEFT
                || type == JoinType.SEMI || type == JoinType.ANTI;
            return streamSide && isStreamable(join.left());
        }
        if (node instanceof Slice slice) {
            return slice.isHead() && isStreamable(slice.child());
        }
        return false;
    }

    // ========================================================================
    // Streaming
    // ========================================================================

    private PhysicalOperator planPipeline(LogicalPlan node) {
        List<OperatorFactory> stages = new ArrayList<>();
        List<PhysicalOperator> buildSides = new ArrayList<>();
        ScanReader source = addStages(node, stages, buildSides);
        Pipeline pipeline = new Pipeline(nextPipelineId++, source, stages, node.schema());
        return new PipelineExec(pipeline, buildSides);
    }

    private ScanReader addStages(LogicalPlan node, List<OperatorFactory> stages, List<PhysicalOperator> buildSides) {
        if (node instanceof Scan scan) {
            return new ScanReader(scan, config.morselSize());
        }
        if (node instanceof Join join) {
            ScanReader source = addStages(join.left(), stages, buildSides);
            PhysicalOperator build = input(join.right());
            buildSides.add(build);
            stages.add(OperatorFactory.of(
                String.format("HashJoinStream(%s, left_on=%s, right_on=%s)",
                    join.joinType().joinName(), join.leftKeys(), join.rightKeys()),
                ctx -> new HashJoinStreamOperator(join, build.execute(ctx))));
            return source;
        }
        ScanReader source = addStages(node.child(), stages, buildSides);
        if (node instanceof Filter filter) {
            stages.add(OperatorFactory.stateless("Filter", filter.toString(),
                BatchFunctions.filter(filter.condition())));
        } else if (node instanceof Project project) {
            stages.add(OperatorFactory.stateless("Project", project.toString(), projection(project)));
        } else if (node instanceof WithColumns withColumns) {
            stages.add(OperatorFactory.stateless("WithColumns", withColumns.toString(),
                BatchFunctions.withColumns(withColumns.columns())));
        } else if (node instanceof Aggregate aggregate) {
            GroupedAggregation prototype = new GroupedAggregation(aggregate);
            stages.add(OperatorFactory.of(
                String.format("HashAggregate(keys=%s, aggs=%s)",
                    aggregate.groupingExpressions(), aggregate.aggregateExpressions()),
                ctx -> new HashAggregateOperator(prototype.newPartial(), ctx)));
        } else if (node instanceof Slice slice) {
            stages.add(OperatorFactory.of(slice.toString(),
                ctx -> new SliceOperator(slice.offset(), slice.length())));
        } else {
            throw new IllegalStateException(node.nodeName() + " cannot be streamed");
        }
        return source;
    }

    private static UnaryOperator<ColumnarBatch> projection(Project project) {
        if (project.isColumnSelection()) {
            List<String> names = project.schema().names();
            return batch -> batch.select(names);
        }
        return BatchFunctions.project(project.projections(), project.schema());
    }

    // ========================================================================
    // In-memory
    // ========================================================================

    private PhysicalOperator planInMemory(LogicalPlan node) {
        if (node instanceof Scan scan) {
            return new ScanExec(scan, config.morselSize());
        }
        if (node instanceof Filter filter) {
            return new FilterExec(filter, input(filter.child()));
        }
        if (node instanceof Project project) {
            return new ProjectExec(project, input(project.child()));
        }
        if (node instanceof WithColumns withColumns) {
            return new WithColumnsExec(withColumns, input(withColumns.child()));
        }
        if (node instanceof Aggregate aggregate) {
            return new HashAggregateExec(aggregate, input(aggregate.child()));
        }
        if (node instanceof Join join) {
            PhysicalOperator left = input(join.left());
            PhysicalOperator right = input(join.right());
            switch (join.joinType()) {
                case CROSS:
                    return new CrossJoinExec(join, left, right);
                case ASOF:
                    return new AsofJoinExec(join, left, right);
                default:
                    return new HashJoinExec(join, left, right);
            }
        }
        if (node instanceof Sort sort) {
            return new SortExec(sort, input(sort.child()));
        }
        if (node instanceof Window window) {
            return new WindowExec(window, input(window.child()));
        }
        if (node instanceof Union union) {
            List<PhysicalOperator> inputs = new ArrayList<>(union.inputs().size());
            for (LogicalPlan child : union.inputs()) {
                inputs.add(input(child));
            }
            return new UnionExec(union, inputs);
        }
        if (node instanceof Distinct distinct) {
            return new DistinctExec(distinct, input(distinct.child()));
        }
        if (node instanceof Explode explode) {
            return new ExplodeExec(explode, input(explode.child()));
        }
        if (node instanceof Unpivot unpivot) {
            return new UnpivotExec(unpivot, input(unpivot.child()));
        }
        if (node instanceof Slice slice) {
            return new SliceExec(slice, input(slice.child()));
        }
        if (node instanceof Cache cache) {
            PhysicalOperator shared = caches.get(cache.id());
            if (shared == null) {
                shared = new CacheExec(cache, input(cache.child()));
                caches.put(cache.id(), shared);
            }
            return shared;
        }
        if (node instanceof Upsample upsample) {
            return new UpsampleExec(upsample, input(upsample.child()));
        }
        throw new IllegalStateException("no physical operator for " + node.nodeName());
    }
}
