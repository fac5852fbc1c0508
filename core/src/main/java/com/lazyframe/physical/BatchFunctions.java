package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.eval.CompiledExpression;
import com.lazyframe.expression.eval.ExpressionCompiler;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Compiled row-wise batch functions shared by the in-memory and streaming executors.
 *
 * <p>Each function is stateless and may run concurrently on different batches.
 */
public final class BatchFunctions {

    private BatchFunctions() {
        // Utility class - prevent instantiation
    }

    /**
     * Compiles a filter. Rows where the condition is null are dropped.
     *
     * @param condition the resolved boolean condition
     * @return the batch function
     */
    public static UnaryOperator<ColumnarBatch> filter(Expression condition) {
        CompiledExpression compiled = ExpressionCompiler.compile(condition);
        return batch -> {
            if (batch.rowCount() == 0) {
                return batch;
            }
            Column mask = compiled.evaluate(batch);
            return batch.filter(mask);
        };
    }

    /**
     * Compiles a projection.
     *
     * @param projections the resolved output expressions
     * @param schema the output schema
     * @return the batch function
     */
    public static UnaryOperator<ColumnarBatch> project(List<Expression> projections, StructType schema) {
        List<CompiledExpression> compiled = ExpressionCompiler.compileAll(projections);
        return batch -> {
            List<Column> columns = new ArrayList<>(compiled.size());
            for (CompiledExpression expr : compiled) {
                columns.add(expr.evaluate(batch));
            }
            return new ColumnarBatch(schema, columns, batch.rowCount());
        };
    }

    /**
     * Compiles a with-columns step. Every expression reads the input batch; results replace
     * columns of the same name in place or are appended.
     *
     * @param exprs the resolved expressions
     * @return the batch function
     */
    public static UnaryOperator<ColumnarBatch> withColumns(List<Expression> exprs) {
        List<CompiledExpression> compiled = ExpressionCompiler.compileAll(exprs);
        return batch -> {
            List<Column> added = new ArrayList<>(compiled.size());
            for (CompiledExpression expr : compiled) {
                added.add(expr.evaluate(batch));
            }
            ColumnarBatch result = batch;
            for (Column column : added) {
                result = result.withColumn(column);
            }
            return result;
        };
    }
}
