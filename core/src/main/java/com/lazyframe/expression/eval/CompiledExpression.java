package com.lazyframe.expression.eval;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.expression.Expression;
import com.lazyframe.types.DataType;
import java.util.Objects;

/**
 * An expression compiled into a reusable evaluator for repeated evaluation over batches.
 *
 * <p>Compiled expressions are stateless and may be evaluated concurrently on different
 * batches.
 */
public final class CompiledExpression {

    /**
     * Evaluates one node over a batch.
     */
    @FunctionalInterface
    interface Evaluator {
        Column evaluate(ColumnarBatch batch);
    }

    private final Expression source;
    private final String outputName;
    private final DataType dataType;
    private final Evaluator evaluator;

    CompiledExpression(Expression source, String outputName, Evaluator evaluator) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.outputName = Objects.requireNonNull(outputName, "outputName must not be null");
        this.dataType = source.dataType();
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /**
     * Evaluates the expression, producing a column named after the expression's output name.
     *
     * @param batch the input batch
     * @return the result column, with one value per input row
     */
    public Column evaluate(ColumnarBatch batch) {
        Column result = evaluator.evaluate(batch);
        if (!result.dataType().equals(dataType)) {
            result = result.cast(dataType, true);
        }
        return result.rename(outputName);
    }

    public Expression source() {
        return source;
    }

    public String outputName() {
        return outputName;
    }

    public DataType dataType() {
        return dataType;
    }

    @Override
    public String toString() {
        return source.toString();
    }
}
