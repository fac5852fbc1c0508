package com.lazyframe.streaming;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.runtime.ExecutionContext;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Creates the operator of one pipeline stage for each execution.
 */
public interface OperatorFactory {

    /**
     * Creates a fresh operator.
     *
     * @param ctx the execution context
     * @return the operator
     */
    StreamOperator create(ExecutionContext ctx);

    /**
     * Returns a one-line description of the stage.
     *
     * @return the description
     */
    String description();

    /**
     * Returns the stage as a stateless batch function, if it is one. Stateless stages
     * directly after the scan are run on the worker pool together with the scan.
     *
     * @return the batch function, or null for stateful stages
     */
    default UnaryOperator<ColumnarBatch> batchFunction() {
        return null;
    }

    /**
     * Creates the factory of a stateless stage.
     *
     * @param name the operator name
     * @param description the stage description
     * @param function the row-wise batch function
     * @return the factory
     */
    static OperatorFactory stateless(String name, String description, UnaryOperator<ColumnarBatch> function) {
        return new OperatorFactory() {
            @Override
            public StreamOperator create(ExecutionContext ctx) {
                return new MapOperator(name, function);
            }

            @Override
            public String description() {
                return description;
            }

            @Override
            public UnaryOperator<ColumnarBatch> batchFunction() {
                return function;
            }

            @Override
            public String toString() {
                return description;
            }
        };
    }

    /**
     * Creates the factory of a stateful stage.
     *
     * @param description the stage description
     * @param create creates the operator for one run
     * @return the factory
     */
    static OperatorFactory of(String description, Function<ExecutionContext, StreamOperator> create) {
        return new OperatorFactory() {
            @Override
            public StreamOperator create(ExecutionContext ctx) {
                return create.apply(ctx);
            }

            @Override
            public String description() {
                return description;
            }

            @Override
            public String toString() {
                return description;
            }
        };
    }
}
