package com.lazyframe.logical;

import com.lazyframe.exception.ComputeException;
import com.lazyframe.temporal.Upsampler;
import com.lazyframe.types.DataType;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeCoercion;
import java.util.List;
import java.util.Objects;

/**
 * Logical plan node that upsamples its input at a regular frequency.
 *
 * @see Upsampler
 */
public final class Upsample extends LogicalPlan {

    private final Upsampler upsampler;

    /**
     * Creates an upsample node.
     *
     * @param child the child node
     * @param upsampler the upsampling parameters
     * @throws ComputeException if the time column is not a date or timestamp column
     */
    public Upsample(LogicalPlan child, Upsampler upsampler) {
        super(child);
        this.upsampler = Objects.requireNonNull(upsampler, "upsampler must not be null");
        StructType input = child.schema();
        DataType timeType = input.field(upsampler.timeColumn()).dataType();
        if (!TypeCoercion.isTemporal(timeType)) {
            throw new ComputeException("upsample not allowed for index column of dtype " + timeType,
                null, nodeName(), upsampler.timeColumn());
        }
        input.select(upsampler.by());
    }

    public Upsampler upsampler() {
        return upsampler;
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Upsample(newChildren.get(0), upsampler);
    }

    @Override
    protected List<Object> parameters() {
        return List.of(upsampler.timeColumn(), upsampler.by(), upsampler.every(), upsampler.offset());
    }

    @Override
    public String toString() {
        return String.format("Upsample(%s, every=%s, offset=%s, by=%s)",
            upsampler.timeColumn(), upsampler.every(), upsampler.offset(), upsampler.by());
    }
}
