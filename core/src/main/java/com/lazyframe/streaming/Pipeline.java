package com.lazyframe.streaming;

import com.lazyframe.physical.ScanReader;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A chain of streaming stages fed by one scan.
 *
 * <p>A pipeline is a plan, not a run: every {@link PipelineDriver} creates its own operators
 * from the stage factories.
 */
public final class Pipeline {

    private final int id;
    private final ScanReader source;
    private final List<OperatorFactory> stages;
    private final StructType schema;

    /**
     * Creates a pipeline.
     *
     * @param id the pipeline id, unique within one physical plan
     * @param source the scan feeding the pipeline
     * @param stages the stages, in data flow order
     * @param schema the schema of the pipeline's output
     */
    public Pipeline(int id, ScanReader source, List<OperatorFactory> stages, StructType schema) {
        this.id = id;
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.stages = List.copyOf(Objects.requireNonNull(stages, "stages must not be null"));
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
    }

    public int id() {
        return id;
    }

    public ScanReader source() {
        return source;
    }

    public List<OperatorFactory> stages() {
        return stages;
    }

    public StructType schema() {
        return schema;
    }

    /**
     * Returns the stage descriptions, source first.
     *
     * @return one line per stage
     */
    public List<String> describe() {
        List<String> lines = new ArrayList<>(stages.size() + 1);
        lines.add("Scan(" + source.sourceName() + ")");
        for (OperatorFactory stage : stages) {
            lines.add(stage.description());
        }
        return lines;
    }

    @Override
    public String toString() {
        return "Pipeline#" + id + "[" + String.join(" -> ", describe()) + "]";
    }
}
