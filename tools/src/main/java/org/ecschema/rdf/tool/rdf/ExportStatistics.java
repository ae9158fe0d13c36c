package org.ecschema.rdf.tool.rdf;

import lombok.Getter;
import lombok.ToString;

/**
 * Counts what an export wrote and what it had to skip. Not thread safe, an
 * export runs on a single thread.
 */
@Getter
@ToString
public class ExportStatistics {
    private long schemas;
    private long instances;
    /**
     * Instances skipped as a whole, usually because their class isn't
     * registered.
     */
    private long skippedInstances;
    /**
     * Single property values that couldn't be written.
     */
    private long skippedValues;

    void schemaWritten() {
        schemas++;
    }

    void instanceWritten() {
        instances++;
    }

    void instanceSkipped() {
        skippedInstances++;
    }

    void valueSkipped() {
        skippedValues++;
    }
}
