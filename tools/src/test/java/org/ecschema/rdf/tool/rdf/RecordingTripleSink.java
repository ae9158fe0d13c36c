package org.ecschema.rdf.tool.rdf;

import java.util.ArrayList;
import java.util.List;

/**
 * Records written lines in the format {@link TurtleTripleWriter} uses,
 * without the trailing newline.
 */
public class RecordingTripleSink implements TripleSink {
    private final List<String> lines = new ArrayList<>();

    @Override
    public void writeTriple(String subject, String predicate, String object) {
        lines.add(subject + " " + predicate + " " + object + " .");
    }

    @Override
    public void writePrefix(String prefix, String iri) {
        lines.add("@prefix " + prefix + ": <" + iri + "> .");
    }

    public List<String> lines() {
        return lines;
    }

    /**
     * Lines as a Turtle document.
     */
    public String turtle() {
        StringBuilder turtle = new StringBuilder();
        for (String line : lines) {
            turtle.append(line).append('\n');
        }
        return turtle.toString();
    }

    public void clear() {
        lines.clear();
    }
}
