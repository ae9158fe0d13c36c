package org.ecschema.rdf.tool.rdf;

import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;

import org.ecschema.rdf.tool.exception.TripleSinkException;

/**
 * Writes statements as line oriented Turtle, one statement per line. Every
 * line is flushed as soon as it is complete so the output is a valid graph up
 * to the last line even if the export dies.
 */
public class TurtleTripleWriter implements TripleSink, Closeable {
    /**
     * Where the lines go.
     */
    private final Writer out;
    private final StringBuilder line = new StringBuilder();
    private long lines;

    public TurtleTripleWriter(Writer out) {
        this.out = out;
    }

    @Override
    public void writeTriple(String subject, String predicate, String object) {
        line.setLength(0);
        line.append(subject).append(' ').append(predicate).append(' ').append(object).append(" .\n");
        writeLine();
    }

    @Override
    public void writePrefix(String prefix, String iri) {
        line.setLength(0);
        line.append("@prefix ").append(prefix).append(": <").append(iri).append("> .\n");
        writeLine();
    }

    private void writeLine() {
        try {
            out.write(line.toString());
            out.flush();
        } catch (IOException e) {
            throw new TripleSinkException("Error writing line " + (lines + 1), e);
        }
        lines++;
    }

    /**
     * Number of lines written so far, prefixes included.
     */
    public long lines() {
        return lines;
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
