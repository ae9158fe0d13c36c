package org.ecschema.rdf.tool;

import static java.nio.file.Files.createDirectories;
import static java.nio.file.Files.newInputStream;
import static java.nio.file.Files.newOutputStream;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;
import static org.ecschema.rdf.tool.StreamUtils.utf8;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import de.thetaphi.forbiddenapis.SuppressForbidden;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Utilities for command line scripts.
 */
public final class CliUtils {
    /**
     * Get an input stream for a file, - being stdin. Files ending in .gz are
     * unzipped on the fly.
     *
     * @throws IOException if it is thrown opening the file
     */
    @SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "coming from program arguments")
    public static InputStream inputStream(String file) throws IOException {
        if (file.equals("-")) {
            return ForbiddenOk.systemDotIn();
        }
        InputStream stream = new BufferedInputStream(newInputStream(Paths.get(file)));
        if (file.endsWith(".gz")) {
            stream = new GZIPInputStream(stream);
        }
        return stream;
    }

    /**
     * Build a UTF-8 writer for the file.
     *
     * @throws IOException if it is thrown opening the file
     */
    public static Writer writer(String file) throws IOException {
        return utf8(outputStream(file));
    }

    /**
     * Get an output stream for a file, - being stdout. An existing file is
     * truncated, missing parent directories are created and files ending in
     * .gz are zipped on the fly.
     *
     * @throws IOException if it is thrown opening the file
     */
    @SuppressFBWarnings(value = "PATH_TRAVERSAL_OUT", justification = "coming from program arguments")
    public static OutputStream outputStream(String file) throws IOException {
        if (file.equals("-")) {
            return ForbiddenOk.systemDotOut();
        }
        Path path = Paths.get(file).toAbsolutePath();
        Path parent = path.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("Invalid path: " + file);
        }
        createDirectories(parent);
        OutputStream stream = new BufferedOutputStream(newOutputStream(path, CREATE, TRUNCATE_EXISTING, WRITE));
        if (file.endsWith(".gz")) {
            stream = new GZIPOutputStream(stream);
        }
        return stream;
    }

    /**
     * Methods in this class are ignored by the forbiddenapis checks. Be sure
     * what you put in here is right.
     */
    @SuppressForbidden
    public static final class ForbiddenOk {
        private ForbiddenOk() {
            // Utility class should never be instantiated
        }

        /**
         * Get System.in. Command line tools may use System.in/out/err.
         */
        public static InputStream systemDotIn() {
            return System.in;
        }

        /**
         * Get System.out. Command line tools may use System.in/out/err.
         */
        public static PrintStream systemDotOut() {
            return System.out;
        }

        /**
         * Get System.err. Command line tools may use System.in/out/err.
         */
        public static PrintStream systemDotErr() {
            return System.err;
        }
    }

    private CliUtils() {
        // Uncallable utility constructor
    }
}
