/**
 * Copyright (c) 2016, Fulcrum Genomics LLC
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *
 * 1. Redistributions of source code must retain the above copyright notice,
 * this list of conditions and the following disclaimer.
 *
 * 2. Redistributions in binary form must reproduce the above copyright notice,
 * this list of conditions and the following disclaimer in the documentation
 * and/or other materials provided with the distribution.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */

package com.fulcrumgenomics.protein.function;

import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;
import picard.PicardException;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * An immutable, ordered table of reference functions, each a label and a non-negative embedding vector.
 * All vectors in a table have the same number of elements.  Entries keep the order in which they were
 * added, which is also the order used to break ties when ranking.
 *
 * Tables are read from a tab-delimited text file with one entry per line: the label followed by the
 * elements of the vector.  Blank lines and lines starting with '#' are ignored.  A table matching
 * {@link FunctionEmbedder#DIMENSION} ships with the library and is available from {@link #builtIn()}.
 */
public final class ReferenceFunctionTable {
    /** The classpath resource, relative to this class, holding the built-in table. */
    public static final String BUILT_IN_RESOURCE = "reference_functions.txt";

    private static final Log log = Log.getInstance(ReferenceFunctionTable.class);

    private final List<String> labels;
    private final List<double[]> vectors;
    private final int dimension;

    private ReferenceFunctionTable(final List<String> labels, final List<double[]> vectors, final int dimension) {
        this.labels    = Collections.unmodifiableList(labels);
        this.vectors   = vectors;
        this.dimension = dimension;
    }

    /** Holder so that the built-in table is read once, on first use. */
    private static class BuiltIn {
        static final ReferenceFunctionTable TABLE = fromResource(BUILT_IN_RESOURCE);
    }

    /** Returns the table that ships with the library. */
    public static ReferenceFunctionTable builtIn() { return BuiltIn.TABLE; }

    /** Reads a table from a file. */
    public static ReferenceFunctionTable fromFile(final File file) {
        IOUtil.assertFileIsReadable(file);
        try (final BufferedReader in = IOUtil.openFileForBufferedReading(file)) {
            return read(in, file.getPath());
        }
        catch (final IOException ioe) {
            throw new RuntimeIOException(ioe);
        }
    }

    /** Reads the table from the file if one is given, otherwise returns the built-in table. */
    public static ReferenceFunctionTable fromFileOrBuiltIn(final File file) {
        return file == null ? builtIn() : fromFile(file);
    }

    /** Reads a table from a classpath resource relative to this class. */
    static ReferenceFunctionTable fromResource(final String resource) {
        final InputStream stream = ReferenceFunctionTable.class.getResourceAsStream(resource);
        if (stream == null) throw new PicardException("Could not find reference function table resource: " + resource);

        try (final BufferedReader in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return read(in, resource);
        }
        catch (final IOException ioe) {
            throw new RuntimeIOException(ioe);
        }
    }

    /** Parses a table, reporting problems with the line number at which they occur. */
    static ReferenceFunctionTable read(final BufferedReader in, final String source) throws IOException {
        final Builder builder = new Builder();
        int lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty() || line.startsWith("#")) continue;

            final String[] fields = line.split("\t", -1); // NB: include trailing empty strings
            if (fields.length < 2) {
                throw new PicardException(String.format("%s line %d: expected a label and at least one value.", source, lineNumber));
            }

            final double[] values = new double[fields.length - 1];
            for (int i=1; i<fields.length; ++i) {
                try {
                    values[i-1] = Double.parseDouble(fields[i].trim());
                }
                catch (final NumberFormatException nfe) {
                    throw new PicardException(String.format("%s line %d: '%s' is not a number.", source, lineNumber, fields[i]), nfe);
                }
            }

            try {
                builder.add(fields[0].trim(), values);
            }
            catch (final IllegalArgumentException iae) {
                throw new PicardException(String.format("%s line %d: %s", source, lineNumber, iae.getMessage()), iae);
            }
        }

        final ReferenceFunctionTable table = builder.build();
        log.info("Loaded " + table.size() + " reference functions from " + source);
        return table;
    }

    /** The number of reference functions. */
    public int size() { return this.labels.size(); }

    public boolean isEmpty() { return this.labels.isEmpty(); }

    /** The number of elements in every vector, or zero for an empty table. */
    public int dimension() { return this.dimension; }

    /** The labels of all reference functions, in table order. */
    public List<String> labels() { return this.labels; }

    /** The label of the i'th entry. */
    public String label(final int index) { return this.labels.get(index); }

    /** Returns a copy of the vector for the given label, or null if there is no such label. */
    public double[] vector(final String label) {
        final int index = this.labels.indexOf(label);
        return index < 0 ? null : Arrays.copyOf(this.vectors.get(index), this.dimension);
    }

    /** The vector of the i'th entry, without copying. */
    double[] vectorAt(final int index) { return this.vectors.get(index); }

    /** Accumulates entries for a table; the first entry added fixes the vector length. */
    public static class Builder {
        private final List<String> labels = new ArrayList<>();
        private final List<double[]> vectors = new ArrayList<>();
        private final Set<String> seen = new HashSet<>();

        /** Adds an entry; throws IllegalArgumentException if the label or the values are unusable. */
        public Builder add(final String label, final double... values) {
            if (label == null || label.isEmpty()) throw new IllegalArgumentException("Reference function labels must not be empty.");
            if (seen.contains(label)) throw new IllegalArgumentException("Duplicate reference function label: " + label);
            if (values.length == 0) throw new IllegalArgumentException("Reference function '" + label + "' has no values.");
            if (!vectors.isEmpty() && values.length != vectors.get(0).length) {
                throw new IllegalArgumentException("Reference function '" + label + "' has " + values.length
                        + " values but earlier entries have " + vectors.get(0).length + ".");
            }
            for (final double value : values) {
                if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
                    throw new IllegalArgumentException("Reference function '" + label + "' has a negative or non-finite value: " + value);
                }
            }

            this.seen.add(label);
            this.labels.add(label);
            this.vectors.add(Arrays.copyOf(values, values.length));
            return this;
        }

        public ReferenceFunctionTable build() {
            final int dimension = vectors.isEmpty() ? 0 : vectors.get(0).length;
            return new ReferenceFunctionTable(new ArrayList<>(labels), new ArrayList<>(vectors), dimension);
        }
    }
}
