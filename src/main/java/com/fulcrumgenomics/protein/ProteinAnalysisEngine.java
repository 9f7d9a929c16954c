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

package com.fulcrumgenomics.protein;

import com.fulcrumgenomics.protein.analysis.AnalysisResult;
import com.fulcrumgenomics.protein.analysis.ProteinAnalyzer;
import com.fulcrumgenomics.protein.function.FunctionEmbedder;
import com.fulcrumgenomics.protein.function.ReferenceFunctionTable;
import com.fulcrumgenomics.protein.mutation.MutationComparator;
import com.fulcrumgenomics.protein.mutation.MutationDelta;

import java.util.List;

/**
 * The entry point for callers wishing to analyze protein sequences.  Raw input is first turned into a
 * {@link ProteinSequence} with {@link #validate(String)}; validated sequences can then be analyzed on
 * their own or compared with a mutated version.
 *
 * The reference function table is supplied when the engine is built and never changes afterwards, so a
 * single engine can serve any number of concurrent callers.
 */
public class ProteinAnalysisEngine {
    private final ReferenceFunctionTable reference;
    private final ProteinAnalyzer analyzer;
    private final MutationComparator comparator;

    /** Constructs an engine using the built-in reference functions and full embeddings. */
    public ProteinAnalysisEngine() {
        this(ReferenceFunctionTable.builtIn(), new FunctionEmbedder());
    }

    /**
     * Constructs an engine with the given reference functions.
     *
     * @throws EmptyReferenceTableException if the table has no entries
     * @throws IllegalArgumentException if the embedder's dimension differs from the table's
     */
    public ProteinAnalysisEngine(final ReferenceFunctionTable reference, final FunctionEmbedder embedder) {
        this.reference  = reference;
        this.analyzer   = new ProteinAnalyzer(reference, embedder);
        this.comparator = new MutationComparator(this.analyzer);
    }

    /** Validates raw input; see {@link SequenceValidator}. */
    public ProteinSequence validate(final String raw) {
        return SequenceValidator.validate(raw);
    }

    /** Validates raw input and names the resulting sequence. */
    public ProteinSequence validate(final String name, final String raw) {
        return SequenceValidator.validate(name, raw);
    }

    /** Runs all analyses on the sequence. */
    public AnalysisResult analyzeFull(final ProteinSequence sequence) {
        return this.analyzer.analyze(sequence);
    }

    /** Analyzes both sequences and reports how the mutation changes their properties. */
    public MutationDelta compare(final ProteinSequence original, final ProteinSequence mutated) {
        return this.comparator.compare(original, mutated);
    }

    /** The labels of the reference functions, in table order, for display. */
    public List<String> knownFunctionLabels() {
        return this.reference.labels();
    }
}
