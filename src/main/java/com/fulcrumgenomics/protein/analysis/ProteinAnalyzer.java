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

package com.fulcrumgenomics.protein.analysis;

import com.fulcrumgenomics.protein.EmptyReferenceTableException;
import com.fulcrumgenomics.protein.ProteinSequence;
import com.fulcrumgenomics.protein.function.FunctionEmbedder;
import com.fulcrumgenomics.protein.function.FunctionPrediction;
import com.fulcrumgenomics.protein.function.FunctionPredictor;
import com.fulcrumgenomics.protein.function.ReferenceFunctionTable;
import htsjdk.samtools.util.Log;

/**
 * Runs every per-sequence analysis on a validated sequence and gathers the results.  The analyses are
 * independent of one another and share no state, so a single analyzer may be used from many threads.
 */
public class ProteinAnalyzer {
    private final Log log = Log.getInstance(ProteinAnalyzer.class);

    private final ReferenceFunctionTable reference;
    private final FunctionEmbedder embedder;
    private final HydrophobicityAnalyzer hydrophobicityAnalyzer = new HydrophobicityAnalyzer();
    private final SecondaryStructurePredictor structurePredictor = new SecondaryStructurePredictor();
    private final CompositionAnalyzer compositionAnalyzer = new CompositionAnalyzer();
    private final DomainScanner domainScanner = new DomainScanner();
    private final FunctionalDomainClassifier domainClassifier = new FunctionalDomainClassifier();
    private final FunctionPredictor functionPredictor = new FunctionPredictor();

    /**
     * @param reference the reference functions to predict against; must not be empty
     * @param embedder the embedder, whose dimension must match the reference table's
     */
    public ProteinAnalyzer(final ReferenceFunctionTable reference, final FunctionEmbedder embedder) {
        if (reference.isEmpty()) throw new EmptyReferenceTableException();
        if (reference.dimension() != embedder.dimension()) {
            throw new IllegalArgumentException("Reference table vectors have " + reference.dimension()
                    + " elements but the embedder produces " + embedder.dimension() + ".");
        }
        this.reference = reference;
        this.embedder  = embedder;
    }

    /** Analyzes a single sequence. */
    public AnalysisResult analyze(final ProteinSequence sequence) {
        ProteinSequence.assertNotEmpty(sequence, "protein analysis");

        final HydrophobicityProfile hydrophobicity = this.hydrophobicityAnalyzer.analyze(sequence);
        final StructureComposition structure = this.structurePredictor.predict(sequence);
        final ResidueStructure states = this.structurePredictor.predictStates(sequence);
        final ResidueComposition composition = this.compositionAnalyzer.analyze(sequence);
        final FunctionalDomainPrediction functionalDomain = this.domainClassifier.classify(sequence);
        final FunctionPrediction function = this.functionPredictor.predict(this.embedder.embed(sequence), this.reference);

        final AnalysisResult result = new AnalysisResult(sequence, hydrophobicity, structure, states, composition,
                this.domainScanner.scan(sequence), functionalDomain, function);

        log.debug("Analyzed ", sequence.name() == null ? "sequence" : sequence.name(), " of ", sequence.length(),
                " residues: mean hydrophobicity ", hydrophobicity.mean(), ", structure ", structure, ", ", functionalDomain,
                ", function ", function.label(), " (", function.confidence(), ")");
        return result;
    }
}
