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

import com.fulcrumgenomics.protein.ProteinSequence;
import com.fulcrumgenomics.protein.function.FunctionPrediction;

import java.util.Collections;
import java.util.List;

/** Everything predicted for a single sequence. */
public class AnalysisResult {
    private final ProteinSequence sequence;
    private final HydrophobicityProfile hydrophobicity;
    private final StructureComposition structure;
    private final ResidueStructure residueStructure;
    private final ResidueComposition composition;
    private final List<DomainHit> domains;
    private final FunctionalDomainPrediction functionalDomain;
    private final FunctionPrediction function;

    public AnalysisResult(final ProteinSequence sequence,
                          final HydrophobicityProfile hydrophobicity,
                          final StructureComposition structure,
                          final ResidueStructure residueStructure,
                          final ResidueComposition composition,
                          final List<DomainHit> domains,
                          final FunctionalDomainPrediction functionalDomain,
                          final FunctionPrediction function) {
        this.sequence         = sequence;
        this.hydrophobicity   = hydrophobicity;
        this.structure        = structure;
        this.residueStructure = residueStructure;
        this.composition      = composition;
        this.domains          = Collections.unmodifiableList(domains);
        this.functionalDomain = functionalDomain;
        this.function         = function;
    }

    public ProteinSequence sequence() { return this.sequence; }
    public HydrophobicityProfile hydrophobicity() { return this.hydrophobicity; }
    public StructureComposition structure() { return this.structure; }

    /** One {@link SecondaryStructure#code()} per residue. */
    public String structureStates() { return this.residueStructure.states(); }

    public ResidueStructure residueStructure() { return this.residueStructure; }

    public ResidueComposition composition() { return this.composition; }
    public List<DomainHit> domains() { return this.domains; }
    public FunctionalDomainPrediction functionalDomain() { return this.functionalDomain; }
    public FunctionPrediction function() { return this.function; }
}
