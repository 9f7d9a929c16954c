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

package com.fulcrumgenomics.protein.mutation;

import com.fulcrumgenomics.protein.analysis.AnalysisResult;
import com.fulcrumgenomics.protein.analysis.SecondaryStructure;

/**
 * The analyses of an original and a mutated sequence along with the change in each summary property,
 * always expressed as mutated minus original.  Only whole-sequence properties are compared, so the two
 * sequences may differ in length.
 */
public class MutationDelta {
    private final AnalysisResult original;
    private final AnalysisResult mutated;

    public MutationDelta(final AnalysisResult original, final AnalysisResult mutated) {
        this.original = original;
        this.mutated  = mutated;
    }

    public AnalysisResult original() { return this.original; }
    public AnalysisResult mutated() { return this.mutated; }

    /** The change in mean hydrophobicity. */
    public double hydrophobicityDelta() {
        return this.mutated.hydrophobicity().mean() - this.original.hydrophobicity().mean();
    }

    /** The change in the proportion of the given structure class. */
    public double structureDelta(final SecondaryStructure structure) {
        return this.mutated.structure().get(structure) - this.original.structure().get(structure);
    }

    public double helixDelta() { return structureDelta(SecondaryStructure.HELIX); }
    public double sheetDelta() { return structureDelta(SecondaryStructure.SHEET); }
    public double coilDelta()  { return structureDelta(SecondaryStructure.COIL); }

    /** True if the predicted function differs between the two sequences. */
    public boolean functionChanged() { return !originalFunction().equals(mutatedFunction()); }

    public String originalFunction() { return this.original.function().label(); }
    public String mutatedFunction() { return this.mutated.function().label(); }
    public double originalConfidence() { return this.original.function().confidence(); }
    public double mutatedConfidence() { return this.mutated.function().confidence(); }

    /** The number of residues gained (positive) or lost (negative). */
    public int lengthDelta() { return this.mutated.sequence().length() - this.original.sequence().length(); }
}
