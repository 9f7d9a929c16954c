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

import com.fulcrumgenomics.protein.AminoAcids;
import com.fulcrumgenomics.protein.ProteinSequence;

/** Summarizes a sequence into hydrophobic, polar and charged fractions and an approximate molecular weight. */
public class CompositionAnalyzer {
    /** Average mass of an amino acid residue, in Daltons, used to approximate molecular weight. */
    public static final double AVERAGE_RESIDUE_MASS = 110.0;

    public ResidueComposition analyze(final ProteinSequence sequence) {
        ProteinSequence.assertNotEmpty(sequence, "composition analysis");

        int hydrophobic = 0, polar = 0, charged = 0;
        for (int i=0; i<sequence.length(); ++i) {
            final byte residue = sequence.residueAt(i);
            if      (AminoAcids.isHydrophobic(residue)) ++hydrophobic;
            else if (AminoAcids.isPolar(residue))       ++polar;
            else if (AminoAcids.isCharged(residue))     ++charged;
        }

        final double length = sequence.length();
        return new ResidueComposition(sequence.length(),
                hydrophobic / length,
                polar / length,
                charged / length,
                length * AVERAGE_RESIDUE_MASS);
    }
}
