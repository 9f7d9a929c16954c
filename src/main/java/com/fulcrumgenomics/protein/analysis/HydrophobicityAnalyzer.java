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

/**
 * Scores each residue of a protein on the Kyte-Doolittle hydropathy scale and summarizes the scores.
 * Positive values are hydrophobic, negative values hydrophilic; the scale runs from -4.5 (arginine)
 * to +4.5 (isoleucine).
 */
public class HydrophobicityAnalyzer {
    /** The lowest value on the scale. */
    public static final double MIN_VALUE = -4.5;

    /** The highest value on the scale. */
    public static final double MAX_VALUE = 4.5;

    //                                              A    C     D     E    F     G     H    I     K    L    M     N     P     Q     R     S     T    V     W     Y
    private static final double[] KYTE_DOOLITTLE = {1.8, 2.5, -3.5, -3.5, 2.8, -0.4, -3.2, 4.5, -3.9, 3.8, 1.9, -3.5, -1.6, -3.5, -4.5, -0.8, -0.7, 4.2, -0.9, -1.3};

    /** Returns the Kyte-Doolittle value for a canonical residue. */
    public static double valueOf(final byte residue) {
        final int index = AminoAcids.indexOf(residue);
        if (index < 0) throw new IllegalArgumentException("Not a canonical residue: " + (char) residue);
        return KYTE_DOOLITTLE[index];
    }

    /** Computes the per-residue scores and their mean. */
    public HydrophobicityProfile analyze(final ProteinSequence sequence) {
        ProteinSequence.assertNotEmpty(sequence, "hydrophobicity analysis");

        final double[] scores = new double[sequence.length()];
        double sum = 0;
        for (int i=0; i<scores.length; ++i) {
            scores[i] = KYTE_DOOLITTLE[sequence.residueIndexAt(i)];
            sum += scores[i];
        }

        return new HydrophobicityProfile(scores, sum / scores.length);
    }
}
