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

/**
 * Predicts secondary structure from the Chou-Fasman conformational parameters.  Each residue has a
 * fixed relative propensity to be found in a helix, a sheet or a turn/coil; these are not probabilities
 * and do not sum to one per residue.
 *
 * Two predictions are offered:
 * <ul>
 *     <li>{@link #predict(ProteinSequence)} sums each class's propensity over all residues and divides by
 *         the total over all classes, giving the overall composition.</li>
 *     <li>{@link #predictStates(ProteinSequence)} assigns each residue the class with the highest average
 *         propensity in a window centered on it, with that class's share of the window's propensity as
 *         the confidence.</li>
 * </ul>
 */
public class SecondaryStructurePredictor {
    /** The number of residues in the window used by {@link #predictStates(ProteinSequence)}. */
    public static final int STATE_WINDOW_SIZE = 7;

    //                                     A     C     D     E     F     G     H     I     K     L     M     N     P     Q     R     S     T     V     W     Y
    private static final double[] HELIX = {1.42, 0.70, 1.01, 1.51, 1.13, 0.57, 1.00, 1.08, 1.14, 1.21, 1.45, 0.67, 0.57, 1.11, 0.98, 0.77, 0.83, 1.06, 1.08, 0.69};
    private static final double[] SHEET = {0.83, 1.19, 0.54, 0.37, 1.38, 0.75, 0.87, 1.60, 0.74, 1.30, 1.05, 0.89, 0.55, 1.10, 0.93, 0.75, 1.19, 1.70, 1.37, 1.47};
    private static final double[] COIL  = {0.66, 1.19, 1.46, 0.74, 0.60, 1.56, 0.95, 0.47, 1.01, 0.59, 0.60, 1.56, 1.52, 0.98, 0.95, 1.43, 0.96, 0.50, 0.96, 1.14};

    /** Computes the helix/sheet/coil composition of the whole sequence. */
    public StructureComposition predict(final ProteinSequence sequence) {
        ProteinSequence.assertNotEmpty(sequence, "secondary structure prediction");

        double helix = 0, sheet = 0, coil = 0;
        for (int i=0; i<sequence.length(); ++i) {
            final int index = sequence.residueIndexAt(i);
            helix += HELIX[index];
            sheet += SHEET[index];
            coil  += COIL[index];
        }

        return StructureComposition.fromPropensitySums(helix, sheet, coil);
    }

    /** Assigns a structure class to every residue, returning only the {@link SecondaryStructure#code()}s. */
    public String assignStates(final ProteinSequence sequence) {
        return predictStates(sequence).states();
    }

    /**
     * Assigns a structure class and a confidence to every residue.  Positions of the window that fall off
     * either end of the sequence contribute nothing.  Ties go to helix, then sheet.
     */
    public ResidueStructure predictStates(final ProteinSequence sequence) {
        ProteinSequence.assertNotEmpty(sequence, "secondary structure assignment");

        final int flank = STATE_WINDOW_SIZE / 2;
        final char[] states = new char[sequence.length()];
        final double[] confidences = new double[sequence.length()];
        for (int i=0; i<states.length; ++i) {
            // Every window has the same denominator, so comparing sums is the same as comparing averages
            double helix = 0, sheet = 0, coil = 0;
            final int end = Math.min(sequence.length() - 1, i + flank);
            for (int j=Math.max(0, i - flank); j<=end; ++j) {
                final int index = sequence.residueIndexAt(j);
                helix += HELIX[index];
                sheet += SHEET[index];
                coil  += COIL[index];
            }

            final SecondaryStructure state;
            final double best;
            if (helix >= sheet && helix >= coil) { state = SecondaryStructure.HELIX; best = helix; }
            else if (sheet >= coil)              { state = SecondaryStructure.SHEET; best = sheet; }
            else                                 { state = SecondaryStructure.COIL;  best = coil; }
            states[i] = state.code();
            confidences[i] = 100 * best / (helix + sheet + coil);
        }

        return new ResidueStructure(new String(states), confidences);
    }
}
