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
 * Assigns a whole sequence to the {@link FunctionalDomain} whose residues make up the largest fraction
 * of it.  Classes are considered in declaration order and a later class must score strictly higher to
 * replace an earlier one.
 */
public class FunctionalDomainClassifier {
    /** The lowest score at which a class is reported rather than {@link FunctionalDomain#NONE}. */
    public static final double MIN_SCORE = 0.1;

    private static final FunctionalDomain[] CLASSES = {
            FunctionalDomain.TRANSMEMBRANE, FunctionalDomain.CATALYTIC, FunctionalDomain.SIGNAL_PEPTIDE
    };

    public FunctionalDomainPrediction classify(final ProteinSequence sequence) {
        ProteinSequence.assertNotEmpty(sequence, "functional domain prediction");

        final int[] counts = new int[CLASSES.length];
        for (int i=0; i<sequence.length(); ++i) {
            final byte residue = sequence.residueAt(i);
            for (int c=0; c<CLASSES.length; ++c) {
                if (CLASSES[c].contains(residue)) ++counts[c];
            }
        }

        int best = 0;
        for (int c=1; c<CLASSES.length; ++c) {
            if (counts[c] > counts[best]) best = c;
        }

        final double score = counts[best] / (double) sequence.length();
        return new FunctionalDomainPrediction(score < MIN_SCORE ? FunctionalDomain.NONE : CLASSES[best], score);
    }
}
