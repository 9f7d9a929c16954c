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

import com.fulcrumgenomics.protein.AminoAcids;
import com.fulcrumgenomics.protein.ProteinSequence;
import com.fulcrumgenomics.protein.analysis.HydrophobicityAnalyzer;

/**
 * Converts a sequence into a fixed-length, non-negative feature vector for comparison against reference
 * functions.  The first {@link AminoAcids#COUNT} elements are the frequency of each residue, in
 * {@link AminoAcids#ALPHABET} order, and sum to one.  Unless the embedder is composition-only, two derived
 * features follow, each scaled into [0,1]:
 * <ol>
 *     <li>the length bucket of the sequence (see {@link #lengthBucket(int)});</li>
 *     <li>the mean Kyte-Doolittle hydrophobicity, rescaled from the range of the scale.</li>
 * </ol>
 */
public class FunctionEmbedder {
    /** The number of elements in a composition-only embedding. */
    public static final int COMPOSITION_DIMENSION = AminoAcids.COUNT;

    /** The number of elements in a full embedding. */
    public static final int DIMENSION = COMPOSITION_DIMENSION + 2;

    /** Inclusive upper bounds on sequence length for each length bucket but the last, which is open. */
    static final int[] LENGTH_BUCKET_BOUNDS = {50, 100, 200, 400, 800};

    private final boolean includeDerivedFeatures;
    private final HydrophobicityAnalyzer hydrophobicityAnalyzer = new HydrophobicityAnalyzer();

    /** Constructs an embedder producing full {@link #DIMENSION}-element embeddings. */
    public FunctionEmbedder() { this(true); }

    public FunctionEmbedder(final boolean includeDerivedFeatures) {
        this.includeDerivedFeatures = includeDerivedFeatures;
    }

    /** Constructs an embedder producing only the residue frequency histogram. */
    public static FunctionEmbedder compositionOnly() { return new FunctionEmbedder(false); }

    /** The length of the vectors produced by {@link #embed(ProteinSequence)}. */
    public int dimension() { return this.includeDerivedFeatures ? DIMENSION : COMPOSITION_DIMENSION; }

    public double[] embed(final ProteinSequence sequence) {
        ProteinSequence.assertNotEmpty(sequence, "function embedding");

        final double[] embedding = new double[dimension()];
        for (int i=0; i<sequence.length(); ++i) embedding[sequence.residueIndexAt(i)] += 1;
        for (int i=0; i<COMPOSITION_DIMENSION; ++i) embedding[i] /= sequence.length();

        if (this.includeDerivedFeatures) {
            embedding[COMPOSITION_DIMENSION]     = lengthBucket(sequence.length());
            embedding[COMPOSITION_DIMENSION + 1] = scaledHydrophobicity(this.hydrophobicityAnalyzer.analyze(sequence).mean());
        }

        return embedding;
    }

    /**
     * Places a length into one of six buckets (up to 50, 100, 200, 400, 800 residues, or longer) and returns
     * the bucket index divided by the index of the last bucket.
     */
    static double lengthBucket(final int length) {
        int bucket = 0;
        while (bucket < LENGTH_BUCKET_BOUNDS.length && length > LENGTH_BUCKET_BOUNDS[bucket]) ++bucket;
        return bucket / (double) LENGTH_BUCKET_BOUNDS.length;
    }

    /** Rescales a mean hydrophobicity from the Kyte-Doolittle range into [0,1]. */
    static double scaledHydrophobicity(final double mean) {
        final double scaled = (mean - HydrophobicityAnalyzer.MIN_VALUE) / (HydrophobicityAnalyzer.MAX_VALUE - HydrophobicityAnalyzer.MIN_VALUE);
        return Math.max(0, Math.min(1, scaled));
    }
}
