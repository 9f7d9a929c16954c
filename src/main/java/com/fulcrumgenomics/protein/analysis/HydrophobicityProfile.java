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

import java.util.Arrays;

/**
 * Per-residue hydrophobicity scores for a sequence, one per residue in sequence order, along with
 * the mean score across the whole sequence.
 */
public class HydrophobicityProfile {
    private final double[] scores;
    private final double mean;

    /** Takes ownership of the scores array. */
    HydrophobicityProfile(final double[] scores, final double mean) {
        this.scores = scores;
        this.mean = mean;
    }

    /** The number of residues scored; always equal to the length of the sequence. */
    public int length() { return this.scores.length; }

    /** The score of the residue at the zero-based offset. */
    public double score(final int offset) { return this.scores[offset]; }

    /** Returns a copy of the per-residue scores. */
    public double[] getScores() { return Arrays.copyOf(this.scores, this.scores.length); }

    /** The arithmetic mean of the per-residue scores. */
    public double mean() { return this.mean; }

    public double min() { return Arrays.stream(this.scores).min().getAsDouble(); }

    public double max() { return Arrays.stream(this.scores).max().getAsDouble(); }

    /**
     * Computes a hydropathy plot: the mean score of every window of {@code windowSize} consecutive residues.
     * Element {@code i} of the result is the mean over residues {@code i} to {@code i + windowSize - 1}, so
     * the result has {@code length() - windowSize + 1} elements and is empty if the window is longer than
     * the sequence.
     */
    public double[] smoothed(final int windowSize) {
        if (windowSize < 1) throw new IllegalArgumentException("Window size must be at least 1: " + windowSize);
        if (windowSize > this.scores.length) return new double[0];

        final double[] smoothed = new double[this.scores.length - windowSize + 1];
        for (int i=0; i<smoothed.length; ++i) {
            double sum = 0;
            for (int j=i; j<i+windowSize; ++j) sum += this.scores[j];
            smoothed[i] = sum / windowSize;
        }
        return smoothed;
    }
}
