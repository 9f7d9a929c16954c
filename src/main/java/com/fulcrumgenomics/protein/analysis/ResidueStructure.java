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

/**
 * Per-residue secondary structure calls: the state assigned to each residue and the percentage
 * confidence in that state.
 */
public class ResidueStructure {
    private final String states;
    private final double[] confidences;

    ResidueStructure(final String states, final double[] confidences) {
        if (states.length() != confidences.length) {
            throw new IllegalArgumentException("Have " + states.length() + " states but " + confidences.length + " confidences.");
        }
        this.states      = states;
        this.confidences = confidences;
    }

    public int length() { return this.states.length(); }

    /** One {@link SecondaryStructure#code()} per residue. */
    public String states() { return this.states; }

    public char state(final int offset) { return this.states.charAt(offset); }

    /**
     * The share of the window's summed propensity held by the assigned state, as a percentage.  Always at
     * least a third, since the assigned state has the largest of the three sums.
     */
    public double confidence(final int offset) { return this.confidences[offset]; }

    /** Returns a copy of the per-residue confidences. */
    public double[] getConfidences() { return this.confidences.clone(); }
}
