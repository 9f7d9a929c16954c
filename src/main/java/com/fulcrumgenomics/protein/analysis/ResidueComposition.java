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
 * Coarse composition of a protein: the fraction of residues that are hydrophobic, polar and charged, and an
 * approximate molecular weight.
 */
public class ResidueComposition {
    private final int length;
    private final double hydrophobicFraction;
    private final double polarFraction;
    private final double chargedFraction;
    private final double molecularWeight;

    ResidueComposition(final int length,
                       final double hydrophobicFraction,
                       final double polarFraction,
                       final double chargedFraction,
                       final double molecularWeight) {
        this.length              = length;
        this.hydrophobicFraction = hydrophobicFraction;
        this.polarFraction       = polarFraction;
        this.chargedFraction     = chargedFraction;
        this.molecularWeight     = molecularWeight;
    }

    public int length() { return this.length; }
    public double hydrophobicFraction() { return this.hydrophobicFraction; }
    public double polarFraction() { return this.polarFraction; }
    public double chargedFraction() { return this.chargedFraction; }

    /** The approximate molecular weight in Daltons. */
    public double molecularWeight() { return this.molecularWeight; }
}
