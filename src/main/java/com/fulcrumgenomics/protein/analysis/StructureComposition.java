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
 * The proportion of a sequence predicted to be helix, sheet and coil.  The three proportions are
 * non-negative and sum to one.
 */
public class StructureComposition {
    private final double helix;
    private final double sheet;
    private final double coil;

    StructureComposition(final double helix, final double sheet, final double coil) {
        this.helix = helix;
        this.sheet = sheet;
        this.coil  = coil;
    }

    /**
     * Builds a composition from summed propensities, dividing each class by the total over all three
     * classes.  If the total is zero the proportions are split evenly.
     */
    public static StructureComposition fromPropensitySums(final double helixSum, final double sheetSum, final double coilSum) {
        if (helixSum < 0 || sheetSum < 0 || coilSum < 0) {
            throw new IllegalArgumentException("Propensity sums must be non-negative.");
        }

        final double total = helixSum + sheetSum + coilSum;
        if (total == 0) return new StructureComposition(1 / 3d, 1 / 3d, 1 / 3d);
        return new StructureComposition(helixSum / total, sheetSum / total, coilSum / total);
    }

    public double helix() { return this.helix; }
    public double sheet() { return this.sheet; }
    public double coil()  { return this.coil; }

    /** Returns the proportion for the given class. */
    public double get(final SecondaryStructure structure) {
        switch (structure) {
            case HELIX: return this.helix;
            case SHEET: return this.sheet;
            default:    return this.coil;
        }
    }

    @Override public String toString() {
        return String.format("{helix: %.4f, sheet: %.4f, coil: %.4f}", this.helix, this.sheet, this.coil);
    }
}
