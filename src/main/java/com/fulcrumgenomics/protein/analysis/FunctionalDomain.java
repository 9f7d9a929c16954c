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
 * Coarse whole-sequence functional classes, each recognized by the fraction of the sequence made up of
 * a characteristic set of residues.  {@link #NONE} is reported when no class reaches
 * {@link FunctionalDomainClassifier#MIN_SCORE}.
 */
public enum FunctionalDomain {
    TRANSMEMBRANE("transmembrane domain", "LVIFW"),
    CATALYTIC("catalytic domain", "DEHRK"),
    SIGNAL_PEPTIDE("signal peptide", "ACG"),
    NONE("no clear domain", "");

    private final String label;
    private final String residues;

    FunctionalDomain(final String label, final String residues) {
        this.label    = label;
        this.residues = residues;
    }

    public String label() { return this.label; }

    /** The residues whose combined frequency scores the class. Empty for {@link #NONE}. */
    public String residues() { return this.residues; }

    /** True if the residue belongs to this class's residue set. */
    public boolean contains(final byte residue) {
        return this.residues.indexOf(residue) >= 0;
    }
}
