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

package com.fulcrumgenomics.protein;

import htsjdk.samtools.util.StringUtil;

import java.util.Arrays;

/**
 * An immutable, validated protein sequence.  Every residue is one of the twenty canonical upper-case
 * one-letter codes and the sequence is never empty.  Instances are only produced by
 * {@link SequenceValidator}.
 *
 * An optional name (e.g. the FASTA record name) travels with the sequence for reporting; it plays no
 * part in any of the analyses.
 */
public final class ProteinSequence {
    private final String name;
    private final byte[] residues;

    /** Takes ownership of the residue array; callers must have validated it. */
    ProteinSequence(final String name, final byte[] residues) {
        this.name = name;
        this.residues = residues;
    }

    /** The name of the sequence, or null if none was given. */
    public String name() { return this.name; }

    /** The number of residues in the sequence. */
    public int length() { return this.residues.length; }

    /** The residue at the zero-based offset. */
    public byte residueAt(final int offset) { return this.residues[offset]; }

    /** The index within {@link AminoAcids#ALPHABET} of the residue at the zero-based offset. */
    public int residueIndexAt(final int offset) { return AminoAcids.indexOf(this.residues[offset]); }

    /** Returns a copy of the residues. */
    public byte[] getResidues() { return Arrays.copyOf(this.residues, this.residues.length); }

    /**
     * Throws an {@link EmptySequenceException} if the sequence is null or has no residues.  Analyses
     * call this on entry; a validated sequence never trips it.
     */
    public static void assertNotEmpty(final ProteinSequence sequence, final String operation) {
        if (sequence == null || sequence.length() == 0) throw new EmptySequenceException(operation);
    }

    @Override public boolean equals(final Object o) {
        if (!(o instanceof ProteinSequence)) return false;
        final ProteinSequence that = (ProteinSequence) o;
        return Arrays.equals(this.residues, that.residues) && (this.name == null ? that.name == null : this.name.equals(that.name));
    }

    @Override public int hashCode() { return Arrays.hashCode(this.residues); }

    /** Returns the residues as a String. */
    @Override public String toString() { return StringUtil.bytesToString(this.residues); }
}
