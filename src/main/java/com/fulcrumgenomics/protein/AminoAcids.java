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

import java.util.Arrays;

/**
 * Static information about the twenty canonical amino acids: the one-letter alphabet, the index of
 * each residue within that alphabet, and the coarse physico-chemical classes used when summarizing
 * the composition of a protein.
 *
 * Per-residue lookup tables elsewhere in this package are plain arrays laid out in {@link #ALPHABET}
 * order and indexed with {@link #indexOf(byte)}.
 */
public final class AminoAcids {
    /** The canonical one-letter residue codes, in alphabetical order. */
    public static final String ALPHABET = "ACDEFGHIKLMNPQRSTVWY";

    /** The number of canonical residues. */
    public static final int COUNT = ALPHABET.length();

    /** Residues considered hydrophobic when computing composition. */
    public static final String HYDROPHOBIC = "VILMFYW";

    /** Residues considered polar (uncharged) when computing composition. */
    public static final String POLAR = "STNQ";

    /** Residues considered charged when computing composition. */
    public static final String CHARGED = "DEKR";

    private static final byte[] INDEX = new byte[128];
    private static final boolean[] IS_HYDROPHOBIC = new boolean[128];
    private static final boolean[] IS_POLAR = new boolean[128];
    private static final boolean[] IS_CHARGED = new boolean[128];

    static {
        Arrays.fill(INDEX, (byte) -1);
        for (int i=0; i<ALPHABET.length(); ++i) INDEX[ALPHABET.charAt(i)] = (byte) i;
        for (final char ch : HYDROPHOBIC.toCharArray()) IS_HYDROPHOBIC[ch] = true;
        for (final char ch : POLAR.toCharArray())       IS_POLAR[ch]       = true;
        for (final char ch : CHARGED.toCharArray())     IS_CHARGED[ch]     = true;
    }

    private AminoAcids() { }

    /** Returns the zero-based index of the residue within {@link #ALPHABET}, or -1 if it is not a canonical upper-case residue. */
    public static int indexOf(final byte residue) {
        return residue < 0 ? -1 : INDEX[residue];
    }

    /** True if the character is one of the twenty canonical upper-case residue codes. */
    public static boolean isCanonical(final char ch) {
        return ch < 128 && INDEX[ch] != -1;
    }

    public static boolean isHydrophobic(final byte residue) { return residue >= 0 && IS_HYDROPHOBIC[residue]; }
    public static boolean isPolar(final byte residue)       { return residue >= 0 && IS_POLAR[residue]; }
    public static boolean isCharged(final byte residue)     { return residue >= 0 && IS_CHARGED[residue]; }
}
