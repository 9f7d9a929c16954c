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
 * Turns raw user input into a {@link ProteinSequence}.  All whitespace is removed (so sequences pasted
 * across several lines are accepted), the remaining characters are upper-cased, and each one is
 * checked against the canonical amino acid alphabet.  The first offending character is reported along
 * with its 1-based position in the whitespace-stripped sequence.
 */
public final class SequenceValidator {

    private SequenceValidator() { }

    /** Validates an unnamed sequence. */
    public static ProteinSequence validate(final String raw) {
        return validate(null, raw);
    }

    /** Validates a sequence and attaches the given name (which may be null) to it. */
    public static ProteinSequence validate(final String name, final String raw) {
        if (raw == null) throw new InvalidSequenceException(name, "No sequence provided.");

        final byte[] residues = new byte[raw.length()];
        int length = 0;
        for (int i=0; i<raw.length(); ++i) {
            final char ch = raw.charAt(i);
            if (Character.isWhitespace(ch)) continue;

            final char upper = Character.toUpperCase(ch);
            if (!AminoAcids.isCanonical(upper)) throw new InvalidSequenceException(name, ch, length + 1);
            residues[length++] = (byte) upper;
        }

        if (length == 0) throw new InvalidSequenceException(name, "Sequence is empty after removing whitespace.");
        return new ProteinSequence(name, Arrays.copyOf(residues, length));
    }
}
