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

/**
 * Thrown when raw input cannot be turned into a protein sequence, either because it is empty or because
 * it contains a character outside the canonical amino acid alphabet.  In the latter case the offending
 * character and its 1-based position are available for diagnostics.
 */
public class InvalidSequenceException extends ProteinAnalysisException {
    private final String sequenceName;
    private final Character character;
    private final int position;

    /** Constructs an exception for input that has no residues at all. */
    public InvalidSequenceException(final String sequenceName, final String message) {
        super(describe(sequenceName) + message);
        this.sequenceName = sequenceName;
        this.character = null;
        this.position = -1;
    }

    /** Constructs an exception for an invalid character at the given 1-based position. */
    public InvalidSequenceException(final String sequenceName, final char character, final int position) {
        super(describe(sequenceName) + String.format("Invalid residue '%s' at position %d; residues must be one of %s.",
                character, position, AminoAcids.ALPHABET));
        this.sequenceName = sequenceName;
        this.character = character;
        this.position = position;
    }

    private static String describe(final String sequenceName) {
        return sequenceName == null ? "" : "Sequence '" + sequenceName + "': ";
    }

    /** The name of the offending sequence, or null if it was unnamed. */
    public String getSequenceName() { return sequenceName; }

    /** The first invalid character, or null if the input was empty. */
    public Character getCharacter() { return character; }

    /** The 1-based position of the first invalid character, or -1 if the input was empty. */
    public int getPosition() { return position; }
}
