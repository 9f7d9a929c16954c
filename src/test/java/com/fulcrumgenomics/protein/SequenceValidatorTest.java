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

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class SequenceValidatorTest {

    @Test(dataProvider = "validSequencesDataProvider")
    public void testValidSequences(final String raw, final String expected) {
        final ProteinSequence sequence = SequenceValidator.validate(raw);
        Assert.assertEquals(sequence.toString(), expected);
        Assert.assertEquals(sequence.length(), expected.length());
        Assert.assertNull(sequence.name());
    }

    @DataProvider(name = "validSequencesDataProvider")
    public Object[][] validSequencesDataProvider() {
        return new Object[][] {
                {"ACDEFGHIKLMNPQRSTVWY", "ACDEFGHIKLMNPQRSTVWY"},
                // lower case is accepted
                {"mktayiakqr", "MKTAYIAKQR"},
                // whitespace anywhere is removed
                {"  MKT AYI\nAKQ\tR \r\n", "MKTAYIAKQR"},
                {"a", "A"},
        };
    }

    @Test(dataProvider = "invalidSequencesDataProvider")
    public void testInvalidSequences(final String raw, final char character, final int position) {
        try {
            SequenceValidator.validate(raw);
            Assert.fail("Expected an InvalidSequenceException for " + raw);
        }
        catch (final InvalidSequenceException ex) {
            Assert.assertEquals(ex.getCharacter(), Character.valueOf(character));
            Assert.assertEquals(ex.getPosition(), position);
            Assert.assertTrue(ex.getMessage().contains("'" + character + "'"), ex.getMessage());
        }
    }

    @DataProvider(name = "invalidSequencesDataProvider")
    public Object[][] invalidSequencesDataProvider() {
        return new Object[][] {
                {"ABCXYZ123", 'B', 2},
                {"X", 'X', 1},
                // positions count only the residues that remain after whitespace is removed
                {"MK T\nA*", '*', 5},
                // the original character is reported, not its upper-cased form
                {"MKTb", 'b', 4},
                {"MKT1", '1', 4},
                {"MKT-AYI", '-', 4},
        };
    }

    @Test(dataProvider = "emptySequencesDataProvider")
    public void testEmptySequences(final String raw) {
        try {
            SequenceValidator.validate(raw);
            Assert.fail("Expected an InvalidSequenceException");
        }
        catch (final InvalidSequenceException ex) {
            Assert.assertNull(ex.getCharacter());
            Assert.assertEquals(ex.getPosition(), -1);
        }
    }

    @DataProvider(name = "emptySequencesDataProvider")
    public Object[][] emptySequencesDataProvider() {
        return new Object[][] { {""}, {"   "}, {"\n\t\r\n"}, {null} };
    }

    @Test
    public void testNameIsCarriedAndReported() {
        Assert.assertEquals(SequenceValidator.validate("p53", "MEEP").name(), "p53");

        try {
            SequenceValidator.validate("p53", "MEEPZ");
            Assert.fail("Expected an InvalidSequenceException");
        }
        catch (final InvalidSequenceException ex) {
            Assert.assertEquals(ex.getSequenceName(), "p53");
            Assert.assertTrue(ex.getMessage().startsWith("Sequence 'p53': "), ex.getMessage());
        }
    }

    @Test
    public void testValidationIsIdempotent() {
        final ProteinSequence once  = SequenceValidator.validate(" mkt ayi ");
        final ProteinSequence twice = SequenceValidator.validate(once.toString());
        Assert.assertEquals(twice, once);
        Assert.assertEquals(twice.hashCode(), once.hashCode());
    }

    @Test
    public void testResiduesAreCopied() {
        final ProteinSequence sequence = SequenceValidator.validate("MKT");
        final byte[] residues = sequence.getResidues();
        residues[0] = 'A';
        Assert.assertEquals(sequence.toString(), "MKT");
        Assert.assertEquals(sequence.residueAt(0), (byte) 'M');
        Assert.assertEquals(sequence.residueIndexAt(0), AminoAcids.ALPHABET.indexOf('M'));
    }

    @Test
    public void testExceptionsAreProteinAnalysisExceptions() {
        try {
            SequenceValidator.validate("J");
            Assert.fail("Expected an exception");
        }
        catch (final ProteinAnalysisException ex) {
            Assert.assertTrue(ex instanceof InvalidSequenceException);
        }
    }
}
