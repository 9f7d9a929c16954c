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
import org.testng.annotations.Test;

public class AminoAcidsTest {

    @Test
    public void testIndexOf() {
        Assert.assertEquals(AminoAcids.COUNT, 20);
        for (int i=0; i<AminoAcids.COUNT; ++i) {
            Assert.assertEquals(AminoAcids.indexOf((byte) AminoAcids.ALPHABET.charAt(i)), i);
        }
        Assert.assertEquals(AminoAcids.indexOf((byte) 'B'), -1);
        Assert.assertEquals(AminoAcids.indexOf((byte) 'a'), -1);
        Assert.assertEquals(AminoAcids.indexOf((byte) -61), -1);
    }

    @Test
    public void testIsCanonical() {
        Assert.assertTrue(AminoAcids.isCanonical('W'));
        Assert.assertFalse(AminoAcids.isCanonical('w'));
        Assert.assertFalse(AminoAcids.isCanonical('U'));
        Assert.assertFalse(AminoAcids.isCanonical('\u00c9'));
    }

    @Test
    public void testClassesAreDisjoint() {
        int classified = 0;
        for (final char ch : AminoAcids.ALPHABET.toCharArray()) {
            final byte b = (byte) ch;
            int n = 0;
            if (AminoAcids.isHydrophobic(b)) ++n;
            if (AminoAcids.isPolar(b)) ++n;
            if (AminoAcids.isCharged(b)) ++n;
            Assert.assertTrue(n <= 1, "Residue in more than one class: " + ch);
            classified += n;
        }
        Assert.assertEquals(classified, AminoAcids.HYDROPHOBIC.length() + AminoAcids.POLAR.length() + AminoAcids.CHARGED.length());
        Assert.assertFalse(AminoAcids.isHydrophobic((byte) 'A'));
        Assert.assertFalse(AminoAcids.isCharged((byte) 'H'));
    }
}
