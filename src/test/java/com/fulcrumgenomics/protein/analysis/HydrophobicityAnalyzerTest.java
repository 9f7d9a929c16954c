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

import com.fulcrumgenomics.protein.AminoAcids;
import com.fulcrumgenomics.protein.SequenceValidator;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class HydrophobicityAnalyzerTest {
    private final HydrophobicityAnalyzer analyzer = new HydrophobicityAnalyzer();

    private static void assertScores(final double[] actual, final double... expected) {
        Assert.assertEquals(actual.length, expected.length);
        for (int i=0; i<actual.length; ++i) Assert.assertEquals(actual[i], expected[i], 1e-9, "Score " + i);
    }

    @Test(dataProvider = "meanDataProvider")
    public void testMean(final String sequence, final double expectedMean) {
        final HydrophobicityProfile profile = analyzer.analyze(SequenceValidator.validate(sequence));
        Assert.assertEquals(profile.length(), sequence.length());
        Assert.assertEquals(profile.mean(), expectedMean, 1e-9);
    }

    @DataProvider(name = "meanDataProvider")
    public Object[][] meanDataProvider() {
        return new Object[][] {
                {"I", 4.5},
                {"R", -4.5},
                {"IV", 4.35},
                {"IR", 0.0},
                {"GGGG", -0.4},
                {"AC", 2.15},
        };
    }

    @Test
    public void testScoresFollowSequenceOrder() {
        final HydrophobicityProfile profile = analyzer.analyze(SequenceValidator.validate("IVLA"));
        assertScores(profile.getScores(), 4.5, 4.2, 3.8, 1.8);
        Assert.assertEquals(profile.score(2), 3.8, 1e-9);
        Assert.assertEquals(profile.min(), 1.8, 1e-9);
        Assert.assertEquals(profile.max(), 4.5, 1e-9);
    }

    @Test
    public void testEveryValueIsOnTheScale() {
        for (final char ch : AminoAcids.ALPHABET.toCharArray()) {
            final double value = HydrophobicityAnalyzer.valueOf((byte) ch);
            Assert.assertTrue(value >= HydrophobicityAnalyzer.MIN_VALUE && value <= HydrophobicityAnalyzer.MAX_VALUE, "Out of range for " + ch);
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testValueOfNonCanonicalResidue() {
        HydrophobicityAnalyzer.valueOf((byte) 'X');
    }

    @Test
    public void testSmoothed() {
        final HydrophobicityProfile profile = analyzer.analyze(SequenceValidator.validate("IVLA"));
        assertScores(profile.smoothed(1), profile.getScores());
        assertScores(profile.smoothed(2), 4.35, 4.0, 2.8);
        Assert.assertEquals(profile.smoothed(4).length, 1);
        Assert.assertEquals(profile.smoothed(4)[0], profile.mean(), 1e-9);
        Assert.assertEquals(profile.smoothed(5).length, 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSmoothedRejectsEmptyWindow() {
        analyzer.analyze(SequenceValidator.validate("IVLA")).smoothed(0);
    }

    @Test
    public void testScoresAreCopied() {
        final HydrophobicityProfile profile = analyzer.analyze(SequenceValidator.validate("IV"));
        profile.getScores()[0] = 0;
        Assert.assertEquals(profile.score(0), 4.5, 1e-9);
    }
}
