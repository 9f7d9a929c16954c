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

import com.fulcrumgenomics.protein.SequenceValidator;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class FunctionalDomainClassifierTest {
    private final FunctionalDomainClassifier classifier = new FunctionalDomainClassifier();

    @Test(dataProvider = "classifyDataProvider")
    public void testClassify(final String sequence, final FunctionalDomain expected, final double score) {
        final FunctionalDomainPrediction prediction = classifier.classify(SequenceValidator.validate(sequence));
        Assert.assertEquals(prediction.domain(), expected);
        Assert.assertEquals(prediction.score(), score, 1e-9);
    }

    @DataProvider(name = "classifyDataProvider")
    public Object[][] classifyDataProvider() {
        return new Object[][] {
                {"LLLL",        FunctionalDomain.TRANSMEMBRANE,  1.0},
                {"DDEE",        FunctionalDomain.CATALYTIC,      1.0},
                {"HHKR",        FunctionalDomain.CATALYTIC,      1.0},
                {"AAGG",        FunctionalDomain.SIGNAL_PEPTIDE, 1.0},
                {"MNPQSTY",     FunctionalDomain.NONE,           0.0},
                {"MNPQSTYMNPL", FunctionalDomain.NONE,           1 / 11d},
                {"MNPQSTYMNL",  FunctionalDomain.TRANSMEMBRANE,  0.1},
                {"LD",          FunctionalDomain.TRANSMEMBRANE,  0.5},
                {"DA",          FunctionalDomain.CATALYTIC,      0.5},
                {"AW",          FunctionalDomain.TRANSMEMBRANE,  0.5},
                {"FVNQHLCGSHLVEALYLVCGERGFFYTPKT", FunctionalDomain.TRANSMEMBRANE, 10 / 30d},
        };
    }

    @Test
    public void testLabelsAndDescriptions() {
        final FunctionalDomainPrediction catalytic = classifier.classify(SequenceValidator.validate("AAKKRRHAA"));
        Assert.assertEquals(catalytic.domain().label(), "catalytic domain");
        Assert.assertEquals(catalytic.score(), 5 / 9d, 1e-9);
        Assert.assertTrue(catalytic.description().contains("involved in catalytic domain activity"), catalytic.description());

        final FunctionalDomainPrediction none = classifier.classify(SequenceValidator.validate("MMMM"));
        Assert.assertEquals(none.domain().label(), "no clear domain");
        Assert.assertTrue(none.description().contains("uncertain"), none.description());
    }
}
