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

import com.fulcrumgenomics.protein.analysis.AnalysisResult;
import com.fulcrumgenomics.protein.analysis.DomainHit;
import com.fulcrumgenomics.protein.function.FunctionCandidate;
import com.fulcrumgenomics.protein.function.FunctionEmbedder;
import com.fulcrumgenomics.protein.function.ReferenceFunctionTable;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public class ProteinAnalysisEngineTest {
    private static final String INSULIN_B = "FVNQHLCGSHLVEALYLVCGERGFFYTPKT";
    private static final String LYSOZYME  = "KVFGRCELAAAMKRHGLDNYRGYSLGNWVCAAKFESNFNTQATNRNTDGSTDYGILQINSRWWCNDGRTPGSRNLCNIPCSALLSSDITASVNCAKKIVSDGNGMNAWVAWRNRCKGTDVQAWIRGCRL";

    private final ProteinAnalysisEngine engine = new ProteinAnalysisEngine();

    @Test
    public void testKnownFunctionLabels() {
        Assert.assertEquals(engine.knownFunctionLabels(), ReferenceFunctionTable.builtIn().labels());
    }

    @Test(dataProvider = "sequencesDataProvider")
    public void testAnalyzeFull(final String raw) {
        final ProteinSequence sequence = engine.validate("query", raw);
        final AnalysisResult result = engine.analyzeFull(sequence);

        Assert.assertSame(result.sequence(), sequence);
        Assert.assertEquals(result.hydrophobicity().length(), sequence.length());
        Assert.assertEquals(result.structureStates().length(), sequence.length());
        Assert.assertEquals(result.structure().helix() + result.structure().sheet() + result.structure().coil(), 1.0, 1e-9);
        Assert.assertEquals(result.composition().molecularWeight(), sequence.length() * 110.0, 1e-9);
        Assert.assertFalse(result.domains().isEmpty());
        Assert.assertEquals(result.residueStructure().length(), sequence.length());
        Assert.assertTrue(result.functionalDomain().score() >= 0 && result.functionalDomain().score() <= 1);

        final List<FunctionCandidate> candidates = result.function().candidates();
        Assert.assertEquals(candidates.size(), engine.knownFunctionLabels().size());
        Assert.assertTrue(engine.knownFunctionLabels().contains(result.function().label()));
        Assert.assertTrue(result.function().confidence() >= 0 && result.function().confidence() <= 1);
        for (int i=1; i<candidates.size(); ++i) {
            Assert.assertTrue(candidates.get(i-1).similarity() >= candidates.get(i).similarity());
            Assert.assertEquals(candidates.get(i).rank(), i + 1);
        }
    }

    @DataProvider(name = "sequencesDataProvider")
    public Object[][] sequencesDataProvider() {
        return new Object[][] { {INSULIN_B}, {LYSOZYME}, {"M"}, {"GPPGPPGPPGPPGPPGPPGPP"} };
    }

    @Test
    public void testAnalysisIsDeterministic() {
        final AnalysisResult a = engine.analyzeFull(engine.validate(LYSOZYME));
        final AnalysisResult b = new ProteinAnalysisEngine().analyzeFull(engine.validate(LYSOZYME));

        Assert.assertTrue(Arrays.equals(a.hydrophobicity().getScores(), b.hydrophobicity().getScores()));
        Assert.assertTrue(Arrays.equals(a.hydrophobicity().smoothed(9), b.hydrophobicity().smoothed(9)));
        Assert.assertEquals(a.structure().helix(), b.structure().helix());
        Assert.assertEquals(a.structure().sheet(), b.structure().sheet());
        Assert.assertEquals(a.structure().coil(), b.structure().coil());
        Assert.assertEquals(a.structureStates(), b.structureStates());
        Assert.assertTrue(Arrays.equals(a.residueStructure().getConfidences(), b.residueStructure().getConfidences()));
        Assert.assertEquals(a.composition().hydrophobicFraction(), b.composition().hydrophobicFraction());
        Assert.assertEquals(a.composition().polarFraction(), b.composition().polarFraction());
        Assert.assertEquals(a.composition().chargedFraction(), b.composition().chargedFraction());
        Assert.assertEquals(a.functionalDomain().toString(), b.functionalDomain().toString());
        Assert.assertEquals(a.domains().toString(), b.domains().toString());

        final List<FunctionCandidate> candidatesA = a.function().candidates();
        final List<FunctionCandidate> candidatesB = b.function().candidates();
        Assert.assertEquals(candidatesA.size(), candidatesB.size());
        for (int i=0; i<candidatesA.size(); ++i) {
            Assert.assertEquals(candidatesA.get(i).label(), candidatesB.get(i).label());
            Assert.assertEquals(candidatesA.get(i).similarity(), candidatesB.get(i).similarity());
            Assert.assertEquals(candidatesA.get(i).rank(), candidatesB.get(i).rank());
        }
    }

    @Test
    public void testInsulinMotifIsFound() {
        final AnalysisResult result = engine.analyzeFull(engine.validate(INSULIN_B));
        boolean found = false;
        for (final DomainHit hit : result.domains()) found |= hit.name().equals("Insulin/IGF/Relaxin");
        Assert.assertTrue(found, result.domains().toString());
    }

    @Test(expectedExceptions = EmptyReferenceTableException.class)
    public void testEmptyReferenceTableFailsAtConstruction() {
        new ProteinAnalysisEngine(new ReferenceFunctionTable.Builder().build(), new FunctionEmbedder());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEmbedderMustMatchTable() {
        new ProteinAnalysisEngine(ReferenceFunctionTable.builtIn(), FunctionEmbedder.compositionOnly());
    }

    @Test(expectedExceptions = InvalidSequenceException.class)
    public void testValidateRejectsInvalidInput() {
        engine.validate("MKTX");
    }

    @Test
    public void testCompareSequencesOfDifferentLengths() {
        final ProteinSequence original = engine.validate(INSULIN_B);
        final ProteinSequence mutated  = engine.validate(INSULIN_B.substring(0, 20));
        Assert.assertEquals(engine.compare(original, mutated).lengthDelta(), -10);
    }
}
