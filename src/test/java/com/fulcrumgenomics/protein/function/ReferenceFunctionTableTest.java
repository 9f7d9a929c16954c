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

package com.fulcrumgenomics.protein.function;

import htsjdk.samtools.util.IOUtil;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import picard.PicardException;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.util.Arrays;

public class ReferenceFunctionTableTest {

    private static ReferenceFunctionTable parse(final String text) throws IOException {
        return ReferenceFunctionTable.read(new BufferedReader(new StringReader(text)), "test");
    }

    @Test
    public void testBuiltIn() {
        final ReferenceFunctionTable table = ReferenceFunctionTable.builtIn();
        Assert.assertEquals(table.size(), 6);
        Assert.assertEquals(table.dimension(), FunctionEmbedder.DIMENSION);
        Assert.assertEquals(table.labels(), Arrays.asList("enzyme", "transport", "signaling", "DNA/RNA binding", "structural", "hormone"));
        Assert.assertSame(ReferenceFunctionTable.fromFileOrBuiltIn(null), table);
    }

    @Test
    public void testBuiltInCompositionsAreNormalized() {
        final ReferenceFunctionTable table = ReferenceFunctionTable.builtIn();
        for (final String label : table.labels()) {
            final double[] vector = table.vector(label);
            double sum = 0;
            for (int i=0; i<FunctionEmbedder.COMPOSITION_DIMENSION; ++i) sum += vector[i];
            Assert.assertEquals(sum, 1.0, 0.01, label);
        }
    }

    @Test
    public void testParseSkipsCommentsAndBlankLines() throws IOException {
        final ReferenceFunctionTable table = parse("# a comment\n\nalpha\t1\t0.5\n  \nbeta\t0\t2\n# trailing\n");
        Assert.assertEquals(table.size(), 2);
        Assert.assertEquals(table.dimension(), 2);
        Assert.assertEquals(table.label(0), "alpha");
        Assert.assertEquals(table.vector("beta")[1], 2.0, 1e-12);
        Assert.assertNull(table.vector("gamma"));
    }

    @Test
    public void testLabelsMayContainSpaces() throws IOException {
        final ReferenceFunctionTable table = parse("DNA/RNA binding\t1\t2\n");
        Assert.assertEquals(table.labels(), Arrays.asList("DNA/RNA binding"));
    }

    @Test
    public void testEmptyTable() throws IOException {
        final ReferenceFunctionTable table = parse("# nothing here\n");
        Assert.assertTrue(table.isEmpty());
        Assert.assertEquals(table.dimension(), 0);
    }

    @Test(dataProvider = "malformedTablesDataProvider")
    public void testMalformedTables(final String text, final String expectedMessage) throws IOException {
        try {
            parse(text);
            Assert.fail("Expected a PicardException");
        }
        catch (final PicardException ex) {
            Assert.assertTrue(ex.getMessage().contains(expectedMessage), ex.getMessage());
        }
    }

    @DataProvider(name = "malformedTablesDataProvider")
    public Object[][] malformedTablesDataProvider() {
        return new Object[][] {
                {"alpha\t1\t2\nbeta\t1\tx\n", "line 2"},
                {"alpha\n", "line 1"},
                {"alpha\t1\t2\nbeta\t1\t2\t3\n", "line 2"},
                {"alpha\t1\t2\nalpha\t3\t4\n", "Duplicate"},
                {"# header\nalpha\t-1\t2\n", "line 2"},
                {"alpha\t1\tNaN\n", "non-finite"},
                {"\t1\t2\n", "must not be empty"},
        };
    }

    @Test
    public void testVectorsAreCopied() {
        final ReferenceFunctionTable table = new ReferenceFunctionTable.Builder().add("a", 1, 2).build();
        table.vector("a")[0] = 99;
        Assert.assertEquals(table.vector("a")[0], 1.0, 1e-12);
    }

    @Test
    public void testBuilderIsUnaffectedByCallerArrays() {
        final double[] values = {1, 2};
        final ReferenceFunctionTable table = new ReferenceFunctionTable.Builder().add("a", values).build();
        values[0] = 99;
        Assert.assertEquals(table.vector("a")[0], 1.0, 1e-12);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testLabelsAreUnmodifiable() {
        ReferenceFunctionTable.builtIn().labels().add("toxin");
    }

    @Test
    public void testFromFile() throws IOException {
        final File dir = Files.createTempDirectory("ReferenceFunctionTableTest").toFile();
        final File file = new File(dir, "functions.txt");
        Files.write(file.toPath(), Arrays.asList("# label\tvalues", "kinase\t0.5\t0.5", "channel\t0.9\t0.1"));

        final ReferenceFunctionTable table = ReferenceFunctionTable.fromFileOrBuiltIn(file);
        Assert.assertEquals(table.labels(), Arrays.asList("kinase", "channel"));
        Assert.assertEquals(table.vector("channel")[0], 0.9, 1e-12);

        IOUtil.deleteDirectoryTree(dir);
    }

    @Test(expectedExceptions = PicardException.class)
    public void testMissingResource() {
        ReferenceFunctionTable.fromResource("no_such_table.txt");
    }
}
