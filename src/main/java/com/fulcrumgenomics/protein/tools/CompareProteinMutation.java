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

package com.fulcrumgenomics.protein.tools;

import com.fulcrumgenomics.protein.ProteinAnalysisEngine;
import com.fulcrumgenomics.protein.ProteinSequence;
import com.fulcrumgenomics.protein.cmdline.ProteinAnalysisPrograms;
import com.fulcrumgenomics.protein.function.FunctionEmbedder;
import com.fulcrumgenomics.protein.function.ReferenceFunctionTable;
import com.fulcrumgenomics.protein.metrics.MutationDeltaMetric;
import com.fulcrumgenomics.protein.mutation.MutationDelta;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.FormatUtil;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import picard.cmdline.CommandLineProgram;
import picard.cmdline.CommandLineProgramProperties;
import picard.cmdline.Option;
import picard.cmdline.StandardOptionDefinitions;

import java.io.File;

/**
 * Program which analyzes a protein sequence and a mutated version of it and reports how the mutation
 * shifts mean hydrophobicity, secondary structure composition and the predicted function.
 */
@CommandLineProgramProperties(
        usage = "Compares the predicted properties of a protein sequence with those of a mutated version of it.\n" +
                "The sequences need not be the same length, so insertions and deletions may be compared as well as\n" +
                "substitutions. Writes a metrics file with a single row of differences (mutated minus original).",
        usageShort = "Compares the predicted properties of a protein and a mutated version of it.",
        programGroup = ProteinAnalysisPrograms.class
)
public class CompareProteinMutation extends CommandLineProgram {
    @Option(doc = "The original protein sequence.")
    public String ORIGINAL;

    @Option(doc = "The mutated protein sequence.")
    public String MUTATED;

    @Option(shortName = "RT", doc = "A tab-delimited table of reference function embeddings to use instead of the built-in table.", optional = true)
    public File REFERENCE_TABLE;

    @Option(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME, doc = "The metrics file to write.")
    public File OUTPUT;

    private final Log log = Log.getInstance(CompareProteinMutation.class);

    @Override
    protected int doWork() {
        if (REFERENCE_TABLE != null) IOUtil.assertFileIsReadable(REFERENCE_TABLE);
        IOUtil.assertFileIsWritable(OUTPUT);

        final ProteinAnalysisEngine engine = new ProteinAnalysisEngine(ReferenceFunctionTable.fromFileOrBuiltIn(REFERENCE_TABLE), new FunctionEmbedder());
        final ProteinSequence original = engine.validate("original", ORIGINAL);
        final ProteinSequence mutated  = engine.validate("mutated", MUTATED);
        final MutationDelta delta = engine.compare(original, mutated);

        final MetricsFile<MutationDeltaMetric, ?> metrics = getMetricsFile();
        metrics.addMetric(toMetric(delta));
        metrics.write(OUTPUT);

        final FormatUtil fmt = new FormatUtil();
        log.info("Mean hydrophobicity changed by " + fmt.format(delta.hydrophobicityDelta()) + ".");
        if (delta.functionChanged()) {
            log.info("Predicted function changed from " + delta.originalFunction() + " to " + delta.mutatedFunction() + ".");
        }
        else {
            log.info("Predicted function unchanged: " + delta.originalFunction() + ".");
        }
        return 0;
    }

    /** Builds the metric describing the differences between the two sequences. */
    static MutationDeltaMetric toMetric(final MutationDelta delta) {
        final MutationDeltaMetric metric = new MutationDeltaMetric();
        metric.ORIGINAL_LENGTH         = delta.original().sequence().length();
        metric.MUTATED_LENGTH          = delta.mutated().sequence().length();
        metric.ORIGINAL_HYDROPHOBICITY = delta.original().hydrophobicity().mean();
        metric.MUTATED_HYDROPHOBICITY  = delta.mutated().hydrophobicity().mean();
        metric.HYDROPHOBICITY_DELTA    = delta.hydrophobicityDelta();
        metric.HELIX_DELTA             = delta.helixDelta();
        metric.SHEET_DELTA             = delta.sheetDelta();
        metric.COIL_DELTA              = delta.coilDelta();
        metric.ORIGINAL_FUNCTION       = delta.originalFunction();
        metric.ORIGINAL_CONFIDENCE     = delta.originalConfidence();
        metric.MUTATED_FUNCTION        = delta.mutatedFunction();
        metric.MUTATED_CONFIDENCE      = delta.mutatedConfidence();
        metric.FUNCTION_CHANGED        = delta.functionChanged();
        return metric;
    }
}
