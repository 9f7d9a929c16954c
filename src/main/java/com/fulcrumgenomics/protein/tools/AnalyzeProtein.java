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
import com.fulcrumgenomics.protein.analysis.AnalysisResult;
import com.fulcrumgenomics.protein.analysis.DomainHit;
import com.fulcrumgenomics.protein.analysis.HydrophobicityProfile;
import com.fulcrumgenomics.protein.analysis.ResidueStructure;
import com.fulcrumgenomics.protein.cmdline.ProteinAnalysisPrograms;
import com.fulcrumgenomics.protein.function.FunctionCandidate;
import com.fulcrumgenomics.protein.function.FunctionEmbedder;
import com.fulcrumgenomics.protein.function.ReferenceFunctionTable;
import com.fulcrumgenomics.protein.metrics.DomainMetric;
import com.fulcrumgenomics.protein.metrics.FunctionCandidateMetric;
import com.fulcrumgenomics.protein.metrics.ProteinAnalysisMetric;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.util.CloserUtil;
import htsjdk.samtools.util.FormatUtil;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.StringUtil;
import picard.cmdline.CommandLineProgram;
import picard.cmdline.CommandLineProgramProperties;
import picard.cmdline.Option;
import picard.cmdline.StandardOptionDefinitions;

import java.io.File;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Program which predicts the properties of one or more protein sequences: hydrophobicity, secondary
 * structure, residue composition, putative domains, a coarse functional domain class and the most
 * similar reference function.
 *
 * Four files are written using OUTPUT as a prefix:
 * <ul>
 *     <li>OUTPUT.protein_analysis_metrics: one summary row per sequence;</li>
 *     <li>OUTPUT.function_candidates: every reference function ranked for every sequence;</li>
 *     <li>OUTPUT.domains: the putative domains found in every sequence;</li>
 *     <li>OUTPUT.residues.txt: a per-residue table of hydrophobicity and predicted structure with its confidence.</li>
 * </ul>
 */
@CommandLineProgramProperties(
        usage = "Predicts hydrophobicity, secondary structure composition, domains and function for protein sequences.\n" +
                "Sequences are given either directly with SEQUENCE or as a protein FASTA file with INPUT. Function\n" +
                "is predicted by comparing the residue composition of each sequence with a table of reference\n" +
                "functions; a built-in table is used unless REFERENCE_TABLE is given.",
        usageShort = "Predicts properties of protein sequences.",
        programGroup = ProteinAnalysisPrograms.class
)
public class AnalyzeProtein extends CommandLineProgram {
    public static final String ANALYSIS_METRICS_EXTENSION = ".protein_analysis_metrics";
    public static final String FUNCTION_CANDIDATES_EXTENSION = ".function_candidates";
    public static final String DOMAINS_EXTENSION = ".domains";
    public static final String RESIDUES_EXTENSION = ".residues.txt";

    @Option(shortName = StandardOptionDefinitions.INPUT_SHORT_NAME, doc = "A FASTA file of protein sequences.", optional = true)
    public File INPUT;

    @Option(shortName = "S", doc = "A protein sequence to analyze, instead of INPUT.", optional = true)
    public String SEQUENCE;

    @Option(shortName = "N", doc = "The name to report for SEQUENCE.")
    public String SEQUENCE_NAME = "sequence";

    @Option(shortName = "RT", doc = "A tab-delimited table of reference function embeddings to use instead of the built-in table.", optional = true)
    public File REFERENCE_TABLE;

    @Option(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME, doc = "The prefix for output files.")
    public File OUTPUT;

    @Option(shortName = "W", doc = "The number of residues averaged for the smoothed hydrophobicity in the per-residue table.")
    public int WINDOW_SIZE = 9;

    private final Log log = Log.getInstance(AnalyzeProtein.class);

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if (INPUT == null && SEQUENCE == null) errors.add("One of INPUT or SEQUENCE must be given.");
        if (INPUT != null && SEQUENCE != null) errors.add("Only one of INPUT or SEQUENCE may be given.");
        if (WINDOW_SIZE < 1) errors.add("WINDOW_SIZE must be at least 1.");

        if (errors.isEmpty()) return super.customCommandLineValidation();
        return errors.toArray(new String[errors.size()]);
    }

    @Override
    protected int doWork() {
        if (INPUT != null) IOUtil.assertFileIsReadable(INPUT);
        if (REFERENCE_TABLE != null) IOUtil.assertFileIsReadable(REFERENCE_TABLE);
        final File metricsOut    = new File(OUTPUT.getPath() + ANALYSIS_METRICS_EXTENSION);
        final File candidatesOut = new File(OUTPUT.getPath() + FUNCTION_CANDIDATES_EXTENSION);
        final File domainsOut    = new File(OUTPUT.getPath() + DOMAINS_EXTENSION);
        final File residuesOut   = new File(OUTPUT.getPath() + RESIDUES_EXTENSION);
        for (final File f : new File[] {metricsOut, candidatesOut, domainsOut, residuesOut}) IOUtil.assertFileIsWritable(f);

        final ProteinAnalysisEngine engine = new ProteinAnalysisEngine(ReferenceFunctionTable.fromFileOrBuiltIn(REFERENCE_TABLE), new FunctionEmbedder());
        final List<ProteinSequence> sequences = readSequences(engine);
        log.info("Analyzing " + sequences.size() + " protein sequence(s).");

        final MetricsFile<ProteinAnalysisMetric, ?> analysisMetrics = getMetricsFile();
        final MetricsFile<FunctionCandidateMetric, ?> candidateMetrics = getMetricsFile();
        final MetricsFile<DomainMetric, ?> domainMetrics = getMetricsFile();
        final FormatUtil fmt = new FormatUtil();
        final PrintWriter residues = new PrintWriter(IOUtil.openFileForBufferedWriting(residuesOut));
        residues.append("sequence_name\tposition\tresidue\thydrophobicity\tsmoothed_hydrophobicity\tstructure\tstructure_confidence\n");

        for (final ProteinSequence sequence : sequences) {
            final AnalysisResult result = engine.analyzeFull(sequence);
            final String name = sequence.name();

            analysisMetrics.addMetric(toMetric(name, result));
            for (final FunctionCandidate candidate : result.function().candidates()) {
                final FunctionCandidateMetric metric = new FunctionCandidateMetric();
                metric.SEQUENCE_NAME = name;
                metric.RANK          = candidate.rank();
                metric.FUNCTION      = candidate.label();
                metric.SIMILARITY    = candidate.similarity();
                candidateMetrics.addMetric(metric);
            }
            for (final DomainHit hit : result.domains()) {
                final DomainMetric metric = new DomainMetric();
                metric.SEQUENCE_NAME = name;
                metric.DOMAIN        = hit.name();
                metric.START         = hit.start();
                metric.END           = hit.end();
                metric.SCORE         = hit.score();
                metric.DESCRIPTION   = hit.description();
                domainMetrics.addMetric(metric);
            }

            writeResidues(residues, fmt, result);
            log.info("Predicted " + name + " to be " + result.function().label() + " with confidence "
                    + fmt.format(result.function().confidence()) + ".");
        }

        residues.close();
        analysisMetrics.write(metricsOut);
        candidateMetrics.write(candidatesOut);
        domainMetrics.write(domainsOut);
        return 0;
    }

    /** Validates either the single SEQUENCE or every record in the INPUT FASTA. */
    List<ProteinSequence> readSequences(final ProteinAnalysisEngine engine) {
        final List<ProteinSequence> sequences = new ArrayList<>();
        if (SEQUENCE != null) {
            sequences.add(engine.validate(SEQUENCE_NAME, SEQUENCE));
        }
        else {
            final FastaSequenceFile fasta = new FastaSequenceFile(INPUT, true);
            try {
                ReferenceSequence record;
                while ((record = fasta.nextSequence()) != null) {
                    sequences.add(engine.validate(record.getName(), StringUtil.bytesToString(record.getBases())));
                }
            }
            finally {
                CloserUtil.close(fasta);
            }
        }
        return sequences;
    }

    /** Builds the summary metric for one analyzed sequence. */
    static ProteinAnalysisMetric toMetric(final String name, final AnalysisResult result) {
        final ProteinAnalysisMetric metric = new ProteinAnalysisMetric();
        metric.SEQUENCE_NAME           = name;
        metric.LENGTH                  = result.sequence().length();
        metric.MOLECULAR_WEIGHT        = result.composition().molecularWeight();
        metric.MEAN_HYDROPHOBICITY     = result.hydrophobicity().mean();
        metric.MIN_HYDROPHOBICITY      = result.hydrophobicity().min();
        metric.MAX_HYDROPHOBICITY      = result.hydrophobicity().max();
        metric.PCT_HELIX               = result.structure().helix();
        metric.PCT_SHEET               = result.structure().sheet();
        metric.PCT_COIL                = result.structure().coil();
        metric.PCT_HYDROPHOBIC         = result.composition().hydrophobicFraction();
        metric.PCT_POLAR               = result.composition().polarFraction();
        metric.PCT_CHARGED             = result.composition().chargedFraction();
        metric.NUM_DOMAINS             = result.domains().size();
        metric.FUNCTIONAL_DOMAIN       = result.functionalDomain().domain().label();
        metric.FUNCTIONAL_DOMAIN_SCORE = result.functionalDomain().score();
        metric.PREDICTED_FUNCTION      = result.function().label();
        metric.FUNCTION_CONFIDENCE     = result.function().confidence();
        return metric;
    }

    /**
     * Writes one line per residue.  The smoothed hydrophobicity of a residue is the mean over the window
     * centered on it; residues too close to either end for a full window get a '.'.
     */
    private void writeResidues(final PrintWriter out, final FormatUtil fmt, final AnalysisResult result) {
        final ProteinSequence sequence = result.sequence();
        final HydrophobicityProfile profile = result.hydrophobicity();
        final ResidueStructure states = result.residueStructure();
        final double[] smoothed = profile.smoothed(WINDOW_SIZE);
        final int offset = (WINDOW_SIZE - 1) / 2;

        for (int i=0; i<sequence.length(); ++i) {
            final int window = i - offset;
            out.append(sequence.name()).append('\t');
            out.append(fmt.format(i + 1)).append('\t');
            out.append((char) sequence.residueAt(i)).append('\t');
            out.append(fmt.format(profile.score(i))).append('\t');
            out.append(window >= 0 && window < smoothed.length ? fmt.format(smoothed[window]) : ".").append('\t');
            out.append(states.state(i)).append('\t');
            out.append(fmt.format(states.confidence(i)));
            out.append('\n');
        }
    }
}
