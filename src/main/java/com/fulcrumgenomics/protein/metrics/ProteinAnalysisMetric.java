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

package com.fulcrumgenomics.protein.metrics;

import htsjdk.samtools.metrics.MetricBase;

/** Summary of the analysis of one protein sequence. */
public class ProteinAnalysisMetric extends MetricBase {
    /** The name of the sequence. */
    public String SEQUENCE_NAME;
    /** The number of residues in the sequence. */
    public int LENGTH;
    /** The approximate molecular weight in Daltons. */
    public double MOLECULAR_WEIGHT;
    /** The mean Kyte-Doolittle hydrophobicity of all residues. */
    public double MEAN_HYDROPHOBICITY;
    /** The lowest per-residue hydrophobicity. */
    public double MIN_HYDROPHOBICITY;
    /** The highest per-residue hydrophobicity. */
    public double MAX_HYDROPHOBICITY;
    /** The fraction of the sequence predicted to be helix. */
    public double PCT_HELIX;
    /** The fraction of the sequence predicted to be sheet. */
    public double PCT_SHEET;
    /** The fraction of the sequence predicted to be coil. */
    public double PCT_COIL;
    /** The fraction of residues that are hydrophobic (VILMFYW). */
    public double PCT_HYDROPHOBIC;
    /** The fraction of residues that are polar (STNQ). */
    public double PCT_POLAR;
    /** The fraction of residues that are charged (DEKR). */
    public double PCT_CHARGED;
    /** The number of putative domains or regions found. */
    public int NUM_DOMAINS;
    /** The functional domain class suggested by the whole-sequence composition, or 'no clear domain'. */
    public String FUNCTIONAL_DOMAIN;
    /** The fraction of residues belonging to the best functional domain class. */
    public double FUNCTIONAL_DOMAIN_SCORE;
    /** The predicted function. */
    public String PREDICTED_FUNCTION;
    /** The similarity of the sequence to the predicted function, in [0,1]. */
    public double FUNCTION_CONFIDENCE;
}
