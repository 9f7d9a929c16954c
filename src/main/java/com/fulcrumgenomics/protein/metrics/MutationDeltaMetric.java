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

/** How the predicted properties of a protein change with a mutation.  Deltas are mutated minus original. */
public class MutationDeltaMetric extends MetricBase {
    /** The number of residues in the original sequence. */
    public int ORIGINAL_LENGTH;
    /** The number of residues in the mutated sequence. */
    public int MUTATED_LENGTH;
    /** The mean hydrophobicity of the original sequence. */
    public double ORIGINAL_HYDROPHOBICITY;
    /** The mean hydrophobicity of the mutated sequence. */
    public double MUTATED_HYDROPHOBICITY;
    /** The change in mean hydrophobicity. */
    public double HYDROPHOBICITY_DELTA;
    /** The change in the fraction predicted to be helix. */
    public double HELIX_DELTA;
    /** The change in the fraction predicted to be sheet. */
    public double SHEET_DELTA;
    /** The change in the fraction predicted to be coil. */
    public double COIL_DELTA;
    /** The function predicted for the original sequence. */
    public String ORIGINAL_FUNCTION;
    /** The confidence in the function predicted for the original sequence. */
    public double ORIGINAL_CONFIDENCE;
    /** The function predicted for the mutated sequence. */
    public String MUTATED_FUNCTION;
    /** The confidence in the function predicted for the mutated sequence. */
    public double MUTATED_CONFIDENCE;
    /** Whether the predicted function differs between the two sequences. */
    public boolean FUNCTION_CHANGED;
}
