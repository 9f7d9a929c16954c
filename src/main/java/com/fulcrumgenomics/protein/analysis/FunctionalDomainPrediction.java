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

/** The best scoring {@link FunctionalDomain} for a sequence along with its score. */
public class FunctionalDomainPrediction {
    private final FunctionalDomain domain;
    private final double score;

    FunctionalDomainPrediction(final FunctionalDomain domain, final double score) {
        this.domain = domain;
        this.score  = score;
    }

    public FunctionalDomain domain() { return this.domain; }

    /**
     * The fraction of the sequence drawn from the best class's residues, in [0,1].  Reported even when
     * it falls short of the threshold and the domain is {@link FunctionalDomain#NONE}.
     */
    public double score() { return this.score; }

    /** A sentence describing the prediction. */
    public String description() {
        if (this.domain == FunctionalDomain.NONE) {
            return "The sequence has no clear functional domain, so its function is uncertain.";
        }
        return "The sequence is predicted to contain a " + this.domain.label()
                + ", suggesting it could be involved in " + this.domain.label() + " activity.";
    }

    @Override public String toString() {
        return String.format("%s (%.3f)", this.domain.label(), this.score);
    }
}
