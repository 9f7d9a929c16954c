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

import java.util.Collections;
import java.util.List;

/**
 * The reference functions ranked by similarity to a query, most similar first.  The first candidate is
 * the predicted function and its similarity is the confidence of the prediction.
 */
public class FunctionPrediction {
    private final List<FunctionCandidate> candidates;

    /** Takes ownership of a non-empty list of candidates already in rank order. */
    FunctionPrediction(final List<FunctionCandidate> candidates) {
        this.candidates = Collections.unmodifiableList(candidates);
    }

    /** All candidates in rank order. */
    public List<FunctionCandidate> candidates() { return this.candidates; }

    /** The top-ranked candidate. */
    public FunctionCandidate top() { return this.candidates.get(0); }

    /** The label of the predicted function. */
    public String label() { return top().label(); }

    /** The confidence in the predicted function, in [0,1]. */
    public double confidence() { return top().similarity(); }
}
