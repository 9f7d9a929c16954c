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

import com.fulcrumgenomics.protein.EmptyReferenceTableException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Nearest-neighbour function prediction: a query embedding is compared with every entry of a
 * {@link ReferenceFunctionTable} by cosine similarity and the entries are ranked by that similarity.
 * Ties keep the order of the entries in the table, so the ranking is reproducible.
 */
public class FunctionPredictor {

    /**
     * Ranks every reference function by similarity to the embedding.  Similarities are clipped into [0,1],
     * which for non-negative embeddings only ever removes rounding error.
     */
    public FunctionPrediction predict(final double[] embedding, final ReferenceFunctionTable reference) {
        if (reference.isEmpty()) throw new EmptyReferenceTableException();
        if (embedding.length != reference.dimension()) {
            throw new IllegalArgumentException("Embedding has " + embedding.length + " elements but the reference table has "
                    + reference.dimension() + ".");
        }

        final double[] similarities = new double[reference.size()];
        final Integer[] order = new Integer[reference.size()];
        for (int i=0; i<similarities.length; ++i) {
            similarities[i] = Math.max(0, Math.min(1, cosineSimilarity(embedding, reference.vectorAt(i))));
            order[i] = i;
        }

        Arrays.sort(order, Comparator.<Integer>comparingDouble(i -> -similarities[i]).thenComparingInt(i -> i));

        final List<FunctionCandidate> candidates = new ArrayList<>(order.length);
        for (int rank=0; rank<order.length; ++rank) {
            final int i = order[rank];
            candidates.add(new FunctionCandidate(reference.label(i), similarities[i], rank + 1));
        }
        return new FunctionPrediction(candidates);
    }

    /**
     * Computes the cosine of the angle between two vectors of equal length.  Returns zero if either
     * vector has no magnitude.  Each vector is first divided by its largest absolute element, which leaves
     * the cosine unchanged but keeps the sums of squares from overflowing for very large elements.
     */
    public static double cosineSimilarity(final double[] a, final double[] b) {
        if (a.length != b.length) throw new IllegalArgumentException("Vectors differ in length: " + a.length + " vs. " + b.length);

        final double scaleA = maxAbs(a), scaleB = maxAbs(b);
        if (scaleA == 0 || scaleB == 0) return 0;

        double dot = 0, normA = 0, normB = 0;
        for (int i=0; i<a.length; ++i) {
            final double x = a[i] / scaleA, y = b[i] / scaleB;
            dot   += x * y;
            normA += x * x;
            normB += y * y;
        }

        final double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Double.isNaN(cosine) ? 0 : cosine;
    }

    private static double maxAbs(final double[] values) {
        double max = 0;
        for (final double value : values) max = Math.max(max, Math.abs(value));
        return max;
    }
}
