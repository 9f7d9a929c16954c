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

import com.fulcrumgenomics.protein.AminoAcids;
import com.fulcrumgenomics.protein.ProteinSequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Looks for putative domains in a sequence in three passes:
 * <ol>
 *     <li>exact matches to a small set of known motifs;</li>
 *     <li>windows of {@link #WINDOW_SIZE} residues that are predominantly hydrophobic (candidate
 *         membrane-spanning regions) or predominantly charged (candidate binding sites), with overlapping
 *         or abutting windows of the same kind merged into a single region;</li>
 *     <li>if neither pass found anything, a single region covering the whole sequence that is labelled by
 *         its overall composition.</li>
 * </ol>
 */
public class DomainScanner {
    /** The number of residues in each window examined. */
    public static final int WINDOW_SIZE = 10;

    /** The score given to exact motif matches. */
    public static final double MOTIF_SCORE = 95.0;

    /** The score given to a whole-sequence region of mixed composition. */
    public static final double MIXED_REGION_SCORE = 50.0;

    /** A named exact-match motif. */
    static class Motif {
        final String name;
        final String pattern;
        final String description;

        Motif(final String name, final String pattern, final String description) {
            this.name = name;
            this.pattern = pattern;
            this.description = description;
        }
    }

    /** Motifs without a display name are reported under their lower-case identifier. */
    static final List<Motif> KNOWN_MOTIFS = Collections.unmodifiableList(Arrays.asList(
            new Motif("Insulin/IGF/Relaxin", "FVNQHLCGSHLVEAL", "Hormone involved in glucose regulation"),
            new Motif("transmembrane",       "LLLLLLFFFF",      "Membrane-spanning region"),
            new Motif("dna_binding",         "KKRRH",           "DNA-binding motif")
    ));

    /** The kinds of region found by scanning windows. */
    enum WindowKind {
        TRANSMEMBRANE("Transmembrane domain", "Potential membrane-spanning region", 7) {
            @Override boolean counts(final byte residue) { return AminoAcids.isHydrophobic(residue); }
        },
        CHARGED("Charged domain", "Potential binding or interaction site", 5) {
            @Override boolean counts(final byte residue) { return AminoAcids.isCharged(residue); }
        };

        final String label;
        final String description;
        final int minResidues;

        WindowKind(final String label, final String description, final int minResidues) {
            this.label = label;
            this.description = description;
            this.minResidues = minResidues;
        }

        abstract boolean counts(byte residue);
    }

    private final CompositionAnalyzer compositionAnalyzer = new CompositionAnalyzer();

    /** Scans the sequence, returning hits ordered by start position then name.  Never returns an empty list. */
    public List<DomainHit> scan(final ProteinSequence sequence) {
        ProteinSequence.assertNotEmpty(sequence, "domain scanning");

        final List<DomainHit> hits = new ArrayList<>();
        final String residues = sequence.toString();
        for (final Motif motif : KNOWN_MOTIFS) {
            final int offset = residues.indexOf(motif.pattern);
            if (offset >= 0) hits.add(new DomainHit(motif.name, offset + 1, offset + motif.pattern.length(), MOTIF_SCORE, motif.description));
        }

        for (final WindowKind kind : WindowKind.values()) hits.addAll(scanWindows(sequence, kind));

        if (hits.isEmpty()) hits.add(wholeSequenceRegion(sequence));

        hits.sort(Comparator.comparingInt(DomainHit::start).thenComparing(DomainHit::name));
        return hits;
    }

    /** Finds the runs of qualifying windows of the given kind and reports each run as one region. */
    List<DomainHit> scanWindows(final ProteinSequence sequence, final WindowKind kind) {
        final List<DomainHit> hits = new ArrayList<>();
        if (sequence.length() < WINDOW_SIZE) return hits;

        int count = 0;
        for (int i=0; i<WINDOW_SIZE; ++i) if (kind.counts(sequence.residueAt(i))) ++count;

        // Zero-based start and exclusive end of the region being built, -1 when none is open
        int regionStart = -1, regionEnd = -1, best = 0;
        for (int start=0; start + WINDOW_SIZE <= sequence.length(); ++start) {
            if (start > 0) {
                if (kind.counts(sequence.residueAt(start - 1))) --count;
                if (kind.counts(sequence.residueAt(start + WINDOW_SIZE - 1))) ++count;
            }

            if (count < kind.minResidues) continue;

            if (regionStart >= 0 && start <= regionEnd) {
                regionEnd = start + WINDOW_SIZE;
                best = Math.max(best, count);
            }
            else {
                if (regionStart >= 0) hits.add(toHit(kind, regionStart, regionEnd, best));
                regionStart = start;
                regionEnd   = start + WINDOW_SIZE;
                best        = count;
            }
        }
        if (regionStart >= 0) hits.add(toHit(kind, regionStart, regionEnd, best));

        return hits;
    }

    private static DomainHit toHit(final WindowKind kind, final int start, final int end, final int bestCount) {
        return new DomainHit(kind.label, start + 1, end, 100.0 * bestCount / WINDOW_SIZE, kind.description);
    }

    /** Labels the whole sequence by its dominant residue class. */
    private DomainHit wholeSequenceRegion(final ProteinSequence sequence) {
        final ResidueComposition composition = this.compositionAnalyzer.analyze(sequence);
        final int length = sequence.length();

        if (composition.hydrophobicFraction() > 0.4) {
            return new DomainHit("Hydrophobic region", 1, length, composition.hydrophobicFraction() * 100,
                    "Region rich in hydrophobic amino acids");
        }
        else if (composition.chargedFraction() > 0.3) {
            return new DomainHit("Charged region", 1, length, composition.chargedFraction() * 100,
                    "Region rich in charged amino acids");
        }
        else {
            return new DomainHit("Mixed region", 1, length, MIXED_REGION_SCORE, "Region with mixed amino acid properties");
        }
    }
}
