/**
 * Copyright (C) 2015-2016, BMW Car IT GmbH and BMW AG
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.gesture.hmm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the emission parameters and transition probabilities of a left-to-right HMM with
 * three states from three training sequences of the same gesture.
 *
 * <p>Each training sequence is split into three contiguous regions, one per state. Starting
 * from the thirds of each sequence (or from given boundaries), the boundaries are refined by
 * repeated passes. Each pass pools the regions of all sequences, computes mean and standard
 * deviation of each pooled region and moves every boundary by at most one sample towards the
 * region whose statistics fit the adjacent sample better. The refinement stops at the first
 * pass that does not move any boundary.
 *
 * <p>Sample distances are measured in standard deviations of a region, i.e.
 * |x - mean| / std. For a region with standard deviation 0 this follows IEEE 754 semantics:
 * infinity for samples different from the mean and NaN, which never compares as closer,
 * for samples equal to the mean.
 *
 * <p>Instances hold no state between calls and may be shared between threads.
 */
public class SequenceSegmenter {

    private static final Logger logger = LoggerFactory.getLogger(SequenceSegmenter.class);

    public static final int NUMBER_EXAMPLES = 3;

    private static final int NUMBER_STATES = TransitionMatrix.NUMBER_STATES;

    /**
     * Pooled statistics of the three regions in one refinement pass.
     */
    private static class RegionStatistics {
        final double[] means = new double[NUMBER_STATES];
        final double[] stds = new double[NUMBER_STATES];

        /**
         * Returns the distance of x to the region in standard deviations.
         */
        double distance(double x, int region) {
            return FastMath.abs(x - means[region]) / stds[region];
        }

        /**
         * Returns whether x is closer to the candidate region than to the current region.
         */
        boolean isCloser(double x, int candidateRegion, int currentRegion) {
            return distance(x, candidateRegion) < distance(x, currentRegion);
        }
    }

    private final SegmenterParams params;

    public SequenceSegmenter() {
        this(new SegmenterParams());
    }

    public SequenceSegmenter(SegmenterParams params) {
        if (params == null) {
            throw new NullPointerException("params must not be null.");
        }
        this.params = params;
    }

    /**
     * Segments the training sequences starting from the initial boundaries
     * {@link BoundaryIndices#initial(int)}.
     *
     * @see #segment(List, List)
     */
    public SegmentationResult segment(List<double[]> sequences) {
        return segment(sequences, null);
    }

    /**
     * Segments the training sequences starting from the given boundaries.
     *
     * @param sequences exactly three training sequences of the same gesture
     * @param seeds initial boundaries for each sequence or null for
     * {@link BoundaryIndices#initial(int)}. The passed instances are not modified.
     *
     * @throws IllegalArgumentException if not exactly three sequences or seeds are passed
     * @throws DegenerateSegmentationException if the initial boundaries do not split a sequence
     * into three non-empty regions
     * @throws NonConvergentSegmentationException if the boundaries still move after
     * {@link SegmenterParams#getMaxIterations()} passes
     */
    public SegmentationResult segment(List<double[]> sequences, List<BoundaryIndices> seeds) {
        if (sequences == null) {
            throw new NullPointerException("sequences must not be null.");
        }
        if (sequences.size() != NUMBER_EXAMPLES) {
            throw new IllegalArgumentException("Expected " + NUMBER_EXAMPLES
                    + " training sequences but got " + sequences.size() + ".");
        }
        if (seeds != null && seeds.size() != NUMBER_EXAMPLES) {
            throw new IllegalArgumentException("Expected " + NUMBER_EXAMPLES
                    + " seed boundaries but got " + seeds.size() + ".");
        }

        final List<BoundaryIndices> boundaries = initialBoundaries(sequences, seeds);

        int iterations = 0;
        RegionStatistics statistics;
        boolean changed;
        do {
            iterations++;
            if (iterations > params.getMaxIterations()) {
                throw new NonConvergentSegmentationException("Boundaries did not converge within "
                        + params.getMaxIterations() + " passes: " + boundaries, iterations - 1);
            }

            statistics = computeRegionStatistics(sequences, boundaries);
            changed = false;
            for (int i = 0; i < NUMBER_EXAMPLES; i++) {
                changed |= refineBoundaries(sequences.get(i), boundaries.get(i), statistics);
            }
            if (logger.isDebugEnabled()) {
                logger.debug("Pass " + iterations + ": means " + Arrays.toString(statistics.means)
                        + ", stds " + Arrays.toString(statistics.stds) + ", boundaries "
                        + boundaries);
            }
        } while (changed);

        logger.debug("Segmentation converged after {} passes.", iterations);
        return createResult(sequences, boundaries, statistics, iterations);
    }

    private List<BoundaryIndices> initialBoundaries(List<double[]> sequences,
            List<BoundaryIndices> seeds) {
        final List<BoundaryIndices> result = new ArrayList<>(NUMBER_EXAMPLES);
        for (int i = 0; i < NUMBER_EXAMPLES; i++) {
            final double[] sequence = sequences.get(i);
            if (sequence == null) {
                throw new NullPointerException("Training sequence " + i + " is null.");
            }
            final BoundaryIndices boundary = seeds == null
                    ? BoundaryIndices.initial(sequence.length) : seeds.get(i).copy();
            if (!boundary.isValidFor(sequence.length)) {
                throw new DegenerateSegmentationException(boundary + " do not split training "
                        + "sequence " + i + " of length " + sequence.length
                        + " into three non-empty regions.");
            }
            result.add(boundary);
        }
        return result;
    }

    /**
     * Pools each region over all sequences and computes its mean and population standard
     * deviation.
     */
    private RegionStatistics computeRegionStatistics(List<double[]> sequences,
            List<BoundaryIndices> boundaries) {
        final RegionStatistics result = new RegionStatistics();
        for (int region = 0; region < NUMBER_STATES; region++) {
            final double[] pooled = pooledRegion(sequences, boundaries, region);
            if (pooled.length == 0) {
                throw new DegenerateSegmentationException("Region " + (region + 1)
                        + " is empty in all training sequences: " + boundaries);
            }
            result.means[region] = StatUtils.mean(pooled);
            result.stds[region] =
                    FastMath.sqrt(StatUtils.populationVariance(pooled, result.means[region]));
        }
        return result;
    }

    private double[] pooledRegion(List<double[]> sequences, List<BoundaryIndices> boundaries,
            int region) {
        int length = 0;
        for (int i = 0; i < NUMBER_EXAMPLES; i++) {
            length += regionEnd(sequences.get(i), boundaries.get(i), region)
                    - regionStart(boundaries.get(i), region);
        }

        final double[] result = new double[Math.max(length, 0)];
        int pos = 0;
        for (int i = 0; i < NUMBER_EXAMPLES; i++) {
            final int start = regionStart(boundaries.get(i), region);
            final int end = regionEnd(sequences.get(i), boundaries.get(i), region);
            if (end > start) {
                System.arraycopy(sequences.get(i), start, result, pos, end - start);
                pos += end - start;
            }
        }
        return result;
    }

    private static int regionStart(BoundaryIndices boundary, int region) {
        switch (region) {
        case 0:
            return 0;
        case 1:
            return boundary.index1();
        default:
            return boundary.index2();
        }
    }

    private static int regionEnd(double[] sequence, BoundaryIndices boundary, int region) {
        switch (region) {
        case 0:
            return boundary.index1();
        case 1:
            return boundary.index2();
        default:
            return sequence.length;
        }
    }

    /**
     * Moves each boundary of the sequence by at most one sample. Both moves are discarded if
     * they would leave the middle region empty.
     *
     * @return whether a boundary moved
     */
    private boolean refineBoundaries(double[] sequence, BoundaryIndices boundary,
            RegionStatistics statistics) {
        final int index1 = boundary.index1();
        final int index2 = boundary.index2();

        int newIndex1 = index1;
        if (index1 > 1 && statistics.isCloser(sequence[index1 - 1], 1, 0)) {
            newIndex1 = index1 - 1;
        } else if (statistics.isCloser(sequence[index1], 0, 1)) {
            newIndex1 = index1 + 1;
        }

        int newIndex2 = index2;
        if (statistics.isCloser(sequence[index2 - 1], 2, 1)) {
            newIndex2 = index2 - 1;
        } else if (index2 < sequence.length - 1 && statistics.isCloser(sequence[index2], 1, 2)) {
            newIndex2 = index2 + 1;
        }

        if (newIndex1 + 1 > newIndex2) {
            return false;
        }
        if (newIndex1 == index1 && newIndex2 == index2) {
            return false;
        }
        boundary.set(newIndex1, newIndex2);
        return true;
    }

    private SegmentationResult createResult(List<double[]> sequences,
            List<BoundaryIndices> boundaries, RegionStatistics statistics, int iterations) {
        final int decimalPlaces = params.getDecimalPlaces();
        final double[] means = new double[NUMBER_STATES];
        final double[] stds = new double[NUMBER_STATES];
        final double[] advanceProbabilities = new double[NUMBER_STATES];
        for (int region = 0; region < NUMBER_STATES; region++) {
            means[region] = Utils.round(statistics.means[region], decimalPlaces);
            stds[region] = Utils.round(statistics.stds[region], decimalPlaces);

            // The advance probability is the inverse of the average dwell time in the region.
            int pooledLength = 0;
            for (int i = 0; i < NUMBER_EXAMPLES; i++) {
                pooledLength += regionEnd(sequences.get(i), boundaries.get(i), region)
                        - regionStart(boundaries.get(i), region);
            }
            if (pooledLength <= 0) {
                throw new DegenerateSegmentationException("Region " + (region + 1)
                        + " has pooled length " + pooledLength + ": " + boundaries);
            }
            advanceProbabilities[region] =
                    Utils.round((double) NUMBER_EXAMPLES / pooledLength, decimalPlaces);
        }

        final List<BoundaryIndices> frozenBoundaries = new ArrayList<>(NUMBER_EXAMPLES);
        for (BoundaryIndices boundary : boundaries) {
            frozenBoundaries.add(boundary.copy());
        }

        return new SegmentationResult(means, stds, new TransitionMatrix(advanceProbabilities[0],
                advanceProbabilities[1], advanceProbabilities[2]), frozenBoundaries, iterations);
    }

}
