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
import java.util.Collections;
import java.util.List;

/**
 * Per-state emission parameters and transition probabilities derived by
 * {@link SequenceSegmenter} for one gesture and one tracked dimension.
 */
public final class SegmentationResult {

    private final double[] means;
    private final double[] stds;
    private final TransitionMatrix transitionMatrix;
    private final List<BoundaryIndices> boundaries;
    private final int iterations;

    SegmentationResult(double[] means, double[] stds, TransitionMatrix transitionMatrix,
            List<BoundaryIndices> boundaries, int iterations) {
        this.means = means.clone();
        this.stds = stds.clone();
        this.transitionMatrix = transitionMatrix;
        this.boundaries = Collections.unmodifiableList(new ArrayList<>(boundaries));
        this.iterations = iterations;
    }

    /**
     * Returns mean1, mean2, mean3 of the three regions.
     */
    public double[] means() {
        return means.clone();
    }

    /**
     * Returns std1, std2, std3 of the three regions.
     */
    public double[] stds() {
        return stds.clone();
    }

    /**
     * Returns the emission parameters of the zero-based state.
     *
     * @throws IllegalArgumentException if the standard deviation of the region is 0, e.g.
     * because all its samples are equal
     */
    public GaussianParameters emissionParameters(int state) {
        return new GaussianParameters(means[state], stds[state]);
    }

    public TransitionMatrix transitionMatrix() {
        return transitionMatrix;
    }

    /**
     * Returns the converged boundaries, one per training sequence.
     */
    public List<BoundaryIndices> boundaries() {
        return boundaries;
    }

    /**
     * Returns the number of refinement passes including the final pass without changes.
     */
    public int iterations() {
        return iterations;
    }

    @Override
    public String toString() {
        return "SegmentationResult [means=" + Arrays.toString(means) + ", stds="
                + Arrays.toString(stds) + ", transitionMatrix=" + transitionMatrix
                + ", boundaries=" + boundaries + ", iterations=" + iterations + "]";
    }

}
