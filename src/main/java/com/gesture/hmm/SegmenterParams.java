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

/**
 * Parameters for {@link SequenceSegmenter}.
 */
public class SegmenterParams {

    private int maxIterations = 1000;
    private int decimalPlaces = 3;

    /**
     * Maximum number of boundary refinement passes. The refinement is a greedy local search
     * without a convergence guarantee. Exceeding this number throws a
     * {@link NonConvergentSegmentationException}.
     */
    public SegmenterParams setMaxIterations(int value) {
        if (value < 1) {
            throw new IllegalArgumentException("maxIterations must be positive but was " + value);
        }
        this.maxIterations = value;
        return this;
    }

    /**
     * Number of decimal places of the resulting means, standard deviations and transition
     * probabilities.
     */
    public SegmenterParams setDecimalPlaces(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("decimalPlaces must not be negative but was "
                    + value);
        }
        this.decimalPlaces = value;
        return this;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public int getDecimalPlaces() {
        return decimalPlaces;
    }

}
