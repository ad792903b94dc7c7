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
 * Thrown if the boundaries still move after the maximum number of refinement passes.
 *
 * @see SegmenterParams#setMaxIterations(int)
 */
public class NonConvergentSegmentationException extends SegmentationException {

    private static final long serialVersionUID = 1L;

    private final int iterations;

    public NonConvergentSegmentationException(String message, int iterations) {
        super(message);
        this.iterations = iterations;
    }

    public int getIterations() {
        return iterations;
    }

}
