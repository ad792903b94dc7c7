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
 * Split points of one training sequence into the three regions [0, index1), [index1, index2)
 * and [index2, length), one per hidden state.
 *
 * <p>Only {@link SequenceSegmenter} moves the indices. Instances returned in a
 * {@link SegmentationResult} are copies and do not change anymore.
 */
public final class BoundaryIndices {

    private int index1;
    private int index2;

    public BoundaryIndices(int index1, int index2) {
        this.index1 = index1;
        this.index2 = index2;
    }

    /**
     * Returns the initial boundaries index1 = ceil(length / 3), index2 = 2 * index1.
     */
    public static BoundaryIndices initial(int length) {
        final int index1 = (length + 2) / 3;
        return new BoundaryIndices(index1, 2 * index1);
    }

    public int index1() {
        return index1;
    }

    public int index2() {
        return index2;
    }

    /**
     * Returns whether the indices split a sequence of the given length into three non-empty
     * regions, i.e. 0 < index1 < index2 < length.
     */
    public boolean isValidFor(int length) {
        return 0 < index1 && index1 < index2 && index2 < length;
    }

    void set(int index1, int index2) {
        this.index1 = index1;
        this.index2 = index2;
    }

    BoundaryIndices copy() {
        return new BoundaryIndices(index1, index2);
    }

    @Override
    public int hashCode() {
        return 31 * index1 + index2;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        BoundaryIndices other = (BoundaryIndices) obj;
        return index1 == other.index1 && index2 == other.index2;
    }

    @Override
    public String toString() {
        return "BoundaryIndices [index1=" + index1 + ", index2=" + index2 + "]";
    }

}
