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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class SequenceSegmenterTest {

    private static final double DELTA = 1e-9;

    /**
     * Returns a sequence with values near 0, 5 and 10 in its first, second and last third.
     */
    private static double[] thirds(int length) {
        final double[] result = new double[length];
        final int third = length / 3;
        for (int i = 0; i < length; i++) {
            result[i] = 5.0 * (i / third) + 0.1 * ((i % 3) - 1);
        }
        return result;
    }

    /**
     * Returns a sequence with values near 0 before index1, near 5 before index2 and near 10
     * afterwards.
     */
    private static double[] steps(int length, int index1, int index2, double phase) {
        final double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            final double level = i < index1 ? 0.0 : i < index2 ? 5.0 : 10.0;
            result[i] = level + 0.2 * Math.sin(1.3 * i + phase);
        }
        return result;
    }

    private static List<double[]> scenario() {
        return Arrays.asList(thirds(9), thirds(12), thirds(15));
    }

    private static void checkInvariants(List<double[]> sequences, SegmentationResult result) {
        for (int i = 0; i < sequences.size(); i++) {
            final BoundaryIndices boundary = result.boundaries().get(i);
            assertTrue(boundary.toString(), 1 <= boundary.index1());
            assertTrue(boundary.toString(), boundary.index1() < boundary.index2());
            assertTrue(boundary.toString(), boundary.index2() <= sequences.get(i).length - 1);
        }
        final TransitionMatrix matrix = result.transitionMatrix();
        for (int s = 0; s < 3; s++) {
            assertEquals(1.0, matrix.selfProbability(s) + matrix.advanceProbability(s), 1e-3);
        }
    }

    @Test
    public void testConvergesToThirds() {
        final List<double[]> sequences = scenario();
        final SegmentationResult result = new SequenceSegmenter().segment(sequences);

        assertEquals(Arrays.asList(new BoundaryIndices(3, 6), new BoundaryIndices(4, 8),
                new BoundaryIndices(5, 10)), result.boundaries());
        assertEquals(1, result.iterations());

        final double[] means = result.means();
        assertEquals(0.0, means[0], 0.05);
        assertEquals(5.0, means[1], 0.05);
        assertEquals(10.0, means[2], 0.05);
        for (double std : result.stds()) {
            assertTrue(std > 0.0 && std < 0.1);
        }

        // 3 / (3 + 4 + 5) for every state
        assertArrayEquals(new double[] {0.75, 0.25}, result.transitionMatrix().toArray()[0],
                DELTA);
        assertArrayEquals(new double[] {0.75, 0.25}, result.transitionMatrix().toArray()[1],
                DELTA);
        assertArrayEquals(new double[] {0.75, 0.25}, result.transitionMatrix().toArray()[2],
                DELTA);
        checkInvariants(sequences, result);
    }

    @Test
    public void testRoundsToThreeDecimalPlaces() {
        final SegmentationResult result = new SequenceSegmenter().segment(scenario());
        for (double value : result.means()) {
            assertEquals(Math.round(value * 1000.0) / 1000.0, value, 1e-12);
        }
        for (double value : result.stds()) {
            assertEquals(Math.round(value * 1000.0) / 1000.0, value, 1e-12);
        }
        assertEquals(-0.017, result.means()[0], 1e-12);
        assertEquals(10.017, result.means()[2], 1e-12);
    }

    @Test
    public void testSeededBoundariesMoveBack() {
        final List<double[]> sequences = scenario();
        final List<BoundaryIndices> seeds = Arrays.asList(new BoundaryIndices(2, 7),
                new BoundaryIndices(5, 7), new BoundaryIndices(4, 11));
        final SegmentationResult result = new SequenceSegmenter().segment(sequences, seeds);

        assertEquals(Arrays.asList(new BoundaryIndices(3, 6), new BoundaryIndices(4, 8),
                new BoundaryIndices(5, 10)), result.boundaries());
        assertEquals(2, result.iterations());
        checkInvariants(sequences, result);

        // Seeds are not modified.
        assertEquals(new BoundaryIndices(2, 7), seeds.get(0));
    }

    @Test
    public void testUnequalDwellTimes() {
        final List<double[]> sequences = Arrays.asList(steps(12, 2, 8, 0.0),
                steps(14, 3, 10, 1.0), steps(13, 2, 9, 2.0));
        final SegmentationResult result = new SequenceSegmenter().segment(sequences);

        assertEquals(Arrays.asList(new BoundaryIndices(2, 8), new BoundaryIndices(3, 10),
                new BoundaryIndices(2, 9)), result.boundaries());
        final TransitionMatrix matrix = result.transitionMatrix();
        assertEquals(0.429, matrix.advanceProbability(0), DELTA); // 3 / (2 + 3 + 2)
        assertEquals(0.15, matrix.advanceProbability(1), DELTA); // 3 / (6 + 7 + 7)
        assertEquals(0.25, matrix.advanceProbability(2), DELTA); // 3 / (4 + 4 + 4)
        assertEquals(0.571, matrix.selfProbability(0), DELTA);
        checkInvariants(sequences, result);
    }

    @Test
    public void testDeterminism() {
        final List<double[]> sequences = Arrays.asList(steps(12, 2, 8, 0.0),
                steps(14, 3, 10, 1.0), steps(13, 2, 9, 2.0));
        final SegmentationResult first = new SequenceSegmenter().segment(sequences);
        final SegmentationResult second = new SequenceSegmenter().segment(sequences);

        assertArrayEquals(first.means(), second.means(), 0.0);
        assertArrayEquals(first.stds(), second.stds(), 0.0);
        assertEquals(first.boundaries(), second.boundaries());
        assertEquals(first.iterations(), second.iterations());
    }

    @Test
    public void testNonConvergent() {
        final List<BoundaryIndices> seeds = Arrays.asList(new BoundaryIndices(2, 7),
                new BoundaryIndices(5, 7), new BoundaryIndices(4, 11));
        final SequenceSegmenter segmenter =
                new SequenceSegmenter(new SegmenterParams().setMaxIterations(1));
        try {
            segmenter.segment(scenario(), seeds);
            fail("Expected NonConvergentSegmentationException");
        } catch (NonConvergentSegmentationException e) {
            assertEquals(1, e.getIterations());
        }
    }

    @Test
    public void testIterationCapIsInclusive() {
        final List<BoundaryIndices> seeds = Arrays.asList(new BoundaryIndices(2, 7),
                new BoundaryIndices(5, 7), new BoundaryIndices(4, 11));
        final SegmentationResult result =
                new SequenceSegmenter(new SegmenterParams().setMaxIterations(2))
                .segment(scenario(), seeds);
        assertEquals(2, result.iterations());
    }

    @Test
    public void testFirstBoundaryStaysAboveOne() {
        // The first sample belongs to the middle level but must stay in the first region.
        final List<double[]> sequences = Arrays.asList(
                new double[] {5.0, 5.1, 4.9, 5.0, 10.0, 10.1, 9.9, 10.0, 10.1},
                thirds(12), thirds(15));
        final SegmentationResult result = new SequenceSegmenter().segment(sequences,
                Arrays.asList(new BoundaryIndices(1, 4), new BoundaryIndices(4, 8),
                        new BoundaryIndices(5, 10)));

        assertEquals(new BoundaryIndices(1, 4), result.boundaries().get(0));
        assertEquals(1, result.iterations());
        checkInvariants(sequences, result);
    }

    @Test
    public void testSecondBoundaryStaysBelowLastIndex() {
        // The last sample belongs to the middle level but must stay in the last region.
        final List<double[]> sequences = Arrays.asList(
                new double[] {-0.1, 0.0, 0.1, 4.9, 5.0, 5.1, 5.0, 4.9, 5.1},
                thirds(12), thirds(15));
        final SegmentationResult result = new SequenceSegmenter().segment(sequences,
                Arrays.asList(new BoundaryIndices(3, 8), new BoundaryIndices(4, 8),
                        new BoundaryIndices(5, 10)));

        assertEquals(new BoundaryIndices(3, 8), result.boundaries().get(0));
        assertEquals(1, result.iterations());
        checkInvariants(sequences, result);
    }

    @Test
    public void testFirstBoundaryMoveEmptyingMiddleRegionIsDiscarded() {
        // The only middle sample is low, so the first boundary would move onto the second.
        final List<double[]> sequences = Arrays.asList(
                new double[] {-0.1, 0.0, 0.1, 0.0, 10.0, 9.9, 10.1, 10.0, 9.9},
                thirds(12), thirds(15));
        final SegmentationResult result = new SequenceSegmenter().segment(sequences,
                Arrays.asList(new BoundaryIndices(3, 4), new BoundaryIndices(4, 8),
                        new BoundaryIndices(5, 10)));

        assertEquals(new BoundaryIndices(3, 4), result.boundaries().get(0));
        assertEquals(1, result.iterations());
        checkInvariants(sequences, result);
    }

    @Test
    public void testSecondBoundaryMoveEmptyingMiddleRegionIsDiscarded() {
        // The only middle sample is high, so the second boundary would move onto the first.
        final List<double[]> sequences = Arrays.asList(
                new double[] {-0.1, 0.0, 0.1, 10.0, 10.0, 9.9, 10.1, 10.0, 9.9},
                thirds(12), thirds(15));
        final SegmentationResult result = new SequenceSegmenter().segment(sequences,
                Arrays.asList(new BoundaryIndices(3, 4), new BoundaryIndices(4, 8),
                        new BoundaryIndices(5, 10)));

        assertEquals(new BoundaryIndices(3, 4), result.boundaries().get(0));
        assertEquals(1, result.iterations());
        checkInvariants(sequences, result);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroMaxIterations() {
        new SegmenterParams().setMaxIterations(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeDecimalPlaces() {
        new SegmenterParams().setDecimalPlaces(-1);
    }

    @Test(expected = DegenerateSegmentationException.class)
    public void testSequenceTooShort() {
        // ceil(4 / 3) = 2 and 2 * 2 = 4 leave the last region empty.
        new SequenceSegmenter().segment(Arrays.asList(thirds(9), new double[] {0, 5, 10, 10},
                thirds(9)));
    }

    @Test(expected = DegenerateSegmentationException.class)
    public void testInvalidSeed() {
        new SequenceSegmenter().segment(scenario(), Arrays.asList(new BoundaryIndices(3, 6),
                new BoundaryIndices(4, 4), new BoundaryIndices(5, 10)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRequiresThreeSequences() {
        new SequenceSegmenter().segment(Arrays.asList(thirds(9), thirds(12)));
    }

    @Test
    public void testConstantRegionsHaveZeroStandardDeviation() {
        final double[] sequence = {0, 0, 0, 5, 5, 5, 10, 10, 10};
        final SegmentationResult result =
                new SequenceSegmenter().segment(Arrays.asList(sequence, sequence, sequence));

        assertArrayEquals(new double[] {0.0, 5.0, 10.0}, result.means(), 0.0);
        assertArrayEquals(new double[] {0.0, 0.0, 0.0}, result.stds(), 0.0);
        try {
            result.emissionParameters(0);
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // Zero standard deviation has no density.
        }
    }

}
