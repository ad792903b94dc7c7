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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transition probabilities of a left-to-right HMM with three states. Each state either stays
 * or advances to the next state. The third state advances to the end of the gesture.
 *
 * <p>The probability of staying is 1 minus the probability of advancing.
 */
public final class TransitionMatrix {

    public static final int NUMBER_STATES = 3;

    private final double[] advanceProbabilities;

    /**
     * @param p12 probability of advancing from the first to the second state
     * @param p23 probability of advancing from the second to the third state
     * @param p3e probability of leaving the third state
     */
    public TransitionMatrix(double p12, double p23, double p3e) {
        this.advanceProbabilities = new double[] {p12, p23, p3e};
        for (int i = 0; i < NUMBER_STATES; i++) {
            if (!Utils.probabilityInRange(advanceProbabilities[i], 0.0)) {
                throw new IllegalArgumentException("Advance probability of state " + (i + 1)
                        + " must be in [0, 1] but was " + advanceProbabilities[i]);
            }
        }
    }

    /**
     * @param state zero-based state index
     */
    public double advanceProbability(int state) {
        return advanceProbabilities[state];
    }

    /**
     * @param state zero-based state index
     */
    public double selfProbability(int state) {
        return 1.0 - advanceProbabilities[state];
    }

    /**
     * Returns the matrix [[1 - p12, p12], [1 - p23, p23], [1 - p3e, p3e]].
     */
    public double[][] toArray() {
        final double[][] result = new double[NUMBER_STATES][];
        for (int i = 0; i < NUMBER_STATES; i++) {
            result[i] = new double[] {selfProbability(i), advanceProbabilities[i]};
        }
        return result;
    }

    /**
     * Returns the transitions between the given states of one gesture: the self transition of
     * each state and the advance of the first and second state. Leaving the third state has
     * no target among the given states and is omitted.
     *
     * @param states the three states in left-to-right order
     */
    public <S> Map<Transition<S>, Double> toTransitionMap(List<S> states) {
        if (states.size() != NUMBER_STATES) {
            throw new IllegalArgumentException("Expected " + NUMBER_STATES + " states but got "
                    + states.size());
        }
        final Map<Transition<S>, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < NUMBER_STATES; i++) {
            result.put(new Transition<>(states.get(i), states.get(i)), selfProbability(i));
            if (i + 1 < NUMBER_STATES) {
                result.put(new Transition<>(states.get(i), states.get(i + 1)),
                        advanceProbabilities[i]);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("TransitionMatrix [");
        for (int i = 0; i < NUMBER_STATES; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append("[" + selfProbability(i) + ", " + advanceProbabilities[i] + "]");
        }
        return sb.append("]").toString();
    }

}
