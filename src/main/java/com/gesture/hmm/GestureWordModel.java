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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The left-to-right HMM of one gesture word, assembled from one {@link SegmentationResult}
 * per tracked dimension.
 *
 * <p>The states are named word + "1", word + "2" and word + "3". Initial state probabilities
 * are not part of the model and are passed when decoding.
 */
public class GestureWordModel {

    private final String word;
    private final List<String> states;
    private final Map<String, List<GaussianParameters>> emissions;
    private final List<Map<Transition<String>, Double>> transitions;

    private GestureWordModel(String word, Map<String, List<GaussianParameters>> emissions,
            List<Map<Transition<String>, Double>> transitions) {
        this.word = word;
        this.states = Collections.unmodifiableList(stateNames(word));
        this.emissions = Collections.unmodifiableMap(emissions);
        this.transitions = Collections.unmodifiableList(transitions);
    }

    /**
     * @param dimensions one segmentation per tracked dimension
     *
     * @throws IllegalArgumentException if no dimension is given or a segmented region has
     * standard deviation 0
     */
    public static GestureWordModel fromSegmentation(String word,
            List<SegmentationResult> dimensions) {
        if (word == null || dimensions == null) {
            throw new NullPointerException("word and dimensions must not be null.");
        }
        if (dimensions.isEmpty()) {
            throw new IllegalArgumentException("At least one dimension is required.");
        }

        final List<String> states = stateNames(word);
        final Map<String, List<GaussianParameters>> emissions = new LinkedHashMap<>();
        for (int s = 0; s < states.size(); s++) {
            final List<GaussianParameters> parameters = new ArrayList<>(dimensions.size());
            for (SegmentationResult dimension : dimensions) {
                parameters.add(dimension.emissionParameters(s));
            }
            emissions.put(states.get(s), Collections.unmodifiableList(parameters));
        }

        final List<Map<Transition<String>, Double>> transitions =
                new ArrayList<>(dimensions.size());
        for (SegmentationResult dimension : dimensions) {
            transitions.add(Collections.unmodifiableMap(
                    dimension.transitionMatrix().toTransitionMap(states)));
        }
        return new GestureWordModel(word, emissions, transitions);
    }

    private static List<String> stateNames(String word) {
        final List<String> result = new ArrayList<>(TransitionMatrix.NUMBER_STATES);
        for (int s = 1; s <= TransitionMatrix.NUMBER_STATES; s++) {
            result.add(word + s);
        }
        return result;
    }

    public String word() {
        return word;
    }

    /**
     * Returns the states in left-to-right order, which is also the tie-breaking order when
     * decoding.
     */
    public List<String> states() {
        return states;
    }

    public int numberDimensions() {
        return transitions.size();
    }

    /**
     * Returns the emission parameters of the given dimension for each state.
     */
    public Map<String, GaussianParameters> emissions(int dimension) {
        final Map<String, GaussianParameters> result = new LinkedHashMap<>();
        for (String state : states) {
            result.put(state, emissions.get(state).get(dimension));
        }
        return result;
    }

    /**
     * Returns the within-word transition probabilities of the given dimension.
     */
    public Map<Transition<String>, Double> transitions(int dimension) {
        return transitions.get(dimension);
    }

    /**
     * Decodes scalar evidence of a model with one dimension.
     *
     * @throws IllegalStateException if the model has more than one dimension
     */
    public GesturePath<String> decode(double[] evidence, Map<String, Double> priors) {
        if (numberDimensions() != 1) {
            throw new IllegalStateException("Scalar evidence requires a model with one "
                    + "dimension but " + word + " has " + numberDimensions() + ".");
        }
        return new ViterbiDecoder<>(states).decode(evidence, priors, transitions(0),
                emissions(0));
    }

    /**
     * Decodes evidence with one observation per tracked dimension and time step. Transition
     * weights are the product of the transition probabilities of all dimensions.
     */
    public GesturePath<String> decode(double[][] evidence, Map<String, Double> priors) {
        return new ViterbiDecoder<>(states).decode(evidence, priors, transitions, emissions);
    }

    @Override
    public String toString() {
        return "GestureWordModel [word=" + word + ", emissions=" + emissions
                + ", transitions=" + transitions + "]";
    }

}
