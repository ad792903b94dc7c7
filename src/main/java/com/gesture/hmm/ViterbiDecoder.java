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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of the Viterbi algorithm for stationary Markov processes with Gaussian
 * emissions, as described e.g. in Rabiner, Juang, An introduction to Hidden Markov Models,
 * IEEE ASSP Mag., pp 4-16, June 1986.
 *
 * <p>Takes plain (non-logarithmic) priors and transition probabilities but accumulates path
 * scores as log probabilities, so the most likely path is found correctly even where the
 * joint probability underflows.
 *
 * <p>The state list passed to the constructor fixes the iteration order. If several states
 * have the same score, the first of them in this order wins, both for back pointers and for
 * the last state of the path. Hence the result is deterministic.
 *
 * <p>Instances hold no state between calls and may be shared between threads.
 *
 * @param <S> the state type
 */
public class ViterbiDecoder<S> {

    private static final Logger logger = LoggerFactory.getLogger(ViterbiDecoder.class);

    private static final double DELTA = 1e-8;

    private final List<S> states;
    private final boolean keepMessageHistory;

    /**
     * Does not keep the message history.
     */
    public ViterbiDecoder(List<S> states) {
        this(states, false);
    }

    /**
     * @param states all states in tie-breaking order
     * @param keepMessageHistory Whether to store intermediate forward messages
     * (probabilities of intermediate most likely paths) for debugging.
     */
    public ViterbiDecoder(List<S> states, boolean keepMessageHistory) {
        if (states == null) {
            throw new NullPointerException("states must not be null.");
        }
        if (states.isEmpty()) {
            throw new IllegalArgumentException("At least one state is required.");
        }
        if (new LinkedHashSet<>(states).size() != states.size()) {
            throw new IllegalArgumentException("States must be distinct: " + states);
        }
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.keepMessageHistory = keepMessageHistory;
    }

    public List<S> states() {
        return states;
    }

    /**
     * Computes the most likely state sequence for scalar evidence.
     *
     * @param priors initial probability of each state
     * @param transitions transition probability between pairs of states. A transition
     * probability of zero is assumed for every missing transition.
     * @param emissions emission parameters of each state. A missing state is treated as
     * {@link GaussianParameters#UNSET}.
     *
     * @throws NullPointerException if any argument is null or any prior is missing
     * @throws IllegalArgumentException if a prior or transition probability is not in [0, 1]
     */
    public GesturePath<S> decode(double[] evidence, Map<S, Double> priors,
            Map<Transition<S>, Double> transitions, Map<S, GaussianParameters> emissions) {
        if (evidence == null || emissions == null) {
            throw new NullPointerException("evidence and emissions must not be null.");
        }

        final double[][] logEmissions = new double[evidence.length][states.size()];
        for (int s = 0; s < states.size(); s++) {
            final GaussianParameters parameters = emissionParameters(emissions, states.get(s));
            for (int t = 0; t < evidence.length; t++) {
                logEmissions[t][s] = GaussianEmissionModel.logDensity(evidence[t], parameters);
            }
        }
        return compute(logPriors(priors), logTransitions(Collections.singletonList(transitions)),
                logEmissions);
    }

    /**
     * Computes the most likely state sequence for evidence with several tracked dimensions.
     * Dimensions are conditionally independent given the state.
     *
     * <p>The weight of a transition is the product of its probabilities in all passed
     * transition maps, e.g. one map per tracked dimension.
     *
     * @param evidence evidence[t][d] is the observation of dimension d at time step t
     * @param emissions per state, the emission parameters of each dimension. A missing state is
     * treated as unset in all dimensions.
     *
     * @throws NullPointerException if any argument is null or any prior is missing
     * @throws IllegalArgumentException if an observation or the emission parameters of a state
     * do not match the number of dimensions, or if a probability is not in [0, 1]
     */
    public GesturePath<S> decode(double[][] evidence, Map<S, Double> priors,
            List<Map<Transition<S>, Double>> transitions,
            Map<S, List<GaussianParameters>> emissions) {
        if (evidence == null || emissions == null) {
            throw new NullPointerException("evidence and emissions must not be null.");
        }

        final double[][] logEmissions = new double[evidence.length][states.size()];
        for (int s = 0; s < states.size(); s++) {
            final List<GaussianParameters> parameters = emissions.get(states.get(s));
            for (int t = 0; t < evidence.length; t++) {
                if (parameters == null) {
                    logEmissions[t][s] = Double.NEGATIVE_INFINITY;
                } else {
                    logEmissions[t][s] =
                            GaussianEmissionModel.jointLogDensity(evidence[t], parameters);
                }
            }
        }
        return compute(logPriors(priors), logTransitions(transitions), logEmissions);
    }

    private GaussianParameters emissionParameters(Map<S, GaussianParameters> emissions,
            S state) {
        final GaussianParameters parameters = emissions.get(state);
        return parameters == null ? GaussianParameters.UNSET : parameters;
    }

    private double[] logPriors(Map<S, Double> priors) {
        if (priors == null) {
            throw new NullPointerException("priors must not be null.");
        }
        final double[] result = new double[states.size()];
        for (int s = 0; s < states.size(); s++) {
            final Double prior = priors.get(states.get(s));
            if (prior == null) {
                throw new NullPointerException("No initial probability for " + states.get(s));
            }
            checkProbability(prior, "Initial probability of " + states.get(s));
            result[s] = Math.log(prior);
        }
        return result;
    }

    private double[][] logTransitions(List<Map<Transition<S>, Double>> transitions) {
        if (transitions == null) {
            throw new NullPointerException("transitions must not be null.");
        }
        if (transitions.isEmpty()) {
            throw new IllegalArgumentException("At least one transition map is required.");
        }
        final double[][] result = new double[states.size()][states.size()];
        for (int from = 0; from < states.size(); from++) {
            for (int to = 0; to < states.size(); to++) {
                final Transition<S> transition =
                        new Transition<>(states.get(from), states.get(to));
                double logProbability = 0.0;
                for (Map<Transition<S>, Double> dimensionTransitions : transitions) {
                    logProbability += transitionLogProbability(transition, dimensionTransitions);
                }
                result[from][to] = logProbability;
            }
        }
        return result;
    }

    private double transitionLogProbability(Transition<S> transition,
            Map<Transition<S>, Double> transitions) {
        if (transitions == null) {
            throw new NullPointerException("transitions must not be null.");
        }
        final Double probability = transitions.get(transition);
        if (probability == null) {
            return Double.NEGATIVE_INFINITY; // Transition has zero probability.
        }
        checkProbability(probability, transition.toString());
        return Math.log(probability);
    }

    private void checkProbability(double probability, String name) {
        if (!Utils.probabilityInRange(probability, DELTA)) {
            throw new IllegalArgumentException(name + " must be in [0, 1] but was "
                    + probability);
        }
    }

    /**
     * Runs the forward pass and retrieves the most likely sequence from the back pointers.
     *
     * @param logEmissions logEmissions[t][s] is the emission log probability of state s at
     * time step t
     */
    private GesturePath<S> compute(double[] logPriors, double[][] logTransitions,
            double[][] logEmissions) {
        List<Map<S, Double>> messageHistory = null;
        if (keepMessageHistory) {
            messageHistory = new ArrayList<>();
        }

        // Empty evidence does not count as an HMM break.
        if (logEmissions.length == 0) {
            return new GesturePath<>(new ArrayList<S>(), Double.NEGATIVE_INFINITY, false,
                    messageHistory);
        }

        // Initial message.
        double[] message = new double[states.size()];
        for (int s = 0; s < states.size(); s++) {
            message[s] = logPriors[s] + logEmissions[0][s];
        }
        if (hmmBreak(message)) {
            logger.debug("HMM break at the initial time step.");
            final List<S> sequence = new ArrayList<>(logEmissions.length);
            continueSequence(sequence, states.get(0), logEmissions.length);
            return new GesturePath<>(sequence, Double.NEGATIVE_INFINITY, true, messageHistory);
        }
        if (messageHistory != null) {
            messageHistory.add(toMap(message));
        }

        // Forward pass
        // backPointerSequence.get(t - 1)[s] is the previous state of the most likely
        // sequence passing at time step t through state s.
        final List<int[]> backPointerSequence = new ArrayList<>(logEmissions.length);
        boolean isBroken = false;
        for (int t = 1; t < logEmissions.length; t++) {
            final double[] newMessage = new double[states.size()];
            final int[] backPointers = new int[states.size()];
            forwardStep(message, logTransitions, logEmissions[t], newMessage, backPointers);
            if (hmmBreak(newMessage)) {
                logger.debug("HMM break at time step {} of {}.", t, logEmissions.length);
                isBroken = true;
                break;
            }
            if (messageHistory != null) {
                messageHistory.add(toMap(newMessage));
            }
            message = newMessage;
            backPointerSequence.add(backPointers);
        }

        final int lastState = mostLikelyState(message);
        final List<S> mostLikelySequence =
                retrieveMostLikelySequence(backPointerSequence, lastState);
        if (isBroken) {
            continueSequence(mostLikelySequence, states.get(lastState), logEmissions.length);
        }
        final double logProbability = isBroken ? Double.NEGATIVE_INFINITY : message[lastState];
        return new GesturePath<>(mostLikelySequence, logProbability, isBroken, messageHistory);
    }

    /**
     * Computes the new forward message and the back pointers to the previous states.
     * Previous states with zero probability are skipped.
     */
    private void forwardStep(double[] message, double[][] logTransitions,
            double[] logEmissions, double[] newMessage, int[] backPointers) {
        for (int curState = 0; curState < states.size(); curState++) {
            double maxLogProbability = Double.NEGATIVE_INFINITY;
            int maxPrevState = -1;
            for (int prevState = 0; prevState < states.size(); prevState++) {
                if (message[prevState] == Double.NEGATIVE_INFINITY) {
                    continue;
                }
                final double logProbability =
                        message[prevState] + logTransitions[prevState][curState];
                if (logProbability > maxLogProbability) {
                    maxLogProbability = logProbability;
                    maxPrevState = prevState;
                }
            }

            // maxPrevState == -1 if there is no transition with non-zero probability.
            // In this case curState has zero probability and will not be part of the most
            // likely sequence.
            newMessage[curState] = maxPrevState == -1 ? Double.NEGATIVE_INFINITY
                    : maxLogProbability + logEmissions[curState];
            backPointers[curState] = maxPrevState;
        }
    }

    /**
     * Returns whether the specified message only contains states with zero probability.
     */
    private boolean hmmBreak(double[] message) {
        for (double logProbability : message) {
            if (logProbability != Double.NEGATIVE_INFINITY) {
                return false;
            }
        }
        return true;
    }

    /**
     * Retrieves the first state in state order with maximum probability.
     */
    private int mostLikelyState(double[] message) {
        int result = 0;
        for (int s = 1; s < message.length; s++) {
            if (message[s] > message[result]) {
                result = s;
            }
        }
        return result;
    }

    /**
     * Retrieves the most likely sequence from the specified back pointer sequence ending in the
     * specified last state.
     */
    private List<S> retrieveMostLikelySequence(List<int[]> backPointerSequence, int lastState) {
        final List<S> mostLikelySequence = new ArrayList<>(backPointerSequence.size() + 1);
        // Retrieve most likely state sequence in reverse order
        mostLikelySequence.add(states.get(lastState));

        final ListIterator<int[]> backPointerSeqIter =
                backPointerSequence.listIterator(backPointerSequence.size());
        while (backPointerSeqIter.hasPrevious()) {
            lastState = backPointerSeqIter.previous()[lastState];
            mostLikelySequence.add(states.get(lastState));
        }

        Collections.reverse(mostLikelySequence);
        return mostLikelySequence;
    }

    /**
     * Repeats the specified state until the sequence has the specified length. Used after an
     * HMM break.
     */
    private void continueSequence(List<S> sequence, S state, int length) {
        while (sequence.size() < length) {
            sequence.add(state);
        }
    }

    private Map<S, Double> toMap(double[] message) {
        final Map<S, Double> result =
                new LinkedHashMap<>(Utils.initialHashMapCapacity(message.length));
        for (int s = 0; s < message.length; s++) {
            result.put(states.get(s), message[s]);
        }
        return result;
    }

}
