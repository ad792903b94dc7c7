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
import java.util.List;
import java.util.Map;

/**
 * Most likely state sequence computed by {@link ViterbiDecoder} together with its joint
 * probability.
 *
 * @param <S> the state type
 */
public class GesturePath<S> {

    private final List<S> states;
    private final double logProbability;
    private final boolean isBroken;
    private final List<Map<S, Double>> messageHistory;

    GesturePath(List<S> states, double logProbability, boolean isBroken,
            List<Map<S, Double>> messageHistory) {
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.logProbability = logProbability;
        this.isBroken = isBroken;
        this.messageHistory = messageHistory == null ? null
                : Collections.unmodifiableList(messageHistory);
    }

    /**
     * Returns one state per time step. Always has the length of the evidence, see
     * {@link #isBroken()} for the case of an HMM break.
     */
    public List<S> states() {
        return states;
    }

    public int size() {
        return states.size();
    }

    /**
     * Returns the log of the joint probability of the path and the evidence.
     * Negative infinity for empty evidence and for broken HMMs.
     */
    public double logProbability() {
        return logProbability;
    }

    /**
     * Returns the joint probability p(s_1, ..., s_T, o_1, ..., o_T) of the path and the
     * evidence. This is not normalized by the probability of the evidence.
     *
     * <p>May underflow to 0 for long sequences. Use {@link #logProbability()} to compare paths.
     */
    public double probability() {
        return Math.exp(logProbability);
    }

    /**
     * Returns whether an HMM break occurred, i.e. at some time step every state had zero
     * probability. In this case {@link #states()} contains the most likely sequence up to the
     * last time step before the break, continued with its last state, and
     * {@link #probability()} is 0.
     */
    public boolean isBroken() {
        return isBroken;
    }

    /**
     * Sequence of forward messages with the log probability of the most likely path ending in
     * each state at each time step. Null if the message history was not kept.
     */
    public List<Map<S, Double>> messageHistory() {
        return messageHistory;
    }

    public String messageHistoryString() {
        if (messageHistory == null) {
            throw new IllegalStateException("Message history was not recorded.");
        }

        final StringBuilder sb = new StringBuilder();
        sb.append("Message history with log probabilities\n\n");
        int i = 0;
        for (Map<S, Double> message : messageHistory) {
            sb.append("Time step " + i + "\n");
            i++;
            for (Map.Entry<S, Double> entry : message.entrySet()) {
                sb.append(entry.getKey() + ": " + entry.getValue() + "\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "GesturePath [states=" + states + ", logProbability=" + logProbability
                + ", isBroken=" + isBroken + "]";
    }

}
