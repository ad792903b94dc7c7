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
 * Mean and standard deviation of the normal distribution emitted by one state in one
 * tracked dimension.
 *
 * <p>{@link #UNSET} marks a state that does not apply to a dimension. Its density is zero
 * everywhere, see {@link GaussianEmissionModel}.
 */
public final class GaussianParameters {

    public static final GaussianParameters UNSET = new GaussianParameters();

    private final double mean;
    private final double std;
    private final boolean set;

    /**
     * @throws IllegalArgumentException if std is not a positive finite number or mean is
     * not finite. A zero standard deviation has no density.
     */
    public GaussianParameters(double mean, double std) {
        if (Double.isNaN(mean) || Double.isInfinite(mean)) {
            throw new IllegalArgumentException("Mean must be finite but was " + mean);
        }
        if (!(std > 0.0) || Double.isInfinite(std)) {
            throw new IllegalArgumentException(
                    "Standard deviation must be positive and finite but was " + std);
        }
        this.mean = mean;
        this.std = std;
        this.set = true;
    }

    private GaussianParameters() {
        this.mean = Double.NaN;
        this.std = Double.NaN;
        this.set = false;
    }

    public boolean isSet() {
        return set;
    }

    /**
     * @throws IllegalStateException for {@link #UNSET}
     */
    public double mean() {
        checkSet();
        return mean;
    }

    /**
     * @throws IllegalStateException for {@link #UNSET}
     */
    public double std() {
        checkSet();
        return std;
    }

    private void checkSet() {
        if (!set) {
            throw new IllegalStateException("Parameters are unset.");
        }
    }

    @Override
    public int hashCode() {
        if (!set) {
            return 0;
        }
        final long bits = Double.doubleToLongBits(mean) * 31 + Double.doubleToLongBits(std);
        return (int) (bits ^ (bits >>> 32));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        GaussianParameters other = (GaussianParameters) obj;
        if (!set || !other.set) {
            return set == other.set;
        }
        return Double.compare(mean, other.mean) == 0 && Double.compare(std, other.std) == 0;
    }

    @Override
    public String toString() {
        if (!set) {
            return "GaussianParameters [unset]";
        }
        return "GaussianParameters [mean=" + mean + ", std=" + std + "]";
    }

}
