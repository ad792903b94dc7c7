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

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.pow;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.List;

/**
 * Emission densities of a state given its {@link GaussianParameters}.
 *
 * <p>Observations with several tracked dimensions are treated as conditionally independent
 * given the state, so the joint density is the product of the per-dimension densities.
 */
public class GaussianEmissionModel {

    private GaussianEmissionModel() {
    }

    /**
     * Returns the normal density of x, or 0 if the parameters are
     * {@link GaussianParameters#UNSET}.
     */
    public static double density(double x, GaussianParameters parameters) {
        if (!parameters.isSet()) {
            return 0.0;
        }
        final double sigma = parameters.std();
        return 1.0 / (sqrt(2.0 * PI) * sigma) * exp(-0.5 * pow((x - parameters.mean()) / sigma, 2));
    }

    /**
     * Use this function instead of Math.log(density(x, parameters)) to avoid an
     * arithmetic underflow for very small densities.
     *
     * @return negative infinity if the parameters are {@link GaussianParameters#UNSET}
     */
    public static double logDensity(double x, GaussianParameters parameters) {
        if (!parameters.isSet()) {
            return Double.NEGATIVE_INFINITY;
        }
        final double sigma = parameters.std();
        return log(1.0 / (sqrt(2.0 * PI) * sigma)) - 0.5 * pow((x - parameters.mean()) / sigma, 2);
    }

    /**
     * Returns the product of the per-dimension densities.
     *
     * @throws IllegalArgumentException if x and parameters differ in dimension
     */
    public static double jointDensity(double[] x, List<GaussianParameters> parameters) {
        checkDimensions(x, parameters);
        double result = 1.0;
        for (int i = 0; i < x.length; i++) {
            result *= density(x[i], parameters.get(i));
        }
        return result;
    }

    /**
     * Returns the sum of the per-dimension log densities.
     *
     * @throws IllegalArgumentException if x and parameters differ in dimension
     */
    public static double jointLogDensity(double[] x, List<GaussianParameters> parameters) {
        checkDimensions(x, parameters);
        double result = 0.0;
        for (int i = 0; i < x.length; i++) {
            result += logDensity(x[i], parameters.get(i));
        }
        return result;
    }

    private static void checkDimensions(double[] x, List<GaussianParameters> parameters) {
        if (x.length != parameters.size()) {
            throw new IllegalArgumentException("Observation has " + x.length
                    + " dimensions but parameters are given for " + parameters.size() + ".");
        }
    }

}
