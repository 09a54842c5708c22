/*
 * Copyright 2014 Tyler Ward.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.columbia.tjw.helm.util;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegrator;
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegratorFactory;
import org.apache.commons.math3.util.FastMath;

public final class MathFunctions
{
    public static final double EPSILON = Math.ulp(1.0);

    // Past this point the Debye integrand is below 1e-24, the tail is dropped.
    private static final double DEBYE_CUTOFF = 64.0;
    private static final int DEBYE_POINTS = 64;

    private static final GaussIntegratorFactory FACTORY = new GaussIntegratorFactory();

    private MathFunctions()
    {
    }

    /**
     * Replaces every exact zero in the input with floor_. The input is not
     * modified.
     *
     * @param values_ The vector to process
     * @param floor_ The (positive) replacement for zero entries
     * @return A copy of values_ with no zero entries
     */
    public static double[] floorZeros(final double[] values_, final double floor_)
    {
        if (!(floor_ > 0.0))
        {
            throw new IllegalArgumentException("Floor must be positive: " + floor_);
        }

        final double[] output = values_.clone();

        for (int i = 0; i < output.length; i++)
        {
            if (output[i] == 0.0)
            {
                output[i] = floor_;
            }
        }

        return output;
    }

    public static double sum(final double[] values_)
    {
        double sum = 0.0;

        for (final double next : values_)
        {
            sum += next;
        }

        return sum;
    }

    /**
     * The Debye function D_n(x) = n / x^n * integral_0^x t^n / (e^t - 1) dt,
     * for x &gt; 0.
     *
     * @param n_ The order, must be positive
     * @param x_ The argument, must be positive
     * @return D_n(x_)
     */
    public static double debye(final int n_, final double x_)
    {
        if (n_ < 1)
        {
            throw new IllegalArgumentException("Order must be positive: " + n_);
        }
        if (!(x_ > 0.0) || Double.isInfinite(x_))
        {
            throw new IllegalArgumentException("Invalid argument: " + x_);
        }

        final double upper = Math.min(x_, DEBYE_CUTOFF);
        final GaussIntegrator integrator = FACTORY.legendreHighPrecision(DEBYE_POINTS, 0.0, upper);

        final UnivariateFunction integrand = (t) -> FastMath.pow(t, n_) / FastMath.expm1(t);
        final double integral = integrator.integrate(integrand);

        return n_ * integral / FastMath.pow(x_, n_);
    }

}
