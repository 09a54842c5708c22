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
package edu.columbia.tjw.helm.copula;

import org.apache.commons.math3.util.FastMath;

/**
 * C(u, v) = -1/theta * log(1 + (e^(-theta u) - 1)(e^(-theta v) - 1) / (e^(-theta) - 1)),
 * with theta = 0 the independence copula.
 *
 * @author tyler
 */
public final class FrankCopula extends AbstractBivariateCopula
{
    // Below this the direct expm1 form is accurate, above it the factored form is.
    private static final double FACTORED_THRESHOLD = 1.0;

    private final double _theta;

    public FrankCopula(final double theta_)
    {
        super(CopulaFamily.FRANK, theta_);

        if (Double.isNaN(theta_) || Double.isInfinite(theta_))
        {
            throw new IllegalArgumentException("Frank theta must be finite: " + theta_);
        }

        _theta = theta_;
    }

    @Override
    protected double interiorCdf(final double u_, final double v_)
    {
        if (_theta == 0.0)
        {
            return u_ * v_;
        }
        if (_theta < 0.0)
        {
            // Negative dependence is the reflection of the positive copula.
            return u_ - positiveCdf(-_theta, u_, 1.0 - v_);
        }

        return positiveCdf(_theta, u_, v_);
    }

    private static double positiveCdf(final double theta_, final double u_, final double v_)
    {
        if (theta_ <= FACTORED_THRESHOLD)
        {
            final double num = FastMath.expm1(-theta_ * u_) * FastMath.expm1(-theta_ * v_);
            return -FastMath.log1p(num / FastMath.expm1(-theta_)) / theta_;
        }

        // Numerator of the ratio is e^(-theta m) * (1 + x - y - z), m = min(u, v).
        final double min = Math.min(u_, v_);
        final double max = Math.max(u_, v_);
        final double x = FastMath.exp(-theta_ * (max - min));
        final double y = FastMath.exp(-theta_ * max);
        final double z = FastMath.exp(-theta_ * (1.0 - min));
        final double logBracket = FastMath.log1p(x - y - z);
        final double logDenom = FastMath.log1p(-FastMath.exp(-theta_));
        return min - (logBracket - logDenom) / theta_;
    }

}
