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
 * C(u, v) = (u^-theta + v^-theta - 1)^(-1/theta), theta &gt;= -1, with
 * theta = 0 the independence copula.
 *
 * @author tyler
 */
public final class ClaytonCopula extends AbstractBivariateCopula
{
    // Beyond this expm1 would overflow, switch to the factored form.
    private static final double EXPM1_LIMIT = 700.0;

    private final double _theta;

    public ClaytonCopula(final double theta_)
    {
        super(CopulaFamily.CLAYTON, theta_);

        if (!(theta_ >= -1.0) || Double.isInfinite(theta_))
        {
            throw new IllegalArgumentException("Clayton theta must be finite and at least -1: " + theta_);
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
            final double base = FastMath.pow(u_, -_theta) + FastMath.pow(v_, -_theta) - 1.0;

            if (base <= 0.0)
            {
                return 0.0;
            }

            return FastMath.pow(base, -1.0 / _theta);
        }

        // Work with log(u^-theta + v^-theta - 1) = log(e^a + e^b - 1).
        final double a = -_theta * FastMath.log(u_);
        final double b = -_theta * FastMath.log(v_);
        final double max = Math.max(a, b);
        final double min = Math.min(a, b);
        final double logBase;

        if (max < EXPM1_LIMIT)
        {
            logBase = FastMath.log1p(FastMath.expm1(a) + FastMath.expm1(b));
        }
        else
        {
            logBase = max + FastMath.log1p(FastMath.exp(min - max) - FastMath.exp(-max));
        }

        return FastMath.exp(-logBase / _theta);
    }

}
