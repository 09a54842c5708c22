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
 * C(u, v) = exp(-((-ln u)^theta + (-ln v)^theta)^(1/theta)), theta &gt;= 1.
 *
 * @author tyler
 */
public final class GumbelCopula extends AbstractBivariateCopula
{
    private final double _theta;

    public GumbelCopula(final double theta_)
    {
        super(CopulaFamily.GUMBEL, theta_);

        if (!(theta_ >= 1.0) || Double.isInfinite(theta_))
        {
            throw new IllegalArgumentException("Gumbel theta must be finite and at least 1: " + theta_);
        }

        _theta = theta_;
    }

    @Override
    protected double interiorCdf(final double u_, final double v_)
    {
        final double a = -FastMath.log(u_);
        final double b = -FastMath.log(v_);
        final double max = Math.max(a, b);
        final double min = Math.min(a, b);

        // Factor out the larger term so that large theta cannot overflow.
        final double ratio = FastMath.pow(min / max, _theta);
        final double sum = max * FastMath.exp(FastMath.log1p(ratio) / _theta);
        return FastMath.exp(-sum);
    }

}
