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

/**
 * Handles the edges of the unit square, where every copula has the same
 * behavior: C(u, 0) = C(0, v) = 0, C(u, 1) = u and C(1, v) = v.
 *
 * @author tyler
 */
public abstract class AbstractBivariateCopula implements BivariateCopula
{
    private final CopulaFamily _family;
    private final double _parameter;

    protected AbstractBivariateCopula(final CopulaFamily family_, final double parameter_)
    {
        _family = family_;
        _parameter = parameter_;
    }

    @Override
    public final CopulaFamily getFamily()
    {
        return _family;
    }

    @Override
    public final double getParameter()
    {
        return _parameter;
    }

    @Override
    public final double cdf(final double u_, final double v_)
    {
        if (Double.isNaN(u_) || Double.isNaN(v_))
        {
            throw new IllegalArgumentException("NaN copula argument: (" + u_ + ", " + v_ + ")");
        }
        if (u_ <= 0.0 || v_ <= 0.0)
        {
            return 0.0;
        }
        if (u_ >= 1.0)
        {
            return Math.min(v_, 1.0);
        }
        if (v_ >= 1.0)
        {
            return u_;
        }

        final double raw = interiorCdf(u_, v_);

        // Stay inside the Frechet bounds, numerical noise can push past them.
        final double lower = Math.max(u_ + v_ - 1.0, 0.0);
        final double upper = Math.min(u_, v_);
        return Math.max(lower, Math.min(upper, raw));
    }

    /**
     * @param u_ Strictly inside (0, 1)
     * @param v_ Strictly inside (0, 1)
     * @return C(u_, v_)
     */
    protected abstract double interiorCdf(final double u_, final double v_);

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + "[" + _parameter + "]";
    }

}
