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

import edu.columbia.tjw.helm.algo.BivariateNormal;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * C(u, v) = Phi_2(Phi^-1(u), Phi^-1(v); rho)
 *
 * @author tyler
 */
public final class GaussianCopula extends AbstractBivariateCopula
{
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final double _rho;

    public GaussianCopula(final double rho_)
    {
        super(CopulaFamily.GAUSSIAN, rho_);

        if (!(rho_ >= -1.0 && rho_ <= 1.0))
        {
            throw new IllegalArgumentException("Correlation out of range: " + rho_);
        }

        _rho = rho_;
    }

    @Override
    protected double interiorCdf(final double u_, final double v_)
    {
        final double x = STANDARD_NORMAL.inverseCumulativeProbability(u_);
        final double y = STANDARD_NORMAL.inverseCumulativeProbability(v_);
        return BivariateNormal.cdf(x, y, _rho);
    }

}
