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

import edu.columbia.tjw.helm.algo.BivariateStudentT;
import org.apache.commons.math3.distribution.TDistribution;

/**
 * C(u, v) = T_2(t^-1(u), t^-1(v); rho, nu) for integer nu.
 *
 * @author tyler
 */
public final class StudentTCopula extends AbstractBivariateCopula
{
    private final double _rho;
    private final BivariateStudentT _joint;
    private final TDistribution _marginal;

    public StudentTCopula(final double rho_, final int degreesOfFreedom_)
    {
        super(CopulaFamily.STUDENT_T, rho_);

        if (!(rho_ >= -1.0 && rho_ <= 1.0))
        {
            throw new IllegalArgumentException("Correlation out of range: " + rho_);
        }

        _rho = rho_;
        _joint = new BivariateStudentT(degreesOfFreedom_);
        _marginal = _joint.getMarginal();
    }

    public int getDegreesOfFreedom()
    {
        return _joint.getDegreesOfFreedom();
    }

    @Override
    protected double interiorCdf(final double u_, final double v_)
    {
        final double x = _marginal.inverseCumulativeProbability(u_);
        final double y = _marginal.inverseCumulativeProbability(v_);
        return _joint.cdf(x, y, _rho);
    }

    @Override
    public String toString()
    {
        return "StudentTCopula[" + _rho + ", " + getDegreesOfFreedom() + "]";
    }

}
