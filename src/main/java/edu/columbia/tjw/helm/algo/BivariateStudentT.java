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
package edu.columbia.tjw.helm.algo;

import edu.columbia.tjw.helm.util.MathFunctions;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.util.FastMath;

/**
 * CDF of the standard bivariate Student-t distribution with an integer number
 * of degrees of freedom.
 *
 * Closed form recursion of Dunnett &amp; Sobel (1954), in the arrangement used
 * by Alan Genz's bvtl routine.
 *
 * @author tyler
 */
public final class BivariateStudentT
{
    private final int _dof;
    private final TDistribution _marginal;

    public BivariateStudentT(final int dof_)
    {
        if (dof_ < 1)
        {
            throw new IllegalArgumentException("Degrees of freedom must be positive: " + dof_);
        }

        _dof = dof_;
        _marginal = new TDistribution(dof_);
    }

    public int getDegreesOfFreedom()
    {
        return _dof;
    }

    /**
     * @return The univariate marginal of this distribution
     */
    public TDistribution getMarginal()
    {
        return _marginal;
    }

    /**
     * @param dh_ Upper limit for the first variable
     * @param dk_ Upper limit for the second variable
     * @param r_ The correlation, in [-1, 1]
     * @return P[X &lt; dh_, Y &lt; dk_]
     */
    public double cdf(final double dh_, final double dk_, final double r_)
    {
        if (Double.isNaN(dh_) || Double.isNaN(dk_))
        {
            throw new IllegalArgumentException("NaN limits: " + dh_ + ", " + dk_);
        }
        if (!(r_ >= -1.0 && r_ <= 1.0))
        {
            throw new IllegalArgumentException("Correlation out of range: " + r_);
        }
        if (dh_ == Double.NEGATIVE_INFINITY || dk_ == Double.NEGATIVE_INFINITY)
        {
            return 0.0;
        }
        if (dh_ == Double.POSITIVE_INFINITY)
        {
            return _marginal.cumulativeProbability(dk_);
        }
        if (dk_ == Double.POSITIVE_INFINITY)
        {
            return _marginal.cumulativeProbability(dh_);
        }

        final double eps = MathFunctions.EPSILON;

        if (1.0 - r_ <= eps)
        {
            return _marginal.cumulativeProbability(Math.min(dh_, dk_));
        }
        if (r_ + 1.0 <= eps)
        {
            if (dh_ > -dk_)
            {
                return _marginal.cumulativeProbability(dh_) - _marginal.cumulativeProbability(-dk_);
            }

            return 0.0;
        }

        return clip(recursion(dh_, dk_, r_));
    }

    private double recursion(final double dh_, final double dk_, final double r_)
    {
        final int nu = _dof;
        final double pi = Math.PI;
        final double tpi = 2.0 * pi;
        final double snu = Math.sqrt(nu);
        final double ors = 1.0 - r_ * r_;
        final double hrk = dh_ - r_ * dk_;
        final double krh = dk_ - r_ * dh_;
        final double dh2 = dh_ * dh_;
        final double dk2 = dk_ * dk_;

        final double xnhk;
        final double xnkh;

        if (Math.abs(hrk) + ors > 0.0)
        {
            xnhk = hrk * hrk / (hrk * hrk + ors * (nu + dk2));
            xnkh = krh * krh / (krh * krh + ors * (nu + dh2));
        }
        else
        {
            xnhk = 0.0;
            xnkh = 0.0;
        }

        final double hs = Math.signum(dh_ - r_ * dk_);
        final double ks = Math.signum(dk_ - r_ * dh_);
        double bvt;

        if (nu % 2 == 0)
        {
            bvt = FastMath.atan2(Math.sqrt(ors), -r_) / tpi;
            double gmph = dh_ / Math.sqrt(16.0 * (nu + dh2));
            double gmpk = dk_ / Math.sqrt(16.0 * (nu + dk2));
            double btnckh = 2.0 * FastMath.atan2(Math.sqrt(xnkh), Math.sqrt(1.0 - xnkh)) / pi;
            double btpdkh = 2.0 * Math.sqrt(xnkh * (1.0 - xnkh)) / pi;
            double btnchk = 2.0 * FastMath.atan2(Math.sqrt(xnhk), Math.sqrt(1.0 - xnhk)) / pi;
            double btpdhk = 2.0 * Math.sqrt(xnhk * (1.0 - xnhk)) / pi;

            for (int j = 1; j <= nu / 2; j++)
            {
                bvt += gmph * (1.0 + ks * btnckh);
                bvt += gmpk * (1.0 + hs * btnchk);
                btnckh += btpdkh;
                btpdkh = 2 * j * btpdkh * (1.0 - xnkh) / (2 * j + 1);
                btnchk += btpdhk;
                btpdhk = 2 * j * btpdhk * (1.0 - xnhk) / (2 * j + 1);
                gmph = gmph * (2 * j - 1) / (2 * j * (1.0 + dh2 / nu));
                gmpk = gmpk * (2 * j - 1) / (2 * j * (1.0 + dk2 / nu));
            }
        }
        else
        {
            final double qhrk = Math.sqrt(dh2 + dk2 - 2.0 * r_ * dh_ * dk_ + nu * ors);
            final double hkrn = dh_ * dk_ + r_ * nu;
            final double hkn = dh_ * dk_ - nu;
            final double hpk = dh_ + dk_;
            bvt = FastMath.atan2(-snu * (hkn * qhrk + hpk * hkrn), hkn * hkrn - nu * hpk * qhrk) / tpi;

            if (bvt < -MathFunctions.EPSILON)
            {
                bvt += 1.0;
            }

            double gmph = dh_ / (tpi * snu * (1.0 + dh2 / nu));
            double gmpk = dk_ / (tpi * snu * (1.0 + dk2 / nu));
            double btnckh = Math.sqrt(xnkh);
            double btpdkh = btnckh;
            double btnchk = Math.sqrt(xnhk);
            double btpdhk = btnchk;

            for (int j = 1; j <= (nu - 1) / 2; j++)
            {
                bvt += gmph * (1.0 + ks * btnckh) + gmpk * (1.0 + hs * btnchk);
                btpdkh = (2 * j - 1) * btpdkh * (1.0 - xnkh) / (2 * j);
                btnckh += btpdkh;
                btpdhk = (2 * j - 1) * btpdhk * (1.0 - xnhk) / (2 * j);
                btnchk += btpdhk;
                gmph = 2 * j * gmph / ((2 * j + 1) * (1.0 + dh2 / nu));
                gmpk = 2 * j * gmpk / ((2 * j + 1) * (1.0 + dk2 / nu));
            }
        }

        return bvt;
    }

    private static double clip(final double p_)
    {
        return Math.max(0.0, Math.min(1.0, p_));
    }

}
