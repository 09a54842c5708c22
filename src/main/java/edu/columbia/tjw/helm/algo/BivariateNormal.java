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

import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.util.FastMath;

/**
 * CDF of the standard bivariate normal distribution with correlation rho.
 *
 * This is Alan Genz's refinement of the Drezner &amp; Wesolowsky method
 * (Statistics and Computing, 2004), accurate to roughly 1e-15.
 *
 * @author tyler
 */
public final class BivariateNormal
{
    private static final double TWO_PI = 2.0 * Math.PI;
    private static final double SQRT_TWO = Math.sqrt(2.0);
    private static final double SQRT_TWO_PI = Math.sqrt(TWO_PI);

    // Gauss-Legendre half rules, the abscissas are mirrored below.
    private static final double[] W6 =
    {
        0.1713244923791705, 0.3607615730481384, 0.4679139345726904
    };
    private static final double[] X6 =
    {
        0.9324695142031522, 0.6612093864662647, 0.2386191860831970
    };
    private static final double[] W12 =
    {
        0.04717533638651177, 0.1069393259953183, 0.1600783285433464,
        0.2031674267230659, 0.2334925365383547, 0.2491470458134029
    };
    private static final double[] X12 =
    {
        0.9815606342467191, 0.9041172563704750, 0.7699026741943050,
        0.5873179542866171, 0.3678314989981802, 0.1252334085114692
    };
    private static final double[] W20 =
    {
        0.01761400713915212, 0.04060142980038694, 0.06267204833410906,
        0.08327674157670475, 0.1019301198172404, 0.1181945319615184,
        0.1316886384491766, 0.1420961093183821, 0.1491729864726037,
        0.1527533871307259
    };
    private static final double[] X20 =
    {
        0.9931285991850949, 0.9639719272779138, 0.9122344282513259,
        0.8391169718222188, 0.7463319064601508, 0.6360536807265150,
        0.5108670019508271, 0.3737060887154196, 0.2277858511416451,
        0.07652652113349733
    };

    private BivariateNormal()
    {
    }

    /**
     * Standard univariate normal CDF.
     *
     * @param x_ The point
     * @return P[X &lt; x_]
     */
    public static double phi(final double x_)
    {
        return 0.5 * Erf.erfc(-x_ / SQRT_TWO);
    }

    /**
     * @param x_ Upper limit for the first variable
     * @param y_ Upper limit for the second variable
     * @param rho_ The correlation, in [-1, 1]
     * @return P[X &lt; x_, Y &lt; y_]
     */
    public static double cdf(final double x_, final double y_, final double rho_)
    {
        if (Double.isNaN(x_) || Double.isNaN(y_))
        {
            throw new IllegalArgumentException("NaN limits: " + x_ + ", " + y_);
        }
        if (!(rho_ >= -1.0 && rho_ <= 1.0))
        {
            throw new IllegalArgumentException("Correlation out of range: " + rho_);
        }

        return upperTail(-x_, -y_, rho_);
    }

    /**
     * P[X &gt; h_, Y &gt; k_], the form the Genz algorithm is written in.
     */
    private static double upperTail(final double h_, final double k_, final double r_)
    {
        if (h_ == Double.POSITIVE_INFINITY || k_ == Double.POSITIVE_INFINITY)
        {
            return 0.0;
        }
        if (h_ == Double.NEGATIVE_INFINITY)
        {
            return (k_ == Double.NEGATIVE_INFINITY) ? 1.0 : phi(-k_);
        }
        if (k_ == Double.NEGATIVE_INFINITY)
        {
            return phi(-h_);
        }
        if (r_ == 0.0)
        {
            return phi(-h_) * phi(-k_);
        }

        final double absR = Math.abs(r_);
        final double[] halfW;
        final double[] halfX;

        if (absR < 0.3)
        {
            halfW = W6;
            halfX = X6;
        }
        else if (absR < 0.75)
        {
            halfW = W12;
            halfX = X12;
        }
        else
        {
            halfW = W20;
            halfX = X20;
        }

        final int n = halfW.length;
        final double[] w = new double[2 * n];
        final double[] x = new double[2 * n];

        for (int i = 0; i < n; i++)
        {
            w[i] = halfW[i];
            w[n + i] = halfW[i];
            x[i] = 1.0 - halfX[i];
            x[n + i] = 1.0 + halfX[i];
        }

        final double h = h_;
        double k = k_;
        double hk = h * k;
        double bvn = 0.0;

        if (absR < 0.925)
        {
            final double hs = (h * h + k * k) / 2.0;
            final double asr = FastMath.asin(r_) / 2.0;

            for (int i = 0; i < w.length; i++)
            {
                final double sn = FastMath.sin(asr * x[i]);
                bvn += w[i] * FastMath.exp((sn * hk - hs) / (1.0 - sn * sn));
            }

            bvn = bvn * asr / TWO_PI + phi(-h) * phi(-k);
            return clip(bvn);
        }

        if (r_ < 0.0)
        {
            k = -k;
            hk = -hk;
        }

        if (absR < 1.0)
        {
            final double as = 1.0 - r_ * r_;
            double a = Math.sqrt(as);
            final double bs = (h - k) * (h - k);
            double asr = -(bs / as + hk) / 2.0;
            final double c = (4.0 - hk) / 8.0;
            final double d = (12.0 - hk) / 80.0;

            if (asr > -100.0)
            {
                bvn = a * FastMath.exp(asr) * (1.0 - c * (bs - as) * (1.0 - d * bs) / 3.0 + c * d * as * as);
            }
            if (hk > -100.0)
            {
                final double b = Math.sqrt(bs);
                final double sp = SQRT_TWO_PI * phi(-b / a);
                bvn = bvn - FastMath.exp(-hk / 2.0) * sp * b * (1.0 - c * bs * (1.0 - d * bs) / 3.0);
            }

            a = a / 2.0;
            double sum = 0.0;

            for (int i = 0; i < w.length; i++)
            {
                final double xs = (a * x[i]) * (a * x[i]);
                asr = -(bs / xs + hk) / 2.0;

                if (asr > -100.0)
                {
                    final double sp = 1.0 + c * xs * (1.0 + 5.0 * d * xs);
                    final double rs = Math.sqrt(1.0 - xs);
                    final double ep = FastMath.exp(-(hk / 2.0) * xs / ((1.0 + rs) * (1.0 + rs))) / rs;
                    sum += w[i] * FastMath.exp(asr) * (sp - ep);
                }
            }

            bvn = (a * sum - bvn) / TWO_PI;
        }

        if (r_ > 0.0)
        {
            bvn = bvn + phi(-Math.max(h, k));
        }
        else if (h >= k)
        {
            bvn = -bvn;
        }
        else
        {
            final double l;

            if (h < 0.0)
            {
                l = phi(k) - phi(h);
            }
            else
            {
                l = phi(-h) - phi(-k);
            }

            bvn = l - bvn;
        }

        return clip(bvn);
    }

    private static double clip(final double p_)
    {
        return Math.max(0.0, Math.min(1.0, p_));
    }

}
