package edu.columbia.tjw.helm.algo;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BivariateNormalTest
{
    private static final double[] CORRELATIONS = new double[]{-0.99, -0.9, -0.5, -0.1, 0.0, 0.3, 0.5, 0.8, 0.95,
        0.999};

    @Test
    void testOrthant()
    {
        for (final double rho : CORRELATIONS)
        {
            final double expected = 0.25 + Math.asin(rho) / (2.0 * Math.PI);
            Assertions.assertEquals(expected, BivariateNormal.cdf(0.0, 0.0, rho), 1.0e-14, "rho = " + rho);
        }
    }

    @Test
    void testIndependence()
    {
        final double[] points = new double[]{-3.0, -1.2, -0.1, 0.0, 0.4, 1.7, 2.5};

        for (final double x : points)
        {
            for (final double y : points)
            {
                final double expected = BivariateNormal.phi(x) * BivariateNormal.phi(y);
                Assertions.assertEquals(expected, BivariateNormal.cdf(x, y, 0.0), 1.0e-14);
            }
        }
    }

    @Test
    void testKnownValue()
    {
        Assertions.assertEquals(0.3013219157529622, BivariateNormal.cdf(1.0, -0.5, 0.6), 1.0e-12);
    }

    @Test
    void testSymmetry()
    {
        for (final double rho : CORRELATIONS)
        {
            Assertions.assertEquals(BivariateNormal.cdf(0.7, -0.3, rho), BivariateNormal.cdf(-0.3, 0.7, rho),
                    1.0e-14);

            // P(X < x, Y < y) + P(X < x, Y > y) = P(X < x)
            final double split = BivariateNormal.cdf(0.7, -0.3, rho) + BivariateNormal.cdf(0.7, 0.3, -rho);
            Assertions.assertEquals(BivariateNormal.phi(0.7), split, 1.0e-13);
        }
    }

    @Test
    void testTails()
    {
        Assertions.assertEquals(0.0, BivariateNormal.cdf(-40.0, 0.5, 0.5), 1.0e-15);
        Assertions.assertEquals(BivariateNormal.phi(0.5), BivariateNormal.cdf(40.0, 0.5, 0.5), 1.0e-14);
        Assertions.assertEquals(1.0, BivariateNormal.cdf(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 0.2),
                1.0e-15);
    }

    @Test
    void testInvalid()
    {
        Assertions.assertThrows(IllegalArgumentException.class, () -> BivariateNormal.cdf(0.0, 0.0, 1.5));
        Assertions.assertThrows(IllegalArgumentException.class, () -> BivariateNormal.cdf(Double.NaN, 0.0, 0.5));
    }

}
