package edu.columbia.tjw.helm.copula;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BivariateCopulaTest
{
    private static final double[] POINTS = new double[]{1.0e-9, 0.01, 0.2, 0.35, 0.5, 0.77, 0.9, 0.999};

    private static List<BivariateCopula> makeCopulas()
    {
        final List<BivariateCopula> output = new ArrayList<>();
        output.add(new GaussianCopula(-0.7));
        output.add(new GaussianCopula(0.0));
        output.add(new GaussianCopula(0.95));
        output.add(new StudentTCopula(-0.4, 1));
        output.add(new StudentTCopula(0.6, 4));
        output.add(new StudentTCopula(0.3, 7));
        output.add(new ClaytonCopula(-0.8));
        output.add(new ClaytonCopula(0.0));
        output.add(new ClaytonCopula(2.0));
        output.add(new ClaytonCopula(150.0));
        output.add(new FrankCopula(-12.0));
        output.add(new FrankCopula(0.0));
        output.add(new FrankCopula(0.5));
        output.add(new FrankCopula(30.0));
        output.add(new GumbelCopula(1.0));
        output.add(new GumbelCopula(2.5));
        output.add(new GumbelCopula(40.0));
        return output;
    }

    @Test
    void testBoundaries()
    {
        for (final BivariateCopula copula : makeCopulas())
        {
            for (final double x : POINTS)
            {
                Assertions.assertEquals(0.0, copula.cdf(x, 0.0), copula.toString());
                Assertions.assertEquals(0.0, copula.cdf(0.0, x), copula.toString());
                Assertions.assertEquals(0.0, copula.cdf(-0.5, x), copula.toString());
                Assertions.assertEquals(x, copula.cdf(x, 1.0), copula.toString());
                Assertions.assertEquals(x, copula.cdf(1.0, x), copula.toString());
            }

            Assertions.assertEquals(1.0, copula.cdf(1.0, 1.0));
            Assertions.assertThrows(IllegalArgumentException.class, () -> copula.cdf(Double.NaN, 0.5));
        }
    }

    @Test
    void testFrechetBounds()
    {
        for (final BivariateCopula copula : makeCopulas())
        {
            for (final double u : POINTS)
            {
                for (final double v : POINTS)
                {
                    final double c = copula.cdf(u, v);
                    Assertions.assertTrue(c >= Math.max(u + v - 1.0, 0.0), copula + " at " + u + ", " + v);
                    Assertions.assertTrue(c <= Math.min(u, v), copula + " at " + u + ", " + v);
                }
            }
        }
    }

    @Test
    void testMonotone()
    {
        for (final BivariateCopula copula : makeCopulas())
        {
            for (final double v : POINTS)
            {
                double prev = 0.0;

                for (final double u : POINTS)
                {
                    final double c = copula.cdf(u, v);
                    Assertions.assertTrue(c >= prev - 1.0e-14, copula + " at " + u + ", " + v);
                    prev = c;
                }
            }
        }
    }

    @Test
    void testIndependence()
    {
        final BivariateCopula[] copulas = new BivariateCopula[]{new GaussianCopula(0.0), new ClaytonCopula(0.0),
            new FrankCopula(0.0), new GumbelCopula(1.0)};

        for (final BivariateCopula copula : copulas)
        {
            for (final double u : POINTS)
            {
                for (final double v : POINTS)
                {
                    Assertions.assertEquals(u * v, copula.cdf(u, v), 1.0e-12, copula.toString());
                }
            }
        }
    }

    @Test
    void testKnownValues()
    {
        Assertions.assertEquals(0.2465154709363856, new GaussianCopula(0.5).cdf(0.3, 0.6), 1.0e-10);
        Assertions.assertEquals(0.24280940140298074, new StudentTCopula(0.5, 4).cdf(0.3, 0.6), 1.0e-7);
        Assertions.assertEquals(0.2785430072655778, new ClaytonCopula(2.0).cdf(0.3, 0.6), 1.0e-13);
        Assertions.assertEquals(0.2703985494048813, new GumbelCopula(2.0).cdf(0.3, 0.6), 1.0e-13);
        Assertions.assertEquals(0.27189107899679454, new FrankCopula(5.0).cdf(0.3, 0.6), 1.0e-13);
        Assertions.assertEquals(0.07441933474407622, new FrankCopula(-5.0).cdf(0.3, 0.6), 1.0e-13);
    }

    @Test
    void testLargeParameters()
    {
        // Strong positive dependence approaches the upper Frechet bound.
        Assertions.assertEquals(0.3, new ClaytonCopula(500.0).cdf(0.3, 0.6), 1.0e-3);
        Assertions.assertEquals(0.3, new GumbelCopula(500.0).cdf(0.3, 0.6), 1.0e-3);
        Assertions.assertEquals(0.3, new FrankCopula(5000.0).cdf(0.3, 0.6), 1.0e-3);
        Assertions.assertEquals(0.0, new FrankCopula(-5000.0).cdf(0.3, 0.6), 1.0e-3);
    }

    @Test
    void testInvalidParameters()
    {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ClaytonCopula(-1.5));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new GumbelCopula(0.9));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new GaussianCopula(1.1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new StudentTCopula(0.5, 0));
    }

    @Test
    void testFamilies()
    {
        Assertions.assertEquals(CopulaFamily.CLAYTON, new ClaytonCopula(1.0).getFamily());
        Assertions.assertEquals(1.0, new ClaytonCopula(1.0).getParameter());
        Assertions.assertEquals(CopulaFamily.STUDENT_T, new StudentTCopula(0.2, 3).getFamily());
        Assertions.assertEquals(3, new StudentTCopula(0.2, 3).getDegreesOfFreedom());
    }

}
