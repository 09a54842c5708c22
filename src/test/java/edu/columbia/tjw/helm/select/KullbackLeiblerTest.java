package edu.columbia.tjw.helm.select;

import edu.columbia.tjw.helm.signature.MultinomialSignature;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class KullbackLeiblerTest
{
    @Test
    void testIdentical()
    {
        final MultinomialSignature p = new MultinomialSignature(new double[]{0.1, 0.2, 0.3, 0.4});
        Assertions.assertEquals(0.0, KullbackLeibler.divergence(p, p), 1.0e-15);
    }

    @Test
    void testKnownValue()
    {
        final double expected = 0.5 * Math.log(2.0) + 0.5 * Math.log(2.0 / 3.0);
        Assertions.assertEquals(expected, KullbackLeibler.divergence(new double[]{0.5, 0.5},
                new double[]{0.25, 0.75}), 1.0e-15);
    }

    @Test
    void testAsymmetric()
    {
        final double[] p = new double[]{0.7, 0.2, 0.1};
        final double[] q = new double[]{0.2, 0.3, 0.5};
        Assertions.assertNotEquals(KullbackLeibler.divergence(p, q), KullbackLeibler.divergence(q, p), 1.0e-3);
        Assertions.assertTrue(KullbackLeibler.divergence(p, q) > 0.0);
    }

    @Test
    void testNormalized()
    {
        final double[] p = new double[]{0.5, 0.5};
        final double base = KullbackLeibler.divergence(p, new double[]{0.25, 0.75});
        Assertions.assertEquals(base, KullbackLeibler.divergence(new double[]{2.0, 2.0}, new double[]{1.0, 3.0}),
                1.0e-15);
    }

    @Test
    void testZeros()
    {
        Assertions.assertEquals(Math.log(2.0), KullbackLeibler.divergence(new double[]{1.0, 0.0},
                new double[]{0.5, 0.5}), 1.0e-15);
        Assertions.assertEquals(Double.POSITIVE_INFINITY, KullbackLeibler.divergence(new double[]{0.5, 0.5},
                new double[]{1.0, 0.0}));
    }

    @Test
    void testInvalid()
    {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> KullbackLeibler.divergence(new double[]{0.5, 0.5}, new double[]{1.0}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> KullbackLeibler.divergence(new double[]{0.0, 0.0}, new double[]{0.5, 0.5}));
    }

}
