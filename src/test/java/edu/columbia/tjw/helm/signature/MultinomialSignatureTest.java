package edu.columbia.tjw.helm.signature;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MultinomialSignatureTest
{
    @Test
    void testFloor()
    {
        final MultinomialSignature signature = new MultinomialSignature(new double[]{0.0, 0.25, 0.75, 0.0});
        final MultinomialSignature floored = signature.withFloor(1.0e-10);

        Assertions.assertArrayEquals(new double[]{1.0e-10, 0.25, 0.75, 1.0e-10}, floored.toArray());
        Assertions.assertEquals(0.0, signature.get(0));
        Assertions.assertEquals(1.0, signature.sum());
    }

    @Test
    void testImmutable()
    {
        final double[] masses = new double[]{0.5, 0.5};
        final MultinomialSignature signature = new MultinomialSignature(masses);
        masses[0] = 0.9;
        signature.toArray()[1] = 0.9;

        Assertions.assertEquals(new MultinomialSignature(new double[]{0.5, 0.5}), signature);
    }

    @Test
    void testInvalid()
    {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new MultinomialSignature(new double[0]));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new MultinomialSignature(new double[]{0.5, -0.1}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new MultinomialSignature(new double[]{0.5, Double.NaN}));
    }

}
