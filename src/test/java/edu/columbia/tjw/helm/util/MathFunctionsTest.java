package edu.columbia.tjw.helm.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class MathFunctionsTest
{
    @Test
    void testDebye()
    {
        Assertions.assertEquals(0.7775046341122508, MathFunctions.debye(1, 1.0), 1.0e-12);
        Assertions.assertEquals(0.7078784756278264, MathFunctions.debye(2, 1.0), 1.0e-12);
        Assertions.assertEquals(0.3208761977001379, MathFunctions.debye(1, 5.0), 1.0e-12);

        // D_1(x) tends to pi^2 / (6 x) for large x.
        Assertions.assertEquals(Math.PI * Math.PI / 6.0e3, MathFunctions.debye(1, 1000.0), 1.0e-12);
    }

    @Test
    void testDebyeSmallArgument()
    {
        // D_n(x) = 1 - n x / (2 (n + 1)) + O(x^2)
        Assertions.assertEquals(1.0 - 1.0e-4 / 4.0, MathFunctions.debye(1, 1.0e-4), 1.0e-9);
        Assertions.assertEquals(1.0 - 1.0e-4 / 3.0, MathFunctions.debye(2, 1.0e-4), 1.0e-9);
    }

    @Test
    void testDebyeInvalid()
    {
        Assertions.assertThrows(IllegalArgumentException.class, () -> MathFunctions.debye(0, 1.0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MathFunctions.debye(1, 0.0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MathFunctions.debye(1, Double.NaN));
    }

    @Test
    void testFloorZeros()
    {
        final double[] input = new double[]{0.0, 0.5, 0.0, 0.5};
        final double[] output = MathFunctions.floorZeros(input, 1.0e-6);

        Assertions.assertArrayEquals(new double[]{1.0e-6, 0.5, 1.0e-6, 0.5}, output);
        Assertions.assertEquals(0.0, input[0]);
        Assertions.assertThrows(IllegalArgumentException.class, () -> MathFunctions.floorZeros(input, 0.0));
    }

    @Test
    void testSum()
    {
        Assertions.assertEquals(1.5, MathFunctions.sum(new double[]{0.25, 0.25, 1.0}));
        Assertions.assertEquals(0.0, MathFunctions.sum(new double[0]));
    }

}
