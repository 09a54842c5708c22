package edu.columbia.tjw.helm.select;

import edu.columbia.tjw.helm.copula.CopulaFamily;
import edu.columbia.tjw.helm.data.SampleMatrix;
import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Draws repeatedly from a Gaussian copula and checks that the selector
 * recognizes it most of the time.
 */
class GaussianSelectionTest
{
    private static final int TRIALS = 50;
    private static final int SAMPLE_SIZE = 1000;
    private static final double TAU = 0.5;

    @Test
    void testGaussianMajority()
    {
        final SampleGenerator generator = new SampleGenerator(0x5eed0001L);
        final FamilySelector selector = new FamilySelector();
        final Map<CopulaFamily, Integer> counts = new EnumMap<>(CopulaFamily.class);
        double tauSum = 0.0;

        for (int i = 0; i < TRIALS; i++)
        {
            final SampleMatrix samples = generator.gaussianPair(SAMPLE_SIZE, TAU);
            final SelectionResult result = selector.selectFamily(samples);

            Assertions.assertTrue(result.hasFamily());
            counts.merge(result.getFamily(), 1, Integer::sum);
            tauSum += result.getTauHat();
        }

        final int gaussian = counts.getOrDefault(CopulaFamily.GAUSSIAN, 0);
        Assertions.assertTrue(gaussian > TRIALS / 2, "Selections: " + counts);
        Assertions.assertEquals(TAU, tauSum / TRIALS, 0.02);
    }

}
