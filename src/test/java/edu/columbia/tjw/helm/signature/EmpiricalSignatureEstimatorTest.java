package edu.columbia.tjw.helm.signature;

import edu.columbia.tjw.helm.data.SampleMatrix;
import java.util.List;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class EmpiricalSignatureEstimatorTest
{
    @Test
    void testComonotone()
    {
        final double[] x = new double[]{1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0};
        final double[] y = new double[x.length];

        for (int i = 0; i < x.length; i++)
        {
            y[i] = Math.exp(x[i]);
        }

        final EmpiricalSignature signature = new EmpiricalSignatureEstimator().estimate(
                SampleMatrix.fromColumns(x, y), 4, 0, 1);

        Assertions.assertEquals(1, signature.getRv1());
        Assertions.assertEquals(2, signature.getRv2());
        Assertions.assertEquals(0, signature.getUnassignedCount());

        // Pseudo-observations are k / 9, two per bucket, all on the diagonal.
        final double[] expected = new double[16];
        expected[0] = 0.25;
        expected[5] = 0.25;
        expected[10] = 0.25;
        expected[15] = 0.25;
        Assertions.assertArrayEquals(expected, signature.getSignature().toArray(), 1.0e-15);
    }

    @Test
    void testCountermonotone()
    {
        final double[] x = new double[]{1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0};
        final double[] y = new double[]{8.0, 7.0, 6.0, 5.0, 4.0, 3.0, 2.0, 1.0};

        final EmpiricalSignature signature = new EmpiricalSignatureEstimator().estimate(
                SampleMatrix.fromColumns(x, y), 4, 0, 1);

        // Low u with high v lands in cell 4 (index 3), high u with low v in cell 13 (index 12).
        Assertions.assertEquals(0.25, signature.getSignature().get(3), 1.0e-15);
        Assertions.assertEquals(0.25, signature.getSignature().get(6), 1.0e-15);
        Assertions.assertEquals(0.25, signature.getSignature().get(9), 1.0e-15);
        Assertions.assertEquals(0.25, signature.getSignature().get(12), 1.0e-15);
    }

    @Test
    void testAllPairs()
    {
        final RandomGenerator rand = new Well19937c(0xabcdef12L);
        final int rows = 500;
        final double[][] columns = new double[4][rows];

        for (int i = 0; i < rows; i++)
        {
            final double common = rand.nextGaussian();

            for (int k = 0; k < 4; k++)
            {
                columns[k][i] = common + (k + 1) * rand.nextGaussian();
            }
        }

        final SampleMatrix samples = SampleMatrix.fromColumns(columns);
        final EmpiricalSignatureEstimator estimator = new EmpiricalSignatureEstimator();
        final List<EmpiricalSignature> output = estimator.estimate(samples, 5);

        Assertions.assertEquals(6, output.size());

        int pointer = 0;

        for (int i = 0; i < 4; i++)
        {
            for (int j = i + 1; j < 4; j++)
            {
                final EmpiricalSignature next = output.get(pointer++);
                Assertions.assertEquals(i + 1, next.getRv1());
                Assertions.assertEquals(j + 1, next.getRv2());
                Assertions.assertEquals(25, next.getSignature().size());
                Assertions.assertEquals(1.0, next.getSignature().sum(), 1.0e-12);
                Assertions.assertEquals(0, next.getUnassignedCount());

                final EmpiricalSignature single = estimator.estimate(samples, 5, i, j);
                Assertions.assertEquals(next.getSignature(), single.getSignature());
                Assertions.assertEquals(next.getRv1(), single.getRv1());
                Assertions.assertEquals(next.getRv2(), single.getRv2());
            }
        }
    }

    @Test
    void testTies()
    {
        // Ties share the largest rank, so mass conservation holds regardless.
        final SampleMatrix samples = SampleMatrix.fromColumns(new double[]{1.0, 1.0, 1.0, 2.0, 3.0},
                new double[]{0.0, 0.0, 5.0, 5.0, 5.0});
        final EmpiricalSignature signature = new EmpiricalSignatureEstimator().estimate(samples, 3, 0, 1);
        Assertions.assertEquals(1.0, signature.getSignature().sum(), 1.0e-15);
        Assertions.assertEquals(0, signature.getUnassignedCount());
    }

    @Test
    void testInvalid()
    {
        final EmpiricalSignatureEstimator estimator = new EmpiricalSignatureEstimator();
        final SampleMatrix oneColumn = SampleMatrix.fromColumns(new double[]{1.0, 2.0, 3.0});
        final SampleMatrix noRows = SampleMatrix.fromColumns(new double[0], new double[0]);
        final SampleMatrix valid = SampleMatrix.fromColumns(new double[]{1.0, 2.0}, new double[]{2.0, 1.0});

        Assertions.assertThrows(IllegalArgumentException.class, () -> estimator.estimate(oneColumn, 4));
        Assertions.assertThrows(IllegalArgumentException.class, () -> estimator.estimate(noRows, 4));
        Assertions.assertThrows(IllegalArgumentException.class, () -> estimator.estimate(valid, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> estimator.estimate(valid, 4, 1, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> estimator.estimate(valid, 4, 0, 2));
    }

}
