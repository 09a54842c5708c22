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
package edu.columbia.tjw.helm.stat;

import edu.columbia.tjw.helm.data.SampleMatrix;
import org.apache.commons.math3.exception.NotANumberException;
import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.RankingAlgorithm;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

/**
 * The probability integral transform through the empirical CDF of each
 * column: U[i][k] = rank(X[i][k]) / (M + 1).
 *
 * Tied values share the largest of their ranks, i.e. the empirical CDF
 * evaluated at that value. Dividing by M + 1 rather than M keeps every value
 * strictly inside (0, 1).
 *
 * @author tyler
 */
public final class PseudoObservations
{
    private static final RankingAlgorithm RANKING = new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.MAXIMUM);

    private PseudoObservations()
    {
    }

    /**
     * @param samples_ The raw M x N samples
     * @return An M x N matrix of pseudo-observations
     * @throws IllegalArgumentException if samples_ contains NaN
     */
    public static SampleMatrix transform(final SampleMatrix samples_)
    {
        final int columns = samples_.getColumns();
        final double[][] output = new double[columns][];

        for (int k = 0; k < columns; k++)
        {
            output[k] = transform(samples_.getColumn(k));
        }

        return SampleMatrix.fromColumns(output);
    }

    /**
     * @param column_ The raw values of one variable
     * @return The pseudo-observations of column_, in the same order
     */
    public static double[] transform(final double[] column_)
    {
        final double[] ranks;

        try
        {
            ranks = RANKING.rank(column_);
        }
        catch (final NotANumberException e)
        {
            throw new IllegalArgumentException("Samples may not contain NaN.", e);
        }

        final double scale = 1.0 / (column_.length + 1.0);

        for (int i = 0; i < ranks.length; i++)
        {
            ranks[i] = ranks[i] * scale;
        }

        return ranks;
    }

}
