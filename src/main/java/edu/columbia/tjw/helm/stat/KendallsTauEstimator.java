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
import org.apache.commons.math3.stat.correlation.KendallsCorrelation;

/**
 * Empirical Kendall's tau (tau-b, so ties are accounted for) between the
 * first two columns of the sample.
 *
 * @author tyler
 */
public final class KendallsTauEstimator implements DependencyEstimator
{
    private static final KendallsTauEstimator SINGLETON = new KendallsTauEstimator();

    public static KendallsTauEstimator singleton()
    {
        return SINGLETON;
    }

    private KendallsTauEstimator()
    {
    }

    @Override
    public double estimate(final SampleMatrix samples_)
    {
        if (samples_.getColumns() < 2)
        {
            throw new IllegalArgumentException("Kendall's tau needs two columns, got " + samples_.getColumns());
        }
        if (samples_.getRows() < 2)
        {
            throw new IllegalArgumentException("Kendall's tau needs two rows, got " + samples_.getRows());
        }

        final double tau = new KendallsCorrelation().correlation(samples_.getColumn(0), samples_.getColumn(1));

        if (Double.isNaN(tau))
        {
            throw new IllegalArgumentException("Kendall's tau is undefined, one of the columns is constant.");
        }

        return tau;
    }

}
