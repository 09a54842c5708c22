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
package edu.columbia.tjw.helm.signature;

import edu.columbia.tjw.helm.data.SampleMatrix;
import edu.columbia.tjw.helm.grid.GridPartition;
import edu.columbia.tjw.helm.stat.PseudoObservations;
import edu.columbia.tjw.helm.util.LogUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Estimates the multinomial signature of observed data. The sample is first
 * mapped to pseudo-observations, then every row is counted in the grid cell
 * containing it, with weight 1 / M.
 *
 * @author tyler
 */
public final class EmpiricalSignatureEstimator
{
    private static final Logger LOG = LogUtil.getLogger(EmpiricalSignatureEstimator.class);

    public EmpiricalSignatureEstimator()
    {
    }

    /**
     * @param samples_ The raw sample, one row per observation, at least two
     * columns
     * @param resolution_ The number of cells along each axis (K)
     * @return One record per pair of columns (dim1 &lt; dim2), in
     * lexicographic order
     */
    public List<EmpiricalSignature> estimate(final SampleMatrix samples_, final int resolution_)
    {
        checkSamples(samples_);
        final GridPartition partition = GridPartition.forResolution(resolution_);
        final SampleMatrix uniform = PseudoObservations.transform(samples_);
        final int columns = uniform.getColumns();
        final List<EmpiricalSignature> output = new ArrayList<>(columns * (columns - 1) / 2);

        for (int i = 0; i < columns; i++)
        {
            for (int j = i + 1; j < columns; j++)
            {
                output.add(bin(uniform, partition, i, j));
            }
        }

        return Collections.unmodifiableList(output);
    }

    /**
     * @param samples_ The raw sample
     * @param resolution_ The number of cells along each axis (K)
     * @param dim1_ The first column (zero based)
     * @param dim2_ The second column (zero based), greater than dim1_
     * @return The empirical signature of the given pair
     */
    public EmpiricalSignature estimate(final SampleMatrix samples_, final int resolution_, final int dim1_,
            final int dim2_)
    {
        checkSamples(samples_);

        if (dim1_ < 0 || dim2_ <= dim1_ || dim2_ >= samples_.getColumns())
        {
            throw new IllegalArgumentException("Invalid column pair (" + dim1_ + ", " + dim2_ + ") for "
                    + samples_.getColumns() + " columns.");
        }

        final GridPartition partition = GridPartition.forResolution(resolution_);
        final SampleMatrix uniform = PseudoObservations.transform(samples_.selectColumns(dim1_, dim2_));
        final EmpiricalSignature raw = bin(uniform, partition, 0, 1);
        return new EmpiricalSignature(dim1_ + 1, dim2_ + 1, raw.getSignature(), raw.getUnassignedCount());
    }

    private static void checkSamples(final SampleMatrix samples_)
    {
        if (samples_.getColumns() < 2)
        {
            throw new IllegalArgumentException("At least two columns are required, got " + samples_.getColumns());
        }
        if (samples_.getRows() < 1)
        {
            throw new IllegalArgumentException("The sample has no rows.");
        }
    }

    private static EmpiricalSignature bin(final SampleMatrix uniform_, final GridPartition partition_,
            final int dim1_, final int dim2_)
    {
        final int rows = uniform_.getRows();
        final double weight = 1.0 / rows;
        final double[] masses = new double[partition_.size()];
        int unassigned = 0;

        for (int k = 0; k < rows; k++)
        {
            final int index = partition_.locate(uniform_.get(k, dim1_), uniform_.get(k, dim2_));

            if (index < 0)
            {
                unassigned++;
                continue;
            }

            masses[index] += weight;
        }

        if (unassigned > 0)
        {
            LOG.warning(unassigned + " of " + rows + " observations of pair (" + (dim1_ + 1) + ", " + (dim2_ + 1)
                    + ") fell in no grid cell.");
        }

        LogUtil.logVector(LOG, "Empirical signature: ", masses);
        return new EmpiricalSignature(dim1_ + 1, dim2_ + 1, new MultinomialSignature(masses), unassigned);
    }

}
