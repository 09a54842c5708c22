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

import edu.columbia.tjw.helm.copula.CopulaFamily;
import edu.columbia.tjw.helm.copula.CopulaVolume;
import edu.columbia.tjw.helm.copula.DependencySpec;
import edu.columbia.tjw.helm.copula.StandardCopulaVolume;
import edu.columbia.tjw.helm.grid.GridCell;
import edu.columbia.tjw.helm.grid.GridPartition;
import edu.columbia.tjw.helm.util.LogUtil;
import java.util.logging.Logger;

/**
 * Computes the theoretical multinomial signature of a copula: the C-volume of
 * every cell of the grid partition, in cell order.
 *
 * @author tyler
 */
public final class SignatureCalculator
{
    private static final Logger LOG = LogUtil.getLogger(SignatureCalculator.class);

    private final CopulaVolume _volume;

    public SignatureCalculator()
    {
        this(StandardCopulaVolume.singleton());
    }

    public SignatureCalculator(final CopulaVolume volume_)
    {
        if (null == volume_)
        {
            throw new NullPointerException("Volume cannot be null.");
        }

        _volume = volume_;
    }

    public CopulaVolume getVolume()
    {
        return _volume;
    }

    /**
     * @param family_ The copula family
     * @param dependency_ The dependency of the copula
     * @param resolution_ The number of cells along each axis (K)
     * @return The K^2 cell masses, in cell order
     */
    public MultinomialSignature signature(final CopulaFamily family_, final DependencySpec dependency_,
            final int resolution_)
    {
        if (null == family_ || null == dependency_)
        {
            throw new NullPointerException("Family and dependency cannot be null.");
        }

        final GridPartition partition = GridPartition.forResolution(resolution_);
        final CopulaVolume.CellVolume cellVolume = _volume.bind(family_, dependency_);
        final double[] masses = new double[partition.size()];

        for (final GridCell cell : partition)
        {
            masses[cell.getIndex()] = cellVolume.volume(cell);
        }

        final MultinomialSignature output = new MultinomialSignature(masses);
        LOG.fine("Signature of " + family_ + " at " + dependency_ + " (K = " + resolution_ + ") has total mass "
                + output.sum());
        LogUtil.logVector(LOG, "Theoretical signature: ", masses);
        return output;
    }

}
