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

import edu.columbia.tjw.helm.util.MathFunctions;
import java.io.Serializable;
import java.util.Arrays;

/**
 * The probability mass of each cell of a K x K grid partition. Entry i is the
 * mass of cell number i + 1.
 *
 * @author tyler
 */
public final class MultinomialSignature implements Serializable
{
    private static final long serialVersionUID = 0x3a66c1d2b1e0f457L;

    private final double[] _masses;

    /**
     * @param masses_ The cell masses, in cell order. The array is copied.
     */
    public MultinomialSignature(final double[] masses_)
    {
        if (masses_.length < 1)
        {
            throw new IllegalArgumentException("Signature cannot be empty.");
        }

        for (final double next : masses_)
        {
            if (!(next >= 0.0))
            {
                throw new IllegalArgumentException("Cell masses must be non-negative: " + next);
            }
        }

        _masses = masses_.clone();
    }

    public double get(final int index_)
    {
        return _masses[index_];
    }

    public int size()
    {
        return _masses.length;
    }

    public double sum()
    {
        return MathFunctions.sum(_masses);
    }

    public double[] toArray()
    {
        return _masses.clone();
    }

    /**
     * @param floor_ The replacement for zero masses
     * @return This signature with zero masses replaced by floor_
     */
    public MultinomialSignature withFloor(final double floor_)
    {
        return new MultinomialSignature(MathFunctions.floorZeros(_masses, floor_));
    }

    @Override
    public boolean equals(final Object obj_)
    {
        if (this == obj_)
        {
            return true;
        }
        if (!(obj_ instanceof MultinomialSignature))
        {
            return false;
        }

        return Arrays.equals(_masses, ((MultinomialSignature) obj_)._masses);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(_masses);
    }

    @Override
    public String toString()
    {
        return "MultinomialSignature" + Arrays.toString(_masses);
    }

}
