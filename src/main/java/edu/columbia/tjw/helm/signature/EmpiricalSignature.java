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

/**
 * The empirical signature of one pair of variables. Variables are numbered
 * from 1, and rv1 &lt; rv2.
 *
 * @author tyler
 */
public final class EmpiricalSignature
{
    private final int _rv1;
    private final int _rv2;
    private final MultinomialSignature _signature;
    private final int _unassignedCount;

    public EmpiricalSignature(final int rv1_, final int rv2_, final MultinomialSignature signature_,
            final int unassignedCount_)
    {
        if (rv1_ < 1 || rv2_ <= rv1_)
        {
            throw new IllegalArgumentException("Invalid pair: (" + rv1_ + ", " + rv2_ + ")");
        }
        if (unassignedCount_ < 0)
        {
            throw new IllegalArgumentException("Unassigned count must be non-negative: " + unassignedCount_);
        }

        _rv1 = rv1_;
        _rv2 = rv2_;
        _signature = signature_;
        _unassignedCount = unassignedCount_;
    }

    public int getRv1()
    {
        return _rv1;
    }

    public int getRv2()
    {
        return _rv2;
    }

    public MultinomialSignature getSignature()
    {
        return _signature;
    }

    /**
     * @return The number of observations that fell in no cell, normally zero
     */
    public int getUnassignedCount()
    {
        return _unassignedCount;
    }

    @Override
    public String toString()
    {
        return "EmpiricalSignature[(" + _rv1 + ", " + _rv2 + "), unassigned=" + _unassignedCount + ", "
                + _signature + "]";
    }

}
