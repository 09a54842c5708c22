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
package edu.columbia.tjw.helm.select;

/**
 *
 * @author tyler
 */
public final class PairwiseSelection
{
    private final int _rv1;
    private final int _rv2;
    private final SelectionResult _result;

    public PairwiseSelection(final int rv1_, final int rv2_, final SelectionResult result_)
    {
        _rv1 = rv1_;
        _rv2 = rv2_;
        _result = result_;
    }

    /**
     * @return The first variable, numbered from 1
     */
    public int getRv1()
    {
        return _rv1;
    }

    public int getRv2()
    {
        return _rv2;
    }

    public SelectionResult getResult()
    {
        return _result;
    }

    @Override
    public String toString()
    {
        return "PairwiseSelection[(" + _rv1 + ", " + _rv2 + "), " + _result + "]";
    }

}
