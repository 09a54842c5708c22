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
package edu.columbia.tjw.helm.grid;

/**
 * A point (u, v) on the unit square.
 *
 * @author tyler
 */
public final class GridPoint
{
    private final double _u;
    private final double _v;

    public GridPoint(final double u_, final double v_)
    {
        _u = u_;
        _v = v_;
    }

    public double getU()
    {
        return _u;
    }

    public double getV()
    {
        return _v;
    }

    @Override
    public boolean equals(final Object obj_)
    {
        if (this == obj_)
        {
            return true;
        }
        if (!(obj_ instanceof GridPoint))
        {
            return false;
        }

        final GridPoint that = (GridPoint) obj_;
        return Double.compare(_u, that._u) == 0 && Double.compare(_v, that._v) == 0;
    }

    @Override
    public int hashCode()
    {
        return 31 * Double.hashCode(_u) + Double.hashCode(_v);
    }

    @Override
    public String toString()
    {
        return "(" + _u + ", " + _v + ")";
    }

}
