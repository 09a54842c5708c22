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

import edu.columbia.tjw.helm.util.MathFunctions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Partition of the unit square into K x K cells.
 *
 * Break points are spaced evenly over [eps, 1 - eps] on both axes, so that no
 * corner ever sits exactly on the edge of the square, where most copula CDFs
 * are awkward to evaluate. The cell order is fixed (see GridCell), and every
 * signature in this package uses it.
 *
 * Partitions are immutable and cached by resolution.
 *
 * @author tyler
 */
public final class GridPartition implements Iterable<GridCell>
{
    private static final ConcurrentMap<Integer, GridPartition> CACHE = new ConcurrentHashMap<>();

    private final int _resolution;
    private final double[] _breaks;
    private final double _step;
    private final List<GridCell> _cells;

    private GridPartition(final int resolution_)
    {
        _resolution = resolution_;
        _breaks = computeBreaks(resolution_);
        _step = _breaks[1] - _breaks[0];

        final List<GridCell> cells = new ArrayList<>(resolution_ * resolution_);
        int number = 1;

        for (int i = 0; i < resolution_; i++)
        {
            for (int j = 0; j < resolution_; j++)
            {
                final GridCell cell = new GridCell(number++, i, j, _breaks[i], _breaks[i + 1], _breaks[j],
                        _breaks[j + 1]);
                cells.add(cell);
            }
        }

        _cells = Collections.unmodifiableList(cells);
    }

    /**
     * @param resolution_ K, the number of cells along each axis
     * @return The (shared) partition with K * K cells
     * @throws IllegalArgumentException if resolution_ &lt; 1
     */
    public static GridPartition forResolution(final int resolution_)
    {
        if (resolution_ < 1)
        {
            throw new IllegalArgumentException("Grid resolution must be positive: " + resolution_);
        }

        return CACHE.computeIfAbsent(resolution_, GridPartition::new);
    }

    private static double[] computeBreaks(final int resolution_)
    {
        final double start = MathFunctions.EPSILON;
        final double stop = 1.0 - MathFunctions.EPSILON;
        final double step = (stop - start) / resolution_;
        final double[] output = new double[resolution_ + 1];

        for (int i = 0; i < resolution_; i++)
        {
            output[i] = start + (i * step);
        }

        output[resolution_] = stop;
        return output;
    }

    public int getResolution()
    {
        return _resolution;
    }

    /**
     * @return K * K
     */
    public int size()
    {
        return _cells.size();
    }

    public GridCell getCell(final int index_)
    {
        return _cells.get(index_);
    }

    public List<GridCell> getCells()
    {
        return _cells;
    }

    /**
     * @return A copy of the K + 1 break points shared by both axes
     */
    public double[] getBreaks()
    {
        return _breaks.clone();
    }

    /**
     * Finds the cell containing (u, v). The answer is always the cell a linear
     * scan of getCells() testing GridCell.contains would stop at, but it is
     * computed directly from the break points.
     *
     * @param u_ The horizontal coordinate
     * @param v_ The vertical coordinate
     * @return The 0-based index of the containing cell, or -1 if the point is
     * outside [eps, 1 - eps) on either axis
     */
    public int locate(final double u_, final double v_)
    {
        final int uIndex = axisIndex(u_);

        if (uIndex < 0)
        {
            return -1;
        }

        final int vIndex = axisIndex(v_);

        if (vIndex < 0)
        {
            return -1;
        }

        return (uIndex * _resolution) + vIndex;
    }

    private int axisIndex(final double x_)
    {
        if (!(x_ >= _breaks[0]) || !(x_ < _breaks[_resolution]))
        {
            return -1;
        }

        int index = (int) ((x_ - _breaks[0]) / _step);
        index = Math.max(0, Math.min(_resolution - 1, index));

        // Rounding in the division can land one bucket off near a break.
        while (index > 0 && x_ < _breaks[index])
        {
            index--;
        }
        while (index < _resolution - 1 && x_ >= _breaks[index + 1])
        {
            index++;
        }

        return index;
    }

    @Override
    public Iterator<GridCell> iterator()
    {
        return _cells.iterator();
    }

}
