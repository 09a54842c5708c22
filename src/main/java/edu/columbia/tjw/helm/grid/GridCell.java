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
 * One rectangle [u1, u2) x [v1, v2) of a grid partition.
 *
 * Cells are numbered from 1, column by column (u), bottom to top (v) within a
 * column. For a 4 x 4 grid:
 * <pre>
 *   | 4 | 8 | 12 | 16 |
 *   | 3 | 7 | 11 | 15 |
 *   | 2 | 6 | 10 | 14 |
 *   | 1 | 5 |  9 | 13 |
 * </pre>
 *
 * @author tyler
 */
public final class GridCell
{
    private final int _number;
    private final int _uIndex;
    private final int _vIndex;
    private final GridPoint _lowerLeft;
    private final GridPoint _upperLeft;
    private final GridPoint _lowerRight;
    private final GridPoint _upperRight;

    public GridCell(final int number_, final int uIndex_, final int vIndex_, final double u1_, final double u2_,
            final double v1_, final double v2_)
    {
        if (!(u1_ < u2_) || !(v1_ < v2_))
        {
            throw new IllegalArgumentException("Degenerate cell: [" + u1_ + ", " + u2_ + ") x [" + v1_ + ", "
                    + v2_ + ")");
        }

        _number = number_;
        _uIndex = uIndex_;
        _vIndex = vIndex_;
        _lowerLeft = new GridPoint(u1_, v1_);
        _upperLeft = new GridPoint(u1_, v2_);
        _lowerRight = new GridPoint(u2_, v1_);
        _upperRight = new GridPoint(u2_, v2_);
    }

    /**
     * @return The 1-based cell number, see the class comment for the layout
     */
    public int getNumber()
    {
        return _number;
    }

    /**
     * @return The position of this cell in its partition, getNumber() - 1
     */
    public int getIndex()
    {
        return _number - 1;
    }

    public int getUIndex()
    {
        return _uIndex;
    }

    public int getVIndex()
    {
        return _vIndex;
    }

    public GridPoint getLowerLeft()
    {
        return _lowerLeft;
    }

    public GridPoint getUpperLeft()
    {
        return _upperLeft;
    }

    public GridPoint getLowerRight()
    {
        return _lowerRight;
    }

    public GridPoint getUpperRight()
    {
        return _upperRight;
    }

    public double getU1()
    {
        return _lowerLeft.getU();
    }

    public double getU2()
    {
        return _upperRight.getU();
    }

    public double getV1()
    {
        return _lowerLeft.getV();
    }

    public double getV2()
    {
        return _upperRight.getV();
    }

    public boolean contains(final double u_, final double v_)
    {
        return u_ >= getU1() && u_ < getU2() && v_ >= getV1() && v_ < getV2();
    }

    @Override
    public String toString()
    {
        return "GridCell[" + _number + "]: " + _lowerLeft + " -> " + _upperRight;
    }

}
