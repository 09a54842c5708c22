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
package edu.columbia.tjw.helm.data;

/**
 * An immutable M x N matrix of observations, one row per sample and one column
 * per variable. Stored column-major since every consumer reads whole columns.
 *
 * @author tyler
 */
public final class SampleMatrix
{
    private final double[] _data;
    private final int _rows;
    private final int _columns;

    private SampleMatrix(final double[] data_, final int rows_, final int columns_)
    {
        _data = data_;
        _rows = rows_;
        _columns = columns_;
    }

    /**
     * Copies the given row-major array, each element of data_ is one sample.
     *
     * @param data_ data_[row][column]
     * @return A new matrix holding a copy of data_
     */
    public static SampleMatrix fromRows(final double[][] data_)
    {
        if (data_.length < 1)
        {
            throw new IllegalArgumentException("Matrix must have at least one row.");
        }

        final int rows = data_.length;
        final int columns = data_[0].length;
        final double[] data = new double[rows * columns];

        for (int i = 0; i < rows; i++)
        {
            if (data_[i].length != columns)
            {
                throw new IllegalArgumentException("Ragged input, row " + i + " has " + data_[i].length
                        + " columns, expected " + columns);
            }

            for (int k = 0; k < columns; k++)
            {
                data[(k * rows) + i] = data_[i][k];
            }
        }

        return new SampleMatrix(data, rows, columns);
    }

    /**
     * Copies the given column arrays, each element of columns_ is one variable.
     *
     * @param columns_ columns_[column][row]
     * @return A new matrix holding a copy of columns_
     */
    public static SampleMatrix fromColumns(final double[]... columns_)
    {
        if (columns_.length < 1)
        {
            throw new IllegalArgumentException("Matrix must have at least one column.");
        }

        final int columns = columns_.length;
        final int rows = columns_[0].length;
        final double[] data = new double[rows * columns];

        for (int k = 0; k < columns; k++)
        {
            if (columns_[k].length != rows)
            {
                throw new IllegalArgumentException("Ragged input, column " + k + " has " + columns_[k].length
                        + " rows, expected " + rows);
            }

            System.arraycopy(columns_[k], 0, data, k * rows, rows);
        }

        return new SampleMatrix(data, rows, columns);
    }

    public double get(final int row_, final int column_)
    {
        final int index = computeIndex(row_, column_);
        return _data[index];
    }

    /**
     * @param column_ The column to extract
     * @return A fresh copy of the given column
     */
    public double[] getColumn(final int column_)
    {
        final int start = computeIndex(0, column_);
        final double[] output = new double[_rows];
        System.arraycopy(_data, start, output, 0, _rows);
        return output;
    }

    /**
     * @param first_ The first column to keep
     * @param second_ The second column to keep
     * @return A two column matrix made up of the given columns, in order
     */
    public SampleMatrix selectColumns(final int first_, final int second_)
    {
        return fromColumns(getColumn(first_), getColumn(second_));
    }

    public int getRows()
    {
        return _rows;
    }

    public int getColumns()
    {
        return _columns;
    }

    public int size()
    {
        return _data.length;
    }

    /**
     * Check for errors that will not cause an array index out of bounds
     * exception.
     *
     * @param row_
     * @param column_
     */
    private int computeIndex(final int row_, final int column_)
    {
        if (column_ < 0)
        {
            throw new ArrayIndexOutOfBoundsException("Column must be non-negative: " + column_);
        }
        if (column_ >= _columns)
        {
            throw new ArrayIndexOutOfBoundsException("Column too large: " + column_);
        }
        if (row_ < 0)
        {
            throw new ArrayIndexOutOfBoundsException("Row must be non-negative: " + row_);
        }
        if (row_ >= _rows)
        {
            throw new ArrayIndexOutOfBoundsException("Row too large: " + row_);
        }

        final int index = (column_ * _rows) + row_;
        return index;
    }

}
