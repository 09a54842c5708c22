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
package edu.columbia.tjw.helm.spark;

import edu.columbia.tjw.helm.data.SampleMatrix;
import edu.columbia.tjw.helm.util.LogUtil;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Logger;
import org.apache.spark.ml.linalg.Vector;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;

/**
 * Collects a vector column of a Spark dataset into a local sample matrix, one
 * row per dataset row and one column per vector entry.
 *
 * @author tyler
 */
public class SparkSampleAdapter
{
    private static final Logger LOG = LogUtil.getLogger(SparkSampleAdapter.class);

    private final SampleMatrix _samples;

    public SparkSampleAdapter(final Dataset<?> data_, final String featureColumn_)
    {
        if (!Arrays.asList(data_.columns()).contains(featureColumn_))
        {
            throw new IllegalArgumentException("No such column: " + featureColumn_);
        }

        final int rowCount = (int) data_.count();

        if (rowCount < 1)
        {
            throw new IllegalArgumentException("Dataset is empty.");
        }

        final Iterator<Row> rowForm = (Iterator<Row>) data_.toLocalIterator();

        double[][] transposed = null;
        int columnCount = -1;
        int pointer = 0;

        while (rowForm.hasNext())
        {
            final Row next = rowForm.next();
            final Vector vec = (Vector) next.get(next.fieldIndex(featureColumn_));

            if (null == vec)
            {
                throw new IllegalArgumentException("Null feature vector in row " + pointer);
            }
            if (null == transposed)
            {
                columnCount = vec.size();
                transposed = new double[columnCount][rowCount];
            }
            if (vec.size() != columnCount)
            {
                throw new IllegalArgumentException("Size mismatch in row " + pointer + ": " + vec.size() + " != "
                        + columnCount);
            }
            if (pointer >= rowCount)
            {
                throw new IllegalStateException("Dataset grew while being read.");
            }

            for (int i = 0; i < columnCount; i++)
            {
                transposed[i][pointer] = vec.apply(i);
            }

            pointer++;
        }

        if (pointer != rowCount)
        {
            throw new IllegalStateException("Expected " + rowCount + " rows, read " + pointer);
        }

        _samples = SampleMatrix.fromColumns(transposed);
        LOG.info("Read " + rowCount + " x " + columnCount + " samples from column " + featureColumn_);
    }

    public SampleMatrix getSamples()
    {
        return _samples;
    }

}
