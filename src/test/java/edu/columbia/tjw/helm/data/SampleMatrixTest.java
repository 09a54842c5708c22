package edu.columbia.tjw.helm.data;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SampleMatrixTest
{
    @Test
    void testRowsAndColumnsAgree()
    {
        final SampleMatrix byRows = SampleMatrix.fromRows(new double[][]{{1.0, 2.0, 3.0}, {4.0, 5.0, 6.0}});
        final SampleMatrix byColumns = SampleMatrix.fromColumns(new double[]{1.0, 4.0}, new double[]{2.0, 5.0},
                new double[]{3.0, 6.0});

        Assertions.assertEquals(2, byRows.getRows());
        Assertions.assertEquals(3, byRows.getColumns());
        Assertions.assertEquals(6, byRows.size());

        for (int i = 0; i < 2; i++)
        {
            for (int k = 0; k < 3; k++)
            {
                Assertions.assertEquals(byRows.get(i, k), byColumns.get(i, k));
            }
        }

        Assertions.assertEquals(6.0, byRows.get(1, 2));
    }

    @Test
    void testCopies()
    {
        final double[] column = new double[]{1.0, 2.0};
        final SampleMatrix matrix = SampleMatrix.fromColumns(column, new double[]{3.0, 4.0});
        column[0] = 100.0;
        Assertions.assertEquals(1.0, matrix.get(0, 0));

        matrix.getColumn(0)[1] = 100.0;
        Assertions.assertEquals(2.0, matrix.get(1, 0));
    }

    @Test
    void testSelectColumns()
    {
        final SampleMatrix matrix = SampleMatrix.fromRows(new double[][]{{1.0, 2.0, 3.0}, {4.0, 5.0, 6.0}});
        final SampleMatrix selected = matrix.selectColumns(2, 0);
        Assertions.assertEquals(2, selected.getColumns());
        Assertions.assertArrayEquals(new double[]{3.0, 6.0}, selected.getColumn(0));
        Assertions.assertArrayEquals(new double[]{1.0, 4.0}, selected.getColumn(1));
    }

    @Test
    void testInvalid()
    {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SampleMatrix.fromRows(new double[][]{{1.0, 2.0}, {3.0}}));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SampleMatrix.fromColumns(new double[]{1.0, 2.0}, new double[]{3.0}));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SampleMatrix.fromRows(new double[0][]));

        final SampleMatrix matrix = SampleMatrix.fromRows(new double[][]{{1.0, 2.0}});
        Assertions.assertThrows(ArrayIndexOutOfBoundsException.class, () -> matrix.get(0, 2));
        Assertions.assertThrows(ArrayIndexOutOfBoundsException.class, () -> matrix.get(1, 0));
        Assertions.assertThrows(ArrayIndexOutOfBoundsException.class, () -> matrix.getColumn(-1));
    }

}
