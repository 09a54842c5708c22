package edu.columbia.tjw.helm.copula;

import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CopulaFamilyTest
{
    @Test
    void testFromName()
    {
        Assertions.assertEquals(CopulaFamily.GAUSSIAN, CopulaFamily.fromName("Gaussian"));
        Assertions.assertEquals(CopulaFamily.GAUSSIAN, CopulaFamily.fromName("gaussian"));
        Assertions.assertEquals(CopulaFamily.STUDENT_T, CopulaFamily.fromName("T"));
        Assertions.assertEquals(CopulaFamily.STUDENT_T, CopulaFamily.fromName("student_t"));
        Assertions.assertEquals(CopulaFamily.STUDENT_T, CopulaFamily.fromName("Student-T"));
        Assertions.assertEquals(CopulaFamily.CLAYTON, CopulaFamily.fromName(" CLAYTON "));
        Assertions.assertEquals(CopulaFamily.FRANK, CopulaFamily.fromName("frank"));
        Assertions.assertEquals(CopulaFamily.GUMBEL, CopulaFamily.fromName("Gumbel"));
    }

    @Test
    void testUnknownName()
    {
        Assertions.assertThrows(IllegalArgumentException.class, () -> CopulaFamily.fromName("Joe"));
        Assertions.assertThrows(NullPointerException.class, () -> CopulaFamily.fromName(null));
    }

    @Test
    void testFromNames()
    {
        Assertions.assertEquals(Arrays.asList(CopulaFamily.FRANK, CopulaFamily.GAUSSIAN),
                CopulaFamily.fromNames("Frank", "Gaussian"));
    }

    @Test
    void testNonNegativeOnly()
    {
        Assertions.assertTrue(CopulaFamily.CLAYTON.isNonNegativeDependenceOnly());
        Assertions.assertTrue(CopulaFamily.GUMBEL.isNonNegativeDependenceOnly());
        Assertions.assertFalse(CopulaFamily.GAUSSIAN.isNonNegativeDependenceOnly());
        Assertions.assertFalse(CopulaFamily.STUDENT_T.isNonNegativeDependenceOnly());
        Assertions.assertFalse(CopulaFamily.FRANK.isNonNegativeDependenceOnly());
    }

    @Test
    void testLabel()
    {
        Assertions.assertEquals("T", CopulaFamily.STUDENT_T.toString());
        Assertions.assertEquals("Gaussian", CopulaFamily.GAUSSIAN.getLabel());
    }

}
