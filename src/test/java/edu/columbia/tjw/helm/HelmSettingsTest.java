package edu.columbia.tjw.helm;

import edu.columbia.tjw.helm.copula.CopulaFamily;
import edu.columbia.tjw.helm.util.MathFunctions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HelmSettingsTest
{
    @Test
    void testDefaults()
    {
        final HelmSettings settings = HelmSettings.getDefault();
        Assertions.assertEquals(4, settings.getGridResolution());
        Assertions.assertEquals(Arrays.asList(CopulaFamily.GAUSSIAN, CopulaFamily.CLAYTON, CopulaFamily.GUMBEL,
                CopulaFamily.FRANK), settings.getCandidateFamilies());
        Assertions.assertEquals(-0.05, settings.getExclusionThreshold());
        Assertions.assertEquals(MathFunctions.EPSILON, settings.getZeroMassFloor());
        Assertions.assertEquals(4, settings.getStudentTDegreesOfFreedom());
        Assertions.assertTrue(settings.getUseThreading());
    }

    @Test
    void testBuilder()
    {
        final List<CopulaFamily> families = new ArrayList<>(Arrays.asList(CopulaFamily.FRANK,
                CopulaFamily.STUDENT_T));

        final HelmSettings settings = HelmSettings.getDefault().makeBuilder()
                .setGridResolution(6)
                .setCandidateFamilies(families)
                .setExclusionThreshold(-0.1)
                .setZeroMassFloor(1.0e-9)
                .setStudentTDegreesOfFreedom(7)
                .setUseThreading(false)
                .build();

        Assertions.assertEquals(6, settings.getGridResolution());
        Assertions.assertEquals(families, settings.getCandidateFamilies());
        Assertions.assertEquals(-0.1, settings.getExclusionThreshold());
        Assertions.assertEquals(1.0e-9, settings.getZeroMassFloor());
        Assertions.assertEquals(7, settings.getStudentTDegreesOfFreedom());
        Assertions.assertFalse(settings.getUseThreading());

        // The settings keep their own copy.
        families.clear();
        Assertions.assertEquals(2, settings.getCandidateFamilies().size());
        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> settings.getCandidateFamilies().add(CopulaFamily.GUMBEL));

        // The default is untouched.
        Assertions.assertEquals(4, HelmSettings.getDefault().getGridResolution());
    }

    @Test
    void testValidation()
    {
        final HelmSettings.HelmSettingsBuilder builder = new HelmSettings.HelmSettingsBuilder();

        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.setGridResolution(0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.setExclusionThreshold(0.1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.setZeroMassFloor(0.0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.setStudentTDegreesOfFreedom(0));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> builder.setCandidateFamilies(Collections.<CopulaFamily>emptyList()));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> builder.setCandidateFamilies(Arrays.asList(CopulaFamily.FRANK, CopulaFamily.FRANK)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.setCandidateFamilies(null));
    }

}
