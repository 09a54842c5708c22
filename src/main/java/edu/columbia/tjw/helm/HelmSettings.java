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
package edu.columbia.tjw.helm;

import edu.columbia.tjw.helm.copula.CopulaFamily;
import edu.columbia.tjw.helm.util.MathFunctions;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 *
 * Settings that control how signatures are computed and families selected.
 *
 * All the members are final so that this thing is threadsafe. Use the builder
 * to make adjusted versions of this class.
 *
 * @author tyler
 */
public final class HelmSettings implements Serializable
{
    private static final long serialVersionUID = 0x5d1c0e2a7f4b93e1L;

    private static final int DEFAULT_GRID_RESOLUTION = 4;
    private static final double DEFAULT_EXCLUSION_THRESHOLD = -0.05;
    private static final double DEFAULT_ZERO_MASS_FLOOR = MathFunctions.EPSILON;
    private static final int DEFAULT_STUDENT_T_DOF = 4;
    private static final boolean DEFAULT_USE_THREADING = true;
    private static final List<CopulaFamily> DEFAULT_FAMILIES = Collections.unmodifiableList(
            CopulaFamily.fromNames("Gaussian", "Clayton", "Gumbel", "Frank"));

    private static final HelmSettings DEFAULT = new HelmSettings();

    private final int _gridResolution;
    private final List<CopulaFamily> _candidateFamilies;

    // Estimated tau below this excludes the non-negative-only families. Between
    // this and zero, those families are evaluated at tau = 0.
    private final double _exclusionThreshold;

    // Replacement for zero cell masses before any log or ratio is taken.
    private final double _zeroMassFloor;

    // Used whenever a Student-t signature is requested from a rank correlation.
    private final int _studentTDegreesOfFreedom;

    private final boolean _useThreading;

    public HelmSettings()
    {
        _gridResolution = DEFAULT_GRID_RESOLUTION;
        _candidateFamilies = DEFAULT_FAMILIES;
        _exclusionThreshold = DEFAULT_EXCLUSION_THRESHOLD;
        _zeroMassFloor = DEFAULT_ZERO_MASS_FLOOR;
        _studentTDegreesOfFreedom = DEFAULT_STUDENT_T_DOF;
        _useThreading = DEFAULT_USE_THREADING;
    }

    public HelmSettings(final HelmSettingsBuilder builder_)
    {
        _gridResolution = builder_.getGridResolution();
        _candidateFamilies = Collections.unmodifiableList(new ArrayList<>(builder_.getCandidateFamilies()));
        _exclusionThreshold = builder_.getExclusionThreshold();
        _zeroMassFloor = builder_.getZeroMassFloor();
        _studentTDegreesOfFreedom = builder_.getStudentTDegreesOfFreedom();
        _useThreading = builder_.isUseThreading();
    }

    public static HelmSettings getDefault()
    {
        return DEFAULT;
    }

    public int getGridResolution()
    {
        return _gridResolution;
    }

    public List<CopulaFamily> getCandidateFamilies()
    {
        return _candidateFamilies;
    }

    public double getExclusionThreshold()
    {
        return _exclusionThreshold;
    }

    public double getZeroMassFloor()
    {
        return _zeroMassFloor;
    }

    public int getStudentTDegreesOfFreedom()
    {
        return _studentTDegreesOfFreedom;
    }

    public boolean getUseThreading()
    {
        return _useThreading;
    }

    public HelmSettingsBuilder makeBuilder()
    {
        return new HelmSettingsBuilder(this);
    }

    @Override
    public String toString()
    {
        return "HelmSettings[K=" + _gridResolution + ", families=" + _candidateFamilies + ", exclusion="
                + _exclusionThreshold + ", floor=" + _zeroMassFloor + ", dof=" + _studentTDegreesOfFreedom
                + ", threading=" + _useThreading + "]";
    }

    public static final class HelmSettingsBuilder
    {
        private int _gridResolution;
        private List<CopulaFamily> _candidateFamilies;
        private double _exclusionThreshold;
        private double _zeroMassFloor;
        private int _studentTDegreesOfFreedom;
        private boolean _useThreading;

        public HelmSettingsBuilder()
        {
            this(DEFAULT);
        }

        public HelmSettingsBuilder(final HelmSettings base_)
        {
            _gridResolution = base_.getGridResolution();
            _candidateFamilies = base_.getCandidateFamilies();
            _exclusionThreshold = base_.getExclusionThreshold();
            _zeroMassFloor = base_.getZeroMassFloor();
            _studentTDegreesOfFreedom = base_.getStudentTDegreesOfFreedom();
            _useThreading = base_.getUseThreading();
        }

        public HelmSettings build()
        {
            return new HelmSettings(this);
        }

        public int getGridResolution()
        {
            return _gridResolution;
        }

        public List<CopulaFamily> getCandidateFamilies()
        {
            return _candidateFamilies;
        }

        public double getExclusionThreshold()
        {
            return _exclusionThreshold;
        }

        public double getZeroMassFloor()
        {
            return _zeroMassFloor;
        }

        public int getStudentTDegreesOfFreedom()
        {
            return _studentTDegreesOfFreedom;
        }

        public boolean isUseThreading()
        {
            return _useThreading;
        }

        public HelmSettingsBuilder setGridResolution(final int gridResolution_)
        {
            if (gridResolution_ < 1)
            {
                throw new IllegalArgumentException("Grid resolution must be positive: " + gridResolution_);
            }

            _gridResolution = gridResolution_;
            return this;
        }

        public HelmSettingsBuilder setCandidateFamilies(final List<CopulaFamily> candidateFamilies_)
        {
            checkFamilies(candidateFamilies_);
            _candidateFamilies = new ArrayList<>(candidateFamilies_);
            return this;
        }

        public HelmSettingsBuilder setExclusionThreshold(final double exclusionThreshold_)
        {
            if (!(exclusionThreshold_ <= 0.0 && exclusionThreshold_ >= -1.0))
            {
                throw new IllegalArgumentException("Exclusion threshold must be in [-1, 0]: " + exclusionThreshold_);
            }

            _exclusionThreshold = exclusionThreshold_;
            return this;
        }

        public HelmSettingsBuilder setZeroMassFloor(final double zeroMassFloor_)
        {
            if (!(zeroMassFloor_ > 0.0 && zeroMassFloor_ < 1.0))
            {
                throw new IllegalArgumentException("Zero mass floor must be in (0, 1): " + zeroMassFloor_);
            }

            _zeroMassFloor = zeroMassFloor_;
            return this;
        }

        public HelmSettingsBuilder setStudentTDegreesOfFreedom(final int studentTDegreesOfFreedom_)
        {
            if (studentTDegreesOfFreedom_ < 1)
            {
                throw new IllegalArgumentException("Degrees of freedom must be positive: "
                        + studentTDegreesOfFreedom_);
            }

            _studentTDegreesOfFreedom = studentTDegreesOfFreedom_;
            return this;
        }

        public HelmSettingsBuilder setUseThreading(final boolean useThreading_)
        {
            _useThreading = useThreading_;
            return this;
        }

    }

    /**
     * Rejects null, empty, or duplicated candidate lists.
     *
     * @param families_ The candidate families, in priority order
     */
    public static void checkFamilies(final List<CopulaFamily> families_)
    {
        if (null == families_)
        {
            throw new IllegalArgumentException("Candidate families cannot be null.");
        }
        if (families_.isEmpty())
        {
            throw new IllegalArgumentException("At least one candidate family is required.");
        }

        final Set<CopulaFamily> seen = EnumSet.noneOf(CopulaFamily.class);

        for (final CopulaFamily next : families_)
        {
            if (null == next)
            {
                throw new IllegalArgumentException("Candidate families cannot contain null.");
            }
            if (!seen.add(next))
            {
                throw new IllegalArgumentException("Duplicate candidate family: " + next);
            }
        }
    }

}
