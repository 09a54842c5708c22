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
package edu.columbia.tjw.helm.copula;

import java.util.Objects;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * The dependency handed to a copula family: either a rank correlation
 * (Kendall or Spearman), or the family's native parameter.
 *
 * Native parameters are a scalar theta for Clayton, Frank and Gumbel, and a
 * 2 x 2 correlation matrix (or just its off diagonal entry) for the Gaussian
 * and Student-t families. The Student-t family also needs the degrees of
 * freedom, whichever kind of dependency is given.
 *
 * @author tyler
 */
public final class DependencySpec
{
    private static final double SYMMETRY_TOLERANCE = 1.0e-12;

    private final DependencyKind _kind;
    private final double _value;
    private final int _degreesOfFreedom;

    private DependencySpec(final DependencyKind kind_, final double value_, final int degreesOfFreedom_)
    {
        if (Double.isNaN(value_) || Double.isInfinite(value_))
        {
            throw new IllegalArgumentException("Dependency value must be finite: " + value_);
        }
        if (degreesOfFreedom_ < 0)
        {
            throw new IllegalArgumentException("Degrees of freedom must be non-negative: " + degreesOfFreedom_);
        }

        _kind = kind_;
        _value = value_;
        _degreesOfFreedom = degreesOfFreedom_;
    }

    public static DependencySpec kendall(final double tau_)
    {
        return kendall(tau_, 0);
    }

    public static DependencySpec kendall(final double tau_, final int degreesOfFreedom_)
    {
        return new DependencySpec(DependencyKind.KENDALL, tau_, degreesOfFreedom_);
    }

    public static DependencySpec spearman(final double rho_)
    {
        return spearman(rho_, 0);
    }

    public static DependencySpec spearman(final double rho_, final int degreesOfFreedom_)
    {
        return new DependencySpec(DependencyKind.SPEARMAN, rho_, degreesOfFreedom_);
    }

    /**
     * @param parameter_ theta for Clayton, Frank and Gumbel, the correlation
     * for Gaussian
     * @return A native dependency specification
     */
    public static DependencySpec nativeParameter(final double parameter_)
    {
        return new DependencySpec(DependencyKind.NATIVE, parameter_, 0);
    }

    public static DependencySpec nativeCorrelation(final RealMatrix correlation_)
    {
        return nativeCorrelation(correlation_, 0);
    }

    /**
     * @param correlation_ A 2 x 2 symmetric matrix with a unit diagonal
     * @param degreesOfFreedom_ The degrees of freedom (Student-t only, 0
     * otherwise)
     * @return A native dependency specification
     */
    public static DependencySpec nativeCorrelation(final RealMatrix correlation_, final int degreesOfFreedom_)
    {
        return new DependencySpec(DependencyKind.NATIVE, extractCorrelation(correlation_), degreesOfFreedom_);
    }

    private static double extractCorrelation(final RealMatrix correlation_)
    {
        if (correlation_.getRowDimension() != 2 || correlation_.getColumnDimension() != 2)
        {
            throw new IllegalArgumentException("Only bivariate correlation matrices are supported, got "
                    + correlation_.getRowDimension() + " x " + correlation_.getColumnDimension());
        }
        if (correlation_.getEntry(0, 0) != 1.0 || correlation_.getEntry(1, 1) != 1.0)
        {
            throw new IllegalArgumentException("Correlation matrix must have a unit diagonal: " + correlation_);
        }
        if (!MatrixUtils.isSymmetric(correlation_, SYMMETRY_TOLERANCE))
        {
            throw new IllegalArgumentException("Correlation matrix must be symmetric: " + correlation_);
        }

        return correlation_.getEntry(0, 1);
    }

    public DependencyKind getKind()
    {
        return _kind;
    }

    /**
     * @return tau, rho, theta, or the off diagonal correlation, depending on
     * getKind() and the family
     */
    public double getValue()
    {
        return _value;
    }

    /**
     * @return The Student-t degrees of freedom, or 0 if none were given
     */
    public int getDegreesOfFreedom()
    {
        return _degreesOfFreedom;
    }

    @Override
    public boolean equals(final Object obj_)
    {
        if (this == obj_)
        {
            return true;
        }
        if (!(obj_ instanceof DependencySpec))
        {
            return false;
        }

        final DependencySpec that = (DependencySpec) obj_;
        return _kind == that._kind && Double.compare(_value, that._value) == 0
                && _degreesOfFreedom == that._degreesOfFreedom;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(_kind, _value, _degreesOfFreedom);
    }

    @Override
    public String toString()
    {
        return "DependencySpec[" + _kind + ", " + _value + ", dof=" + _degreesOfFreedom + "]";
    }

}
