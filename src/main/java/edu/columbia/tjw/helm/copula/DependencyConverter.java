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

import edu.columbia.tjw.helm.util.LogUtil;
import edu.columbia.tjw.helm.util.MathFunctions;
import java.util.logging.Logger;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegrator;
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegratorFactory;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.analysis.solvers.UnivariateSolver;
import org.apache.commons.math3.util.FastMath;

/**
 * Converts between rank correlations (Kendall's tau, Spearman's rho) and the
 * native parameter of each family, in both directions.
 *
 * Closed forms are used where they exist. Frank goes through the Debye
 * functions, and Spearman's rho for Clayton and Gumbel is integrated
 * numerically (rho_S = 12 * int int C(u, v) du dv - 3). Inverses without a
 * closed form are found with a Brent solver. Targets a family cannot reach
 * within its solver bracket are saturated at the edge of the bracket, with a
 * warning.
 *
 * @author tyler
 */
public final class DependencyConverter
{
    private static final Logger LOG = LogUtil.getLogger(DependencyConverter.class);

    private static final double SOLVER_ACCURACY = 1.0e-12;
    private static final int SOLVER_MAX_EVAL = 1000;

    // Upper ends of the solver brackets for theta.
    private static final double FRANK_MAX_THETA = 1.0e4;
    private static final double CLAYTON_MAX_THETA = 1.0e3;
    private static final double GUMBEL_MAX_THETA = 1.0e3;

    // Below this |theta| the Frank formulas cancel badly, use their series.
    private static final double FRANK_SERIES_LIMIT = 1.0e-4;

    private static final int SPEARMAN_POINTS = 48;
    private static final GaussIntegrator SPEARMAN_RULE = new GaussIntegratorFactory()
            .legendreHighPrecision(SPEARMAN_POINTS, 0.0, 1.0);

    private DependencyConverter()
    {
    }

    /**
     * Computes the native parameter of family_ corresponding to the given
     * dependency.
     *
     * @param family_ The copula family
     * @param kind_ How value_ is expressed
     * @param value_ tau, rho or the native parameter itself
     * @return theta for Clayton, Frank and Gumbel, the correlation for
     * Gaussian and Student-t
     * @throws IllegalArgumentException if value_ is outside the range of the
     * family
     */
    public static double toNative(final CopulaFamily family_, final DependencyKind kind_, final double value_)
    {
        switch (kind_)
        {
            case NATIVE:
                return value_;
            case KENDALL:
                checkRankCorrelation(value_);
                return kendallToNative(family_, value_);
            case SPEARMAN:
                checkRankCorrelation(value_);
                return spearmanToNative(family_, value_);
            default:
                throw new IllegalArgumentException("Unknown dependency kind: " + kind_);
        }
    }

    /**
     * Computes the given rank correlation of family_ at its native parameter.
     *
     * @param family_ The copula family
     * @param kind_ The measure to compute
     * @param parameter_ The native parameter
     * @return The requested dependency measure
     */
    public static double fromNative(final CopulaFamily family_, final DependencyKind kind_, final double parameter_)
    {
        switch (kind_)
        {
            case NATIVE:
                return parameter_;
            case KENDALL:
                return nativeToKendall(family_, parameter_);
            case SPEARMAN:
                return nativeToSpearman(family_, parameter_);
            default:
                throw new IllegalArgumentException("Unknown dependency kind: " + kind_);
        }
    }

    private static void checkRankCorrelation(final double value_)
    {
        if (!(value_ >= -1.0 && value_ <= 1.0))
        {
            throw new IllegalArgumentException("Rank correlation must be in [-1, 1]: " + value_);
        }
    }

    private static double kendallToNative(final CopulaFamily family_, final double tau_)
    {
        switch (family_)
        {
            case GAUSSIAN:
            case STUDENT_T:
                return FastMath.sin(Math.PI * tau_ / 2.0);
            case CLAYTON:
                if (tau_ >= 1.0)
                {
                    throw new IllegalArgumentException("Clayton requires tau < 1: " + tau_);
                }

                return 2.0 * tau_ / (1.0 - tau_);
            case GUMBEL:
                if (!(tau_ >= 0.0 && tau_ < 1.0))
                {
                    throw new IllegalArgumentException("Gumbel requires tau in [0, 1): " + tau_);
                }

                return 1.0 / (1.0 - tau_);
            case FRANK:
                return solveOdd(tau_, (theta) -> frankKendall(theta), FRANK_MAX_THETA, family_);
            default:
                throw new IllegalArgumentException("Unknown family: " + family_);
        }
    }

    private static double spearmanToNative(final CopulaFamily family_, final double rho_)
    {
        switch (family_)
        {
            case GAUSSIAN:
            case STUDENT_T:
                return 2.0 * FastMath.sin(Math.PI * rho_ / 6.0);
            case FRANK:
                return solveOdd(rho_, (theta) -> frankSpearman(theta), FRANK_MAX_THETA, family_);
            case CLAYTON:
                if (rho_ == 0.0)
                {
                    return 0.0;
                }

                return solve(rho_, (theta) -> numericSpearman(new ClaytonCopula(theta)), -1.0, CLAYTON_MAX_THETA,
                        family_);
            case GUMBEL:
                if (rho_ < 0.0)
                {
                    throw new IllegalArgumentException("Gumbel requires a non-negative Spearman's rho: " + rho_);
                }
                if (rho_ == 0.0)
                {
                    return 1.0;
                }

                return solve(rho_, (theta) -> numericSpearman(new GumbelCopula(theta)), 1.0, GUMBEL_MAX_THETA,
                        family_);
            default:
                throw new IllegalArgumentException("Unknown family: " + family_);
        }
    }

    private static double nativeToKendall(final CopulaFamily family_, final double parameter_)
    {
        switch (family_)
        {
            case GAUSSIAN:
            case STUDENT_T:
                return 2.0 * FastMath.asin(parameter_) / Math.PI;
            case CLAYTON:
                return parameter_ / (parameter_ + 2.0);
            case GUMBEL:
                return 1.0 - 1.0 / parameter_;
            case FRANK:
                return frankKendall(parameter_);
            default:
                throw new IllegalArgumentException("Unknown family: " + family_);
        }
    }

    private static double nativeToSpearman(final CopulaFamily family_, final double parameter_)
    {
        switch (family_)
        {
            case GAUSSIAN:
            case STUDENT_T:
                return 6.0 * FastMath.asin(parameter_ / 2.0) / Math.PI;
            case CLAYTON:
                return numericSpearman(new ClaytonCopula(parameter_));
            case GUMBEL:
                return numericSpearman(new GumbelCopula(parameter_));
            case FRANK:
                return frankSpearman(parameter_);
            default:
                throw new IllegalArgumentException("Unknown family: " + family_);
        }
    }

    /**
     * tau(theta) = 1 - 4 / theta * (1 - D_1(theta)), odd in theta.
     */
    private static double frankKendall(final double theta_)
    {
        final double abs = Math.abs(theta_);

        if (abs < FRANK_SERIES_LIMIT)
        {
            return theta_ / 9.0;
        }

        final double tau = 1.0 - (4.0 / abs) * (1.0 - MathFunctions.debye(1, abs));
        return Math.copySign(tau, theta_);
    }

    /**
     * rho_S(theta) = 1 - 12 / theta * (D_1(theta) - D_2(theta)), odd in theta.
     */
    private static double frankSpearman(final double theta_)
    {
        final double abs = Math.abs(theta_);

        if (abs < FRANK_SERIES_LIMIT)
        {
            return theta_ / 6.0;
        }

        final double rho = 1.0 - (12.0 / abs) * (MathFunctions.debye(1, abs) - MathFunctions.debye(2, abs));
        return Math.copySign(rho, theta_);
    }

    private static double numericSpearman(final BivariateCopula copula_)
    {
        final UnivariateFunction outer = (u) ->
        {
            final UnivariateFunction inner = (v) -> copula_.cdf(u, v);
            return SPEARMAN_RULE.integrate(inner);
        };

        final double integral = SPEARMAN_RULE.integrate(outer);
        return 12.0 * integral - 3.0;
    }

    /**
     * Inverts an odd, increasing function of theta, solving on [0, max_] for
     * |target_|.
     */
    private static double solveOdd(final double target_, final UnivariateFunction forward_, final double max_,
            final CopulaFamily family_)
    {
        if (target_ == 0.0)
        {
            return 0.0;
        }

        final double abs = solve(Math.abs(target_), forward_, 0.0, max_, family_);
        return Math.copySign(abs, target_);
    }

    private static double solve(final double target_, final UnivariateFunction forward_, final double min_,
            final double max_, final CopulaFamily family_)
    {
        final double low = forward_.value(min_);
        final double high = forward_.value(max_);

        if (target_ <= low)
        {
            LOG.warning("Dependency " + target_ + " is below the reach of " + family_ + ", using theta = " + min_);
            return min_;
        }
        if (target_ >= high)
        {
            LOG.warning("Dependency " + target_ + " is beyond the reach of " + family_ + ", using theta = " + max_);
            return max_;
        }

        final UnivariateFunction diff = (theta) -> forward_.value(theta) - target_;
        final UnivariateSolver solver = new BrentSolver(SOLVER_ACCURACY);
        return solver.solve(SOLVER_MAX_EVAL, diff, min_, max_);
    }

}
