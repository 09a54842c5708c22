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
package edu.columbia.tjw.helm.select;

import edu.columbia.tjw.helm.HelmSettings;
import edu.columbia.tjw.helm.copula.CopulaFamily;
import edu.columbia.tjw.helm.copula.DependencyConverter;
import edu.columbia.tjw.helm.copula.DependencyKind;
import edu.columbia.tjw.helm.copula.DependencySpec;
import edu.columbia.tjw.helm.data.SampleMatrix;
import edu.columbia.tjw.helm.signature.EmpiricalSignatureEstimator;
import edu.columbia.tjw.helm.signature.MultinomialSignature;
import edu.columbia.tjw.helm.signature.SignatureCalculator;
import edu.columbia.tjw.helm.stat.DependencyEstimator;
import edu.columbia.tjw.helm.stat.KendallsTauEstimator;
import edu.columbia.tjw.helm.util.LogUtil;
import edu.columbia.tjw.helm.util.MathFunctions;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Chooses the copula family whose multinomial signature is closest, in
 * Kullback-Leibler divergence, to the empirical signature of the first two
 * columns of a sample.
 *
 * Every candidate is evaluated at the estimated Kendall's tau. Families that
 * can only express non-negative dependence are excluded when tau is clearly
 * negative (below the exclusion threshold), evaluated at independence when
 * tau is slightly negative, and evaluated just below one when tau is one. The
 * parameter of the winning family is inverted from the estimated tau itself.
 *
 * @author tyler
 */
public final class FamilySelector
{
    private static final Logger LOG = LogUtil.getLogger(FamilySelector.class);

    private final HelmSettings _settings;
    private final SignatureCalculator _calculator;
    private final EmpiricalSignatureEstimator _empirical;
    private final DependencyEstimator _tauEstimator;

    public FamilySelector()
    {
        this(HelmSettings.getDefault());
    }

    public FamilySelector(final HelmSettings settings_)
    {
        this(settings_, new SignatureCalculator(), new EmpiricalSignatureEstimator(),
                KendallsTauEstimator.singleton());
    }

    public FamilySelector(final HelmSettings settings_, final SignatureCalculator calculator_,
            final EmpiricalSignatureEstimator empirical_, final DependencyEstimator tauEstimator_)
    {
        if (null == settings_ || null == calculator_ || null == empirical_ || null == tauEstimator_)
        {
            throw new NullPointerException("Selector components cannot be null.");
        }

        _settings = settings_;
        _calculator = calculator_;
        _empirical = empirical_;
        _tauEstimator = tauEstimator_;
    }

    public HelmSettings getSettings()
    {
        return _settings;
    }

    /**
     * Selects among the configured candidate families at the configured grid
     * resolution.
     *
     * @param samples_ The raw sample, at least two columns
     * @return The selection result
     */
    public SelectionResult selectFamily(final SampleMatrix samples_)
    {
        return selectFamily(samples_, _settings.getGridResolution(), _settings.getCandidateFamilies());
    }

    /**
     * @param samples_ The raw sample, only the first two columns are used
     * @param resolution_ The number of grid cells along each axis (K)
     * @param candidates_ The candidate families, earlier entries win ties
     * @return The selection result, possibly in the "no admissible family"
     * state
     */
    public SelectionResult selectFamily(final SampleMatrix samples_, final int resolution_,
            final List<CopulaFamily> candidates_)
    {
        if (resolution_ < 1)
        {
            throw new IllegalArgumentException("Grid resolution must be positive: " + resolution_);
        }

        HelmSettings.checkFamilies(candidates_);

        final double tauHat = _tauEstimator.estimate(samples_);
        final MultinomialSignature empirical = _empirical.estimate(samples_, resolution_, 0, 1).getSignature()
                .withFloor(_settings.getZeroMassFloor());

        LOG.info("Selecting among " + candidates_ + " with K = " + resolution_ + ", tau = " + tauHat);

        final Map<CopulaFamily, Double> divergences = new EnumMap<>(CopulaFamily.class);
        CopulaFamily best = null;
        double bestDivergence = Double.POSITIVE_INFINITY;

        for (final CopulaFamily family : candidates_)
        {
            final double divergence = computeDivergence(family, tauHat, resolution_, empirical);
            divergences.put(family, divergence);

            LOG.fine("Divergence of " + family + ": " + divergence);

            if (divergence < bestDivergence)
            {
                best = family;
                bestDivergence = divergence;
            }
        }

        if (null == best)
        {
            LOG.warning("No admissible family among " + candidates_ + " for tau = " + tauHat);
            return SelectionResult.noAdmissibleFamily(tauHat, divergences);
        }

        final double parameter = invert(best, tauHat);
        final SelectionResult output = new SelectionResult(best, parameter, tauHat, divergences);
        LOG.info("Selected: " + output);
        return output;
    }

    private double computeDivergence(final CopulaFamily family_, final double tauHat_, final int resolution_,
            final MultinomialSignature empirical_)
    {
        final double tau = evaluationTau(family_, tauHat_);

        if (Double.isNaN(tau))
        {
            return Double.POSITIVE_INFINITY;
        }

        final MultinomialSignature theoretical = _calculator.signature(family_, makeDependency(family_, tau),
                resolution_).withFloor(_settings.getZeroMassFloor());

        return KullbackLeibler.divergence(theoretical, empirical_);
    }

    /**
     * @return The tau at which family_ is evaluated, or NaN if the family is
     * excluded
     */
    private double evaluationTau(final CopulaFamily family_, final double tauHat_)
    {
        if (!family_.isNonNegativeDependenceOnly())
        {
            return tauHat_;
        }
        if (tauHat_ < _settings.getExclusionThreshold())
        {
            LOG.fine("Excluding " + family_ + ", tau = " + tauHat_ + " is below "
                    + _settings.getExclusionThreshold());
            return Double.NaN;
        }
        if (tauHat_ < 0.0)
        {
            return 0.0;
        }
        if (tauHat_ >= 1.0)
        {
            return 1.0 - MathFunctions.EPSILON;
        }

        return tauHat_;
    }

    private DependencySpec makeDependency(final CopulaFamily family_, final double tau_)
    {
        if (family_ == CopulaFamily.STUDENT_T)
        {
            return DependencySpec.kendall(tau_, _settings.getStudentTDegreesOfFreedom());
        }

        return DependencySpec.kendall(tau_);
    }

    private double invert(final CopulaFamily family_, final double tauHat_)
    {
        try
        {
            return DependencyConverter.toNative(family_, DependencyKind.KENDALL, tauHat_);
        }
        catch (final IllegalArgumentException e)
        {
            // The winner was evaluated at a clamped tau that it can represent.
            final double clamped = evaluationTau(family_, tauHat_);
            LOG.warning("Tau = " + tauHat_ + " is outside the range of " + family_ + ", inverting " + clamped
                    + " instead: " + e.getMessage());
            return DependencyConverter.toNative(family_, DependencyKind.KENDALL, clamped);
        }
    }

}
