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

import edu.columbia.tjw.helm.copula.CopulaFamily;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The outcome of a family selection: the chosen family, its native parameter
 * and the estimated Kendall's tau, along with the divergence of every
 * candidate. When every candidate was excluded there is no family, see
 * hasFamily().
 *
 * @author tyler
 */
public final class SelectionResult
{
    private final CopulaFamily _family;
    private final double _nativeParameter;
    private final double _tauHat;
    private final Map<CopulaFamily, Double> _divergences;

    public SelectionResult(final CopulaFamily family_, final double nativeParameter_, final double tauHat_,
            final Map<CopulaFamily, Double> divergences_)
    {
        if (null == family_)
        {
            throw new NullPointerException("Family cannot be null, use noAdmissibleFamily instead.");
        }

        _family = family_;
        _nativeParameter = nativeParameter_;
        _tauHat = tauHat_;
        _divergences = copy(divergences_);
    }

    private SelectionResult(final double tauHat_, final Map<CopulaFamily, Double> divergences_)
    {
        _family = null;
        _nativeParameter = Double.NaN;
        _tauHat = tauHat_;
        _divergences = copy(divergences_);
    }

    public static SelectionResult noAdmissibleFamily(final double tauHat_,
            final Map<CopulaFamily, Double> divergences_)
    {
        return new SelectionResult(tauHat_, divergences_);
    }

    private static Map<CopulaFamily, Double> copy(final Map<CopulaFamily, Double> divergences_)
    {
        final Map<CopulaFamily, Double> output = new EnumMap<>(CopulaFamily.class);
        output.putAll(divergences_);
        return Collections.unmodifiableMap(output);
    }

    public boolean hasFamily()
    {
        return null != _family;
    }

    /**
     * @return The selected family, or null if no candidate was admissible
     */
    public CopulaFamily getFamily()
    {
        return _family;
    }

    /**
     * @return The native parameter of the selected family, NaN if none
     */
    public double getNativeParameter()
    {
        return _nativeParameter;
    }

    public double getTauHat()
    {
        return _tauHat;
    }

    public Map<CopulaFamily, Double> getDivergences()
    {
        return _divergences;
    }

    public double getDivergence(final CopulaFamily family_)
    {
        final Double output = _divergences.get(family_);

        if (null == output)
        {
            throw new IllegalArgumentException("Family was not a candidate: " + family_);
        }

        return output;
    }

    @Override
    public String toString()
    {
        if (!hasFamily())
        {
            return "SelectionResult[no admissible family, tau=" + _tauHat + ", " + _divergences + "]";
        }

        return "SelectionResult[" + _family + ", parameter=" + _nativeParameter + ", tau=" + _tauHat + ", "
                + _divergences + "]";
    }

}
