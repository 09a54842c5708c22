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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The supported bivariate copula families.
 *
 * @author tyler
 */
public enum CopulaFamily
{
    GAUSSIAN("Gaussian", false),
    STUDENT_T("T", false),
    CLAYTON("Clayton", true),
    FRANK("Frank", false),
    GUMBEL("Gumbel", true);

    private final String _label;
    private final boolean _positiveOnly;

    private CopulaFamily(final String label_, final boolean positiveOnly_)
    {
        _label = label_;
        _positiveOnly = positiveOnly_;
    }

    /**
     * @return The short display name, e.g. "Gaussian" or "T"
     */
    public String getLabel()
    {
        return _label;
    }

    /**
     * Families whose parameter can only express non-negative concordance
     * (Kendall's tau in [0, 1)) for the purposes of family selection.
     *
     * @return True if negative tau values are inadmissible for this family
     */
    public boolean isNonNegativeDependenceOnly()
    {
        return _positiveOnly;
    }

    /**
     * Case insensitive lookup, accepting both the labels ("Gaussian", "T",
     * "Clayton", "Frank", "Gumbel") and the enum names.
     *
     * @param name_ The name to look up
     * @return The matching family
     * @throws IllegalArgumentException if no family matches
     */
    public static CopulaFamily fromName(final String name_)
    {
        if (null == name_)
        {
            throw new NullPointerException("Family name cannot be null.");
        }

        final String trimmed = name_.trim();

        for (final CopulaFamily next : values())
        {
            if (next._label.equalsIgnoreCase(trimmed) || next.name().equalsIgnoreCase(trimmed))
            {
                return next;
            }
        }

        if ("student-t".equals(trimmed.toLowerCase(Locale.ROOT)))
        {
            return STUDENT_T;
        }

        throw new IllegalArgumentException("Unknown copula family: '" + name_ + "'");
    }

    public static List<CopulaFamily> fromNames(final String... names_)
    {
        final List<CopulaFamily> output = new ArrayList<>(names_.length);

        for (final String next : names_)
        {
            output.add(fromName(next));
        }

        return Collections.unmodifiableList(output);
    }

    @Override
    public String toString()
    {
        return _label;
    }

}
