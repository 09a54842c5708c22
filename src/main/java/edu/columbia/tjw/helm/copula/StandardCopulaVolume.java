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

import edu.columbia.tjw.helm.grid.GridPoint;

/**
 * Inclusion-exclusion over the copula CDF:
 * C(u2, v2) - C(u2, v1) - C(u1, v2) + C(u1, v1).
 *
 * @author tyler
 */
public final class StandardCopulaVolume implements CopulaVolume
{
    private static final StandardCopulaVolume SINGLETON = new StandardCopulaVolume();

    public static StandardCopulaVolume singleton()
    {
        return SINGLETON;
    }

    private StandardCopulaVolume()
    {
    }

    @Override
    public double volume(final CopulaFamily family_, final GridPoint u1v1_, final GridPoint u1v2_,
            final GridPoint u2v1_, final GridPoint u2v2_, final DependencySpec dependency_)
    {
        final BivariateCopula copula = CopulaFactory.create(family_, dependency_);
        return volume(copula, u1v1_, u1v2_, u2v1_, u2v2_);
    }

    @Override
    public CellVolume bind(final CopulaFamily family_, final DependencySpec dependency_)
    {
        final BivariateCopula copula = CopulaFactory.create(family_, dependency_);
        return (cell) -> volume(copula, cell.getLowerLeft(), cell.getUpperLeft(), cell.getLowerRight(),
                cell.getUpperRight());
    }

    /**
     * @param copula_ An already parameterized copula
     * @param u1v1_ Lower left corner
     * @param u1v2_ Upper left corner
     * @param u2v1_ Lower right corner
     * @param u2v2_ Upper right corner
     * @return The mass of copula_ inside the rectangle
     */
    public static double volume(final BivariateCopula copula_, final GridPoint u1v1_, final GridPoint u1v2_,
            final GridPoint u2v1_, final GridPoint u2v2_)
    {
        final double upperRight = copula_.cdf(u2v2_.getU(), u2v2_.getV());
        final double lowerRight = copula_.cdf(u2v1_.getU(), u2v1_.getV());
        final double upperLeft = copula_.cdf(u1v2_.getU(), u1v2_.getV());
        final double lowerLeft = copula_.cdf(u1v1_.getU(), u1v1_.getV());

        final double mass = upperRight - lowerRight - upperLeft + lowerLeft;

        // Rounding can produce tiny negative masses in near-empty cells.
        return Math.max(0.0, mass);
    }

}
