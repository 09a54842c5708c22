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

import edu.columbia.tjw.helm.grid.GridCell;
import edu.columbia.tjw.helm.grid.GridPoint;

/**
 * The C-volume: the probability mass a copula family places inside an axis
 * aligned rectangle.
 *
 * @author tyler
 */
public interface CopulaVolume
{
    /**
     * @param family_ The copula family
     * @param u1v1_ Lower left corner
     * @param u1v2_ Upper left corner
     * @param u2v1_ Lower right corner
     * @param u2v2_ Upper right corner
     * @param dependency_ The dependency of the copula
     * @return The probability mass inside the rectangle, in [0, 1]
     */
    double volume(final CopulaFamily family_, final GridPoint u1v1_, final GridPoint u1v2_,
            final GridPoint u2v1_, final GridPoint u2v2_, final DependencySpec dependency_);

    /**
     * Fixes the family and dependency, for repeated evaluation over the cells
     * of a grid. Implementations should override this when building the
     * copula is expensive.
     *
     * @param family_ The copula family
     * @param dependency_ The dependency of the copula
     * @return A function from grid cell to mass
     */
    default CellVolume bind(final CopulaFamily family_, final DependencySpec dependency_)
    {
        return (cell) -> volume(family_, cell.getLowerLeft(), cell.getUpperLeft(), cell.getLowerRight(),
                cell.getUpperRight(), dependency_);
    }

    /**
     * The volume of a single family and dependency, as a function of the cell.
     */
    interface CellVolume
    {
        double volume(final GridCell cell_);
    }
}
