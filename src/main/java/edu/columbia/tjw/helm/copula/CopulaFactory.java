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

/**
 * Builds a parameterized copula from a family and a dependency specification.
 *
 * @author tyler
 */
public final class CopulaFactory
{
    private CopulaFactory()
    {
    }

    /**
     * @param family_ The family to build
     * @param dependency_ The dependency, in any supported form
     * @return The matching copula
     * @throws IllegalArgumentException if the dependency is out of range for
     * the family, or a Student-t copula is requested without degrees of freedom
     */
    public static BivariateCopula create(final CopulaFamily family_, final DependencySpec dependency_)
    {
        if (null == family_)
        {
            throw new NullPointerException("Family cannot be null.");
        }
        if (null == dependency_)
        {
            throw new NullPointerException("Dependency cannot be null.");
        }

        final double parameter = DependencyConverter.toNative(family_, dependency_.getKind(),
                dependency_.getValue());

        switch (family_)
        {
            case GAUSSIAN:
                return new GaussianCopula(parameter);
            case STUDENT_T:
                if (dependency_.getDegreesOfFreedom() < 1)
                {
                    throw new IllegalArgumentException("Student-t copula requires positive degrees of freedom: "
                            + dependency_);
                }

                return new StudentTCopula(parameter, dependency_.getDegreesOfFreedom());
            case CLAYTON:
                return new ClaytonCopula(parameter);
            case FRANK:
                return new FrankCopula(parameter);
            case GUMBEL:
                return new GumbelCopula(parameter);
            default:
                throw new IllegalArgumentException("Unknown family: " + family_);
        }
    }

}
