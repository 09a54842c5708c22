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
 * A fully parameterized two dimensional copula.
 *
 * @author tyler
 */
public interface BivariateCopula
{
    CopulaFamily getFamily();

    /**
     * @return theta for the Archimedean families, the correlation for the
     * elliptical ones
     */
    double getParameter();

    /**
     * The copula CDF, C(u, v) = P[U &lt;= u, V &lt;= v]. Arguments outside of
     * [0, 1] are treated as the nearest edge of the square.
     *
     * @param u_ The first coordinate
     * @param v_ The second coordinate
     * @return C(u_, v_)
     */
    double cdf(final double u_, final double v_);
}
