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
 * How a dependency value is expressed.
 *
 * @author tyler
 */
public enum DependencyKind
{
    /**
     * Kendall's tau.
     */
    KENDALL,
    /**
     * Spearman's rho.
     */
    SPEARMAN,
    /**
     * The family's own parameter (theta, or a correlation for the elliptical
     * families).
     */
    NATIVE;
}
