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
package edu.columbia.tjw.helm.stat;

import edu.columbia.tjw.helm.data.SampleMatrix;

/**
 * Estimates a scalar rank correlation from the first two columns of a sample.
 *
 * @author tyler
 */
public interface DependencyEstimator
{
    double estimate(final SampleMatrix samples_);
}
