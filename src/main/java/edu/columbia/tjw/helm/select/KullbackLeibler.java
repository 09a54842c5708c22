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

import edu.columbia.tjw.helm.signature.MultinomialSignature;
import edu.columbia.tjw.helm.util.MathFunctions;
import org.apache.commons.math3.util.FastMath;

/**
 * Discrete Kullback-Leibler divergence, D(p || q) = sum_i p_i log(p_i / q_i).
 *
 * Both vectors are normalized to unit mass first, so a signature that has been
 * floored (and therefore sums to slightly more than one) is compared as a
 * proper distribution. Terms with p_i = 0 contribute nothing, a term with
 * q_i = 0 &lt; p_i makes the divergence infinite.
 *
 * @author tyler
 */
public final class KullbackLeibler
{
    private KullbackLeibler()
    {
    }

    public static double divergence(final MultinomialSignature p_, final MultinomialSignature q_)
    {
        return divergence(p_.toArray(), q_.toArray());
    }

    public static double divergence(final double[] p_, final double[] q_)
    {
        if (p_.length != q_.length)
        {
            throw new IllegalArgumentException("Length mismatch: " + p_.length + " != " + q_.length);
        }

        final double pSum = MathFunctions.sum(p_);
        final double qSum = MathFunctions.sum(q_);

        if (!(pSum > 0.0) || !(qSum > 0.0))
        {
            throw new IllegalArgumentException("Distributions must have positive mass: " + pSum + ", " + qSum);
        }

        double output = 0.0;

        for (int i = 0; i < p_.length; i++)
        {
            final double p = p_[i] / pSum;

            if (p == 0.0)
            {
                continue;
            }

            final double q = q_[i] / qSum;

            if (q == 0.0)
            {
                return Double.POSITIVE_INFINITY;
            }

            output += p * FastMath.log(p / q);
        }

        return output;
    }

}
