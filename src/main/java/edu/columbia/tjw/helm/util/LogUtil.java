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
package edu.columbia.tjw.helm.util;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 *
 * @author tyler
 */
public final class LogUtil
{
    private LogUtil()
    {
    }

    public static Logger getLogger(final Class<?> clazz_)
    {
        final String name = clazz_.getName();
        final Logger output = Logger.getLogger(name);
        return output;
    }

    /**
     * Formats a probability vector for debug output, only if the logger would
     * actually print it.
     *
     * @param log_ The logger that will receive the message
     * @param label_ A prefix for the message
     * @param values_ The vector to print
     */
    public static void logVector(final Logger log_, final String label_, final double[] values_)
    {
        if (!log_.isLoggable(Level.FINE))
        {
            return;
        }

        final StringBuilder builder = new StringBuilder();
        builder.append(label_);
        builder.append("[");

        for (int i = 0; i < values_.length; i++)
        {
            if (i > 0)
            {
                builder.append(", ");
            }

            builder.append(values_[i]);
        }

        builder.append("]");
        log_.fine(builder.toString());
    }

}
