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

import edu.columbia.tjw.helm.HelmSettings;
import edu.columbia.tjw.helm.copula.CopulaFamily;
import edu.columbia.tjw.helm.data.SampleMatrix;
import edu.columbia.tjw.helm.util.LogUtil;
import edu.columbia.tjw.helm.util.thread.GeneralTask;
import edu.columbia.tjw.helm.util.thread.GeneralThreadPool;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs the family selector over every pair of columns of a sample. Each pair
 * is an independent task, run on the shared pool when threading is enabled.
 *
 * @author tyler
 */
public final class PairwiseFamilySelector
{
    private static final Logger LOG = LogUtil.getLogger(PairwiseFamilySelector.class);

    private final FamilySelector _selector;

    public PairwiseFamilySelector()
    {
        this(new FamilySelector());
    }

    public PairwiseFamilySelector(final FamilySelector selector_)
    {
        if (null == selector_)
        {
            throw new NullPointerException("Selector cannot be null.");
        }

        _selector = selector_;
    }

    public List<PairwiseSelection> selectAll(final SampleMatrix samples_)
    {
        final HelmSettings settings = _selector.getSettings();
        return selectAll(samples_, settings.getGridResolution(), settings.getCandidateFamilies());
    }

    /**
     * @param samples_ The raw sample, at least two columns
     * @param resolution_ The number of grid cells along each axis (K)
     * @param candidates_ The candidate families, earlier entries win ties
     * @return One selection per pair of columns, in lexicographic pair order
     */
    public List<PairwiseSelection> selectAll(final SampleMatrix samples_, final int resolution_,
            final List<CopulaFamily> candidates_)
    {
        final int columns = samples_.getColumns();

        if (columns < 2)
        {
            throw new IllegalArgumentException("At least two columns are required, got " + columns);
        }

        HelmSettings.checkFamilies(candidates_);

        final List<PairTask> tasks = new ArrayList<>(columns * (columns - 1) / 2);

        for (int i = 0; i < columns; i++)
        {
            for (int j = i + 1; j < columns; j++)
            {
                tasks.add(new PairTask(samples_, i, j, resolution_, candidates_));
            }
        }

        LOG.info("Selecting families for " + tasks.size() + " pairs.");

        final List<PairwiseSelection> output = GeneralThreadPool.singleton().runAll(tasks,
                _selector.getSettings().getUseThreading());
        return Collections.unmodifiableList(output);
    }

    private final class PairTask extends GeneralTask<PairwiseSelection>
    {
        private final SampleMatrix _samples;
        private final int _dim1;
        private final int _dim2;
        private final int _resolution;
        private final List<CopulaFamily> _candidates;

        public PairTask(final SampleMatrix samples_, final int dim1_, final int dim2_, final int resolution_,
                final List<CopulaFamily> candidates_)
        {
            _samples = samples_;
            _dim1 = dim1_;
            _dim2 = dim2_;
            _resolution = resolution_;
            _candidates = candidates_;
        }

        @Override
        protected PairwiseSelection subRun()
        {
            final SampleMatrix pair = _samples.selectColumns(_dim1, _dim2);
            final SelectionResult result = _selector.selectFamily(pair, _resolution, _candidates);
            return new PairwiseSelection(_dim1 + 1, _dim2 + 1, result);
        }

    }

}
