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
package edu.columbia.tjw.helm.util.thread;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared daemon pool used for independent pieces of signature work (one task
 * per variable pair).
 *
 * @author tyler
 */
public class GeneralThreadPool extends ThreadPoolExecutor
{
    private static final int NUM_PROCESSORS = Runtime.getRuntime().availableProcessors();
    private static final int MAX_THREADS = 32;
    private static final int BASE_SIZE = Math.min(NUM_PROCESSORS, MAX_THREADS);
    private static final GeneralThreadPool SINGLETON = new GeneralThreadPool();

    public static GeneralThreadPool singleton()
    {
        return SINGLETON;
    }

    private GeneralThreadPool()
    {
        // The queue is unbounded, so the pool never grows past its core size.
        super(BASE_SIZE, BASE_SIZE, 500, TimeUnit.SECONDS, new LinkedBlockingDeque<Runnable>());
        this.allowCoreThreadTimeOut(true);
        this.setThreadFactory(new GeneralFactory());
    }

    /**
     * Runs all the given tasks, either on this pool or inline in the calling
     * thread, and collects their results in task order.
     *
     * @param <W> The result type of the tasks
     * @param tasks_ The tasks to run
     * @param useThreading_ If false, every task is run in the calling thread
     * @return The results, in the same order as tasks_
     */
    public <W> List<W> runAll(final List<? extends GeneralTask<W>> tasks_, final boolean useThreading_)
    {
        final List<W> output = new ArrayList<>(tasks_.size());

        for (final GeneralTask<W> next : tasks_)
        {
            if (useThreading_)
            {
                this.execute(next);
            }
            else
            {
                next.run();
            }
        }

        for (final GeneralTask<W> next : tasks_)
        {
            final W res = next.waitForCompletion();
            output.add(res);
        }

        return output;
    }

    private static final class GeneralFactory implements ThreadFactory
    {
        private final AtomicInteger _counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r)
        {
            final Thread t = new Thread(r, "helm-worker-" + _counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }

    }

}
