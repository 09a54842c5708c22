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

/**
 * A unit of work that may be run on a pool thread, or by whoever waits on it
 * first.
 *
 * @author tyler
 * @param <V> The return type of this task
 */
public abstract class GeneralTask<V> implements Runnable
{
    private V _result;
    private RuntimeException _exception;
    private boolean _isDone;
    private boolean _isRunning;

    public GeneralTask()
    {
        _result = null;
        _exception = null;
        _isDone = false;
        _isRunning = false;
    }

    public synchronized boolean isDone()
    {
        return _isDone;
    }

    /**
     * Blocks until the task has finished. If nobody has started the task yet,
     * the calling thread runs it.
     *
     * @return The result of subRun()
     * @throws RuntimeException if subRun() failed, the original exception is
     * rethrown as-is when unchecked, and wrapped otherwise
     */
    public V waitForCompletion()
    {
        // run() kicks out immediately if the task is already running or done.
        this.run();

        synchronized (this)
        {
            while (!_isDone)
            {
                try
                {
                    this.wait();
                }
                catch (final InterruptedException e)
                {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException(e);
                }
            }

            if (null != _exception)
            {
                throw _exception;
            }

            return _result;
        }
    }

    @Override
    public void run()
    {
        synchronized (this)
        {
            if (_isRunning || _isDone)
            {
                return;
            }

            _isRunning = true;
        }

        V result = null;
        RuntimeException t = null;

        try
        {
            result = subRun();
        }
        catch (final RuntimeException e)
        {
            t = e;
        }
        catch (final Throwable e)
        {
            t = new RuntimeException(e);
        }
        finally
        {
            synchronized (this)
            {
                _result = result;
                _exception = t;
                _isDone = true;
                _isRunning = false;
                this.notifyAll();
            }
        }
    }

    protected abstract V subRun() throws Exception;
}
