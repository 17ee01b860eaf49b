/**
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 * 
 * http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */

package dooplicity.mr.backend;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.hadoop.conf.Configuration;
import org.apache.log4j.Logger;

import dooplicity.mr.task.TaskReport;
import dooplicity.mr.task.TaskRunner;
import dooplicity.mr.task.TaskSpec;

/**
 * Runs tasks in a fixed pool of threads in this JVM.
 *
 * <p>
 * The pool size is <em>local.num.tasks</em>, by default one less than the number of processors and at
 * least one. Cancelling a task interrupts its thread; the task runner checks the interrupt flag between
 * records and before committing.
 * </p>
 */
public class LocalBackend extends AbstractBackend
{
  public static final String NUM_TASKS = "local.num.tasks";
  private static final long CANCEL_WAIT_MS = 30000;

  private final Logger _log = Logger.getLogger(LocalBackend.class);

  private final int numTasks;
  private final ExecutorService executor;
  private final TaskRunner taskRunner = new TaskRunner();
  private final ConcurrentHashMap<TaskHandle, Execution> executions = new ConcurrentHashMap<TaskHandle, Execution>();
  private final AtomicInteger submitted = new AtomicInteger();

  public LocalBackend(Configuration conf)
  {
    super(conf);
    this.numTasks = conf.getInt(NUM_TASKS, defaultNumTasks());
    if (numTasks < 1)
    {
      throw new IllegalArgumentException(String.format("%s must be at least 1, got %d", NUM_TASKS, numTasks));
    }
    final AtomicInteger threads = new AtomicInteger();
    this.executor = Executors.newFixedThreadPool(numTasks, new ThreadFactory()
    {
      @Override
      public Thread newThread(Runnable r)
      {
        Thread t = new Thread(r, "local-task-" + threads.incrementAndGet());
        t.setDaemon(true);
        return t;
      }
    });
    _log.info(String.format("Local backend with %d task slots", numTasks));
  }

  public static int defaultNumTasks()
  {
    return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
  }

  @Override
  public String getName()
  {
    return "local";
  }

  @Override
  public int capacity()
  {
    return numTasks;
  }

  @Override
  public TaskHandle submit(final TaskSpec spec) throws IOException
  {
    TaskHandle handle = new TaskHandle(spec, "local-" + submitted.incrementAndGet());
    final Execution execution = new Execution();
    execution.future = executor.submit(new Callable<TaskReport>()
    {
      @Override
      public TaskReport call()
      {
        execution.started.set(true);
        try
        {
          return taskRunner.execute(spec);
        }
        finally
        {
          execution.finished.countDown();
          wakeUp();
        }
      }
    });
    executions.put(handle, execution);
    return handle;
  }

  @Override
  public TaskStatus poll(TaskHandle handle) throws IOException
  {
    Execution execution = executions.get(handle);
    if (execution == null)
    {
      throw new IllegalArgumentException("Unknown task handle: " + handle);
    }
    if (!execution.future.isDone())
    {
      return TaskStatus.running();
    }
    executions.remove(handle);
    TaskReport report;
    try
    {
      report = execution.future.get();
    }
    catch (CancellationException e)
    {
      return TaskStatus.failed("Cancelled", null);
    }
    catch (InterruptedException e)
    {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while reading result of " + handle);
    }
    catch (ExecutionException e)
    {
      throw new IOException("Task thread failed for " + handle, e.getCause());
    }
    return checkReport(handle.getSpec(), report, storageFor(handle.getSpec()));
  }

  @Override
  public void cancel(TaskHandle handle) throws IOException
  {
    Execution execution = executions.remove(handle);
    if (execution == null)
    {
      return;
    }
    execution.future.cancel(true);
    if (execution.started.get())
    {
      try
      {
        if (!execution.finished.await(CANCEL_WAIT_MS, TimeUnit.MILLISECONDS))
        {
          _log.warn(String.format("Task %s did not stop within %d ms of being cancelled", handle, CANCEL_WAIT_MS));
        }
      }
      catch (InterruptedException e)
      {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while cancelling " + handle);
      }
    }
    _log.info(String.format("Cancelled %s", handle));
  }

  @Override
  public void close() throws IOException
  {
    executor.shutdownNow();
  }

  private static final class Execution
  {
    final AtomicBoolean started = new AtomicBoolean();
    final CountDownLatch finished = new CountDownLatch(1);
    volatile Future<TaskReport> future;
  }
}
