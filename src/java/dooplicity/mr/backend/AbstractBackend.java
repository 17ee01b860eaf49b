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

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;

import dooplicity.mr.fs.SharedStorage;
import dooplicity.mr.task.TaskReport;
import dooplicity.mr.task.TaskSpec;

/**
 * Base class for backends: the update monitor the orchestrator waits on, and the success check shared by
 * the backends whose workers run in other processes.
 */
public abstract class AbstractBackend implements Backend
{
  private final Object monitor = new Object();
  private boolean updated;

  protected final Configuration conf;

  protected AbstractBackend(Configuration conf)
  {
    this.conf = conf;
  }

  public Configuration getConf()
  {
    return conf;
  }

  @Override
  public void awaitUpdate(long millis) throws InterruptedException
  {
    synchronized (monitor)
    {
      if (!updated && millis > 0)
      {
        monitor.wait(millis);
      }
      updated = false;
    }
  }

  @Override
  public void wakeUp()
  {
    synchronized (monitor)
    {
      updated = true;
      monitor.notifyAll();
    }
  }

  protected SharedStorage storageFor(TaskSpec spec) throws IOException
  {
    return SharedStorage.get(spec.getWorkPath(), spec.getConf());
  }

  /**
   * Status of an attempt whose process has exited cleanly: succeeded only if the worker left a
   * successful report and the committed output is in place.
   */
  protected TaskStatus completedStatus(TaskHandle handle) throws IOException
  {
    TaskSpec spec = handle.getSpec();
    SharedStorage storage = storageFor(spec);
    Path statusPath = spec.getStatusPath();
    TaskReport report = TaskReport.readFrom(statusPath, storage.getFileSystem());
    if (report == null)
    {
      return TaskStatus.failed(String.format("%s exited without leaving a report at %s", handle, statusPath), null);
    }
    return checkReport(spec, report, storage);
  }

  protected TaskStatus checkReport(TaskSpec spec, TaskReport report, SharedStorage storage) throws IOException
  {
    if (!report.isSucceeded())
    {
      return TaskStatus.failed(report.getDiagnostics(), report);
    }
    if (!storage.exists(spec.getOutputPath()))
    {
      return TaskStatus.failed(String.format("Task %s reported success but %s is missing", spec.getTaskId(), spec.getOutputPath()),
                               report);
    }
    return TaskStatus.succeeded(report);
  }

  /**
   * Reads the worker's report, if any, to enrich a failure reported by the substrate.
   */
  protected TaskReport readReportIfPresent(TaskSpec spec) throws IOException
  {
    return TaskReport.readFrom(spec.getStatusPath(), storageFor(spec).getFileSystem());
  }

  @Override
  public void close() throws IOException
  {
  }
}
