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

package dooplicity.mr.jobs;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import dooplicity.mr.task.TaskCounter;
import dooplicity.mr.task.TaskReport;

/**
 * Progress and totals of one stage. Every count only grows.
 */
public class StageCounters
{
  private final String stage;
  private int totalTasks;
  private long submitted;
  private long succeeded;
  private long failed;
  private long retried;
  private long rerun;
  private int completedTasks;
  private final Map<String, Long> counters = new TreeMap<String, Long>();

  public StageCounters(String stage)
  {
    this.stage = stage;
  }

  StageCounters(StageCounters other)
  {
    synchronized (other)
    {
      this.stage = other.stage;
      this.totalTasks = other.totalTasks;
      this.submitted = other.submitted;
      this.succeeded = other.succeeded;
      this.failed = other.failed;
      this.retried = other.retried;
      this.rerun = other.rerun;
      this.completedTasks = other.completedTasks;
      this.counters.putAll(other.counters);
    }
  }

  public String getStage()
  {
    return stage;
  }

  public synchronized int getTotalTasks()
  {
    return totalTasks;
  }

  synchronized void setTotalTasks(int totalTasks)
  {
    this.totalTasks = totalTasks;
  }

  /**
   * Tasks that have succeeded at least once.
   */
  public synchronized int getCompletedTasks()
  {
    return completedTasks;
  }

  synchronized void taskCompleted()
  {
    completedTasks++;
  }

  /**
   * Attempts handed to the backend.
   */
  public synchronized long getSubmitted()
  {
    return submitted;
  }

  synchronized void attemptSubmitted()
  {
    submitted++;
  }

  /**
   * Attempts that committed, re-runs included.
   */
  public synchronized long getSucceeded()
  {
    return succeeded;
  }

  synchronized void attemptSucceeded(TaskReport report)
  {
    succeeded++;
    if (report != null)
    {
      for (Map.Entry<String, Long> c : report.getCounters().entrySet())
      {
        Long current = counters.get(c.getKey());
        counters.put(c.getKey(), current == null ? c.getValue() : current + c.getValue());
      }
    }
  }

  public synchronized long getFailed()
  {
    return failed;
  }

  synchronized void attemptFailed()
  {
    failed++;
  }

  public synchronized long getRetried()
  {
    return retried;
  }

  synchronized void taskRetried()
  {
    retried++;
  }

  /**
   * Succeeded tasks run again because a downstream task lost their output.
   */
  public synchronized long getRerun()
  {
    return rerun;
  }

  synchronized void taskRerun()
  {
    rerun++;
  }

  /**
   * Task counters summed over the committed attempts.
   */
  public synchronized Map<String, Long> getCounters()
  {
    return Collections.unmodifiableMap(new TreeMap<String, Long>(counters));
  }

  public synchronized long getCounter(TaskCounter counter)
  {
    Long value = counters.get(counter.name());
    return value == null ? 0 : value;
  }

  @Override
  public synchronized String toString()
  {
    return String.format("%s: %d/%d tasks, %d submitted, %d succeeded, %d failed, %d retried",
                         stage,
                         completedTasks,
                         totalTasks,
                         submitted,
                         succeeded,
                         failed,
                         retried);
  }
}
