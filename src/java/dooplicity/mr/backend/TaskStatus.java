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

import dooplicity.mr.task.TaskReport;

/**
 * State of a submitted attempt as seen by its backend.
 */
public class TaskStatus
{
  public enum State
  {
    RUNNING,
    SUCCEEDED,
    FAILED
  }

  private static final TaskStatus RUNNING = new TaskStatus(State.RUNNING, null, null);

  private final State state;
  private final String reason;
  private final TaskReport report;

  private TaskStatus(State state, String reason, TaskReport report)
  {
    this.state = state;
    this.reason = reason;
    this.report = report;
  }

  public static TaskStatus running()
  {
    return RUNNING;
  }

  public static TaskStatus succeeded(TaskReport report)
  {
    return new TaskStatus(State.SUCCEEDED, null, report);
  }

  public static TaskStatus failed(String reason, TaskReport report)
  {
    return new TaskStatus(State.FAILED, reason, report);
  }

  public State getState()
  {
    return state;
  }

  public boolean isDone()
  {
    return state != State.RUNNING;
  }

  /**
   * Why the attempt failed, <code>null</code> unless failed.
   */
  public String getReason()
  {
    return reason;
  }

  /**
   * The worker's report, when one was produced.
   */
  public TaskReport getReport()
  {
    return report;
  }

  @Override
  public String toString()
  {
    return reason == null ? state.name() : state.name() + ": " + reason;
  }
}
