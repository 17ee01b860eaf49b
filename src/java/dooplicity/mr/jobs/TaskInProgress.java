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

import java.util.HashSet;
import java.util.Set;

import dooplicity.mr.backend.TaskHandle;
import dooplicity.mr.task.TaskSpec;

/**
 * The orchestrator's record of one task: its state, its attempts and what it is waiting for.
 */
class TaskInProgress
{
  private final int stageIndex;
  private final TaskSpec spec;
  private TaskState state = TaskState.PENDING;
  private int attempts;
  private boolean rerunRequested;
  private boolean everSucceeded;
  private TaskHandle handle;
  private final Set<TaskInProgress> waitingOn = new HashSet<TaskInProgress>();

  TaskInProgress(int stageIndex, TaskSpec spec)
  {
    this.stageIndex = stageIndex;
    this.spec = spec;
  }

  int getStageIndex()
  {
    return stageIndex;
  }

  String getStageName()
  {
    return spec.getStageName();
  }

  int getTaskIndex()
  {
    return spec.getTaskIndex();
  }

  TaskState getState()
  {
    return state;
  }

  void moveTo(TaskState next)
  {
    if (!state.canMoveTo(next, rerunRequested))
    {
      throw new IllegalStateException(String.format("Task %s cannot go from %s to %s", getName(), state, next));
    }
    if (state == TaskState.SUCCEEDED)
    {
      rerunRequested = false;
    }
    if (next == TaskState.SUCCEEDED)
    {
      everSucceeded = true;
    }
    state = next;
  }

  /**
   * Spec for the next attempt.
   */
  TaskSpec nextAttempt()
  {
    attempts++;
    return spec.withAttempt(attempts);
  }

  int getAttempts()
  {
    return attempts;
  }

  void requestRerun()
  {
    rerunRequested = true;
  }

  boolean isRerunRequested()
  {
    return rerunRequested;
  }

  boolean hasEverSucceeded()
  {
    return everSucceeded;
  }

  TaskHandle getHandle()
  {
    return handle;
  }

  void setHandle(TaskHandle handle)
  {
    this.handle = handle;
  }

  /**
   * Upstream tasks being re-run before this one may be retried.
   */
  Set<TaskInProgress> getWaitingOn()
  {
    return waitingOn;
  }

  String getName()
  {
    return spec.getTaskName();
  }

  @Override
  public String toString()
  {
    return String.format("%s [%s, %d attempts]", getName(), state, attempts);
  }
}
