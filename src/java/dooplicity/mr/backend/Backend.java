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

import java.io.Closeable;
import java.io.IOException;

import dooplicity.mr.task.TaskSpec;

/**
 * Runs tasks on one execution substrate. A job talks to exactly one backend, chosen when the job is
 * created.
 *
 * <p>
 * A backend reports {@link TaskStatus.State#SUCCEEDED} only once the task's committed output directory
 * exists. Remote backends additionally require the worker's status report to say the attempt succeeded.
 * </p>
 */
public interface Backend extends Closeable
{
  String getName();

  /**
   * Starts one attempt of a task. Callers keep the number of unfinished handles within
   * {@link #capacity()}.
   */
  TaskHandle submit(TaskSpec spec) throws IOException;

  TaskStatus poll(TaskHandle handle) throws IOException;

  /**
   * Stops an attempt. Returns once the attempt can no longer commit, as far as the substrate allows.
   */
  void cancel(TaskHandle handle) throws IOException;

  /**
   * Maximum number of attempts that may be running at once.
   */
  int capacity();

  /**
   * Blocks until some task may have changed state, or at most <code>millis</code>.
   */
  void awaitUpdate(long millis) throws InterruptedException;

  /**
   * Wakes up a caller blocked in {@link #awaitUpdate(long)}.
   */
  void wakeUp();
}
