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

/**
 * Lifecycle of a task across its attempts.
 *
 * <pre>
 * PENDING -&gt; RUNNING -&gt; SUCCEEDED | FAILED
 * FAILED -&gt; RETRYING -&gt; RUNNING
 * SUCCEEDED -&gt; RUNNING        only when downstream lost its output
 * PENDING | RUNNING | RETRYING -&gt; CANCELLED
 * </pre>
 */
public enum TaskState
{
  PENDING,
  RUNNING,
  SUCCEEDED,
  FAILED,
  RETRYING,
  CANCELLED;

  boolean canMoveTo(TaskState next, boolean rerun)
  {
    switch (this)
    {
      case PENDING:
        return next == RUNNING || next == CANCELLED;
      case RUNNING:
        return next == SUCCEEDED || next == FAILED || next == CANCELLED;
      case FAILED:
        return next == RETRYING;
      case RETRYING:
        return next == RUNNING || next == CANCELLED;
      case SUCCEEDED:
        return rerun && next == RUNNING;
      default:
        return false;
    }
  }
}
