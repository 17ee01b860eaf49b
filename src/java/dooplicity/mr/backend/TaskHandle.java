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

import dooplicity.mr.task.TaskSpec;

/**
 * A submitted attempt, as known to the backend that runs it.
 */
public class TaskHandle
{
  private final TaskSpec spec;
  private final String externalId;

  public TaskHandle(TaskSpec spec, String externalId)
  {
    this.spec = spec;
    this.externalId = externalId;
  }

  public TaskSpec getSpec()
  {
    return spec;
  }

  /**
   * The substrate's own identifier: a scheduler job id, a step id, a host slot.
   */
  public String getExternalId()
  {
    return externalId;
  }

  @Override
  public String toString()
  {
    return String.format("%s [%s]", spec.getTaskId(), externalId);
  }
}
