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

package dooplicity.mr.task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A task could not find the committed output of some upstream tasks. The producing tasks must run again
 * before this one can succeed.
 */
public class InputLostException extends TaskExecutionException
{
  private static final long serialVersionUID = 1L;

  private final String upstreamStage;
  private final List<Integer> lostTasks;

  public InputLostException(String upstreamStage, List<Integer> lostTasks)
  {
    super(String.format("Lost input from stage %s, tasks %s", upstreamStage, lostTasks));
    this.upstreamStage = upstreamStage;
    this.lostTasks = Collections.unmodifiableList(new ArrayList<Integer>(lostTasks));
  }

  public String getUpstreamStage()
  {
    return upstreamStage;
  }

  public List<Integer> getLostTasks()
  {
    return lostTasks;
  }
}
