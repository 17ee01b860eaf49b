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
 * A task of a stage failed on every allowed attempt, which ends the job.
 */
public class StageFailureException extends Exception
{
  private static final long serialVersionUID = 1L;

  private final String stage;
  private final String diagnostics;

  public StageFailureException(String stage, String message, String diagnostics)
  {
    super(message);
    this.stage = stage;
    this.diagnostics = diagnostics;
  }

  public String getStage()
  {
    return stage;
  }

  /**
   * Diagnostics of the last attempt of the task that failed.
   */
  public String getDiagnostics()
  {
    return diagnostics;
  }
}
