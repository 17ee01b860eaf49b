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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.hadoop.fs.Path;

/**
 * Outcome of a job run.
 */
public class JobResult
{
  private final String runId;
  private final JobState state;
  private final List<StageCounters> stages;
  private final String failedStage;
  private final String diagnostics;
  private final Path outputPath;

  public JobResult(String runId, JobState state, List<StageCounters> stages, String failedStage, String diagnostics, Path outputPath)
  {
    this.runId = runId;
    this.state = state;
    this.stages = Collections.unmodifiableList(new ArrayList<StageCounters>(stages));
    this.failedStage = failedStage;
    this.diagnostics = diagnostics;
    this.outputPath = outputPath;
  }

  public String getRunId()
  {
    return runId;
  }

  public JobState getState()
  {
    return state;
  }

  public boolean isSucceeded()
  {
    return state == JobState.SUCCEEDED;
  }

  public List<StageCounters> getStages()
  {
    return stages;
  }

  public StageCounters getStage(String name)
  {
    for (StageCounters stage : stages)
    {
      if (stage.getStage().equals(name))
      {
        return stage;
      }
    }
    return null;
  }

  /**
   * The stage that failed, <code>null</code> unless the job failed.
   */
  public String getFailedStage()
  {
    return failedStage;
  }

  /**
   * Diagnostics of the first task that failed for good, <code>null</code> unless the job failed.
   */
  public String getDiagnostics()
  {
    return diagnostics;
  }

  /**
   * Where the merged output was written, <code>null</code> if no output path was set or the job did not
   * succeed.
   */
  public Path getOutputPath()
  {
    return outputPath;
  }

  @Override
  public String toString()
  {
    return String.format("Job %s %s %s", runId, state, stages);
  }
}
