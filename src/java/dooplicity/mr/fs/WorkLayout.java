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

package dooplicity.mr.fs;

import org.apache.hadoop.fs.Path;

import dooplicity.mr.partition.ExternalSorter;

/**
 * Names of everything a job keeps under its working directory. All names are derived from the stage
 * name, task index and attempt number, so any process that knows the working directory can find a task's
 * data without asking the orchestrator.
 *
 * <pre>
 * &lt;work&gt;/&lt;stage&gt;/task-00003/part-00001
 * &lt;work&gt;/&lt;stage&gt;/_temporary/task-00003-attempt-2/
 * &lt;work&gt;/_tasks/&lt;stage&gt;/task-00003-attempt-2.xml
 * &lt;work&gt;/_status/&lt;stage&gt;/task-00003-attempt-2.avro
 * &lt;work&gt;/_cache/
 * </pre>
 */
public class WorkLayout
{
  public static final String TEMPORARY = "_temporary";
  public static final String TASKS = "_tasks";
  public static final String STATUS = "_status";
  public static final String CACHE = "_cache";
  public static final String LOGS = "_logs";
  public static final String SUCCESS = "_SUCCESS";

  private final Path workPath;

  public WorkLayout(Path workPath)
  {
    this.workPath = workPath;
  }

  public Path getWorkPath()
  {
    return workPath;
  }

  public Path stageDir(String stage)
  {
    return new Path(workPath, stage);
  }

  public static String taskName(int taskIndex)
  {
    return String.format("task-%05d", taskIndex);
  }

  public static String attemptName(int taskIndex, int attempt)
  {
    return String.format("%s-attempt-%d", taskName(taskIndex), attempt);
  }

  /**
   * Directory holding the committed output partitions of a task.
   */
  public Path taskOutput(String stage, int taskIndex)
  {
    return new Path(stageDir(stage), taskName(taskIndex));
  }

  public Path partitionFile(String stage, int taskIndex, int partition)
  {
    return ExternalSorter.partitionPath(taskOutput(stage, taskIndex), partition);
  }

  public Path attemptDir(String stage, int taskIndex, int attempt)
  {
    return new Path(new Path(stageDir(stage), TEMPORARY), attemptName(taskIndex, attempt));
  }

  public Path descriptor(String stage, int taskIndex, int attempt)
  {
    return new Path(new Path(new Path(workPath, TASKS), stage), attemptName(taskIndex, attempt) + ".xml");
  }

  public Path script(String stage, int taskIndex, int attempt)
  {
    return new Path(new Path(new Path(workPath, TASKS), stage), attemptName(taskIndex, attempt) + ".sh");
  }

  public Path status(String stage, int taskIndex, int attempt)
  {
    return new Path(new Path(new Path(workPath, STATUS), stage), attemptName(taskIndex, attempt) + ".avro");
  }

  public Path defaultCacheRoot()
  {
    return new Path(workPath, CACHE);
  }
}
