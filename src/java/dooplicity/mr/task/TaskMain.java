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

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.conf.Configured;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.util.Tool;
import org.apache.hadoop.util.ToolRunner;
import org.apache.log4j.Logger;

import dooplicity.mr.fs.SharedStorage;

/**
 * Worker entry point for backends that run tasks in another process: reads a task descriptor, runs the
 * task and leaves its report under the job's <em>_status</em> directory.
 *
 * <pre>
 * TaskMain &lt;descriptor.xml&gt;
 * </pre>
 *
 * Exits 0 when the task committed, 1 when it failed and 2 on bad usage.
 */
public class TaskMain extends Configured implements Tool
{
  private final Logger _log = Logger.getLogger(TaskMain.class);

  @Override
  public int run(String[] args) throws Exception
  {
    if (args.length != 1)
    {
      System.err.println("Usage: TaskMain <descriptor.xml>");
      return 2;
    }
    Configuration base = getConf() == null ? new Configuration() : getConf();
    TaskSpec spec = TaskSpec.readDescriptor(new Path(args[0]), base);
    _log.info(String.format("Running task %s", spec.getTaskId()));

    TaskReport report = new TaskRunner().execute(spec);
    Path status = spec.getStatusPath();
    SharedStorage storage = SharedStorage.get(status, spec.getConf());
    storage.mkdirs(status.getParent());
    report.writeTo(status, storage.getFileSystem());
    _log.info(String.format("Task %s %s, report at %s", spec.getTaskId(), report.isSucceeded() ? "succeeded" : "failed", status));
    return report.isSucceeded() ? 0 : 1;
  }

  public static void main(String[] args) throws Exception
  {
    System.exit(ToolRunner.run(new Configuration(), new TaskMain(), args));
  }
}
