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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;

import dooplicity.mr.fs.SharedStorage;
import dooplicity.mr.task.TaskReport;
import dooplicity.mr.task.TaskSpec;

/**
 * Runs each task as a batch job on a SLURM-style cluster scheduler sharing the working storage.
 *
 * <p>
 * A batch script running the worker entry point on the task descriptor is written next to the
 * descriptor and submitted with <code>sbatch --parsable</code>. Jobs are polled with <code>sacct</code>
 * and cancelled with <code>scancel</code>.
 * </p>
 *
 * <ul>
 * <li><em>scheduler.submit.command</em> - default <code>sbatch</code></li>
 * <li><em>scheduler.status.command</em> - default <code>sacct</code></li>
 * <li><em>scheduler.cancel.command</em> - default <code>scancel</code></li>
 * <li><em>scheduler.queue</em> - partition to submit to</li>
 * <li><em>scheduler.submit.args</em> - extra arguments for the submit command</li>
 * <li><em>scheduler.max.jobs</em> - jobs in flight at once (default 64)</li>
 * </ul>
 */
public class SchedulerBackend extends CommandBackend
{
  public static final String SUBMIT_COMMAND = "scheduler.submit.command";
  public static final String STATUS_COMMAND = "scheduler.status.command";
  public static final String CANCEL_COMMAND = "scheduler.cancel.command";
  public static final String QUEUE = "scheduler.queue";
  public static final String SUBMIT_ARGS = "scheduler.submit.args";
  public static final String MAX_JOBS = "scheduler.max.jobs";

  private static final Set<String> ACTIVE_STATES =
      new HashSet<String>(Arrays.asList("PENDING", "RUNNING", "CONFIGURING", "COMPLETING", "REQUEUED", "RESIZING",
                                        "SUSPENDED", "STAGE_OUT", "SIGNALING", "REQUEUE_HOLD", "REQUEUE_FED"));

  private final Logger _log = Logger.getLogger(SchedulerBackend.class);

  private final int maxJobs;

  public SchedulerBackend(Configuration conf, CommandRunner runner, Map<String, String> environment)
  {
    super(conf, runner, environment);
    this.maxJobs = conf.getInt(MAX_JOBS, 64);
  }

  @Override
  public String getName()
  {
    return "scheduler";
  }

  @Override
  public int capacity()
  {
    return maxJobs;
  }

  @Override
  public TaskHandle submit(TaskSpec spec) throws IOException
  {
    SharedStorage storage = storageFor(spec);
    Path descriptor = spec.writeDescriptor(storage);
    Path script = spec.getLayout().script(spec.getStageName(), spec.getTaskIndex(), spec.getAttempt());
    storage.delete(spec.getStatusPath());
    storage.writeFully(script, batchScript(spec, descriptor).getBytes(StandardCharsets.UTF_8));

    List<String> command = words(conf.get(SUBMIT_COMMAND, "sbatch"));
    command.add("--parsable");
    command.addAll(words(conf.get(SUBMIT_ARGS, "")));
    command.add(localPath(storage, script));
    CommandResult result = runControl(command);

    String jobId = parseJobId(result.getOutput());
    if (jobId == null)
    {
      throw new BackendUnavailableException(String.format("Could not parse a job id from '%s'", result.getOutput().trim()), null);
    }
    _log.info(String.format("Submitted %s as scheduler job %s", spec.getTaskId(), jobId));
    return new TaskHandle(spec, jobId);
  }

  String batchScript(TaskSpec spec, Path descriptor) throws IOException
  {
    SharedStorage storage = storageFor(spec);
    Path log = new Path(descriptor.getParent(), descriptor.getName().replace(".xml", ".log"));
    StringBuilder sb = new StringBuilder();
    sb.append("#!/bin/bash\n");
    sb.append("#SBATCH --job-name=").append(spec.getTaskId().replace('/', '-')).append('\n');
    sb.append("#SBATCH --output=").append(localPath(storage, log)).append('\n');
    String queue = conf.getTrimmed(QUEUE);
    if (queue != null && !queue.isEmpty())
    {
      sb.append("#SBATCH --partition=").append(queue).append('\n');
    }
    sb.append("exec ").append(workerShellCommand(storage.qualify(descriptor).toString())).append('\n');
    return sb.toString();
  }

  /**
   * <code>sbatch --parsable</code> prints <em>jobid</em> or <em>jobid;cluster</em>.
   */
  public static String parseJobId(String output)
  {
    for (String line : StringUtils.split(output, '\n'))
    {
      String id = StringUtils.substringBefore(line.trim(), ";");
      if (id.matches("[0-9]+(_[0-9]+)?"))
      {
        return id;
      }
    }
    return null;
  }

  @Override
  public TaskStatus poll(TaskHandle handle) throws IOException
  {
    List<String> command = words(conf.get(STATUS_COMMAND, "sacct"));
    command.addAll(Arrays.asList("-n", "-X", "-P", "-j", handle.getExternalId(), "-o", "State,ExitCode"));
    CommandResult result = runControl(command);

    String line = firstLine(result.getOutput());
    if (line == null)
    {
      // not yet visible in accounting
      return TaskStatus.running();
    }
    String[] fields = line.split("\\|", -1);
    String state = StringUtils.substringBefore(fields[0].trim(), " ");
    String exitCode = fields.length > 1 ? fields[1].trim() : "";
    if (ACTIVE_STATES.contains(state))
    {
      return TaskStatus.running();
    }
    if ("COMPLETED".equals(state))
    {
      return completedStatus(handle);
    }
    TaskReport report = readReportIfPresent(handle.getSpec());
    String reason = String.format("Scheduler job %s ended in state %s (exit %s)", handle.getExternalId(), state, exitCode);
    if (report != null && report.getDiagnostics() != null)
    {
      reason = reason + "\n" + report.getDiagnostics();
    }
    return TaskStatus.failed(reason, report);
  }

  @Override
  public void cancel(TaskHandle handle) throws IOException
  {
    List<String> command = words(conf.get(CANCEL_COMMAND, "scancel"));
    command.add(handle.getExternalId());
    runControl(command);
    _log.info(String.format("Cancelled scheduler job %s (%s)", handle.getExternalId(), handle.getSpec().getTaskId()));
  }

  private static String firstLine(String output)
  {
    for (String line : StringUtils.split(output, '\n'))
    {
      if (!line.trim().isEmpty())
      {
        return line.trim();
      }
    }
    return null;
  }

  static String localPath(SharedStorage storage, Path path)
  {
    return storage.qualify(path).toUri().getPath();
  }
}
