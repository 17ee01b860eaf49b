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
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.hadoop.conf.Configuration;
import org.apache.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import dooplicity.mr.ConfigurationException;
import dooplicity.mr.fs.SharedStorage;
import dooplicity.mr.task.TaskReport;
import dooplicity.mr.task.TaskSpec;

/**
 * Runs each task as a step on a running Elastic MapReduce cluster, through the <code>aws</code> command
 * line.
 *
 * <p>
 * A step runs the worker entry point with <code>command-runner.jar</code> on the task descriptor, which
 * must therefore live on storage the cluster can read (S3 or the cluster's HDFS). Steps are added with
 * <code>aws emr add-steps</code>, polled with <code>describe-step</code> and stopped with
 * <code>cancel-steps</code>. The AWS profile and region come from the environment captured when the
 * backend was created.
 * </p>
 *
 * <ul>
 * <li><em>elastic.cluster.id</em> - cluster to add steps to (required)</li>
 * <li><em>elastic.aws.command</em> - default <code>aws</code></li>
 * <li><em>elastic.max.steps</em> - steps in flight at once (default 8)</li>
 * </ul>
 */
public class ElasticBackend extends CommandBackend
{
  public static final String CLUSTER_ID = "elastic.cluster.id";
  public static final String AWS_COMMAND = "elastic.aws.command";
  public static final String MAX_STEPS = "elastic.max.steps";
  public static final String STEP_JAR = "command-runner.jar";

  private final Logger _log = Logger.getLogger(ElasticBackend.class);

  private final String clusterId;
  private final int maxSteps;

  public ElasticBackend(Configuration conf, CommandRunner runner, Map<String, String> environment)
  {
    super(conf, runner, environment);
    this.clusterId = conf.getTrimmed(CLUSTER_ID);
    if (clusterId == null || clusterId.isEmpty())
    {
      throw new ConfigurationException("No cluster given for the elastic backend. Set '" + CLUSTER_ID + "'.");
    }
    this.maxSteps = conf.getInt(MAX_STEPS, 8);
  }

  @Override
  public String getName()
  {
    return "elastic";
  }

  @Override
  public int capacity()
  {
    return maxSteps;
  }

  public String getClusterId()
  {
    return clusterId;
  }

  @Override
  public TaskHandle submit(TaskSpec spec) throws IOException
  {
    SharedStorage storage = storageFor(spec);
    storage.delete(spec.getStatusPath());
    String descriptor = storage.qualify(spec.writeDescriptor(storage)).toString();

    List<String> command = emr("add-steps");
    command.addAll(Arrays.asList("--cluster-id", clusterId, "--steps", steps(spec, descriptor).toString()));
    CommandResult result = runControl(command);

    String stepId;
    try
    {
      stepId = new JSONObject(result.getOutput()).getJSONArray("StepIds").getString(0);
    }
    catch (JSONException e)
    {
      throw new BackendUnavailableException(String.format("Unexpected add-steps response: %s", result.getOutput().trim()), e);
    }
    _log.info(String.format("Added step %s for %s to cluster %s", stepId, spec.getTaskId(), clusterId));
    return new TaskHandle(spec, stepId);
  }

  /**
   * The add-steps argument for one task: a single custom jar step that leaves the cluster running if it
   * fails.
   */
  public JSONArray steps(TaskSpec spec, String descriptor)
  {
    JSONObject step = new JSONObject();
    step.put("Type", "CUSTOM_JAR");
    step.put("Name", spec.getTaskId());
    step.put("ActionOnFailure", "CONTINUE");
    step.put("Jar", STEP_JAR);
    step.put("Args", new JSONArray(workerCommand(descriptor)));
    return new JSONArray().put(step);
  }

  @Override
  public TaskStatus poll(TaskHandle handle) throws IOException
  {
    List<String> command = emr("describe-step");
    command.addAll(Arrays.asList("--cluster-id", clusterId, "--step-id", handle.getExternalId()));
    CommandResult result = runControl(command);

    String state;
    String failure = null;
    try
    {
      JSONObject status = new JSONObject(result.getOutput()).getJSONObject("Step").getJSONObject("Status");
      state = status.getString("State");
      JSONObject details = status.optJSONObject("FailureDetails");
      if (details != null)
      {
        failure = details.optString("Reason", "") + " " + details.optString("Message", "");
      }
    }
    catch (JSONException e)
    {
      throw new BackendUnavailableException(String.format("Unexpected describe-step response: %s", result.getOutput().trim()), e);
    }

    if ("PENDING".equals(state) || "RUNNING".equals(state) || "CANCEL_PENDING".equals(state))
    {
      return TaskStatus.running();
    }
    if ("COMPLETED".equals(state))
    {
      return completedStatus(handle);
    }
    TaskReport report = readReportIfPresent(handle.getSpec());
    String reason = String.format("Step %s ended in state %s", handle.getExternalId(), state);
    if (failure != null)
    {
      reason = reason + ": " + failure.trim();
    }
    if (report != null && report.getDiagnostics() != null)
    {
      reason = reason + "\n" + report.getDiagnostics();
    }
    return TaskStatus.failed(reason, report);
  }

  @Override
  public void cancel(TaskHandle handle) throws IOException
  {
    List<String> command = emr("cancel-steps");
    command.addAll(Arrays.asList("--cluster-id", clusterId, "--step-ids", handle.getExternalId()));
    runControl(command);
    _log.info(String.format("Cancelled step %s (%s)", handle.getExternalId(), handle.getSpec().getTaskId()));
  }

  private List<String> emr(String subcommand)
  {
    List<String> command = words(conf.get(AWS_COMMAND, "aws"));
    command.add("emr");
    command.add(subcommand);
    return command;
  }
}
