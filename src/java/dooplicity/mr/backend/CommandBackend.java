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
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang.StringUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.retry.RetryPolicies;
import org.apache.hadoop.io.retry.RetryPolicy;
import org.apache.hadoop.io.retry.RetryPolicy.RetryAction;
import org.apache.log4j.Logger;

/**
 * Base class for backends that drive a cluster through command-line tools.
 *
 * <p>
 * The variables the tools need are captured once, when the backend is built, and set on every command.
 * Commands still inherit the rest of this process's environment; captured values take precedence.
 * Control commands (submit, status, cancel) that fail to run or exit non-zero are retried with
 * exponential backoff; when the retries are used up they surface as a
 * {@link BackendUnavailableException}.
 * </p>
 *
 * <ul>
 * <li><em>backend.command.retries</em> - retries per control command (default 3)</li>
 * <li><em>backend.command.retry.sleep.ms</em> - base backoff (default 1000)</li>
 * <li><em>backend.command.timeout.ms</em> - timeout per control command (default 60000)</li>
 * <li><em>worker.command</em> - command that runs the worker entry point, followed by the descriptor
 * path</li>
 * </ul>
 */
public abstract class CommandBackend extends AbstractBackend
{
  public static final String COMMAND_RETRIES = "backend.command.retries";
  public static final String COMMAND_RETRY_SLEEP_MS = "backend.command.retry.sleep.ms";
  public static final String COMMAND_TIMEOUT_MS = "backend.command.timeout.ms";
  public static final String WORKER_COMMAND = "worker.command";
  public static final String DEFAULT_WORKER_COMMAND = "java $DOOPLICITY_JAVA_OPTS -cp $CLASSPATH dooplicity.mr.task.TaskMain";

  /**
   * Variables handed to every command, when set.
   */
  public static final String[] PASSED_ENVIRONMENT =
      { "AWS_PROFILE", "AWS_DEFAULT_REGION", "SLURM_CONF", "SSH_AUTH_SOCK", "DOOPLICITY_JAVA_OPTS", "CLASSPATH" };

  private final Logger _log = Logger.getLogger(CommandBackend.class);

  protected final CommandRunner runner;
  private final Map<String, String> environment;
  private final RetryPolicy retryPolicy;
  private final long commandTimeoutMillis;

  protected CommandBackend(Configuration conf, CommandRunner runner, Map<String, String> environment)
  {
    super(conf);
    this.runner = runner;
    this.environment = Collections.unmodifiableMap(new TreeMap<String, String>(environment));
    this.retryPolicy =
        RetryPolicies.exponentialBackoffRetry(conf.getInt(COMMAND_RETRIES, 3),
                                              conf.getLong(COMMAND_RETRY_SLEEP_MS, 1000),
                                              TimeUnit.MILLISECONDS);
    this.commandTimeoutMillis = conf.getLong(COMMAND_TIMEOUT_MS, 60000);
  }

  /**
   * The process variables set explicitly on every command.
   */
  public static Map<String, String> captureEnvironment()
  {
    Map<String, String> env = new TreeMap<String, String>();
    for (String name : PASSED_ENVIRONMENT)
    {
      String value = System.getenv(name);
      if (value != null)
      {
        env.put(name, value);
      }
    }
    return env;
  }

  public Map<String, String> getEnvironment()
  {
    return environment;
  }

  /**
   * Runs a control command, retrying failures.
   */
  protected CommandResult runControl(List<String> command) throws IOException
  {
    int retries = 0;
    while (true)
    {
      Exception failure;
      try
      {
        CommandResult result = runner.run(command, environment, commandTimeoutMillis);
        if (result.isSuccess())
        {
          return result;
        }
        failure = new IOException(String.format("%s failed with %s", command.get(0), result));
      }
      catch (IOException e)
      {
        failure = e;
      }

      RetryAction action;
      try
      {
        action = retryPolicy.shouldRetry(failure, retries, 0, true);
      }
      catch (Exception e)
      {
        throw new BackendUnavailableException("Retry policy failed for " + command.get(0), e);
      }
      if (action.action != RetryAction.RetryDecision.RETRY)
      {
        throw new BackendUnavailableException(String.format("%s still failing after %d retries", command.get(0), retries),
                                              failure);
      }
      retries++;
      _log.warn(String.format("%s (retry %d in %d ms)", failure.getMessage(), retries, action.delayMillis));
      try
      {
        Thread.sleep(action.delayMillis);
      }
      catch (InterruptedException e)
      {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while retrying " + command.get(0));
      }
    }
  }

  /**
   * Runs a command once, without retrying and without a timeout. Used for the task itself.
   */
  protected CommandResult runOnce(List<String> command) throws IOException
  {
    return runner.run(command, environment, 0);
  }

  /**
   * The worker command line for a task, as separate words.
   */
  protected List<String> workerCommand(String descriptor)
  {
    List<String> command = new ArrayList<String>();
    Collections.addAll(command, StringUtils.split(conf.get(WORKER_COMMAND, DEFAULT_WORKER_COMMAND)));
    command.add(descriptor);
    return command;
  }

  /**
   * The worker command line for a task, as one shell string.
   */
  protected String workerShellCommand(String descriptor)
  {
    return StringUtils.join(workerCommand(descriptor), ' ');
  }

  protected static List<String> words(String line)
  {
    List<String> words = new ArrayList<String>();
    Collections.addAll(words, StringUtils.split(line));
    return words;
  }
}
