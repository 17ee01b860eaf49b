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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.lang.StringUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.log4j.Logger;

import dooplicity.mr.ConfigurationException;
import dooplicity.mr.fs.SharedStorage;
import dooplicity.mr.task.TaskReport;
import dooplicity.mr.task.TaskSpec;

/**
 * Runs each task over <code>ssh</code> on one of a fixed list of hosts that share the working storage.
 *
 * <p>
 * Every host offers <em>remote.slots.per.host</em> slots and a task occupies one slot for as long as its
 * channel is open. Exit status 255 is how <code>ssh</code> reports a lost connection; like any other
 * non-zero status it fails the attempt.
 * </p>
 *
 * <ul>
 * <li><em>remote.hosts</em> - comma-separated host names (required)</li>
 * <li><em>remote.slots.per.host</em> - concurrent tasks per host (default 1)</li>
 * <li><em>remote.ssh.command</em> - default <code>ssh -o BatchMode=yes</code></li>
 * </ul>
 */
public class RemoteShellBackend extends CommandBackend
{
  public static final String HOSTS = "remote.hosts";
  public static final String SLOTS_PER_HOST = "remote.slots.per.host";
  public static final String SSH_COMMAND = "remote.ssh.command";
  public static final int CHANNEL_LOST = 255;

  private final Logger _log = Logger.getLogger(RemoteShellBackend.class);

  private final Map<String, Integer> busySlots = new LinkedHashMap<String, Integer>();
  private final int slotsPerHost;
  private final ExecutorService channels;
  private final Map<TaskHandle, Future<CommandResult>> running = new ConcurrentHashMap<TaskHandle, Future<CommandResult>>();

  public RemoteShellBackend(Configuration conf, CommandRunner runner, Map<String, String> environment)
  {
    super(conf, runner, environment);
    String[] hosts = conf.getTrimmedStrings(HOSTS);
    if (hosts.length == 0)
    {
      throw new ConfigurationException("No remote hosts given. Set '" + HOSTS + "'.");
    }
    for (String host : hosts)
    {
      busySlots.put(host, 0);
    }
    this.slotsPerHost = conf.getInt(SLOTS_PER_HOST, 1);
    if (slotsPerHost < 1)
    {
      throw new ConfigurationException(String.format("%s must be at least 1, got %d", SLOTS_PER_HOST, slotsPerHost));
    }
    this.channels = Executors.newCachedThreadPool();
  }

  @Override
  public String getName()
  {
    return "remote";
  }

  @Override
  public int capacity()
  {
    return busySlots.size() * slotsPerHost;
  }

  public List<String> getHosts()
  {
    return Collections.unmodifiableList(new ArrayList<String>(busySlots.keySet()));
  }

  /**
   * @return slots not taken by a running task, over all hosts
   */
  public synchronized int getFreeSlots()
  {
    int busy = 0;
    for (int slots : busySlots.values())
    {
      busy += slots;
    }
    return capacity() - busy;
  }

  @Override
  public TaskHandle submit(TaskSpec spec) throws IOException
  {
    SharedStorage storage = storageFor(spec);
    storage.delete(spec.getStatusPath());
    String descriptor = storage.qualify(spec.writeDescriptor(storage)).toString();
    String host = acquireSlot();
    final List<String> command = sshCommand(host, workerShellCommand(descriptor));
    TaskHandle handle = new TaskHandle(spec, host);
    Future<CommandResult> future = channels.submit(new Callable<CommandResult>()
    {
      @Override
      public CommandResult call() throws IOException
      {
        try
        {
          return runOnce(command);
        }
        finally
        {
          wakeUp();
        }
      }
    });
    running.put(handle, future);
    _log.info(String.format("Started %s on %s (descriptor %s, %d slots free)", spec.getTaskId(), host, descriptor, getFreeSlots()));
    return handle;
  }

  @Override
  public TaskStatus poll(TaskHandle handle) throws IOException
  {
    Future<CommandResult> future = running.get(handle);
    if (future == null)
    {
      throw new IllegalArgumentException("Unknown task handle: " + handle);
    }
    if (!future.isDone())
    {
      return TaskStatus.running();
    }
    running.remove(handle);
    releaseSlot(handle.getExternalId());
    CommandResult result;
    try
    {
      result = future.get();
    }
    catch (CancellationException e)
    {
      return TaskStatus.failed("Cancelled", null);
    }
    catch (InterruptedException e)
    {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while reading result of " + handle);
    }
    catch (ExecutionException e)
    {
      return TaskStatus.failed(String.format("Could not run ssh to %s: %s", handle.getExternalId(), e.getCause()), null);
    }

    if (result.getExitCode() == CHANNEL_LOST)
    {
      return TaskStatus.failed(String.format("Lost the ssh channel to %s: %s", handle.getExternalId(), tail(result.getError())),
                               null);
    }
    if (!result.isSuccess())
    {
      TaskReport report = readReportIfPresent(handle.getSpec());
      String reason = String.format("Task exited with %d on %s", result.getExitCode(), handle.getExternalId());
      if (report != null && report.getDiagnostics() != null)
      {
        reason = reason + "\n" + report.getDiagnostics();
      }
      else
      {
        reason = reason + "\n" + tail(result.getError());
      }
      return TaskStatus.failed(reason, report);
    }
    return completedStatus(handle);
  }

  @Override
  public void cancel(TaskHandle handle) throws IOException
  {
    Future<CommandResult> future = running.remove(handle);
    if (future == null)
    {
      return;
    }
    future.cancel(true);
    releaseSlot(handle.getExternalId());
    // closing the local channel does not always stop the remote process
    String descriptor = storageFor(handle.getSpec()).qualify(handle.getSpec().getDescriptorPath()).toString();
    CommandResult kill = runOnce(sshCommand(handle.getExternalId(), "pkill -f " + descriptor));
    // pkill exits 1 when nothing matched, meaning the task had already stopped
    if (kill.getExitCode() > 1)
    {
      throw new IOException(String.format("Could not stop %s on %s: %s", handle.getSpec().getTaskId(), handle.getExternalId(), kill));
    }
    _log.info(String.format("Cancelled %s on %s", handle.getSpec().getTaskId(), handle.getExternalId()));
  }

  private List<String> sshCommand(String host, String remoteCommand)
  {
    List<String> command = words(conf.get(SSH_COMMAND, "ssh -o BatchMode=yes"));
    command.add(host);
    command.add(remoteCommand);
    return command;
  }

  private synchronized String acquireSlot() throws IOException
  {
    String best = null;
    for (Map.Entry<String, Integer> host : busySlots.entrySet())
    {
      if (host.getValue() < slotsPerHost && (best == null || host.getValue() < busySlots.get(best)))
      {
        best = host.getKey();
      }
    }
    if (best == null)
    {
      throw new IOException("All " + capacity() + " remote slots are busy");
    }
    busySlots.put(best, busySlots.get(best) + 1);
    return best;
  }

  private synchronized void releaseSlot(String host)
  {
    busySlots.put(host, busySlots.get(host) - 1);
  }

  private static String tail(String text)
  {
    String trimmed = text.trim();
    return trimmed.length() <= 2000 ? trimmed : "..." + StringUtils.right(trimmed, 2000);
  }

  @Override
  public void close() throws IOException
  {
    channels.shutdownNow();
  }
}
