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

import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;

import dooplicity.mr.ConfigurationException;
import dooplicity.mr.avro.AvroRecordWriter;
import dooplicity.mr.backend.Backend;
import dooplicity.mr.backend.TaskHandle;
import dooplicity.mr.backend.TaskStatus;
import dooplicity.mr.fs.PathUtils;
import dooplicity.mr.fs.SharedStorage;
import dooplicity.mr.fs.WorkLayout;
import dooplicity.mr.io.RecordFiles;
import dooplicity.mr.io.RecordInput;
import dooplicity.mr.io.RecordWriter;
import dooplicity.mr.manifest.Manifest;
import dooplicity.mr.partition.ExternalSorter;
import dooplicity.mr.partition.MergingRecordInput;
import dooplicity.mr.stage.Pipeline;
import dooplicity.mr.stage.Stage;
import dooplicity.mr.task.TaskReport;
import dooplicity.mr.task.TaskSpec;

/**
 * Runs a pipeline over a manifest on one backend.
 *
 * <p>
 * Stages run in order. The first stage has one task per manifest entry and every later stage one task
 * per output partition of the stage before it; task <em>p</em> reads partition <em>p</em> of every
 * upstream task, in upstream task order. A stage is done when all its tasks have succeeded and every
 * declared partition of every task is committed. A failed attempt is retried up to
 * <em>task.max.attempts</em> times in all; a task that runs out of attempts fails the job, its stage's
 * running tasks are cancelled and no later stage is submitted. A task that fails because upstream output
 * is missing has the producing upstream tasks run again before it is retried.
 * </p>
 *
 * <p>
 * When the last stage succeeds and <em>output.path</em> is set, each of its partitions is merged across
 * tasks into <em>output.path/part-NNNNN</em> and <em>_SUCCESS</em> is written. The working directory is
 * then deleted unless <em>keep.intermediates</em> is true. Failed and cancelled jobs leave it in place.
 * Every attempt's report is appended to <em>_logs/task-reports.avro</em> under the output path, or under
 * the working path when there is no output path.
 * </p>
 *
 * <p>
 * All state of a run lives in its runner, so several jobs can run in one JVM.
 * </p>
 */
public class JobRunner
{
  public static final String OUTPUT_PATH = "output.path";
  public static final String KEEP_INTERMEDIATES = "keep.intermediates";
  public static final String MAX_ATTEMPTS = "task.max.attempts";
  public static final int DEFAULT_MAX_ATTEMPTS = 4;
  public static final String POLL_INTERVAL_MS = "job.poll.interval.ms";
  public static final long DEFAULT_POLL_INTERVAL_MS = 500;
  public static final String START_STAGE = "job.start.stage";
  public static final String STOP_STAGE = "job.stop.stage";
  public static final String RUN_ID = "job.run.id";
  public static final String TASK_LOG = "task-reports.avro";

  private final Logger _log = Logger.getLogger(JobRunner.class);

  private final Configuration conf;
  private final Pipeline pipeline;
  private final Manifest manifest;
  private final Backend backend;
  private final int maxAttempts;
  private final long pollMillis;
  private final String runId;

  private final Map<String, StageCounters> counters = new LinkedHashMap<String, StageCounters>();
  private final Map<String, List<TaskInProgress>> tasks = new LinkedHashMap<String, List<TaskInProgress>>();
  private final List<TaskReport> reports = Collections.synchronizedList(new ArrayList<TaskReport>());
  private volatile boolean cancelRequested;
  private volatile JobState state = JobState.RUNNING;

  private SharedStorage storage;
  private WorkLayout layout;

  /**
   * @param manifest
   *          input units; may be <code>null</code> when the run starts after the first stage
   */
  public JobRunner(Configuration conf, Pipeline pipeline, Manifest manifest, Backend backend)
  {
    this.conf = conf;
    this.pipeline = pipeline;
    this.manifest = manifest;
    this.backend = backend;
    this.maxAttempts = conf.getInt(MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
    this.pollMillis = conf.getLong(POLL_INTERVAL_MS, DEFAULT_POLL_INTERVAL_MS);
    this.runId = conf.get(RUN_ID, "run-" + new SimpleDateFormat("yyyyMMdd-HHmmss-SSS").format(new Date()));
  }

  public String getRunId()
  {
    return runId;
  }

  public JobState getState()
  {
    return state;
  }

  /**
   * Asks the run to stop: nothing more is submitted, running attempts are cancelled and their partial
   * output discarded. Returns immediately; {@link #run()} returns once the cancellation is done.
   */
  public void cancel()
  {
    _log.info(String.format("Cancellation requested for job %s", runId));
    cancelRequested = true;
    backend.wakeUp();
  }

  /**
   * A snapshot of every stage's counters, in pipeline order. Completed-task counts never decrease.
   */
  public List<StageCounters> getProgress()
  {
    List<StageCounters> snapshot = new ArrayList<StageCounters>();
    synchronized (counters)
    {
      for (StageCounters c : counters.values())
      {
        snapshot.add(new StageCounters(c));
      }
    }
    return snapshot;
  }

  /**
   * Runs the job to completion, failure or cancellation.
   *
   * @throws ConfigurationException
   *           when the job is misconfigured; nothing has been submitted in that case
   * @throws IOException
   *           when the working storage fails
   */
  public JobResult run() throws IOException
  {
    Configuration jobConf = prepare();
    int start = conf.get(START_STAGE) == null ? 0 : pipeline.indexOf(conf.getTrimmed(START_STAGE));
    int stop = conf.get(STOP_STAGE) == null ? pipeline.size() - 1 : pipeline.indexOf(conf.getTrimmed(STOP_STAGE));
    if (start > stop)
    {
      throw new ConfigurationException(String.format("Start stage %s comes after stop stage %s",
                                                     pipeline.getStage(start).getName(),
                                                     pipeline.getStage(stop).getName()));
    }
    if (start == 0 && (manifest == null || manifest.size() == 0))
    {
      throw new ConfigurationException("No manifest entries to process");
    }
    Path outputPath = resolveOutputPath();
    int upstreamTasks = start == 0 ? 0 : countCommittedTasks(pipeline.getStage(start - 1));

    _log.info(String.format("Job %s: stages %s to %s of %s on the %s backend (capacity %d), working directory %s",
                            runId,
                            pipeline.getStage(start).getName(),
                            pipeline.getStage(stop).getName(),
                            pipeline.names(),
                            backend.getName(),
                            backend.capacity(),
                            layout.getWorkPath()));

    String failedStage = null;
    String diagnostics = null;
    JobState finalState = JobState.SUCCEEDED;
    try
    {
      for (int s = start; s <= stop; s++)
      {
        List<TaskInProgress> stageTasks = createTasks(jobConf, s, upstreamTasks);
        if (!runStage(s, stageTasks))
        {
          finalState = JobState.CANCELLED;
          break;
        }
        upstreamTasks = stageTasks.size();
        _log.info(String.format("Stage %s complete: %s", pipeline.getStage(s).getName(), counters(s)));
      }
      if (finalState == JobState.SUCCEEDED && outputPath != null)
      {
        mergeOutput(pipeline.getStage(stop), upstreamTasks, outputPath);
      }
    }
    catch (StageFailureException e)
    {
      finalState = JobState.FAILED;
      failedStage = e.getStage();
      diagnostics = e.getDiagnostics();
      _log.error(String.format("Job %s failed: %s", runId, e.getMessage()));
    }

    state = finalState;
    writeTaskLog(outputPath != null && finalState == JobState.SUCCEEDED ? outputPath : layout.getWorkPath());
    if (finalState == JobState.SUCCEEDED && outputPath != null && !conf.getBoolean(KEEP_INTERMEDIATES, false))
    {
      _log.info(String.format("Deleting working directory %s", layout.getWorkPath()));
      storage.delete(layout.getWorkPath());
    }
    _log.info(String.format("Job %s %s", runId, finalState));
    return new JobResult(runId,
                         finalState,
                         getProgress(),
                         failedStage,
                         diagnostics,
                         finalState == JobState.SUCCEEDED ? outputPath : null);
  }

  private Configuration prepare() throws IOException
  {
    pipeline.validate();
    String work = conf.get(TaskSpec.WORK_PATH);
    if (work == null || work.trim().isEmpty())
    {
      throw new ConfigurationException("Working path is not specified. Setup the '" + TaskSpec.WORK_PATH + "' parameter.");
    }
    if (maxAttempts < 1)
    {
      throw new ConfigurationException(String.format("%s must be at least 1, got %d", MAX_ATTEMPTS, maxAttempts));
    }
    Path workPath = new Path(work.trim());
    storage = SharedStorage.get(workPath, conf);
    workPath = storage.qualify(workPath);
    layout = new WorkLayout(workPath);

    Configuration jobConf = new Configuration(conf);
    jobConf.set(TaskSpec.WORK_PATH, workPath.toString());
    jobConf.set(RUN_ID, runId);
    pipeline.writeTo(jobConf);
    return jobConf;
  }

  private Path resolveOutputPath() throws IOException
  {
    String output = conf.getTrimmed(OUTPUT_PATH);
    if (output == null || output.isEmpty())
    {
      return null;
    }
    Path outputPath = new Path(PathUtils.expandCurrent(output, new Date()));
    SharedStorage outputStorage = SharedStorage.get(outputPath, conf);
    outputPath = outputStorage.qualify(outputPath);
    if (outputStorage.exists(outputPath) && outputStorage.getFileSystem().listStatus(outputPath).length > 0)
    {
      throw new ConfigurationException(String.format("Output path %s already exists and is not empty", outputPath));
    }
    return outputPath;
  }

  private int countCommittedTasks(Stage stage) throws IOException
  {
    List<Path> dirs = PathUtils.listSorted(storage.getFileSystem(), layout.stageDir(stage.getName()));
    int n = 0;
    for (Path dir : dirs)
    {
      if (dir.getName().equals(WorkLayout.taskName(n)))
      {
        n++;
      }
    }
    if (n == 0)
    {
      throw new ConfigurationException(String.format("Cannot start after stage %s: it has no committed output under %s",
                                                     stage.getName(),
                                                     layout.stageDir(stage.getName())));
    }
    return n;
  }

  private List<TaskInProgress> createTasks(Configuration jobConf, int s, int upstreamTasks) throws IOException
  {
    Stage stage = pipeline.getStage(s);
    storage.delete(layout.stageDir(stage.getName()));
    storage.delete(new Path(new Path(layout.getWorkPath(), WorkLayout.TASKS), stage.getName()));
    storage.delete(new Path(new Path(layout.getWorkPath(), WorkLayout.STATUS), stage.getName()));

    List<TaskInProgress> stageTasks = new ArrayList<TaskInProgress>();
    if (s == 0)
    {
      for (int i = 0; i < manifest.size(); i++)
      {
        stageTasks.add(new TaskInProgress(s, TaskSpec.forManifestEntry(jobConf, stage.getName(), i, manifest.getEntries().get(i))));
      }
    }
    else
    {
      Stage upstream = pipeline.getStage(s - 1);
      for (int p = 0; p < upstream.getNumPartitions(); p++)
      {
        List<Path> inputs = new ArrayList<Path>();
        for (int u = 0; u < upstreamTasks; u++)
        {
          inputs.add(layout.partitionFile(upstream.getName(), u, p));
        }
        stageTasks.add(new TaskInProgress(s, TaskSpec.forPartition(jobConf, stage.getName(), p, upstream.getName(), inputs)));
      }
    }
    tasks.put(stage.getName(), stageTasks);
    StageCounters c = new StageCounters(stage.getName());
    c.setTotalTasks(stageTasks.size());
    synchronized (counters)
    {
      counters.put(stage.getName(), c);
    }
    return stageTasks;
  }

  /**
   * @return false if the job was cancelled
   */
  private boolean runStage(int s, List<TaskInProgress> stageTasks) throws IOException, StageFailureException
  {
    Stage stage = pipeline.getStage(s);
    _log.info(String.format("Starting stage %s with %d tasks", stage, stageTasks.size()));
    Deque<TaskInProgress> queue = new ArrayDeque<TaskInProgress>(stageTasks);
    List<TaskInProgress> inFlight = new ArrayList<TaskInProgress>();
    List<TaskInProgress> blocked = new ArrayList<TaskInProgress>();
    try
    {
      while (true)
      {
        if (cancelRequested)
        {
          cancelAll(inFlight, queue, blocked);
          return false;
        }

        for (Iterator<TaskInProgress> it = blocked.iterator(); it.hasNext();)
        {
          TaskInProgress tip = it.next();
          if (allSucceeded(tip.getWaitingOn()))
          {
            tip.getWaitingOn().clear();
            it.remove();
            queue.addLast(tip);
          }
        }

        while (inFlight.size() < backend.capacity() && !queue.isEmpty())
        {
          submit(queue.pollFirst(), inFlight, queue, blocked);
        }

        if (inFlight.isEmpty() && queue.isEmpty() && blocked.isEmpty())
        {
          List<TaskInProgress> incomplete = findIncomplete(stage, stageTasks);
          if (incomplete.isEmpty())
          {
            return true;
          }
          for (TaskInProgress tip : incomplete)
          {
            _log.warn(String.format("Task %s succeeded but some of its partitions are missing, running it again", tip.getName()));
            tip.requestRerun();
            counters(s).taskRerun();
            queue.addLast(tip);
          }
          continue;
        }

        try
        {
          backend.awaitUpdate(pollMillis);
        }
        catch (InterruptedException e)
        {
          _log.warn("Interrupted while waiting for tasks, cancelling job " + runId);
          Thread.currentThread().interrupt();
          cancelRequested = true;
          continue;
        }

        for (Iterator<TaskInProgress> it = inFlight.iterator(); it.hasNext();)
        {
          TaskInProgress tip = it.next();
          TaskStatus status = poll(tip);
          if (status.isDone())
          {
            it.remove();
            completed(tip, status, queue, blocked);
          }
        }
      }
    }
    catch (StageFailureException e)
    {
      cancelInFlight(inFlight);
      throw e;
    }
  }

  private void submit(TaskInProgress tip, List<TaskInProgress> inFlight, Deque<TaskInProgress> queue, List<TaskInProgress> blocked) throws IOException,
      StageFailureException
  {
    if (tip.getState() == TaskState.SUCCEEDED)
    {
      _log.info(String.format("Running %s again", tip.getName()));
    }
    TaskSpec spec = tip.nextAttempt();
    tip.moveTo(TaskState.RUNNING);
    counters(tip.getStageIndex()).attemptSubmitted();
    try
    {
      storage.delete(spec.getAttemptPath());
      tip.setHandle(backend.submit(spec));
      inFlight.add(tip);
      _log.info(String.format("Submitted %s", tip.getHandle()));
    }
    catch (IOException e)
    {
      _log.warn(String.format("Could not submit %s: %s", spec.getTaskId(), e.getMessage()));
      failed(tip, spec, null, "Could not submit: " + ExceptionUtils.getStackTrace(e), queue, blocked);
    }
  }

  private TaskStatus poll(TaskInProgress tip)
  {
    try
    {
      return backend.poll(tip.getHandle());
    }
    catch (IOException e)
    {
      _log.warn(String.format("Could not get the status of %s, counting the attempt as failed", tip.getHandle()));
      // the attempt must not keep running next to its retry
      cancelQuietly(tip.getHandle());
      return TaskStatus.failed("Status unavailable: " + ExceptionUtils.getStackTrace(e), null);
    }
  }

  private void completed(TaskInProgress tip, TaskStatus status, Deque<TaskInProgress> queue, List<TaskInProgress> blocked) throws IOException,
      StageFailureException
  {
    TaskSpec spec = tip.getHandle().getSpec();
    TaskReport report = status.getReport();
    if (status.getState() == TaskStatus.State.SUCCEEDED)
    {
      reports.add(report);
      boolean first = !tip.hasEverSucceeded();
      tip.moveTo(TaskState.SUCCEEDED);
      StageCounters c = counters(tip.getStageIndex());
      c.attemptSucceeded(report);
      if (first)
      {
        c.taskCompleted();
      }
      _log.info(String.format("Task %s succeeded (%s)", spec.getTaskId(), c));
      return;
    }
    failed(tip, spec, report, status.getReason(), queue, blocked);
  }

  private void failed(TaskInProgress tip,
                      TaskSpec spec,
                      TaskReport report,
                      String reason,
                      Deque<TaskInProgress> queue,
                      List<TaskInProgress> blocked) throws IOException,
      StageFailureException
  {
    reports.add(report != null ? report : TaskReport.failure(spec, reason, Collections.<Integer> emptyList()));
    tip.moveTo(TaskState.FAILED);
    counters(tip.getStageIndex()).attemptFailed();
    storage.delete(spec.getAttemptPath());

    if (tip.getAttempts() >= maxAttempts)
    {
      _log.error(String.format("Task %s failed on all %d attempts:\n%s", tip.getName(), maxAttempts, reason));
      throw new StageFailureException(tip.getStageName(),
                                      String.format("Task %s failed after %d attempts", tip.getName(), tip.getAttempts()),
                                      reason);
    }

    tip.moveTo(TaskState.RETRYING);
    counters(tip.getStageIndex()).taskRetried();
    List<Integer> lost = report == null ? Collections.<Integer> emptyList() : report.getLostInputs();
    if (lost.isEmpty())
    {
      _log.warn(String.format("Attempt %s failed, retrying:\n%s", spec.getTaskId(), reason));
      queue.addLast(tip);
      return;
    }

    List<TaskInProgress> upstream = tip.getStageIndex() == 0 ? null : tasks.get(pipeline.getStage(tip.getStageIndex() - 1).getName());
    if (upstream == null)
    {
      throw new StageFailureException(tip.getStageName(),
                                      String.format("Task %s lost input from a stage that did not run in this job", tip.getName()),
                                      reason);
    }
    _log.warn(String.format("Attempt %s lost the output of upstream tasks %s, running them again", spec.getTaskId(), lost));
    for (int index : lost)
    {
      TaskInProgress producer = upstream.get(index);
      if (producer.getState() == TaskState.SUCCEEDED && !producer.isRerunRequested())
      {
        producer.requestRerun();
        counters(producer.getStageIndex()).taskRerun();
        queue.addFirst(producer);
      }
      tip.getWaitingOn().add(producer);
    }
    blocked.add(tip);
  }

  private void cancelAll(List<TaskInProgress> inFlight, Deque<TaskInProgress> queue, List<TaskInProgress> blocked) throws IOException
  {
    _log.info(String.format("Cancelling %d running tasks", inFlight.size()));
    cancelInFlight(inFlight);
    List<TaskInProgress> waiting = new ArrayList<TaskInProgress>(queue);
    waiting.addAll(blocked);
    for (TaskInProgress tip : waiting)
    {
      if (tip.getState() != TaskState.SUCCEEDED)
      {
        tip.moveTo(TaskState.CANCELLED);
      }
    }
    queue.clear();
    blocked.clear();
  }

  private void cancelInFlight(List<TaskInProgress> inFlight) throws IOException
  {
    for (TaskInProgress tip : inFlight)
    {
      cancelQuietly(tip.getHandle());
      TaskSpec spec = tip.getHandle().getSpec();
      storage.delete(spec.getAttemptPath());
      storage.delete(spec.getOutputPath());
      tip.moveTo(TaskState.CANCELLED);
      reports.add(TaskReport.failure(spec, "Cancelled", Collections.<Integer> emptyList()));
    }
    inFlight.clear();
  }

  private void cancelQuietly(TaskHandle handle)
  {
    try
    {
      backend.cancel(handle);
    }
    catch (IOException e)
    {
      _log.error(String.format("Could not cancel %s", handle), e);
    }
  }

  private List<TaskInProgress> findIncomplete(Stage stage, List<TaskInProgress> stageTasks) throws IOException
  {
    List<TaskInProgress> incomplete = new ArrayList<TaskInProgress>();
    for (TaskInProgress tip : stageTasks)
    {
      for (int p = 0; p < stage.getNumPartitions(); p++)
      {
        if (!storage.exists(layout.partitionFile(stage.getName(), tip.getTaskIndex(), p)))
        {
          incomplete.add(tip);
          break;
        }
      }
    }
    return incomplete;
  }

  private static boolean allSucceeded(Iterable<TaskInProgress> tips)
  {
    for (TaskInProgress tip : tips)
    {
      if (tip.getState() != TaskState.SUCCEEDED || tip.isRerunRequested())
      {
        return false;
      }
    }
    return true;
  }

  private void mergeOutput(Stage last, int numTasks, Path outputPath) throws IOException
  {
    SharedStorage outputStorage = SharedStorage.get(outputPath, conf);
    RecordFiles inputFiles = new RecordFiles(storage.getFileSystem(), conf);
    RecordFiles outputFiles = new RecordFiles(outputStorage.getFileSystem(), new Configuration(false));
    Path tmp = new Path(outputPath, WorkLayout.TEMPORARY);
    outputStorage.mkdirs(tmp);

    for (int p = 0; p < last.getNumPartitions(); p++)
    {
      List<RecordInput> inputs = new ArrayList<RecordInput>();
      try
      {
        for (int t = 0; t < numTasks; t++)
        {
          inputs.add(inputFiles.open(layout.partitionFile(last.getName(), t, p)));
        }
      }
      catch (IOException e)
      {
        MergingRecordInput.closeQuietly(inputs);
        throw e;
      }

      Path part = ExternalSorter.partitionPath(tmp, p);
      RecordInput merged = new MergingRecordInput(inputs);
      RecordWriter writer = outputFiles.create(part);
      try
      {
        writer.writeAll(merged);
      }
      finally
      {
        writer.close();
        merged.close();
      }
      if (!outputStorage.getFileSystem().rename(part, new Path(outputPath, part.getName())))
      {
        throw new IOException(String.format("Could not move %s into %s", part, outputPath));
      }
    }
    outputStorage.delete(tmp);
    outputStorage.writeFully(new Path(outputPath, WorkLayout.SUCCESS), new byte[0]);
    _log.info(String.format("Wrote %d partitions to %s", last.getNumPartitions(), outputPath));
  }

  private void writeTaskLog(Path root) throws IOException
  {
    SharedStorage logStorage = SharedStorage.get(root, conf);
    Path logs = new Path(root, WorkLayout.LOGS);
    logStorage.mkdirs(logs);
    AvroRecordWriter writer = new AvroRecordWriter(new Path(logs, TASK_LOG), TaskReport.SCHEMA, logStorage.getFileSystem());
    try
    {
      writer.open();
      synchronized (reports)
      {
        for (TaskReport report : reports)
        {
          writer.append(report.toRecord());
        }
      }
    }
    finally
    {
      writer.close();
    }
  }

  private StageCounters counters(int stageIndex)
  {
    synchronized (counters)
    {
      return counters.get(pipeline.getStage(stageIndex).getName());
    }
  }
}
