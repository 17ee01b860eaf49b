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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;

import dooplicity.mr.cache.RedundancyEliminator;
import dooplicity.mr.cache.SharedStorageResultCache;
import dooplicity.mr.fs.SharedStorage;
import dooplicity.mr.io.Record;
import dooplicity.mr.io.RecordFiles;
import dooplicity.mr.io.RecordInput;
import dooplicity.mr.manifest.ManifestRecordInput;
import dooplicity.mr.partition.ExternalSorter;
import dooplicity.mr.partition.KeyGroupIterator;
import dooplicity.mr.partition.MergingRecordInput;
import dooplicity.mr.stage.CachingMapper;
import dooplicity.mr.stage.OutputCollector;
import dooplicity.mr.stage.Stage;
import dooplicity.mr.stage.StageMapper;
import dooplicity.mr.stage.StageReducer;
import dooplicity.mr.stage.StageType;
import dooplicity.mr.stage.TaskContext;

/**
 * Runs one attempt of one task, the same way on every backend.
 *
 * <p>
 * The runner reads the task's input, invokes the stage body, sorts and partitions what the body emits,
 * writes every declared partition into the attempt directory and commits the directory with a single
 * rename. Map stages marked cacheable have their computation routed through the job's result cache. Any
 * failure becomes a failed {@link TaskReport}; the runner never retries and never leaves a partial commit
 * behind. The thread's interrupt flag is checked between records, which is how the local backend cancels
 * a running task.
 * </p>
 */
public class TaskRunner
{
  public static final String CACHE_PATH = "cache.path";
  private static final String SPILL_DIR = "_spill";

  private final Logger _log = Logger.getLogger(TaskRunner.class);

  public TaskReport execute(TaskSpec spec)
  {
    long start = System.currentTimeMillis();
    TaskReport report;
    try
    {
      report = TaskReport.success(spec, run(spec));
      _log.info(String.format("Task %s committed to %s", spec.getTaskId(), spec.getOutputPath()));
    }
    catch (InputLostException e)
    {
      _log.warn(String.format("Task %s lost output of %s tasks %s", spec.getTaskId(), e.getUpstreamStage(), e.getLostTasks()));
      report = TaskReport.failure(spec, ExceptionUtils.getStackTrace(e), e.getLostTasks());
    }
    catch (InterruptedIOException e)
    {
      _log.warn(String.format("Task %s interrupted", spec.getTaskId()));
      report = TaskReport.failure(spec, "Interrupted: " + e.getMessage(), Collections.<Integer> emptyList());
    }
    catch (IOException e)
    {
      _log.error(String.format("Task %s failed", spec.getTaskId()), e);
      report = TaskReport.failure(spec, ExceptionUtils.getStackTrace(e), Collections.<Integer> emptyList());
    }
    catch (RuntimeException e)
    {
      _log.error(String.format("Task %s failed", spec.getTaskId()), e);
      report = TaskReport.failure(spec, ExceptionUtils.getStackTrace(e), Collections.<Integer> emptyList());
    }
    return report.setTiming(hostName(), start, System.currentTimeMillis());
  }

  private Map<String, Long> run(TaskSpec spec) throws IOException
  {
    Stage stage = spec.getStage();
    Configuration stageConf = stage.createStageConf(spec.getConf());
    SharedStorage storage = SharedStorage.get(spec.getWorkPath(), stageConf);
    Path attemptDir = spec.getAttemptPath();
    storage.delete(attemptDir);
    storage.mkdirs(attemptDir);

    boolean committed = false;
    try
    {
      RecordFiles files = new RecordFiles(storage.getFileSystem(), stageConf);
      TaskContext context = new TaskContext(stage, spec.getTaskIndex(), spec.getAttempt(), stageConf);
      ExternalSorter sorter =
          new ExternalSorter(stage.createPartitioner(stageConf),
                             stage.getNumPartitions(),
                             files,
                             new Path(attemptDir, SPILL_DIR),
                             stageConf.getLong(ExternalSorter.SORT_BUFFER_BYTES, ExternalSorter.DEFAULT_SORT_BUFFER_BYTES));
      long[] written;
      try
      {
        RecordInput input = openInput(spec, storage, files);
        try
        {
          if (stage.getType() == StageType.MAP)
          {
            runMap(spec, stage, stageConf, context, input, sorter);
          }
          else
          {
            runReduce(stage, stageConf, context, input, sorter);
          }
        }
        finally
        {
          input.close();
        }
        checkInterrupted(spec);
        written = sorter.writePartitions(attemptDir);
        increment(context, TaskCounter.SPILLS, sorter.getSpillCount());
      }
      finally
      {
        sorter.close();
      }
      storage.delete(new Path(attemptDir, SPILL_DIR));

      long total = 0;
      for (long w : written)
      {
        total += w;
      }
      increment(context, TaskCounter.OUTPUT_RECORDS, total);

      checkInterrupted(spec);
      storage.commitDirectory(attemptDir, spec.getOutputPath());
      committed = true;
      return new TreeMap<String, Long>(context.getCounters());
    }
    finally
    {
      if (!committed)
      {
        storage.delete(attemptDir);
      }
    }
  }

  private RecordInput openInput(TaskSpec spec, SharedStorage storage, RecordFiles files) throws IOException
  {
    if (spec.readsManifest())
    {
      return new ManifestRecordInput(spec.getManifestEntry(), spec.getConf());
    }

    List<Path> inputs = spec.getInputs();
    List<Integer> lost = new ArrayList<Integer>();
    for (int i = 0; i < inputs.size(); i++)
    {
      if (!storage.exists(inputs.get(i)))
      {
        lost.add(i);
      }
    }
    if (!lost.isEmpty())
    {
      throw new InputLostException(spec.getInputStage(), lost);
    }

    List<RecordInput> readers = new ArrayList<RecordInput>();
    try
    {
      for (Path input : inputs)
      {
        readers.add(files.open(input));
      }
    }
    catch (IOException e)
    {
      MergingRecordInput.closeQuietly(readers);
      throw e;
    }
    return new MergingRecordInput(readers);
  }

  private void runMap(TaskSpec spec,
                      Stage stage,
                      Configuration stageConf,
                      TaskContext context,
                      RecordInput input,
                      ExternalSorter sorter) throws IOException
  {
    StageMapper mapper = (StageMapper) stage.createBody(stageConf);
    OutputCollector output = collector(sorter);
    mapper.setup(context);

    RedundancyEliminator eliminator = null;
    if (stage.isCacheable())
    {
      eliminator = createEliminator(spec, stage, stageConf);
    }

    long records = 0;
    Record record;
    while ((record = input.read()) != null)
    {
      checkInterrupted(spec);
      records++;
      if (eliminator != null)
      {
        final CachingMapper body = (CachingMapper) mapper;
        byte[] result = eliminator.resolve(body.workUnit(record), new RedundancyEliminator.Computation()
        {
          @Override
          public byte[] compute(byte[] workUnit) throws IOException
          {
            return body.compute(workUnit);
          }
        });
        body.emit(record, result, output);
      }
      else
      {
        mapper.map(record, output);
      }
    }
    mapper.cleanup(output);

    increment(context, TaskCounter.INPUT_RECORDS, records);
    if (eliminator != null)
    {
      increment(context, TaskCounter.CACHE_HITS, eliminator.getHits());
      increment(context, TaskCounter.CACHE_COMPUTED, eliminator.getComputed());
      increment(context, TaskCounter.CACHE_RACE_LOSSES, eliminator.getRaceLosses());
      increment(context, TaskCounter.CACHE_CLAIM_WAITS, eliminator.getClaimWaits());
    }
  }

  private void runReduce(Stage stage, Configuration stageConf, TaskContext context, RecordInput input, ExternalSorter sorter) throws IOException
  {
    StageReducer reducer = (StageReducer) stage.createBody(stageConf);
    OutputCollector output = collector(sorter);
    reducer.setup(context);

    KeyGroupIterator groups = new KeyGroupIterator(input);
    try
    {
      while (groups.nextKey())
      {
        if (Thread.currentThread().isInterrupted())
        {
          throw new InterruptedIOException("Interrupted in stage " + stage.getName());
        }
        reducer.reduce(groups.getKey(), groups.values(), output);
      }
    }
    catch (RuntimeException e)
    {
      // values() can only surface read failures unchecked
      if (e.getCause() instanceof IOException)
      {
        throw (IOException) e.getCause();
      }
      throw e;
    }
    reducer.cleanup(output);
    increment(context, TaskCounter.INPUT_GROUPS, groups.getGroupCount());
  }

  private RedundancyEliminator createEliminator(TaskSpec spec, Stage stage, Configuration stageConf) throws IOException
  {
    Path cacheRoot = new Path(stageConf.get(CACHE_PATH, spec.getLayout().defaultCacheRoot().toString()));
    SharedStorageResultCache cache =
        new SharedStorageResultCache(SharedStorage.get(cacheRoot, stageConf),
                                     cacheRoot,
                                     stageConf.getLong(SharedStorageResultCache.CLAIM_POLL_MS,
                                                       SharedStorageResultCache.DEFAULT_CLAIM_POLL_MS));
    return new RedundancyEliminator(cache,
                                    stage.createFingerprinter(),
                                    spec.getTaskName(),
                                    stageConf.getInt(RedundancyEliminator.MEMO_SIZE, RedundancyEliminator.DEFAULT_MEMO_SIZE),
                                    stageConf.getLong(RedundancyEliminator.CLAIM_TIMEOUT_MS,
                                                      RedundancyEliminator.DEFAULT_CLAIM_TIMEOUT_MS));
  }

  private static OutputCollector collector(final ExternalSorter sorter)
  {
    return new OutputCollector()
    {
      @Override
      public void collect(Record record) throws IOException
      {
        sorter.add(record);
      }
    };
  }

  private static void checkInterrupted(TaskSpec spec) throws InterruptedIOException
  {
    if (Thread.currentThread().isInterrupted())
    {
      throw new InterruptedIOException("Task " + spec.getTaskId() + " interrupted");
    }
  }

  private static void increment(TaskContext context, TaskCounter counter, long amount)
  {
    context.incrementCounter(counter.name(), amount);
  }

  private static String hostName()
  {
    try
    {
      return InetAddress.getLocalHost().getHostName();
    }
    catch (UnknownHostException e)
    {
      return "unknown";
    }
  }
}
