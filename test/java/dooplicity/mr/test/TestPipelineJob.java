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

package dooplicity.mr.test;

import java.io.IOException;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Random;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import dooplicity.mr.ConfigurationException;
import dooplicity.mr.avro.AvroRecordReader;
import dooplicity.mr.backend.Backend;
import dooplicity.mr.backend.BackendFactory;
import dooplicity.mr.backend.ElasticBackend;
import dooplicity.mr.backend.LocalBackend;
import dooplicity.mr.backend.RemoteShellBackend;
import dooplicity.mr.cache.SharedStorageResultCache;
import dooplicity.mr.fs.WorkLayout;
import dooplicity.mr.io.Record;
import dooplicity.mr.io.RecordFiles;
import dooplicity.mr.io.RecordInputs;
import dooplicity.mr.jobs.JobResult;
import dooplicity.mr.jobs.JobRunner;
import dooplicity.mr.jobs.JobState;
import dooplicity.mr.jobs.PipelineJob;
import dooplicity.mr.jobs.StageCounters;
import dooplicity.mr.partition.HashPartitioner;
import dooplicity.mr.partition.KeyFieldPartitioner;
import dooplicity.mr.stage.Pipeline;
import dooplicity.mr.stage.Stage;
import dooplicity.mr.stages.CanonicalSequenceMapper;
import dooplicity.mr.stages.SampleCountReducer;
import dooplicity.mr.stages.StandardPipelines;
import dooplicity.mr.task.TaskCounter;
import dooplicity.mr.test.jobs.FlakyMapper;
import dooplicity.mr.test.jobs.GroupSizeReducer;
import dooplicity.mr.test.jobs.SlowMapper;
import dooplicity.mr.test.util.InProcessCommandRunner;
import dooplicity.mr.test.util.InputDeletingBackend;
import dooplicity.mr.test.util.SampleWriter;

@Test(groups = "pcl")
public class TestPipelineJob extends TestBase
{
  private Logger _log = Logger.getLogger(TestPipelineJob.class);

  private Path _inputPath;
  private Path _workPath;
  private Path _outputPath;
  private Path _manifestPath;

  public TestPipelineJob() throws IOException
  {
    super();
  }

  @BeforeClass
  public void beforeClass() throws Exception
  {
    super.beforeClass();
    _inputPath = path("input");
    _workPath = path("work");
    _outputPath = path("output");
  }

  @AfterClass
  public void afterClass() throws Exception
  {
    super.afterClass();
  }

  @BeforeMethod
  public void beforeMethod(Method method) throws IOException
  {
    _log.info("*** Running " + method.getName());
    cleanPath(_inputPath);
    cleanPath(_workPath);
    cleanPath(_outputPath);

    SampleWriter samples = new SampleWriter(getFileSystem(), _inputPath);
    samples.addSample("liver-1-1", "ACGTT", "AACGT", "GGGCC", "ACGTT", "TTTTA");
    samples.addSample("liver-2-1", "GGCCC", "TAAAA", "CATGC");
    samples.addSample("brain-1-1", "ACGTT", "CCCCC", "GCATG", "GGGGG");
    _manifestPath = samples.writeManifest();
  }

  @Test
  public void sequenceCountTest() throws IOException
  {
    PipelineJob job = createJob(StandardPipelines.sequenceCount(2));
    JobResult result = job.run();

    Assert.assertEquals(result.getState(), JobState.SUCCEEDED, result.toString());
    Assert.assertEquals(result.getOutputPath(), _outputPath);
    Assert.assertTrue(getFileSystem().exists(new Path(_outputPath, WorkLayout.SUCCESS)));
    Assert.assertFalse(getFileSystem().exists(_workPath), "working directory should be deleted");

    Map<String, String> counts = readOutput(_outputPath);
    Assert.assertEquals(counts.get("AACGT\tliver-1-1"), "3");
    Assert.assertEquals(counts.get("GGCCC\tliver-1-1"), "1");
    Assert.assertEquals(counts.get("TAAAA\tliver-1-1"), "1");
    Assert.assertEquals(counts.get("GGCCC\tliver-2-1"), "1");
    Assert.assertEquals(counts.get("TAAAA\tliver-2-1"), "1");
    Assert.assertEquals(counts.get("CATGC\tliver-2-1"), "1");
    Assert.assertEquals(counts.get("AACGT\tbrain-1-1"), "1");
    Assert.assertEquals(counts.get("CATGC\tbrain-1-1"), "1");
    // GGGGG is the reverse complement of CCCCC
    Assert.assertEquals(counts.get("CCCCC\tbrain-1-1"), "2");
    Assert.assertEquals(counts.size(), 9, counts.toString());

    StageCounters canonicalize = result.getStage("canonicalize");
    Assert.assertEquals(canonicalize.getTotalTasks(), 3);
    Assert.assertEquals(canonicalize.getCompletedTasks(), 3);
    Assert.assertEquals(canonicalize.getCounter(TaskCounter.INPUT_RECORDS), 12);
    Assert.assertEquals(result.getStage("count").getTotalTasks(), 2);
    Assert.assertEquals(result.getStage("count").getCounter(TaskCounter.OUTPUT_RECORDS), 9);

    List<GenericRecord> log = AvroRecordReader.readAll(new Path(_outputPath, WorkLayout.LOGS + "/" + JobRunner.TASK_LOG), getFileSystem());
    Assert.assertEquals(log.size(), 5);
  }

  @Test
  public void redundantReadsAreComputedOnceTest() throws IOException
  {
    cleanPath(_inputPath);
    Random random = new Random(42);
    List<String> common = new ArrayList<String>();
    for (int i = 0; i < 8; i++)
    {
      common.add(randomSequence(random, 20));
    }

    // 80% of each sample's distinct reads are shared with every other sample
    SampleWriter samples = new SampleWriter(getFileSystem(), _inputPath);
    for (int s = 0; s < 5; s++)
    {
      List<String> reads = new ArrayList<String>(common);
      reads.add(common.get(0));
      reads.add(randomSequence(random, 20));
      reads.add(randomSequence(random, 20));
      samples.addSample("sample-" + s + "-1", reads);
    }
    _manifestPath = samples.writeManifest();

    PipelineJob job = createJob(StandardPipelines.sequenceCount(4));
    // one worker, so that no two tasks compute the same read concurrently
    job.setNumLocalTasks(1);
    JobResult result = job.run();
    Assert.assertEquals(result.getState(), JobState.SUCCEEDED, result.toString());

    StageCounters canonicalize = result.getStage("canonicalize");
    Assert.assertEquals(canonicalize.getCounter(TaskCounter.INPUT_RECORDS), 55);
    Assert.assertEquals(canonicalize.getCounter(TaskCounter.CACHE_COMPUTED), 18);
    Assert.assertEquals(canonicalize.getCounter(TaskCounter.CACHE_HITS), 37);

    Map<String, String> counts = readOutput(_outputPath);
    Assert.assertEquals(counts.size(), 50);
    String first = canonical(common.get(0));
    for (int s = 0; s < 5; s++)
    {
      Assert.assertEquals(counts.get(first + "\tsample-" + s + "-1"), "2");
    }
  }

  @Test
  public void eachKeyReachesOneReduceTaskTest() throws IOException
  {
    Pipeline pipeline =
        new Pipeline().add(Stage.map("map", FlakyMapper.class).setNumPartitions(3))
                      .add(Stage.reduce("group", GroupSizeReducer.class));
    JobResult result = createJob(pipeline).run();
    Assert.assertEquals(result.getState(), JobState.SUCCEEDED, result.toString());

    List<Record> records = readRecords(_outputPath);
    Map<String, String> groups = new HashMap<String, String>();
    for (Record record : records)
    {
      Assert.assertNull(groups.put(record.getKeyString(), record.getValueString()), record.getKeyString() + " seen twice");
    }
    Assert.assertEquals(groups.get("ACGTT"), partitionOf("ACGTT") + ":3");
    Assert.assertEquals(groups.get("GGCCC"), partitionOf("GGCCC") + ":1");
    Assert.assertEquals(groups.size(), 10);
    for (Map.Entry<String, String> group : groups.entrySet())
    {
      Assert.assertTrue(group.getValue().startsWith(partitionOf(group.getKey()) + ":"), group.toString());
    }
    for (int i = 1; i < records.size(); i++)
    {
      Assert.assertTrue(Record.compareKeys(records.get(i - 1).getKey(), records.get(i).getKey()) < 0);
    }
  }

  @Test
  public void retriedTasksGiveTheSameOutputTest() throws IOException
  {
    JobResult clean = createJob(flakyPipeline(0, -1)).run();
    Assert.assertEquals(clean.getState(), JobState.SUCCEEDED);
    Map<String, String> expected = readOutput(_outputPath);
    cleanPath(_outputPath);

    JobResult retried = createJob(flakyPipeline(1, -1)).run();
    Assert.assertEquals(retried.getState(), JobState.SUCCEEDED, retried.toString());
    StageCounters map = retried.getStage("map");
    // liver-2-1 and brain-1-1 fail too, every sample has at least two reads
    Assert.assertEquals(map.getRetried(), 3);
    Assert.assertEquals(map.getFailed(), 3);
    Assert.assertEquals(map.getSucceeded(), 3);
    Assert.assertEquals(map.getCounter(TaskCounter.INPUT_RECORDS), 12);
    Assert.assertEquals(readOutput(_outputPath), expected);
  }

  @Test
  public void exhaustedRetriesFailTheJobTest() throws IOException
  {
    PipelineJob job = createJob(flakyPipeline(99, 1));
    job.getConf().setInt(JobRunner.MAX_ATTEMPTS, 2);
    JobResult result = job.run();

    Assert.assertEquals(result.getState(), JobState.FAILED);
    Assert.assertEquals(result.getFailedStage(), "map");
    Assert.assertTrue(result.getDiagnostics().contains("Injected failure"), result.getDiagnostics());
    Assert.assertEquals(result.getStage("map").getFailed(), 2);
    Assert.assertNull(result.getStage("count"), "downstream stage must not start");
    Assert.assertFalse(getFileSystem().exists(_outputPath));
    Assert.assertTrue(getFileSystem().exists(new Path(_workPath, WorkLayout.LOGS + "/" + JobRunner.TASK_LOG)));
  }

  @Test
  public void cancelStopsTheJobTest() throws Exception
  {
    PipelineJob job = createJob(slowPipeline());
    job.getConf().setLong(SlowMapper.SLEEP_MS, 2000);
    assertCancelledMidStage(job);
  }

  @Test
  public void cancelStopsRemoteAndElasticTasksTest() throws Exception
  {
    for (String name : new String[] { "remote", "elastic" })
    {
      cleanPath(_workPath);
      cleanPath(_outputPath);
      PipelineJob job = createJob(slowPipeline());
      job.getConf().setLong(SlowMapper.SLEEP_MS, 2000);
      job.getConf().set(BackendFactory.BACKEND, name);
      job.getConf().set(RemoteShellBackend.HOSTS, "node1,node2");
      job.getConf().set(ElasticBackend.CLUSTER_ID, "j-TEST");
      InProcessCommandRunner commands = new InProcessCommandRunner();
      Backend backend = BackendFactory.create(job.getConf(), commands, Collections.<String, String> emptyMap());
      try
      {
        job.setBackend(backend);
        assertCancelledMidStage(job);
        if (name.equals("remote"))
        {
          Assert.assertFalse(commands.getCommands("ssh").isEmpty());
          List<String> kill = commands.getCommands("ssh").get(commands.getCommands("ssh").size() - 1);
          Assert.assertTrue(kill.get(kill.size() - 1).startsWith("pkill -f "), kill.toString());
          Assert.assertEquals(((RemoteShellBackend) backend).getFreeSlots(), backend.capacity());
        }
        else
        {
          Assert.assertFalse(commands.getCommands("aws").isEmpty());
          boolean cancelSteps = false;
          for (List<String> command : commands.getCommands("aws"))
          {
            cancelSteps |= command.get(2).equals("cancel-steps");
          }
          Assert.assertTrue(cancelSteps, "no step was cancelled");
        }
      }
      finally
      {
        backend.close();
      }
    }
  }

  @Test
  public void cancelBeforeRunTest() throws IOException
  {
    PipelineJob job = createJob(StandardPipelines.sequenceCount(2));
    job.cancel();
    JobResult result = job.run();
    Assert.assertEquals(result.getState(), JobState.CANCELLED);
    Assert.assertEquals(result.getStage("canonicalize").getSubmitted(), 0);
  }

  @Test
  public void lostInputIsRegeneratedTest() throws IOException
  {
    JobResult clean = createJob(StandardPipelines.sequenceCount(2)).run();
    Assert.assertEquals(clean.getState(), JobState.SUCCEEDED);
    Map<String, String> expected = readOutput(_outputPath);
    cleanPath(_outputPath);

    PipelineJob job = createJob(StandardPipelines.sequenceCount(2));
    LocalBackend local = new LocalBackend(job.getConf());
    InputDeletingBackend backend = new InputDeletingBackend(local, "count", 1);
    try
    {
      job.setBackend(backend);
      JobResult result = job.run();
      Assert.assertEquals(result.getState(), JobState.SUCCEEDED, result.toString());
      Assert.assertTrue(result.getStage("canonicalize").getRerun() >= 1, result.getStage("canonicalize").toString());
      Assert.assertEquals(result.getStage("canonicalize").getCompletedTasks(), 3);
      Assert.assertTrue(result.getStage("count").getRetried() >= 1);
      Assert.assertTrue(backend.getSubmitted().contains("canonicalize/task-00000-attempt-2"), backend.getSubmitted().toString());
      Assert.assertEquals(readOutput(_outputPath), expected);
    }
    finally
    {
      local.close();
    }
  }

  @Test
  public void startAndStopStagesTest() throws IOException
  {
    JobResult full = createJob(StandardPipelines.sequenceCount(2)).run();
    Assert.assertEquals(full.getState(), JobState.SUCCEEDED);
    Map<String, String> expected = readOutput(_outputPath);
    cleanPath(_outputPath);

    PipelineJob first = createJob(StandardPipelines.sequenceCount(2));
    first.setOutputPath(null);
    first.setKeepIntermediates(true);
    first.getConf().set(JobRunner.STOP_STAGE, "canonicalize");
    JobResult firstResult = first.run();
    Assert.assertEquals(firstResult.getState(), JobState.SUCCEEDED);
    Assert.assertNull(firstResult.getStage("count"));
    Assert.assertTrue(getFileSystem().exists(new Path(_workPath, "canonicalize/" + WorkLayout.taskName(2))));

    PipelineJob second = createJob(StandardPipelines.sequenceCount(2));
    second.setManifestPath(null);
    second.getConf().set(JobRunner.START_STAGE, "count");
    JobResult secondResult = second.run();
    Assert.assertEquals(secondResult.getState(), JobState.SUCCEEDED, secondResult.toString());
    Assert.assertNull(secondResult.getStage("canonicalize"));
    Assert.assertEquals(secondResult.getStage("count").getTotalTasks(), 2);
    Assert.assertEquals(readOutput(_outputPath), expected);
  }

  @Test(expectedExceptions = ConfigurationException.class)
  public void startWithoutUpstreamOutputTest() throws IOException
  {
    PipelineJob job = createJob(StandardPipelines.sequenceCount(2));
    job.getConf().set(JobRunner.START_STAGE, "count");
    job.run();
  }

  @Test(expectedExceptions = ConfigurationException.class, expectedExceptionsMessageRegExp = ".*not empty.*")
  public void nonEmptyOutputIsRejectedTest() throws IOException
  {
    writeText(new Path(_outputPath, "part-00000"), "old\n");
    createJob(StandardPipelines.sequenceCount(2)).run();
  }

  @Test
  public void currentSuffixAndKeptIntermediatesTest() throws IOException
  {
    String before = new SimpleDateFormat("yyyy-MM-dd-HH-mm").format(new Date());
    PipelineJob job = createJob(StandardPipelines.sequenceCount(2));
    job.setOutputPath(new Path(_outputPath, "#CURRENT"));
    job.setKeepIntermediates(true);
    JobResult result = job.run();
    String after = new SimpleDateFormat("yyyy-MM-dd-HH-mm").format(new Date());

    Assert.assertEquals(result.getState(), JobState.SUCCEEDED);
    String name = result.getOutputPath().getName();
    Assert.assertTrue(name.equals(before) || name.equals(after), name);
    Assert.assertEquals(result.getOutputPath().getParent(), _outputPath);
    Assert.assertTrue(getFileSystem().exists(new Path(result.getOutputPath(), WorkLayout.SUCCESS)));
    Assert.assertTrue(getFileSystem().exists(new Path(_workPath, "canonicalize")));
  }

  @Test
  public void jobFromPropertiesTest() throws IOException
  {
    Properties props = new Properties();
    props.setProperty(PipelineJob.MANIFEST_PATH, _manifestPath.toString());
    props.setProperty("work.path", _workPath.toString());
    props.setProperty(JobRunner.OUTPUT_PATH, _outputPath.toString());
    props.setProperty(LocalBackend.NUM_TASKS, "2");
    props.setProperty("hadoop-conf." + JobRunner.POLL_INTERVAL_MS, "20");
    props.setProperty(Pipeline.STAGES, "map,group");
    props.setProperty(Stage.PREFIX + "map.type", "map");
    props.setProperty(Stage.PREFIX + "map.class", FlakyMapper.class.getName());
    props.setProperty(Stage.PREFIX + "map.partitions", "2");
    props.setProperty(Stage.PREFIX + "map.partitioner.class", KeyFieldPartitioner.class.getName());
    props.setProperty(Stage.PREFIX + "map.param." + FlakyMapper.FAIL_ATTEMPTS, "0");
    props.setProperty(Stage.PREFIX + "group.type", "reduce");
    props.setProperty(Stage.PREFIX + "group.class", GroupSizeReducer.class.getName());

    PipelineJob job = new PipelineJob("from-properties", props);
    Assert.assertEquals(job.getPipeline().names(), Arrays.asList("map", "group"));
    Stage map = job.getPipeline().getStage("map");
    Assert.assertEquals(map.getNumPartitions(), 2);
    Assert.assertEquals(map.getBodyClass(), FlakyMapper.class);
    Assert.assertEquals(map.getPartitionerClass(), KeyFieldPartitioner.class);
    Assert.assertEquals(map.getParams().get(FlakyMapper.FAIL_ATTEMPTS), "0");
    Assert.assertFalse(map.isCacheable());
    Assert.assertEquals(job.getProperties().getProperty(JobRunner.POLL_INTERVAL_MS), "20");
    Assert.assertEquals(job.getConf().getLong(JobRunner.POLL_INTERVAL_MS, 0), 20);

    JobResult result = job.run();
    Assert.assertEquals(result.getState(), JobState.SUCCEEDED, result.toString());
    Assert.assertEquals(readRecords(_outputPath).size(), 10);
  }

  @Test
  public void pipelineRoundTripsThroughConfigurationTest()
  {
    Configuration conf = new Configuration(false);
    StandardPipelines.sequenceCount(5).writeTo(conf);
    Pipeline pipeline = Pipeline.fromConfiguration(conf);

    Assert.assertEquals(pipeline.names(), Arrays.asList("canonicalize", "count"));
    Stage canonicalize = pipeline.getStage("canonicalize");
    Assert.assertTrue(canonicalize.isCacheable());
    Assert.assertEquals(canonicalize.getCacheNamespace(), "canonicalize");
    Assert.assertEquals(canonicalize.getCacheParams(), Arrays.asList(CanonicalSequenceMapper.REVERSE_COMPLEMENT));
    Assert.assertEquals(canonicalize.getParams().get(CanonicalSequenceMapper.REVERSE_COMPLEMENT), "true");
    Assert.assertEquals(canonicalize.getNumPartitions(), 5);
    Assert.assertEquals(pipeline.getStage("count").getBodyClass(), SampleCountReducer.class);
    Assert.assertEquals(pipeline.getStage("count").getPartitionerClass(), HashPartitioner.class);
  }

  @Test(expectedExceptions = ConfigurationException.class, expectedExceptionsMessageRegExp = ".*must be a map stage.*")
  public void pipelineMustStartWithMapTest()
  {
    new Pipeline().add(Stage.reduce("count", SampleCountReducer.class)).validate();
  }

  @Test
  public void backendsGiveIdenticalOutputTest() throws IOException
  {
    Map<String, String> expected = null;
    for (String name : new String[] { "local", "scheduler", "remote", "elastic" })
    {
      cleanPath(_workPath);
      cleanPath(_outputPath);
      PipelineJob job = createJob(StandardPipelines.sequenceCount(3));
      job.getConf().set(BackendFactory.BACKEND, name);
      job.getConf().set(RemoteShellBackend.HOSTS, "node1,node2");
      job.getConf().set(ElasticBackend.CLUSTER_ID, "j-TEST");
      InProcessCommandRunner commands = new InProcessCommandRunner();
      Backend backend = BackendFactory.create(job.getConf(), commands, Collections.<String, String> emptyMap());
      try
      {
        job.setBackend(backend);
        JobResult result = job.run();
        Assert.assertEquals(result.getState(), JobState.SUCCEEDED, name + ": " + result);
      }
      finally
      {
        backend.close();
      }

      Map<String, String> output = readOutput(_outputPath);
      if (expected == null)
      {
        expected = output;
        Assert.assertTrue(commands.getCommands().isEmpty());
      }
      else
      {
        Assert.assertEquals(output, expected, name);
        Assert.assertFalse(commands.getCommands().isEmpty(), name);
      }
    }
  }

  // UTILITIES

  private PipelineJob createJob(Pipeline pipeline)
  {
    PipelineJob job = new PipelineJob();
    job.setManifestPath(_manifestPath);
    job.setWorkPath(_workPath);
    job.setOutputPath(_outputPath);
    job.setPipeline(pipeline);
    job.setNumLocalTasks(2);
    job.getConf().setLong(JobRunner.POLL_INTERVAL_MS, 20);
    job.getConf().setLong(SharedStorageResultCache.CLAIM_POLL_MS, 10);
    return job;
  }

  private static Pipeline slowPipeline()
  {
    return new Pipeline().add(Stage.map("slow", SlowMapper.class).setNumPartitions(2))
                         .add(Stage.reduce("count", GroupSizeReducer.class));
  }

  /**
   * Runs the job in the background, cancels it once a task of the first stage has started and checks
   * that nothing was committed.
   */
  private void assertCancelledMidStage(final PipelineJob job) throws Exception
  {
    final AtomicReference<Object> outcome = new AtomicReference<Object>();
    Thread runner = new Thread(new Runnable()
    {
      @Override
      public void run()
      {
        try
        {
          outcome.set(job.run());
        }
        catch (Exception e)
        {
          outcome.set(e);
        }
      }
    });
    runner.start();

    Path temporary = new Path(new Path(_workPath, "slow"), WorkLayout.TEMPORARY);
    long deadline = System.currentTimeMillis() + 30000;
    while (!getFileSystem().exists(temporary) && System.currentTimeMillis() < deadline)
    {
      Thread.sleep(10);
    }
    Assert.assertTrue(getFileSystem().exists(temporary), "no task started");
    job.cancel();
    runner.join(30000);
    Assert.assertFalse(runner.isAlive(), "job did not stop");

    Assert.assertTrue(outcome.get() instanceof JobResult, String.valueOf(outcome.get()));
    JobResult result = (JobResult) outcome.get();
    Assert.assertEquals(result.getState(), JobState.CANCELLED);
    Assert.assertNull(result.getStage("count"));
    Assert.assertFalse(getFileSystem().exists(_outputPath));
    for (int i = 0; i < 3; i++)
    {
      Path task = new Path(_workPath, "slow/" + WorkLayout.taskName(i));
      Assert.assertFalse(getFileSystem().exists(task), task + " was committed");
    }
  }

  private static Pipeline flakyPipeline(int failAttempts, int failTask)
  {
    return new Pipeline().add(Stage.map("map", FlakyMapper.class)
                                   .setNumPartitions(2)
                                   .setParam(FlakyMapper.FAIL_ATTEMPTS, Integer.toString(failAttempts))
                                   .setParam(FlakyMapper.FAIL_TASK, Integer.toString(failTask)))
                         .add(Stage.reduce("count", GroupSizeReducer.class).setNumPartitions(2));
  }

  private List<Record> readRecords(Path output) throws IOException
  {
    RecordFiles files = new RecordFiles(getFileSystem(), getConf());
    List<Record> records = new ArrayList<Record>();
    for (FileStatus status : getFileSystem().listStatus(output))
    {
      if (status.getPath().getName().startsWith("part-"))
      {
        records.addAll(RecordInputs.readAll(files.open(status.getPath())));
      }
    }
    return records;
  }

  private Map<String, String> readOutput(Path output) throws IOException
  {
    Map<String, String> values = new HashMap<String, String>();
    for (Record record : readRecords(output))
    {
      Assert.assertNull(values.put(record.getKeyString(), record.getValueString()), "duplicate key " + record.getKeyString());
    }
    return values;
  }

  private static int partitionOf(String key)
  {
    return new HashPartitioner().getPartition(key.getBytes(StandardCharsets.UTF_8), 3);
  }

  private static String randomSequence(Random random, int length)
  {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < length; i++)
    {
      sb.append("ACGT".charAt(random.nextInt(4)));
    }
    return sb.toString();
  }

  private static String canonical(String sequence)
  {
    StringBuilder rc = new StringBuilder();
    for (int i = sequence.length() - 1; i >= 0; i--)
    {
      rc.append("TGCA".charAt("ACGT".indexOf(sequence.charAt(i))));
    }
    return sequence.compareTo(rc.toString()) <= 0 ? sequence : rc.toString();
  }
}
