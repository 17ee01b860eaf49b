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
import java.util.Properties;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.conf.Configured;
import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;

import dooplicity.mr.ConfigurationException;
import dooplicity.mr.backend.Backend;
import dooplicity.mr.backend.BackendFactory;
import dooplicity.mr.backend.LocalBackend;
import dooplicity.mr.manifest.Manifest;
import dooplicity.mr.stage.Pipeline;

/**
 * A pipeline run over the samples of a manifest.
 *
 * <p>
 * Jobs can be configured either by providing properties or by calling setters. Each property has a
 * corresponding setter. Every property is also copied into the job's Hadoop configuration, which is how
 * it reaches the backend and the tasks.
 * </p>
 *
 * This class recognizes the following properties:
 *
 * <ul>
 * <li><em>manifest.path</em> - Manifest listing the input samples</li>
 * <li><em>work.path</em> - Working directory for intermediate data, on storage every task can reach</li>
 * <li><em>output.path</em> - Where the final stage's partitions are merged to; may end in
 * <em>#CURRENT</em></li>
 * <li><em>keep.intermediates</em> - Keep the working directory after a successful run (boolean)</li>
 * <li><em>backend</em> - <code>local</code>, <code>scheduler</code>, <code>remote</code> or
 * <code>elastic</code></li>
 * <li><em>local.num.tasks</em> - Worker threads of the local backend</li>
 * <li><em>job.start.stage</em>, <em>job.stop.stage</em> - Run only part of the pipeline</li>
 * <li><em>pipeline.stages</em> and <em>pipeline.stage.*</em> - The pipeline, see {@link Pipeline}</li>
 * </ul>
 *
 * <p>
 * Properties starting with <em>hadoop-conf.</em> are set in the configuration without the prefix.
 * </p>
 *
 * <p>
 * The <em>output.path</em> property may end with <em>#CURRENT</em>, which is replaced by the time the job
 * starts in <em>yyyy-MM-dd-HH-mm</em> format, so that repeated runs write to dated directories.
 * </p>
 *
 * <p>
 * The working path is the only required parameter, along with the manifest when the run starts at the
 * first stage. The rest is optional.
 * </p>
 *
 * <p>
 * Three methods can be overridden to customize the execution flow:
 * <ul>
 * <li><em>init(): </em>Just after instantiation</li>
 * <li><em>configure(): </em>Before the job starts</li>
 * <li><em>finish(): </em>After the job ended (successfully or not)</li>
 * </ul>
 * </p>
 */
public class PipelineJob extends Configured
{
  public static final String MANIFEST_PATH = "manifest.path";

  private static String HADOOP_PREFIX = "hadoop-conf.";

  private final Logger _log = Logger.getLogger(PipelineJob.class);

  private Properties props;
  private String name;
  private Path manifestPath;
  private Path workPath;
  private Path outputPath;
  private boolean keepIntermediates;
  private Pipeline pipeline;
  private Backend backend;
  private volatile JobRunner runner;
  private volatile boolean cancelled;

  /**
   * Initializes the job.
   */
  public PipelineJob()
  {
    setConf(new Configuration());
    setName(getClass().getSimpleName());
  }

  /**
   * Initializes the job with a job name and properties.
   *
   * @param name
   *          Job name
   * @param props
   *          Configuration properties
   */
  public PipelineJob(String name, Properties props)
  {
    this();
    setName(name);
    setProperties(props);
  }

  public String getName()
  {
    return name;
  }

  public void setName(String name)
  {
    this.name = name;
  }

  public Properties getProperties()
  {
    return props;
  }

  /**
   * Sets the configuration properties.
   *
   * @param props
   *          Properties
   */
  public void setProperties(Properties props)
  {
    this.props = props;
    updateConfigurationFromProps(props);

    if (props.containsKey(MANIFEST_PATH))
    {
      setManifestPath(new Path(props.getProperty(MANIFEST_PATH)));
    }

    if (props.containsKey("work.path"))
    {
      setWorkPath(new Path(props.getProperty("work.path")));
    }

    if (props.containsKey(JobRunner.OUTPUT_PATH))
    {
      setOutputPath(new Path(props.getProperty(JobRunner.OUTPUT_PATH)));
    }

    if (props.get(JobRunner.KEEP_INTERMEDIATES) != null)
    {
      setKeepIntermediates(Boolean.parseBoolean(props.getProperty(JobRunner.KEEP_INTERMEDIATES)));
    }

    if (props.containsKey(LocalBackend.NUM_TASKS))
    {
      try
      {
        setNumLocalTasks(Integer.parseInt(props.getProperty(LocalBackend.NUM_TASKS).trim()));
      }
      catch (NumberFormatException e)
      {
        throw new ConfigurationException("Could not parse " + LocalBackend.NUM_TASKS + ": " + props.get(LocalBackend.NUM_TASKS), e);
      }
    }
    _log.info(String.format("Keeping intermediates: %s", keepIntermediates));
  }

  /**
   * Overridden to provide custom configuration after instantiation
   *
   * @param conf
   */
  public void init(Configuration conf)
  {
  }

  /**
   * Overridden to provide custom configuration before the job starts.
   *
   * @param runner
   */
  public void configure(JobRunner runner)
  {
  }

  /**
   * Overridden to provide custom actions after the job ends.
   *
   * @param result
   */
  public void finish(JobResult result)
  {
  }

  public Path getManifestPath()
  {
    return manifestPath;
  }

  /**
   * Sets the manifest path. Can also be set with <em>manifest.path</em>.
   */
  public void setManifestPath(Path manifestPath)
  {
    this.manifestPath = manifestPath;
  }

  public Path getWorkPath()
  {
    return workPath;
  }

  /**
   * Sets the working path. Can also be set with <em>work.path</em>.
   */
  public void setWorkPath(Path workPath)
  {
    this.workPath = workPath;
  }

  public Path getOutputPath()
  {
    return outputPath;
  }

  /**
   * Sets the output path. Can also be set with <em>output.path</em>.
   */
  public void setOutputPath(Path outputPath)
  {
    this.outputPath = outputPath;
  }

  public boolean isKeepIntermediates()
  {
    return keepIntermediates;
  }

  /**
   * Sets whether to keep the working directory after success. Can also be set with
   * <em>keep.intermediates</em>.
   */
  public void setKeepIntermediates(boolean keepIntermediates)
  {
    this.keepIntermediates = keepIntermediates;
  }

  /**
   * Sets the number of local worker threads. Can also be set with <em>local.num.tasks</em>.
   */
  public void setNumLocalTasks(int numTasks)
  {
    getConf().setInt(LocalBackend.NUM_TASKS, numTasks);
  }

  /**
   * Gets the pipeline. Unless one was set, it is read from the <em>pipeline.*</em> properties.
   *
   * @return the pipeline
   */
  public Pipeline getPipeline()
  {
    if (pipeline == null && getConf().get(Pipeline.STAGES) != null)
    {
      pipeline = Pipeline.fromConfiguration(getConf());
    }
    return pipeline;
  }

  public void setPipeline(Pipeline pipeline)
  {
    this.pipeline = pipeline;
  }

  /**
   * Sets the backend to use instead of the one named by <em>backend</em>. The job does not close a
   * backend it was given.
   */
  public void setBackend(Backend backend)
  {
    this.backend = backend;
  }

  /**
   * Stops a running job, see {@link JobRunner#cancel()}. A job cancelled before it starts does not
   * start.
   */
  public void cancel()
  {
    cancelled = true;
    JobRunner current = runner;
    if (current != null)
    {
      current.cancel();
    }
  }

  /**
   * Run the job.
   *
   * @return the result; failures of tasks are reported in it rather than thrown
   * @throws ConfigurationException
   *           when the job is misconfigured, before anything is submitted
   * @throws IOException
   *           when the working storage fails
   */
  public JobResult run() throws IOException
  {
    init(getConf());

    if (getWorkPath() == null)
    {
      throw new ConfigurationException("Working path is not specified. Setup the 'work.path' parameter.");
    }
    getConf().set("work.path", getWorkPath().toString());
    if (getOutputPath() != null)
    {
      getConf().set(JobRunner.OUTPUT_PATH, getOutputPath().toString());
    }
    getConf().setBoolean(JobRunner.KEEP_INTERMEDIATES, isKeepIntermediates());

    Pipeline pipeline = getPipeline();
    if (pipeline == null)
    {
      throw new ConfigurationException("No pipeline is defined. Setup the '" + Pipeline.STAGES + "' parameter.");
    }
    pipeline.validate();

    Manifest manifest = null;
    String startStage = getConf().getTrimmed(JobRunner.START_STAGE);
    if (startStage == null || pipeline.indexOf(startStage) == 0)
    {
      if (getManifestPath() == null)
      {
        throw new ConfigurationException("Manifest path is not specified. Setup the '" + MANIFEST_PATH + "' parameter.");
      }
      manifest = Manifest.load(getManifestPath(), getConf());
      _log.info(String.format("Read %d samples from %s", manifest.size(), getManifestPath()));
    }

    boolean ownBackend = backend == null;
    Backend jobBackend = ownBackend ? BackendFactory.create(getConf()) : backend;
    try
    {
      JobRunner jobRunner = new JobRunner(getConf(), pipeline, manifest, jobBackend);
      configure(jobRunner);
      runner = jobRunner;
      if (cancelled)
      {
        jobRunner.cancel();
      }
      _log.info(String.format("Running job %s (%s)", getName(), jobRunner.getRunId()));
      JobResult result = jobRunner.run();
      finish(result);
      return result;
    }
    finally
    {
      runner = null;
      if (ownBackend)
      {
        jobBackend.close();
      }
    }
  }

  /**
   * Copies the properties into the Hadoop configuration.
   *
   * @param props
   */
  private void updateConfigurationFromProps(Properties props)
  {
    Configuration config = getConf();

    if (config == null)
    {
      config = new Configuration();
      setConf(config);
    }

    for (String key : props.stringPropertyNames())
    {
      String newKey = key;
      String value = props.getProperty(key);

      if (key.toLowerCase().startsWith(HADOOP_PREFIX))
      {
        newKey = key.substring(HADOOP_PREFIX.length());
        config.set(newKey, value);
        props.remove(key);
        props.setProperty(newKey, value);
      }
      else
      {
        config.set(key, value);
      }
    }
  }
}
