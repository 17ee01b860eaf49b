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

package dooplicity.mr.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.conf.Configured;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;
import org.apache.hadoop.util.Tool;
import org.apache.hadoop.util.ToolRunner;
import org.apache.log4j.Logger;

import dooplicity.mr.ConfigurationException;
import dooplicity.mr.backend.BackendFactory;
import dooplicity.mr.backend.LocalBackend;
import dooplicity.mr.jobs.JobResult;
import dooplicity.mr.jobs.JobRunner;
import dooplicity.mr.jobs.JobState;
import dooplicity.mr.jobs.PipelineJob;
import dooplicity.mr.stage.Pipeline;
import dooplicity.mr.stages.StandardPipelines;
import dooplicity.mr.task.TaskSpec;

/**
 * Command line front end: runs one pipeline over a manifest and exits with a status describing how the
 * run ended.
 *
 * <pre>
 * dooplicity run -manifest M -work W [-output O] [-backend B] [-tasks N] [-pipeline P] [-D k=v]...
 * </pre>
 *
 * <p>
 * <em>-pipeline</em> is either a properties file holding <em>pipeline.*</em> keys or the name of a
 * built-in pipeline. Generic Hadoop options such as <em>-D</em> are handled by {@link ToolRunner} and end
 * up in the job configuration.
 * </p>
 */
public class RunTool extends Configured implements Tool
{
  public static final int EXIT_SUCCESS = 0;
  public static final int EXIT_CONFIGURATION = 2;
  public static final int EXIT_FAILED = 3;
  public static final int EXIT_CANCELLED = 4;

  public static final String PARTITIONS = "pipeline.partitions";
  public static final int DEFAULT_PARTITIONS = 8;

  private final Logger _log = Logger.getLogger(RunTool.class);

  private volatile PipelineJob job;
  private boolean installShutdownHook = true;

  public RunTool()
  {
  }

  public RunTool(Configuration conf)
  {
    super(conf);
  }

  /**
   * Whether {@link #run(String[])} cancels the job when the JVM is asked to stop. Embedded callers turn
   * this off and call {@link #cancel()} themselves.
   */
  public void setInstallShutdownHook(boolean installShutdownHook)
  {
    this.installShutdownHook = installShutdownHook;
  }

  /**
   * Cancels the job being run, if any.
   */
  public void cancel()
  {
    PipelineJob current = job;
    if (current != null)
    {
      current.cancel();
    }
  }

  static Options buildOptions()
  {
    Options options = new Options();
    options.addOption(createOption("manifest", "Manifest listing the input samples", "path", false));
    options.addOption(createOption("work", "Working directory on storage every task can reach", "path", true));
    options.addOption(createOption("output", "Where the final stage's output is merged to; may end in #CURRENT", "path", false));
    options.addOption(createOption("backend", "local, scheduler, remote or elastic (default local)", "name", false));
    options.addOption(createOption("tasks", "Worker threads of the local backend", "n", false));
    options.addOption(createOption("pipeline", "Pipeline properties file or built-in pipeline name (default "
        + StandardPipelines.SEQUENCE_COUNT + ")", "file|name", false));
    options.addOption(createOption("partitions", "Output partitions of a built-in pipeline's first stage", "n", false));
    options.addOption(createOption("start", "First stage to run", "stage", false));
    options.addOption(createOption("stop", "Last stage to run", "stage", false));
    options.addOption(Option.builder("keep").desc("Keep the working directory after success").build());
    options.addOption(Option.builder("help").desc("Print this message").build());
    return options;
  }

  private static Option createOption(String name, String desc, String argName, boolean required)
  {
    return Option.builder(name).desc(desc).hasArg().argName(argName).required(required).build();
  }

  @Override
  public int run(String[] args) throws Exception
  {
    Options options = buildOptions();
    if (Arrays.asList(args).contains("-help"))
    {
      printUsage(options);
      return EXIT_SUCCESS;
    }

    CommandLine cmdLine;
    try
    {
      CommandLineParser parser = new DefaultParser();
      cmdLine = parser.parse(options, args);
    }
    catch (ParseException e)
    {
      System.err.println(e.getMessage());
      printUsage(options);
      return EXIT_CONFIGURATION;
    }

    final PipelineJob pipelineJob;
    try
    {
      pipelineJob = createJob(cmdLine);
    }
    catch (ConfigurationException e)
    {
      reportConfigurationError(e);
      return EXIT_CONFIGURATION;
    }
    catch (IOException e)
    {
      _log.error("Could not read the pipeline definition", e);
      return EXIT_CONFIGURATION;
    }

    final CountDownLatch done = new CountDownLatch(1);
    Thread hook = null;
    if (installShutdownHook)
    {
      hook = new Thread("dooplicity-cancel")
      {
        @Override
        public void run()
        {
          _log.warn("Shutdown requested, cancelling job");
          pipelineJob.cancel();
          try
          {
            done.await();
          }
          catch (InterruptedException e)
          {
            Thread.currentThread().interrupt();
          }
        }
      };
      Runtime.getRuntime().addShutdownHook(hook);
    }

    job = pipelineJob;
    try
    {
      JobResult result = pipelineJob.run();
      return exitCode(result);
    }
    catch (ConfigurationException e)
    {
      reportConfigurationError(e);
      return EXIT_CONFIGURATION;
    }
    catch (IOException e)
    {
      _log.error("Job failed", e);
      return EXIT_FAILED;
    }
    finally
    {
      job = null;
      done.countDown();
      if (hook != null)
      {
        removeShutdownHook(hook);
      }
    }
  }

  static int exitCode(JobResult result)
  {
    if (result.getState() == JobState.SUCCEEDED)
    {
      return EXIT_SUCCESS;
    }
    if (result.getState() == JobState.CANCELLED)
    {
      return EXIT_CANCELLED;
    }
    return EXIT_FAILED;
  }

  PipelineJob createJob(CommandLine cmdLine) throws IOException
  {
    Configuration conf = getConf() != null ? getConf() : new Configuration();
    Properties props = new Properties();

    String pipelineArg = cmdLine.getOptionValue("pipeline", StandardPipelines.SEQUENCE_COUNT);
    Pipeline builtIn = null;
    if (pipelineArg.endsWith(".properties"))
    {
      props.putAll(loadProperties(new Path(pipelineArg), conf));
    }
    else
    {
      int partitions = parseInt(cmdLine.getOptionValue("partitions"), PARTITIONS, conf.getInt(PARTITIONS, DEFAULT_PARTITIONS));
      builtIn = StandardPipelines.byName(pipelineArg, partitions);
    }

    props.setProperty(TaskSpec.WORK_PATH, cmdLine.getOptionValue("work"));
    setIfPresent(props, cmdLine, "manifest", PipelineJob.MANIFEST_PATH);
    setIfPresent(props, cmdLine, "output", JobRunner.OUTPUT_PATH);
    setIfPresent(props, cmdLine, "backend", BackendFactory.BACKEND);
    setIfPresent(props, cmdLine, "start", JobRunner.START_STAGE);
    setIfPresent(props, cmdLine, "stop", JobRunner.STOP_STAGE);
    if (cmdLine.hasOption("tasks"))
    {
      props.setProperty(LocalBackend.NUM_TASKS, Integer.toString(parseInt(cmdLine.getOptionValue("tasks"), "-tasks", 0)));
    }
    if (cmdLine.hasOption("keep"))
    {
      props.setProperty(JobRunner.KEEP_INTERMEDIATES, "true");
    }

    PipelineJob pipelineJob = new PipelineJob();
    pipelineJob.setConf(new Configuration(conf));
    pipelineJob.setName("dooplicity-" + pipelineArg);
    pipelineJob.setProperties(props);
    if (builtIn != null)
    {
      pipelineJob.setPipeline(builtIn);
    }
    return pipelineJob;
  }

  private static Properties loadProperties(Path path, Configuration conf) throws IOException
  {
    FileSystem fs = path.getFileSystem(conf);
    if (!fs.exists(path))
    {
      throw new ConfigurationException("Pipeline file does not exist: " + path);
    }
    Properties props = new Properties();
    InputStream in = fs.open(path);
    try
    {
      props.load(in);
    }
    finally
    {
      IOUtils.closeStream(in);
    }
    return props;
  }

  private static void setIfPresent(Properties props, CommandLine cmdLine, String option, String key)
  {
    if (cmdLine.hasOption(option))
    {
      props.setProperty(key, cmdLine.getOptionValue(option));
    }
  }

  private static int parseInt(String value, String name, int defaultValue)
  {
    if (value == null)
    {
      return defaultValue;
    }
    try
    {
      int parsed = Integer.parseInt(value.trim());
      if (parsed < 1)
      {
        throw new ConfigurationException(String.format("%s must be positive, got %d", name, parsed));
      }
      return parsed;
    }
    catch (NumberFormatException e)
    {
      throw new ConfigurationException(String.format("Could not parse %s: %s", name, value), e);
    }
  }

  private void reportConfigurationError(ConfigurationException e)
  {
    _log.error("Invalid configuration: " + e.getMessage());
    for (String problem : e.getProblems())
    {
      System.err.println(problem);
    }
  }

  private void removeShutdownHook(Thread hook)
  {
    try
    {
      Runtime.getRuntime().removeShutdownHook(hook);
    }
    catch (IllegalStateException e)
    {
      // JVM is already shutting down; the hook is running
      _log.debug("Shutdown in progress, leaving hook registered");
    }
  }

  private static void printUsage(Options options)
  {
    HelpFormatter formatter = new HelpFormatter();
    PrintWriter out = new PrintWriter(System.err);
    formatter.printHelp(out, 100, "dooplicity run", null, options, 2, 4, "Generic Hadoop options such as -D k=v are accepted.", true);
    out.flush();
  }

  public static void main(String[] args) throws Exception
  {
    int exitCode = ToolRunner.run(new RunTool(), args);
    System.exit(exitCode);
  }
}
