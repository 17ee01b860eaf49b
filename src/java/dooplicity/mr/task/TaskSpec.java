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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;

import dooplicity.mr.ConfigurationException;
import dooplicity.mr.fs.SharedStorage;
import dooplicity.mr.fs.WorkLayout;
import dooplicity.mr.manifest.ManifestEntry;
import dooplicity.mr.stage.Stage;

/**
 * Everything a worker needs to run one attempt of one task.
 *
 * <p>
 * A spec is the job configuration (which carries the pipeline definition) plus a few <em>task.*</em>
 * keys. It is written to the working directory as Hadoop configuration XML, the task descriptor, which is
 * all a remote worker is given. A task of the first stage reads one manifest entry; a task of a later
 * stage reads one partition of every upstream task, where the i-th input was produced by upstream task
 * i.
 * </p>
 */
public class TaskSpec
{
  public static final String WORK_PATH = "work.path";
  public static final String STAGE = "task.stage";
  public static final String INDEX = "task.index";
  public static final String ATTEMPT = "task.attempt";
  public static final String INPUT_STAGE = "task.input.stage";
  public static final String INPUTS = "task.inputs";
  public static final String MANIFEST_LABEL = "task.manifest.label";
  public static final String MANIFEST_URLS = "task.manifest.urls";
  public static final String MANIFEST_MD5S = "task.manifest.md5s";

  private final Configuration conf;

  private TaskSpec(Configuration conf)
  {
    this.conf = conf;
  }

  public static TaskSpec forManifestEntry(Configuration jobConf, String stage, int taskIndex, ManifestEntry entry)
  {
    Configuration conf = taskConf(jobConf, stage, taskIndex);
    conf.set(MANIFEST_LABEL, entry.getLabel());
    setList(conf, MANIFEST_URLS, entry.getUrls());
    List<String> md5s = new ArrayList<String>();
    for (String md5 : entry.getMd5s())
    {
      md5s.add(md5 == null ? "0" : md5);
    }
    setList(conf, MANIFEST_MD5S, md5s);
    return new TaskSpec(conf);
  }

  public static TaskSpec forPartition(Configuration jobConf, String stage, int taskIndex, String inputStage, List<Path> inputs)
  {
    Configuration conf = taskConf(jobConf, stage, taskIndex);
    conf.set(INPUT_STAGE, inputStage);
    List<String> paths = new ArrayList<String>();
    for (Path input : inputs)
    {
      paths.add(input.toString());
    }
    setList(conf, INPUTS, paths);
    return new TaskSpec(conf);
  }

  /**
   * Stores each value under its own indexed key, <em>name.0</em>, <em>name.1</em>, ..., with the count
   * under <em>name.count</em>. URLs and paths may contain commas, so the comma-joined form of
   * {@link Configuration#setStrings} cannot be used.
   */
  static void setList(Configuration conf, String name, List<String> values)
  {
    conf.setInt(name + ".count", values.size());
    for (int i = 0; i < values.size(); i++)
    {
      conf.set(name + "." + i, values.get(i));
    }
  }

  static List<String> getList(Configuration conf, String name)
  {
    int count = conf.getInt(name + ".count", 0);
    List<String> values = new ArrayList<String>(count);
    for (int i = 0; i < count; i++)
    {
      String value = conf.get(name + "." + i);
      if (value == null)
      {
        throw new ConfigurationException(String.format("Missing '%s.%d' of %d values", name, i, count));
      }
      values.add(value);
    }
    return values;
  }

  private static Configuration taskConf(Configuration jobConf, String stage, int taskIndex)
  {
    if (jobConf.get(WORK_PATH) == null)
    {
      throw new ConfigurationException("Working path not set. Set '" + WORK_PATH + "'.");
    }
    Configuration conf = new Configuration(jobConf);
    conf.set(STAGE, stage);
    conf.setInt(INDEX, taskIndex);
    conf.setInt(ATTEMPT, 1);
    return conf;
  }

  /**
   * A copy of this spec for another attempt of the same task.
   */
  public TaskSpec withAttempt(int attempt)
  {
    Configuration copy = new Configuration(conf);
    copy.setInt(ATTEMPT, attempt);
    return new TaskSpec(copy);
  }

  public Configuration getConf()
  {
    return conf;
  }

  public String getStageName()
  {
    return conf.get(STAGE);
  }

  public int getTaskIndex()
  {
    return conf.getInt(INDEX, -1);
  }

  public int getAttempt()
  {
    return conf.getInt(ATTEMPT, 1);
  }

  public Path getWorkPath()
  {
    return new Path(conf.get(WORK_PATH));
  }

  public WorkLayout getLayout()
  {
    return new WorkLayout(getWorkPath());
  }

  public Stage getStage()
  {
    return Stage.fromConfiguration(conf, getStageName());
  }

  public boolean readsManifest()
  {
    return conf.get(MANIFEST_LABEL) != null;
  }

  /**
   * @return the manifest entry of a first-stage task, <code>null</code> for later stages
   */
  public ManifestEntry getManifestEntry()
  {
    String label = conf.get(MANIFEST_LABEL);
    if (label == null)
    {
      return null;
    }
    List<String> urls = getList(conf, MANIFEST_URLS);
    List<String> md5s = getList(conf, MANIFEST_MD5S);
    if (urls.size() == 2 && md5s.size() == 2)
    {
      return new ManifestEntry(urls.get(0), md5(md5s.get(0)), urls.get(1), md5(md5s.get(1)), label);
    }
    if (urls.size() != 1 || md5s.size() != 1)
    {
      throw new ConfigurationException(String.format("Task %s has %d source URLs and %d checksums", getTaskId(), urls.size(), md5s.size()));
    }
    return new ManifestEntry(urls.get(0), md5(md5s.get(0)), label);
  }

  private static String md5(String value)
  {
    return "0".equals(value) ? null : value;
  }

  public String getInputStage()
  {
    return conf.get(INPUT_STAGE);
  }

  /**
   * Upstream partition files, in upstream task order.
   */
  public List<Path> getInputs()
  {
    List<Path> inputs = new ArrayList<Path>();
    for (String input : getList(conf, INPUTS))
    {
      inputs.add(new Path(input));
    }
    return Collections.unmodifiableList(inputs);
  }

  public Path getOutputPath()
  {
    return getLayout().taskOutput(getStageName(), getTaskIndex());
  }

  public Path getAttemptPath()
  {
    return getLayout().attemptDir(getStageName(), getTaskIndex(), getAttempt());
  }

  public Path getDescriptorPath()
  {
    return getLayout().descriptor(getStageName(), getTaskIndex(), getAttempt());
  }

  public Path getStatusPath()
  {
    return getLayout().status(getStageName(), getTaskIndex(), getAttempt());
  }

  /**
   * Identifies the task across its attempts, e.g. <em>align/task-00003</em>.
   */
  public String getTaskName()
  {
    return getStageName() + "/" + WorkLayout.taskName(getTaskIndex());
  }

  /**
   * Identifies this attempt, e.g. <em>align/task-00003-attempt-2</em>.
   */
  public String getTaskId()
  {
    return getStageName() + "/" + WorkLayout.attemptName(getTaskIndex(), getAttempt());
  }

  public Path writeDescriptor(SharedStorage storage) throws IOException
  {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    conf.writeXml(out);
    Path descriptor = getDescriptorPath();
    storage.writeFully(descriptor, out.toByteArray());
    return descriptor;
  }

  public static TaskSpec readDescriptor(Path descriptor, Configuration base) throws IOException
  {
    SharedStorage storage = SharedStorage.get(descriptor, base);
    byte[] xml = storage.readFully(descriptor);
    if (xml == null)
    {
      throw new IOException("Task descriptor not found: " + descriptor);
    }
    Configuration conf = new Configuration(false);
    conf.addResource(new ByteArrayInputStream(xml), descriptor.toString());
    if (conf.get(STAGE) == null || conf.get(WORK_PATH) == null)
    {
      throw new IOException("Not a task descriptor: " + descriptor);
    }
    return new TaskSpec(conf);
  }

  @Override
  public String toString()
  {
    return getTaskId();
  }
}
