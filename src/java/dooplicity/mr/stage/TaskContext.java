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

package dooplicity.mr.stage;

import java.util.Map;
import java.util.TreeMap;

import org.apache.hadoop.conf.Configuration;

/**
 * What a stage body may know about the task running it.
 */
public class TaskContext
{
  private final Stage stage;
  private final int taskIndex;
  private final int attempt;
  private final Configuration conf;
  private final Map<String, Long> counters = new TreeMap<String, Long>();

  public TaskContext(Stage stage, int taskIndex, int attempt, Configuration conf)
  {
    this.stage = stage;
    this.taskIndex = taskIndex;
    this.attempt = attempt;
    this.conf = conf;
  }

  public Stage getStage()
  {
    return stage;
  }

  public int getTaskIndex()
  {
    return taskIndex;
  }

  /**
   * Attempt number, starting at 1.
   */
  public int getAttempt()
  {
    return attempt;
  }

  /**
   * Stage configuration: the job configuration overlaid with the stage's own parameters.
   */
  public Configuration getConf()
  {
    return conf;
  }

  public String getParam(String name, String defaultValue)
  {
    return conf.get(name, defaultValue);
  }

  public int getIntParam(String name, int defaultValue)
  {
    return conf.getInt(name, defaultValue);
  }

  /**
   * Adds to a body-defined counter reported with the task.
   */
  public void incrementCounter(String name, long amount)
  {
    Long current = counters.get(name);
    counters.put(name, current == null ? amount : current + amount);
  }

  public Map<String, Long> getCounters()
  {
    return counters;
  }
}
