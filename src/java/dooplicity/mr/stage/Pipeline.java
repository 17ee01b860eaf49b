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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.hadoop.conf.Configuration;

import dooplicity.mr.ConfigurationException;

/**
 * An ordered, linear chain of stages. Stage <em>i + 1</em> runs one task per output partition of stage
 * <em>i</em>; the first stage must be a map stage and runs one task per manifest entry.
 *
 * <p>
 * The stage order is stored in <em>pipeline.stages</em> as a comma-separated list of stage names.
 * </p>
 */
public class Pipeline
{
  public static final String STAGES = "pipeline.stages";

  private final List<Stage> stages = new ArrayList<Stage>();

  public Pipeline add(Stage stage)
  {
    for (Stage existing : stages)
    {
      if (existing.getName().equals(stage.getName()))
      {
        throw new ConfigurationException("Duplicate stage name: " + stage.getName());
      }
    }
    stages.add(stage);
    return this;
  }

  public List<Stage> getStages()
  {
    return Collections.unmodifiableList(stages);
  }

  public int size()
  {
    return stages.size();
  }

  public Stage getStage(int index)
  {
    return stages.get(index);
  }

  public Stage getStage(String name)
  {
    return stages.get(indexOf(name));
  }

  public int indexOf(String name)
  {
    for (int i = 0; i < stages.size(); i++)
    {
      if (stages.get(i).getName().equals(name))
      {
        return i;
      }
    }
    throw new ConfigurationException(String.format("Unknown stage '%s'. Stages are %s", name, names()));
  }

  public List<String> names()
  {
    List<String> names = new ArrayList<String>();
    for (Stage stage : stages)
    {
      names.add(stage.getName());
    }
    return names;
  }

  public void validate()
  {
    if (stages.isEmpty())
    {
      throw new ConfigurationException("The pipeline has no stages. Set '" + STAGES + "'.");
    }
    if (stages.get(0).getType() != StageType.MAP)
    {
      throw new ConfigurationException(String.format("The first stage (%s) must be a map stage", stages.get(0).getName()));
    }
    Set<String> seen = new HashSet<String>();
    for (Stage stage : stages)
    {
      if (!seen.add(stage.getName()))
      {
        throw new ConfigurationException("Duplicate stage name: " + stage.getName());
      }
      stage.validate();
    }
  }

  public void writeTo(Configuration conf)
  {
    conf.setStrings(STAGES, names().toArray(new String[0]));
    for (Stage stage : stages)
    {
      stage.writeTo(conf);
    }
  }

  public static Pipeline fromConfiguration(Configuration conf)
  {
    Pipeline pipeline = new Pipeline();
    for (String name : conf.getTrimmedStrings(STAGES))
    {
      pipeline.add(Stage.fromConfiguration(conf, name));
    }
    pipeline.validate();
    return pipeline;
  }

  @Override
  public String toString()
  {
    return stages.toString();
  }
}
