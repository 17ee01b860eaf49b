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

package dooplicity.mr.stages;

import java.util.Collections;

import dooplicity.mr.ConfigurationException;
import dooplicity.mr.stage.Pipeline;
import dooplicity.mr.stage.Stage;

/**
 * Pipelines that ship with the library, selectable by name.
 */
public class StandardPipelines
{
  public static final String SEQUENCE_COUNT = "sequence-count";

  private StandardPipelines()
  {
  }

  /**
   * Canonicalizes every read with redundancy elimination across samples, then counts each canonical
   * sequence per sample.
   *
   * @param partitions
   *          number of count tasks
   */
  public static Pipeline sequenceCount(int partitions)
  {
    return new Pipeline().add(Stage.map("canonicalize", CanonicalSequenceMapper.class)
                                   .setNumPartitions(partitions)
                                   .setCacheable(true)
                                   .setParam(CanonicalSequenceMapper.REVERSE_COMPLEMENT, "true")
                                   .setCacheParams(Collections.singletonList(CanonicalSequenceMapper.REVERSE_COMPLEMENT)))
                         .add(Stage.reduce("count", SampleCountReducer.class));
  }

  public static Pipeline byName(String name, int partitions)
  {
    if (SEQUENCE_COUNT.equals(name))
    {
      return sequenceCount(partitions);
    }
    throw new ConfigurationException(String.format("Unknown pipeline '%s'. Available: %s", name, SEQUENCE_COUNT));
  }
}
