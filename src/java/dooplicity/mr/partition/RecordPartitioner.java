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

package dooplicity.mr.partition;

import org.apache.hadoop.conf.Configured;

/**
 * Assigns a record key to one of a stage's output partitions.
 *
 * <p>
 * Implementations are instantiated reflectively with the stage configuration, so they may read their
 * parameters by overriding {@link #setConf(org.apache.hadoop.conf.Configuration)}. The assignment must be
 * a pure function of the key: every task of every backend must agree on it.
 * </p>
 */
public abstract class RecordPartitioner extends Configured
{
  /**
   * @param key
   *          record key
   * @param numPartitions
   *          number of output partitions, at least one
   * @return partition index in <code>[0, numPartitions)</code>
   */
  public abstract int getPartition(byte[] key, int numPartitions);
}
