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

import org.apache.hadoop.io.WritableComparator;

/**
 * Partitions by a hash of the full key bytes. The hash is computed over bytes, not a Java object, so it
 * is stable across JVMs and hosts.
 */
public class HashPartitioner extends RecordPartitioner
{
  @Override
  public int getPartition(byte[] key, int numPartitions)
  {
    return (WritableComparator.hashBytes(key, key.length) & Integer.MAX_VALUE) % numPartitions;
  }
}
