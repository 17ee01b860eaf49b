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

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.io.WritableComparator;

/**
 * Partitions on a prefix of tab-separated key fields, so that keys sharing their first
 * <em>partitioner.key.fields</em> fields reach the same task while the remaining fields still take part
 * in sorting. A value of zero, or more fields than the key has, uses the whole key.
 */
public class KeyFieldPartitioner extends RecordPartitioner
{
  public static final String KEY_FIELDS = "partitioner.key.fields";

  private int numFields;

  @Override
  public void setConf(Configuration conf)
  {
    super.setConf(conf);
    if (conf != null)
    {
      numFields = conf.getInt(KEY_FIELDS, 0);
      if (numFields < 0)
      {
        throw new IllegalArgumentException(KEY_FIELDS + " must be >= 0, was " + numFields);
      }
    }
  }

  @Override
  public int getPartition(byte[] key, int numPartitions)
  {
    int length = prefixLength(key);
    return (WritableComparator.hashBytes(key, length) & Integer.MAX_VALUE) % numPartitions;
  }

  int prefixLength(byte[] key)
  {
    if (numFields == 0)
    {
      return key.length;
    }
    int seen = 0;
    for (int i = 0; i < key.length; i++)
    {
      if (key[i] == '\t' && ++seen == numFields)
      {
        return i;
      }
    }
    return key.length;
  }
}
