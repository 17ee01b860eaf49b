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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.hadoop.conf.Configuration;

import dooplicity.mr.io.Record;

/**
 * Partitions by comparing keys against sorted split points, so that concatenating the partitions in
 * index order yields a totally ordered stream. With <em>n</em> partitions there must be <em>n - 1</em>
 * split points, given as comma-separated UTF-8 strings in <em>partitioner.range.splits</em>. Partition
 * <em>i</em> holds the keys <em>k</em> with <code>split[i-1] &lt;= k &lt; split[i]</code>.
 */
public class RangePartitioner extends RecordPartitioner
{
  public static final String RANGE_SPLITS = "partitioner.range.splits";

  private List<byte[]> splits = new ArrayList<byte[]>();

  @Override
  public void setConf(Configuration conf)
  {
    super.setConf(conf);
    if (conf != null)
    {
      List<byte[]> parsed = new ArrayList<byte[]>();
      for (String split : conf.getTrimmedStrings(RANGE_SPLITS))
      {
        parsed.add(split.getBytes(StandardCharsets.UTF_8));
      }
      setSplits(parsed);
    }
  }

  public void setSplits(List<byte[]> splits)
  {
    for (int i = 1; i < splits.size(); i++)
    {
      if (Record.compareKeys(splits.get(i - 1), splits.get(i)) >= 0)
      {
        throw new IllegalArgumentException(RANGE_SPLITS + " must be strictly increasing");
      }
    }
    this.splits = splits;
  }

  @Override
  public int getPartition(byte[] key, int numPartitions)
  {
    if (splits.size() != numPartitions - 1)
    {
      throw new IllegalStateException(String.format("Range partitioner has %d split points but %d partitions were requested",
                                                    splits.size(),
                                                    numPartitions));
    }
    int lo = 0;
    int hi = splits.size();
    // first split point strictly greater than the key
    while (lo < hi)
    {
      int mid = (lo + hi) >>> 1;
      if (Record.compareKeys(splits.get(mid), key) <= 0)
      {
        lo = mid + 1;
      }
      else
      {
        hi = mid;
      }
    }
    return lo;
  }
}
