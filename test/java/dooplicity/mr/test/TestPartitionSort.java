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

package dooplicity.mr.test;

import java.io.IOException;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import dooplicity.mr.io.Record;
import dooplicity.mr.io.RecordFiles;
import dooplicity.mr.io.RecordInputs;
import dooplicity.mr.partition.ExternalSorter;
import dooplicity.mr.partition.HashPartitioner;
import dooplicity.mr.partition.KeyFieldPartitioner;
import dooplicity.mr.partition.KeyGroupIterator;
import dooplicity.mr.partition.MergingRecordInput;
import dooplicity.mr.partition.RangePartitioner;
import dooplicity.mr.partition.RecordPartitioner;

@Test(groups = "pcl")
public class TestPartitionSort extends TestBase
{
  private Logger _log = Logger.getLogger(TestPartitionSort.class);

  private Path _sortPath;

  public TestPartitionSort() throws IOException
  {
    super();
  }

  @BeforeClass
  public void beforeClass() throws Exception
  {
    super.beforeClass();
    _sortPath = path("sort");
  }

  @AfterClass
  public void afterClass() throws Exception
  {
    super.afterClass();
  }

  @BeforeMethod
  public void beforeMethod(Method method) throws IOException
  {
    _log.info("*** Running " + method.getName());
    cleanPath(_sortPath);
  }

  @Test
  public void inMemorySortIsStableTest() throws IOException
  {
    List<Record> records = interleaved(50);
    ExternalSorter sorter = sorter(new HashPartitioner(), 1, Long.MAX_VALUE);
    addAll(sorter, records);
    sorter.writePartitions(new Path(_sortPath, "out"));
    sorter.close();
    Assert.assertEquals(sorter.getSpillCount(), 0);

    checkSortedAndStable(read(new Path(_sortPath, "out"), 0), 50);
  }

  @Test
  public void spilledSortIsStableTest() throws IOException
  {
    List<Record> records = interleaved(200);
    // a few records per spill
    ExternalSorter sorter = sorter(new HashPartitioner(), 3, 64);
    addAll(sorter, records);
    long[] counts = sorter.writePartitions(new Path(_sortPath, "out"));
    sorter.close();
    Assert.assertTrue(sorter.getSpillCount() > 10, "expected many spills but got " + sorter.getSpillCount());
    Assert.assertFalse(getFileSystem().exists(new Path(_sortPath, "spill")));

    long total = 0;
    for (int p = 0; p < 3; p++)
    {
      List<Record> partition = read(new Path(_sortPath, "out"), p);
      Assert.assertEquals(partition.size(), counts[p]);
      checkSortedAndStable(partition, -1);
      for (Record record : partition)
      {
        Assert.assertEquals(new HashPartitioner().getPartition(record.getKey(), 3), p);
      }
      total += counts[p];
    }
    Assert.assertEquals(total, records.size());
  }

  @Test
  public void emptyPartitionsAreWrittenTest() throws IOException
  {
    ExternalSorter sorter = sorter(new HashPartitioner(), 4, Long.MAX_VALUE);
    sorter.add(Record.of("only", "one"));
    sorter.writePartitions(new Path(_sortPath, "out"));
    sorter.close();

    int nonEmpty = 0;
    for (int p = 0; p < 4; p++)
    {
      Path part = ExternalSorter.partitionPath(new Path(_sortPath, "out"), p);
      Assert.assertTrue(getFileSystem().exists(part), part + " should exist");
      nonEmpty += read(new Path(_sortPath, "out"), p).size();
    }
    Assert.assertEquals(nonEmpty, 1);
  }

  @Test(expectedExceptions = IOException.class)
  public void partitionOutOfRangeTest() throws IOException
  {
    ExternalSorter sorter = sorter(new RecordPartitioner()
    {
      @Override
      public int getPartition(byte[] key, int numPartitions)
      {
        return numPartitions;
      }
    }, 2, Long.MAX_VALUE);
    sorter.add(Record.of("k", "v"));
  }

  @Test
  public void hashPartitionerIsDeterministicTest()
  {
    HashPartitioner partitioner = new HashPartitioner();
    for (Record record : interleaved(20))
    {
      int p = partitioner.getPartition(record.getKey(), 7);
      Assert.assertTrue(p >= 0 && p < 7);
      Assert.assertEquals(new HashPartitioner().getPartition(record.getKey(), 7), p);
    }
  }

  @Test
  public void keyFieldPartitionerTest()
  {
    Configuration conf = new Configuration(false);
    conf.setInt(KeyFieldPartitioner.KEY_FIELDS, 1);
    KeyFieldPartitioner partitioner = new KeyFieldPartitioner();
    partitioner.setConf(conf);

    // keys that share their first field go to the same partition
    for (int i = 0; i < 20; i++)
    {
      String chrom = "chr" + i;
      int p = partitioner.getPartition(bytes(chrom + "\t100"), 5);
      Assert.assertEquals(partitioner.getPartition(bytes(chrom + "\t99999"), 5), p);
      Assert.assertEquals(partitioner.getPartition(bytes(chrom), 5), p);
    }
  }

  @Test
  public void rangePartitionerTest()
  {
    Configuration conf = new Configuration(false);
    conf.set(RangePartitioner.RANGE_SPLITS, "C,G,T");
    RangePartitioner partitioner = new RangePartitioner();
    partitioner.setConf(conf);

    Assert.assertEquals(partitioner.getPartition(bytes("AAAA"), 4), 0);
    Assert.assertEquals(partitioner.getPartition(bytes("C"), 4), 1);
    Assert.assertEquals(partitioner.getPartition(bytes("CTTT"), 4), 1);
    Assert.assertEquals(partitioner.getPartition(bytes("GA"), 4), 2);
    Assert.assertEquals(partitioner.getPartition(bytes("TTTT"), 4), 3);
    Assert.assertEquals(partitioner.getPartition(bytes(""), 4), 0);
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void rangePartitionerSplitCountTest()
  {
    RangePartitioner partitioner = new RangePartitioner();
    partitioner.setSplits(Arrays.asList(bytes("M")));
    partitioner.getPartition(bytes("A"), 3);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void rangePartitionerUnsortedSplitsTest()
  {
    new RangePartitioner().setSplits(Arrays.asList(bytes("M"), bytes("C")));
  }

  @Test
  public void mergeKeepsInputOrderForEqualKeysTest() throws IOException
  {
    MergingRecordInput merged =
        new MergingRecordInput(Arrays.asList(RecordInputs.fromList(Arrays.asList(Record.of("a", "0-1"), Record.of("b", "0-2"))),
                                             RecordInputs.fromList(Arrays.asList(Record.of("a", "1-1"), Record.of("c", "1-2"))),
                                             RecordInputs.fromList(Arrays.asList(Record.of("a", "2-1"), Record.of("b", "2-2")))));
    List<String> values = new ArrayList<String>();
    for (Record record : RecordInputs.readAll(merged))
    {
      values.add(record.getKeyString() + ":" + record.getValueString());
    }
    Assert.assertEquals(values, Arrays.asList("a:0-1", "a:1-1", "a:2-1", "b:0-2", "b:2-2", "c:1-2"));
  }

  @Test
  public void keyGroupsTest() throws IOException
  {
    KeyGroupIterator groups =
        new KeyGroupIterator(RecordInputs.fromList(Arrays.asList(Record.of("a", "1"),
                                                                 Record.of("a", "2"),
                                                                 Record.of("b", "3"),
                                                                 Record.of("c", "4"),
                                                                 Record.of("c", "5"))));
    List<String> seen = new ArrayList<String>();
    while (groups.nextKey())
    {
      String key = new String(groups.getKey(), StandardCharsets.UTF_8);
      if (key.equals("c"))
      {
        // only consume the first value; the rest must be skipped
        seen.add(key + "=" + new String(groups.values().next(), StandardCharsets.UTF_8));
        continue;
      }
      StringBuilder sb = new StringBuilder(key).append('=');
      for (Iterator<byte[]> it = groups.values(); it.hasNext();)
      {
        sb.append(new String(it.next(), StandardCharsets.UTF_8));
      }
      seen.add(sb.toString());
    }
    Assert.assertEquals(seen, Arrays.asList("a=12", "b=3", "c=4"));
    Assert.assertEquals(groups.getGroupCount(), 3);
  }

  @Test(expectedExceptions = IOException.class, expectedExceptionsMessageRegExp = ".*not sorted.*")
  public void unsortedGroupsTest() throws IOException
  {
    KeyGroupIterator groups = new KeyGroupIterator(RecordInputs.fromList(Arrays.asList(Record.of("b", "1"), Record.of("a", "2"))));
    while (groups.nextKey())
    {
      groups.values().next();
    }
  }

  // UTILITIES

  private ExternalSorter sorter(RecordPartitioner partitioner, int partitions, long bufferBytes)
  {
    return new ExternalSorter(partitioner,
                              partitions,
                              new RecordFiles(getFileSystem(), getConf()),
                              new Path(_sortPath, "spill"),
                              bufferBytes);
  }

  /**
   * Keys k00..k09 repeated, each value carrying its arrival sequence number.
   */
  private static List<Record> interleaved(int n)
  {
    List<Record> records = new ArrayList<Record>();
    for (int i = 0; i < n; i++)
    {
      records.add(Record.of(String.format("k%02d", (i * 7) % 10), String.format("%06d", i)));
    }
    return records;
  }

  private static void addAll(ExternalSorter sorter, List<Record> records) throws IOException
  {
    for (Record record : records)
    {
      sorter.add(record);
    }
  }

  private List<Record> read(Path dir, int partition) throws IOException
  {
    return RecordInputs.readAll(new RecordFiles(getFileSystem(), getConf()).open(ExternalSorter.partitionPath(dir, partition)));
  }

  private static void checkSortedAndStable(List<Record> records, int expectedSize)
  {
    if (expectedSize >= 0)
    {
      Assert.assertEquals(records.size(), expectedSize);
    }
    for (int i = 1; i < records.size(); i++)
    {
      Record prev = records.get(i - 1);
      Record cur = records.get(i);
      int cmp = Record.compareKeys(prev.getKey(), cur.getKey());
      Assert.assertTrue(cmp <= 0, "keys out of order at " + i);
      if (cmp == 0)
      {
        Assert.assertTrue(prev.getValueString().compareTo(cur.getValueString()) < 0, "equal keys lost arrival order at " + i);
      }
    }
  }

  private static byte[] bytes(String s)
  {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
