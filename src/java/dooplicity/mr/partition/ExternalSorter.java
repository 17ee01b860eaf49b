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

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;

import dooplicity.mr.io.Record;
import dooplicity.mr.io.RecordFiles;
import dooplicity.mr.io.RecordInput;
import dooplicity.mr.io.RecordWriter;

/**
 * Splits an unsorted record stream into key-sorted partitions.
 *
 * <p>
 * Records are buffered in memory until <em>sort.buffer.bytes</em> is exceeded, at which point the buffer
 * is stably sorted by partition then key and spilled as one sorted run per partition. The final
 * partitions are produced by merging the runs of each partition in spill order, so records with equal
 * keys keep the order in which they were added.
 * </p>
 */
public class ExternalSorter implements Closeable
{
  public static final String SORT_BUFFER_BYTES = "sort.buffer.bytes";
  public static final long DEFAULT_SORT_BUFFER_BYTES = 64L * 1024 * 1024;

  private static final Comparator<Entry> ENTRY_ORDER = new Comparator<Entry>()
  {
    @Override
    public int compare(Entry o1, Entry o2)
    {
      if (o1.partition != o2.partition)
      {
        return o1.partition < o2.partition ? -1 : 1;
      }
      return Record.compareKeys(o1.record.getKey(), o2.record.getKey());
    }
  };

  private final Logger _log = Logger.getLogger(ExternalSorter.class);

  private final RecordPartitioner partitioner;
  private final int numPartitions;
  private final RecordFiles files;
  private final Path spillDir;
  private final long bufferBytes;

  private final List<Entry> buffer = new ArrayList<Entry>();
  private long bufferedBytes;
  // spills.get(s)[p] is true when spill s holds records of partition p
  private final List<boolean[]> spills = new ArrayList<boolean[]>();

  public ExternalSorter(RecordPartitioner partitioner, int numPartitions, RecordFiles files, Path spillDir, long bufferBytes)
  {
    if (numPartitions < 1)
    {
      throw new IllegalArgumentException("Number of partitions must be >= 1, was " + numPartitions);
    }
    this.partitioner = partitioner;
    this.numPartitions = numPartitions;
    this.files = files;
    this.spillDir = spillDir;
    this.bufferBytes = bufferBytes;
  }

  public void add(Record record) throws IOException
  {
    int partition = partitioner.getPartition(record.getKey(), numPartitions);
    if (partition < 0 || partition >= numPartitions)
    {
      throw new IOException(String.format("%s returned partition %d for %d partitions",
                                          partitioner.getClass().getSimpleName(),
                                          partition,
                                          numPartitions));
    }
    buffer.add(new Entry(partition, record));
    bufferedBytes += record.getSizeEstimate();
    if (bufferedBytes >= bufferBytes)
    {
      spill();
    }
  }

  public int getSpillCount()
  {
    return spills.size();
  }

  /**
   * Writes every partition, including empty ones, as <code>part-NNNNN</code> under the output directory.
   *
   * @return number of records written per partition
   */
  public long[] writePartitions(Path outputDir) throws IOException
  {
    long[] counts = new long[numPartitions];
    if (spills.isEmpty())
    {
      Collections.sort(buffer, ENTRY_ORDER);
      int i = 0;
      for (int p = 0; p < numPartitions; p++)
      {
        RecordWriter writer = files.create(partitionPath(outputDir, p));
        try
        {
          while (i < buffer.size() && buffer.get(i).partition == p)
          {
            writer.write(buffer.get(i++).record);
          }
        }
        finally
        {
          writer.close();
        }
        counts[p] = writer.getRecordsWritten();
      }
      buffer.clear();
      bufferedBytes = 0;
      return counts;
    }

    spill();
    for (int p = 0; p < numPartitions; p++)
    {
      List<RecordInput> runs = new ArrayList<RecordInput>();
      RecordWriter writer = null;
      try
      {
        for (int s = 0; s < spills.size(); s++)
        {
          if (spills.get(s)[p])
          {
            runs.add(files.open(partitionPath(spillPath(s), p)));
          }
        }
        writer = files.create(partitionPath(outputDir, p));
        counts[p] = writer.writeAll(new MergingRecordInput(runs));
      }
      finally
      {
        MergingRecordInput.closeQuietly(runs);
        if (writer != null)
        {
          writer.close();
        }
      }
    }
    _log.info(String.format("Merged %d spills into %d partitions under %s", spills.size(), numPartitions, outputDir));
    return counts;
  }

  private void spill() throws IOException
  {
    if (buffer.isEmpty())
    {
      return;
    }
    Collections.sort(buffer, ENTRY_ORDER);
    int spillIndex = spills.size();
    Path dir = spillPath(spillIndex);
    boolean[] present = new boolean[numPartitions];
    int i = 0;
    while (i < buffer.size())
    {
      int p = buffer.get(i).partition;
      RecordWriter writer = files.create(partitionPath(dir, p));
      try
      {
        while (i < buffer.size() && buffer.get(i).partition == p)
        {
          writer.write(buffer.get(i++).record);
        }
      }
      finally
      {
        writer.close();
      }
      present[p] = true;
    }
    spills.add(present);
    _log.debug(String.format("Spilled %d records (%d bytes) to %s", buffer.size(), bufferedBytes, dir));
    buffer.clear();
    bufferedBytes = 0;
  }

  private Path spillPath(int spill)
  {
    return new Path(spillDir, String.format("spill-%05d", spill));
  }

  public static Path partitionPath(Path dir, int partition)
  {
    return new Path(dir, String.format("part-%05d", partition));
  }

  /**
   * Deletes the spill directory.
   */
  @Override
  public void close() throws IOException
  {
    buffer.clear();
    if (!spills.isEmpty())
    {
      files.getFileSystem().delete(spillDir, true);
    }
  }

  private static final class Entry
  {
    final int partition;
    final Record record;

    Entry(int partition, Record record)
    {
      this.partition = partition;
      this.record = record;
    }
  }
}
