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

package dooplicity.mr.manifest;

import java.io.IOException;
import java.io.InputStream;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;
import org.apache.log4j.Logger;

import dooplicity.mr.io.Record;
import dooplicity.mr.io.RecordInput;

/**
 * The records of one manifest entry, keyed by its sample label.
 *
 * <p>
 * Sources carrying an MD5 are verified before anything is read from them. Mates of a paired entry are
 * read in lockstep, mate 1 before mate 2, and the two sources must hold the same number of reads.
 * </p>
 */
public class ManifestRecordInput implements RecordInput
{
  private final Logger _log = Logger.getLogger(ManifestRecordInput.class);

  private final ManifestEntry entry;
  private final Configuration conf;
  private ReadSource first;
  private ReadSource second;
  private Read pendingMate;
  private boolean opened;

  public ManifestRecordInput(ManifestEntry entry, Configuration conf)
  {
    this.entry = entry;
    this.conf = conf;
  }

  @Override
  public Record read() throws IOException
  {
    if (!opened)
    {
      open();
    }
    if (pendingMate != null)
    {
      Read mate = pendingMate;
      pendingMate = null;
      return mate.toRecord(entry.getLabel());
    }
    Read read = first.next();
    if (second == null)
    {
      return read == null ? null : read.toRecord(entry.getLabel());
    }
    Read mate = second.next();
    if (read == null && mate == null)
    {
      return null;
    }
    if (read == null || mate == null)
    {
      throw new IOException(String.format("Mate files of sample %s have different numbers of reads (%s ends after %d)",
                                          entry.getLabel(),
                                          read == null ? entry.getUrls().get(0) : entry.getUrls().get(1),
                                          read == null ? first.getReadsRead() : second.getReadsRead()));
    }
    pendingMate = mate;
    return read.toRecord(entry.getLabel());
  }

  private void open() throws IOException
  {
    opened = true;
    for (int i = 0; i < entry.getUrls().size(); i++)
    {
      String md5 = entry.getMd5s().get(i);
      if (md5 != null)
      {
        verify(new Path(entry.getUrls().get(i)), md5);
      }
    }
    if (entry.isPaired())
    {
      first = ReadSource.open(new Path(entry.getUrls().get(0)), conf, 1);
      second = ReadSource.open(new Path(entry.getUrls().get(1)), conf, 2);
    }
    else
    {
      first = ReadSource.open(new Path(entry.getUrls().get(0)), conf, 0);
    }
  }

  private void verify(Path path, String expected) throws IOException
  {
    FileSystem fs = path.getFileSystem(conf);
    InputStream in = fs.open(path);
    String actual;
    try
    {
      actual = DigestUtils.md5Hex(in);
    }
    finally
    {
      IOUtils.closeStream(in);
    }
    if (!actual.equalsIgnoreCase(expected))
    {
      throw new IOException(String.format("MD5 of %s is %s but the manifest says %s", path, actual, expected));
    }
    _log.info(String.format("Verified MD5 of %s", path));
  }

  @Override
  public void close() throws IOException
  {
    IOUtils.closeStream(first);
    IOUtils.closeStream(second);
  }
}
