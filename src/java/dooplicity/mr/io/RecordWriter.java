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

package dooplicity.mr.io;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes records encoded by {@link RecordCodec} to a stream.
 */
public class RecordWriter implements Closeable
{
  private final OutputStream out;
  private long recordsWritten;

  public RecordWriter(OutputStream out)
  {
    this.out = new BufferedOutputStream(out, 64 * 1024);
  }

  public void write(Record record) throws IOException
  {
    RecordCodec.write(record, out);
    recordsWritten++;
  }

  /**
   * Copies every remaining record of the input.
   *
   * @return number of records copied
   */
  public long writeAll(RecordInput input) throws IOException
  {
    long count = 0;
    Record record;
    while ((record = input.read()) != null)
    {
      write(record);
      count++;
    }
    return count;
  }

  public long getRecordsWritten()
  {
    return recordsWritten;
  }

  @Override
  public void close() throws IOException
  {
    out.close();
  }
}
