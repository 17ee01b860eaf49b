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

import java.io.IOException;
import java.io.InputStream;

import org.apache.hadoop.io.Text;
import org.apache.hadoop.util.LineReader;

/**
 * Reads records encoded by {@link RecordCodec} from a stream.
 */
public class RecordReader implements RecordInput
{
  private final LineReader lineReader;
  private final String source;
  private final Text line = new Text();
  private long recordsRead;

  public RecordReader(InputStream in, String source)
  {
    this.lineReader = new LineReader(in);
    this.source = source;
  }

  @Override
  public Record read() throws IOException
  {
    int bytes = lineReader.readLine(line);
    if (bytes == 0)
    {
      return null;
    }
    try
    {
      Record record = RecordCodec.decode(line.getBytes(), line.getLength());
      recordsRead++;
      return record;
    }
    catch (IOException e)
    {
      throw new IOException(String.format("%s (record %d of %s)", e.getMessage(), recordsRead + 1, source), e);
    }
  }

  @Override
  public void close() throws IOException
  {
    lineReader.close();
  }
}
