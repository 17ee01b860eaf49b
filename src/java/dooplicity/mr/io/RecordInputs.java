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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.hadoop.io.IOUtils;

/**
 * Static helpers over {@link RecordInput}.
 */
public class RecordInputs
{
  private RecordInputs()
  {
  }

  public static RecordInput fromList(final List<Record> records)
  {
    final Iterator<Record> it = records.iterator();
    return new RecordInput()
    {
      @Override
      public Record read()
      {
        return it.hasNext() ? it.next() : null;
      }

      @Override
      public void close()
      {
      }
    };
  }

  /**
   * Drains and closes the input.
   */
  public static List<Record> readAll(RecordInput input) throws IOException
  {
    List<Record> records = new ArrayList<Record>();
    try
    {
      Record record;
      while ((record = input.read()) != null)
      {
        records.add(record);
      }
    }
    finally
    {
      IOUtils.closeStream(input);
    }
    return records;
  }
}
