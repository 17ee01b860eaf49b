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
import java.nio.charset.StandardCharsets;

import dooplicity.mr.io.Record;

/**
 * A sequencing read as carried in the value of a first-stage record:
 * <code>name TAB seq TAB qual TAB mate</code>, where <em>mate</em> is 0 for unpaired reads and 1 or 2 for
 * the mates of a pair. The record key is the sample label.
 */
public class Read
{
  private final String name;
  private final String sequence;
  private final String quality;
  private final int mate;

  public Read(String name, String sequence, String quality, int mate)
  {
    this.name = name;
    this.sequence = sequence;
    this.quality = quality;
    this.mate = mate;
  }

  public String getName()
  {
    return name;
  }

  public String getSequence()
  {
    return sequence;
  }

  public String getQuality()
  {
    return quality;
  }

  public int getMate()
  {
    return mate;
  }

  public Record toRecord(String label)
  {
    return Record.of(label, name + "\t" + sequence + "\t" + quality + "\t" + mate);
  }

  public static Read fromRecord(Record record) throws IOException
  {
    String[] fields = new String(record.getValue(), StandardCharsets.UTF_8).split("\t", -1);
    if (fields.length != 4)
    {
      throw new IOException(String.format("Expected 4 read fields but found %d in %s", fields.length, record));
    }
    try
    {
      return new Read(fields[0], fields[1], fields[2], Integer.parseInt(fields[3]));
    }
    catch (NumberFormatException e)
    {
      throw new IOException(String.format("Bad mate number '%s' in %s", fields[3], record), e);
    }
  }
}
