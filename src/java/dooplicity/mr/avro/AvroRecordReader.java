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

package dooplicity.mr.avro;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.avro.file.DataFileStream;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;

/**
 * Reads every generic record of an Avro data file.
 */
public class AvroRecordReader
{
  private AvroRecordReader()
  {
  }

  public static List<GenericRecord> readAll(Path path, FileSystem fs) throws IOException
  {
    InputStream is = fs.open(path);
    DataFileStream<GenericRecord> dataReader = null;
    try
    {
      dataReader = new DataFileStream<GenericRecord>(is, new GenericDatumReader<GenericRecord>());
      List<GenericRecord> res = new ArrayList<GenericRecord>();
      while (dataReader.hasNext())
      {
        res.add(dataReader.next());
      }
      return res;
    }
    finally
    {
      IOUtils.closeStream(dataReader);
      IOUtils.closeStream(is);
    }
  }
}
