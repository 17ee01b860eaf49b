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

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;

import org.apache.avro.Schema;
import org.apache.avro.file.DataFileWriter;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

/**
 * Writes generic records to an Avro data file.
 */
public class AvroRecordWriter implements Closeable
{
  private final Path outputPath;
  private final Schema schema;
  private final FileSystem fs;

  private DataFileWriter<GenericRecord> dataWriter;
  private OutputStream outputStream;

  public AvroRecordWriter(Path outputPath, Schema schema, FileSystem fs)
  {
    this.outputPath = outputPath;
    this.schema = schema;
    this.fs = fs;
  }

  public void open() throws IOException
  {
    if (dataWriter != null)
    {
      throw new IllegalStateException("Already have data writer");
    }
    outputStream = fs.create(outputPath, true);
    dataWriter = new DataFileWriter<GenericRecord>(new GenericDatumWriter<GenericRecord>(schema));
    dataWriter.create(schema, outputStream);
  }

  public void append(GenericRecord record) throws IOException
  {
    if (dataWriter == null)
    {
      throw new IllegalStateException("No data writer");
    }
    dataWriter.append(record);
  }

  @Override
  public void close() throws IOException
  {
    if (dataWriter == null)
    {
      return;
    }
    dataWriter.close();
    outputStream.close();
    dataWriter = null;
    outputStream = null;
  }
}
