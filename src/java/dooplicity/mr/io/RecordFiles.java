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

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.util.ReflectionUtils;

/**
 * Opens and creates partition files, applying the intermediate compression codec when one is
 * configured with <em>intermediate.compression.codec</em>.
 */
public class RecordFiles
{
  public static final String COMPRESSION_CODEC = "intermediate.compression.codec";

  private final FileSystem fs;
  private final CompressionCodec codec;

  public RecordFiles(FileSystem fs, Configuration conf)
  {
    this.fs = fs;
    String codecClass = conf.get(COMPRESSION_CODEC);
    if (codecClass != null && codecClass.trim().length() > 0)
    {
      try
      {
        Class<? extends CompressionCodec> c = conf.getClassByName(codecClass.trim()).asSubclass(CompressionCodec.class);
        this.codec = ReflectionUtils.newInstance(c, conf);
      }
      catch (ClassNotFoundException e)
      {
        throw new IllegalArgumentException("Unknown compression codec: " + codecClass, e);
      }
    }
    else
    {
      this.codec = null;
    }
  }

  public FileSystem getFileSystem()
  {
    return fs;
  }

  public RecordReader open(Path path) throws IOException
  {
    if (!fs.exists(path))
    {
      throw new FileNotFoundException("Partition file not found: " + path);
    }
    InputStream in = fs.open(path);
    if (codec != null)
    {
      in = codec.createInputStream(in);
    }
    return new RecordReader(in, path.toString());
  }

  public RecordWriter create(Path path) throws IOException
  {
    OutputStream out = fs.create(path, true);
    if (codec != null)
    {
      out = codec.createOutputStream(out);
    }
    return new RecordWriter(out);
  }
}
