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

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;
import org.apache.hadoop.io.compress.CompressionCodec;
import org.apache.hadoop.io.compress.CompressionCodecFactory;

/**
 * Reads FASTQ or FASTA from one source file, optionally compressed with any codec Hadoop recognizes by
 * extension. The format is detected from the first non-blank character: <em>@</em> for FASTQ and
 * <em>&gt;</em> for FASTA. FASTA reads may span several lines and are given a uniform quality string.
 */
public class ReadSource implements Closeable
{
  static final char FASTA_QUALITY = 'I';

  private final BufferedReader reader;
  private final String source;
  private final int mate;
  private Boolean fastq;
  private String pending;
  private long readsRead;

  public ReadSource(InputStream in, String source, int mate)
  {
    this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    this.source = source;
    this.mate = mate;
  }

  public static ReadSource open(Path path, Configuration conf, int mate) throws IOException
  {
    FileSystem fs = path.getFileSystem(conf);
    InputStream in = fs.open(path);
    CompressionCodec codec = new CompressionCodecFactory(conf).getCodec(path);
    if (codec != null)
    {
      try
      {
        in = codec.createInputStream(in);
      }
      catch (IOException e)
      {
        IOUtils.closeStream(in);
        throw e;
      }
    }
    return new ReadSource(in, path.toString(), mate);
  }

  /**
   * @return the next read, or <code>null</code> at the end of the source
   */
  public Read next() throws IOException
  {
    String header = nextNonBlank();
    if (header == null)
    {
      return null;
    }
    if (fastq == null)
    {
      if (header.startsWith("@"))
      {
        fastq = Boolean.TRUE;
      }
      else if (header.startsWith(">"))
      {
        fastq = Boolean.FALSE;
      }
      else
      {
        throw new IOException(String.format("%s is neither FASTQ nor FASTA: first line starts with '%s'",
                                            source,
                                            header.substring(0, 1)));
      }
    }
    Read read = fastq ? nextFastq(header) : nextFasta(header);
    readsRead++;
    return read;
  }

  public long getReadsRead()
  {
    return readsRead;
  }

  private Read nextFastq(String header) throws IOException
  {
    if (!header.startsWith("@"))
    {
      throw malformed("expected a header line starting with '@'");
    }
    String seq = reader.readLine();
    String plus = reader.readLine();
    String qual = reader.readLine();
    if (seq == null || plus == null || qual == null)
    {
      throw malformed("truncated record");
    }
    if (!plus.startsWith("+"))
    {
      throw malformed("expected a separator line starting with '+'");
    }
    seq = seq.trim();
    qual = qual.trim();
    if (seq.length() != qual.length())
    {
      throw malformed(String.format("sequence has length %d but quality has length %d", seq.length(), qual.length()));
    }
    return new Read(readName(header), seq, qual, mate);
  }

  private Read nextFasta(String header) throws IOException
  {
    if (!header.startsWith(">"))
    {
      throw malformed("expected a header line starting with '>'");
    }
    StringBuilder seq = new StringBuilder();
    String line;
    while ((line = reader.readLine()) != null)
    {
      if (line.startsWith(">"))
      {
        pending = line;
        break;
      }
      seq.append(line.trim());
    }
    if (seq.length() == 0)
    {
      throw malformed("empty sequence");
    }
    char[] qual = new char[seq.length()];
    Arrays.fill(qual, FASTA_QUALITY);
    return new Read(readName(header), seq.toString(), new String(qual), mate);
  }

  private String nextNonBlank() throws IOException
  {
    if (pending != null)
    {
      String line = pending;
      pending = null;
      return line;
    }
    String line;
    while ((line = reader.readLine()) != null)
    {
      if (!line.trim().isEmpty())
      {
        return line;
      }
    }
    return null;
  }

  private static String readName(String header)
  {
    return header.substring(1).trim().replace('\t', ' ');
  }

  private IOException malformed(String problem)
  {
    return new IOException(String.format("Malformed read %d in %s: %s", readsRead + 1, source, problem));
  }

  @Override
  public void close() throws IOException
  {
    reader.close();
  }
}
