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

package dooplicity.mr.test.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import dooplicity.mr.manifest.ManifestEntry;

/**
 * Writes FASTQ samples and a manifest listing them.
 */
public class SampleWriter
{
  private final FileSystem _fs;
  private final Path _dir;
  private final List<ManifestEntry> _entries = new ArrayList<ManifestEntry>();

  public SampleWriter(FileSystem fs, Path dir)
  {
    _fs = fs;
    _dir = dir;
  }

  /**
   * Writes one unpaired FASTQ sample holding the given sequences, in order.
   */
  public Path addSample(String label, List<String> sequences) throws IOException
  {
    Path path = new Path(_dir, label + ".fastq");
    write(path, fastq(label, sequences));
    _entries.add(new ManifestEntry(path.toString(), null, label));
    return path;
  }

  public Path addSample(String label, String... sequences) throws IOException
  {
    List<String> list = new ArrayList<String>();
    for (String sequence : sequences)
    {
      list.add(sequence);
    }
    return addSample(label, list);
  }

  public List<ManifestEntry> getEntries()
  {
    return _entries;
  }

  /**
   * Writes the manifest of every sample added so far.
   */
  public Path writeManifest() throws IOException
  {
    StringBuilder sb = new StringBuilder();
    sb.append("# test manifest\n");
    for (ManifestEntry entry : _entries)
    {
      sb.append(entry.toLine()).append('\n');
    }
    Path manifest = new Path(_dir, "manifest.txt");
    write(manifest, sb.toString());
    return manifest;
  }

  public static String fastq(String prefix, List<String> sequences)
  {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < sequences.size(); i++)
    {
      String seq = sequences.get(i);
      sb.append('@').append(prefix).append('.').append(i).append('\n');
      sb.append(seq).append('\n');
      sb.append("+\n");
      for (int j = 0; j < seq.length(); j++)
      {
        sb.append('F');
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  public void write(Path path, String text) throws IOException
  {
    _fs.mkdirs(path.getParent());
    FSDataOutputStream out = _fs.create(path, true);
    try
    {
      out.write(text.getBytes(StandardCharsets.UTF_8));
    }
    finally
    {
      out.close();
    }
  }
}
