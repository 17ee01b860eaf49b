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
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.IOUtils;

import dooplicity.mr.ConfigurationException;

/**
 * The list of input units of a job.
 *
 * <p>
 * A manifest is a tab-separated text file with one input unit per line, either
 * <code>URL MD5 label</code> or <code>URL1 MD5_1 URL2 MD5_2 label</code>. An MD5 of <code>0</code> or an
 * empty field means no checksum is known. Labels have the form <em>group-biorep-techrep</em>. Blank lines
 * and lines starting with <em>#</em> are ignored. Every problem in the file is collected and reported in
 * a single {@link ConfigurationException}.
 * </p>
 */
public class Manifest
{
  private static final Pattern LABEL = Pattern.compile("[A-Za-z0-9_.]+-[A-Za-z0-9_.]+-[A-Za-z0-9_.]+");
  private static final Pattern MD5 = Pattern.compile("[0-9a-fA-F]{32}");

  private final List<ManifestEntry> entries;

  public Manifest(List<ManifestEntry> entries)
  {
    this.entries = Collections.unmodifiableList(new ArrayList<ManifestEntry>(entries));
  }

  public List<ManifestEntry> getEntries()
  {
    return entries;
  }

  public int size()
  {
    return entries.size();
  }

  public static Manifest load(Path path, Configuration conf)
  {
    InputStream in = null;
    try
    {
      FileSystem fs = path.getFileSystem(conf);
      if (!fs.exists(path))
      {
        throw new ConfigurationException(String.format("Manifest file %s does not exist. Check the URL and try again.", path));
      }
      in = fs.open(path);
      return parse(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), path.toString());
    }
    catch (IOException e)
    {
      throw new ConfigurationException(String.format("Could not read manifest file %s", path), e);
    }
    finally
    {
      IOUtils.closeStream(in);
    }
  }

  public static Manifest parse(String text, String source)
  {
    try
    {
      return parse(new BufferedReader(new StringReader(text)), source);
    }
    catch (IOException e)
    {
      throw new IllegalStateException(e);
    }
  }

  static Manifest parse(BufferedReader reader, String source) throws IOException
  {
    List<ManifestEntry> entries = new ArrayList<ManifestEntry>();
    List<String> errors = new ArrayList<String>();
    Map<String, Integer> labels = new HashMap<String, Integer>();
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null)
    {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#"))
      {
        continue;
      }
      String[] tokens = trimmed.split("\t", -1);
      ManifestEntry entry;
      if (tokens.length == 3)
      {
        entry = new ManifestEntry(url(tokens[0], lineNumber, errors), md5(tokens[1], lineNumber, errors), tokens[2].trim());
      }
      else if (tokens.length == 5)
      {
        entry = new ManifestEntry(url(tokens[0], lineNumber, errors),
                                  md5(tokens[1], lineNumber, errors),
                                  url(tokens[2], lineNumber, errors),
                                  md5(tokens[3], lineNumber, errors),
                                  tokens[4].trim());
      }
      else
      {
        errors.add(String.format("Line %d of manifest file %s has an invalid number of tokens (%d, expected 3 or 5):\n%s",
                                 lineNumber,
                                 source,
                                 tokens.length,
                                 line));
        continue;
      }

      if (!LABEL.matcher(entry.getLabel()).matches())
      {
        errors.add(String.format("Line %d: sample label '%s' does not have the form group-biorep-techrep",
                                 lineNumber,
                                 entry.getLabel()));
      }
      else if (labels.containsKey(entry.getLabel()))
      {
        errors.add(String.format("Line %d: sample label '%s' already used on line %d",
                                 lineNumber,
                                 entry.getLabel(),
                                 labels.get(entry.getLabel())));
      }
      else
      {
        labels.put(entry.getLabel(), lineNumber);
      }
      entries.add(entry);
    }

    if (errors.isEmpty() && entries.isEmpty())
    {
      errors.add(String.format("Manifest file %s has no valid lines.", source));
    }
    if (!errors.isEmpty())
    {
      StringBuilder message = new StringBuilder(String.format("Manifest file %s is invalid:", source));
      for (String error : errors)
      {
        message.append("\n  ").append(error);
      }
      throw new ConfigurationException(message.toString(), errors, null);
    }
    return new Manifest(entries);
  }

  private static String url(String token, int lineNumber, List<String> errors)
  {
    String url = token.trim();
    if (url.isEmpty())
    {
      errors.add(String.format("Line %d: empty source URL", lineNumber));
      return url;
    }
    try
    {
      new Path(url);
    }
    catch (IllegalArgumentException e)
    {
      errors.add(String.format("Line %d: source URL '%s' cannot be parsed: %s", lineNumber, url, e.getMessage()));
    }
    return url;
  }

  private static String md5(String token, int lineNumber, List<String> errors)
  {
    String md5 = token.trim();
    if (md5.isEmpty() || md5.equals("0"))
    {
      return null;
    }
    if (!MD5.matcher(md5).matches())
    {
      errors.add(String.format("Line %d: '%s' is not an MD5 checksum (32 hex digits, or 0 for none)", lineNumber, md5));
      return null;
    }
    return md5.toLowerCase();
  }
}
