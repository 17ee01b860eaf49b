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

package dooplicity.mr.fs;

import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Date;
import java.util.List;

import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.PathFilter;

/**
 * Path naming and listing helpers.
 */
public class PathUtils
{
  public static final String CURRENT_SUFFIX = "#CURRENT";
  public static final String CURRENT_FORMAT = "yyyy-MM-dd-HH-mm";

  /**
   * Accepts paths whose name starts with neither <em>_</em> nor <em>.</em>.
   */
  public static final PathFilter nonHiddenPathFilter = new PathFilter()
  {
    @Override
    public boolean accept(Path path)
    {
      String name = path.getName();
      return !name.startsWith("_") && !name.startsWith(".");
    }
  };

  private PathUtils()
  {
  }

  /**
   * Replaces a trailing <em>#CURRENT</em> with the current time in <em>yyyy-MM-dd-HH-mm</em> format.
   */
  public static String expandCurrent(String path, Date now)
  {
    if (path.endsWith(CURRENT_SUFFIX))
    {
      return path.substring(0, path.length() - CURRENT_SUFFIX.length()) + new SimpleDateFormat(CURRENT_FORMAT).format(now);
    }
    return path;
  }

  /**
   * Lists the non-hidden children of a directory sorted by name, or nothing if it does not exist.
   */
  public static List<Path> listSorted(FileSystem fs, Path dir) throws IOException
  {
    if (!fs.exists(dir))
    {
      return new ArrayList<Path>();
    }
    FileStatus[] statuses = fs.listStatus(dir, nonHiddenPathFilter);
    Arrays.sort(statuses, new Comparator<FileStatus>()
    {
      @Override
      public int compare(FileStatus o1, FileStatus o2)
      {
        return o1.getPath().getName().compareTo(o2.getPath().getName());
      }
    });
    List<Path> paths = new ArrayList<Path>(statuses.length);
    for (FileStatus status : statuses)
    {
      paths.add(status.getPath());
    }
    return paths;
  }
}
