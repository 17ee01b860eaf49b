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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One line of a manifest: one source (unpaired) or two sources (paired mates) and a sample label.
 */
public class ManifestEntry
{
  private final List<String> urls;
  private final List<String> md5s;
  private final String label;

  public ManifestEntry(String url, String md5, String label)
  {
    this.urls = Collections.singletonList(url);
    this.md5s = Collections.singletonList(md5);
    this.label = label;
  }

  public ManifestEntry(String url1, String md51, String url2, String md52, String label)
  {
    List<String> u = new ArrayList<String>(2);
    u.add(url1);
    u.add(url2);
    List<String> m = new ArrayList<String>(2);
    m.add(md51);
    m.add(md52);
    this.urls = Collections.unmodifiableList(u);
    this.md5s = Collections.unmodifiableList(m);
    this.label = label;
  }

  public String getLabel()
  {
    return label;
  }

  public boolean isPaired()
  {
    return urls.size() == 2;
  }

  public List<String> getUrls()
  {
    return urls;
  }

  /**
   * Expected MD5 per source, <code>null</code> where none was given.
   */
  public List<String> getMd5s()
  {
    return md5s;
  }

  /**
   * Renders the entry back to its manifest line.
   */
  public String toLine()
  {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < urls.size(); i++)
    {
      sb.append(urls.get(i)).append('\t').append(md5s.get(i) == null ? "0" : md5s.get(i)).append('\t');
    }
    return sb.append(label).toString();
  }

  @Override
  public String toString()
  {
    return toLine();
  }
}
