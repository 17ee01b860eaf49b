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

package dooplicity.mr.stages;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

import dooplicity.mr.io.Record;
import dooplicity.mr.stage.OutputCollector;
import dooplicity.mr.stage.StageReducer;

/**
 * Counts how often each sample saw a sequence. Emits one record per sequence and sample, keyed
 * <code>sequence TAB label</code> with the count as value.
 */
public class SampleCountReducer extends StageReducer
{
  @Override
  public void reduce(byte[] key, Iterator<byte[]> values, OutputCollector output) throws IOException
  {
    Map<String, Long> counts = new TreeMap<String, Long>();
    while (values.hasNext())
    {
      String label = new String(values.next(), StandardCharsets.UTF_8);
      Long count = counts.get(label);
      counts.put(label, count == null ? 1 : count + 1);
    }
    String sequence = new String(key, StandardCharsets.UTF_8);
    for (Map.Entry<String, Long> count : counts.entrySet())
    {
      output.collect(Record.of(sequence + "\t" + count.getKey(), Long.toString(count.getValue())));
    }
  }
}
