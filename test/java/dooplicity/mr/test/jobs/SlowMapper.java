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

package dooplicity.mr.test.jobs;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;

import dooplicity.mr.io.Record;
import dooplicity.mr.manifest.Read;
import dooplicity.mr.stage.OutputCollector;
import dooplicity.mr.stage.StageMapper;
import dooplicity.mr.stage.TaskContext;

/**
 * Keys every read by its sequence, sleeping <em>sleep.ms</em> per read.
 */
public class SlowMapper extends StageMapper
{
  public static final String SLEEP_MS = "sleep.ms";

  private long sleepMillis;

  @Override
  public void setup(TaskContext context) throws IOException
  {
    sleepMillis = context.getConf().getLong(SLEEP_MS, 100);
  }

  @Override
  public void map(Record record, OutputCollector output) throws IOException
  {
    try
    {
      Thread.sleep(sleepMillis);
    }
    catch (InterruptedException e)
    {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted while sleeping");
    }
    output.collect(new Record(Read.fromRecord(record).getSequence().getBytes(StandardCharsets.UTF_8), record.getKey()));
  }
}
