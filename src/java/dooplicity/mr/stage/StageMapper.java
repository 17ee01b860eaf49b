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

package dooplicity.mr.stage;

import java.io.IOException;

import dooplicity.mr.io.Record;

/**
 * Body of a {@link StageType#MAP} stage. Instances are created reflectively, one per task attempt, so
 * subclasses need a public no-argument constructor.
 */
public abstract class StageMapper
{
  /**
   * Called once before the first record.
   */
  public void setup(TaskContext context) throws IOException
  {
  }

  public abstract void map(Record record, OutputCollector output) throws IOException;

  /**
   * Called once after the last record.
   */
  public void cleanup(OutputCollector output) throws IOException
  {
  }
}
