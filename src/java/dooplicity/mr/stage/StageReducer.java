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
import java.util.Iterator;

/**
 * Body of a {@link StageType#REDUCE} stage. Every value of a key is presented in one call, in the order
 * the values arrived from the upstream tasks.
 */
public abstract class StageReducer
{
  public void setup(TaskContext context) throws IOException
  {
  }

  public abstract void reduce(byte[] key, Iterator<byte[]> values, OutputCollector output) throws IOException;

  public void cleanup(OutputCollector output) throws IOException
  {
  }
}
