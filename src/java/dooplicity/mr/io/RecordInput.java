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

import java.io.Closeable;
import java.io.IOException;

/**
 * A pull-based stream of records.
 */
public interface RecordInput extends Closeable
{
  /**
   * Reads the next record.
   *
   * @return the next record, or <code>null</code> once the input is exhausted
   * @throws IOException
   *           when the underlying storage fails or the data is malformed
   */
  Record read() throws IOException;
}
