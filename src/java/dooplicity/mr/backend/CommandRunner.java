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

package dooplicity.mr.backend;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Runs external commands for the backends that drive a cluster through its command-line tools.
 */
public interface CommandRunner
{
  /**
   * Runs a command to completion.
   *
   * @param command
   *          program and arguments
   * @param environment
   *          variables added to the inherited environment
   * @param timeoutMillis
   *          give up after this long, 0 for no limit
   * @return the exit code and output; a non-zero exit is a result, not an exception
   * @throws IOException
   *           when the command could not be run or timed out
   */
  CommandResult run(List<String> command, Map<String, String> environment, long timeoutMillis) throws IOException;
}
