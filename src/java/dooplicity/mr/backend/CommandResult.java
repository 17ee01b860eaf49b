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

/**
 * Exit code and output of an external command.
 */
public class CommandResult
{
  private final int exitCode;
  private final String output;
  private final String error;

  public CommandResult(int exitCode, String output, String error)
  {
    this.exitCode = exitCode;
    this.output = output == null ? "" : output;
    this.error = error == null ? "" : error;
  }

  public int getExitCode()
  {
    return exitCode;
  }

  public boolean isSuccess()
  {
    return exitCode == 0;
  }

  public String getOutput()
  {
    return output;
  }

  public String getError()
  {
    return error;
  }

  @Override
  public String toString()
  {
    return String.format("exit %d%s", exitCode, error.isEmpty() ? "" : ": " + error.trim());
  }
}
