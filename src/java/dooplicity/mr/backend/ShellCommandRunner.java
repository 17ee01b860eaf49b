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

import org.apache.hadoop.util.Shell.ExitCodeException;
import org.apache.hadoop.util.Shell.ShellCommandExecutor;

/**
 * Runs commands with Hadoop's {@link ShellCommandExecutor}. The given variables are added to the
 * environment inherited from this process.
 */
public class ShellCommandRunner implements CommandRunner
{
  @Override
  public CommandResult run(List<String> command, Map<String, String> environment, long timeoutMillis) throws IOException
  {
    ShellCommandExecutor executor =
        new ShellCommandExecutor(command.toArray(new String[0]), null, environment, timeoutMillis);
    try
    {
      executor.execute();
    }
    catch (ExitCodeException e)
    {
      // the executor kills a command that runs too long and reports it as an exit code
      if (executor.isTimedOut())
      {
        throw timedOut(command, timeoutMillis, e);
      }
      return new CommandResult(e.getExitCode(), executor.getOutput(), e.getMessage());
    }
    if (executor.isTimedOut())
    {
      throw timedOut(command, timeoutMillis, null);
    }
    return new CommandResult(executor.getExitCode(), executor.getOutput(), null);
  }

  private static IOException timedOut(List<String> command, long timeoutMillis, Throwable cause)
  {
    return new IOException(String.format("Command %s timed out after %d ms", command, timeoutMillis), cause);
  }
}
