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

import java.util.Map;

import org.apache.hadoop.conf.Configuration;

import dooplicity.mr.ConfigurationException;

/**
 * Creates the backend named by <em>backend</em>: <code>local</code> (default), <code>scheduler</code>,
 * <code>remote</code> or <code>elastic</code>.
 */
public class BackendFactory
{
  public static final String BACKEND = "backend";
  public static final String DEFAULT_BACKEND = "local";

  private BackendFactory()
  {
  }

  public static Backend create(Configuration conf)
  {
    return create(conf, new ShellCommandRunner(), CommandBackend.captureEnvironment());
  }

  public static Backend create(Configuration conf, CommandRunner runner, Map<String, String> environment)
  {
    String name = conf.getTrimmed(BACKEND, DEFAULT_BACKEND).toLowerCase();
    if ("local".equals(name))
    {
      return new LocalBackend(conf);
    }
    if ("scheduler".equals(name))
    {
      return new SchedulerBackend(conf, runner, environment);
    }
    if ("remote".equals(name))
    {
      return new RemoteShellBackend(conf, runner, environment);
    }
    if ("elastic".equals(name))
    {
      return new ElasticBackend(conf, runner, environment);
    }
    throw new ConfigurationException(String.format("Unknown backend '%s'. Use local, scheduler, remote or elastic.", name));
  }
}
