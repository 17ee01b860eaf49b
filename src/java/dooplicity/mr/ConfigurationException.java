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

package dooplicity.mr;

import java.util.Collections;
import java.util.List;

/**
 * A job cannot start because its manifest, pipeline definition or backend parameters are invalid.
 * Raised before any task is submitted.
 */
public class ConfigurationException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  private final List<String> problems;

  public ConfigurationException(String message)
  {
    this(message, Collections.singletonList(message), null);
  }

  public ConfigurationException(String message, Throwable cause)
  {
    this(message, Collections.singletonList(message), cause);
  }

  public ConfigurationException(String message, List<String> problems, Throwable cause)
  {
    super(message, cause);
    this.problems = Collections.unmodifiableList(problems);
  }

  /**
   * Every problem found, when validation collected more than one.
   */
  public List<String> getProblems()
  {
    return problems;
  }
}
