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

package dooplicity.mr.cache;

import java.io.IOException;

/**
 * Job-wide store of computation results keyed by work-unit fingerprint.
 *
 * <p>
 * Entries are immutable: the first successful {@link #putIfAbsent(String, byte[])} for a fingerprint
 * wins and every later reader observes exactly its bytes. Claims let concurrent tasks agree on which one
 * performs a computation; they are advisory and a caller that gives up waiting on a claim may compute
 * anyway, relying on first-writer-wins.
 * </p>
 */
public interface ResultCache
{
  /**
   * @return the stored result, or <code>null</code> if none has been published
   */
  byte[] get(String fingerprint) throws IOException;

  /**
   * Publishes a result unless one is already stored.
   *
   * @return true if this result was stored, false if another writer's result was already present
   */
  boolean putIfAbsent(String fingerprint, byte[] result) throws IOException;

  /**
   * Claims the computation of a fingerprint.
   *
   * @param owner
   *          identity of the claiming task; a task that finds its own earlier claim owns it again
   * @return true if the caller owns the claim and should compute
   */
  boolean tryClaim(String fingerprint, String owner) throws IOException;

  /**
   * Gives up a claim so that waiting tasks can take it over. A claim held by another owner is left alone.
   *
   * @return true if the claim was held by this owner and is now released
   */
  boolean releaseClaim(String fingerprint, String owner) throws IOException;

  /**
   * Waits for another task's result to be published. Returns early, without a result, once nobody holds
   * the claim any more.
   *
   * @return the result, or <code>null</code> if none appeared within the timeout or the claim was released
   */
  byte[] awaitResult(String fingerprint, long timeoutMillis) throws IOException, InterruptedException;
}
