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
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;

import dooplicity.mr.fs.SharedStorage;

/**
 * {@link ResultCache} kept as files on shared storage, so tasks on every backend see the same entries.
 *
 * <p>
 * An entry lives at <code>root/ab/abcdef...</code> where <code>ab</code> are the first two characters of
 * the fingerprint. It is written to a temporary file and published with
 * {@link SharedStorage#commitExclusive(Path, Path)}, which is the only compare-and-set in the system.
 * Claims live under <code>root/_claims</code> and hold the owner's identity.
 * </p>
 */
public class SharedStorageResultCache implements ResultCache
{
  public static final String CLAIM_POLL_MS = "cache.claim.poll.ms";
  public static final long DEFAULT_CLAIM_POLL_MS = 200;

  private final Logger _log = Logger.getLogger(SharedStorageResultCache.class);

  private final SharedStorage storage;
  private final Path root;
  private final long pollMillis;

  public SharedStorageResultCache(SharedStorage storage, Path root, long pollMillis)
  {
    this.storage = storage;
    this.root = root;
    this.pollMillis = pollMillis;
  }

  Path entryPath(String fingerprint)
  {
    checkFingerprint(fingerprint);
    return new Path(new Path(root, fingerprint.substring(0, 2)), fingerprint);
  }

  Path claimPath(String fingerprint)
  {
    checkFingerprint(fingerprint);
    return new Path(new Path(new Path(root, "_claims"), fingerprint.substring(0, 2)), fingerprint);
  }

  @Override
  public byte[] get(String fingerprint) throws IOException
  {
    return storage.readFully(entryPath(fingerprint));
  }

  @Override
  public boolean putIfAbsent(String fingerprint, byte[] result) throws IOException
  {
    Path entry = entryPath(fingerprint);
    storage.mkdirs(entry.getParent());
    boolean accepted = storage.commitExclusive(storage.writeTemporary(entry, result), entry);
    if (!accepted)
    {
      _log.debug(String.format("Lost publish race for %s", fingerprint));
    }
    return accepted;
  }

  @Override
  public boolean tryClaim(String fingerprint, String owner) throws IOException
  {
    Path claim = claimPath(fingerprint);
    byte[] ownerBytes = owner.getBytes(StandardCharsets.UTF_8);
    if (storage.createExclusive(claim, ownerBytes))
    {
      return true;
    }
    // a retried attempt finds the claim its predecessor left behind
    byte[] holder = storage.readFully(claim);
    return holder != null && Arrays.equals(holder, ownerBytes);
  }

  @Override
  public boolean releaseClaim(String fingerprint, String owner) throws IOException
  {
    Path claim = claimPath(fingerprint);
    byte[] holder = storage.readFully(claim);
    if (holder == null || !Arrays.equals(holder, owner.getBytes(StandardCharsets.UTF_8)))
    {
      return false;
    }
    storage.delete(claim);
    _log.info(String.format("Released claim on %s held by %s", fingerprint, owner));
    return true;
  }

  @Override
  public byte[] awaitResult(String fingerprint, long timeoutMillis) throws IOException, InterruptedException
  {
    long deadline = System.currentTimeMillis() + timeoutMillis;
    Path claim = claimPath(fingerprint);
    while (true)
    {
      byte[] result = get(fingerprint);
      if (result != null)
      {
        return result;
      }
      if (!storage.exists(claim))
      {
        // checked again so a result published just before the release is not missed
        return get(fingerprint);
      }
      long remaining = deadline - System.currentTimeMillis();
      if (remaining <= 0)
      {
        return null;
      }
      Thread.sleep(Math.min(pollMillis, remaining));
    }
  }

  private static void checkFingerprint(String fingerprint)
  {
    if (fingerprint == null || fingerprint.length() < 3)
    {
      throw new IllegalArgumentException("Invalid fingerprint: " + fingerprint);
    }
  }
}
