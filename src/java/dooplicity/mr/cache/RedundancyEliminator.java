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
import java.io.InterruptedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Resolves work units through the {@link ResultCache} so that each distinct unit is computed once per
 * job.
 *
 * <p>
 * Lookup order is: a small in-task memo, the shared cache, then a claim. The claim owner computes and
 * publishes; other tasks wait for the published result. An owner whose computation fails releases its
 * claim and a waiting task takes it over. A claim that is neither honored nor released within
 * <em>cache.claim.timeout.ms</em> (for example because its owner died) is ignored and the waiter computes
 * itself. A result that loses the publish race is discarded in favor of the stored one.
 * </p>
 */
public class RedundancyEliminator
{
  public static final String MEMO_SIZE = "cache.memo.size";
  public static final int DEFAULT_MEMO_SIZE = 10000;
  public static final String CLAIM_TIMEOUT_MS = "cache.claim.timeout.ms";
  public static final long DEFAULT_CLAIM_TIMEOUT_MS = 10 * 60 * 1000L;

  /**
   * The expensive computation whose results are shared.
   */
  public interface Computation
  {
    byte[] compute(byte[] workUnit) throws IOException;
  }

  private final Logger _log = Logger.getLogger(RedundancyEliminator.class);

  private final ResultCache cache;
  private final Fingerprinter fingerprinter;
  private final String owner;
  private final long claimTimeoutMillis;
  private final Map<String, byte[]> memo;

  private long hits;
  private long computed;
  private long raceLosses;
  private long claimWaits;

  public RedundancyEliminator(ResultCache cache,
                              Fingerprinter fingerprinter,
                              String owner,
                              final int memoSize,
                              long claimTimeoutMillis)
  {
    this.cache = cache;
    this.fingerprinter = fingerprinter;
    this.owner = owner;
    this.claimTimeoutMillis = claimTimeoutMillis;
    this.memo = new LinkedHashMap<String, byte[]>(16, 0.75f, true)
    {
      private static final long serialVersionUID = 1L;

      @Override
      protected boolean removeEldestEntry(Map.Entry<String, byte[]> eldest)
      {
        return size() > memoSize;
      }
    };
  }

  public byte[] resolve(byte[] workUnit, Computation computation) throws IOException
  {
    String fingerprint = fingerprinter.fingerprint(workUnit);
    byte[] result = memo.get(fingerprint);
    if (result != null)
    {
      hits++;
      return result;
    }

    result = cache.get(fingerprint);
    if (result != null)
    {
      hits++;
    }
    else if (cache.tryClaim(fingerprint, owner))
    {
      result = computeAndPublish(fingerprint, workUnit, computation);
    }
    else
    {
      claimWaits++;
      result = awaitOrTakeOver(fingerprint, workUnit, computation);
    }
    memo.put(fingerprint, result);
    return result;
  }

  private byte[] awaitOrTakeOver(String fingerprint, byte[] workUnit, Computation computation) throws IOException
  {
    long deadline = System.currentTimeMillis() + claimTimeoutMillis;
    while (true)
    {
      byte[] result;
      try
      {
        result = cache.awaitResult(fingerprint, Math.max(0L, deadline - System.currentTimeMillis()));
      }
      catch (InterruptedException e)
      {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("Interrupted while waiting for cached result " + fingerprint);
      }
      if (result != null)
      {
        hits++;
        return result;
      }
      if (cache.tryClaim(fingerprint, owner))
      {
        _log.info(String.format("Took over released claim on %s", fingerprint));
        return computeAndPublish(fingerprint, workUnit, computation);
      }
      if (System.currentTimeMillis() >= deadline)
      {
        _log.warn(String.format("Claim on %s not honored within %d ms, computing it here", fingerprint, claimTimeoutMillis));
        return computeAndPublish(fingerprint, workUnit, computation);
      }
    }
  }

  private byte[] computeAndPublish(String fingerprint, byte[] workUnit, Computation computation) throws IOException
  {
    byte[] result;
    try
    {
      result = computation.compute(workUnit);
    }
    catch (IOException e)
    {
      releaseClaim(fingerprint);
      throw e;
    }
    catch (RuntimeException e)
    {
      releaseClaim(fingerprint);
      throw e;
    }
    computed++;
    if (!cache.putIfAbsent(fingerprint, result))
    {
      raceLosses++;
      byte[] winner = cache.get(fingerprint);
      if (winner == null)
      {
        throw new IOException("Cache entry vanished after losing publish race: " + fingerprint);
      }
      result = winner;
    }
    return result;
  }

  private void releaseClaim(String fingerprint)
  {
    try
    {
      cache.releaseClaim(fingerprint, owner);
    }
    catch (IOException e)
    {
      _log.warn(String.format("Could not release claim on %s, waiters will time out", fingerprint), e);
    }
  }

  public long getHits()
  {
    return hits;
  }

  public long getComputed()
  {
    return computed;
  }

  public long getRaceLosses()
  {
    return raceLosses;
  }

  public long getClaimWaits()
  {
    return claimWaits;
  }
}
