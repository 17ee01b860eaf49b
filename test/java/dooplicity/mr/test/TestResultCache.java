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

package dooplicity.mr.test;

import java.io.IOException;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import dooplicity.mr.cache.Fingerprinter;
import dooplicity.mr.cache.RedundancyEliminator;
import dooplicity.mr.cache.SharedStorageResultCache;
import dooplicity.mr.fs.SharedStorage;

@Test(groups = "pcl")
public class TestResultCache extends TestBase
{
  private Logger _log = Logger.getLogger(TestResultCache.class);

  private Path _cachePath;
  private SharedStorageResultCache _cache;
  private Fingerprinter _fingerprinter = new Fingerprinter("align", Collections.singletonMap("k", "22"));

  public TestResultCache() throws IOException
  {
    super();
  }

  @BeforeClass
  public void beforeClass() throws Exception
  {
    super.beforeClass();
    _cachePath = path("cache");
  }

  @AfterClass
  public void afterClass() throws Exception
  {
    super.afterClass();
  }

  @BeforeMethod
  public void beforeMethod(Method method) throws IOException
  {
    _log.info("*** Running " + method.getName());
    cleanPath(_cachePath);
    _cache = new SharedStorageResultCache(new SharedStorage(getFileSystem()), _cachePath, 10);
  }

  @Test
  public void fingerprintDependsOnParamsAndNamespaceTest()
  {
    byte[] unit = bytes("ACGTACGT");
    String base = _fingerprinter.fingerprint(unit);
    Assert.assertEquals(base.length(), 64);
    Assert.assertEquals(new Fingerprinter("align", Collections.singletonMap("k", "22")).fingerprint(unit), base);
    Assert.assertNotEquals(new Fingerprinter("align", Collections.singletonMap("k", "23")).fingerprint(unit), base);
    Assert.assertNotEquals(new Fingerprinter("other", Collections.singletonMap("k", "22")).fingerprint(unit), base);
    Assert.assertNotEquals(new Fingerprinter("align", Collections.<String, String> emptyMap()).fingerprint(unit), base);
    Assert.assertNotEquals(_fingerprinter.fingerprint(bytes("ACGTACGA")), base);
  }

  @Test
  public void fingerprintFieldsDoNotRunTogetherTest()
  {
    Map<String, String> p1 = new HashMap<String, String>();
    p1.put("ab", "c");
    Map<String, String> p2 = new HashMap<String, String>();
    p2.put("a", "bc");
    Assert.assertNotEquals(new Fingerprinter("n", p1).fingerprint(new byte[0]), new Fingerprinter("n", p2).fingerprint(new byte[0]));
  }

  @Test
  public void firstWriterWinsTest() throws IOException
  {
    String fp = _fingerprinter.fingerprint(bytes("unit"));
    Assert.assertNull(_cache.get(fp));
    Assert.assertTrue(_cache.putIfAbsent(fp, bytes("first")));
    Assert.assertFalse(_cache.putIfAbsent(fp, bytes("second")));
    Assert.assertEquals(_cache.get(fp), bytes("first"));
  }

  @Test
  public void concurrentWritersAgreeTest() throws Exception
  {
    final String fp = _fingerprinter.fingerprint(bytes("contended"));
    final int writers = 8;
    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(writers);
    try
    {
      List<Future<Boolean>> results = new ArrayList<Future<Boolean>>();
      for (int i = 0; i < writers; i++)
      {
        final int id = i;
        results.add(executor.submit(new Callable<Boolean>()
        {
          @Override
          public Boolean call() throws Exception
          {
            start.await();
            return _cache.putIfAbsent(fp, bytes("writer-" + id));
          }
        }));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> result : results)
      {
        if (result.get())
        {
          winners++;
        }
      }
      Assert.assertEquals(winners, 1);
      Assert.assertTrue(new String(_cache.get(fp), StandardCharsets.UTF_8).startsWith("writer-"));
    }
    finally
    {
      executor.shutdownNow();
    }
  }

  @Test
  public void claimsTest() throws IOException
  {
    String fp = _fingerprinter.fingerprint(bytes("claimed"));
    Assert.assertTrue(_cache.tryClaim(fp, "count/task-00000"));
    Assert.assertFalse(_cache.tryClaim(fp, "count/task-00001"));
    // a retried attempt of the owner takes its claim back
    Assert.assertTrue(_cache.tryClaim(fp, "count/task-00000"));
  }

  @Test
  public void releaseClaimTest() throws Exception
  {
    String fp = _fingerprinter.fingerprint(bytes("released"));
    Assert.assertFalse(_cache.releaseClaim(fp, "count/task-00000"));
    Assert.assertTrue(_cache.tryClaim(fp, "count/task-00000"));
    Assert.assertFalse(_cache.releaseClaim(fp, "count/task-00001"));
    Assert.assertFalse(_cache.tryClaim(fp, "count/task-00001"));
    Assert.assertTrue(_cache.releaseClaim(fp, "count/task-00000"));
    // nobody holds the claim, so there is nothing to wait for
    Assert.assertNull(_cache.awaitResult(fp, 10000));
    Assert.assertTrue(_cache.tryClaim(fp, "count/task-00001"));
  }

  @Test
  public void awaitResultTest() throws Exception
  {
    final String fp = _fingerprinter.fingerprint(bytes("awaited"));
    Assert.assertTrue(_cache.tryClaim(fp, "count/task-00003"));
    Assert.assertNull(_cache.awaitResult(fp, 50));

    Thread publisher = new Thread()
    {
      @Override
      public void run()
      {
        try
        {
          Thread.sleep(100);
          _cache.putIfAbsent(fp, bytes("published"));
        }
        catch (Exception e)
        {
          _log.error("Could not publish", e);
        }
      }
    };
    publisher.start();
    Assert.assertEquals(_cache.awaitResult(fp, 10000), bytes("published"));
    publisher.join();
  }

  @Test
  public void eliminatorComputesOnceTest() throws IOException
  {
    final AtomicInteger calls = new AtomicInteger();
    RedundancyEliminator.Computation reverse = new RedundancyEliminator.Computation()
    {
      @Override
      public byte[] compute(byte[] workUnit)
      {
        calls.incrementAndGet();
        return new StringBuilder(new String(workUnit, StandardCharsets.UTF_8)).reverse().toString().getBytes(StandardCharsets.UTF_8);
      }
    };

    RedundancyEliminator first = new RedundancyEliminator(_cache, _fingerprinter, "map/task-00000", 2, 1000);
    Assert.assertEquals(first.resolve(bytes("ACG"), reverse), bytes("GCA"));
    Assert.assertEquals(first.resolve(bytes("ACG"), reverse), bytes("GCA"));
    Assert.assertEquals(calls.get(), 1);
    Assert.assertEquals(first.getComputed(), 1);
    Assert.assertEquals(first.getHits(), 1);

    // another task finds the published result
    RedundancyEliminator second = new RedundancyEliminator(_cache, _fingerprinter, "map/task-00001", 2, 1000);
    Assert.assertEquals(second.resolve(bytes("ACG"), reverse), bytes("GCA"));
    Assert.assertEquals(second.resolve(bytes("TTT"), reverse), bytes("TTT"));
    Assert.assertEquals(calls.get(), 2);
    Assert.assertEquals(second.getHits(), 1);
    Assert.assertEquals(second.getComputed(), 1);
  }

  @Test
  public void abandonedClaimIsComputedAnywayTest() throws IOException
  {
    String fp = _fingerprinter.fingerprint(bytes("orphan"));
    Assert.assertTrue(_cache.tryClaim(fp, "map/task-00009"));

    RedundancyEliminator eliminator = new RedundancyEliminator(_cache, _fingerprinter, "map/task-00000", 10, 50);
    byte[] result = eliminator.resolve(bytes("orphan"), new RedundancyEliminator.Computation()
    {
      @Override
      public byte[] compute(byte[] workUnit)
      {
        return bytes("computed");
      }
    });
    Assert.assertEquals(result, bytes("computed"));
    Assert.assertEquals(eliminator.getClaimWaits(), 1);
    Assert.assertEquals(eliminator.getComputed(), 1);
    Assert.assertEquals(_cache.get(fp), bytes("computed"));
  }

  @Test
  public void failedComputationReleasesClaimTest() throws IOException
  {
    String fp = _fingerprinter.fingerprint(bytes("broken"));
    RedundancyEliminator eliminator = new RedundancyEliminator(_cache, _fingerprinter, "map/task-00000", 10, 1000);
    try
    {
      eliminator.resolve(bytes("broken"), new RedundancyEliminator.Computation()
      {
        @Override
        public byte[] compute(byte[] workUnit) throws IOException
        {
          throw new IOException("aligner crashed");
        }
      });
      Assert.fail("expected the computation's failure");
    }
    catch (IOException e)
    {
      Assert.assertEquals(e.getMessage(), "aligner crashed");
    }
    Assert.assertEquals(eliminator.getComputed(), 0);
    Assert.assertNull(_cache.get(fp));
    Assert.assertTrue(_cache.tryClaim(fp, "map/task-00001"));
  }

  @Test
  public void waiterTakesOverReleasedClaimTest() throws Exception
  {
    final String fp = _fingerprinter.fingerprint(bytes("shared"));
    final CountDownLatch ownerClaimed = new CountDownLatch(1);
    final CountDownLatch waiterStarted = new CountDownLatch(1);
    final RedundancyEliminator owner = new RedundancyEliminator(_cache, _fingerprinter, "map/task-00000", 10, 60000);
    final RedundancyEliminator waiter = new RedundancyEliminator(_cache, _fingerprinter, "map/task-00001", 10, 60000);

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try
    {
      Future<String> failed = executor.submit(new Callable<String>()
      {
        @Override
        public String call() throws Exception
        {
          try
          {
            owner.resolve(bytes("shared"), new RedundancyEliminator.Computation()
            {
              @Override
              public byte[] compute(byte[] workUnit) throws IOException
              {
                ownerClaimed.countDown();
                try
                {
                  waiterStarted.await();
                  Thread.sleep(300);
                }
                catch (InterruptedException e)
                {
                  throw new IOException(e);
                }
                throw new IOException("first attempt failed");
              }
            });
            return "resolved";
          }
          catch (IOException e)
          {
            return e.getMessage();
          }
        }
      });

      ownerClaimed.await();
      long start = System.currentTimeMillis();
      Future<byte[]> taken = executor.submit(new Callable<byte[]>()
      {
        @Override
        public byte[] call() throws Exception
        {
          waiterStarted.countDown();
          return waiter.resolve(bytes("shared"), new RedundancyEliminator.Computation()
          {
            @Override
            public byte[] compute(byte[] workUnit)
            {
              return bytes("computed by waiter");
            }
          });
        }
      });

      Assert.assertEquals(failed.get(), "first attempt failed");
      Assert.assertEquals(taken.get(), bytes("computed by waiter"));
      long elapsed = System.currentTimeMillis() - start;
      Assert.assertTrue(elapsed < 30000, "waiter sat out the claim timeout: " + elapsed + " ms");
      Assert.assertEquals(waiter.getClaimWaits(), 1);
      Assert.assertEquals(waiter.getComputed(), 1);
      Assert.assertEquals(_cache.get(fp), bytes("computed by waiter"));
    }
    finally
    {
      executor.shutdownNow();
    }
  }

  @Test
  public void lostRaceReturnsStoredResultTest() throws IOException
  {
    final String fp = _fingerprinter.fingerprint(bytes("raced"));
    RedundancyEliminator eliminator = new RedundancyEliminator(_cache, _fingerprinter, "map/task-00000", 10, 1000);
    byte[] result = eliminator.resolve(bytes("raced"), new RedundancyEliminator.Computation()
    {
      @Override
      public byte[] compute(byte[] workUnit) throws IOException
      {
        // someone else publishes while we compute
        _cache.putIfAbsent(fp, bytes("winner"));
        return bytes("loser");
      }
    });
    Assert.assertEquals(result, bytes("winner"));
    Assert.assertEquals(eliminator.getRaceLosses(), 1);
  }

  private static byte[] bytes(String s)
  {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
