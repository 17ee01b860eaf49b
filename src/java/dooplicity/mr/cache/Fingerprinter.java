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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Computes work-unit fingerprints.
 *
 * <p>
 * A fingerprint is the SHA-256 of the cache namespace, the stage parameters that affect the
 * computation (in key order) and the work unit itself, each length-prefixed so that no two distinct
 * inputs share an encoding. Sample labels and other per-record metadata must never reach the work unit,
 * otherwise identical sequences from different samples would not share a cache entry.
 * </p>
 */
public class Fingerprinter
{
  private final String namespace;
  private final SortedMap<String, String> params;

  public Fingerprinter(String namespace, Map<String, String> params)
  {
    this.namespace = namespace;
    this.params = new TreeMap<String, String>(params);
  }

  public String fingerprint(byte[] workUnit)
  {
    MessageDigest digest = DigestUtils.getSha256Digest();
    update(digest, namespace.getBytes(StandardCharsets.UTF_8));
    for (Map.Entry<String, String> param : params.entrySet())
    {
      update(digest, param.getKey().getBytes(StandardCharsets.UTF_8));
      update(digest, param.getValue().getBytes(StandardCharsets.UTF_8));
    }
    update(digest, workUnit);
    return Hex.encodeHexString(digest.digest());
  }

  private static void update(MessageDigest digest, byte[] field)
  {
    int length = field.length;
    digest.update((byte) (length >>> 24));
    digest.update((byte) (length >>> 16));
    digest.update((byte) (length >>> 8));
    digest.update((byte) length);
    digest.update(field);
  }
}
