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

package dooplicity.mr.io;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Comparator;

import org.apache.hadoop.io.WritableComparator;

/**
 * A key/value pair of raw bytes, the unit of data exchanged between stages.
 *
 * <p>
 * Keys order by unsigned lexicographic comparison of their bytes. Keys are not unique; when several
 * records share a key their relative order is the order in which they arrived.
 * </p>
 */
public final class Record
{
  /**
   * Orders records by key only, so that a stable sort keeps arrival order among equal keys.
   */
  public static final Comparator<Record> KEY_ORDER = new Comparator<Record>()
  {
    @Override
    public int compare(Record o1, Record o2)
    {
      return compareKeys(o1.key, o2.key);
    }
  };

  private final byte[] key;
  private final byte[] value;

  public Record(byte[] key, byte[] value)
  {
    if (key == null || value == null)
    {
      throw new IllegalArgumentException("Record key and value must not be null");
    }
    this.key = key;
    this.value = value;
  }

  public static Record of(String key, String value)
  {
    return new Record(key.getBytes(StandardCharsets.UTF_8), value.getBytes(StandardCharsets.UTF_8));
  }

  public static int compareKeys(byte[] k1, byte[] k2)
  {
    return WritableComparator.compareBytes(k1, 0, k1.length, k2, 0, k2.length);
  }

  public byte[] getKey()
  {
    return key;
  }

  public byte[] getValue()
  {
    return value;
  }

  public String getKeyString()
  {
    return new String(key, StandardCharsets.UTF_8);
  }

  public String getValueString()
  {
    return new String(value, StandardCharsets.UTF_8);
  }

  /**
   * Approximate heap footprint, used by the sorter to decide when to spill.
   */
  public long getSizeEstimate()
  {
    return key.length + value.length + 48L;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj)
    {
      return true;
    }
    if (!(obj instanceof Record))
    {
      return false;
    }
    Record other = (Record) obj;
    return Arrays.equals(key, other.key) && Arrays.equals(value, other.value);
  }

  @Override
  public int hashCode()
  {
    return 31 * Arrays.hashCode(key) + Arrays.hashCode(value);
  }

  @Override
  public String toString()
  {
    return String.format("Record[%s -> %s]", getKeyString(), getValueString());
  }
}
