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

package dooplicity.mr.partition;

import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import dooplicity.mr.io.Record;
import dooplicity.mr.io.RecordInput;

/**
 * Walks a key-sorted input one key group at a time, streaming the values of each group.
 *
 * <p>
 * Values not consumed by the caller are skipped when moving to the next key. The value iterator
 * wraps read failures in a <code>RuntimeException</code> whose cause is the <code>IOException</code>.
 * </p>
 */
public class KeyGroupIterator
{
  private final RecordInput input;
  private Record pending;
  private byte[] currentKey;
  private boolean groupOpen;
  private long groups;

  public KeyGroupIterator(RecordInput input)
  {
    this.input = input;
  }

  /**
   * Advances to the next key group.
   *
   * @return false once the input is exhausted
   */
  public boolean nextKey() throws IOException
  {
    while (groupOpen && hasNextValue())
    {
      pending = null;
    }
    if (pending == null)
    {
      pending = input.read();
    }
    if (pending == null)
    {
      currentKey = null;
      return false;
    }
    if (currentKey != null && Record.compareKeys(currentKey, pending.getKey()) > 0)
    {
      throw new IOException("Input is not sorted by key at group " + (groups + 1));
    }
    currentKey = pending.getKey();
    groupOpen = true;
    groups++;
    return true;
  }

  public byte[] getKey()
  {
    return currentKey;
  }

  public long getGroupCount()
  {
    return groups;
  }

  public Iterator<byte[]> values()
  {
    return new Iterator<byte[]>()
    {
      @Override
      public boolean hasNext()
      {
        try
        {
          return hasNextValue();
        }
        catch (IOException e)
        {
          throw new RuntimeException(e);
        }
      }

      @Override
      public byte[] next()
      {
        if (!hasNext())
        {
          throw new NoSuchElementException();
        }
        byte[] value = pending.getValue();
        pending = null;
        return value;
      }

      @Override
      public void remove()
      {
        throw new UnsupportedOperationException();
      }
    };
  }

  private boolean hasNextValue() throws IOException
  {
    if (!groupOpen)
    {
      return false;
    }
    if (pending == null)
    {
      pending = input.read();
    }
    if (pending == null || Record.compareKeys(pending.getKey(), currentKey) != 0)
    {
      groupOpen = false;
      return false;
    }
    return true;
  }
}
