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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import org.apache.hadoop.io.IOUtils;

import dooplicity.mr.io.Record;
import dooplicity.mr.io.RecordInput;

/**
 * K-way merge of inputs that are each sorted by key.
 *
 * <p>
 * Holds one record per input, so memory is bounded by the number of inputs rather than the number of
 * records. Equal keys are emitted in input order, and in stream order within one input, which makes the
 * merge stable when the inputs are listed in arrival order.
 * </p>
 */
public class MergingRecordInput implements RecordInput
{
  private static final Comparator<Head> HEAD_ORDER = new Comparator<Head>()
  {
    @Override
    public int compare(Head o1, Head o2)
    {
      int cmp = Record.compareKeys(o1.record.getKey(), o2.record.getKey());
      return cmp != 0 ? cmp : Integer.compare(o1.source, o2.source);
    }
  };

  private final List<RecordInput> inputs;
  private final PriorityQueue<Head> queue;
  private boolean primed;

  public MergingRecordInput(List<? extends RecordInput> inputs)
  {
    this.inputs = new ArrayList<RecordInput>(inputs);
    this.queue = new PriorityQueue<Head>(Math.max(1, inputs.size()), HEAD_ORDER);
  }

  @Override
  public Record read() throws IOException
  {
    if (!primed)
    {
      for (int i = 0; i < inputs.size(); i++)
      {
        advance(i);
      }
      primed = true;
    }
    Head head = queue.poll();
    if (head == null)
    {
      return null;
    }
    advance(head.source);
    return head.record;
  }

  private void advance(int source) throws IOException
  {
    Record next = inputs.get(source).read();
    if (next != null)
    {
      queue.add(new Head(next, source));
    }
  }

  @Override
  public void close() throws IOException
  {
    IOException first = null;
    for (RecordInput input : inputs)
    {
      try
      {
        input.close();
      }
      catch (IOException e)
      {
        if (first == null)
        {
          first = e;
        }
      }
    }
    queue.clear();
    if (first != null)
    {
      throw first;
    }
  }

  private static final class Head
  {
    final Record record;
    final int source;

    Head(Record record, int source)
    {
      this.record = record;
      this.source = source;
    }
  }

  /**
   * Closes every input, ignoring failures. For error paths that are already rethrowing.
   */
  public static void closeQuietly(List<? extends RecordInput> inputs)
  {
    for (RecordInput input : inputs)
    {
      IOUtils.closeStream(input);
    }
  }
}
