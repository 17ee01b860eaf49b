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

package dooplicity.mr.stages;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import dooplicity.mr.io.Record;
import dooplicity.mr.manifest.Read;
import dooplicity.mr.stage.CachingMapper;
import dooplicity.mr.stage.OutputCollector;
import dooplicity.mr.stage.TaskContext;

/**
 * Maps every read to its canonical sequence, keyed by that sequence with the sample label as value.
 *
 * <p>
 * The canonical form of a sequence is the upper-cased sequence or, when <em>reverse.complement</em> is
 * true (the default), the lesser of it and its reverse complement. The work unit is the read sequence
 * alone, so identical reads of different samples share one computation.
 * </p>
 */
public class CanonicalSequenceMapper extends CachingMapper
{
  public static final String REVERSE_COMPLEMENT = "reverse.complement";

  private boolean reverseComplement = true;

  @Override
  public void setup(TaskContext context) throws IOException
  {
    reverseComplement = Boolean.parseBoolean(context.getParam(REVERSE_COMPLEMENT, "true"));
  }

  @Override
  public byte[] workUnit(Record record) throws IOException
  {
    return Read.fromRecord(record).getSequence().getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public byte[] compute(byte[] workUnit) throws IOException
  {
    String seq = new String(workUnit, StandardCharsets.UTF_8).toUpperCase();
    if (reverseComplement)
    {
      String rc = reverseComplement(seq);
      if (rc.compareTo(seq) < 0)
      {
        seq = rc;
      }
    }
    return seq.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public void emit(Record record, byte[] result, OutputCollector output) throws IOException
  {
    output.collect(new Record(result, record.getKey()));
  }

  static String reverseComplement(String seq)
  {
    StringBuilder sb = new StringBuilder(seq.length());
    for (int i = seq.length() - 1; i >= 0; i--)
    {
      char c = seq.charAt(i);
      switch (c)
      {
        case 'A':
          sb.append('T');
          break;
        case 'C':
          sb.append('G');
          break;
        case 'G':
          sb.append('C');
          break;
        case 'T':
          sb.append('A');
          break;
        default:
          sb.append('N');
      }
    }
    return sb.toString();
  }
}
