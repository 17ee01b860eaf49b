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

package dooplicity.mr.stage;

import java.io.IOException;

import dooplicity.mr.io.Record;

/**
 * A map body whose expensive part depends only on a work unit extracted from each record, and is
 * therefore eligible for cross-sample redundancy elimination.
 *
 * <p>
 * The body is split in three: {@link #workUnit(Record)} extracts the semantically relevant bytes (for
 * example the read sequence, without its sample label), {@link #compute(byte[])} does the expensive work
 * on them, and {@link #emit(Record, byte[], OutputCollector)} combines the possibly shared result with the
 * record's own metadata. When the stage is marked cacheable the task runner routes
 * <code>compute</code> through the job's result cache; otherwise {@link #map(Record, OutputCollector)}
 * simply chains the three.
 * </p>
 */
public abstract class CachingMapper extends StageMapper
{
  public abstract byte[] workUnit(Record record) throws IOException;

  public abstract byte[] compute(byte[] workUnit) throws IOException;

  public abstract void emit(Record record, byte[] result, OutputCollector output) throws IOException;

  @Override
  public void map(Record record, OutputCollector output) throws IOException
  {
    emit(record, compute(workUnit(record)), output);
  }
}
