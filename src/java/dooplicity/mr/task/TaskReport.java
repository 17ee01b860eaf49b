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

package dooplicity.mr.task;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.apache.avro.Schema.Type;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import dooplicity.mr.avro.AvroRecordReader;
import dooplicity.mr.avro.AvroRecordWriter;
import dooplicity.mr.avro.Schemas;

/**
 * Outcome of one task attempt.
 *
 * <p>
 * Reports are stored as Avro records: remote workers leave one under <em>_status</em> for the backend to
 * pick up, and the orchestrator appends the final report of every task to the job's
 * <em>task-reports.avro</em>.
 * </p>
 */
public class TaskReport
{
  public static final Schema SCHEMA =
      Schemas.createRecordSchema(TaskReport.class,
                                 "TaskReport",
                                 new Field("stage", Schema.create(Type.STRING), "stage name", null),
                                 new Field("task", Schema.create(Type.INT), "task index", null),
                                 new Field("attempt", Schema.create(Type.INT), "attempt number", null),
                                 new Field("succeeded", Schema.create(Type.BOOLEAN), "whether the attempt committed", null),
                                 new Field("diagnostics", Schemas.nullable(Type.STRING), "failure details", null),
                                 new Field("lost_inputs",
                                           Schema.createArray(Schema.create(Type.INT)),
                                           "upstream tasks whose output was missing",
                                           null),
                                 new Field("counters", Schema.createMap(Schema.create(Type.LONG)), "task counters", null),
                                 new Field("host", Schema.create(Type.STRING), "host that ran the attempt", null),
                                 new Field("start_time", Schema.create(Type.LONG), "start, epoch millis", null),
                                 new Field("finish_time", Schema.create(Type.LONG), "finish, epoch millis", null));

  private final String stage;
  private final int taskIndex;
  private final int attempt;
  private final boolean succeeded;
  private final String diagnostics;
  private final List<Integer> lostInputs;
  private final Map<String, Long> counters;
  private String host = "";
  private long startTime;
  private long finishTime;

  public TaskReport(String stage,
                    int taskIndex,
                    int attempt,
                    boolean succeeded,
                    String diagnostics,
                    List<Integer> lostInputs,
                    Map<String, Long> counters)
  {
    this.stage = stage;
    this.taskIndex = taskIndex;
    this.attempt = attempt;
    this.succeeded = succeeded;
    this.diagnostics = diagnostics;
    this.lostInputs = Collections.unmodifiableList(new ArrayList<Integer>(lostInputs));
    this.counters = Collections.unmodifiableMap(new TreeMap<String, Long>(counters));
  }

  public static TaskReport success(TaskSpec spec, Map<String, Long> counters)
  {
    return new TaskReport(spec.getStageName(),
                          spec.getTaskIndex(),
                          spec.getAttempt(),
                          true,
                          null,
                          Collections.<Integer> emptyList(),
                          counters);
  }

  public static TaskReport failure(TaskSpec spec, String diagnostics, List<Integer> lostInputs)
  {
    return new TaskReport(spec.getStageName(),
                          spec.getTaskIndex(),
                          spec.getAttempt(),
                          false,
                          diagnostics,
                          lostInputs,
                          Collections.<String, Long> emptyMap());
  }

  public String getStage()
  {
    return stage;
  }

  public int getTaskIndex()
  {
    return taskIndex;
  }

  public int getAttempt()
  {
    return attempt;
  }

  public boolean isSucceeded()
  {
    return succeeded;
  }

  public String getDiagnostics()
  {
    return diagnostics;
  }

  /**
   * Indices of upstream tasks whose committed output was missing, empty unless the attempt failed for
   * that reason.
   */
  public List<Integer> getLostInputs()
  {
    return lostInputs;
  }

  public Map<String, Long> getCounters()
  {
    return counters;
  }

  public long getCounter(TaskCounter counter)
  {
    Long value = counters.get(counter.name());
    return value == null ? 0 : value;
  }

  public String getHost()
  {
    return host;
  }

  public TaskReport setTiming(String host, long startTime, long finishTime)
  {
    this.host = host == null ? "" : host;
    this.startTime = startTime;
    this.finishTime = finishTime;
    return this;
  }

  public long getStartTime()
  {
    return startTime;
  }

  public long getFinishTime()
  {
    return finishTime;
  }

  public GenericRecord toRecord()
  {
    GenericRecord record = new GenericData.Record(SCHEMA);
    record.put("stage", stage);
    record.put("task", taskIndex);
    record.put("attempt", attempt);
    record.put("succeeded", succeeded);
    record.put("diagnostics", diagnostics);
    record.put("lost_inputs", new ArrayList<Integer>(lostInputs));
    record.put("counters", new TreeMap<String, Long>(counters));
    record.put("host", host);
    record.put("start_time", startTime);
    record.put("finish_time", finishTime);
    return record;
  }

  public static TaskReport fromRecord(GenericRecord record)
  {
    List<Integer> lost = new ArrayList<Integer>();
    for (Object o : (List<?>) record.get("lost_inputs"))
    {
      lost.add((Integer) o);
    }
    Map<String, Long> counters = new TreeMap<String, Long>();
    for (Map.Entry<?, ?> e : ((Map<?, ?>) record.get("counters")).entrySet())
    {
      counters.put(e.getKey().toString(), (Long) e.getValue());
    }
    Object diagnostics = record.get("diagnostics");
    TaskReport report = new TaskReport(record.get("stage").toString(),
                                       (Integer) record.get("task"),
                                       (Integer) record.get("attempt"),
                                       (Boolean) record.get("succeeded"),
                                       diagnostics == null ? null : diagnostics.toString(),
                                       lost,
                                       counters);
    return report.setTiming(record.get("host").toString(), (Long) record.get("start_time"), (Long) record.get("finish_time"));
  }

  /**
   * Writes this report as a single-record Avro file.
   */
  public void writeTo(Path path, FileSystem fs) throws IOException
  {
    Path tmp = new Path(path.getParent(), "." + path.getName() + ".tmp");
    AvroRecordWriter writer = new AvroRecordWriter(tmp, SCHEMA, fs);
    try
    {
      writer.open();
      writer.append(toRecord());
    }
    finally
    {
      writer.close();
    }
    fs.delete(path, false);
    if (!fs.rename(tmp, path))
    {
      throw new IOException(String.format("Could not move report %s into place at %s", tmp, path));
    }
  }

  /**
   * @return the report stored at the path, or <code>null</code> if there is none
   */
  public static TaskReport readFrom(Path path, FileSystem fs) throws IOException
  {
    if (!fs.exists(path))
    {
      return null;
    }
    List<GenericRecord> records = AvroRecordReader.readAll(path, fs);
    if (records.isEmpty())
    {
      throw new IOException("Empty task report: " + path);
    }
    return fromRecord(records.get(0));
  }

  @Override
  public String toString()
  {
    return String.format("%s/task-%05d attempt %d %s%s",
                         stage,
                         taskIndex,
                         attempt,
                         succeeded ? "succeeded" : "failed",
                         lostInputs.isEmpty() ? "" : " (lost inputs " + Arrays.toString(lostInputs.toArray()) + ")");
  }
}
