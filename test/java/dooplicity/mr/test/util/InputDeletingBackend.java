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

package dooplicity.mr.test.util;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.hadoop.fs.Path;
import org.apache.log4j.Logger;

import dooplicity.mr.backend.Backend;
import dooplicity.mr.backend.TaskHandle;
import dooplicity.mr.backend.TaskStatus;
import dooplicity.mr.fs.SharedStorage;
import dooplicity.mr.task.TaskSpec;

/**
 * Wraps a backend and, just before the first attempt of one task is submitted, deletes the committed
 * output of the upstream task that produced its first input. Simulates intermediate data lost between
 * stages.
 */
public class InputDeletingBackend implements Backend
{
  private Logger _log = Logger.getLogger(InputDeletingBackend.class);

  private final Backend _delegate;
  private final String _stage;
  private final int _taskIndex;
  private final List<String> _submitted = Collections.synchronizedList(new ArrayList<String>());
  private boolean _deleted;

  public InputDeletingBackend(Backend delegate, String stage, int taskIndex)
  {
    _delegate = delegate;
    _stage = stage;
    _taskIndex = taskIndex;
  }

  /**
   * Task ids of every submitted attempt, in submission order.
   */
  public List<String> getSubmitted()
  {
    synchronized (_submitted)
    {
      return new ArrayList<String>(_submitted);
    }
  }

  @Override
  public String getName()
  {
    return _delegate.getName();
  }

  @Override
  public TaskHandle submit(TaskSpec spec) throws IOException
  {
    if (!_deleted && spec.getStageName().equals(_stage) && spec.getTaskIndex() == _taskIndex)
    {
      Path upstreamOutput = spec.getInputs().get(0).getParent();
      _log.info("Deleting " + upstreamOutput + " before " + spec.getTaskId());
      SharedStorage.get(upstreamOutput, spec.getConf()).delete(upstreamOutput);
      _deleted = true;
    }
    _submitted.add(spec.getTaskId());
    return _delegate.submit(spec);
  }

  @Override
  public TaskStatus poll(TaskHandle handle) throws IOException
  {
    return _delegate.poll(handle);
  }

  @Override
  public void cancel(TaskHandle handle) throws IOException
  {
    _delegate.cancel(handle);
  }

  @Override
  public int capacity()
  {
    return _delegate.capacity();
  }

  @Override
  public void awaitUpdate(long millis) throws InterruptedException
  {
    _delegate.awaitUpdate(millis);
  }

  @Override
  public void wakeUp()
  {
    _delegate.wakeUp();
  }

  @Override
  public void close() throws IOException
  {
    _delegate.close();
  }
}
