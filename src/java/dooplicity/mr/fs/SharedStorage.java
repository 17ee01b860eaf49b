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

package dooplicity.mr.fs;

import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.util.UUID;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.LocalFileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.RawLocalFileSystem;
import org.apache.hadoop.io.IOUtils;
import org.apache.log4j.Logger;

/**
 * Working storage shared by the orchestrator and every task, whatever backend runs them.
 *
 * <p>
 * Two commit primitives are offered. {@link #commitDirectory(Path, Path)} publishes a finished task
 * attempt with a single rename. {@link #commitExclusive(Path, Path)} publishes a file only if nothing is
 * at the destination yet; on a local (or NFS-mounted) filesystem it is a hard link, which the kernel
 * refuses when the destination exists, elsewhere it relies on the filesystem's rename refusing to
 * overwrite, as HDFS does.
 * </p>
 */
public class SharedStorage
{
  private final Logger _log = Logger.getLogger(SharedStorage.class);

  private final FileSystem fs;

  public SharedStorage(FileSystem fs)
  {
    if (fs instanceof LocalFileSystem)
    {
      // checksum files would otherwise shadow every partition and cache entry
      fs = ((LocalFileSystem) fs).getRaw();
    }
    this.fs = fs;
  }

  public static SharedStorage get(Path root, Configuration conf) throws IOException
  {
    return new SharedStorage(root.getFileSystem(conf));
  }

  public FileSystem getFileSystem()
  {
    return fs;
  }

  public Path qualify(Path path)
  {
    return fs.makeQualified(path);
  }

  public boolean exists(Path path) throws IOException
  {
    return fs.exists(path);
  }

  public void mkdirs(Path path) throws IOException
  {
    if (!fs.exists(path) && !fs.mkdirs(path))
    {
      throw new IOException("Could not create directory " + path);
    }
  }

  public boolean delete(Path path) throws IOException
  {
    return fs.delete(path, true);
  }

  /**
   * Reads a whole file.
   *
   * @return the file contents, or <code>null</code> if the file does not exist
   */
  public byte[] readFully(Path path) throws IOException
  {
    InputStream in;
    try
    {
      in = fs.open(path);
    }
    catch (FileNotFoundException e)
    {
      return null;
    }
    try
    {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      IOUtils.copyBytes(in, out, 8192, false);
      return out.toByteArray();
    }
    finally
    {
      IOUtils.closeStream(in);
    }
  }

  public void writeFully(Path path, byte[] content) throws IOException
  {
    OutputStream out = fs.create(path, true);
    try
    {
      out.write(content);
    }
    finally
    {
      out.close();
    }
  }

  /**
   * Writes content to a uniquely named hidden sibling of the destination, for a later commit.
   */
  public Path writeTemporary(Path dest, byte[] content) throws IOException
  {
    Path tmp = new Path(dest.getParent(), String.format(".%s.tmp-%s", dest.getName(), UUID.randomUUID()));
    writeFully(tmp, content);
    return tmp;
  }

  /**
   * Moves a finished attempt directory into its final place, replacing an older commit of the same
   * task if there is one.
   */
  public void commitDirectory(Path attemptDir, Path finalDir) throws IOException
  {
    if (fs.exists(finalDir))
    {
      _log.info(String.format("Replacing previous commit at %s", finalDir));
      fs.delete(finalDir, true);
    }
    mkdirs(finalDir.getParent());
    if (!fs.rename(attemptDir, finalDir))
    {
      throw new IOException(String.format("Could not commit %s to %s", attemptDir, finalDir));
    }
  }

  /**
   * Atomically publishes <code>tmp</code> at <code>dest</code> unless <code>dest</code> already exists.
   * The temporary file is gone when this returns.
   *
   * @return true if this call created <code>dest</code>, false if another writer got there first
   */
  public boolean commitExclusive(Path tmp, Path dest) throws IOException
  {
    mkdirs(dest.getParent());
    if (fs instanceof RawLocalFileSystem)
    {
      RawLocalFileSystem local = (RawLocalFileSystem) fs;
      try
      {
        Files.createLink(local.pathToFile(dest).toPath(), local.pathToFile(tmp).toPath());
        return true;
      }
      catch (FileAlreadyExistsException e)
      {
        return false;
      }
      finally
      {
        fs.delete(tmp, false);
      }
    }

    if (fs.rename(tmp, dest))
    {
      return true;
    }
    fs.delete(tmp, false);
    if (fs.exists(dest))
    {
      return false;
    }
    throw new IOException(String.format("Could not commit %s to %s", tmp, dest));
  }

  /**
   * Creates a file holding the given content only if no file exists at the path.
   *
   * @return true if this call created the file
   */
  public boolean createExclusive(Path path, byte[] content) throws IOException
  {
    mkdirs(path.getParent());
    return commitExclusive(writeTemporary(path, content), path);
  }
}
