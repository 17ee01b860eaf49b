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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Line-oriented text encoding of records.
 *
 * <p>
 * Each record is written as <code>escape(key) TAB escape(value) LF</code>. The escape maps a backslash
 * to <code>\\</code>, a tab to <code>\t</code>, a line feed to <code>\n</code> and a carriage return to
 * <code>\r</code>, so keys and values may hold arbitrary bytes while the first raw tab on a line always
 * separates the key from the value.
 * </p>
 */
public final class RecordCodec
{
  public static final byte FIELD_SEPARATOR = '\t';
  public static final byte RECORD_SEPARATOR = '\n';
  private static final byte ESCAPE = '\\';

  private RecordCodec()
  {
  }

  public static void write(Record record, OutputStream out) throws IOException
  {
    escape(record.getKey(), out);
    out.write(FIELD_SEPARATOR);
    escape(record.getValue(), out);
    out.write(RECORD_SEPARATOR);
  }

  public static byte[] encode(Record record)
  {
    ByteArrayOutputStream out = new ByteArrayOutputStream(record.getKey().length + record.getValue().length + 4);
    try
    {
      write(record, out);
    }
    catch (IOException e)
    {
      throw new IllegalStateException(e);
    }
    return out.toByteArray();
  }

  /**
   * Decodes one line, without its trailing line feed.
   *
   * @param line
   *          buffer holding the encoded line
   * @param length
   *          number of valid bytes in the buffer
   * @return the decoded record
   * @throws IOException
   *           if the line has no field separator or holds a dangling or unknown escape
   */
  public static Record decode(byte[] line, int length) throws IOException
  {
    int separator = -1;
    for (int i = 0; i < length; i++)
    {
      if (line[i] == ESCAPE)
      {
        i++;
      }
      else if (line[i] == FIELD_SEPARATOR)
      {
        separator = i;
        break;
      }
    }
    if (separator < 0)
    {
      throw new IOException("Malformed record, no field separator: " + new String(line, 0, length, "UTF-8"));
    }
    return new Record(unescape(line, 0, separator), unescape(line, separator + 1, length));
  }

  static void escape(byte[] bytes, OutputStream out) throws IOException
  {
    int start = 0;
    for (int i = 0; i < bytes.length; i++)
    {
      byte replacement;
      switch (bytes[i])
      {
        case '\\':
          replacement = '\\';
          break;
        case '\t':
          replacement = 't';
          break;
        case '\n':
          replacement = 'n';
          break;
        case '\r':
          replacement = 'r';
          break;
        default:
          continue;
      }
      out.write(bytes, start, i - start);
      out.write(ESCAPE);
      out.write(replacement);
      start = i + 1;
    }
    out.write(bytes, start, bytes.length - start);
  }

  static byte[] unescape(byte[] buf, int from, int to) throws IOException
  {
    ByteArrayOutputStream out = new ByteArrayOutputStream(to - from);
    for (int i = from; i < to; i++)
    {
      byte b = buf[i];
      if (b == FIELD_SEPARATOR)
      {
        throw new IOException("Malformed record, unescaped tab in value at offset " + i);
      }
      if (b != ESCAPE)
      {
        out.write(b);
        continue;
      }
      if (++i >= to)
      {
        throw new IOException("Malformed record, dangling escape at end of field");
      }
      switch (buf[i])
      {
        case '\\':
          out.write('\\');
          break;
        case 't':
          out.write('\t');
          break;
        case 'n':
          out.write('\n');
          break;
        case 'r':
          out.write('\r');
          break;
        default:
          throw new IOException(String.format("Malformed record, unknown escape \\%c", (char) buf[i]));
      }
    }
    return out.toByteArray();
  }
}
