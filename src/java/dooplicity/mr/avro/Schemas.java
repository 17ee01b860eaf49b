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

package dooplicity.mr.avro;

import java.util.Arrays;

import org.apache.avro.Schema;
import org.apache.avro.Schema.Field;
import org.apache.avro.Schema.Type;

/**
 * Helpers for building Avro schemas in code.
 */
public class Schemas
{
  private Schemas()
  {
  }

  /**
   * Creates a record schema whose namespace is the package of the given class.
   */
  public static Schema createRecordSchema(Class<?> cls, String name, Field... fields)
  {
    Schema schema = Schema.createRecord(name, null, cls.getPackage().getName(), false);
    schema.setFields(Arrays.asList(fields));
    return schema;
  }

  /**
   * A union of null and the given type, for optional fields.
   */
  public static Schema nullable(Type type)
  {
    return Schema.createUnion(Arrays.asList(Schema.create(Type.NULL), Schema.create(type)));
  }
}
