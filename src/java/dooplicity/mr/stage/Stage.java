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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.util.ReflectionUtils;

import dooplicity.mr.ConfigurationException;
import dooplicity.mr.cache.Fingerprinter;
import dooplicity.mr.partition.HashPartitioner;
import dooplicity.mr.partition.RecordPartitioner;

/**
 * Definition of one pipeline step.
 *
 * <p>
 * A stage is stored in the job configuration under <em>pipeline.stage.&lt;name&gt;.</em>, which is how it
 * travels to workers on remote backends:
 * </p>
 *
 * <ul>
 * <li><em>type</em> - <code>map</code> or <code>reduce</code></li>
 * <li><em>class</em> - body class, a {@link StageMapper} or {@link StageReducer}</li>
 * <li><em>partitions</em> - number of output partitions (default 1)</li>
 * <li><em>partitioner.class</em> - {@link RecordPartitioner} (default {@link HashPartitioner})</li>
 * <li><em>cache</em> - whether the stage is eligible for redundancy elimination</li>
 * <li><em>cache.namespace</em> - fingerprint namespace (default the stage name)</li>
 * <li><em>cache.params</em> - comma-separated parameter names that affect the cached computation</li>
 * <li><em>param.&lt;key&gt;</em> - stage parameters, visible to the body and partitioner as plain keys</li>
 * </ul>
 */
public class Stage
{
  public static final String PREFIX = "pipeline.stage.";

  private final String name;
  private final StageType type;
  private final Class<?> bodyClass;
  private int numPartitions = 1;
  private Class<? extends RecordPartitioner> partitionerClass = HashPartitioner.class;
  private boolean cacheable;
  private String cacheNamespace;
  private List<String> cacheParams = new ArrayList<String>();
  private final Map<String, String> params = new LinkedHashMap<String, String>();

  public Stage(String name, StageType type, Class<?> bodyClass)
  {
    if (name == null || !name.matches("[A-Za-z0-9_.-]+") || name.startsWith("_") || name.startsWith("."))
    {
      throw new ConfigurationException("Invalid stage name: " + name);
    }
    this.name = name;
    this.type = type;
    this.bodyClass = bodyClass;
    this.cacheNamespace = name;
  }

  public static Stage map(String name, Class<? extends StageMapper> bodyClass)
  {
    return new Stage(name, StageType.MAP, bodyClass);
  }

  public static Stage reduce(String name, Class<? extends StageReducer> bodyClass)
  {
    return new Stage(name, StageType.REDUCE, bodyClass);
  }

  public String getName()
  {
    return name;
  }

  public StageType getType()
  {
    return type;
  }

  public Class<?> getBodyClass()
  {
    return bodyClass;
  }

  public int getNumPartitions()
  {
    return numPartitions;
  }

  public Stage setNumPartitions(int numPartitions)
  {
    if (numPartitions < 1)
    {
      throw new ConfigurationException(String.format("Stage %s needs at least one partition, got %d", name, numPartitions));
    }
    this.numPartitions = numPartitions;
    return this;
  }

  public Class<? extends RecordPartitioner> getPartitionerClass()
  {
    return partitionerClass;
  }

  public Stage setPartitionerClass(Class<? extends RecordPartitioner> partitionerClass)
  {
    this.partitionerClass = partitionerClass;
    return this;
  }

  public boolean isCacheable()
  {
    return cacheable;
  }

  public Stage setCacheable(boolean cacheable)
  {
    this.cacheable = cacheable;
    return this;
  }

  public String getCacheNamespace()
  {
    return cacheNamespace;
  }

  public Stage setCacheNamespace(String cacheNamespace)
  {
    this.cacheNamespace = cacheNamespace;
    return this;
  }

  public List<String> getCacheParams()
  {
    return Collections.unmodifiableList(cacheParams);
  }

  public Stage setCacheParams(List<String> cacheParams)
  {
    this.cacheParams = new ArrayList<String>(cacheParams);
    return this;
  }

  public Map<String, String> getParams()
  {
    return Collections.unmodifiableMap(params);
  }

  public Stage setParam(String key, String value)
  {
    params.put(key, value);
    return this;
  }

  /**
   * Checks that the body class matches the stage type and that only map stages with a
   * {@link CachingMapper} body ask for redundancy elimination.
   */
  public void validate()
  {
    Class<?> expected = type == StageType.MAP ? StageMapper.class : StageReducer.class;
    if (bodyClass == null || !expected.isAssignableFrom(bodyClass))
    {
      throw new ConfigurationException(String.format("Stage %s is a %s stage but its body %s is not a %s",
                                                     name,
                                                     type.name().toLowerCase(),
                                                     bodyClass == null ? "(none)" : bodyClass.getName(),
                                                     expected.getSimpleName()));
    }
    if (cacheable && !CachingMapper.class.isAssignableFrom(bodyClass))
    {
      throw new ConfigurationException(String.format("Stage %s is marked cacheable but %s is not a %s",
                                                     name,
                                                     bodyClass.getName(),
                                                     CachingMapper.class.getSimpleName()));
    }
    for (String param : cacheParams)
    {
      if (!params.containsKey(param))
      {
        throw new ConfigurationException(String.format("Stage %s lists cache parameter %s which is not set", name, param));
      }
    }
  }

  /**
   * The job configuration overlaid with this stage's parameters.
   */
  public Configuration createStageConf(Configuration jobConf)
  {
    Configuration conf = new Configuration(jobConf);
    for (Map.Entry<String, String> param : params.entrySet())
    {
      conf.set(param.getKey(), param.getValue());
    }
    return conf;
  }

  public RecordPartitioner createPartitioner(Configuration stageConf)
  {
    return ReflectionUtils.newInstance(partitionerClass, stageConf);
  }

  public Object createBody(Configuration stageConf)
  {
    return ReflectionUtils.newInstance(bodyClass, stageConf);
  }

  public Fingerprinter createFingerprinter()
  {
    Map<String, String> relevant = new TreeMap<String, String>();
    for (String param : cacheParams)
    {
      relevant.put(param, params.get(param));
    }
    return new Fingerprinter(cacheNamespace, relevant);
  }

  public void writeTo(Configuration conf)
  {
    String prefix = PREFIX + name + ".";
    conf.set(prefix + "type", type.name().toLowerCase());
    conf.set(prefix + "class", bodyClass.getName());
    conf.setInt(prefix + "partitions", numPartitions);
    conf.set(prefix + "partitioner.class", partitionerClass.getName());
    conf.setBoolean(prefix + "cache", cacheable);
    conf.set(prefix + "cache.namespace", cacheNamespace);
    conf.setStrings(prefix + "cache.params", cacheParams.toArray(new String[0]));
    for (Map.Entry<String, String> param : params.entrySet())
    {
      conf.set(prefix + "param." + param.getKey(), param.getValue());
    }
  }

  public static Stage fromConfiguration(Configuration conf, String name)
  {
    String prefix = PREFIX + name + ".";
    String typeName = conf.getTrimmed(prefix + "type");
    if (typeName == null)
    {
      throw new ConfigurationException(String.format("Stage %s has no type. Set '%stype' to map or reduce.", name, prefix));
    }
    StageType type;
    try
    {
      type = StageType.valueOf(typeName.toUpperCase());
    }
    catch (IllegalArgumentException e)
    {
      throw new ConfigurationException(String.format("Stage %s has unknown type '%s'", name, typeName), e);
    }

    String bodyClassName = conf.getTrimmed(prefix + "class");
    if (bodyClassName == null)
    {
      throw new ConfigurationException(String.format("Stage %s has no body class. Set '%sclass'.", name, prefix));
    }
    Stage stage = new Stage(name, type, loadClass(conf, bodyClassName, name));
    try
    {
      stage.setNumPartitions(conf.getInt(prefix + "partitions", 1));
    }
    catch (NumberFormatException e)
    {
      throw new ConfigurationException(String.format("Stage %s has a non-numeric partition count", name), e);
    }

    String partitionerName = conf.getTrimmed(prefix + "partitioner.class");
    if (partitionerName != null)
    {
      Class<?> c = loadClass(conf, partitionerName, name);
      if (!RecordPartitioner.class.isAssignableFrom(c))
      {
        throw new ConfigurationException(String.format("Stage %s partitioner %s is not a %s",
                                                       name,
                                                       partitionerName,
                                                       RecordPartitioner.class.getSimpleName()));
      }
      stage.setPartitionerClass(c.asSubclass(RecordPartitioner.class));
    }

    stage.setCacheable(conf.getBoolean(prefix + "cache", false));
    stage.setCacheNamespace(conf.getTrimmed(prefix + "cache.namespace", name));
    List<String> cacheParams = new ArrayList<String>();
    Collections.addAll(cacheParams, conf.getTrimmedStrings(prefix + "cache.params"));
    stage.setCacheParams(cacheParams);

    Map<String, String> params = new TreeMap<String, String>(conf.getPropsWithPrefix(prefix + "param."));
    for (Map.Entry<String, String> param : params.entrySet())
    {
      stage.setParam(param.getKey(), param.getValue());
    }
    stage.validate();
    return stage;
  }

  private static Class<?> loadClass(Configuration conf, String className, String stageName)
  {
    try
    {
      return conf.getClassByName(className);
    }
    catch (ClassNotFoundException e)
    {
      throw new ConfigurationException(String.format("Stage %s refers to unknown class %s", stageName, className), e);
    }
  }

  @Override
  public String toString()
  {
    return String.format("%s(%s, %d partitions%s)", name, type.name().toLowerCase(), numPartitions, cacheable ? ", cached" : "");
  }
}
