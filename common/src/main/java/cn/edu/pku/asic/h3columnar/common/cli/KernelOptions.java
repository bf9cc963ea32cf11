/*
 * Copyright 2020 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package cn.edu.pku.asic.h3columnar.common.cli;

import cn.edu.pku.asic.h3columnar.common.utils.Parallel;
import org.apache.hadoop.conf.Configuration;

import java.io.PrintStream;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/**
 * Options that tune how the kernels run. Defaults are read from {@code h3columnar-default.xml} on the
 * classpath and can be overridden by an optional {@code h3columnar-site.xml} or by calling {@link #set}.
 */
public class KernelOptions extends Configuration {

  @OperationParam(
      description = "Maximum number of ranges a kernel splits its input into. Zero means one per core",
      defaultValue = "0"
  )
  public static final String Parallelism = "h3columnar.parallelism";

  @OperationParam(
      description = "Minimum number of elements per range, smaller inputs run on the calling thread",
      defaultValue = "4096"
  )
  public static final String MinChunkSize = "h3columnar.chunk.min";

  @OperationParam(
      description = "Split cell boundaries crossing the antimeridian into two polygons",
      defaultValue = "false"
  )
  public static final String SplitAntimeridian = "h3columnar.boundary.split";

  @OperationParam(
      description = "How to ingest invalid cell values and geometries {REJECT, NULL_OUT}",
      defaultValue = "REJECT"
  )
  public static final String IngestPolicy = "h3columnar.ingest.policy";

  @OperationParam(
      description = "Minimum number of children in an R-tree node",
      defaultValue = "8"
  )
  public static final String RTreeMinCapacity = "h3columnar.rtree.min";

  @OperationParam(
      description = "Maximum number of children in an R-tree node",
      defaultValue = "20"
  )
  public static final String RTreeMaxCapacity = "h3columnar.rtree.max";

  static {
    Configuration.addDefaultResource("h3columnar-default.xml");
    Configuration.addDefaultResource("h3columnar-site.xml");
  }

  public KernelOptions() {
    super(true);
  }

  public KernelOptions(KernelOptions other) {
    super(other);
  }

  /**
   * Options that run every kernel on the calling thread.
   * @return a new options object
   */
  public static KernelOptions sequential() {
    return new KernelOptions().setParallelism(1);
  }

  /**
   * The effective number of ranges. A non-positive configured value means one per available core.
   * @return a positive number
   */
  public int getParallelism() {
    int parallelism = getInt(Parallelism, 0);
    return parallelism > 0 ? parallelism : Parallel.PoolSize;
  }

  public KernelOptions setParallelism(int parallelism) {
    setInt(Parallelism, parallelism);
    return this;
  }

  public int getMinChunkSize() {
    return Math.max(1, getInt(MinChunkSize, 4096));
  }

  public KernelOptions setMinChunkSize(int minChunkSize) {
    setInt(MinChunkSize, minChunkSize);
    return this;
  }

  public boolean isSplitAntimeridian() {
    return getBoolean(SplitAntimeridian, false);
  }

  /**
   * Prints all the user-settable options with their descriptions and current values.
   * @param out the stream to print to
   */
  public void printUsage(PrintStream out) {
    for (Field field : KernelOptions.class.getFields()) {
      OperationParam param = field.getAnnotation(OperationParam.class);
      if (param == null || !param.showInUsage() || !Modifier.isStatic(field.getModifiers()))
        continue;
      String key;
      try {
        key = (String) field.get(null);
      } catch (IllegalAccessException e) {
        throw new IllegalStateException("Cannot read option key " + field.getName(), e);
      }
      out.printf("%s: %s (default: %s, current: %s)%n", key, param.description(), param.defaultValue(),
          get(key, param.defaultValue()));
    }
  }
}
