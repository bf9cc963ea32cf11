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
package cn.edu.pku.asic.h3columnar.indexing;

import cn.edu.pku.asic.h3columnar.dggs.core.Feature;
import cn.edu.pku.asic.h3columnar.dggs.core.FeatureProvider;

/**
 * Registers the spatial index when this module is on the classpath.
 */
public class SpatialIndexFeatureProvider implements FeatureProvider {
  @Override
  public Feature getFeature() {
    return Feature.SPATIAL_INDEX;
  }

  @Override
  public String getDescription() {
    return "R-tree over cell footprints (" + CellSpatialIndex.class.getSimpleName() + ")";
  }
}
