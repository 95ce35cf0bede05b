/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/**
 * Redfin city market tracker ingestion.
 *
 * <p>{@link org.menapiai.pipeline.trends.housing.RedfinTsvReader} streams the
 * gzip TSV row by row; {@link org.menapiai.pipeline.trends.housing.HousingNormalizer}
 * filters one city and date window and groups the canonical records by
 * {@link org.menapiai.pipeline.trends.housing.PropertyType}. The written layout
 * is {@code housing_trends/property_type_partition=<slug>/year=<yyyy>/}.
 */
package org.menapiai.pipeline.trends.housing;
