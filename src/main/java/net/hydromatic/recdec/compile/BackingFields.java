/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.recdec.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableBiMap;
import net.hydromatic.recdec.type.Field;
import net.hydromatic.recdec.type.Property;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One-to-one relation between the automatic properties of a record and the
 * fields that back them.
 *
 * <p>A property that is not in the relation is not automatic. Immutable.
 */
public class BackingFields {
  private final ImmutableBiMap<Property, Field> map;

  BackingFields(ImmutableBiMap<Property, Field> map) {
    this.map = requireNonNull(map);
  }

  /** Returns the field that backs an automatic property, or null if the
   * property is not automatic. */
  public @Nullable Field fieldOf(Property property) {
    return map.get(property);
  }

  /** Returns the automatic property that a field backs, or null. */
  public @Nullable Property propertyOf(Field field) {
    return map.inverse().get(field);
  }

  /** Whether a field backs an automatic property. */
  public boolean isBackingField(Field field) {
    return map.containsValue(field);
  }

  public int size() {
    return map.size();
  }

  /** Returns the relation as a map from property to field; its
   * {@link ImmutableBiMap#inverse() inverse} maps field to property. */
  public ImmutableBiMap<Property, Field> asMap() {
    return map;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    map.forEach((p, f) ->
        b.append(b.length() == 1 ? "" : ", ")
            .append(p.name).append('=').append(f.name));
    return b.append('}').toString();
  }
}

// End BackingFields.java
