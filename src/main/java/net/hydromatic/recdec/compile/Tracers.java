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

import java.util.List;
import java.util.function.BiConsumer;
import net.hydromatic.recdec.type.Field;
import net.hydromatic.recdec.type.Member;
import net.hydromatic.recdec.type.Property;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each detected
   * auto-property, then calls the underlying tracer. */
  public static Tracer withOnAutoProperty(Tracer tracer,
      BiConsumer<Property, Field> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onAutoProperty(Property property, Field backingField) {
        consumer.accept(property, backingField);
        super.onAutoProperty(property, backingField);
      }
    };
  }

  /** Returns a tracer that performs the given action on each mismatch,
   * then calls the underlying tracer. */
  public static Tracer withOnMismatch(Tracer tracer,
      BiConsumer<Member, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onMismatch(Member member, String reason) {
        consumer.accept(member, reason);
        super.onMismatch(member, reason);
      }
    };
  }

  /** Returns a tracer that performs the given action on each verdict,
   * then calls the underlying tracer. */
  public static Tracer withOnVerdict(Tracer tracer,
      BiConsumer<Member, Boolean> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onVerdict(Member member, boolean generated) {
        consumer.accept(member, generated);
        super.onVerdict(member, generated);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onAutoProperty(Property property, Field backingField) {
    }

    @Override
    public void onMemberOrder(@Nullable List<Member> members) {
    }

    @Override
    public void onMismatch(Member member, String reason) {
    }

    @Override
    public void onVerdict(Member member, boolean generated) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onAutoProperty(Property property, Field backingField) {
      tracer.onAutoProperty(property, backingField);
    }

    @Override
    public void onMemberOrder(@Nullable List<Member> members) {
      tracer.onMemberOrder(members);
    }

    @Override
    public void onMismatch(Member member, String reason) {
      tracer.onMismatch(member, reason);
    }

    @Override
    public void onVerdict(Member member, boolean generated) {
      tracer.onVerdict(member, generated);
    }
  }
}

// End Tracers.java
