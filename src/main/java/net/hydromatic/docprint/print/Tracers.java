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
package net.hydromatic.docprint.print;

import java.util.function.Consumer;
import net.hydromatic.docprint.doc.Doc;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each node that is
   * printed, then calls the underlying tracer. */
  public static Tracer withOnPrint(Tracer tracer, Consumer<Doc> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onPrint(Doc doc) {
        consumer.accept(doc);
        super.onPrint(doc);
      }
    };
  }

  /** Returns a tracer that performs the given action when an unknown node is
   * encountered, then calls the underlying tracer. */
  public static Tracer withOnUnknownDoc(Tracer tracer,
      Consumer<UnknownDocException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onUnknownDoc(UnknownDocException e) {
        consumer.accept(e);
        super.onUnknownDoc(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onPrint(Doc doc) {
    }

    @Override public void onUnknownDoc(UnknownDocException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onPrint(Doc doc) {
      tracer.onPrint(doc);
    }

    @Override public void onUnknownDoc(UnknownDocException e) {
      tracer.onUnknownDoc(e);
    }
  }
}

// End Tracers.java
