// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import java.lang.reflect.Type;
import java.util.Map;
import java.util.Objects;

/// Supplies the structural description of a Java type. The factory treats it as a black box.
@FunctionalInterface
public interface TypeIntrospector {

  /// Describe a class or parameterized type
  /// @throws IllegalArgumentException if the type cannot be described
  TypeDescriptor describe(Type type);

  /// Introspector backed by a fixed table of descriptions
  static TypeIntrospector of(Map<Type, TypeDescriptor> descriptors) {
    final Map<Type, TypeDescriptor> table = Map.copyOf(Objects.requireNonNull(descriptors, "descriptors must not be null"));
    return type -> {
      final TypeDescriptor descriptor = table.get(type);
      if (descriptor == null) {
        throw new IllegalArgumentException("No type description for " + type.getTypeName());
      }
      return descriptor;
    };
  }

  /// Introspector for a factory that is only ever given descriptors
  static TypeIntrospector none() {
    return type -> {
      throw new IllegalStateException("No TypeIntrospector configured to describe " + type.getTypeName() +
          ": resolve a TypeDescriptor directly or create the factory with an introspector");
    };
  }
}
