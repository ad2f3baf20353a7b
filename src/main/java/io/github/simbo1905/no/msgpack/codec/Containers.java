// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/// Shared array and map element loops, and the mutable container chosen for each java.util type
final class Containers {

  private Containers() {
  }

  static int packElements(Buffer buf, int index, Collection<?> values, MessageCodec<?> element) {
    int written = BufferPacker.packArrayHeader(buf, index, values.size());
    for (Object value : values) {
      written += MessageCodec.packUnchecked(element, buf, index + written, value);
    }
    return written;
  }

  static <C extends Collection<Object>> C unpackElements(BufferUnpacker unpacker, MessageCodec<?> element, C into) {
    final int size = unpacker.unpackArrayHeader();
    for (int i = 0; i < size; i++) {
      into.add(element.unpack(unpacker));
    }
    return into;
  }

  static int packEntries(Buffer buf, int index, Map<?, ?> values, MessageCodec<?> key, MessageCodec<?> value) {
    int written = BufferPacker.packMapHeader(buf, index, values.size());
    for (Map.Entry<?, ?> entry : values.entrySet()) {
      written += MessageCodec.packUnchecked(key, buf, index + written, entry.getKey());
      written += MessageCodec.packUnchecked(value, buf, index + written, entry.getValue());
    }
    return written;
  }

  static <M extends Map<Object, Object>> M unpackEntries(BufferUnpacker unpacker, MessageCodec<?> key, MessageCodec<?> value, M into) {
    final int size = unpacker.unpackMapHeader();
    for (int i = 0; i < size; i++) {
      final Object k = key.unpack(unpacker);
      into.put(k, value.unpack(unpacker));
    }
    return into;
  }

  /// Pick the collection to decode into: a standard implementation for an interface, else the
  /// class' own no-arg constructor
  @SuppressWarnings("unchecked")
  static Supplier<Collection<Object>> collectionFactory(Class<?> rawType) {
    if (rawType.isAssignableFrom(ArrayList.class)) {
      return ArrayList::new;
    }
    if (rawType.isAssignableFrom(TreeSet.class) && SortedSet.class.isAssignableFrom(rawType)) {
      return TreeSet::new;
    }
    if (rawType.isAssignableFrom(LinkedHashSet.class)) {
      return LinkedHashSet::new;
    }
    if (rawType.isAssignableFrom(ArrayDeque.class)) {
      return ArrayDeque::new;
    }
    final MethodHandle constructor = noArgConstructor(rawType);
    return () -> (Collection<Object>) newInstance(constructor, rawType);
  }

  @SuppressWarnings("unchecked")
  static Supplier<Map<Object, Object>> mapFactory(Class<?> rawType) {
    if (rawType.isAssignableFrom(LinkedHashMap.class)) {
      return LinkedHashMap::new;
    }
    if (rawType.isAssignableFrom(TreeMap.class)) {
      return TreeMap::new;
    }
    if (rawType.isAssignableFrom(ConcurrentHashMap.class) && ConcurrentMap.class.isAssignableFrom(rawType)) {
      return ConcurrentHashMap::new;
    }
    final MethodHandle constructor = noArgConstructor(rawType);
    return () -> (Map<Object, Object>) newInstance(constructor, rawType);
  }

  private static MethodHandle noArgConstructor(Class<?> rawType) {
    if (rawType.isInterface() || Modifier.isAbstract(rawType.getModifiers())) {
      throw new IllegalArgumentException("No standard implementation for abstract container type: " + rawType.getName());
    }
    try {
      return MethodHandles.publicLookup().findConstructor(rawType, MethodType.methodType(void.class));
    } catch (NoSuchMethodException | IllegalAccessException e) {
      throw new IllegalArgumentException("Container type needs a public no-arg constructor: " + rawType.getName(), e);
    }
  }

  private static Object newInstance(MethodHandle constructor, Class<?> rawType) {
    try {
      return constructor.invoke();
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to create " + rawType.getName(), e);
    }
  }
}
