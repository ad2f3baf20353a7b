// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/// Same wire form as [MapCodec], read back into a new mutable instance of the declared map type
final class JavaMapCodec implements MessageCodec<Map<?, ?>> {
  final Class<?> rawType;
  final MessageCodec<?> key;
  final MessageCodec<?> value;
  private final Supplier<Map<Object, Object>> factory;

  JavaMapCodec(Class<?> rawType, MessageCodec<?> key, MessageCodec<?> value) {
    this.rawType = Objects.requireNonNull(rawType);
    this.key = Objects.requireNonNull(key);
    this.value = Objects.requireNonNull(value);
    this.factory = Containers.mapFactory(rawType);
  }

  @Override
  public int pack(Buffer buf, int index, Map<?, ?> map) {
    if (map == null) {
      return BufferPacker.packNil(buf, index);
    }
    return Containers.packEntries(buf, index, map, key, value);
  }

  @Override
  public Map<?, ?> unpack(BufferUnpacker unpacker) {
    if (unpacker.tryUnpackNil()) {
      return null;
    }
    return Containers.unpackEntries(unpacker, key, value, factory.get());
  }

  @Override
  public String toString() {
    return "JavaMapCodec{rawType=" + rawType.getName() + ", key=" + key + ", value=" + value + "}";
  }
}
