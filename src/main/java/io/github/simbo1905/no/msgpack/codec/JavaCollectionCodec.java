// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Supplier;

/// Array wire form, read back into a new mutable instance of the declared collection type
final class JavaCollectionCodec implements MessageCodec<Collection<?>> {
  final Class<?> rawType;
  final MessageCodec<?> element;
  private final Supplier<Collection<Object>> factory;

  JavaCollectionCodec(Class<?> rawType, MessageCodec<?> element) {
    this.rawType = Objects.requireNonNull(rawType);
    this.element = Objects.requireNonNull(element);
    this.factory = Containers.collectionFactory(rawType);
  }

  @Override
  public int pack(Buffer buf, int index, Collection<?> value) {
    if (value == null) {
      return BufferPacker.packNil(buf, index);
    }
    return Containers.packElements(buf, index, value, element);
  }

  @Override
  public Collection<?> unpack(BufferUnpacker unpacker) {
    if (unpacker.tryUnpackNil()) {
      return null;
    }
    return Containers.unpackElements(unpacker, element, factory.get());
  }

  @Override
  public String toString() {
    return "JavaCollectionCodec{rawType=" + rawType.getName() + ", element=" + element + "}";
  }
}
