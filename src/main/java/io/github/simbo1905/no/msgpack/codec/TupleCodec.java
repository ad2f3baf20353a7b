// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;
import io.github.simbo1905.no.msgpack.MessageFormatException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Fixed arity heterogeneous list written as an array with one codec per position
record TupleCodec(List<MessageCodec<?>> elements) implements MessageCodec<List<?>> {
  TupleCodec {
    elements = List.copyOf(elements);
  }

  @Override
  public int pack(Buffer buf, int index, List<?> value) {
    if (value == null) {
      return BufferPacker.packNil(buf, index);
    }
    if (value.size() != elements.size()) {
      throw new IllegalArgumentException("Tuple arity is " + elements.size() + " but got " + value.size() + " values");
    }
    int written = BufferPacker.packArrayHeader(buf, index, elements.size());
    for (int i = 0; i < elements.size(); i++) {
      written += MessageCodec.packUnchecked(elements.get(i), buf, index + written, value.get(i));
    }
    return written;
  }

  @Override
  public List<?> unpack(BufferUnpacker unpacker) {
    if (unpacker.tryUnpackNil()) {
      return null;
    }
    final int size = unpacker.unpackArrayHeader();
    if (size != elements.size()) {
      throw new MessageFormatException("Tuple arity is " + elements.size() + " but the array holds " + size);
    }
    final List<Object> values = new ArrayList<>(size);
    for (MessageCodec<?> element : elements) {
      values.add(element.unpack(unpacker));
    }
    return Collections.unmodifiableList(values);
  }
}
