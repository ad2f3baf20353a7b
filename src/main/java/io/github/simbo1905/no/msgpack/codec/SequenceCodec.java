// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/// An ordered sequence written as an array. The variants differ only in the list they read back into.
sealed interface SequenceCodec extends MessageCodec<Collection<?>> permits SequenceCodec.SeqCodec, SequenceCodec.IndexedSeqCodec {

  TypeDescriptor elementType();

  MessageCodec<?> element();

  List<Object> newList(int sizeHint);

  @Override
  default int pack(Buffer buf, int index, Collection<?> value) {
    if (value == null) {
      return BufferPacker.packNil(buf, index);
    }
    return Containers.packElements(buf, index, value, element());
  }

  @Override
  default List<?> unpack(BufferUnpacker unpacker) {
    if (unpacker.tryUnpackNil()) {
      return null;
    }
    final int size = unpacker.unpackArrayHeader();
    final List<Object> values = newList(size);
    for (int i = 0; i < size; i++) {
      values.add(element().unpack(unpacker));
    }
    return Collections.unmodifiableList(values);
  }

  /// Reads back into a linked list
  record SeqCodec(TypeDescriptor elementType, MessageCodec<?> element) implements SequenceCodec {
    @Override
    public List<Object> newList(int sizeHint) {
      return new LinkedList<>();
    }
  }

  /// Reads back into an array backed list for constant time access by index
  record IndexedSeqCodec(TypeDescriptor elementType, MessageCodec<?> element) implements SequenceCodec {
    @Override
    public List<Object> newList(int sizeHint) {
      return new ArrayList<>(sizeHint);
    }
  }
}
