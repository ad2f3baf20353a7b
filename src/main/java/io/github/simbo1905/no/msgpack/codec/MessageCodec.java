// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferUnpacker;

import java.util.logging.Logger;

/// Encode and decode values of one bound type as MessagePack.
/// A `null` value is written as nil and nil reads back as `null`, except for options where nil is empty.
public interface MessageCodec<A> {

  Logger LOGGER = Logger.getLogger(MessageCodec.class.getName());

  /// Initial buffer size for the byte array helpers
  int DEFAULT_BUFFER_SIZE = 64;

  /// Write a value at the index
  /// @param buf The buffer to write to
  /// @param index The offset of the first byte
  /// @param value The value to write
  /// @return The number of bytes written
  int pack(Buffer buf, int index, A value);

  /// Read the next value from the unpacker, advancing past it
  A unpack(BufferUnpacker unpacker);

  /// Encode to a fresh byte array
  default byte[] toMsgPack(A value) {
    final Buffer buf = Buffer.allocate(DEFAULT_BUFFER_SIZE);
    final int written = pack(buf, 0, value);
    return buf.toByteArray(written);
  }

  /// Decode one value from the start of the array
  default A fromMsgPack(byte[] bytes) {
    return unpack(BufferUnpacker.of(bytes));
  }

  /// Pack with a codec whose type parameter was lost to a wildcard
  /// @throws IllegalArgumentException if the value is not of the codec's type
  @SuppressWarnings("unchecked")
  static int packUnchecked(MessageCodec<?> codec, Buffer buf, int index, Object value) {
    try {
      return ((MessageCodec<Object>) codec).pack(buf, index, value);
    } catch (ClassCastException e) {
      throw new IllegalArgumentException("Value of " + value.getClass().getName() + " cannot be packed by " + codec, e);
    }
  }
}
