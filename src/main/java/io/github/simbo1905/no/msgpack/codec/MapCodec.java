// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Map wire form of alternating keys and values. Reads back into an unmodifiable map in wire order.
record MapCodec(MessageCodec<?> key, MessageCodec<?> value) implements MessageCodec<Map<?, ?>> {
  MapCodec {
    Objects.requireNonNull(key, "key codec must not be null");
    Objects.requireNonNull(value, "value codec must not be null");
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
    return Collections.unmodifiableMap(Containers.unpackEntries(unpacker, key, value, new LinkedHashMap<>()));
  }
}
