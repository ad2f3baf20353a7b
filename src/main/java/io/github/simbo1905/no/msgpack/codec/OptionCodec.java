// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;

import java.util.Objects;
import java.util.Optional;

/// Empty is nil, present is the element's own encoding. A present value that itself encodes as nil,
/// such as an inner empty option, reads back as empty.
@SuppressWarnings("OptionalAssignedToNull")
record OptionCodec<A>(MessageCodec<A> element) implements MessageCodec<Optional<A>> {
  OptionCodec {
    Objects.requireNonNull(element, "element codec must not be null");
  }

  @Override
  public int pack(Buffer buf, int index, Optional<A> value) {
    if (value == null || value.isEmpty()) {
      return BufferPacker.packNil(buf, index);
    }
    return element.pack(buf, index, value.get());
  }

  @Override
  public Optional<A> unpack(BufferUnpacker unpacker) {
    if (unpacker.tryUnpackNil()) {
      return Optional.empty();
    }
    return Optional.ofNullable(element.unpack(unpacker));
  }
}
