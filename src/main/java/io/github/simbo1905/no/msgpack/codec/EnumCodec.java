// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;
import io.github.simbo1905.no.msgpack.MessageFormatException;
import io.github.simbo1905.no.msgpack.ValueType;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.github.simbo1905.no.msgpack.codec.MessageCodec.LOGGER;

/// Writes the constant name. Reads a name, or an ordinal for peers that write enums as integers.
final class EnumCodec implements MessageCodec<Enum<?>> {
  final Class<? extends Enum<?>> enumType;
  final Enum<?>[] enumConstants;
  final Map<String, Enum<?>> byName;

  EnumCodec(@NotNull Class<? extends Enum<?>> enumType) {
    assert enumType.isEnum() : "User type must be an enum: " + enumType;
    this.enumType = enumType;
    this.enumConstants = enumType.getEnumConstants();
    this.byName = Arrays.stream(enumConstants)
        .collect(Collectors.toUnmodifiableMap(Enum::name, Function.identity()));
    LOGGER.fine(() -> "EnumCodec " + enumType.getName() + " construction complete with " + enumConstants.length + " constants");
  }

  @Override
  public int pack(Buffer buf, int index, Enum<?> value) {
    if (value == null) {
      return BufferPacker.packNil(buf, index);
    }
    if (!enumType.isInstance(value)) {
      throw new IllegalArgumentException("Expected " + enumType + " but got " + value.getClass());
    }
    return BufferPacker.packString(buf, index, value.name());
  }

  @Override
  public Enum<?> unpack(BufferUnpacker unpacker) {
    if (unpacker.tryUnpackNil()) {
      return null;
    }
    if (unpacker.getNextFormat().getValueType() == ValueType.INTEGER) {
      final int ordinal = unpacker.unpackInt();
      if (ordinal < 0 || ordinal >= enumConstants.length) {
        throw new MessageFormatException("Invalid enum ordinal " + ordinal + " for " + enumType + " with " + enumConstants.length + " constants");
      }
      return enumConstants[ordinal];
    }
    final String name = unpacker.unpackString();
    final Enum<?> constant = byName.get(name);
    if (constant == null) {
      throw new MessageFormatException("Unknown constant " + name + " for " + enumType);
    }
    return constant;
  }

  @Override
  public String toString() {
    return "EnumCodec{enumType=" + enumType.getName() + "}";
  }
}
