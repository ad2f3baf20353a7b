// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import io.github.simbo1905.no.msgpack.Buffer;
import io.github.simbo1905.no.msgpack.BufferPacker;
import io.github.simbo1905.no.msgpack.BufferUnpacker;
import io.github.simbo1905.no.msgpack.Code;
import io.github.simbo1905.no.msgpack.ExtensionTypeHeader;
import io.github.simbo1905.no.msgpack.MessageFormatException;

import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import static io.github.simbo1905.no.msgpack.codec.TypeDescriptor.PrimitiveKind;

/// Codec for a leaf value built from a packer and an unpacker. Nulls are handled here so the
/// functions only ever see real values.
record StandardCodec<A>(PrimitiveKind kind, Packer<A> packer, Unpacker<A> unpacker) implements MessageCodec<A> {

  @FunctionalInterface
  interface Packer<A> {
    int pack(Buffer buf, int index, A value);
  }

  @FunctionalInterface
  interface Unpacker<A> {
    A unpack(BufferUnpacker unpacker);
  }

  StandardCodec {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(packer, "packer must not be null");
    Objects.requireNonNull(unpacker, "unpacker must not be null");
  }

  static final StandardCodec<Boolean> BOOLEAN = new StandardCodec<>(PrimitiveKind.BOOLEAN,
      BufferPacker::packBoolean, BufferUnpacker::unpackBoolean);
  static final StandardCodec<Byte> BYTE = new StandardCodec<>(PrimitiveKind.BYTE,
      BufferPacker::packByte, BufferUnpacker::unpackByte);
  static final StandardCodec<Short> SHORT = new StandardCodec<>(PrimitiveKind.SHORT,
      BufferPacker::packShort, BufferUnpacker::unpackShort);
  static final StandardCodec<Character> CHARACTER = new StandardCodec<>(PrimitiveKind.CHARACTER,
      (buf, index, c) -> BufferPacker.packInt(buf, index, c), StandardCodec::unpackChar);
  static final StandardCodec<Integer> INTEGER = new StandardCodec<>(PrimitiveKind.INTEGER,
      BufferPacker::packInt, BufferUnpacker::unpackInt);
  static final StandardCodec<Long> LONG = new StandardCodec<>(PrimitiveKind.LONG,
      BufferPacker::packLong, BufferUnpacker::unpackLong);
  static final StandardCodec<Float> FLOAT = new StandardCodec<>(PrimitiveKind.FLOAT,
      BufferPacker::packFloat, BufferUnpacker::unpackFloat);
  static final StandardCodec<Double> DOUBLE = new StandardCodec<>(PrimitiveKind.DOUBLE,
      BufferPacker::packDouble, BufferUnpacker::unpackDouble);
  static final StandardCodec<String> STRING = new StandardCodec<>(PrimitiveKind.STRING,
      BufferPacker::packString, BufferUnpacker::unpackString);
  static final StandardCodec<java.math.BigInteger> BIG_INTEGER = new StandardCodec<>(PrimitiveKind.BIG_INTEGER,
      BufferPacker::packBigInteger, BufferUnpacker::unpackBigInteger);
  static final StandardCodec<byte[]> BINARY = new StandardCodec<>(PrimitiveKind.BINARY,
      StandardCodec::packBinary, u -> u.readPayload(u.unpackBinaryHeader()));
  static final StandardCodec<Instant> TIMESTAMP = new StandardCodec<>(PrimitiveKind.TIMESTAMP,
      StandardCodec::packTimestamp, StandardCodec::unpackTimestamp);

  /// The standard codec of a primitive kind
  static StandardCodec<?> of(PrimitiveKind kind) {
    return switch (kind) {
      case BOOLEAN -> BOOLEAN;
      case BYTE -> BYTE;
      case SHORT -> SHORT;
      case CHARACTER -> CHARACTER;
      case INTEGER -> INTEGER;
      case LONG -> LONG;
      case FLOAT -> FLOAT;
      case DOUBLE -> DOUBLE;
      case STRING -> STRING;
      case BIG_INTEGER -> BIG_INTEGER;
      case BINARY -> BINARY;
      case TIMESTAMP -> TIMESTAMP;
    };
  }

  /// Known codec table holding a standard codec for every primitive kind
  static Map<TypeDescriptor, MessageCodec<?>> standardCodecs() {
    return Arrays.stream(PrimitiveKind.values())
        .collect(Collectors.<PrimitiveKind, TypeDescriptor, MessageCodec<?>>toUnmodifiableMap(TypeDescriptor::of, StandardCodec::of));
  }

  @Override
  public int pack(Buffer buf, int index, A value) {
    if (value == null) {
      return BufferPacker.packNil(buf, index);
    }
    if (!kind.javaType().isInstance(value)) {
      throw new IllegalArgumentException("Expected " + kind.javaType().getName() + " for " + kind +
          " but got " + value.getClass().getName());
    }
    return packer.pack(buf, index, value);
  }

  @Override
  public A unpack(BufferUnpacker unpacker) {
    if (unpacker.tryUnpackNil()) {
      return null;
    }
    return this.unpacker.unpack(unpacker);
  }

  @Override
  public String toString() {
    return "StandardCodec[" + kind + "]";
  }

  private static Character unpackChar(BufferUnpacker unpacker) {
    final int v = unpacker.unpackInt();
    if (v < Character.MIN_VALUE || v > Character.MAX_VALUE) {
      throw new MessageFormatException("Value " + v + " does not fit in char");
    }
    return (char) v;
  }

  private static int packBinary(Buffer buf, int index, byte[] bytes) {
    final int len = BufferPacker.packBinaryHeader(buf, index, bytes.length);
    return len + BufferPacker.writePayload(buf, index + len, bytes);
  }

  /// Timestamp extension: 32 bit seconds when there are no nanos and the seconds fit unsigned,
  /// 64 bits of 30 bit nanos and 34 bit seconds when the seconds fit, otherwise 96 bits.
  private static int packTimestamp(Buffer buf, int index, Instant instant) {
    final long seconds = instant.getEpochSecond();
    final int nanos = instant.getNano();
    if (seconds >>> 34 == 0) {
      final long data64 = ((long) nanos << 34) | seconds;
      if ((data64 & 0xffffffff00000000L) == 0) {
        final int len = BufferPacker.packExtensionTypeHeader(buf, index, Code.EXT_TIMESTAMP, 4);
        return len + buf.writeInt(index + len, (int) seconds);
      }
      final int len = BufferPacker.packExtensionTypeHeader(buf, index, Code.EXT_TIMESTAMP, 8);
      return len + buf.writeLong(index + len, data64);
    }
    final int len = BufferPacker.packExtensionTypeHeader(buf, index, Code.EXT_TIMESTAMP, 12);
    final int nanosLen = buf.writeInt(index + len, nanos);
    return len + nanosLen + buf.writeLong(index + len + nanosLen, seconds);
  }

  private static Instant unpackTimestamp(BufferUnpacker unpacker) {
    final ExtensionTypeHeader header = unpacker.unpackExtensionTypeHeader();
    if (header.type() != Code.EXT_TIMESTAMP) {
      throw new MessageFormatException("Expected timestamp extension type -1 but got " + header.type());
    }
    final ByteBuffer payload = ByteBuffer.wrap(unpacker.readPayload(header.length()));
    switch (header.length()) {
      case 4:
        return Instant.ofEpochSecond(payload.getInt() & 0xffffffffL);
      case 8: {
        final long data64 = payload.getLong();
        return Instant.ofEpochSecond(data64 & 0x00000003ffffffffL, data64 >>> 34);
      }
      case 12: {
        final int nanos = payload.getInt();
        return Instant.ofEpochSecond(payload.getLong(), nanos & 0xffffffffL);
      }
      default:
        throw new MessageFormatException("Invalid timestamp extension length: " + header.length());
    }
  }
}
