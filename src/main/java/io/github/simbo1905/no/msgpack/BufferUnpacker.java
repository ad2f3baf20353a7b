// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static io.github.simbo1905.no.msgpack.BufferPacker.LOGGER;
import static io.github.simbo1905.no.msgpack.Code.*;

/// Reads MessagePack values back from a [Buffer]. Each `unpack` call consumes exactly the bytes the
/// matching [BufferPacker] call wrote and advances the cursor past them. Not thread safe.
public final class BufferUnpacker {

  private final Buffer buf;
  private final int limit;
  private int position;

  public BufferUnpacker(Buffer buf, int position, int limit) {
    this.buf = Objects.requireNonNull(buf, "buffer must not be null");
    if (position < 0 || position > limit || limit > buf.size()) {
      throw new IllegalArgumentException("Invalid range [" + position + ", " + limit + ") for buffer of size " + buf.size());
    }
    this.position = position;
    this.limit = limit;
  }

  public static BufferUnpacker of(byte[] bytes) {
    return new BufferUnpacker(Buffer.wrap(bytes), 0, bytes.length);
  }

  public int position() {
    return position;
  }

  public boolean hasNext() {
    return position < limit;
  }

  public MessageFormat getNextFormat() {
    return MessageFormat.valueOf(peekByte());
  }

  private byte peekByte() {
    require(1);
    return buf.readByte(position);
  }

  private void require(int numBytes) {
    if ((long) position + numBytes > limit) {
      throw new MessageFormatException("Insufficient input: need " + numBytes + " bytes at position " + position + " but limit is " + limit);
    }
  }

  private byte readByte() {
    require(Byte.BYTES);
    final byte b = buf.readByte(position);
    position += Byte.BYTES;
    return b;
  }

  private short readShort() {
    require(Short.BYTES);
    final short v = buf.readShort(position);
    position += Short.BYTES;
    return v;
  }

  private int readInt() {
    require(Integer.BYTES);
    final int v = buf.readInt(position);
    position += Integer.BYTES;
    return v;
  }

  private long readLong() {
    require(Long.BYTES);
    final long v = buf.readLong(position);
    position += Long.BYTES;
    return v;
  }

  private float readFloat() {
    require(Float.BYTES);
    final float v = buf.readFloat(position);
    position += Float.BYTES;
    return v;
  }

  private double readDouble() {
    require(Double.BYTES);
    final double v = buf.readDouble(position);
    position += Double.BYTES;
    return v;
  }

  private static MessageFormatException unexpected(String expected, byte b) {
    final MessageFormat format = MessageFormat.valueOf(b);
    if (format == MessageFormat.NEVER_USED) {
      return new MessageFormatException("Expected " + expected + ", but encountered 0xC1 \"NEVER_USED\" byte");
    }
    final String name = format.getValueType().name();
    return new MessageFormatException(String.format("Expected %s, but got %s (%02x)", expected, name, b));
  }

  private static MessageFormatException overflow(String target, Object value) {
    return new MessageFormatException("Value " + value + " does not fit in " + target);
  }

  public void unpackNil() {
    final byte b = readByte();
    if (b != NIL) {
      throw unexpected("Nil", b);
    }
  }

  /// Consume a nil if one is next
  /// @return true if a nil was consumed
  public boolean tryUnpackNil() {
    if (peekByte() == NIL) {
      position += 1;
      return true;
    }
    return false;
  }

  public boolean unpackBoolean() {
    final byte b = readByte();
    if (b == FALSE) {
      return false;
    } else if (b == TRUE) {
      return true;
    }
    throw unexpected("boolean", b);
  }

  public byte unpackByte() {
    final long v = unpackLongChecked("byte");
    if (v < Byte.MIN_VALUE || v > Byte.MAX_VALUE) {
      throw overflow("byte", v);
    }
    return (byte) v;
  }

  public short unpackShort() {
    final long v = unpackLongChecked("short");
    if (v < Short.MIN_VALUE || v > Short.MAX_VALUE) {
      throw overflow("short", v);
    }
    return (short) v;
  }

  public int unpackInt() {
    final long v = unpackLongChecked("int");
    if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
      throw overflow("int", v);
    }
    return (int) v;
  }

  public long unpackLong() {
    return unpackLongChecked("long");
  }

  private long unpackLongChecked(String target) {
    final byte b = readByte();
    if (Code.isFixInt(b)) {
      return b;
    }
    switch (b) {
      case UINT8:
        return readByte() & 0xFFL;
      case UINT16:
        return readShort() & 0xFFFFL;
      case UINT32:
        return readInt() & 0xFFFFFFFFL;
      case UINT64: {
        final long u64 = readLong();
        if (u64 < 0) {
          throw overflow(target, Long.toUnsignedString(u64));
        }
        return u64;
      }
      case INT8:
        return readByte();
      case INT16:
        return readShort();
      case INT32:
        return readInt();
      case INT64:
        return readLong();
      default:
        throw unexpected("Integer", b);
    }
  }

  /// Accepts every integer form, including uint64 values above [Long#MAX_VALUE]
  public BigInteger unpackBigInteger() {
    final byte b = peekByte();
    if (b == UINT64) {
      position += 1;
      final long u64 = readLong();
      if (u64 < 0) {
        return new BigInteger(Long.toUnsignedString(u64));
      }
      return BigInteger.valueOf(u64);
    }
    return BigInteger.valueOf(unpackLongChecked("BigInteger"));
  }

  public float unpackFloat() {
    final byte b = readByte();
    if (b == FLOAT32) {
      return readFloat();
    } else if (b == FLOAT64) {
      return (float) readDouble();
    }
    throw unexpected("Float", b);
  }

  public double unpackDouble() {
    final byte b = readByte();
    if (b == FLOAT32) {
      return readFloat();
    } else if (b == FLOAT64) {
      return readDouble();
    }
    throw unexpected("Float", b);
  }

  public int unpackRawStringHeader() {
    final byte b = readByte();
    if (Code.isFixedRaw(b)) {
      return b & 0x1f;
    }
    switch (b) {
      case STR8:
        return readByte() & 0xff;
      case STR16:
        return readShort() & 0xffff;
      case STR32:
        return readLength32("string");
      default:
        throw unexpected("String", b);
    }
  }

  public String unpackString() {
    final int len = unpackRawStringHeader();
    return new String(readPayload(len), StandardCharsets.UTF_8);
  }

  /// @throws MessageFormatException if the remaining input is too short to hold that many elements
  public int unpackArrayHeader() {
    final byte b = readByte();
    final int size;
    if (Code.isFixedArray(b)) {
      size = b & 0x0f;
    } else {
      switch (b) {
        case ARRAY16:
          size = readShort() & 0xffff;
          break;
        case ARRAY32:
          size = readLength32("array");
          break;
        default:
          throw unexpected("Array", b);
      }
    }
    requireValues(size, "array");
    return size;
  }

  /// @throws MessageFormatException if the remaining input is too short to hold that many entries
  public int unpackMapHeader() {
    final byte b = readByte();
    final int size;
    if (Code.isFixedMap(b)) {
      size = b & 0x0f;
    } else {
      switch (b) {
        case MAP16:
          size = readShort() & 0xffff;
          break;
        case MAP32:
          size = readLength32("map");
          break;
        default:
          throw unexpected("Map", b);
      }
    }
    requireValues(2L * size, "map");
    return size;
  }

  /// Every value takes at least one byte
  private void requireValues(long count, String what) {
    final long left = (long) limit - position;
    if (count > left) {
      throw new MessageFormatException("Truncated " + what + ": header declares " + count + " values but only " +
          left + " bytes remain at position " + position);
    }
  }

  public ExtensionTypeHeader unpackExtensionTypeHeader() {
    final byte b = readByte();
    switch (b) {
      case FIXEXT1:
        return new ExtensionTypeHeader(readByte(), 1);
      case FIXEXT2:
        return new ExtensionTypeHeader(readByte(), 2);
      case FIXEXT4:
        return new ExtensionTypeHeader(readByte(), 4);
      case FIXEXT8:
        return new ExtensionTypeHeader(readByte(), 8);
      case FIXEXT16:
        return new ExtensionTypeHeader(readByte(), 16);
      case EXT8: {
        final int length = readByte() & 0xff;
        return new ExtensionTypeHeader(readByte(), length);
      }
      case EXT16: {
        final int length = readShort() & 0xffff;
        return new ExtensionTypeHeader(readByte(), length);
      }
      case EXT32: {
        final int length = readLength32("extension");
        return new ExtensionTypeHeader(readByte(), length);
      }
      default:
        throw unexpected("Ext", b);
    }
  }

  public int unpackBinaryHeader() {
    final byte b = readByte();
    switch (b) {
      case BIN8:
        return readByte() & 0xff;
      case BIN16:
        return readShort() & 0xffff;
      case BIN32:
        return readLength32("binary");
      default:
        throw unexpected("Binary", b);
    }
  }

  public byte[] readPayload(int length) {
    require(length);
    final byte[] out = buf.readBytes(position, length);
    position += length;
    return out;
  }

  private int readLength32(String what) {
    final int len = readInt();
    if (len < 0) {
      throw new MessageFormatException("Cannot handle " + what + " of length " + (len & 0xFFFFFFFFL) + " which exceeds 2^31-1");
    }
    return len;
  }

  /// Skip over the next value, including every nested element of an array or map
  public void skipValue() {
    long remaining = 1;
    while (remaining > 0) {
      final MessageFormat format = getNextFormat();
      LOGGER.finer(() -> "Skipping " + format + " at position " + position);
      switch (format) {
        case POSFIXINT:
        case NEGFIXINT:
        case NIL:
        case BOOLEAN:
          position += 1;
          break;
        case UINT8:
        case INT8:
          skip(2);
          break;
        case UINT16:
        case INT16:
          skip(3);
          break;
        case UINT32:
        case INT32:
        case FLOAT32:
          skip(5);
          break;
        case UINT64:
        case INT64:
        case FLOAT64:
          skip(9);
          break;
        case FIXSTR:
        case STR8:
        case STR16:
        case STR32:
          skip(unpackRawStringHeader());
          break;
        case BIN8:
        case BIN16:
        case BIN32:
          skip(unpackBinaryHeader());
          break;
        case FIXEXT1:
        case FIXEXT2:
        case FIXEXT4:
        case FIXEXT8:
        case FIXEXT16:
        case EXT8:
        case EXT16:
        case EXT32:
          skip(unpackExtensionTypeHeader().length());
          break;
        case FIXARRAY:
        case ARRAY16:
        case ARRAY32:
          remaining += unpackArrayHeader();
          break;
        case FIXMAP:
        case MAP16:
        case MAP32:
          remaining += 2L * unpackMapHeader();
          break;
        case NEVER_USED:
          throw new MessageFormatException("Encountered 0xC1 \"NEVER_USED\" byte at position " + position);
      }
      remaining--;
    }
  }

  private void skip(int numBytes) {
    require(numBytes);
    position += numBytes;
  }

  @Override
  public String toString() {
    return "BufferUnpacker{position=" + position + ", limit=" + limit + "}";
  }
}
