// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import static io.github.simbo1905.no.msgpack.Code.*;

/// Writes one MessagePack value at a given index of a [Buffer] and returns the number of bytes written.
/// Every method picks the code that needs the fewest bytes for the value. Nothing here holds state so
/// callers may encode concurrently into disjoint buffers or disjoint ranges of one buffer.
public final class BufferPacker {

  public static final Logger LOGGER = Logger.getLogger(BufferPacker.class.getName());

  /// Largest payload an ext32 header can describe
  public static final long MAX_EXTENSION_LENGTH = 0xFFFFFFFFL;

  private BufferPacker() {
  }

  public static int packNil(Buffer buf, int index) {
    return buf.writeByte(index, NIL);
  }

  public static int packBoolean(Buffer buf, int index, boolean v) {
    return buf.writeByte(index, v ? TRUE : FALSE);
  }

  public static int packByte(Buffer buf, int index, byte v) {
    if (v < -(1 << 5)) {
      return buf.writeByteAndByte(index, INT8, v);
    } else {
      return buf.writeByte(index, v);
    }
  }

  public static int packShort(Buffer buf, int index, short v) {
    if (v < -(1 << 5)) {
      if (v < -(1 << 7)) {
        return buf.writeByteAndShort(index, INT16, v);
      } else {
        return buf.writeByteAndByte(index, INT8, (byte) v);
      }
    } else if (v < (1 << 7)) {
      return buf.writeByte(index, (byte) v);
    } else if (v < (1 << 8)) {
      return buf.writeByteAndByte(index, UINT8, (byte) v);
    } else {
      return buf.writeByteAndShort(index, UINT16, v);
    }
  }

  public static int packInt(Buffer buf, int index, int r) {
    if (r < -(1 << 5)) {
      if (r < -(1 << 15)) {
        return buf.writeByteAndInt(index, INT32, r);
      } else if (r < -(1 << 7)) {
        return buf.writeByteAndShort(index, INT16, (short) r);
      } else {
        return buf.writeByteAndByte(index, INT8, (byte) r);
      }
    } else if (r < (1 << 7)) {
      return buf.writeByte(index, (byte) r);
    } else if (r < (1 << 8)) {
      return buf.writeByteAndByte(index, UINT8, (byte) r);
    } else if (r < (1 << 16)) {
      return buf.writeByteAndShort(index, UINT16, (short) r);
    } else {
      return buf.writeByteAndInt(index, UINT32, r);
    }
  }

  public static int packLong(Buffer buf, int index, long v) {
    if (v < -(1L << 5)) {
      if (v < -(1L << 15)) {
        if (v < -(1L << 31)) {
          return buf.writeByteAndLong(index, INT64, v);
        } else {
          return buf.writeByteAndInt(index, INT32, (int) v);
        }
      } else if (v < -(1 << 7)) {
        return buf.writeByteAndShort(index, INT16, (short) v);
      } else {
        return buf.writeByteAndByte(index, INT8, (byte) v);
      }
    } else if (v < (1 << 7)) {
      // fixnum
      return buf.writeByte(index, (byte) v);
    } else if (v < (1L << 16)) {
      if (v < (1 << 8)) {
        return buf.writeByteAndByte(index, UINT8, (byte) v);
      } else {
        return buf.writeByteAndShort(index, UINT16, (short) v);
      }
    } else if (v < (1L << 32)) {
      return buf.writeByteAndInt(index, UINT32, (int) v);
    } else {
      return buf.writeByteAndLong(index, UINT64, v);
    }
  }

  /// Values up to 63 bits take the long path, a positive 64 bit value takes uint64.
  /// @throws IllegalArgumentException for anything wider, which the format cannot carry
  public static int packBigInteger(Buffer buf, int index, BigInteger bi) {
    if (bi.bitLength() <= 63) {
      return packLong(buf, index, bi.longValue());
    } else if (bi.bitLength() == 64 && bi.signum() == 1) {
      return buf.writeByteAndLong(index, UINT64, bi.longValue());
    } else {
      throw new IllegalArgumentException("MessagePack cannot serialize BigInteger larger than 2^64-1: " + bi);
    }
  }

  public static int packFloat(Buffer buf, int index, float v) {
    return buf.writeByteAndFloat(index, FLOAT32, v);
  }

  public static int packDouble(Buffer buf, int index, double v) {
    return buf.writeByteAndDouble(index, FLOAT64, v);
  }

  public static int packString(Buffer buf, int index, String s) {
    final byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
    final int len = packRawStringHeader(buf, index, bytes.length);
    writePayload(buf, index + len, bytes);
    return len + bytes.length;
  }

  public static int packRawStringHeader(Buffer buf, int index, int len) {
    requireNonNegative("string length", len);
    if (len < (1 << 5)) {
      return buf.writeByte(index, (byte) (FIXSTR_PREFIX | len));
    } else if (len < (1 << 8)) {
      return buf.writeByteAndByte(index, STR8, (byte) len);
    } else if (len < (1 << 16)) {
      return buf.writeByteAndShort(index, STR16, (short) len);
    } else {
      return buf.writeByteAndInt(index, STR32, len);
    }
  }

  public static int packArrayHeader(Buffer buf, int index, int arraySize) {
    if (arraySize < 0) {
      throw new IllegalArgumentException("array size must be >= 0, got: " + arraySize);
    }
    if (arraySize < (1 << 4)) {
      return buf.writeByte(index, (byte) (FIXARRAY_PREFIX | arraySize));
    } else if (arraySize < (1 << 16)) {
      return buf.writeByteAndShort(index, ARRAY16, (short) arraySize);
    } else {
      return buf.writeByteAndInt(index, ARRAY32, arraySize);
    }
  }

  public static int packMapHeader(Buffer buf, int index, int mapSize) {
    if (mapSize < 0) {
      throw new IllegalArgumentException("map size must be >= 0, got: " + mapSize);
    }
    if (mapSize < (1 << 4)) {
      return buf.writeByte(index, (byte) (FIXMAP_PREFIX | mapSize));
    } else if (mapSize < (1 << 16)) {
      return buf.writeByteAndShort(index, MAP16, (short) mapSize);
    } else {
      return buf.writeByteAndInt(index, MAP32, mapSize);
    }
  }

  /// Payloads of 1, 2, 4, 8 or 16 bytes use a fixext code whose length is implied; every other length
  /// gets an explicit 8, 16 or 32 bit length field. The type tag byte always follows.
  /// @throws IllegalArgumentException if the length is negative or above [#MAX_EXTENSION_LENGTH]
  public static int packExtensionTypeHeader(Buffer buf, int index, byte extType, long payloadLen) {
    if (payloadLen < 0 || payloadLen > MAX_EXTENSION_LENGTH) {
      throw new IllegalArgumentException("Extension payload length must be within [0, 2^32-1], got: " + payloadLen);
    }
    if (payloadLen < (1 << 8)) {
      if (payloadLen > 0 && (payloadLen & (payloadLen - 1)) == 0) { // check whether dataLen == 2^x
        if (payloadLen == 1) {
          return buf.writeByteAndByte(index, FIXEXT1, extType);
        } else if (payloadLen == 2) {
          return buf.writeByteAndByte(index, FIXEXT2, extType);
        } else if (payloadLen == 4) {
          return buf.writeByteAndByte(index, FIXEXT4, extType);
        } else if (payloadLen == 8) {
          return buf.writeByteAndByte(index, FIXEXT8, extType);
        } else if (payloadLen == 16) {
          return buf.writeByteAndByte(index, FIXEXT16, extType);
        }
      }
      buf.writeByteAndByte(index, EXT8, (byte) payloadLen);
      buf.writeByte(index + 2, extType);
      return 3;
    } else if (payloadLen < (1 << 16)) {
      buf.writeByteAndShort(index, EXT16, (short) payloadLen);
      buf.writeByte(index + 3, extType);
      return 4;
    } else {
      buf.writeByteAndInt(index, EXT32, (int) payloadLen);
      buf.writeByte(index + 5, extType);
      return 6;
    }
  }

  public static int packBinaryHeader(Buffer buf, int index, int len) {
    requireNonNegative("binary length", len);
    if (len < (1 << 8)) {
      return buf.writeByteAndByte(index, BIN8, (byte) len);
    } else if (len < (1 << 16)) {
      return buf.writeByteAndShort(index, BIN16, (short) len);
    } else {
      return buf.writeByteAndInt(index, BIN32, len);
    }
  }

  public static int writePayload(Buffer buf, int index, byte[] v) {
    return buf.writeBytes(index, v);
  }

  public static int writePayload(Buffer buf, int index, byte[] v, int vOffset, int length) {
    return buf.writeBytes(index, v, vOffset, length);
  }

  private static void requireNonNegative(String what, int len) {
    if (len < 0) {
      throw new IllegalArgumentException(what + " must be >= 0, got: " + len);
    }
  }
}
