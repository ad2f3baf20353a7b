// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack;

/// Decoded header of an extension value: the application defined type tag and the payload length
public record ExtensionTypeHeader(byte type, int length) {
  public ExtensionTypeHeader {
    if (length < 0) {
      throw new IllegalArgumentException("Extension payload length must be >= 0, got: " + length);
    }
  }
}
