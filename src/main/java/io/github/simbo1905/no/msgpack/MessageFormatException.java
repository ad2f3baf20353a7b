// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack;

/// Raised when bytes being decoded do not hold the value that was asked for, or hold a
/// value that cannot be represented by the requested Java type.
public class MessageFormatException extends IllegalStateException {

  public MessageFormatException(String message) {
    super(message);
  }

  public MessageFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
