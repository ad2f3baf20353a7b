// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack;

/// The value categories of the MessagePack type system
public enum ValueType {
  NIL(false, false),
  BOOLEAN(false, false),
  INTEGER(true, false),
  FLOAT(true, false),
  STRING(false, true),
  BINARY(false, true),
  ARRAY(false, false),
  MAP(false, false),
  EXTENSION(false, false);

  private final boolean numberType;
  private final boolean rawType;

  ValueType(boolean numberType, boolean rawType) {
    this.numberType = numberType;
    this.rawType = rawType;
  }

  public boolean isNumberType() {
    return numberType;
  }

  public boolean isRawType() {
    return rawType;
  }
}
