// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.no.msgpack.codec;

import java.util.Arrays;
import java.util.Locale;

/// Record layout on the wire. Set via system property `no.framework.msgpack.RecordFormat`. The default is ARRAY.
///
/// **ARRAY** writes the field values positionally, in declaration order. This is the compact form and
/// allows fields to be renamed but not reordered.
///
/// **MAP** writes each field name followed by its value. Larger, but a reader can match fields by name so
/// fields may be reordered, and names it does not know are skipped.
///
/// Decoding accepts either layout whatever this is set to.
public enum RecordFormat {
  ARRAY,
  MAP;

  public static final String PROPERTY = "no.framework.msgpack.RecordFormat";

  public static RecordFormat current() {
    final String mode = System.getProperty(PROPERTY, ARRAY.name()).toUpperCase(Locale.ROOT);
    try {
      return RecordFormat.valueOf(mode);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid record format: " + mode + ". Must be one of: " + Arrays.toString(RecordFormat.values()), e);
    }
  }
}
