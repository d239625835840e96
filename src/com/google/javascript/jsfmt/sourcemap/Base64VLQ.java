/*
 * Copyright 2026 The Closure Compiler Authors. All rights reserved.
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 *
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 *  * Redistributions in binary form must reproduce the above
 *    copyright notice, this list of conditions and the following
 *    disclaimer in the documentation and/or other materials provided
 *    with the distribution.
 *  * Neither the name of Google Inc. nor the names of its
 *    contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package com.google.javascript.jsfmt.sourcemap;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;

/**
 * Variable length quantities as used by the "mappings" field of a V3 source map.
 *
 * <p>Numbers are written as base64 digits with the least significant digit first. Each digit
 * carries 5 bits of the value and a continuation bit; the lowest bit of the first digit is the
 * sign.
 */
final class Base64VLQ {
  private Base64VLQ() {}

  private static final String BASE64_MAP =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZ" + "abcdefghijklmnopqrstuvwxyz" + "0123456789+/";

  private static final int[] BASE64_DECODE_MAP = new int[128];

  static {
    Arrays.fill(BASE64_DECODE_MAP, -1);
    for (int i = 0; i < BASE64_MAP.length(); i++) {
      BASE64_DECODE_MAP[BASE64_MAP.charAt(i)] = i;
    }
  }

  // A Base64 VLQ digit can represent 5 bits, so it is base-32.
  private static final int VLQ_BASE_SHIFT = 5;
  private static final int VLQ_BASE = 1 << VLQ_BASE_SHIFT;

  // A mask of bits for a VLQ digit (11111), 31 decimal.
  private static final int VLQ_BASE_MASK = VLQ_BASE - 1;

  // The continuation bit is the 6th bit.
  private static final int VLQ_CONTINUATION_BIT = VLQ_BASE;

  /** Moves the sign into the lowest bit: 1 becomes 2, -1 becomes 3, 2 becomes 4. */
  private static int toVLQSigned(int value) {
    return value < 0 ? ((-value) << 1) + 1 : value << 1;
  }

  private static int fromVLQSigned(int value) {
    boolean negate = (value & 1) == 1;
    value = value >> 1;
    return negate ? -value : value;
  }

  static void encode(StringBuilder out, int value) {
    value = toVLQSigned(value);
    do {
      int digit = value & VLQ_BASE_MASK;
      value >>>= VLQ_BASE_SHIFT;
      if (value > 0) {
        digit |= VLQ_CONTINUATION_BIT;
      }
      out.append(BASE64_MAP.charAt(digit));
    } while (value > 0);
  }

  /** A cursor over encoded characters that the decoder advances. */
  interface CharIterator {
    boolean hasNext();

    char next();
  }

  /**
   * Decodes the next value.
   *
   * @throws IllegalArgumentException if the input ends inside a value or holds a character that
   *     is not a base64 digit
   */
  static int decode(CharIterator in) {
    int result = 0;
    boolean continuation;
    int shift = 0;
    do {
      checkArgument(in.hasNext(), "mappings end inside a value");
      int digit = fromBase64(in.next());
      continuation = (digit & VLQ_CONTINUATION_BIT) != 0;
      digit &= VLQ_BASE_MASK;
      result = result + (digit << shift);
      shift = shift + VLQ_BASE_SHIFT;
    } while (continuation);

    return fromVLQSigned(result);
  }

  private static int fromBase64(char c) {
    int result = c < BASE64_DECODE_MAP.length ? BASE64_DECODE_MAP[c] : -1;
    checkArgument(result != -1, "invalid base64 digit: '%s'", c);
    return result;
  }
}
