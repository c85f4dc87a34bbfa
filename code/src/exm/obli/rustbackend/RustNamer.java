/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.obli.rustbackend;

import com.google.common.collect.ImmutableSet;

import exm.obli.common.exceptions.ObliRuntimeError;

/**
 * Maps MiniObli variable names to Rust identifiers.
 *
 * Names that collide with Rust keywords are written as raw identifiers
 * (r#type).  The few keywords that cannot be raw identifiers get a
 * trailing underscore instead.
 */
public class RustNamer {

  private static final ImmutableSet<String> KEYWORDS = ImmutableSet.of(
      "as", "async", "await", "break", "const", "continue", "dyn", "enum",
      "extern", "fn", "for", "impl", "in", "loop", "match", "mod", "move",
      "mut", "pub", "ref", "return", "static", "struct", "trait", "type",
      "unsafe", "use", "where", "while", "abstract", "become", "box", "do",
      "final", "macro", "override", "priv", "try", "typeof", "unsized",
      "virtual", "yield");

  /** Keywords that r# does not accept */
  private static final ImmutableSet<String> NOT_RAW = ImmutableSet.of(
      "self", "Self", "super", "crate", "_");

  public static String rustName(String name) {
    if (name == null || name.length() == 0) {
      throw new ObliRuntimeError("Empty variable name");
    }
    if (NOT_RAW.contains(name)) {
      return name + "_";
    } else if (KEYWORDS.contains(name)) {
      return "r#" + name;
    } else {
      return name;
    }
  }
}
