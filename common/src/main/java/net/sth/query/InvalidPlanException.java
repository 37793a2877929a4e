// This file is part of STH.
// Copyright (C) 2024  The STH Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.sth.query;

/**
 * Thrown when an aggregation plan cannot be built, e.g. a negative cap on an
 * unbucketed plan.
 */
public class InvalidPlanException extends RuntimeException {
  /** Serial for this exception. Auto generated. */
  private static final long serialVersionUID = 5127384196245317760L;

  public InvalidPlanException(final String msg) {
    super(msg);
  }
}
