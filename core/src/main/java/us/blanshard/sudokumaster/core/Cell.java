/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.sudokumaster.core;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * A snapshot of one square of a {@link Grid}: its value, zero when empty, and
 * whether it is one of the puzzle's clues.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Cell {

  /** The value, in the range 0..9. */
  public final int value;

  /** True for puzzle-supplied clues. */
  public final boolean given;

  Cell(int value, boolean given) {
    this.value = value;
    this.given = given;
  }

  public boolean isEmpty() {
    return value == 0;
  }

  public boolean isGiven() {
    return given;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Cell)) return false;
    Cell that = (Cell) o;
    return this.value == that.value && this.given == that.given;
  }

  @Override public int hashCode() {
    return Objects.hashCode(value, given);
  }

  @Override public String toString() {
    return given ? "[" + value + "]" : Integer.toString(value);
  }
}
