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
package us.blanshard.sudokumaster.gen;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokumaster.core.Location;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * A correct value for one empty square.
 */
@Immutable
public final class Hint {

  public final Location location;
  public final int value;

  public Hint(Location location, int value) {
    checkArgument(value >= 1 && value <= Location.SIZE, "value out of range: %s", value);
    this.location = checkNotNull(location);
    this.value = value;
  }

  public int getRow() {
    return location.row;
  }

  public int getColumn() {
    return location.column;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Hint)) return false;
    Hint that = (Hint) o;
    return this.location == that.location && this.value == that.value;
  }

  @Override public int hashCode() {
    return Objects.hashCode(location, value);
  }

  @Override public String toString() {
    return value + " → " + location;  // That's a right arrow
  }
}
