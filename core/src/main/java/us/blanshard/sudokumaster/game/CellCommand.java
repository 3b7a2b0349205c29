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
package us.blanshard.sudokumaster.game;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokumaster.core.Grid;
import us.blanshard.sudokumaster.core.Location;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * An undoable change to one square of a {@link Grid}, remembering the value
 * the square held before.  Has nested classes for setting and clearing.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public abstract class CellCommand {
  final Grid grid;
  final Location loc;
  final int oldValue;

  private CellCommand(Grid grid, Location loc) {
    this.grid = checkNotNull(grid);
    this.loc = checkNotNull(loc);
    this.oldValue = grid.getValue(loc);
  }

  /** Makes a command that puts the given value in the given square. */
  public static Set set(Grid grid, Location loc, int value) {
    return new Set(grid, loc, value);
  }

  /** Makes a command that empties the given square. */
  public static Clear clear(Grid grid, Location loc) {
    return new Clear(grid, loc);
  }

  public Location getLocation() {
    return loc;
  }

  /** The square's value before this command was first done. */
  public int getOldValue() {
    return oldValue;
  }

  /** The square's value after this command is done. */
  public abstract int getNewValue();

  /** Executes the command, again or for the first time. */
  public void redo() throws CommandException {
    apply(getNewValue());
  }

  /** Puts things back the way they were before the command was done. */
  public void undo() throws CommandException {
    apply(oldValue);
  }

  /** A short description for the user, like "Set (0, 4) to 7". */
  public abstract String getDescription();

  @Override public String toString() {
    return getDescription();
  }

  private void apply(int value) throws CommandException {
    if (value == 0) {
      if (grid.isGiven(loc))
        throw new CommandException("Unable to clear location " + loc);
      grid.clearCell(loc);
    } else if (!grid.setCell(loc, value)) {
      throw new CommandException("Unable to set location " + loc + " to " + value);
    }
  }

  public static final class Set extends CellCommand {
    private final int newValue;

    private Set(Grid grid, Location loc, int newValue) {
      super(grid, loc);
      this.newValue = newValue;
    }

    @Override public int getNewValue() {
      return newValue;
    }

    @Override public String getDescription() {
      return "Set " + loc + " to " + newValue;
    }
  }

  public static final class Clear extends CellCommand {
    private Clear(Grid grid, Location loc) {
      super(grid, loc);
    }

    @Override public int getNewValue() {
      return 0;
    }

    @Override public String getDescription() {
      return "Clear " + loc;
    }
  }
}
