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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Sets;

import java.util.List;
import java.util.Set;

/**
 * The rules of Sudoku, as static predicates over a {@link Grid}.
 *
 * @author Luke Blanshard
 */
public final class RuleChecker {

  private RuleChecker() {}

  /** Possible states for a Sudoku grid. */
  public enum State {
    INCOMPLETE,  // Not all filled in, but nothing that is filled in breaks the rules.
    BROKEN,      // Something that's filled in breaks the rules.
    SOLVED;      // Completely filled in, no rule violations.
  }

  /**
   * Tells whether the given value may go in the given square: zero always may,
   * anything else only if no other square in the same row, column or box
   * already holds it.  The square's own current value is ignored.
   */
  public static boolean isPlacementLegal(Grid grid, int row, int col, int value) {
    checkArgument(value >= 0 && value <= Location.SIZE, "value out of range: %s", value);
    if (value == 0) return true;
    return isAbsentFromRow(grid, row, col, value)
        && isAbsentFromColumn(grid, col, row, value)
        && isAbsentFromBox(grid, row, col, value);
  }

  public static boolean isPlacementLegal(Grid grid, Location loc, int value) {
    return isPlacementLegal(grid, loc.row, loc.column, value);
  }

  /** Is the value absent from the row, ignoring the square in column {@code skipCol}? */
  public static boolean isAbsentFromRow(Grid grid, int row, int skipCol, int value) {
    for (int col = 0; col < Location.SIZE; ++col) {
      if (col != skipCol && grid.getValue(row, col) == value) return false;
    }
    return true;
  }

  /** Is the value absent from the column, ignoring the square in row {@code skipRow}? */
  public static boolean isAbsentFromColumn(Grid grid, int col, int skipRow, int value) {
    for (int row = 0; row < Location.SIZE; ++row) {
      if (row != skipRow && grid.getValue(row, col) == value) return false;
    }
    return true;
  }

  /**
   * Is the value absent from the box containing the given square, ignoring
   * that square?
   */
  public static boolean isAbsentFromBox(Grid grid, int row, int col, int value) {
    int top = row / 3 * 3;
    int left = col / 3 * 3;
    for (int r = top; r < top + 3; ++r) {
      for (int c = left; c < left + 3; ++c) {
        if ((r != row || c != col) && grid.getValue(r, c) == value) return false;
      }
    }
    return true;
  }

  /**
   * Tells whether the grid is completely and correctly filled in: no empty
   * squares, and every value legal with respect to all the others.
   */
  public static boolean isBoardSolved(Grid grid) {
    if (!grid.isFull()) return false;
    for (Location loc : Location.ALL) {
      if (!isPlacementLegal(grid, loc, grid.getValue(loc))) return false;
    }
    return true;
  }

  /** Tells whether no unit of the grid holds the same value twice. */
  public static boolean isConsistent(Grid grid) {
    for (List<Location> unit : Location.UNITS) {
      int bits = 0;
      for (Location loc : unit) {
        int value = grid.getValue(loc);
        if (value != 0) {
          int bit = 1 << value;
          if ((bits & bit) != 0) return false;
          bits |= bit;
        }
      }
    }
    return true;
  }

  /**
   * Returns locations that have duplicate values for some unit.
   */
  public static Set<Location> getBrokenLocations(Grid grid) {
    Set<Location> answer = Sets.newTreeSet();
    for (List<Location> unit : Location.UNITS) {
      int bits = 0;
      for (Location loc : unit) {
        int value = grid.getValue(loc);
        if (value == 0) continue;
        int bit = 1 << value;
        if ((bits & bit) != 0) {
          answer.add(loc);
          for (Location firstLoc : unit)
            if (grid.getValue(firstLoc) == value) {
              answer.add(firstLoc);
              break;
            }
        }
        bits |= bit;
      }
    }
    return answer;
  }

  public static State getState(Grid grid) {
    if (!isConsistent(grid))
      return State.BROKEN;
    return grid.isFull() ? State.SOLVED : State.INCOMPLETE;
  }
}
