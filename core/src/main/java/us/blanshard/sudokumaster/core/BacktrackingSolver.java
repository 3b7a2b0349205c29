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
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A depth-first Sudoku solver.  It fills empty squares in row-major order,
 * trying the numerals in ascending order at each one, so for a given starting
 * grid the solution it finds is always the same.
 *
 * <p> Givens are never empty, so they act as fixed constraints.  There is no
 * time limit: callers who care should bound the number of empty squares they
 * hand in.
 *
 * @author Luke Blanshard
 */
public final class BacktrackingSolver {

  private BacktrackingSolver() {}

  /**
   * Fills in the given grid's empty squares with a solution, if there is one.
   * Returns true, with the grid solved, if it found one.  Returns false if
   * there is no solution; the grid's contents are then unspecified, so copy
   * it first if you need to keep it.
   *
   * <p> A grid that already breaks the rules is rejected without searching.
   * A grid that is already solved is left alone.
   */
  public static boolean solve(Grid grid) {
    checkNotNull(grid);
    if (!RuleChecker.isConsistent(grid)) return false;
    return search(grid, 0);
  }

  /**
   * Counts the solutions to the given grid, stopping once it reaches {@code
   * limit}.  Leaves the grid unchanged.
   */
  public static int countSolutions(Grid grid, int limit) {
    checkNotNull(grid);
    checkArgument(limit > 0, "limit must be positive: %s", limit);
    if (!RuleChecker.isConsistent(grid)) return 0;
    return count(grid.copy(), 0, limit);
  }

  private static boolean search(Grid grid, int start) {
    int index = firstEmpty(grid, start);
    if (index < 0) return true;
    Location loc = Location.of(index);
    for (int value = 1; value <= Location.SIZE; ++value) {
      if (RuleChecker.isPlacementLegal(grid, loc, value)) {
        grid.put(index, value);
        if (search(grid, index + 1)) return true;
        grid.put(index, 0);
      }
    }
    return false;
  }

  private static int count(Grid grid, int start, int limit) {
    int index = firstEmpty(grid, start);
    if (index < 0) return 1;
    Location loc = Location.of(index);
    int total = 0;
    for (int value = 1; value <= Location.SIZE && total < limit; ++value) {
      if (RuleChecker.isPlacementLegal(grid, loc, value)) {
        grid.put(index, value);
        total += count(grid, index + 1, limit - total);
        grid.put(index, 0);
      }
    }
    return total;
  }

  /** Squares before {@code start} are known to be filled. */
  private static int firstEmpty(Grid grid, int start) {
    for (int i = start; i < Location.COUNT; ++i) {
      if (grid.getValue(Location.of(i)) == 0) return i;
    }
    return -1;
  }
}
