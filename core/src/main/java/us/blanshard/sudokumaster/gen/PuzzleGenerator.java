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
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.sudokumaster.core.BacktrackingSolver;
import us.blanshard.sudokumaster.core.Grid;
import us.blanshard.sudokumaster.core.Location;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Generates Sudoku puzzles by solving a randomly seeded grid and then taking
 * squares away from it.
 *
 * <p> In the default {@link Uniqueness#SOLVABLE} mode a square stays empty as
 * long as the remaining grid can still be solved, so a puzzle may have more
 * than one solution, more often the more squares are removed.  {@link
 * Uniqueness#UNIQUE} counts solutions instead, which is exact but much slower.
 *
 * <p> Removal is best effort: if every location has been tried before the
 * target is reached, the puzzle comes back with more givens than asked for.
 * Callers that care should look at {@link Grid#givenCount}.
 *
 * @author Luke Blanshard
 */
public final class PuzzleGenerator {
  private static final Logger logger = Logger.getLogger(PuzzleGenerator.class.getName());

  /** How strictly a square's removal is vetted. */
  public enum Uniqueness {
    /** The grid must still have some solution. */
    SOLVABLE {
      @Override boolean allowsRemoval(Grid grid) {
        return BacktrackingSolver.solve(grid.copy());
      }
    },

    /** The grid must still have exactly one solution. */
    UNIQUE {
      @Override boolean allowsRemoval(Grid grid) {
        return BacktrackingSolver.countSolutions(grid, 2) == 1;
      }
    };

    /** Tells whether the given grid, just missing a square, is acceptable. */
    abstract boolean allowsRemoval(Grid grid);
  }

  private final Random random;
  private final Uniqueness uniqueness;

  public PuzzleGenerator() {
    this(new Random());
  }

  public PuzzleGenerator(Random random) {
    this(random, Uniqueness.SOLVABLE);
  }

  public PuzzleGenerator(Random random, Uniqueness uniqueness) {
    this.random = checkNotNull(random);
    this.uniqueness = checkNotNull(uniqueness);
  }

  public Uniqueness getUniqueness() {
    return uniqueness;
  }

  /**
   * Generates a puzzle for the given difficulty.
   */
  public Grid generate(Difficulty difficulty) {
    return generate(difficulty.getCellsToRemove());
  }

  /**
   * Generates a puzzle with up to {@code cellsToRemove} empty squares; every
   * filled square of the result is a given.
   */
  public Grid generate(int cellsToRemove) {
    checkArgument(cellsToRemove >= 0 && cellsToRemove < Location.COUNT,
        "cellsToRemove must be in [0, %s): %s", Location.COUNT, cellsToRemove);
    Grid grid = makeTarget(random);
    int removed = carve(grid, cellsToRemove);
    if (removed < cellsToRemove) {
      logger.info("Removed only " + removed + " of " + cellsToRemove + " requested squares");
    } else {
      logger.fine("Generated puzzle with " + (Location.COUNT - removed) + " givens");
    }
    return grid.toPuzzle();
  }

  /**
   * Creates a completely solved grid.  The three boxes on the diagonal share no
   * row or column, so each gets an independent shuffle of the numerals; the
   * solver fills in the rest.
   */
  public static Grid makeTarget(Random random) {
    Grid grid = Grid.blank();
    for (int box = 0; box < Location.SIZE; box += 4)
      seedBox(grid, box, random);
    checkState(BacktrackingSolver.solve(grid), "Unsolvable seed grid:\n%s", grid);
    return grid;
  }

  /** Returns all locations in random order. */
  public static List<Location> randomLocations(Random random) {
    List<Location> locs = Lists.newArrayList(Location.ALL);
    Collections.shuffle(locs, random);
    return locs;
  }

  /**
   * Empties squares of the given grid, in random order, until the target is
   * reached or no location is left.  Returns the number emptied.
   */
  int carve(Grid grid, int cellsToRemove) {
    int removed = 0;
    for (Location loc : randomLocations(random)) {
      if (removed >= cellsToRemove) break;
      int value = grid.getValue(loc);
      if (value == 0) continue;
      grid.clearCell(loc);
      if (uniqueness.allowsRemoval(grid)) {
        ++removed;
      } else {
        grid.setCell(loc, value);
      }
    }
    return removed;
  }

  private static void seedBox(Grid grid, int box, Random random) {
    List<Integer> values = Lists.newArrayListWithCapacity(Location.SIZE);
    for (int value = 1; value <= Location.SIZE; ++value)
      values.add(value);
    Collections.shuffle(values, random);
    int top = Location.boxTop(box);
    int left = Location.boxLeft(box);
    for (int i = 0; i < Location.SIZE; ++i)
      grid.setCell(top + i / 3, left + i % 3, values.get(i));
  }
}
