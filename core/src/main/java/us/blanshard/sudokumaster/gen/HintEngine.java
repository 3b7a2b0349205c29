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

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokumaster.core.BacktrackingSolver;
import us.blanshard.sudokumaster.core.Grid;
import us.blanshard.sudokumaster.core.Location;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Reveals the value of a randomly chosen empty square, by solving a copy of
 * the grid.  The caller's grid is never modified.
 *
 * @author Luke Blanshard
 */
public final class HintEngine {
  private static final Logger logger = Logger.getLogger(HintEngine.class.getName());

  private final Random random;

  public HintEngine() {
    this(new Random());
  }

  public HintEngine(Random random) {
    this.random = checkNotNull(random);
  }

  /**
   * Returns a hint for the given grid, or nothing if the grid is full or can't
   * be solved as it stands.
   */
  public Optional<Hint> getHint(Grid grid) {
    List<Location> empty = grid.emptyLocations();
    if (empty.isEmpty()) return Optional.empty();

    Grid solution = grid.copy();
    if (!BacktrackingSolver.solve(solution)) {
      logger.fine("No hint: grid has no solution");
      return Optional.empty();
    }

    Location loc = empty.get(random.nextInt(empty.size()));
    return Optional.of(new Hint(loc, solution.getValue(loc)));
  }

  /** Returns the number of squares a hint could still reveal. */
  public int countAvailableHints(Grid grid) {
    return grid.emptyLocations().size();
  }
}
