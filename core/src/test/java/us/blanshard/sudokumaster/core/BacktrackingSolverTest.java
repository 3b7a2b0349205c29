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

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.Collection;

@RunWith(Parameterized.class)
public class BacktrackingSolverTest {
  private final Grid start;
  private final RuleChecker.State state;
  private final String solution;
  private final int numSolutions;

  @Parameters public static Collection<Object[]> getParams() {
    return Arrays.asList(new Object[][]{
        { "...8.9..6.23.........6.8...7....1..2...45...9......6......7......1.46.....3......",  // Broken
          RuleChecker.State.BROKEN, null, 0 },
        { "12345678.........9...............................................................",  // No solution
          RuleChecker.State.INCOMPLETE, null, 0 },
        { "53..7....6..195....98....6.8...6...34..8.3..17...2...6.6....28....419..5....8..79",  // Unique solution
          RuleChecker.State.INCOMPLETE,
          "534678912672195348198342567859761423426853791713924856961537284287419635345286179", 1 },
        { "534678912672195348198342567859761423426853791713924856961537284287419635345286179",  // Already solved
          RuleChecker.State.SOLVED,
          "534678912672195348198342567859761423426853791713924856961537284287419635345286179", 1 },
        { ".................................................................................",  // Blank
          RuleChecker.State.INCOMPLETE,
          "123456789456789123789123456214365897365897214897214365531642978642978531978531642", 2 },
        { "..4678912672195348198342567859761423426853791713924856961537284287419635345286179",  // Two empty
          RuleChecker.State.INCOMPLETE,
          "534678912672195348198342567859761423426853791713924856961537284287419635345286179", 1 },
      });
  }

  public BacktrackingSolverTest(String start, RuleChecker.State state, String solution,
                                int numSolutions) {
    this.start = Grid.fromString(start);
    this.state = state;
    this.solution = solution;
    this.numSolutions = numSolutions;
  }

  @Test public void state() {
    assertEquals(state, RuleChecker.getState(start));
  }

  @Test public void solve() {
    Grid grid = start.copy();
    boolean solved = BacktrackingSolver.solve(grid);
    assertEquals(solution != null, solved);
    if (solved) {
      assertEquals(solution, grid.toFlatString());
      assertEquals(true, RuleChecker.isBoardSolved(grid));
      for (Location loc : Location.ALL) {
        if (start.isGiven(loc)) assertEquals(start.getValue(loc), grid.getValue(loc));
        assertEquals(start.isGiven(loc), grid.isGiven(loc));
      }
    }
  }

  @Test public void solve_isRepeatable() {
    Grid grid1 = start.copy();
    Grid grid2 = start.copy();
    assertEquals(BacktrackingSolver.solve(grid1), BacktrackingSolver.solve(grid2));
    if (solution != null) assertEquals(grid1, grid2);
  }

  @Test public void countSolutions() {
    Grid copy = start.copy();
    assertEquals(numSolutions, BacktrackingSolver.countSolutions(copy, 2));
    assertEquals(start, copy);
  }
}
