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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import us.blanshard.sudokumaster.core.Grid;
import us.blanshard.sudokumaster.gen.HintEngine;
import us.blanshard.sudokumaster.gen.PuzzleGenerator;

import com.google.common.base.Ticker;

import java.util.Random;

public class Fixtures {
  private static final long SEED = 123;

  static final String SOLUTION =
      "534678912672195348198342567859761423426853791713924856961537284287419635345286179";

  static final Grid puzzle = Grid.fromString(
      "53..7....6..195....98....6.8...6...34..8.3..17...2...6.6....28....419..5....8..79");

  /** The same puzzle with just (0, 2) and (0, 3) left open. */
  static final Grid almostSolved = Grid.fromString(
      "53..78912672195348198342567859761423426853791713924856961537284287419635345286179");

  /** A ticker that only moves when told to. */
  static class ManualTicker extends Ticker {
    private long nanos;

    @Override public long read() {
      return nanos;
    }

    void advanceMillis(long millis) {
      nanos += MILLISECONDS.toNanos(millis);
    }
  }

  static Sudoku makeGame(Ticker ticker) {
    return new Sudoku(
        new PuzzleGenerator(new Random(SEED)), new HintEngine(new Random(SEED)), ticker);
  }

  static Sudoku makeGame(Grid puzzle) {
    return makeGame(puzzle, new ManualTicker());
  }

  static Sudoku makeGame(Grid puzzle, Ticker ticker) {
    return makeGame(ticker).newGame(puzzle);
  }
}
