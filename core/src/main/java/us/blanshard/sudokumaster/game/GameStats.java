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

import com.google.common.base.Joiner;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Counts what the player has done in the current game.
 */
@NotThreadSafe
public final class GameStats {
  private static final Joiner LINES = Joiner.on('\n');

  private int moves;
  private int undos;
  private int redos;
  private int hintsUsed;
  private int invalidMoves;

  public void recordMove() { ++moves; }
  public void recordUndo() { ++undos; }
  public void recordRedo() { ++redos; }
  public void recordHint() { ++hintsUsed; }
  public void recordInvalidMove() { ++invalidMoves; }

  public void reset() {
    moves = undos = redos = hintsUsed = invalidMoves = 0;
  }

  public int getMoves() { return moves; }
  public int getUndos() { return undos; }
  public int getRedos() { return redos; }
  public int getHintsUsed() { return hintsUsed; }
  public int getInvalidMoves() { return invalidMoves; }

  /** Moves, undos and redos together. */
  public int getTotalActions() {
    return moves + undos + redos;
  }

  public String getSummary() {
    return LINES.join(
        "Moves: " + moves,
        "Undos: " + undos,
        "Redos: " + redos,
        "Hints: " + hintsUsed,
        "Invalid Moves: " + invalidMoves,
        "Total Actions: " + getTotalActions());
  }

  @Override public String toString() {
    return getSummary().replace('\n', ' ');
  }
}
