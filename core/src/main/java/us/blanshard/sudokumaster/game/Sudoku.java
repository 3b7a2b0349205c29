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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.logging.Level.WARNING;

import us.blanshard.sudokumaster.core.Grid;
import us.blanshard.sudokumaster.core.Location;
import us.blanshard.sudokumaster.core.RuleChecker;
import us.blanshard.sudokumaster.gen.Difficulty;
import us.blanshard.sudokumaster.gen.Hint;
import us.blanshard.sudokumaster.gen.HintEngine;
import us.blanshard.sudokumaster.gen.PuzzleGenerator;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.Lists;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The Sudoku game state: the puzzle, the player's grid, the undo stack, the
 * statistics and the clock.  Moves are refused while the game is paused or
 * once it is solved.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Sudoku {
  private static final Logger logger = Logger.getLogger(Sudoku.class.getName());

  private final PuzzleGenerator generator;
  private final HintEngine hintEngine;
  private final Ticker ticker;
  private final UndoStack undoStack = new UndoStack();
  private final List<Listener> listeners = Lists.newArrayList();

  /** The initial clues. */
  private Grid puzzle;

  /** The grid the player is working on. */
  private Grid grid;

  @Nullable private Difficulty difficulty;
  private GameStats stats = new GameStats();

  /** The initial elapsed milliseconds; non-zero for restored games. */
  private long initialMillis;

  /** The object keeping track of further elapsed time. */
  private Stopwatch stopwatch;

  private boolean solved;

  public Sudoku(PuzzleGenerator generator, HintEngine hintEngine) {
    this(generator, hintEngine, Ticker.systemTicker());
  }

  Sudoku(PuzzleGenerator generator, HintEngine hintEngine, Ticker ticker) {
    this.generator = checkNotNull(generator);
    this.hintEngine = checkNotNull(hintEngine);
    this.ticker = checkNotNull(ticker);
  }

  /** Starts a new game with a freshly generated puzzle. */
  public Sudoku newGame(Difficulty difficulty) {
    Grid puzzle = generator.generate(difficulty);
    logger.info("New " + difficulty.getName() + " game with " + puzzle.givenCount() + " givens");
    return start(puzzle, puzzle.copy(), difficulty, 0, new GameStats());
  }

  /** Starts a new game with the given puzzle, whose filled squares all become givens. */
  public Sudoku newGame(Grid puzzle) {
    Grid clues = puzzle.toPuzzle();
    return start(clues, clues.copy(), null, 0, new GameStats());
  }

  /** Picks up a saved game where it left off.  The game starts paused. */
  Sudoku restore(Grid puzzle, Grid grid, @Nullable Difficulty difficulty, long elapsedMillis,
                 GameStats stats) {
    start(puzzle, grid, difficulty, elapsedMillis, stats);
    return pause();
  }

  private Sudoku start(Grid puzzle, Grid grid, @Nullable Difficulty difficulty,
                       long initialMillis, GameStats stats) {
    this.puzzle = puzzle;
    this.grid = grid;
    this.difficulty = difficulty;
    this.initialMillis = initialMillis;
    this.stats = checkNotNull(stats);
    this.stopwatch = Stopwatch.createStarted(ticker);
    this.solved = false;
    undoStack.clear();
    for (Listener listener : listeners)
      listener.gameStarted(this);
    checkSolved();
    return this;
  }

  public void addListener(Listener listener) {
    listeners.add(checkNotNull(listener));
  }

  public void removeListener(Listener listener) {
    listeners.remove(listener);
  }

  public boolean hasGame() {
    return grid != null;
  }

  /** Returns a copy of the puzzle's clues. */
  public Grid getPuzzle() {
    checkGame();
    return puzzle.copy();
  }

  /** Returns a copy of the player's grid. */
  public Grid getGrid() {
    checkGame();
    return grid.copy();
  }

  @Nullable public Difficulty getDifficulty() {
    return difficulty;
  }

  public GameStats getStats() {
    return stats;
  }

  /**
   * Puts the given value in the given square, or clears it if the value is
   * zero.  Returns false, and counts an invalid move, if the square is a given
   * or the value breaks the rules.
   *
   * @throws IllegalArgumentException   if the value is outside 0..9
   */
  public boolean set(int row, int col, int value) {
    checkArgument(value >= 0 && value <= Location.SIZE, "value out of range: %s", value);
    if (value == 0) return clear(row, col);
    Location loc = Location.of(row, col);
    if (!isRunning()) return false;
    if (grid.isGiven(loc) || !RuleChecker.isPlacementLegal(grid, loc, value)) {
      stats.recordInvalidMove();
      return false;
    }
    if (!execute(CellCommand.set(grid, loc, value))) return false;
    stats.recordMove();
    return true;
  }

  /** Empties the given square.  Returns false if it is a given or already empty. */
  public boolean clear(int row, int col) {
    Location loc = Location.of(row, col);
    if (!isRunning()) return false;
    if (grid.isGiven(loc)) {
      stats.recordInvalidMove();
      return false;
    }
    if (grid.getValue(loc) == 0) return false;
    if (!execute(CellCommand.clear(grid, loc))) return false;
    stats.recordMove();
    return true;
  }

  /**
   * Fills in one empty square with its correct value, undoably.  Returns the
   * hint applied, or nothing if the grid is full or has no solution.
   */
  public Optional<Hint> hint() {
    if (!isRunning()) return Optional.empty();
    Optional<Hint> hint = hintEngine.getHint(grid);
    if (hint.isPresent()) {
      if (!execute(CellCommand.set(grid, hint.get().location, hint.get().value)))
        return Optional.empty();
      stats.recordHint();
    }
    return hint;
  }

  public boolean canUndo() {
    return isRunning() && undoStack.canUndo();
  }

  public boolean canRedo() {
    return isRunning() && undoStack.canRedo();
  }

  /** Undoes the last command, returns false if there was nothing to undo. */
  public boolean undo() {
    if (!canUndo()) return false;
    try {
      CellCommand command = undoStack.undo();
      stats.recordUndo();
      for (Listener listener : listeners)
        listener.commandUndone(this, command);
      return true;
    } catch (CommandException e) {
      logger.log(WARNING, "Undo failed", e);
      return false;
    }
  }

  /** Redoes the last undone command, returns false if there was nothing to redo. */
  public boolean redo() {
    if (!canRedo()) return false;
    try {
      CellCommand command = undoStack.redo();
      stats.recordRedo();
      for (Listener listener : listeners)
        listener.commandRedone(this, command);
      checkSolved();
      return true;
    } catch (CommandException e) {
      logger.log(WARNING, "Redo failed", e);
      return false;
    }
  }

  /** Empties every square the player has filled in, as a fresh start on the same puzzle. */
  public Sudoku restart() {
    checkGame();
    Grid fresh = puzzle.copy();
    return start(puzzle, fresh, difficulty, 0, new GameStats());
  }

  /** Tells whether the game is accepting moves. */
  public boolean isRunning() {
    return grid != null && !solved && stopwatch.isRunning();
  }

  public boolean isPaused() {
    return grid != null && !solved && !stopwatch.isRunning();
  }

  public boolean isSolved() {
    return solved;
  }

  /** Stops the clock.  No moves are possible while the game is paused. */
  public Sudoku pause() {
    checkGame();
    if (stopwatch.isRunning())
      stopwatch.stop();
    return this;
  }

  /** Restarts the clock after a pause. */
  public Sudoku resume() {
    checkGame();
    if (!stopwatch.isRunning() && !solved)
      stopwatch.start();
    return this;
  }

  /** Returns the total elapsed time in milliseconds. */
  public long elapsedMillis() {
    return stopwatch == null ? 0 : initialMillis + stopwatch.elapsed(MILLISECONDS);
  }

  /** Returns the elapsed time as MM:SS. */
  public String formattedTime() {
    long seconds = elapsedMillis() / 1000;
    return String.format("%02d:%02d", seconds / 60, seconds % 60);
  }

  private boolean execute(CellCommand command) {
    try {
      undoStack.doCommand(command);
    } catch (CommandException e) {
      logger.log(WARNING, "Command failed: " + command, e);
      return false;
    }
    for (Listener listener : listeners)
      listener.moveMade(this, command);
    checkSolved();
    return true;
  }

  private void checkSolved() {
    if (!solved && RuleChecker.isBoardSolved(grid)) {
      solved = true;
      if (stopwatch.isRunning())
        stopwatch.stop();
      logger.info("Solved in " + formattedTime() + ": " + stats);
      for (Listener listener : listeners)
        listener.gameSolved(this);
    }
  }

  private void checkGame() {
    checkState(grid != null, "No game in progress");
  }

  /**
   * A callback interface for interested parties to find out what's going on in
   * a Sudoku.
   */
  public interface Listener {
    /** Called when a new game has begun, or a saved one restored. */
    void gameStarted(Sudoku game);

    /** Called when a set, clear or hint has been applied. */
    void moveMade(Sudoku game, CellCommand command);

    /** Called when a command has been undone. */
    void commandUndone(Sudoku game, CellCommand command);

    /** Called when a command has been redone. */
    void commandRedone(Sudoku game, CellCommand command);

    /** Called when the grid becomes completely and correctly filled in. */
    void gameSolved(Sudoku game);
  }

  /**
   * A null implementation of {@link Listener} so you can have a listener
   * without having to implement every method.
   */
  public static class Adapter implements Listener {
    @Override public void gameStarted(Sudoku game) {}
    @Override public void moveMade(Sudoku game, CellCommand command) {}
    @Override public void commandUndone(Sudoku game, CellCommand command) {}
    @Override public void commandRedone(Sudoku game, CellCommand command) {}
    @Override public void gameSolved(Sudoku game) {}
  }
}
