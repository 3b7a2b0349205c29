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

import com.google.common.collect.Lists;

import java.util.Arrays;
import java.util.List;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A mutable Sudoku grid: 81 squares, each holding a value from 0 (empty) to 9,
 * and each either a given (a puzzle clue) or open to the player.
 *
 * <p> Which squares are givens is fixed when the grid is constructed: {@link
 * #fromString}, {@link #toPuzzle} and {@link #copy} are the only ways to get a
 * grid with givens, and no method changes them afterwards.  The public
 * mutators refuse to touch givens, and {@link #setCell} refuses values that
 * would break the rules.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Grid {

  private final byte[] squares;
  private final boolean[] givens;

  private Grid(byte[] squares, boolean[] givens) {
    this.squares = squares;
    this.givens = givens;
  }

  /** Returns a new grid with no values and no givens. */
  public static Grid blank() {
    return new Grid(new byte[Location.COUNT], new boolean[Location.COUNT]);
  }

  /** Returns an independent copy of this grid, givens included. */
  public Grid copy() {
    return new Grid(squares.clone(), givens.clone());
  }

  /**
   * Returns a new grid with this grid's values, in which every filled square
   * is a given.
   */
  public Grid toPuzzle() {
    boolean[] newGivens = new boolean[Location.COUNT];
    for (int i = 0; i < Location.COUNT; ++i)
      newGivens[i] = squares[i] != 0;
    return new Grid(squares.clone(), newGivens);
  }

  public Cell getCell(int row, int col) {
    return getCell(Location.of(row, col));
  }

  public Cell getCell(Location loc) {
    return new Cell(squares[loc.index], givens[loc.index]);
  }

  public int getValue(int row, int col) {
    return getValue(Location.of(row, col));
  }

  public int getValue(Location loc) {
    return squares[loc.index];
  }

  public boolean isGiven(int row, int col) {
    return isGiven(Location.of(row, col));
  }

  public boolean isGiven(Location loc) {
    return givens[loc.index];
  }

  /**
   * Sets the value of the given square, or clears it if the value is zero.
   * Returns false without changing anything if the square is a given or the
   * value conflicts with another square in its row, column or box.
   */
  public boolean setCell(int row, int col, int value) {
    return setCell(Location.of(row, col), value);
  }

  public boolean setCell(Location loc, int value) {
    checkValue(value);
    if (givens[loc.index]) return false;
    if (!RuleChecker.isPlacementLegal(this, loc, value)) return false;
    squares[loc.index] = (byte) value;
    return true;
  }

  /** Empties the given square, unless it is a given. */
  public void clearCell(int row, int col) {
    clearCell(Location.of(row, col));
  }

  public void clearCell(Location loc) {
    if (!givens[loc.index])
      squares[loc.index] = 0;
  }

  /** Empties every square that isn't a given. */
  public void clearEntries() {
    for (int i = 0; i < Location.COUNT; ++i)
      if (!givens[i]) squares[i] = 0;
  }

  /** Unchecked assignment for the solver, which does its own checking. */
  void put(int index, int value) {
    squares[index] = (byte) value;
  }

  /** Does every square have a value? */
  public boolean isFull() {
    for (byte square : squares)
      if (square == 0) return false;
    return true;
  }

  /** Returns the number of squares filled in. */
  public int size() {
    int answer = 0;
    for (byte square : squares)
      if (square != 0) ++answer;
    return answer;
  }

  /** Returns the number of givens. */
  public int givenCount() {
    int answer = 0;
    for (boolean given : givens)
      if (given) ++answer;
    return answer;
  }

  /** Returns the empty locations, in row-major order. */
  public List<Location> emptyLocations() {
    List<Location> answer = Lists.newArrayList();
    for (int i = 0; i < Location.COUNT; ++i)
      if (squares[i] == 0) answer.add(Location.of(i));
    return answer;
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Grid)) return false;
    Grid that = (Grid) object;
    return Arrays.equals(this.squares, that.squares) && Arrays.equals(this.givens, that.givens);
  }

  @Override public int hashCode() {
    return 31 * Arrays.hashCode(squares) + Arrays.hashCode(givens);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int row = 0; row < Location.SIZE; ++row) {
      for (int col = 0; col < Location.SIZE; ++col) {
        int value = squares[row * Location.SIZE + col];
        if (value != 0) sb.append(' ').append(value);
        else sb.append(" .");
        if (col == 2 || col == 5)
          sb.append(" |");
      }
      sb.append('\n');
      if (row == 2 || row == 5)
        sb.append("-------+-------+-------\n");
    }
    return sb.toString();
  }

  /**
   * Generates a string of 81 characters with dots for empty squares and
   * digits for filled ones.
   */
  public String toFlatString() {
    StringBuilder sb = new StringBuilder();
    for (byte square : squares)
      sb.append(square == 0 ? '.' : (char) ('0' + square));
    return sb.toString();
  }

  /**
   * Ignores all characters except digits and periods, requires there to be 81
   * total.  Every digit other than zero becomes a given.  The values are not
   * checked against the rules: see {@link RuleChecker#getState}.
   */
  public static Grid fromString(String s) {
    byte[] squares = new byte[Location.COUNT];
    int index = 0;
    for (char c : s.toCharArray()) {
      if (c >= '1' && c <= '9') {
        if (index < Location.COUNT) squares[index] = (byte) (c - '0');
        ++index;
      } else if (c == '0' || c == '.') {
        ++index;
      }
    }
    if (index != Location.COUNT) {
      throw new IllegalArgumentException(
          String.format("Grid.fromString requires 81 locations, got %d in %s", index, s));
    }
    return new Grid(squares, new boolean[Location.COUNT]).toPuzzle();
  }

  private static void checkValue(int value) {
    checkArgument(value >= 0 && value <= Location.SIZE, "value out of range: %s", value);
  }
}
