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

import static java.util.Arrays.asList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class GridTest {
  static final String CLASSIC =
      "53..7....6..195....98....6.8...6...34..8.3..17...2...6.6....28....419..5....8..79";

  @Test public void blank() {
    Grid grid = Grid.blank();
    assertEquals(0, grid.size());
    assertEquals(0, grid.givenCount());
    assertFalse(grid.isFull());
    assertEquals(Location.ALL, grid.emptyLocations());
    assertEquals(new Cell(0, false), grid.getCell(3, 3));
    assertTrue(grid.getCell(3, 3).isEmpty());
  }

  @Test public void setAndClear() {
    Grid grid = Grid.blank();
    assertTrue(grid.setCell(2, 5, 7));
    assertEquals(7, grid.getValue(2, 5));
    assertEquals(1, grid.size());
    assertFalse(grid.isGiven(2, 5));

    assertTrue(grid.setCell(2, 5, 7));  // Doesn't conflict with itself.
    assertTrue(grid.setCell(2, 5, 3));
    assertEquals(3, grid.getValue(2, 5));

    grid.clearCell(2, 5);
    assertEquals(0, grid.getValue(2, 5));
    assertTrue(grid.setCell(2, 5, 4));
    assertTrue(grid.setCell(2, 5, 0));
    assertEquals(0, grid.size());
  }

  @Test public void setCell_illegal() {
    Grid grid = Grid.blank();
    assertTrue(grid.setCell(0, 0, 5));
    assertFalse(grid.setCell(0, 8, 5));
    assertFalse(grid.setCell(8, 0, 5));
    assertFalse(grid.setCell(1, 1, 5));
    assertTrue(grid.setCell(1, 3, 5));
    assertEquals(2, grid.size());
  }

  @Test public void setCell_given() {
    Grid grid = Grid.fromString(CLASSIC);
    Grid before = grid.copy();
    String flat = grid.toFlatString();

    assertTrue(grid.isGiven(0, 0));
    assertFalse(grid.setCell(0, 0, 1));
    assertFalse(grid.setCell(0, 0, 5));
    assertFalse(grid.setCell(0, 0, 0));
    grid.clearCell(0, 0);

    assertEquals(before, grid);
    assertEquals(flat, grid.toFlatString());
    assertEquals(new Cell(5, true), grid.getCell(0, 0));
  }

  @Test(expected = IllegalArgumentException.class) public void setCell_badValue() {
    Grid.blank().setCell(0, 0, 10);
  }

  @Test public void fromString() {
    Grid grid = Grid.fromString(CLASSIC);
    assertEquals(30, grid.size());
    assertEquals(30, grid.givenCount());
    assertEquals(CLASSIC, grid.toFlatString());
    assertEquals(grid, Grid.fromString(grid.toString()));
    assertEquals(asList(Location.of(0, 2), Location.of(0, 3)), grid.emptyLocations().subList(0, 2));
  }

  @Test(expected = IllegalArgumentException.class) public void fromString_short() {
    Grid.fromString("123");
  }

  @Test(expected = IllegalArgumentException.class) public void fromString_long() {
    Grid.fromString(CLASSIC + "1");
  }

  @Test public void copy() {
    Grid grid = Grid.fromString(CLASSIC);
    Grid copy = grid.copy();
    assertNotSame(grid, copy);
    assertEquals(grid, copy);
    assertEquals(grid.hashCode(), copy.hashCode());

    assertTrue(copy.setCell(0, 2, 4));
    assertEquals(0, grid.getValue(0, 2));
    assertFalse(grid.equals(copy));
  }

  @Test public void toPuzzle() {
    Grid grid = Grid.blank();
    grid.setCell(4, 4, 9);
    Grid puzzle = grid.toPuzzle();
    assertFalse(grid.isGiven(4, 4));
    assertTrue(puzzle.isGiven(4, 4));
    assertEquals(1, puzzle.givenCount());
    assertFalse(grid.equals(puzzle));
    assertEquals(grid.toFlatString(), puzzle.toFlatString());
  }

  @Test public void clearEntries() {
    Grid grid = Grid.fromString(CLASSIC);
    grid.setCell(0, 2, 4);
    grid.setCell(8, 0, 3);
    assertEquals(32, grid.size());
    grid.clearEntries();
    assertEquals(Grid.fromString(CLASSIC), grid);
  }

  @Test public void isFull() {
    Grid grid = Grid.fromString(
        "534678912672195348198342567859761423426853791713924856961537284287419635345286179");
    assertTrue(grid.isFull());
    assertTrue(grid.emptyLocations().isEmpty());
  }
}
