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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A location on a Sudoku grid.  Rows, columns and boxes are all zero-based;
 * boxes are numbered left to right, top to bottom.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Location implements Comparable<Location> {

  /** The number of rows, columns, boxes, and numerals. */
  public static final int SIZE = 9;

  /** The number of distinct locations. */
  public static final int COUNT = SIZE * SIZE;

  public final int row;
  public final int column;
  public final int box;

  /** A number in the range [0, COUNT), row-major. */
  public final int index;

  public static Location of(int row, int column) {
    checkElementIndex(row, SIZE, "row");
    checkElementIndex(column, SIZE, "column");
    return instances[row * SIZE + column];
  }

  public static Location of(int index) {
    checkElementIndex(index, COUNT, "index");
    return instances[index];
  }

  /** All locations, in row-major order. */
  public static final List<Location> ALL;

  /** The 27 units: 9 rows, then 9 columns, then 9 boxes. */
  public static final ImmutableList<ImmutableList<Location>> UNITS;

  /** Returns the index of the top row of the given box. */
  public static int boxTop(int box) {
    return box / 3 * 3;
  }

  /** Returns the index of the leftmost column of the given box. */
  public static int boxLeft(int box) {
    return box % 3 * 3;
  }

  @Override public int compareTo(Location that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row, column);
  }

  private Location(int index) {
    this.index = index;
    this.row = index / SIZE;
    this.column = index % SIZE;
    this.box = row / 3 * 3 + column / 3;
  }

  private static final Location[] instances;
  static {
    instances = new Location[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Location(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));

    ImmutableList.Builder<ImmutableList<Location>> rows = ImmutableList.builder();
    ImmutableList.Builder<ImmutableList<Location>> columns = ImmutableList.builder();
    ImmutableList.Builder<ImmutableList<Location>> boxes = ImmutableList.builder();
    for (int i = 0; i < SIZE; ++i) {
      ImmutableList.Builder<Location> row = ImmutableList.builder();
      ImmutableList.Builder<Location> column = ImmutableList.builder();
      ImmutableList.Builder<Location> box = ImmutableList.builder();
      for (int j = 0; j < SIZE; ++j) {
        row.add(instances[i * SIZE + j]);
        column.add(instances[j * SIZE + i]);
        box.add(instances[(boxTop(i) + j / 3) * SIZE + boxLeft(i) + j % 3]);
      }
      rows.add(row.build());
      columns.add(column.build());
      boxes.add(box.build());
    }
    UNITS = ImmutableList.<ImmutableList<Location>>builder()
        .addAll(rows.build())
        .addAll(columns.build())
        .addAll(boxes.build())
        .build();
  }
}
