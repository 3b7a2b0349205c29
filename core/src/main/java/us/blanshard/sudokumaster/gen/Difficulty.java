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

import us.blanshard.sudokumaster.core.Location;

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableMap;

/**
 * How hard a generated puzzle should be, expressed as the number of squares
 * to take away from a solved grid.
 *
 * @author Luke Blanshard
 */
public enum Difficulty {
  EASY("Easy", 40),
  MEDIUM("Medium", 51),
  HARD("Hard", 56);

  private final String displayName;
  private final int cellsToRemove;

  private Difficulty(String displayName, int cellsToRemove) {
    this.displayName = displayName;
    this.cellsToRemove = cellsToRemove;
  }

  /** Returns a human-readable English name for this difficulty. */
  public String getName() {
    return displayName;
  }

  /** The removal target handed to {@link PuzzleGenerator#generate(int)}. */
  public int getCellsToRemove() {
    return cellsToRemove;
  }

  /** The number of givens a puzzle has when the removal target is met. */
  public int getClueCount() {
    return Location.COUNT - cellsToRemove;
  }

  private static final ImmutableMap<String, Difficulty> names;
  static {
    ImmutableMap.Builder<String, Difficulty> builder = ImmutableMap.builder();
    for (Difficulty d : values())
      builder.put(Ascii.toLowerCase(d.getName()), d);
    names = builder.build();
  }

  /**
   * Returns the difficulty whose {@linkplain #getName() name} is given,
   * ignoring case.
   *
   * @throws IllegalArgumentException   if the name doesn't match a Difficulty
   */
  public static Difficulty byName(String name) {
    String key = Ascii.toLowerCase(name);
    checkArgument(names.containsKey(key), "No difficulty named %s", name);
    return names.get(key);
  }
}
