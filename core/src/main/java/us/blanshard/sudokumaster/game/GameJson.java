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

import us.blanshard.sudokumaster.core.Grid;
import us.blanshard.sudokumaster.core.Location;
import us.blanshard.sudokumaster.gen.Difficulty;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

import javax.annotation.Nullable;

/**
 * Static methods that convert {@link Sudoku} games to and from json, so a
 * game in progress can be saved and picked up later.
 *
 * @author Luke Blanshard
 */
public class GameJson {

  /** A convenience for reading/writing saved games. */
  public static final Gson GSON = register(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that saved games can be
   * serialized and deserialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    builder.registerTypeAdapter(Grid.class, new TypeAdapter<Grid>() {
      @Override public void write(JsonWriter out, Grid value) throws IOException {
        if (value == null) out.nullValue();
        else out.value(value.toFlatString());
      }
      @Override public Grid read(JsonReader in) throws IOException {
        try {
          return Grid.fromString(in.nextString());
        } catch (IllegalArgumentException e) {
          throw new JsonParseException(e);
        }
      }
    });
    return builder;
  }

  /** The json form of a game in progress. */
  static class SavedGame {
    Grid puzzle;
    String entries;
    @Nullable Difficulty difficulty;
    long elapsedMillis;
    GameStats stats;
  }

  /** Renders the given game's current state as json. */
  public static String toJson(Sudoku game) {
    SavedGame saved = new SavedGame();
    saved.puzzle = game.getPuzzle();
    saved.entries = game.getGrid().toFlatString();
    saved.difficulty = game.getDifficulty();
    saved.elapsedMillis = game.elapsedMillis();
    saved.stats = game.getStats();
    return GSON.toJson(saved);
  }

  /**
   * Replaces the given game's state with the one saved in the given json.  The
   * restored game is paused.
   *
   * @throws JsonParseException   if the json is malformed
   * @throws IllegalArgumentException   if the entries don't fit the puzzle
   */
  public static Sudoku restore(Sudoku game, String json) {
    SavedGame saved = GSON.fromJson(json, SavedGame.class);
    if (saved == null || saved.puzzle == null || saved.entries == null)
      throw new JsonParseException("Incomplete saved game: " + json);
    Grid grid = saved.puzzle.copy();
    Grid entries = Grid.fromString(saved.entries);
    for (Location loc : Location.ALL) {
      int value = entries.getValue(loc);
      if (saved.puzzle.isGiven(loc)) {
        checkArgument(value == saved.puzzle.getValue(loc), "Entry at %s contradicts puzzle", loc);
      } else if (value != 0) {
        checkArgument(grid.setCell(loc, value), "Illegal entry %s at %s", value, loc);
      }
    }
    GameStats stats = saved.stats == null ? new GameStats() : saved.stats;
    return game.restore(saved.puzzle, grid, saved.difficulty, saved.elapsedMillis, stats);
  }
}
