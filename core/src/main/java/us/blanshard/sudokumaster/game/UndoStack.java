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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A stack of {@linkplain CellCommand commands} that can be undone or redone.
 * Commands below the current position are the history; those at or above it
 * are available for redo, and are discarded when a new command is done.  When
 * the stack is full the oldest command is dropped.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public class UndoStack {

  /** The default maximum number of commands kept. */
  public static final int DEFAULT_CAPACITY = 100;

  final List<CellCommand> commands = Lists.newArrayList();
  private final int capacity;
  private int position;

  public UndoStack() {
    this(DEFAULT_CAPACITY);
  }

  public UndoStack(int capacity) {
    checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.capacity = capacity;
  }

  public List<CellCommand> getCommands() {
    return Collections.unmodifiableList(commands);
  }

  public int getPosition() {
    return position;
  }

  public int getCapacity() {
    return capacity;
  }

  /** Returns the command last performed, either redone (if forward) or undone. */
  public CellCommand getLastCommand(boolean forward) {
    checkState(forward ? canUndo() : canRedo());
    return commands.get(forward ? position - 1 : position);
  }

  /** Pushes the given command on the stack, and executes it. */
  public void doCommand(CellCommand command) throws CommandException {
    command.redo();  // Execute first, so an exception won't affect the stack.
    if (position < commands.size()) commands.subList(position, commands.size()).clear();
    commands.add(command);
    if (commands.size() > capacity) commands.remove(0);
    position = commands.size();
  }

  /** Tells whether there is a command available to be undone. */
  public boolean canUndo() {
    return position > 0;
  }

  /** Undoes the previous command, and returns it. */
  public CellCommand undo() throws CommandException {
    checkState(canUndo());
    CellCommand command = commands.get(position - 1);
    command.undo();
    // Decrement after undoing so an exception won't affect the stack.
    --position;
    return command;
  }

  /** Tells whether there is a command available to be redone. */
  public boolean canRedo() {
    return position < commands.size();
  }

  /** Redoes the next command, and returns it. */
  public CellCommand redo() throws CommandException {
    checkState(canRedo());
    CellCommand command = commands.get(position);
    command.redo();
    // Increment after redoing so an exception won't affect the stack.
    ++position;
    return command;
  }

  /** Forgets all commands. */
  public void clear() {
    commands.clear();
    position = 0;
  }

  /** Returns the description of the command that undo would undo, or "". */
  public String getLastDescription() {
    return canUndo() ? commands.get(position - 1).getDescription() : "";
  }
}
