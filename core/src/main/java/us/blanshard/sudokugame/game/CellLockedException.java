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
package us.blanshard.sudokugame.game;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokugame.core.Location;

/**
 * Thrown when a move or hint targets one of the puzzle's clues.
 *
 * @author Luke Blanshard
 */
@SuppressWarnings("serial")
public class CellLockedException extends GameException {

  private final Location location;

  public CellLockedException(Location location) {
    super("Cell " + location + " is a clue and can't be changed");
    this.location = checkNotNull(location);
  }

  public Location getLocation() {
    return location;
  }
}
