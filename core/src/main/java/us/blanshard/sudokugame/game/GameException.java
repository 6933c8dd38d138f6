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

/**
 * The base class for the recoverable errors a {@link GameSession} reports.
 *
 * @author Luke Blanshard
 */
@SuppressWarnings("serial")
public abstract class GameException extends Exception {
  protected GameException(String message) {
    super(message);
  }
}
