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
package us.blanshard.sudokugame.stats;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import us.blanshard.sudokugame.core.Location;
import us.blanshard.sudokugame.game.GameSession;
import us.blanshard.sudokugame.game.Score;
import us.blanshard.sudokugame.gen.BoardGenerator;
import us.blanshard.sudokugame.gen.Difficulty;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.junit.Test;

import java.util.Random;

public class GameRecordJsonTest {

  static GameRecord finishedRecord(long finishedAtMillis) throws Exception {
    GameSession game = GameSession.newSession(Difficulty.EASY, new BoardGenerator(new Random(9)));
    for (Location loc : Location.ALL) {
      if (!game.isFixed(loc) && loc.index % 2 == 0)
        game.setValue(loc, game.useHelp(loc));
    }
    Score score = game.finishGame(600, Difficulty.EASY.getTimeLimitSeconds());
    return GameRecord.of(game, score, finishedAtMillis);
  }

  @Test public void roundTrip() throws Exception {
    GameRecord record = finishedRecord(1234567890123L);
    GameRecord copy = GameRecordJson.fromJson(GameRecordJson.toJson(record));
    assertEquals(record, copy);
    assertSame(Difficulty.EASY, copy.getDifficulty());
    assertEquals(record.getScore().getScore(), copy.getScore().getScore());
    assertEquals(record.getScore().getTimeBonus(), copy.getScore().getTimeBonus());
  }

  @Test public void gridsAreFlatStrings() throws Exception {
    GameRecord record = finishedRecord(0);
    JsonObject json = JsonParser.parseString(GameRecordJson.toJson(record)).getAsJsonObject();
    assertEquals(record.getSolution().toFlatString(), json.get("solution").getAsString());
    assertEquals(record.getPuzzle().toFlatString(), json.get("puzzle").getAsString());
    assertEquals(record.getBoard().toFlatString(), json.get("board").getAsString());
    assertEquals("EASY", json.get("difficulty").getAsString());
    assertEquals(record.getScore().getScore(),
                 json.getAsJsonObject("score").get("score").getAsLong());
  }

  @Test public void badGrid() throws Exception {
    JsonObject json = JsonParser.parseString(
        GameRecordJson.toJson(finishedRecord(0))).getAsJsonObject();
    json.addProperty("board", "123");
    try {
      GameRecordJson.fromJson(json.toString());
      fail();
    } catch (JsonParseException expected) {
    }
  }

  @Test(expected = IllegalArgumentException.class) public void unfinishedGame() throws Exception {
    GameSession game = GameSession.newSession(Difficulty.HARD, new BoardGenerator(new Random(9)));
    GameRecord.of(game, Score.compute(0, 0, 0, 0, 0, false));
  }
}
