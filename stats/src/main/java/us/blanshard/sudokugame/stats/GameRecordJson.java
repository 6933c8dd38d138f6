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

import us.blanshard.sudokugame.core.Grid;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/**
 * Static methods that convert game records to and from json.  Grids are
 * written as their 81-character flat strings.
 *
 * @author Luke Blanshard
 */
public class GameRecordJson {

  /** A convenience for reading/writing records. */
  public static final Gson GSON = register(new GsonBuilder()).setPrettyPrinting().create();

  /**
   * Registers type adapters in the given builder so that game records can be
   * serialized and deserialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    builder.registerTypeAdapter(Grid.class, new TypeAdapter<Grid>() {
      @Override public void write(JsonWriter out, Grid value) throws IOException {
        out.value(value.toFlatString());
      }
      @Override public Grid read(JsonReader in) throws IOException {
        String flat = in.nextString();
        try {
          return Grid.fromString(flat);
        } catch (IllegalArgumentException e) {
          throw new JsonParseException("Bad grid: " + flat, e);
        }
      }
    });
    return builder;
  }

  public static String toJson(GameRecord record) {
    return GSON.toJson(record);
  }

  public static GameRecord fromJson(String json) {
    return GSON.fromJson(json, GameRecord.class);
  }
}
