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

import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Logger;

/**
 * Saves game records as json files, one per game, in a single directory.
 * Files are named for the time the game finished.
 *
 * @author Luke Blanshard
 */
public final class StatisticsWriter {
  private static final Logger logger = Logger.getLogger(StatisticsWriter.class.getName());

  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final File directory;
  private final ZoneId zone;

  public StatisticsWriter(File directory) {
    this(directory, ZoneId.systemDefault());
  }

  public StatisticsWriter(File directory, ZoneId zone) {
    this.directory = checkNotNull(directory);
    this.zone = checkNotNull(zone);
  }

  public File getDirectory() {
    return directory;
  }

  /** Returns the name of the file the given record would be saved in. */
  public String fileName(GameRecord record) {
    return "sudoku_" + STAMP.format(Instant.ofEpochMilli(record.getFinishedAtMillis()).atZone(zone))
        + ".json";
  }

  /**
   * Writes the given record, creating the directory if need be.  A record
   * finishing in the same second as an earlier one gets a numbered name
   * rather than replacing it.
   *
   * @return the file written
   */
  public File write(GameRecord record) throws IOException {
    File file = new File(directory, fileName(record));
    Files.createParentDirs(file);
    String base = file.getName().substring(0, file.getName().length() - ".json".length());
    for (int n = 2; file.exists(); ++n)
      file = new File(directory, base + "_" + n + ".json");

    Files.asCharSink(file, UTF_8).write(GameRecordJson.toJson(record));
    logger.info("Saved game statistics to " + file);
    return file;
  }

  /** Reads back a record written by {@link #write}. */
  public static GameRecord read(File file) throws IOException {
    return GameRecordJson.fromJson(Files.asCharSource(file, UTF_8).read());
  }
}
