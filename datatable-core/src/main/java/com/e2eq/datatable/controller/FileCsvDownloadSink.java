package com.e2eq.datatable.controller;

import com.e2eq.datatable.util.ValidateUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes exported files into a directory, replacing a file of the same name.
 */
public class FileCsvDownloadSink implements CsvDownloadSink {
   private static final Logger LOG = Logger.getLogger(FileCsvDownloadSink.class);

   private final Path directory;

   public FileCsvDownloadSink(Path directory) {
      ValidateUtils.nonNullCheck(directory, "directory");
      this.directory = directory;
   }

   @Override
   public void deliver(String filename, String mediaType, String content) throws IOException {
      ValidateUtils.nonEmptyCheck(filename, "filename");
      Path target = directory.resolve(filename).normalize();
      if (!target.startsWith(directory.normalize())) {
         throw new IOException("Export file name " + filename + " points outside of " + directory);
      }
      Files.createDirectories(directory);
      Files.writeString(target, content, StandardCharsets.UTF_8);
      LOG.debugf("Wrote %d characters of %s to %s", content.length(), mediaType, target);
   }

   public Path getDirectory() {
      return directory;
   }
}
