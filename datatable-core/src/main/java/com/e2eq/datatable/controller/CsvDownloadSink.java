package com.e2eq.datatable.controller;

import java.io.IOException;

/**
 * Receives an exported file. Implementations decide how the content reaches the user
 * (an HTTP attachment, a file on disk, a browser save-as).
 */
@FunctionalInterface
public interface CsvDownloadSink {

   String CSV_MEDIA_TYPE = "text/csv;charset=utf-8";

   void deliver(String filename, String mediaType, String content) throws IOException;
}
