package com.bulkload;

import org.apache.hadoop.util.ProgramDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Jar entry point. {@code bulk -D key=value ...} runs {@link BulkLoader}. */
public class App {

  private static final Logger LOG = LoggerFactory.getLogger(App.class);

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    ProgramDriver programs = new ProgramDriver();
    try {
      programs.addClass(
        "bulk",
        BulkLoader.class,
        "load rdf or json input into sharded output stores"
      );
      return programs.run(args);
    } catch (Throwable t) {
      LOG.error("Unable to run {}", args.length > 0 ? args[0] : "program", t);
      return -1;
    }
  }
}
