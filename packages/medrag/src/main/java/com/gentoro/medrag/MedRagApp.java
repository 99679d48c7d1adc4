package com.gentoro.medrag;

public class MedRagApp {

  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(MedRagApp.class);

  public static void main(String[] args) {
    try {
      MedRag app = new MedRag(args);
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed", e);
      System.exit(1);
    }
  }
}
