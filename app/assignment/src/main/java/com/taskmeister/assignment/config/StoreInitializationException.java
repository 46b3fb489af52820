package com.taskmeister.assignment.config;

/** The store file could not be opened or migrated; the application cannot start. */
public class StoreInitializationException extends RuntimeException {

  public StoreInitializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
