package com.ospicorp.navseries.series.source;

public class RecordSourceException extends RuntimeException {

  public RecordSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
