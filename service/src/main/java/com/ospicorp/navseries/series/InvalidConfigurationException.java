package com.ospicorp.navseries.series;

public class InvalidConfigurationException extends RuntimeException {
  private static final String ERROR_DOCS_BASE = "https://docs.nav-series.dev/errors/";

  private final int errorCode;
  private final String moreInfo;

  public InvalidConfigurationException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = ERROR_DOCS_BASE + errorCode;
  }

  public static InvalidConfigurationException nonPositiveMaxPoints(int maxPoints) {
    return new InvalidConfigurationException(
        "Invalid maxPoints " + maxPoints + ". Must be greater than or equal to 1.", 2001);
  }

  public static InvalidConfigurationException unknownStrategy(String name) {
    return new InvalidConfigurationException(
        "Invalid sampling strategy '" + name + "'. Supported values: uniform,recent,smart.", 2002);
  }

  public static InvalidConfigurationException missingStrategy() {
    return new InvalidConfigurationException(
        "Sampling strategy must be provided. Supported values: uniform,recent,smart.", 2003);
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
