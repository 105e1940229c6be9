package rvfchecks.config;

/**
 * Raised for any user-caused error in the check configuration. Generation cannot continue past it.
 */
@SuppressWarnings("serial")
public class ConfigException extends Exception {
  public ConfigException(String message) { super(message); }
  public ConfigException(String message, Throwable cause) { super(message, cause); }
}
