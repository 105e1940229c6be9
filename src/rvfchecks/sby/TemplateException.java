package rvfchecks.sby;

/**
 * A template or hook line references a placeholder that is not bound for the check being rendered.
 */
@SuppressWarnings("serial")
public class TemplateException extends RuntimeException {
  public TemplateException(String message) { super(message); }
}
