package pl.poznan.put.conformer.fragment;

public class EmptyFragmentPoolException extends RuntimeException {
  private final String pattern;

  public EmptyFragmentPoolException(String pattern) {
    super("No fragment matches the secondary structure pattern: " + pattern);
    this.pattern = pattern;
  }

  public String getPattern() {
    return pattern;
  }
}
