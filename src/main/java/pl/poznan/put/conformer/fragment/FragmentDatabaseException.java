package pl.poznan.put.conformer.fragment;

public class FragmentDatabaseException extends RuntimeException {
  public FragmentDatabaseException(String message) {
    super(message);
  }

  public FragmentDatabaseException(String message, Throwable cause) {
    super(message, cause);
  }
}
