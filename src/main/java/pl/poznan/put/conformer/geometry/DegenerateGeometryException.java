package pl.poznan.put.conformer.geometry;

public class DegenerateGeometryException extends RuntimeException {
  public DegenerateGeometryException(String message) {
    super(message);
  }
}
