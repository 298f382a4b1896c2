package pl.poznan.put.conformer.geometry;

public class InvalidGeometryInputException extends IllegalArgumentException {
  public InvalidGeometryInputException(String message) {
    super(message);
  }
}
