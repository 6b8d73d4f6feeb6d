package polyc.hir;

/**
* Thrown when the input lies outside what the generator can express, for
* example an access relation that is not single-valued or a description
* line that does not parse.
*/
public class UnsupportedInput extends RuntimeException
{
  private static final long serialVersionUID = 1;

  public UnsupportedInput()
  {
    super();
  }

  public UnsupportedInput(String message)
  {
    super(message);
  }

  public UnsupportedInput(String message, Throwable cause)
  {
    super(message, cause);
  }
}
