package tech.v2.lazyseq;


public class InvalidStepException extends IllegalArgumentException
{
  public InvalidStepException()
  {
    super("slice step cannot be zero");
  }
}
