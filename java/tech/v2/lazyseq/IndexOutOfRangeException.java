package tech.v2.lazyseq;


public class IndexOutOfRangeException extends IndexOutOfBoundsException
{
  public IndexOutOfRangeException()
  {
    super("lazy sequence index out of range");
  }
  public IndexOutOfRangeException(long idx)
  {
    super(String.format("lazy sequence index out of range: %d", idx));
  }
}
