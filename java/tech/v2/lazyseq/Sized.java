package tech.v2.lazyseq;


//Total number of items, possibly discovered on demand.
public interface Sized
{
  long lsize();
}
