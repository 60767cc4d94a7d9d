package tech.v2.lazyseq.storage;

import tech.v2.lazyseq.Sized;


//Append-only cache of produced items, read by pull order.
public interface ObjectStorage extends Sized
{
  Object read(long idx);
  void append(Object value);
}
