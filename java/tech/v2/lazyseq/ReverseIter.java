package tech.v2.lazyseq;

import it.unimi.dsi.fastutil.objects.ObjectIterator;
import java.util.NoSuchElementException;
import tech.v2.lazyseq.storage.ObjectStorage;


//Strides a fully drained cache from the end, using the reversed slice.
public class ReverseIter implements ObjectIterator
{
  final ObjectStorage cache;
  final long num_elems;
  final long end;
  final long step;
  long pos;
  boolean done;
  public ReverseIter(ObjectStorage _cache, Slice _reversed)
  {
    cache = _cache;
    num_elems = _cache.lsize();
    end = _reversed.stop == null ? num_elems : Math.min(num_elems, _reversed.stop);
    step = _reversed.step;
    pos = _reversed.start == null ? 0 : _reversed.start;
  }
  public boolean hasNext() { return !done && pos < end; }
  public Object next()
  {
    if (!hasNext())
      throw new NoSuchElementException();
    Object retval = cache.read(num_elems - 1 - pos);
    if (pos > Long.MAX_VALUE - step)
      done = true;
    else
      pos += step;
    return retval;
  }
}
