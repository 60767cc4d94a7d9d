package tech.v2.lazyseq;

import it.unimi.dsi.fastutil.objects.ObjectIterator;
import java.util.NoSuchElementException;


//Walks a positive step slice, pulling into the shared cache as it goes.
public class ForwardIter implements ObjectIterator
{
  final CachedProducer producer;
  final Long stop;
  final long step;
  long pos;
  //Set once the next position would not fit in a long.
  boolean done;
  public ForwardIter(CachedProducer _producer, Slice _slice)
  {
    producer = _producer;
    stop = _slice.stop;
    step = _slice.step;
    pos = _slice.start == null ? 0 : _slice.start;
  }
  public boolean hasNext()
  {
    if (done || (stop != null && pos >= stop))
      return false;
    return producer.pullTo(pos);
  }
  public Object next()
  {
    if (!hasNext())
      throw new NoSuchElementException();
    Object retval = producer.cachedAt(pos);
    if (pos > Long.MAX_VALUE - step)
      done = true;
    else
      pos += step;
    return retval;
  }
}
