package tech.v2.lazyseq;

import it.unimi.dsi.fastutil.objects.ObjectIterator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import tech.v2.lazyseq.storage.ObjectStorage;


/**
 * Walks a positive step slice over what is already cached and then straight
 * off the producer. Items read from the producer are not cached, so the
 * producer and cache are spent once this iterator has been used.
 */
public class ReleaseIter implements ObjectIterator
{
  final ObjectStorage cache;
  final Iterator iter;
  final long num_cached;
  final Long stop;
  final long step;
  long pos;
  //Position of the next item the producer will hand out.
  long consumed;
  boolean ready;
  boolean done;
  Object current;
  public ReleaseIter(CachedProducer _producer, Slice _slice)
  {
    cache = _producer.cache();
    iter = _producer.producer();
    num_cached = cache.lsize();
    stop = _slice.stop;
    step = _slice.step;
    pos = _slice.start == null ? 0 : _slice.start;
    consumed = num_cached;
    ready = false;
  }
  public boolean hasNext()
  {
    if (ready)
      return true;
    if (done || (stop != null && pos >= stop))
      return false;
    if (pos < num_cached) {
      current = cache.read(pos);
      ready = true;
      return true;
    }
    while (consumed < pos) {
      if (!iter.hasNext())
        return false;
      iter.next();
      ++consumed;
    }
    if (!iter.hasNext())
      return false;
    current = iter.next();
    ++consumed;
    ready = true;
    return true;
  }
  public Object next()
  {
    if (!hasNext())
      throw new NoSuchElementException();
    Object retval = current;
    current = null;
    ready = false;
    if (pos > Long.MAX_VALUE - step)
      done = true;
    else
      pos += step;
    return retval;
  }
}
