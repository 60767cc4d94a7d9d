package tech.v2.lazyseq;

import clojure.lang.RT;
import java.util.Iterator;
import tech.v2.lazyseq.storage.ObjectStorage;


/**
 * One-pass producer paired with the cache of everything pulled from it.
 * Shared by a root sequence and every slice taken from it. Each item is
 * appended to the cache before anyone sees it, so the cache is always a
 * prefix of the producer's output.
 *
 * <p>As a {@link Sized} it reports the producer's total size, draining it
 * first.
 */
public class CachedProducer implements Sized
{
  final Iterator iter;
  final ObjectStorage cache;
  boolean exhausted;

  public CachedProducer(Iterator _iter, ObjectStorage _cache)
  {
    iter = _iter;
    cache = _cache;
    exhausted = false;
  }

  //Anything Clojure can iterate, plus bare iterators.
  public static Iterator iterOf(Object source)
  {
    if (source instanceof Iterator)
      return (Iterator) source;
    return RT.iter(source);
  }

  public long cached() { return cache.lsize(); }
  public Object cachedAt(long pos) { return cache.read(pos); }
  public ObjectStorage cache() { return cache; }
  //The raw producer. Items taken from it directly never reach the cache.
  public Iterator producer() { return iter; }

  public boolean pull()
  {
    if (exhausted)
      return false;
    if (!iter.hasNext()) {
      exhausted = true;
      return false;
    }
    cache.append(iter.next());
    return true;
  }

  //Pulls until pos is cached. False if the producer ends first.
  public boolean pullTo(long pos)
  {
    while (cache.lsize() <= pos) {
      if (!pull())
        return false;
    }
    return true;
  }

  public void fill()
  {
    while (pull());
  }

  public long lsize()
  {
    fill();
    return cache.lsize();
  }
}
