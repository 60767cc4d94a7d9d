package tech.v2.lazyseq;

import clojure.lang.AFn;
import clojure.lang.ISeq;
import clojure.lang.Indexed;
import clojure.lang.RT;
import clojure.lang.Seqable;
import clojure.lang.Sequential;
import clojure.lang.Util;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectIterator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import tech.v2.lazyseq.storage.Storage;
import tech.v2.lazyseq.storage.StorageFactory;


/**
 * Sequence operations over a one-pass producer. Items are pulled on demand
 * and cached, and slices share the producer and cache of the sequence they
 * were taken from, so no item is ever requested twice.
 *
 * <p>Anything that needs the total size drains the producer first: length,
 * negative indices and bounds, and negative steps. An infinite producer only
 * works with forward, non-negative access.
 *
 * <p>From Clojure a sequence is callable ({@code (s 3)}, {@code (s 1 10 2)}),
 * {@code nth}-able, countable and seqable.
 */
public class LazySequence extends AFn implements Iterable, Sized, Sequential, Indexed, Seqable
{
  final CachedProducer producer;
  final Slice slice;

  public LazySequence(Object source)
  {
    this(source, Storage.defaultFactory());
  }
  public LazySequence(Object source, StorageFactory storage)
  {
    this(new CachedProducer(CachedProducer.iterOf(source), storage.create()),
         Slice.IDENTITY);
  }
  LazySequence(CachedProducer _producer, Slice _slice)
  {
    producer = _producer;
    slice = _slice;
  }

  public static LazySequence create(Object source, SequenceOptions options)
  {
    return new LazySequence(
      new CachedProducer(CachedProducer.iterOf(source), options.storage.create()),
      options.slice);
  }
  public static LazySequence create(Object source, Map options)
  {
    return create(source, SequenceOptions.parse(options));
  }
  public static LazySequence create(Object source, Long start, Long stop, long step)
  {
    return create(source, new SequenceOptions(Storage.defaultFactory(),
                                              new Slice(start, stop, step)));
  }

  public Slice getSlice() { return slice; }

  public ObjectIterator iterator()
  {
    if (slice.step > 0)
      return new ForwardIter(producer, slice.positive(producer));
    producer.fill();
    return new ReverseIter(producer.cache(), slice.reverse(producer));
  }

  /**
   * Iterates without caching anything else. Neither this sequence nor any
   * sequence sharing its producer may be used afterwards.
   */
  public ObjectIterator release()
  {
    if (slice.step > 0)
      return new ReleaseIter(producer, slice.positive(producer));
    producer.fill();
    return new ReverseIter(producer.cache(), slice.reverse(producer));
  }

  public boolean isEmpty()
  {
    return !iterator().hasNext();
  }

  public long lsize()
  {
    return slice.length(producer);
  }

  public Object read(long idx)
  {
    long logical = idx;
    if (logical < 0)
      logical += lsize();
    if (logical < 0)
      throw new IndexOutOfRangeException(idx);

    long pos = slice.resolve(logical, producer);
    if (!producer.pullTo(pos))
      throw new IndexOutOfRangeException(idx);
    return producer.cachedAt(pos);
  }

  public LazySequence slice(Slice child)
  {
    return new LazySequence(producer, slice.compose(child, producer));
  }
  public LazySequence slice(Long start, Long stop, long step)
  {
    return slice(new Slice(start, stop, step));
  }
  public LazySequence slice(Long start, Long stop)
  {
    return slice(new Slice(start, stop, 1));
  }

  public LazySequence reversed()
  {
    return slice(new Slice(null, null, -1));
  }

  //Equality is clojure.lang.Util/equiv, as with clojure collections.
  public long indexOf(Object item)
  {
    long idx = 0;
    for (Iterator iter = iterator(); iter.hasNext(); ++idx) {
      if (Util.equiv(iter.next(), item))
        return idx;
    }
    return -1;
  }

  public boolean contains(Object item)
  {
    return indexOf(item) != -1;
  }

  public long count(Object item)
  {
    long retval = 0;
    for (Iterator iter = iterator(); iter.hasNext();) {
      if (Util.equiv(iter.next(), item))
        ++retval;
    }
    return retval;
  }

  public List toList()
  {
    return new ObjectArrayList(iterator());
  }

  public Stream stream()
  {
    return StreamSupport.stream(
      Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
  }

  public int count()
  {
    return RT.intCast(lsize());
  }
  public Object nth(int idx)
  {
    return read(idx);
  }
  public Object nth(int idx, Object notFound)
  {
    try {
      return read(idx);
    }
    catch (IndexOutOfRangeException e) {
      return notFound;
    }
  }

  public ISeq seq()
  {
    return RT.chunkIteratorSeq(iterator());
  }

  public Object invoke(Object idx)
  {
    return read(RT.longCast(idx));
  }
  public Object invoke(Object start, Object stop)
  {
    return slice(toBound(start), toBound(stop));
  }
  public Object invoke(Object start, Object stop, Object step)
  {
    return slice(toBound(start), toBound(stop), step == null ? 1 : RT.longCast(step));
  }

  static Long toBound(Object value)
  {
    return value == null ? null : Long.valueOf(RT.longCast(value));
  }

  @Override
  public String toString()
  {
    return String.format("#lazy-sequence %s", slice);
  }
}
