package tech.v2.lazyseq;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;


//Test fixtures: integer ranges, a producer that counts pulls, and plain
//list slicing to compare against.
final class Items
{
  private Items() {}

  static List<Long> range(long n)
  {
    List<Long> retval = new ArrayList<>();
    for (long idx = 0; idx < n; ++idx)
      retval.add(idx);
    return retval;
  }

  static List<Object> toList(Iterator iter)
  {
    List<Object> retval = new ArrayList<>();
    while (iter.hasNext())
      retval.add(iter.next());
    return retval;
  }

  static List<Object> slice(List<?> items, Long start, Long stop, long step)
  {
    long n = items.size();
    List<Object> retval = new ArrayList<>();
    if (step > 0) {
      long first = start == null ? 0 : start < 0 ? Math.max(0, start + n) : Math.min(start, n);
      long end = stop == null ? n : stop < 0 ? Math.max(0, stop + n) : Math.min(stop, n);
      for (long idx = first; idx < end; idx = idx > end - step ? end : idx + step)
        retval.add(items.get((int) idx));
    }
    else {
      long first = start == null ? n - 1 : start < 0 ? Math.max(-1, start + n) : Math.min(start, n - 1);
      long end = stop == null ? -1 : stop < 0 ? Math.max(-1, stop + n) : Math.min(stop, n - 1);
      for (long idx = first; idx > end; idx += step)
        retval.add(items.get((int) idx));
    }
    return retval;
  }

  //Counts every item handed out. A negative limit never ends.
  static class CountingIterator implements Iterator<Long>
  {
    final long limit;
    long pulled;
    CountingIterator(long _limit)
    {
      limit = _limit;
      pulled = 0;
    }
    public boolean hasNext() { return limit < 0 || pulled < limit; }
    public Long next()
    {
      if (!hasNext())
        throw new NoSuchElementException();
      return pulled++;
    }
  }

  static CountingIterator counting(long limit)
  {
    return new CountingIterator(limit);
  }
  static CountingIterator infinite()
  {
    return new CountingIterator(-1);
  }
}
