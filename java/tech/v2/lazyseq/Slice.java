package tech.v2.lazyseq;

import java.util.Objects;


/**
 * Immutable (start, stop, step) triple with standard sequence slicing
 * semantics. A null bound is unbounded in that direction; a negative bound
 * counts from the end and is resolved against a {@link Sized} only when an
 * operation actually needs it, so forward slices with non-negative bounds
 * never ask for the total size.
 *
 * <p>Slices attached to a {@link LazySequence} are always expressed against
 * the producer's own order. Slicing a slice goes through
 * {@link #compose(Slice, Sized)}, which returns one flat slice.
 */
public final class Slice
{
  public static final Slice IDENTITY = new Slice(null, null, 1);

  public final Long start;
  public final Long stop;
  public final long step;

  public Slice(Long _start, Long _stop, long _step)
  {
    if (_step == 0)
      throw new InvalidStepException();
    start = _start;
    stop = _stop;
    step = _step;
  }
  public Slice(Long _start, Long _stop)
  {
    this(_start, _stop, 1);
  }

  //Selects nothing, whatever the size.
  public static Slice empty(long step)
  {
    return new Slice(0L, 0L, step);
  }

  public boolean hasNegativeBounds()
  {
    return (start != null && start < 0) || (stop != null && stop < 0);
  }

  /**
   * True when nothing about this slice can be answered without knowing the
   * total size: negative bounds, or a negative step whose first position is
   * the last item.
   */
  public boolean needsSize()
  {
    return step < 0 || hasNegativeBounds();
  }

  /**
   * Resolves negative bounds against the total size. The size is only
   * requested when a bound is negative.
   *
   * <p>A negative stop that still falls before the first item becomes 0 for
   * a forward slice and null (run through position 0) for a backward one. A
   * backward slice whose start falls before the first item returns
   * {@link #empty(long)} rather than a start of 0, as standard slicing of
   * {@code [-100::-1]} over ten items selects nothing.
   */
  public Slice positive(Sized sized)
  {
    if (!hasNegativeBounds())
      return this;

    Long newStart = start;
    Long newStop = stop;
    if (start != null && start < 0) {
      long value = start + sized.lsize();
      if (value < 0) {
        if (step < 0)
          return empty(step);
        value = 0;
      }
      newStart = value;
    }
    if (stop != null && stop < 0) {
      long value = stop + sized.lsize();
      if (value >= 0)
        newStop = value;
      else
        newStop = step > 0 ? Long.valueOf(0) : null;
    }
    return new Slice(newStart, newStop, step);
  }

  /**
   * The forward slice that selects, from the reversed items, what this
   * backward slice selects from the items in their natural order.
   */
  public Slice reverse(Sized sized)
  {
    if (step > 0)
      throw new IllegalStateException("Only a negative step slice can be reversed.");

    long size = sized.lsize();
    Slice pos = positive(sized);
    long first = pos.start == null ? size - 1 : Math.min(pos.start, size - 1);
    long newStop = pos.stop == null ? size : Math.max(0, (size - 1) - pos.stop);
    return new Slice(Math.max(0, (size - 1) - first), newStop, negate(step));
  }

  //Number of selected items. Integer arithmetic only.
  public long length(Sized sized)
  {
    Slice origin = step < 0 ? reverse(sized) : positive(sized);
    long size = sized.lsize();

    if (origin.stop != null)
      size = Math.min(size, origin.stop);
    if (origin.start != null)
      size = Math.max(0, size - origin.start);

    return size > 0 ? 1 + (size - 1) / Math.abs(origin.step) : 0;
  }

  /**
   * Maps a logical index within the slice to a position in the underlying
   * sequence.
   *
   * <p>A forward slice does not need the size unless it has negative bounds,
   * so the returned position may lie past the end of a sequence that has not
   * been fully read yet; callers check that themselves. When the index falls
   * outside the slice, strict mode throws and non-strict mode returns the
   * slice's exclusive bound (-1 for a backward slice running through
   * position 0).
   */
  public long resolve(long index, Sized sized, boolean strict)
  {
    return step > 0
      ? resolveForward(index, sized, strict)
      : resolveBackward(index, sized, strict);
  }
  public long resolve(long index, Sized sized)
  {
    return resolve(index, sized, true);
  }

  long resolveForward(long index, Sized sized, boolean strict)
  {
    Slice pos = positive(sized);
    long first = pos.start == null ? 0 : pos.start;
    long retval;
    try {
      retval = Math.addExact(first, Math.multiplyExact(index, step));
    }
    catch (ArithmeticException e) {
      //Past any position a long can hold.
      if (strict)
        throw new IndexOutOfRangeException(index);
      return pos.stop == null ? Long.MAX_VALUE : pos.stop;
    }

    if (pos.stop != null && retval >= pos.stop) {
      if (strict)
        throw new IndexOutOfRangeException(index);
      return pos.stop;
    }
    return retval;
  }

  long resolveBackward(long index, Sized sized, boolean strict)
  {
    long size = sized.lsize();
    Slice pos = positive(sized);
    long first = pos.start == null ? size - 1 : Math.min(pos.start, size - 1);
    long retval;
    try {
      retval = Math.addExact(first, Math.multiplyExact(index, step));
    }
    catch (ArithmeticException e) {
      retval = -1;
    }

    if (retval < 0 || (pos.stop != null && retval <= pos.stop)) {
      if (strict)
        throw new IndexOutOfRangeException(index);
      return pos.stop == null ? -1 : pos.stop;
    }
    return retval;
  }

  /**
   * The single slice equivalent to applying {@code child}, expressed in this
   * slice's logical indices, on top of this slice.
   *
   * <p>Two forward slices without negative bounds compose without touching
   * the size. Anything else resolves both slices against the total size and
   * returns a slice with concrete bounds.
   */
  public Slice compose(Slice child, Sized sized)
  {
    long newStep = multiplySteps(step, child.step);

    if (!needsSize() && !child.needsSize()) {
      long first = resolve(child.start == null ? 0 : child.start, sized, false);
      Long end = stop;
      if (child.stop != null)
        end = resolve(child.stop, sized, false);
      return new Slice(first, end, newStep);
    }

    long size = sized.lsize();
    long outerCount = count(size);
    long[] outer = indices(size);
    long[] inner = child.indices(outerCount);
    long innerCount = child.count(outerCount);

    if (innerCount == 0)
      return empty(newStep);

    long first = outer[0] + step * inner[0];
    Long end;
    try {
      end = Math.addExact(first, Math.multiplyExact(newStep, innerCount));
    }
    catch (ArithmeticException e) {
      //Only one item is selected and the stop lies beyond any long.
      end = null;
    }
    //A backward slice ending before position 0 runs through it.
    return new Slice(first, end != null && end < 0 ? null : end, newStep);
  }

  /**
   * Product of two steps, saturated to +/- Long.MAX_VALUE. A step at least
   * as large as the sequence selects at most its first item, so the
   * saturated step selects the same items.
   */
  static long multiplySteps(long lhs, long rhs)
  {
    try {
      return Math.multiplyExact(lhs, rhs);
    }
    catch (ArithmeticException e) {
      return (lhs < 0) == (rhs < 0) ? Long.MAX_VALUE : -Long.MAX_VALUE;
    }
  }

  static long negate(long step)
  {
    return step == Long.MIN_VALUE ? Long.MAX_VALUE : -step;
  }

  /**
   * Concrete {start, stop, step} for a sequence of the given size, exactly as
   * standard slicing computes them. A backward stop of -1 means "through
   * position 0".
   */
  public long[] indices(long size)
  {
    long first;
    long end;
    if (step > 0) {
      first = start == null ? 0 : clamp(start, size, 0, size);
      end = stop == null ? size : clamp(stop, size, 0, size);
    }
    else {
      first = start == null ? size - 1 : clamp(start, size, -1, size - 1);
      end = stop == null ? -1 : clamp(stop, size, -1, size - 1);
    }
    return new long[] { first, end, step };
  }

  static long clamp(long value, long size, long lower, long upper)
  {
    if (value < 0) {
      value += size;
      return value < lower ? lower : value;
    }
    return value > upper ? upper : value;
  }

  public long count(long size)
  {
    long[] idx = indices(size);
    if (step > 0)
      return idx[1] > idx[0] ? (idx[1] - idx[0] - 1) / step + 1 : 0;
    return idx[0] > idx[1] ? 1 - (idx[0] - idx[1] - 1) / step : 0;
  }

  @Override
  public boolean equals(Object other)
  {
    if (this == other)
      return true;
    if (!(other instanceof Slice))
      return false;
    Slice rhs = (Slice) other;
    return step == rhs.step
      && Objects.equals(start, rhs.start)
      && Objects.equals(stop, rhs.stop);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(start, stop, step);
  }

  @Override
  public String toString()
  {
    return String.format("[%s:%s:%d]",
                         start == null ? "" : start,
                         stop == null ? "" : stop,
                         step);
  }
}
