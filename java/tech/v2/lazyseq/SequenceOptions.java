package tech.v2.lazyseq;

import clojure.lang.BigInt;
import clojure.lang.Keyword;
import clojure.lang.RT;
import java.math.BigInteger;
import java.util.Map;
import tech.v2.lazyseq.storage.Storage;
import tech.v2.lazyseq.storage.StorageFactory;


/**
 * Construction options. Keys are keywords or strings:
 *
 * <ul>
 * <li>:storage - see {@link Storage#coerce(Object)}</li>
 * <li>:start, :stop - integer or nil</li>
 * <li>:step - non-zero integer, defaults to 1</li>
 * </ul>
 */
public class SequenceOptions
{
  public static final Keyword STORAGE = Keyword.intern(null, "storage");
  public static final Keyword START = Keyword.intern(null, "start");
  public static final Keyword STOP = Keyword.intern(null, "stop");
  public static final Keyword STEP = Keyword.intern(null, "step");

  public static final SequenceOptions DEFAULT =
    new SequenceOptions(Storage.defaultFactory(), Slice.IDENTITY);

  public final StorageFactory storage;
  public final Slice slice;

  public SequenceOptions(StorageFactory _storage, Slice _slice)
  {
    storage = _storage;
    slice = _slice;
  }

  public static SequenceOptions parse(Map options)
  {
    if (options == null)
      return DEFAULT;

    Object storage = null;
    Long start = null;
    Long stop = null;
    Long step = null;

    for (Object item : options.entrySet()) {
      Map.Entry entry = (Map.Entry) item;
      Keyword key = toKeyword(entry.getKey());
      Object value = entry.getValue();
      if (STORAGE.equals(key))
        storage = value;
      else if (START.equals(key))
        start = toLong(key, value);
      else if (STOP.equals(key))
        stop = toLong(key, value);
      else if (STEP.equals(key))
        step = toLong(key, value);
      else
        throw new IllegalArgumentException(
          String.format("Unrecognized option %s.", entry.getKey()));
    }
    return new SequenceOptions(Storage.coerce(storage),
                               new Slice(start, stop, step == null ? 1 : step));
  }

  static Keyword toKeyword(Object key)
  {
    if (key instanceof Keyword)
      return (Keyword) key;
    if (key instanceof String) {
      String name = (String) key;
      return Keyword.intern(null, name.startsWith(":") ? name.substring(1) : name);
    }
    throw new IllegalArgumentException(
      String.format("Option keys must be keywords or strings, got %s.", key));
  }

  static boolean isIntegral(Object value)
  {
    return value instanceof Long
      || value instanceof Integer
      || value instanceof Short
      || value instanceof Byte
      || value instanceof BigInt
      || value instanceof BigInteger;
  }

  static Long toLong(Keyword key, Object value)
  {
    if (value == null)
      return null;
    if (!isIntegral(value))
      throw new IllegalArgumentException(
        String.format("Option %s must be an integer, got %s.", key, value));
    return RT.longCast(value);
  }
}
