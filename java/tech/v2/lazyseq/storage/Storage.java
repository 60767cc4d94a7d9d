package tech.v2.lazyseq.storage;

import clojure.lang.IFn;
import clojure.lang.Keyword;
import java.util.List;
import java.util.function.Supplier;


//Built in storage factories and coercion of user supplied ones.
public class Storage
{
  public static final Keyword LIST_KWD = Keyword.intern(null, "list");
  public static final Keyword BIG_LIST_KWD = Keyword.intern(null, "big-list");

  public static final StorageFactory LIST = ObjectListStorage::new;
  public static final StorageFactory BIG_LIST = BigListStorage::new;

  public static StorageFactory defaultFactory() { return LIST; }

  public static StorageFactory named(Keyword name)
  {
    if (LIST_KWD.equals(name))
      return LIST;
    if (BIG_LIST_KWD.equals(name))
      return BIG_LIST;
    throw new IllegalArgumentException(
      String.format("Unrecognized storage %s, expected %s or %s.",
                    name, LIST_KWD, BIG_LIST_KWD));
  }

  public static StorageFactory fromSupplier(Supplier supplier)
  {
    return () -> new ListStorage(asList(supplier.get()));
  }

  public static StorageFactory fromFn(IFn fn)
  {
    return () -> new ListStorage(asList(fn.invoke()));
  }

  static List asList(Object value)
  {
    if (value instanceof List)
      return (List) value;
    throw new IllegalArgumentException(
      String.format("Storage factory must produce a java.util.List, got %s.",
                    value == null ? "nil" : value.getClass().getName()));
  }

  /**
   * Accepts a StorageFactory, a keyword naming a built in storage, a
   * zero-argument IFn or a Supplier, the latter two producing an empty
   * java.util.List. Null selects the default.
   */
  public static StorageFactory coerce(Object value)
  {
    if (value == null)
      return defaultFactory();
    if (value instanceof StorageFactory)
      return (StorageFactory) value;
    if (value instanceof Keyword)
      return named((Keyword) value);
    if (value instanceof String)
      return named(Keyword.intern(null, (String) value));
    //Clojure fns are checked first, they are also Runnables and Callables.
    if (value instanceof IFn)
      return fromFn((IFn) value);
    if (value instanceof Supplier)
      return fromSupplier((Supplier) value);
    throw new IllegalArgumentException(
      String.format("Cannot use %s as storage.", value.getClass().getName()));
  }
}
