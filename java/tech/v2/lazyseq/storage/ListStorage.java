package tech.v2.lazyseq.storage;

import clojure.lang.RT;
import java.util.List;


//Adapts a caller supplied list. Only add and get are ever called on it.
public class ListStorage implements ObjectStorage
{
  final List data;
  public ListStorage(List _data)
  {
    if (_data == null)
      throw new IllegalArgumentException("Storage factory returned null.");
    if (!_data.isEmpty())
      throw new IllegalArgumentException(
        String.format("Storage must start empty, got %d items.", _data.size()));
    data = _data;
  }
  public long lsize() { return data.size(); }
  public Object read(long idx) { return data.get(RT.intCast(idx)); }
  public void append(Object value) { data.add(value); }
}
